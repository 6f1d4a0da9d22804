package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.model.ExtractionIssue;
import nl.bytesoflife.deltakicad.model.PinRef;
import nl.bytesoflife.deltakicad.model.schematic.Sheet;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One placement of a schematic file in a hierarchy. A file placed twice gives
 * two instances with different paths. The root instance has path {@code "/"}
 * and no parent.
 */
public record SheetInstance(String path, String file, SchematicModel model, SheetInstance parent, Sheet sheet) {

    public int depth() {
        return parent == null ? 0 : parent.depth() + 1;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * Qualifies a sheet-local name with this instance's path.
     */
    public String qualify(String name) {
        return isRoot() ? name : path + name;
    }

    boolean hasAncestorFile(String candidate) {
        for (SheetInstance current = this; current != null; current = current.parent) {
            if (current.file.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "SheetInstance[" + path + " -> " + file + "]";
    }

    /**
     * Expands the sheet tree below {@code root} depth first. Sheets whose file
     * is missing from {@code sheetsByFile}, or which would re-enter a file
     * already on their own path, are not descended and are reported in
     * {@code issues}.
     *
     * @param sheetsByFile models keyed by {@link #fileKey(String)} of the sheet file
     */
    public static List<SheetInstance> expand(SchematicModel root, Map<String, SchematicModel> sheetsByFile,
                                             List<ExtractionIssue> issues) {
        List<SheetInstance> instances = new ArrayList<>();
        String rootFile = fileKey(root.source());
        int slash = rootFile.lastIndexOf('/');
        expand(new SheetInstance(PinRef.ROOT_SHEET, rootFile.substring(slash + 1), root, null, null),
                sheetsByFile, issues, instances);
        return instances;
    }

    private static void expand(SheetInstance instance, Map<String, SchematicModel> sheetsByFile,
                               List<ExtractionIssue> issues, List<SheetInstance> out) {
        out.add(instance);
        for (Sheet sheet : instance.model().sheets()) {
            String file = fileKey(sheet.file());
            if (instance.hasAncestorFile(file)) {
                issues.add(new ExtractionIssue(ExtractionIssue.Kind.SHEET_CYCLE, instance.model().source(), 0,
                        sheet.name(), "Sheet '" + sheet.name() + "' re-enters " + file + " on path " + instance.path()));
                continue;
            }
            SchematicModel child = sheetsByFile.get(file);
            if (child == null) {
                issues.add(new ExtractionIssue(ExtractionIssue.Kind.MISSING_SHEET, instance.model().source(), 0,
                        sheet.name(), "Sheet file not found: " + file));
                continue;
            }
            expand(new SheetInstance(instance.path() + sheet.name() + "/", file, child, instance, sheet),
                    sheetsByFile, issues, out);
        }
    }

    /**
     * Normalised form of a sheet file reference: forward slashes, no leading {@code ./}.
     */
    public static String fileKey(String file) {
        String key = file.replace('\\', '/');
        while (key.startsWith("./")) {
            key = key.substring(2);
        }
        return key;
    }
}
