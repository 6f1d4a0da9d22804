package nl.bytesoflife.deltakicad.model;

import java.util.Comparator;

/**
 * Identifies one pin (schematic) or pad (board) in a design. {@code sheetPath}
 * is {@code "/"} for the root sheet and for boards.
 */
public record PinRef(String sheetPath, String reference, String pin) implements Comparable<PinRef> {

    public static final String ROOT_SHEET = "/";

    private static final Comparator<PinRef> ORDER = Comparator
            .comparing(PinRef::sheetPath)
            .thenComparing(PinRef::reference)
            .thenComparing(PinRef::pin);

    public PinRef(String reference, String pin) {
        this(ROOT_SHEET, reference, pin);
    }

    public PinRef withSheetPath(String path) {
        return new PinRef(path, reference, pin);
    }

    @Override
    public int compareTo(PinRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        String prefix = ROOT_SHEET.equals(sheetPath) ? "" : sheetPath;
        return prefix + reference + "-" + pin;
    }
}
