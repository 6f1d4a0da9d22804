package nl.bytesoflife.deltakicad.project;

import nl.bytesoflife.deltakicad.Fixtures;
import nl.bytesoflife.deltakicad.model.ExtractionIssue;
import nl.bytesoflife.deltakicad.netlist.HierarchicalNetlistResolver;
import nl.bytesoflife.deltakicad.netlist.Net;
import nl.bytesoflife.deltakicad.netlist.Netlist;
import nl.bytesoflife.deltakicad.netlist.SheetInstance;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class SchematicProjectLoaderTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final SchematicProjectLoader loader = new SchematicProjectLoader(executor);

    @TempDir
    Path dir;

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private static String sheetReferencing(String name, String file) {
        return """
                (kicad_sch (version 20231120)
                  (sheet (at 10 10) (size 20 20)
                    (property "Sheetname" "%s")
                    (property "Sheetfile" "%s")))
                """.formatted(name, file);
    }

    @Test
    void loadsSheetFilesOncePerFile() throws IOException {
        SchematicProject project = loader.load(Fixtures.path("hierarchy/root.kicad_sch"));

        // "power.kicad_sch" and "./power.kicad_sch" name the same file
        assertEquals(1, project.sheets().size());
        assertTrue(project.sheets().containsKey("power.kicad_sch"));
        assertEquals(List.of("/", "/Power/", "/Power2/"),
                project.instances().stream().map(SheetInstance::path).toList());
        assertTrue(project.issues().isEmpty());

        Netlist netlist = new HierarchicalNetlistResolver().resolve(project.instances());
        assertEquals(List.of("/Power2/VIN", "GND", "MAIN", "Net-(R2-2)"),
                netlist.nets().stream().map(Net::name).toList());
        assertEquals(10, netlist.pinCount());
    }

    @Test
    void missingSheetIsAnIssue() throws IOException {
        Path root = dir.resolve("root.kicad_sch");
        Files.writeString(root, sheetReferencing("Gone", "gone.kicad_sch"));

        SchematicProject project = loader.load(root);

        assertTrue(project.sheets().isEmpty());
        assertEquals(1, project.instances().size());
        assertEquals(1, project.issues().size());
        assertEquals(ExtractionIssue.Kind.MISSING_SHEET, project.issues().get(0).kind());
        assertEquals("Gone", project.issues().get(0).reference());
    }

    @Test
    void unparsableSheetIsAnIssue() throws IOException {
        Path root = dir.resolve("root.kicad_sch");
        Files.writeString(root, sheetReferencing("Bad", "bad.kicad_sch"));
        Files.writeString(dir.resolve("bad.kicad_sch"), "(kicad_sch (symbol\n");

        SchematicProject project = loader.load(root);

        assertEquals(List.of(ExtractionIssue.Kind.INVALID_VALUE, ExtractionIssue.Kind.MISSING_SHEET),
                project.issues().stream().map(ExtractionIssue::kind).toList());
        assertEquals("bad.kicad_sch", project.issues().get(0).source());
    }

    @Test
    void sheetCycleStopsExpansion() throws IOException {
        Path a = dir.resolve("a.kicad_sch");
        Files.writeString(a, sheetReferencing("B", "b.kicad_sch"));
        Files.writeString(dir.resolve("b.kicad_sch"), sheetReferencing("BackToA", "a.kicad_sch"));

        SchematicProject project = loader.load(a);

        assertEquals(List.of("/", "/B/"), project.instances().stream().map(SheetInstance::path).toList());
        assertEquals(1, project.issues().size());
        assertEquals(ExtractionIssue.Kind.SHEET_CYCLE, project.issues().get(0).kind());
    }

    @Test
    void nestedSheetsLoadInWaves() throws IOException {
        Files.createDirectories(dir.resolve("sub"));
        Path root = dir.resolve("root.kicad_sch");
        Files.writeString(root, sheetReferencing("Mid", "sub/mid.kicad_sch"));
        // paths are relative to the root schematic, not to the referencing sheet
        Files.writeString(dir.resolve("sub/mid.kicad_sch"), sheetReferencing("Leaf", "leaf.kicad_sch"));
        Files.writeString(dir.resolve("leaf.kicad_sch"), "(kicad_sch (version 20231120))");

        SchematicProject project = loader.load(root);

        assertEquals(List.of("/", "/Mid/", "/Mid/Leaf/"),
                project.instances().stream().map(SheetInstance::path).toList());
        assertEquals(2, project.sheets().size());
        assertTrue(project.issues().isEmpty());
    }

    @Test
    void unreadableRootIsAnError() {
        assertThrows(NoSuchFileException.class, () -> loader.load(dir.resolve("absent.kicad_sch")));
    }
}
