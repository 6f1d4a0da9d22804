package nl.bytesoflife.deltakicad;

import nl.bytesoflife.deltakicad.extract.PcbExtractor;
import nl.bytesoflife.deltakicad.extract.SchematicExtractor;
import nl.bytesoflife.deltakicad.model.pcb.PcbModel;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Access to the design files under {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final Path DIRECTORY = Path.of("src/test/resources/fixtures");

    private Fixtures() {
    }

    public static Path path(String name) {
        return DIRECTORY.resolve(name);
    }

    public static String read(String name) {
        try {
            return Files.readString(path(name));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SchematicModel schematic(String name) {
        return new SchematicExtractor().extract(read(name), name);
    }

    public static PcbModel pcb(String name) {
        return new PcbExtractor().extract(read(name), name);
    }
}
