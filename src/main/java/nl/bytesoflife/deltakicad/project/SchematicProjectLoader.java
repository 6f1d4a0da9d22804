package nl.bytesoflife.deltakicad.project;

import nl.bytesoflife.deltakicad.extract.ExtractionException;
import nl.bytesoflife.deltakicad.extract.SchematicExtractor;
import nl.bytesoflife.deltakicad.model.ExtractionIssue;
import nl.bytesoflife.deltakicad.model.schematic.Sheet;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;
import nl.bytesoflife.deltakicad.netlist.SheetInstance;
import nl.bytesoflife.deltakicad.sexpr.LexException;
import nl.bytesoflife.deltakicad.sexpr.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Loads a hierarchical schematic. Sheet files are extracted in waves: every
 * file referenced by the previous wave is extracted in parallel, and the whole
 * wave completes before the next one is scheduled. Sheet paths are resolved
 * against the directory of the root schematic. Only after the last wave are
 * sheet instances expanded, so no cross-file work starts on partial input.
 * <p>
 * The executor is owned by the caller.
 */
public class SchematicProjectLoader {

    private static final Logger log = LoggerFactory.getLogger(SchematicProjectLoader.class);

    private final ExecutorService executor;
    private final SchematicExtractor extractor;

    public SchematicProjectLoader(ExecutorService executor) {
        this(executor, new SchematicExtractor());
    }

    public SchematicProjectLoader(ExecutorService executor, SchematicExtractor extractor) {
        this.executor = executor;
        this.extractor = extractor;
    }

    /**
     * @throws IOException when the root schematic cannot be read; unreadable
     *                     sheet files are reported as issues instead
     */
    public SchematicProject load(Path rootSchematic) throws IOException {
        Path directory = rootSchematic.toAbsolutePath().getParent();
        SchematicModel root = read(rootSchematic);

        Map<String, SchematicModel> sheets = new LinkedHashMap<>();
        Set<String> attempted = new HashSet<>();
        List<ExtractionIssue> issues = new ArrayList<>();
        List<SchematicModel> wave = List.of(root);
        int waveNumber = 0;

        while (!wave.isEmpty()) {
            Map<String, Future<SchematicModel>> pending = new LinkedHashMap<>();
            for (SchematicModel model : wave) {
                for (Sheet sheet : model.sheets()) {
                    String key = SheetInstance.fileKey(sheet.file());
                    if (attempted.add(key)) {
                        Path file = directory.resolve(key);
                        pending.put(key, executor.submit(() -> read(file)));
                    }
                }
            }
            waveNumber++;
            log.debug("Wave {}: extracting {} sheet files", waveNumber, pending.size());

            // barrier: the next wave only starts once this one is complete
            List<SchematicModel> next = new ArrayList<>();
            for (Map.Entry<String, Future<SchematicModel>> entry : pending.entrySet()) {
                Optional<SchematicModel> model = await(entry.getKey(), entry.getValue(), issues);
                if (model.isPresent()) {
                    sheets.put(entry.getKey(), model.get());
                    next.add(model.get());
                }
            }
            wave = next;
        }

        List<SheetInstance> instances = SheetInstance.expand(root, sheets, issues);
        log.debug("Loaded {} with {} sheet files, {} instances, {} issues",
                rootSchematic, sheets.size(), instances.size(), issues.size());
        return new SchematicProject(root, sheets, instances, issues);
    }

    private SchematicModel read(Path file) throws IOException {
        return extractor.extract(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }

    private Optional<SchematicModel> await(String key, Future<SchematicModel> future, List<ExtractionIssue> issues)
            throws IOException {
        try {
            return Optional.of(future.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while loading sheet " + key);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NoSuchFileException) {
                // reported as a missing sheet when instances are expanded
                log.warn("Sheet file {} does not exist", key);
            } else if (cause instanceof IOException
                    || cause instanceof LexException
                    || cause instanceof ParseException
                    || cause instanceof ExtractionException) {
                log.warn("Failed to load sheet file {}: {}", key, cause.getMessage());
                issues.add(new ExtractionIssue(ExtractionIssue.Kind.INVALID_VALUE, key, 0, null,
                        "Sheet file could not be loaded: " + cause.getMessage()));
            } else if (cause instanceof RuntimeException runtime) {
                throw runtime;
            } else {
                throw new UncheckedIOException(new IOException("Failed to load sheet " + key, cause));
            }
            return Optional.empty();
        }
    }
}
