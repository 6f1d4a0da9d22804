package nl.bytesoflife.deltakicad.project;

import nl.bytesoflife.deltakicad.KicadDesigns;
import nl.bytesoflife.deltakicad.extract.ExtractionException;
import nl.bytesoflife.deltakicad.model.DesignModel;
import nl.bytesoflife.deltakicad.sexpr.LexException;
import nl.bytesoflife.deltakicad.sexpr.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Renders a projection for many independent design files in parallel. Each
 * file is read, extracted and rendered on its own, so results are complete
 * per file. After {@link #cancel()} no new file is started; files already
 * finished keep their results.
 */
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    public static final String SCHEMATIC_DIRECTORY = "schematics";
    public static final String PCB_DIRECTORY = "pcbs";

    private final ExecutorService executor;
    private final KicadDesigns designs;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private Path outputDirectory;
    private Consumer<FileResult> listener = r -> { };

    public BatchProcessor(ExecutorService executor, KicadDesigns designs) {
        this.executor = executor;
        this.designs = designs;
    }

    /**
     * Also write each output below {@code directory}, see {@link #outputFileFor}.
     */
    public BatchProcessor withOutputDirectory(Path directory) {
        this.outputDirectory = directory;
        return this;
    }

    /**
     * Called once per file, in input order, as results become available.
     */
    public BatchProcessor onResult(Consumer<FileResult> listener) {
        this.listener = listener;
        return this;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * KiCad schematic and board files in {@code directory}, sorted by path.
     */
    public static List<Path> findDesignFiles(Path directory, boolean recursive) throws IOException {
        try (Stream<Path> stream = recursive ? Files.walk(directory) : Files.list(directory)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(KicadDesigns.SCHEMATIC_EXTENSION)
                                || name.endsWith(KicadDesigns.PCB_EXTENSION);
                    })
                    .sorted()
                    .toList();
        }
    }

    public BatchReport process(Path directory, boolean recursive, Projection projection) throws IOException {
        List<Path> files = findDesignFiles(directory, recursive);
        if (files.isEmpty()) {
            log.warn("No KiCad design files found in {}", directory);
        }
        return process(files, directory, projection);
    }

    public BatchReport process(List<Path> files, Projection projection) throws IOException {
        return process(files, null, projection);
    }

    private BatchReport process(List<Path> files, Path base, Projection projection) throws IOException {
        if (outputDirectory != null) {
            Files.createDirectories(outputDirectory);
        }
        Map<Path, Path> claimed = new HashMap<>();
        List<Future<FileResult>> futures = new ArrayList<>();
        for (Path file : files) {
            Path outputFile = outputDirectory == null ? null : outputFileFor(file, base, projection);
            Path owner = outputFile == null ? null
                    : claimed.putIfAbsent(outputFile.toAbsolutePath().normalize(), file);
            if (owner != null) {
                log.error("Output {} of {} is already written by {}", outputFile, file, owner);
                futures.add(CompletableFuture.completedFuture(FileResult.failed(file,
                        "Output " + outputFile + " is already written by " + owner)));
            } else {
                futures.add(executor.submit(() -> processFile(file, outputFile, projection)));
            }
        }

        List<FileResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            FileResult result = collect(files.get(i), futures.get(i));
            results.add(result);
            listener.accept(result);
        }

        BatchReport report = new BatchReport(projection, results);
        log.info("Processed {} files: {} ok, {} failed{}", results.size(), report.getSucceeded().size(),
                report.getFailed().size(), report.wasCancelled() ? " (cancelled)" : "");
        return report;
    }

    /**
     * Where the output of {@code file} goes: schematics under
     * {@value #SCHEMATIC_DIRECTORY}, boards under {@value #PCB_DIRECTORY}, at the
     * file's own position below {@code base} when the batch came from a directory.
     */
    Path outputFileFor(Path file, Path base, Projection projection) {
        String name = file.getFileName().toString();
        Path target = outputDirectory.resolve(name.endsWith(KicadDesigns.PCB_EXTENSION)
                ? PCB_DIRECTORY : SCHEMATIC_DIRECTORY);
        if (base != null && file.getParent() != null) {
            target = target.resolve(base.relativize(file.getParent()));
        }
        return target.resolve(projection.outputName(name));
    }

    private FileResult collect(Path file, Future<FileResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return FileResult.cancelled(file);
        } catch (CancellationException e) {
            return FileResult.cancelled(file);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            log.error("Unexpected failure processing {}", file, cause);
            return FileResult.failed(file, String.valueOf(cause));
        }
    }

    private FileResult processFile(Path file, Path outputFile, Projection projection) {
        if (cancelled.get()) {
            return FileResult.cancelled(file);
        }
        try {
            DesignModel model = designs.parse(file);
            String output = designs.render(model, projection);
            if (outputFile != null) {
                Files.createDirectories(outputFile.getParent());
                Files.writeString(outputFile, output, StandardCharsets.UTF_8);
            }
            log.debug("Processed {} ({} issues)", file, model.issues().size());
            return FileResult.ok(file, output, outputFile, model.issues());
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to process {}: {}", file, e.getMessage());
            return FileResult.failed(file, e.getMessage());
        } catch (LexException | ParseException | ExtractionException e) {
            log.error("Failed to parse {}: {}", file, e.getMessage());
            return FileResult.failed(file, e.getMessage());
        }
    }
}
