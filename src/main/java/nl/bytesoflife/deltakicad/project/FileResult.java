package nl.bytesoflife.deltakicad.project;

import nl.bytesoflife.deltakicad.model.ExtractionIssue;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of processing one file in a batch. {@code output} is set for
 * {@link Status#OK}, {@code error} for {@link Status#FAILED}; {@code outputFile}
 * only when the batch writes its results to disk.
 */
public record FileResult(Path file, Status status, String output, Path outputFile, String error,
                         List<ExtractionIssue> issues) {

    public enum Status {
        OK,
        FAILED,
        CANCELLED
    }

    public FileResult {
        issues = List.copyOf(issues);
    }

    static FileResult ok(Path file, String output, Path outputFile, List<ExtractionIssue> issues) {
        return new FileResult(file, Status.OK, output, outputFile, null, issues);
    }

    static FileResult failed(Path file, String error) {
        return new FileResult(file, Status.FAILED, null, null, error, List.of());
    }

    static FileResult cancelled(Path file) {
        return new FileResult(file, Status.CANCELLED, null, null, null, List.of());
    }
}
