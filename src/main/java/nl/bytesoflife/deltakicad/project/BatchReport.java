package nl.bytesoflife.deltakicad.project;

import java.util.List;

public class BatchReport {

    private final Projection projection;
    private final List<FileResult> results;

    public BatchReport(Projection projection, List<FileResult> results) {
        this.projection = projection;
        this.results = List.copyOf(results);
    }

    public Projection getProjection() {
        return projection;
    }

    /**
     * One result per input file, in input order.
     */
    public List<FileResult> getResults() {
        return results;
    }

    public List<FileResult> getSucceeded() {
        return withStatus(FileResult.Status.OK);
    }

    public List<FileResult> getFailed() {
        return withStatus(FileResult.Status.FAILED);
    }

    public boolean wasCancelled() {
        return results.stream().anyMatch(r -> r.status() == FileResult.Status.CANCELLED);
    }

    private List<FileResult> withStatus(FileResult.Status status) {
        return results.stream().filter(r -> r.status() == status).toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Batch report (").append(projection).append("):\n");
        sb.append("  Files: ").append(results.size())
          .append(" (").append(getSucceeded().size()).append(" ok, ")
          .append(getFailed().size()).append(" failed)\n");
        for (FileResult r : results) {
            sb.append("  - ").append(r.file().getFileName()).append(": ").append(r.status());
            if (r.error() != null) {
                sb.append(" (").append(r.error()).append(")");
            }
            if (!r.issues().isEmpty()) {
                sb.append(", ").append(r.issues().size()).append(" issues");
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
