package nl.bytesoflife.deltakicad.model;

/**
 * A recoverable problem found while extracting one entity. The entity itself is
 * skipped; everything else in the file is still extracted.
 */
public record ExtractionIssue(Kind kind, String source, int line, String reference, String message) {

    public enum Kind {
        MISSING_FIELD,
        UNKNOWN_LAYER,
        UNKNOWN_LIBRARY,
        DUPLICATE_REFERENCE,
        INVALID_VALUE,
        SHEET_CYCLE,
        MISSING_SHEET
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind).append("] ").append(source);
        if (line > 0) {
            sb.append(':').append(line);
        }
        if (reference != null) {
            sb.append(" (").append(reference).append(')');
        }
        sb.append(": ").append(message);
        return sb.toString();
    }
}
