package nl.bytesoflife.deltakicad.extract;

import nl.bytesoflife.deltakicad.model.ExtractionIssue;

/**
 * Thrown while extracting a single entity. Extractors catch it, skip the entity
 * and record an {@link ExtractionIssue}.
 */
public class ExtractionException extends RuntimeException {

    private final ExtractionIssue.Kind kind;
    private final String reference;
    private final int line;

    public ExtractionException(ExtractionIssue.Kind kind, String message, String reference, int line) {
        super(message);
        this.kind = kind;
        this.reference = reference;
        this.line = line;
    }

    public static ExtractionException missingField(String field, String reference, int line) {
        return new ExtractionException(ExtractionIssue.Kind.MISSING_FIELD,
                "Missing mandatory field '" + field + "'", reference, line);
    }

    public static ExtractionException unknownLayer(String layer, String reference, int line) {
        return new ExtractionException(ExtractionIssue.Kind.UNKNOWN_LAYER,
                "Layer '" + layer + "' is not declared in the layer table", reference, line);
    }

    public ExtractionIssue.Kind getKind() {
        return kind;
    }

    public String getReference() {
        return reference;
    }

    public int getLine() {
        return line;
    }

    public ExtractionIssue toIssue(String source) {
        return new ExtractionIssue(kind, source, line, reference, getMessage());
    }
}
