package nl.bytesoflife.deltakicad.sexpr;

/**
 * Thrown when a token stream is not a well-formed S-expression document.
 */
public class ParseException extends RuntimeException {

    public enum Kind {
        UNBALANCED_PARENS,
        UNTERMINATED_LIST,
        EMPTY_DOCUMENT,
        TRAILING_CONTENT
    }

    private final Kind kind;
    private final String source;
    private final int line;
    private final int column;

    public ParseException(Kind kind, String message, String source, int line, int column) {
        super(source + ":" + line + ":" + column + ": " + kind + ": " + message);
        this.kind = kind;
        this.source = source;
        this.line = line;
        this.column = column;
    }

    public Kind getKind() {
        return kind;
    }

    public String getSource() {
        return source;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
