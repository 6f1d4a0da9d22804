package nl.bytesoflife.deltakicad.sexpr;

/**
 * Thrown when the character stream cannot be split into tokens.
 */
public class LexException extends RuntimeException {

    private final String source;
    private final int line;
    private final int column;

    public LexException(String message, String source, int line, int column) {
        super(source + ":" + line + ":" + column + ": " + message);
        this.source = source;
        this.line = line;
        this.column = column;
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
