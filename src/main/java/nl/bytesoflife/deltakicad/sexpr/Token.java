package nl.bytesoflife.deltakicad.sexpr;

/**
 * A single lexical token. Offsets are character offsets into the source text;
 * line and column are 1-based.
 */
public record Token(TokenType type, String text, int offset, int line, int column) {

    @Override
    public String toString() {
        return switch (type) {
            case OPEN_PAREN -> "(";
            case CLOSE_PAREN -> ")";
            case ATOM -> text;
            case QUOTED_STRING -> '"' + text + '"';
        };
    }
}
