package nl.bytesoflife.deltakicad.sexpr;

public enum TokenType {
    OPEN_PAREN,
    CLOSE_PAREN,
    ATOM,
    QUOTED_STRING
}
