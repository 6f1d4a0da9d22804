package nl.bytesoflife.deltakicad.sexpr;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits KiCad S-expression text into tokens.
 * <p>
 * Tokenization is lazy: every call to {@link #iterator()} starts over from the
 * beginning of the input, so the same lexer can be traversed any number of times.
 */
public class SExpressionLexer implements Iterable<Token> {

    private final CharSequence input;
    private final String source;

    public SExpressionLexer(CharSequence input, String source) {
        this.input = input;
        this.source = source;
    }

    public SExpressionLexer(CharSequence input) {
        this(input, "<input>");
    }

    public String getSource() {
        return source;
    }

    @Override
    public Iterator<Token> iterator() {
        return new TokenIterator();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    private final class TokenIterator implements Iterator<Token> {

        private int pos;
        private int line = 1;
        private int column = 1;
        private Token next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = readToken();
            }
            return next != null;
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token token = next;
            next = null;
            return token;
        }

        private Token readToken() {
            skipWhitespace();
            if (pos >= input.length()) {
                return null;
            }
            char c = input.charAt(pos);
            int startOffset = pos;
            int startLine = line;
            int startColumn = column;
            if (c == '(') {
                advance();
                return new Token(TokenType.OPEN_PAREN, "(", startOffset, startLine, startColumn);
            }
            if (c == ')') {
                advance();
                return new Token(TokenType.CLOSE_PAREN, ")", startOffset, startLine, startColumn);
            }
            if (c == '"') {
                return readQuotedString(startOffset, startLine, startColumn);
            }
            return readAtom(startOffset, startLine, startColumn);
        }

        private Token readQuotedString(int startOffset, int startLine, int startColumn) {
            advance();
            StringBuilder sb = new StringBuilder();
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c == '"') {
                    advance();
                    return new Token(TokenType.QUOTED_STRING, sb.toString(), startOffset, startLine, startColumn);
                }
                if (c == '\\' && pos + 1 < input.length()) {
                    advance();
                    char escaped = input.charAt(pos);
                    switch (escaped) {
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        case 'r' -> sb.append('\r');
                        default -> sb.append(escaped);
                    }
                } else {
                    sb.append(c);
                }
                advance();
            }
            throw new LexException("Unterminated quoted string", source, startLine, startColumn);
        }

        private Token readAtom(int startOffset, int startLine, int startColumn) {
            while (pos < input.length()) {
                char c = input.charAt(pos);
                if (c == '(' || c == ')' || c == '"' || Character.isWhitespace(c)) {
                    break;
                }
                advance();
            }
            String text = input.subSequence(startOffset, pos).toString();
            return new Token(TokenType.ATOM, text, startOffset, startLine, startColumn);
        }

        private void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                advance();
            }
        }

        private void advance() {
            if (input.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }
}
