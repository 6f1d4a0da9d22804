package nl.bytesoflife.deltakicad.sexpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds {@link SNode} trees from a token stream using an explicit stack of
 * open list frames, so nesting depth is not limited by the call stack.
 */
public class SExpressionParser {

    /**
     * Parses a design file, which must contain exactly one top-level list.
     */
    public SNode.SList parseDocument(String text, String source) {
        List<SNode> roots = build(new SExpressionLexer(text, source), source);
        if (roots.isEmpty()) {
            throw new ParseException(ParseException.Kind.EMPTY_DOCUMENT,
                    "No expression found", source, 1, 1);
        }
        if (roots.size() > 1 || !(roots.get(0) instanceof SNode.SList)) {
            SNode offending = roots.size() > 1 ? roots.get(1) : roots.get(0);
            int line = offending instanceof SNode.SList list ? list.line() : 1;
            throw new ParseException(ParseException.Kind.TRAILING_CONTENT,
                    "Expected a single top-level list", source, line, 1);
        }
        return (SNode.SList) roots.get(0);
    }

    public SNode.SList parseDocument(String text) {
        return parseDocument(text, "<input>");
    }

    /**
     * Parses every top-level expression in the text.
     */
    public List<SNode> parseAll(String text, String source) {
        return build(new SExpressionLexer(text, source), source);
    }

    public List<SNode> parseAll(String text) {
        return parseAll(text, "<input>");
    }

    List<SNode> build(Iterable<Token> tokens, String source) {
        Deque<Frame> stack = new ArrayDeque<>();
        List<SNode> roots = new ArrayList<>();

        for (Token token : tokens) {
            switch (token.type()) {
                case OPEN_PAREN -> stack.push(new Frame(token.line()));
                case CLOSE_PAREN -> {
                    if (stack.isEmpty()) {
                        throw new ParseException(ParseException.Kind.UNBALANCED_PARENS,
                                "Unexpected ')'", source, token.line(), token.column());
                    }
                    Frame frame = stack.pop();
                    SNode.SList list = new SNode.SList(frame.children, frame.line);
                    if (stack.isEmpty()) {
                        roots.add(list);
                    } else {
                        stack.peek().children.add(list);
                    }
                }
                case ATOM, QUOTED_STRING -> {
                    SNode.SAtom atom = new SNode.SAtom(token.text(), token.type() == TokenType.QUOTED_STRING);
                    if (stack.isEmpty()) {
                        roots.add(atom);
                    } else {
                        stack.peek().children.add(atom);
                    }
                }
            }
        }

        if (!stack.isEmpty()) {
            Frame innermost = stack.peek();
            throw new ParseException(ParseException.Kind.UNTERMINATED_LIST,
                    "Unexpected end of input, " + stack.size() + " list(s) still open",
                    source, innermost.line, 1);
        }
        return roots;
    }

    private static final class Frame {
        final int line;
        final List<SNode> children = new ArrayList<>();

        Frame(int line) {
            this.line = line;
        }
    }
}
