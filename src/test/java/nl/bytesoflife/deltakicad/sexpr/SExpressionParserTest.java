package nl.bytesoflife.deltakicad.sexpr;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseNestedDocument() {
        SNode.SList root = parser.parseDocument("""
                (kicad_sch
                  (version 20231120)
                  (symbol (lib_id "Device:R") (at 10 20 90)))
                """);

        assertEquals("kicad_sch", root.head());
        assertEquals(1, root.line());
        SNode.SList symbol = root.find("symbol").orElseThrow();
        assertEquals(3, symbol.line());
        assertEquals("Device:R", symbol.find("lib_id").orElseThrow().atomAt(1).orElseThrow());
        assertEquals(List.of("10", "20", "90"), symbol.find("at").orElseThrow().atoms());
    }

    @Test
    void quotedAtomsRememberQuoting() {
        SNode.SList root = parser.parseDocument("(pin input \"input\")");

        assertTrue(root.hasFlag("input"));
        assertFalse(((SNode.SAtom) root.get(1)).quoted());
        assertTrue(((SNode.SAtom) root.get(2)).quoted());
    }

    @Test
    void hasFlagIgnoresQuotedStrings() {
        SNode.SList root = parser.parseDocument("(pin \"hide\")");

        assertFalse(root.hasFlag("hide"));
    }

    @Test
    void findAllReturnsChildrenInOrder() {
        SNode.SList root = parser.parseDocument("(pts (xy 1 2) (arc 0) (xy 3 4))");

        List<SNode.SList> points = root.findAll("xy");
        assertEquals(2, points.size());
        assertEquals("3", points.get(1).atomAt(1).orElseThrow());
        assertEquals(3, root.lists().size());
    }

    @Test
    void extraCloseParenIsUnbalanced() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseDocument("(a (b))\n)"));

        assertEquals(ParseException.Kind.UNBALANCED_PARENS, e.getKind());
        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void missingCloseParenIsUnterminated() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parseDocument("(a\n  (b 1)\n  (c", "cut.kicad_pcb"));

        assertEquals(ParseException.Kind.UNTERMINATED_LIST, e.getKind());
        assertEquals("cut.kicad_pcb", e.getSource());
        assertEquals(3, e.getLine());
    }

    @Test
    void emptyInputIsEmptyDocument() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseDocument("   \n"));

        assertEquals(ParseException.Kind.EMPTY_DOCUMENT, e.getKind());
    }

    @Test
    void secondTopLevelListIsTrailingContent() {
        ParseException e = assertThrows(ParseException.class, () -> parser.parseDocument("(a)\n(b)"));

        assertEquals(ParseException.Kind.TRAILING_CONTENT, e.getKind());
        assertEquals(2, e.getLine());
    }

    @Test
    void parseAllAcceptsSeveralExpressions() {
        List<SNode> nodes = parser.parseAll("(a) b (c)");

        assertEquals(3, nodes.size());
        assertInstanceOf(SNode.SAtom.class, nodes.get(1));
    }

    @Test
    void deepNestingDoesNotOverflow() {
        int depth = 20_000;
        String text = "(n ".repeat(depth) + ")".repeat(depth);

        SNode.SList root = parser.parseDocument(text);
        assertEquals("n", root.head());
    }
}
