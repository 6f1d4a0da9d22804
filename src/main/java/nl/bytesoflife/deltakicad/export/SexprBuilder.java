package nl.bytesoflife.deltakicad.export;

import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.sexpr.SExpressionWriter;
import nl.bytesoflife.deltakicad.sexpr.SNode;

import java.math.BigDecimal;

/**
 * Shared node builders for writing models back to KiCad S-expressions.
 */
abstract class SexprBuilder {

    private final SExpressionWriter writer = new SExpressionWriter();

    protected String render(SNode.SList root) {
        return writer.write(root);
    }

    static SNode.SAtom num(double value) {
        if (value == 0) {
            return SNode.atom("0");
        }
        return SNode.atom(BigDecimal.valueOf(value).stripTrailingZeros().toPlainString());
    }

    static SNode.SList at(Point p) {
        return SNode.list("at", num(p.x()), num(p.y()));
    }

    static SNode.SList at(Point p, double rotation) {
        return SNode.list("at", num(p.x()), num(p.y()), num(rotation));
    }

    static SNode.SList xy(Point p) {
        return SNode.list("xy", num(p.x()), num(p.y()));
    }

    static SNode.SList property(String name, String value) {
        return SNode.list("property", SNode.quoted(name), SNode.quoted(value == null ? "" : value));
    }

    static SNode.SList yesNo(String head, boolean value) {
        return SNode.list(head, value ? "yes" : "no");
    }
}
