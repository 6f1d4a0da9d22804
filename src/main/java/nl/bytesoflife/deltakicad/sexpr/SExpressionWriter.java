package nl.bytesoflife.deltakicad.sexpr;

/**
 * Renders an {@link SNode} tree as indented text in the layout KiCad uses:
 * lists holding only atoms stay on one line, anything deeper is broken up.
 */
public class SExpressionWriter {

    private final String indent;

    public SExpressionWriter() {
        this("  ");
    }

    public SExpressionWriter(String indent) {
        this.indent = indent;
    }

    public String write(SNode node) {
        StringBuilder sb = new StringBuilder();
        write(node, 0, sb);
        sb.append('\n');
        return sb.toString();
    }

    private void write(SNode node, int depth, StringBuilder sb) {
        if (node instanceof SNode.SAtom atom) {
            sb.append(atom);
            return;
        }
        SNode.SList list = (SNode.SList) node;
        if (isFlat(list)) {
            sb.append(list);
            return;
        }
        sb.append('(');
        boolean first = true;
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList && !first) {
                sb.append('\n').append(indent.repeat(depth + 1));
            } else if (!first) {
                sb.append(' ');
            }
            write(child, depth + 1, sb);
            first = false;
        }
        sb.append(')');
    }

    private static boolean isFlat(SNode.SList list) {
        for (SNode child : list.children()) {
            if (child instanceof SNode.SList nested) {
                for (SNode grandChild : nested.children()) {
                    if (grandChild instanceof SNode.SList) return false;
                }
                if (list.children().size() > 4) return false;
            }
        }
        return true;
    }
}
