package nl.bytesoflife.deltakicad.sexpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public sealed interface SNode permits SNode.SAtom, SNode.SList {

    static SAtom atom(String value) {
        return new SAtom(value, false);
    }

    static SAtom quoted(String value) {
        return new SAtom(value, true);
    }

    static SList list(String head, Object... children) {
        List<SNode> nodes = new ArrayList<>();
        nodes.add(atom(head));
        for (Object child : children) {
            if (child instanceof SNode node) {
                nodes.add(node);
            } else {
                nodes.add(atom(String.valueOf(child)));
            }
        }
        return new SList(nodes, 0);
    }

    record SAtom(String value, boolean quoted) implements SNode {

        @Override
        public String toString() {
            if (quoted || needsQuotes(value)) {
                return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + '"';
            }
            return value;
        }

        private static boolean needsQuotes(String value) {
            if (value.isEmpty()) return true;
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == '(' || c == ')' || c == '"' || c == '\\' || Character.isWhitespace(c)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * A parenthesised list. {@code line} is the 1-based line of the opening
     * parenthesis, or 0 for lists built in code.
     */
    record SList(List<SNode> children, int line) implements SNode {

        public SList {
            children = List.copyOf(children);
        }

        /**
         * The head keyword, or an empty string when the first child is not an atom.
         */
        public String head() {
            if (children.isEmpty()) return "";
            if (children.get(0) instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        public int size() {
            return children.size();
        }

        public SNode get(int index) {
            return children.get(index);
        }

        public Optional<String> atomAt(int index) {
            if (index >= children.size()) return Optional.empty();
            if (children.get(index) instanceof SAtom atom) {
                return Optional.of(atom.value());
            }
            return Optional.empty();
        }

        public Optional<SList> find(String head) {
            for (SNode child : children) {
                if (child instanceof SList list && head.equals(list.head())) {
                    return Optional.of(list);
                }
            }
            return Optional.empty();
        }

        public List<SList> findAll(String head) {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list && head.equals(list.head())) {
                    result.add(list);
                }
            }
            return result;
        }

        public List<SList> lists() {
            List<SList> result = new ArrayList<>();
            for (SNode child : children) {
                if (child instanceof SList list) {
                    result.add(list);
                }
            }
            return result;
        }

        /**
         * Atoms following the head keyword, ignoring nested lists.
         */
        public List<String> atoms() {
            List<String> result = new ArrayList<>();
            for (int i = 1; i < children.size(); i++) {
                if (children.get(i) instanceof SAtom atom) {
                    result.add(atom.value());
                }
            }
            return result;
        }

        /**
         * True when a bare atom equal to {@code flag} appears after the head.
         */
        public boolean hasFlag(String flag) {
            for (int i = 1; i < children.size(); i++) {
                if (children.get(i) instanceof SAtom atom && !atom.quoted() && flag.equals(atom.value())) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
