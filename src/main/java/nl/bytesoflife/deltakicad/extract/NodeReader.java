package nl.bytesoflife.deltakicad.extract;

import nl.bytesoflife.deltakicad.model.ExtractionIssue;
import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.sexpr.SNode;

import java.util.Optional;

/**
 * Field accessors shared by the extractors. Every required accessor throws an
 * {@link ExtractionException} naming the field and the enclosing reference.
 */
final class NodeReader {

    private NodeReader() {
    }

    static SNode.SList required(SNode.SList list, String head, String reference) {
        return list.find(head)
                .orElseThrow(() -> ExtractionException.missingField(head, reference, list.line()));
    }

    static String requiredAtom(SNode.SList list, int index, String field, String reference) {
        return list.atomAt(index)
                .orElseThrow(() -> ExtractionException.missingField(field, reference, list.line()));
    }

    static double number(String text, String field, String reference, int line) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new ExtractionException(ExtractionIssue.Kind.INVALID_VALUE,
                    "Field '" + field + "' is not a number: '" + text + "'", reference, line);
        }
    }

    static double number(SNode.SList list, int index, String field, String reference) {
        return number(requiredAtom(list, index, field, reference), field, reference, list.line());
    }

    static double optionalNumber(SNode.SList list, int index, double fallback, String field, String reference) {
        Optional<String> atom = list.atomAt(index);
        if (atom.isEmpty()) return fallback;
        return number(atom.get(), field, reference, list.line());
    }

    /**
     * Reads {@code (head x y ...)} as a point.
     */
    static Point point(SNode.SList list, String field, String reference) {
        double x = number(list, 1, field, reference);
        double y = number(list, 2, field, reference);
        return new Point(x, y);
    }

    static Point requiredPoint(SNode.SList owner, String head, String reference) {
        return point(required(owner, head, reference), head, reference);
    }

    /**
     * Value of {@code (property "name" "value" ...)}, or of the legacy
     * {@code (fp_text name "value" ...)} form used by older board files.
     */
    static Optional<String> property(SNode.SList owner, String... names) {
        for (String name : names) {
            for (SNode.SList property : owner.findAll("property")) {
                if (property.atomAt(1).map(name::equals).orElse(false)) {
                    return property.atomAt(2);
                }
            }
        }
        return Optional.empty();
    }

    static Optional<String> fpText(SNode.SList owner, String kind) {
        for (SNode.SList text : owner.findAll("fp_text")) {
            if (text.atomAt(1).map(kind::equals).orElse(false)) {
                return text.atomAt(2);
            }
        }
        return Optional.empty();
    }

    /**
     * Reads {@code (name yes|no)}; a bare {@code (name)} counts as yes.
     */
    static boolean yesNo(SNode.SList owner, String head, boolean fallback) {
        return owner.find(head)
                .map(list -> list.atomAt(1).map(v -> !"no".equals(v)).orElse(true))
                .orElse(fallback);
    }
}
