package nl.bytesoflife.deltakicad.extract;

import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.sexpr.SNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A symbol definition from the schematic's embedded {@code lib_symbols} cache.
 */
record LibrarySymbol(String name, boolean power, List<LibraryPin> pins) {

    private static final Pattern UNIT_SUFFIX = Pattern.compile("_(\\d+)_(\\d+)$");

    /**
     * A pin of one unit and body style; 0 means shared by all units or styles.
     */
    record LibraryPin(int unit, int bodyStyle, String number, String name, Point offset) {
    }

    LibrarySymbol {
        pins = List.copyOf(pins);
    }

    /**
     * Pins present on the given unit and body style, in definition order.
     */
    List<LibraryPin> pinsFor(int unit, int bodyStyle) {
        List<LibraryPin> result = new ArrayList<>();
        for (LibraryPin pin : pins) {
            boolean unitMatches = pin.unit() == 0 || pin.unit() == unit;
            boolean styleMatches = pin.bodyStyle() == 0 || pin.bodyStyle() == bodyStyle;
            if (unitMatches && styleMatches) {
                result.add(pin);
            }
        }
        return result;
    }

    static LibrarySymbol parse(SNode.SList definition) {
        String name = NodeReader.requiredAtom(definition, 1, "name", null);
        List<LibraryPin> pins = new ArrayList<>();
        collectPins(definition, 0, 0, pins);
        for (SNode.SList unit : definition.findAll("symbol")) {
            String unitName = unit.atomAt(1).orElse("");
            Matcher m = UNIT_SUFFIX.matcher(unitName);
            int unitNumber = 0;
            int style = 0;
            if (m.find()) {
                unitNumber = Integer.parseInt(m.group(1));
                style = Integer.parseInt(m.group(2));
            }
            collectPins(unit, unitNumber, style, pins);
        }
        boolean power = definition.find("power").isPresent();
        return new LibrarySymbol(name, power, pins);
    }

    private static void collectPins(SNode.SList owner, int unit, int style, List<LibraryPin> pins) {
        for (SNode.SList pin : owner.findAll("pin")) {
            String number = pin.find("number").flatMap(n -> n.atomAt(1))
                    .orElseThrow(() -> ExtractionException.missingField("pin number", null, pin.line()));
            String pinName = pin.find("name").flatMap(n -> n.atomAt(1)).orElse("~");
            Point offset = NodeReader.requiredPoint(pin, "at", null);
            pins.add(new LibraryPin(unit, style, number, pinName, offset));
        }
    }
}
