package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.model.PinRef;

import java.util.List;

/**
 * One electrical net. {@code pins} is sorted; {@code explicitName} is false
 * when the name was generated from the first pin.
 */
public record Net(String name, List<PinRef> pins, boolean explicitName) {

    public Net {
        pins = List.copyOf(pins);
    }

    public static String generatedName(PinRef first) {
        return "Net-(" + first + ")";
    }
}
