package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.model.Component;
import nl.bytesoflife.deltakicad.model.Point;

import java.util.List;

/**
 * A placed footprint. {@code footprint} is the library footprint name, e.g.
 * {@code Resistor_SMD:R_0603_1608Metric}.
 */
public record Footprint(String reference, String value, String footprint, String layer,
                        Point position, double rotation, boolean excludeFromBom,
                        String datasheet, String description, List<Pad> pads) implements Component {

    public Footprint {
        pads = List.copyOf(pads);
    }

    @Override
    public String libraryId() {
        return footprint;
    }

    @Override
    public boolean inBom() {
        return !excludeFromBom;
    }
}
