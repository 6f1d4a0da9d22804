package nl.bytesoflife.deltakicad.model.schematic;

import nl.bytesoflife.deltakicad.model.Component;
import nl.bytesoflife.deltakicad.model.Point;

import java.util.List;

/**
 * A placed schematic symbol. Multi-unit parts produce one symbol per placed
 * unit, all sharing the same reference.
 */
public record Symbol(String reference, String value, String footprint, String libId,
                     Point position, double rotation, Mirror mirror, int unit,
                     boolean inBom, boolean power, String datasheet, String description,
                     List<Pin> pins) implements Component {

    public Symbol {
        pins = List.copyOf(pins);
    }

    @Override
    public String libraryId() {
        return libId;
    }

    @Override
    public boolean isVirtual() {
        return power;
    }
}
