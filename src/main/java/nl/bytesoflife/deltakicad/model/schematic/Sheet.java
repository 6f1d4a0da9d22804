package nl.bytesoflife.deltakicad.model.schematic;

import nl.bytesoflife.deltakicad.model.Point;

import java.util.List;

public record Sheet(String name, String file, Point position, List<SheetPin> pins) {

    public Sheet {
        pins = List.copyOf(pins);
    }
}
