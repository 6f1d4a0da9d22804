package nl.bytesoflife.deltakicad.model.schematic;

import nl.bytesoflife.deltakicad.model.Point;

public record Junction(Point position) {
}
