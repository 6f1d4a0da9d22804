package nl.bytesoflife.deltakicad.model.schematic;

import nl.bytesoflife.deltakicad.model.Point;

public record Label(String name, Point position, LabelKind kind) {
}
