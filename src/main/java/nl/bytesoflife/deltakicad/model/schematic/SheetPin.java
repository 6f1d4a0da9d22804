package nl.bytesoflife.deltakicad.model.schematic;

import nl.bytesoflife.deltakicad.model.Point;

/**
 * A port on a sheet symbol, matched by name to a hierarchical label in the
 * child sheet.
 */
public record SheetPin(String name, Point position) {
}
