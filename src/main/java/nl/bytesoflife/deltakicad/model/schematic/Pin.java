package nl.bytesoflife.deltakicad.model.schematic;

import nl.bytesoflife.deltakicad.model.Point;

/**
 * A symbol pin. {@code offset} is the connection point in library coordinates
 * (Y up), {@code position} the resulting sheet coordinate.
 */
public record Pin(String owner, String number, String name, Point offset, Point position) {
}
