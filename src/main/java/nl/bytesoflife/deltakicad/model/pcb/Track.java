package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.model.Point;

/**
 * A copper segment. Arcs are stored by their end points only.
 */
public record Track(Point start, Point end, double width, String layer, int netCode) {

    public double length() {
        return start.distanceTo(end);
    }
}
