package nl.bytesoflife.deltakicad.extract;

import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.schematic.Mirror;

/**
 * Coordinate transforms from local (library / footprint) space to sheet or
 * board space. Both target spaces have Y pointing down and positive angles
 * turning counter-clockwise on screen.
 */
public final class Placement {

    private Placement() {
    }

    /**
     * Sheet position of a library pin. Library coordinates have Y up, so the
     * offset is flipped before rotation; the mirror is applied after rotation.
     */
    public static Point pinPosition(Point symbolPosition, double rotationDeg, Mirror mirror, Point libraryOffset) {
        Point flipped = new Point(libraryOffset.x(), -libraryOffset.y());
        Point rotated = rotate(flipped, rotationDeg);
        Point mirrored = switch (mirror) {
            case X -> new Point(rotated.x(), -rotated.y());
            case Y -> new Point(-rotated.x(), rotated.y());
            case NONE -> rotated;
        };
        return symbolPosition.plus(mirrored);
    }

    /**
     * Board position of a pad placed at {@code padOffset} in a footprint.
     */
    public static Point padPosition(Point footprintPosition, double rotationDeg, Point padOffset) {
        return footprintPosition.plus(rotate(padOffset, rotationDeg));
    }

    static Point rotate(Point p, double degrees) {
        double normalized = ((degrees % 360) + 360) % 360;
        double cos;
        double sin;
        // exact values for quarter turns keep pin positions on grid
        if (normalized == 0) {
            cos = 1; sin = 0;
        } else if (normalized == 90) {
            cos = 0; sin = 1;
        } else if (normalized == 180) {
            cos = -1; sin = 0;
        } else if (normalized == 270) {
            cos = 0; sin = -1;
        } else {
            double rad = Math.toRadians(normalized);
            cos = Math.cos(rad);
            sin = Math.sin(rad);
        }
        return new Point(p.x() * cos + p.y() * sin, -p.x() * sin + p.y() * cos);
    }
}
