package nl.bytesoflife.deltakicad.model;

import java.util.Locale;

/**
 * A position in millimetres. Schematic and board files both use a Y axis
 * pointing down the page.
 */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    public Point plus(Point other) {
        return new Point(x + other.x, y + other.y);
    }

    public double distanceTo(Point other) {
        return Math.hypot(x - other.x, y - other.y);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "(%.4f, %.4f)", x, y);
    }
}
