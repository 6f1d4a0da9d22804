package nl.bytesoflife.deltakicad.geometry;

import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.pcb.Pad;
import nl.bytesoflife.deltakicad.model.pcb.Track;
import nl.bytesoflife.deltakicad.model.pcb.Via;
import nl.bytesoflife.deltakicad.model.pcb.Zone;
import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts board copper items into JTS geometries in board millimetres.
 */
public class CopperGeometryConverter {

    private static final int ARC_SEGMENTS = 32;
    private final GeometryFactory factory = new GeometryFactory();

    public org.locationtech.jts.geom.Point point(Point p) {
        return factory.createPoint(coordinate(p));
    }

    /**
     * Pad outline. Round pads become discs, every other shape its rotated
     * bounding rectangle. A pad without a size is its centre point.
     */
    public Geometry pad(Pad pad) {
        if (pad.width() <= 0 || pad.height() <= 0) {
            return point(pad.position());
        }
        double x = pad.position().x();
        double y = pad.position().y();
        if ("circle".equals(pad.shape())) {
            return point(pad.position()).buffer(pad.width() / 2, ARC_SEGMENTS / 4);
        }
        double hw = pad.width() / 2;
        double hh = pad.height() / 2;
        Polygon rect = factory.createPolygon(new Coordinate[]{
                new Coordinate(x - hw, y - hh),
                new Coordinate(x + hw, y - hh),
                new Coordinate(x + hw, y + hh),
                new Coordinate(x - hw, y + hh),
                new Coordinate(x - hw, y - hh)
        });
        if (pad.rotation() % 180 == 0) {
            return rect;
        }
        // board Y points down, so a counter-clockwise screen rotation is negative here
        AffineTransformation rotation = AffineTransformation.rotationInstance(
                Math.toRadians(-pad.rotation()), x, y);
        return rotation.transform(rect);
    }

    public Geometry via(Via via) {
        if (via.size() <= 0) {
            return point(via.position());
        }
        return point(via.position()).buffer(via.size() / 2, ARC_SEGMENTS / 4);
    }

    /**
     * Track centre line. Width is ignored: tracks connect through their end
     * points, not by overlapping copper.
     */
    public LineString track(Track track) {
        return factory.createLineString(new Coordinate[]{coordinate(track.start()), coordinate(track.end())});
    }

    public Polygon zone(Zone zone) {
        List<Coordinate> coords = new ArrayList<>();
        for (Point p : zone.outline()) {
            coords.add(coordinate(p));
        }
        if (!coords.get(0).equals2D(coords.get(coords.size() - 1))) {
            coords.add(coords.get(0).copy());
        }
        return factory.createPolygon(coords.toArray(new Coordinate[0]));
    }

    private static Coordinate coordinate(Point p) {
        return new Coordinate(p.x(), p.y());
    }
}
