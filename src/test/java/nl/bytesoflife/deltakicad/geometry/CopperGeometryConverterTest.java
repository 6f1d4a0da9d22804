package nl.bytesoflife.deltakicad.geometry;

import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.pcb.Pad;
import nl.bytesoflife.deltakicad.model.pcb.Track;
import nl.bytesoflife.deltakicad.model.pcb.Via;
import nl.bytesoflife.deltakicad.model.pcb.Zone;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CopperGeometryConverterTest {

    private final CopperGeometryConverter converter = new CopperGeometryConverter();

    private static Pad pad(String shape, double width, double height, double rotation) {
        return new Pad("R1", "1", "smd", shape, Point.ORIGIN, new Point(10, 20), width, height, rotation,
                List.of("F.Cu"), 0, null);
    }

    @Test
    void rectanglePad() {
        Envelope env = converter.pad(pad("rect", 2, 1, 0)).getEnvelopeInternal();

        assertEquals(9, env.getMinX(), 1e-9);
        assertEquals(11, env.getMaxX(), 1e-9);
        assertEquals(19.5, env.getMinY(), 1e-9);
        assertEquals(20.5, env.getMaxY(), 1e-9);
    }

    @Test
    void quarterTurnSwapsPadExtent() {
        Envelope env = converter.pad(pad("roundrect", 2, 1, 90)).getEnvelopeInternal();

        assertEquals(1, env.getWidth(), 1e-9);
        assertEquals(2, env.getHeight(), 1e-9);
        assertEquals(10, env.centre().x, 1e-9);
        assertEquals(20, env.centre().y, 1e-9);
    }

    @Test
    void circlePadIsADisc() {
        Geometry disc = converter.pad(pad("circle", 2, 2, 0));

        assertTrue(disc.contains(converter.point(new Point(10.9, 20))));
        assertFalse(disc.contains(converter.point(new Point(10.9, 20.9))));
    }

    @Test
    void padWithoutSizeIsItsCentre() {
        assertEquals("Point", converter.pad(pad("rect", 0, 0, 0)).getGeometryType());
    }

    @Test
    void viaTrackAndZone() {
        Geometry via = converter.via(new Via(new Point(5, 5), 0.6, 0.3, List.of("F.Cu", "B.Cu"), 1));
        assertEquals(0.6, via.getEnvelopeInternal().getWidth(), 1e-9);

        Track track = new Track(new Point(0, 0), new Point(3, 4), 0.25, "F.Cu", 1);
        assertEquals(5, converter.track(track).getLength(), 1e-9);

        Polygon zone = converter.zone(new Zone(1, "GND", List.of("F.Cu"),
                List.of(new Point(0, 0), new Point(4, 0), new Point(4, 4), new Point(0, 4))));
        assertTrue(zone.isValid());
        assertEquals(16, zone.getArea(), 1e-9);
    }
}
