package nl.bytesoflife.deltakicad.geometry;

import nl.bytesoflife.deltakicad.model.Point;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpatialIndexTest {

    private final CopperGeometryConverter converter = new CopperGeometryConverter();

    @Test
    void queryExpandsBySearchDistance() {
        SpatialIndex<String> index = new SpatialIndex<>();
        index.insert(converter.point(new Point(0, 0)), "a");
        index.insert(converter.point(new Point(1, 0)), "b");
        index.insert(converter.point(new Point(10, 10)), "c");

        List<String> near = index.queryNeighbors(converter.point(new Point(0.5, 0)), 0.6);

        assertEquals(2, near.size());
        assertTrue(near.containsAll(List.of("a", "b")));
        assertTrue(index.queryNeighbors(converter.point(new Point(5, 5)), 1).isEmpty());
    }

    @Test
    void insertAfterQueryIsRejected() {
        SpatialIndex<String> index = new SpatialIndex<>();
        index.insert(converter.point(new Point(0, 0)), "a");
        index.queryNeighbors(converter.point(new Point(0, 0)), 0);

        assertThrows(IllegalStateException.class,
                () -> index.insert(converter.point(new Point(1, 1)), "b"));
    }
}
