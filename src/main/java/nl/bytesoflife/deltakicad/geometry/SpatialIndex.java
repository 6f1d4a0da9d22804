package nl.bytesoflife.deltakicad.geometry;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.List;

/**
 * STRtree over arbitrary items keyed by the envelope of their geometry.
 * The tree is built lazily on the first query; no inserts are allowed after.
 */
public class SpatialIndex<T> {

    private final STRtree tree = new STRtree();
    private boolean built = false;

    public void insert(Geometry geometry, T item) {
        if (built) {
            throw new IllegalStateException("Index already queried, cannot insert");
        }
        tree.insert(geometry.getEnvelopeInternal(), item);
    }

    @SuppressWarnings("unchecked")
    public List<T> queryNeighbors(Geometry geometry, double searchDistance) {
        ensureBuilt();
        Envelope searchEnvelope = geometry.getEnvelopeInternal().copy();
        searchEnvelope.expandBy(searchDistance);
        return (List<T>) tree.query(searchEnvelope);
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }
}
