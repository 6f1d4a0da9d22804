package nl.bytesoflife.deltakicad.stats;

import nl.bytesoflife.deltakicad.geometry.CopperGeometryConverter;
import nl.bytesoflife.deltakicad.model.pcb.*;
import org.locationtech.jts.geom.Envelope;

/**
 * Scans a {@link PcbModel} into {@link BoardStatistics}.
 */
public class BoardStatisticsScanner {

    private final CopperGeometryConverter converter = new CopperGeometryConverter();

    public BoardStatistics scan(PcbModel board) {
        BoardStatistics stats = new BoardStatistics();
        stats.setCopperLayerCount(board.copperLayers().size());
        Envelope extent = new Envelope();

        int pads = 0;
        for (Footprint footprint : board.footprints()) {
            stats.getComponentsByLayer().merge(footprint.layer(), 1, Integer::sum);
            extent.expandToInclude(footprint.position().x(), footprint.position().y());
            for (Pad pad : footprint.pads()) {
                extent.expandToInclude(converter.pad(pad).getEnvelopeInternal());
                pads++;
            }
        }
        stats.setPadCount(pads);

        for (Track track : board.tracks()) {
            stats.getTracksByLayer().merge(track.layer(), 1, Integer::sum);
            stats.getTrackLengthByLayer().merge(track.layer(), track.length(), Double::sum);
            extent.expandToInclude(converter.track(track).getEnvelopeInternal());
        }

        for (Via via : board.vias()) {
            extent.expandToInclude(converter.via(via).getEnvelopeInternal());
        }
        stats.setViaCount(board.vias().size());

        for (Zone zone : board.zones()) {
            for (String layer : zone.layers()) {
                stats.getZonesByLayer().merge(layer, 1, Integer::sum);
            }
            extent.expandToInclude(converter.zone(zone).getEnvelopeInternal());
        }

        if (!extent.isNull()) {
            stats.setBoundingBox(extent.getMinX(), extent.getMinY(), extent.getMaxX(), extent.getMaxY());
        }
        return stats;
    }
}
