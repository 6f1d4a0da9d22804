package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.geometry.CopperGeometryConverter;
import nl.bytesoflife.deltakicad.geometry.SpatialIndex;
import nl.bytesoflife.deltakicad.model.PinRef;
import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.pcb.*;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Resolves board nets from copper geometry alone. Board positions come out of
 * rotation transforms, so coincidence is always tested against
 * {@link ConnectivitySettings#getPcbToleranceMm()}, never exact equality.
 * <p>
 * Two items on a shared copper layer connect when a track end point touches
 * the other item, two via centres coincide, a via centre lies on a pad, or
 * (with pad-to-pad connectivity enabled) two pad centres coincide. Filled zones
 * join the items of their own net code that lie inside their outline.
 * Pads of one footprint that share a pad number always form a single pin.
 */
public class PcbNetlistResolver {

    private static final Logger log = LoggerFactory.getLogger(PcbNetlistResolver.class);

    private final ConnectivitySettings settings;
    private final CopperGeometryConverter converter = new CopperGeometryConverter();

    public PcbNetlistResolver() {
        this(ConnectivitySettings.defaults());
    }

    public PcbNetlistResolver(ConnectivitySettings settings) {
        this.settings = settings;
    }

    private sealed interface Item permits PadItem, TrackItem, ViaItem {
        int id();

        Geometry geometry();

        List<String> layers();

        int netCode();

        Point anchor();
    }

    private record PadItem(int id, Pad pad, PinRef ref, Geometry geometry) implements Item {
        public List<String> layers() { return pad.layers(); }
        public int netCode() { return pad.netCode(); }
        public Point anchor() { return pad.position(); }
    }

    private record TrackItem(int id, Track track, Geometry geometry) implements Item {
        public List<String> layers() { return List.of(track.layer()); }
        public int netCode() { return track.netCode(); }
        public Point anchor() { return track.start(); }
    }

    private record ViaItem(int id, Via via, Geometry geometry) implements Item {
        public List<String> layers() { return via.layers(); }
        public int netCode() { return via.netCode(); }
        public Point anchor() { return via.position(); }
    }

    public Netlist resolve(PcbModel model) {
        double tolerance = settings.getPcbToleranceMm();
        List<Item> items = new ArrayList<>();
        for (Footprint footprint : model.footprints()) {
            for (Pad pad : footprint.pads()) {
                items.add(new PadItem(items.size(), pad, new PinRef(pad.owner(), pad.number()), converter.pad(pad)));
            }
        }
        for (Track track : model.tracks()) {
            items.add(new TrackItem(items.size(), track, converter.track(track)));
        }
        for (Via via : model.vias()) {
            items.add(new ViaItem(items.size(), via, converter.via(via)));
        }

        SpatialIndex<Item> index = new SpatialIndex<>();
        for (Item item : items) {
            index.insert(item.geometry(), item);
        }

        // 1. every item starts as a singleton
        UnionFind<Integer> sets = new UnionFind<>();
        for (Item item : items) {
            sets.add(item.id());
        }

        // 2. pads sharing a number within a footprint are one pin (tab and mounting pads)
        Map<PinRef, Integer> firstPad = new HashMap<>();
        for (Item item : items) {
            if (item instanceof PadItem pad) {
                Integer first = firstPad.putIfAbsent(pad.ref(), pad.id());
                if (first != null) {
                    sets.union(first, pad.id());
                }
            }
        }

        // 3. copper coincidence
        for (Item item : items) {
            if (item instanceof TrackItem track) {
                connectTrackEnds(track, index, sets, tolerance);
            } else if (item instanceof ViaItem via) {
                connectCentre(via, via.via().position(), index, sets, tolerance, true);
            } else if (item instanceof PadItem pad && settings.isPadToPadConnectivity()) {
                connectCentre(pad, pad.pad().position(), index, sets, tolerance, false);
            }
        }

        // 4. zones
        for (Zone zone : model.zones()) {
            if (zone.netCode() <= 0) continue;
            Polygon outline = converter.zone(zone);
            Integer first = null;
            for (Item item : index.queryNeighbors(outline, tolerance)) {
                if (item.netCode() != zone.netCode() || !sharesLayer(item.layers(), zone.layers())) continue;
                if (!outline.covers(converter.point(item.anchor()))) continue;
                if (first == null) {
                    first = item.id();
                } else {
                    sets.union(first, item.id());
                }
            }
        }

        return name(model, items, sets);
    }

    private void connectTrackEnds(TrackItem track, SpatialIndex<Item> index, UnionFind<Integer> sets, double tolerance) {
        for (Point end : List.of(track.track().start(), track.track().end())) {
            Geometry endPoint = converter.point(end);
            for (Item other : index.queryNeighbors(endPoint, tolerance)) {
                if (other.id() == track.id()) continue;
                if (!sharesLayer(track.layers(), other.layers())) continue;
                if (other.geometry().isWithinDistance(endPoint, tolerance)) {
                    sets.union(track.id(), other.id());
                }
            }
        }
    }

    /**
     * Joins items whose centre coincides with {@code centre}. Vias also join
     * any pad covering their centre.
     */
    private void connectCentre(Item item, Point centre, SpatialIndex<Item> index, UnionFind<Integer> sets,
                               double tolerance, boolean isVia) {
        Geometry centrePoint = converter.point(centre);
        for (Item other : index.queryNeighbors(centrePoint, tolerance)) {
            if (other.id() == item.id()) continue;
            if (!sharesLayer(item.layers(), other.layers())) continue;
            boolean connected = false;
            if (other instanceof PadItem pad) {
                connected = isVia
                        ? pad.geometry().isWithinDistance(centrePoint, tolerance)
                        : pad.pad().position().distanceTo(centre) <= tolerance;
            } else if (other instanceof ViaItem via) {
                connected = via.via().position().distanceTo(centre) <= tolerance;
            }
            if (connected) {
                sets.union(item.id(), other.id());
            }
        }
    }

    private Netlist name(PcbModel model, List<Item> items, UnionFind<Integer> sets) {
        List<Net> nets = new ArrayList<>();
        List<NetConflict> conflicts = new ArrayList<>();

        for (List<Integer> members : sets.groups().values()) {
            List<PadItem> pads = new ArrayList<>();
            for (Integer id : members) {
                if (items.get(id) instanceof PadItem pad) {
                    pads.add(pad);
                }
            }
            if (pads.isEmpty()) continue;
            pads.sort(Comparator.comparing(PadItem::ref));

            Set<String> declared = new LinkedHashSet<>();
            for (PadItem pad : pads) {
                if (pad.pad().netName() != null) {
                    declared.add(pad.pad().netName());
                }
            }
            List<PinRef> pins = pads.stream().map(PadItem::ref).distinct().toList();
            String name;
            if (declared.isEmpty()) {
                name = Net.generatedName(pins.get(0));
            } else {
                List<String> names = new ArrayList<>(declared);
                name = names.get(names.size() - 1);
                if (names.size() > 1) {
                    NetConflict conflict = new NetConflict(name, names, PinRef.ROOT_SHEET);
                    log.warn("{} ({})", conflict, model.source());
                    conflicts.add(conflict);
                }
            }
            nets.add(new Net(name, pins, !declared.isEmpty()));
        }

        log.debug("Resolved {} nets ({} conflicts) for {}", nets.size(), conflicts.size(), model.source());
        return new Netlist(Netlist.sorted(nets), conflicts);
    }

    private static boolean sharesLayer(List<String> a, List<String> b) {
        for (String layer : a) {
            if (layer.endsWith(".Cu") && b.contains(layer)) {
                return true;
            }
        }
        return false;
    }
}
