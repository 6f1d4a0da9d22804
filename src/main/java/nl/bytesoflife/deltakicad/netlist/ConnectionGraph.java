package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.geometry.SpatialIndex;
import nl.bytesoflife.deltakicad.model.PinRef;
import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.schematic.*;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

import java.util.*;

/**
 * Connected sets of one schematic sheet, including sets that hold only wires
 * and labels. Built once; read-only afterwards.
 */
final class ConnectionGraph {

    private static final GeometryFactory FACTORY = new GeometryFactory();

    private final double resolution;
    private final List<Group> groups;
    private final Map<GridKey, Group> groupsByKey;
    private final SpatialIndex<IndexedWire> wireIndex;

    private ConnectionGraph(double resolution, List<Group> groups, Map<GridKey, Group> groupsByKey,
                            SpatialIndex<IndexedWire> wireIndex) {
        this.resolution = resolution;
        this.groups = groups;
        this.groupsByKey = groupsByKey;
        this.wireIndex = wireIndex;
    }

    /**
     * A point snapped to the schematic grid.
     */
    record GridKey(long x, long y) {
    }

    private record IndexedWire(Wire wire, LineString line) {
    }

    /**
     * One connected set.
     */
    static final class Group {

        private final int index;
        private final List<PinRef> pins = new ArrayList<>();
        private final List<Label> labels = new ArrayList<>();

        private Group(int index) {
            this.index = index;
        }

        int index() {
            return index;
        }

        List<PinRef> pins() {
            return pins;
        }

        /**
         * Labels in the order their names are applied: by kind precedence,
         * then declaration order. The last one wins.
         */
        List<Label> labels() {
            return labels;
        }

        Optional<Label> winner() {
            return labels.isEmpty() ? Optional.empty() : Optional.of(labels.get(labels.size() - 1));
        }

        List<String> distinctNames() {
            Set<String> names = new LinkedHashSet<>();
            for (Label label : labels) {
                names.add(label.name());
            }
            return new ArrayList<>(names);
        }

        boolean hasLabel(String name, LabelKind kind) {
            for (Label label : labels) {
                if (label.kind() == kind && label.name().equals(name)) {
                    return true;
                }
            }
            return false;
        }
    }

    List<Group> groups() {
        return groups;
    }

    /**
     * The set touching {@code p}, either at a known point or along a wire.
     */
    Optional<Group> groupAt(Point p) {
        Group group = groupsByKey.get(key(p, resolution));
        if (group != null) {
            return Optional.of(group);
        }
        List<IndexedWire> through = wiresThrough(wireIndex, p, resolution);
        if (through.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(groupsByKey.get(key(through.get(0).wire().start(), resolution)));
    }

    static ConnectionGraph build(SchematicModel model, double resolution) {
        UnionFind<Object> sets = new UnionFind<>();
        SpatialIndex<IndexedWire> wireIndex = new SpatialIndex<>();

        // 1. every pin is a singleton anchored at its grid point
        for (Symbol symbol : model.symbols()) {
            for (Pin pin : symbol.pins()) {
                PinRef ref = new PinRef(symbol.reference(), pin.number());
                sets.add(ref);
                sets.union(ref, key(pin.position(), resolution));
            }
        }

        // 2. wires join their end points
        List<IndexedWire> wires = new ArrayList<>();
        for (Wire wire : model.wires()) {
            sets.union(key(wire.start(), resolution), key(wire.end(), resolution));
            LineString line = FACTORY.createLineString(new Coordinate[]{
                    new Coordinate(wire.start().x(), wire.start().y()),
                    new Coordinate(wire.end().x(), wire.end().y())});
            IndexedWire indexed = new IndexedWire(wire, line);
            wireIndex.insert(line, indexed);
            wires.add(indexed);
        }

        // wire ends and pins landing on another wire's interior join that wire
        List<Point> anchors = new ArrayList<>();
        for (IndexedWire wire : wires) {
            anchors.add(wire.wire().start());
            anchors.add(wire.wire().end());
        }
        for (Symbol symbol : model.symbols()) {
            for (Pin pin : symbol.pins()) {
                anchors.add(pin.position());
            }
        }
        // 3. junctions, 4. labels
        for (Junction junction : model.junctions()) {
            sets.add(key(junction.position(), resolution));
            anchors.add(junction.position());
        }
        for (Label label : model.labels()) {
            sets.add(key(label.position(), resolution));
            anchors.add(label.position());
        }
        if (!wires.isEmpty()) {
            for (Point anchor : anchors) {
                for (IndexedWire wire : wiresThrough(wireIndex, anchor, resolution)) {
                    sets.union(key(anchor, resolution), key(wire.wire().start(), resolution));
                }
            }
        }

        // labels sharing a name within one sheet are the same net
        Map<String, GridKey> firstByName = new HashMap<>();
        for (Label label : model.labels()) {
            GridKey k = key(label.position(), resolution);
            GridKey first = firstByName.putIfAbsent(label.name(), k);
            if (first != null) {
                sets.union(first, k);
            }
        }

        List<Group> groups = new ArrayList<>();
        Map<GridKey, Group> groupsByKey = new HashMap<>();
        for (Map.Entry<Object, List<Object>> entry : sets.groups().entrySet()) {
            Group group = new Group(groups.size());
            groups.add(group);
            for (Object member : entry.getValue()) {
                if (member instanceof PinRef pin) {
                    group.pins.add(pin);
                } else if (member instanceof GridKey gridKey) {
                    groupsByKey.put(gridKey, group);
                }
            }
            Collections.sort(group.pins);
        }

        List<Label> ordered = new ArrayList<>(model.labels());
        // stable sort keeps declaration order within a kind
        ordered.sort(Comparator.comparing(Label::kind));
        for (Label label : ordered) {
            groupsByKey.get(key(label.position(), resolution)).labels.add(label);
        }

        return new ConnectionGraph(resolution, List.copyOf(groups), groupsByKey, wireIndex);
    }

    private static List<IndexedWire> wiresThrough(SpatialIndex<IndexedWire> index, Point p, double tolerance) {
        org.locationtech.jts.geom.Point point = FACTORY.createPoint(new Coordinate(p.x(), p.y()));
        List<IndexedWire> result = new ArrayList<>();
        for (IndexedWire candidate : index.queryNeighbors(point, tolerance)) {
            if (candidate.line().isWithinDistance(point, tolerance / 2)) {
                result.add(candidate);
            }
        }
        return result;
    }

    static GridKey key(Point p, double resolution) {
        return new GridKey(Math.round(p.x() / resolution), Math.round(p.y() / resolution));
    }
}
