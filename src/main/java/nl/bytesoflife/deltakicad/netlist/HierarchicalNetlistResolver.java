package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.model.ExtractionIssue;
import nl.bytesoflife.deltakicad.model.PinRef;
import nl.bytesoflife.deltakicad.model.schematic.Label;
import nl.bytesoflife.deltakicad.model.schematic.LabelKind;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;
import nl.bytesoflife.deltakicad.model.schematic.SheetPin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Resolves the nets of a hierarchical schematic.
 * <p>
 * Every sheet instance is first resolved on its own. The per-instance sets are
 * then joined: a sheet pin joins the parent set it touches with the child sets
 * carrying a hierarchical label of the same name, and global and power labels
 * join every set carrying the same name anywhere in the project.
 * <p>
 * Naming picks, in order: a global or power name; the name from the instance
 * closest to the root; the stronger label kind; the earlier instance; the
 * label applied last. Local names from a sub-sheet are qualified with its path,
 * e.g. {@code /Power/VIN}.
 */
public class HierarchicalNetlistResolver {

    private static final Logger log = LoggerFactory.getLogger(HierarchicalNetlistResolver.class);

    private final ConnectivitySettings settings;

    public HierarchicalNetlistResolver() {
        this(ConnectivitySettings.defaults());
    }

    public HierarchicalNetlistResolver(ConnectivitySettings settings) {
        this.settings = settings;
    }

    private record GroupKey(int instance, int group) {
    }

    private record GlobalName(String name) {
    }

    private record Candidate(String name, boolean global, int depth, LabelKind kind, int instance, int order,
                             String sheetPath) {
    }

    private static final Comparator<Candidate> PRECEDENCE = Comparator
            .comparing(Candidate::global)
            .thenComparing(Candidate::depth, Comparator.reverseOrder())
            .thenComparing(Candidate::kind)
            .thenComparing(Candidate::instance, Comparator.reverseOrder())
            .thenComparing(Candidate::order);

    public Netlist resolve(SchematicModel root, Map<String, SchematicModel> sheetsByFile) {
        List<ExtractionIssue> issues = new ArrayList<>();
        List<SheetInstance> instances = SheetInstance.expand(root, sheetsByFile, issues);
        for (ExtractionIssue issue : issues) {
            log.warn("{}", issue);
        }
        return resolve(instances);
    }

    public Netlist resolve(List<SheetInstance> instances) {
        double resolution = settings.getSchematicResolutionMm();
        List<ConnectionGraph> graphs = new ArrayList<>();
        Map<SheetInstance, Integer> indexOf = new IdentityHashMap<>();
        UnionFind<Object> sets = new UnionFind<>();

        for (SheetInstance instance : instances) {
            int i = graphs.size();
            ConnectionGraph graph = ConnectionGraph.build(instance.model(), resolution);
            graphs.add(graph);
            indexOf.put(instance, i);
            for (ConnectionGraph.Group group : graph.groups()) {
                GroupKey key = new GroupKey(i, group.index());
                sets.add(key);
                for (Label label : group.labels()) {
                    if (label.kind().isGlobal()) {
                        sets.union(key, new GlobalName(label.name()));
                    }
                }
            }
        }

        // sheet pins join parent and child sets
        for (SheetInstance instance : instances) {
            if (instance.isRoot()) continue;
            int child = indexOf.get(instance);
            int parent = indexOf.get(instance.parent());
            for (SheetPin pin : instance.sheet().pins()) {
                Optional<ConnectionGraph.Group> outer = graphs.get(parent).groupAt(pin.position());
                if (outer.isEmpty()) {
                    log.debug("Sheet pin {} of {} is not connected", pin.name(), instance.path());
                    continue;
                }
                for (ConnectionGraph.Group inner : graphs.get(child).groups()) {
                    if (inner.hasLabel(pin.name(), LabelKind.HIERARCHICAL)) {
                        sets.union(new GroupKey(parent, outer.get().index()), new GroupKey(child, inner.index()));
                    }
                }
            }
        }

        List<Net> nets = new ArrayList<>();
        List<NetConflict> conflicts = new ArrayList<>();
        for (List<Object> members : sets.groups().values()) {
            List<PinRef> pins = new ArrayList<>();
            List<Candidate> candidates = new ArrayList<>();
            Set<String> conflicting = new LinkedHashSet<>();
            Set<String> globalNames = new LinkedHashSet<>();

            for (Object member : members) {
                if (!(member instanceof GroupKey key)) continue;
                SheetInstance instance = instances.get(key.instance());
                ConnectionGraph.Group group = graphs.get(key.instance()).groups().get(key.group());
                for (PinRef pin : group.pins()) {
                    pins.add(pin.withSheetPath(instance.path()));
                }
                List<String> local = new ArrayList<>();
                for (int order = 0; order < group.labels().size(); order++) {
                    Label label = group.labels().get(order);
                    boolean global = label.kind().isGlobal();
                    String name = global ? label.name() : instance.qualify(label.name());
                    candidates.add(new Candidate(name, global, instance.depth(), label.kind(), key.instance(), order,
                            instance.path()));
                    if (!local.contains(name)) {
                        local.add(name);
                    }
                    if (global) {
                        globalNames.add(name);
                    }
                }
                if (local.size() > 1) {
                    conflicting.addAll(local);
                }
            }
            if (pins.isEmpty()) continue;
            Collections.sort(pins);
            if (globalNames.size() > 1) {
                conflicting.addAll(globalNames);
            }

            Optional<Candidate> winner = candidates.stream().max(PRECEDENCE);
            String name = winner.map(Candidate::name).orElseGet(() -> Net.generatedName(pins.get(0)));
            if (conflicting.size() > 1) {
                NetConflict conflict = new NetConflict(name, new ArrayList<>(conflicting), winner.get().sheetPath());
                log.warn("{}", conflict);
                conflicts.add(conflict);
            }
            nets.add(new Net(name, pins, winner.isPresent()));
        }

        log.debug("Resolved {} nets ({} conflicts) across {} sheet instances",
                nets.size(), conflicts.size(), instances.size());
        return new Netlist(Netlist.sorted(nets), conflicts);
    }
}
