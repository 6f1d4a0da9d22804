package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.model.PinRef;
import nl.bytesoflife.deltakicad.model.schematic.Label;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the nets of a single schematic sheet.
 * <p>
 * Pins, wire end points, junctions and labels are joined in a union-find keyed
 * by grid-snapped coordinates. Each resulting set holding at least one pin is a
 * net, named by the last-applied label or, failing that, after its first pin.
 */
public class SchematicNetlistResolver {

    private static final Logger log = LoggerFactory.getLogger(SchematicNetlistResolver.class);

    private final ConnectivitySettings settings;

    public SchematicNetlistResolver() {
        this(ConnectivitySettings.defaults());
    }

    public SchematicNetlistResolver(ConnectivitySettings settings) {
        this.settings = settings;
    }

    public Netlist resolve(SchematicModel model) {
        ConnectionGraph graph = buildGraph(model);
        List<Net> nets = new ArrayList<>();
        List<NetConflict> conflicts = new ArrayList<>();

        for (ConnectionGraph.Group group : graph.groups()) {
            if (group.pins().isEmpty()) continue;

            Optional<Label> winner = group.winner();
            List<String> names = group.distinctNames();
            if (names.size() > 1) {
                NetConflict conflict = new NetConflict(winner.get().name(), names, PinRef.ROOT_SHEET);
                log.warn("{} ({})", conflict, model.source());
                conflicts.add(conflict);
            }
            String name = winner.map(Label::name).orElseGet(() -> Net.generatedName(group.pins().get(0)));
            nets.add(new Net(name, group.pins(), winner.isPresent()));
        }

        log.debug("Resolved {} nets ({} conflicts) for {}", nets.size(), conflicts.size(), model.source());
        return new Netlist(Netlist.sorted(nets), conflicts);
    }

    ConnectionGraph buildGraph(SchematicModel model) {
        return ConnectionGraph.build(model, settings.getSchematicResolutionMm());
    }
}
