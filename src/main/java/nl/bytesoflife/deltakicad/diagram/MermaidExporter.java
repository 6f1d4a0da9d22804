package nl.bytesoflife.deltakicad.diagram;

import nl.bytesoflife.deltakicad.bom.BomAggregator;
import nl.bytesoflife.deltakicad.bom.BomEntry;
import nl.bytesoflife.deltakicad.bom.BomRecord;
import nl.bytesoflife.deltakicad.bom.ReferenceComparator;
import nl.bytesoflife.deltakicad.model.Component;
import nl.bytesoflife.deltakicad.model.DesignModel;
import nl.bytesoflife.deltakicad.model.PinRef;
import nl.bytesoflife.deltakicad.netlist.Net;
import nl.bytesoflife.deltakicad.netlist.Netlist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Renders a design and its nets as a Mermaid {@code flowchart LR}.
 * <p>
 * Nodes are declared in BOM order, followed by parts left off the BOM in
 * reference order. A net between exactly two pins on two parts becomes one
 * labelled edge; a larger net becomes a circle node with an edge from every
 * part on it. Virtual parts (power symbols) and nets touching a single part
 * are not drawn. The output depends only on the input, never on hash or
 * declaration order.
 */
public class MermaidExporter {

    private static final Logger log = LoggerFactory.getLogger(MermaidExporter.class);

    private boolean grouped;

    /**
     * Place nodes in subgraphs per {@link ComponentCategory} and colour edges per {@link NetClass}.
     */
    public MermaidExporter withGrouping(boolean enabled) {
        this.grouped = enabled;
        return this;
    }

    private record Node(String id, String reference, String label) {
    }

    public String export(DesignModel model, Netlist netlist) {
        Map<String, Node> nodes = declareNodes(model);
        Set<String> usedIds = new HashSet<>();
        for (Node node : nodes.values()) {
            usedIds.add(node.id());
        }

        List<String> edges = new ArrayList<>();
        List<NetClass> edgeClasses = new ArrayList<>();
        List<String> starNodes = new ArrayList<>();
        for (Net net : netlist.nets()) {
            List<String> owners = new ArrayList<>();
            for (PinRef pin : net.pins()) {
                Node node = nodes.get(pin.reference());
                if (node != null && PinRef.ROOT_SHEET.equals(pin.sheetPath()) && !owners.contains(node.id())) {
                    owners.add(node.id());
                }
            }
            if (owners.size() < 2) continue;

            NetClass netClass = NetClass.of(net.name());
            if (net.pins().size() == 2) {
                edges.add(owners.get(0) + " -->|" + quote(net.name()) + "| " + owners.get(1));
                edgeClasses.add(netClass);
            } else {
                String hub = uniqueId("N_" + sanitize(net.name()), usedIds);
                starNodes.add(hub + "((" + quote(net.name()) + "))");
                for (String owner : owners) {
                    edges.add(owner + " --> " + hub);
                    edgeClasses.add(netClass);
                }
            }
        }

        StringBuilder sb = new StringBuilder("flowchart LR\n");
        sb.append("    %% ").append(model.source()).append('\n');
        sb.append("    %% Components: ").append(nodes.size())
          .append(", Nets: ").append(netlist.nets().size()).append('\n');
        if (grouped) {
            appendGroupedNodes(sb, nodes.values());
        } else {
            for (Node node : nodes.values()) {
                sb.append("    ").append(node.id()).append('[').append(quote(node.label())).append("]\n");
            }
        }
        for (String star : starNodes) {
            sb.append("    ").append(star).append('\n');
        }
        for (String edge : edges) {
            sb.append("    ").append(edge).append('\n');
        }
        if (grouped) {
            appendLinkStyles(sb, edgeClasses);
        }

        log.debug("Diagram for {}: {} nodes, {} net hubs, {} edges",
                model.source(), nodes.size(), starNodes.size(), edges.size());
        return sb.toString();
    }

    /**
     * Nodes keyed by reference, in output order.
     */
    private Map<String, Node> declareNodes(DesignModel model) {
        Map<String, Component> byReference = new HashMap<>();
        for (Component component : model.components()) {
            if (!component.isVirtual()) {
                byReference.putIfAbsent(component.reference(), component);
            }
        }

        List<String> order = new ArrayList<>();
        BomRecord bom = new BomAggregator().aggregate(model);
        for (BomEntry entry : bom.getEntries()) {
            order.addAll(entry.references());
        }
        List<String> remaining = new ArrayList<>(byReference.keySet());
        remaining.removeAll(order);
        remaining.sort(ReferenceComparator.INSTANCE);
        order.addAll(remaining);

        Map<String, Node> nodes = new LinkedHashMap<>();
        Set<String> usedIds = new HashSet<>();
        for (String reference : order) {
            Component component = byReference.get(reference);
            if (component == null) continue;
            String label = component.value().isEmpty() ? reference : reference + ": " + component.value();
            nodes.put(reference, new Node(uniqueId(sanitize(reference), usedIds), reference, label));
        }
        return nodes;
    }

    private static void appendGroupedNodes(StringBuilder sb, Collection<Node> nodes) {
        Map<ComponentCategory, List<Node>> byCategory = new EnumMap<>(ComponentCategory.class);
        for (Node node : nodes) {
            byCategory.computeIfAbsent(ComponentCategory.of(node.reference()), c -> new ArrayList<>()).add(node);
        }
        for (Map.Entry<ComponentCategory, List<Node>> entry : byCategory.entrySet()) {
            String group = "G_" + entry.getKey().name();
            sb.append("    subgraph ").append(group).append('[').append(quote(entry.getKey().title())).append("]\n");
            for (Node node : entry.getValue()) {
                sb.append("        ").append(node.id()).append('[').append(quote(node.label())).append("]\n");
            }
            sb.append("    end\n");
        }
    }

    private static void appendLinkStyles(StringBuilder sb, List<NetClass> edgeClasses) {
        Map<NetClass, List<String>> indices = new EnumMap<>(NetClass.class);
        for (int i = 0; i < edgeClasses.size(); i++) {
            indices.computeIfAbsent(edgeClasses.get(i), c -> new ArrayList<>()).add(String.valueOf(i));
        }
        for (Map.Entry<NetClass, List<String>> entry : indices.entrySet()) {
            sb.append("    linkStyle ").append(String.join(",", entry.getValue()))
              .append(' ').append(entry.getKey().style()).append('\n');
        }
    }

    static String sanitize(String text) {
        String id = text.replaceAll("[^A-Za-z0-9_]", "_");
        if (id.isEmpty() || Character.isDigit(id.charAt(0))) {
            id = "_" + id;
        }
        return id;
    }

    private static String uniqueId(String base, Set<String> used) {
        String id = base;
        int suffix = 2;
        while (!used.add(id)) {
            id = base + "_" + suffix++;
        }
        return id;
    }

    private static String quote(String text) {
        return '"' + text.replace("\"", "#quot;") + '"';
    }
}
