package nl.bytesoflife.deltakicad.diagram;

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
 * Renders a design as a Mermaid {@code classDiagram} with one class per
 * library item (symbol lib_id or footprint name). Each class lists the
 * references placed from it with their values. Two classes are related when a
 * net connects parts of both; the relation is labelled with those net names.
 * Virtual parts are left out. Classes, members and relations are sorted.
 */
public class MermaidClassDiagramExporter {

    private static final Logger log = LoggerFactory.getLogger(MermaidClassDiagramExporter.class);

    static final String UNKNOWN = "Unknown";

    private record Relation(String from, String to) {
    }

    public String export(DesignModel model, Netlist netlist) {
        SortedMap<String, SortedMap<String, String>> types = groupByType(model);

        Map<String, String> typeOfReference = new HashMap<>();
        Map<String, String> classNames = new HashMap<>();
        Set<String> usedNames = new HashSet<>();
        for (Map.Entry<String, SortedMap<String, String>> type : types.entrySet()) {
            classNames.put(type.getKey(), uniqueName(MermaidExporter.sanitize(type.getKey()), usedNames));
            for (String reference : type.getValue().keySet()) {
                typeOfReference.put(reference, type.getKey());
            }
        }

        Map<Relation, SortedSet<String>> relations = new TreeMap<>(
                Comparator.comparing(Relation::from).thenComparing(Relation::to));
        for (Net net : netlist.nets()) {
            SortedSet<String> connected = new TreeSet<>();
            for (PinRef pin : net.pins()) {
                String type = typeOfReference.get(pin.reference());
                if (type != null && PinRef.ROOT_SHEET.equals(pin.sheetPath())) {
                    connected.add(classNames.get(type));
                }
            }
            List<String> names = new ArrayList<>(connected);
            for (int i = 0; i < names.size(); i++) {
                for (int j = i + 1; j < names.size(); j++) {
                    relations.computeIfAbsent(new Relation(names.get(i), names.get(j)), r -> new TreeSet<>())
                            .add(net.name());
                }
            }
        }

        StringBuilder sb = new StringBuilder("classDiagram\n");
        sb.append("    %% ").append(model.source()).append('\n');
        sb.append("    %% Types: ").append(types.size())
          .append(", Components: ").append(typeOfReference.size()).append('\n');
        for (Map.Entry<String, SortedMap<String, String>> type : types.entrySet()) {
            sb.append("    class ").append(classNames.get(type.getKey())).append(" {\n");
            sb.append("        <<").append(member(type.getKey())).append(">>\n");
            for (Map.Entry<String, String> instance : type.getValue().entrySet()) {
                sb.append("        +").append(member(instance.getKey()));
                if (!instance.getValue().isEmpty()) {
                    sb.append(": ").append(member(instance.getValue()));
                }
                sb.append('\n');
            }
            sb.append("    }\n");
        }
        for (Map.Entry<Relation, SortedSet<String>> relation : relations.entrySet()) {
            sb.append("    ").append(relation.getKey().from()).append(" -- ").append(relation.getKey().to())
              .append(" : ").append(member(String.join(", ", relation.getValue()))).append('\n');
        }

        log.debug("Class diagram for {}: {} classes, {} relations", model.source(), types.size(), relations.size());
        return sb.toString();
    }

    /**
     * Number of distinct parts per library item, sorted by library item.
     */
    public SortedMap<String, Integer> componentTypes(DesignModel model) {
        SortedMap<String, Integer> counts = new TreeMap<>();
        groupByType(model).forEach((type, instances) -> counts.put(type, instances.size()));
        return counts;
    }

    /**
     * Library item to (reference to value), each reference once.
     */
    private static SortedMap<String, SortedMap<String, String>> groupByType(DesignModel model) {
        SortedMap<String, SortedMap<String, String>> types = new TreeMap<>();
        for (Component component : model.components()) {
            if (component.isVirtual()) continue;
            String type = component.libraryId().isBlank() ? UNKNOWN : component.libraryId().trim();
            types.computeIfAbsent(type, t -> new TreeMap<>(ReferenceComparator.INSTANCE))
                 .putIfAbsent(component.reference(), component.value().trim());
        }
        return types;
    }

    private static String uniqueName(String base, Set<String> used) {
        String name = base;
        int suffix = 2;
        while (!used.add(name)) {
            name = base + "_" + suffix++;
        }
        return name;
    }

    // braces and newlines end a class body
    private static String member(String text) {
        return text.replaceAll("[{}\\r\\n]", "_");
    }
}
