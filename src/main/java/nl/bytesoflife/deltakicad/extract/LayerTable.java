package nl.bytesoflife.deltakicad.extract;

import nl.bytesoflife.deltakicad.model.pcb.Layer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The layers declared by a board file, in stack order. Resolves the layer
 * expressions used by pads and vias to concrete layer names.
 */
public class LayerTable {

    private final Map<String, Layer> layers = new LinkedHashMap<>();

    public void add(Layer layer) {
        layers.put(layer.name(), layer);
    }

    public List<Layer> getLayers() {
        return List.copyOf(layers.values());
    }

    /**
     * Resolves one layer expression: a concrete name, a wildcard such as
     * {@code *.Cu}, or the {@code F&B.Cu} shorthand.
     *
     * @throws ExtractionException if a concrete name is not declared
     */
    public List<String> resolve(String expression, String reference, int line) {
        String expr = expression.trim();
        List<String> result = new ArrayList<>();

        if (expr.startsWith("F&B.")) {
            String suffix = expr.substring(4);
            result.addAll(resolve("F." + suffix, reference, line));
            result.addAll(resolve("B." + suffix, reference, line));
            return result;
        }

        // Wildcard support: "*.Cu" matches "F.Cu", "In1.Cu", "B.Cu"
        if (expr.contains("?") || expr.contains("*")) {
            String regex = expr.replace(".", "\\.").replace("?", ".").replace("*", ".*");
            for (String name : layers.keySet()) {
                if (name.matches(regex)) {
                    result.add(name);
                }
            }
            return result;
        }

        if (!layers.containsKey(expr)) {
            throw ExtractionException.unknownLayer(expr, reference, line);
        }
        result.add(expr);
        return result;
    }

    public List<String> resolveAll(List<String> expressions, String reference, int line) {
        List<String> result = new ArrayList<>();
        for (String expression : expressions) {
            for (String name : resolve(expression, reference, line)) {
                if (!result.contains(name)) {
                    result.add(name);
                }
            }
        }
        return result;
    }

    /**
     * Copper layers from {@code from} to {@code to} inclusive, in stack order.
     */
    public List<String> copperSpan(String from, String to, String reference, int line) {
        resolve(from, reference, line);
        resolve(to, reference, line);
        List<String> copper = new ArrayList<>();
        for (Layer layer : layers.values()) {
            if (layer.isCopper()) {
                copper.add(layer.name());
            }
        }
        int a = copper.indexOf(from);
        int b = copper.indexOf(to);
        if (a < 0 || b < 0) {
            List<String> ends = new ArrayList<>();
            ends.add(from);
            if (!from.equals(to)) ends.add(to);
            return ends;
        }
        return new ArrayList<>(copper.subList(Math.min(a, b), Math.max(a, b) + 1));
    }
}
