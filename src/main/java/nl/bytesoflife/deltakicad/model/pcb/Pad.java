package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.model.Point;

import java.util.List;

/**
 * A footprint pad. {@code offset} is relative to the footprint origin before
 * rotation; {@code position} is the board coordinate. {@code layers} holds
 * concrete layer names with wildcards already expanded.
 */
public record Pad(String owner, String number, String type, String shape,
                  Point offset, Point position, double width, double height, double rotation,
                  List<String> layers, int netCode, String netName) {

    public Pad {
        layers = List.copyOf(layers);
    }

    public boolean isOnLayer(String layer) {
        return layers.contains(layer);
    }
}
