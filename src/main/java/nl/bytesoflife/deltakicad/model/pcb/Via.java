package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.model.Point;

import java.util.List;

/**
 * A via. {@code layers} lists every copper layer the via spans, not only the
 * two end layers named in the file.
 */
public record Via(Point position, double size, double drill, List<String> layers, int netCode) {

    public Via {
        layers = List.copyOf(layers);
    }
}
