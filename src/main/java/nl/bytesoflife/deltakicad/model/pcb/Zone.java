package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.model.Point;

import java.util.List;

public record Zone(int netCode, String netName, List<String> layers, List<Point> outline) {

    public Zone {
        layers = List.copyOf(layers);
        outline = List.copyOf(outline);
    }
}
