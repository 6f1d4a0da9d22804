package nl.bytesoflife.deltakicad.model.pcb;

import nl.bytesoflife.deltakicad.model.DesignModel;
import nl.bytesoflife.deltakicad.model.ExtractionIssue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record PcbModel(String source, List<Layer> layers, Map<Integer, String> nets,
                       List<Footprint> footprints, List<Track> tracks, List<Via> vias,
                       List<Zone> zones, List<ExtractionIssue> issues) implements DesignModel {

    public PcbModel {
        layers = List.copyOf(layers);
        nets = Collections.unmodifiableSortedMap(new TreeMap<>(nets));
        footprints = List.copyOf(footprints);
        tracks = List.copyOf(tracks);
        vias = List.copyOf(vias);
        zones = List.copyOf(zones);
        issues = List.copyOf(issues);
    }

    @Override
    public List<Footprint> components() {
        return footprints;
    }

    public List<Pad> pads() {
        List<Pad> pads = new ArrayList<>();
        for (Footprint footprint : footprints) {
            pads.addAll(footprint.pads());
        }
        return pads;
    }

    public List<String> copperLayers() {
        return layers.stream()
                .filter(Layer::isCopper)
                .map(Layer::name)
                .toList();
    }
}
