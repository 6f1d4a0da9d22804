package nl.bytesoflife.deltakicad.model.schematic;

import nl.bytesoflife.deltakicad.model.DesignModel;
import nl.bytesoflife.deltakicad.model.ExtractionIssue;

import java.util.ArrayList;
import java.util.List;

public record SchematicModel(String source, List<Symbol> symbols, List<Wire> wires,
                             List<Label> labels, List<Junction> junctions, List<Sheet> sheets,
                             List<ExtractionIssue> issues) implements DesignModel {

    public SchematicModel {
        symbols = List.copyOf(symbols);
        wires = List.copyOf(wires);
        labels = List.copyOf(labels);
        junctions = List.copyOf(junctions);
        sheets = List.copyOf(sheets);
        issues = List.copyOf(issues);
    }

    @Override
    public List<Symbol> components() {
        return symbols;
    }

    public List<Pin> pins() {
        List<Pin> pins = new ArrayList<>();
        for (Symbol symbol : symbols) {
            pins.addAll(symbol.pins());
        }
        return pins;
    }
}
