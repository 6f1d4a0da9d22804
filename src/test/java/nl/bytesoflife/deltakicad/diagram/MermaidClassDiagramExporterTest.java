package nl.bytesoflife.deltakicad.diagram;

import nl.bytesoflife.deltakicad.Fixtures;
import nl.bytesoflife.deltakicad.model.pcb.PcbModel;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;
import nl.bytesoflife.deltakicad.model.schematic.Symbol;
import nl.bytesoflife.deltakicad.netlist.PcbNetlistResolver;
import nl.bytesoflife.deltakicad.netlist.SchematicNetlistResolver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MermaidClassDiagramExporterTest {

    private final MermaidClassDiagramExporter exporter = new MermaidClassDiagramExporter();

    private String diagram(SchematicModel model) {
        return exporter.export(model, new SchematicNetlistResolver().resolve(model));
    }

    @Test
    void amplifierClassDiagram() {
        String expected = """
                classDiagram
                    %% amplifier.kicad_sch
                    %% Types: 4, Components: 6
                    class Amplifier_Operational_LM358 {
                        <<Amplifier_Operational:LM358>>
                        +U3: LM358
                    }
                    class Connector_TestPoint {
                        <<Connector:TestPoint>>
                        +TP1: TestPoint
                    }
                    class Device_C {
                        <<Device:C>>
                        +C1: 100n
                    }
                    class Device_R {
                        <<Device:R>>
                        +R1: 10k
                        +R2: 10k
                        +R10: 10k
                    }
                    Amplifier_Operational_LM358 -- Connector_TestPoint : Net-(TP1-1)
                    Device_C -- Device_R : Net-(C1-2)
                """;
        assertEquals(expected, diagram(Fixtures.schematic("amplifier.kicad_sch")));
    }

    @Test
    void boardClassesAreFootprints() {
        PcbModel board = Fixtures.pcb("board.kicad_pcb");

        String mermaid = exporter.export(board, new PcbNetlistResolver().resolve(board));

        assertTrue(mermaid.startsWith("classDiagram\n"));
        assertTrue(mermaid.contains("    %% Types: 3, Components: 4\n"));
        assertTrue(mermaid.contains("""
                    class Resistor_SMD_R_0603_1608Metric {
                        <<Resistor_SMD:R_0603_1608Metric>>
                        +R1: 10k
                        +R2: 10k
                    }
                """));
        assertTrue(mermaid.contains("+J1: Conn_01x01\n"));
        assertTrue(mermaid.contains(
                "    Capacitor_SMD_C_0603_1608Metric -- Resistor_SMD_R_0603_1608Metric : GND, VCC\n"));
    }

    @Test
    void componentTypesCountEachReferenceOnce() {
        assertEquals(Map.of(
                        "Amplifier_Operational:LM358", 1,
                        "Connector:TestPoint", 1,
                        "Device:C", 1,
                        "Device:R", 3),
                exporter.componentTypes(Fixtures.schematic("amplifier.kicad_sch")));
        assertEquals(Map.of("Amplifier_Operational:Dual", 1),
                exporter.componentTypes(Fixtures.schematic("dual_opamp.kicad_sch")));
    }

    @Test
    void boardComponentTypesAreSortedByFootprint() {
        assertEquals(List.of(
                        "Capacitor_SMD:C_0603_1608Metric",
                        "Connector_PinHeader_2.54mm:PinHeader_1x01_P2.54mm_Vertical",
                        "Resistor_SMD:R_0603_1608Metric"),
                new ArrayList<>(exporter.componentTypes(Fixtures.pcb("board.kicad_pcb")).keySet()));
    }

    @Test
    void outputDoesNotDependOnDeclarationOrder() {
        SchematicModel model = Fixtures.schematic("amplifier.kicad_sch");
        List<Symbol> symbols = new ArrayList<>(model.symbols());
        Collections.reverse(symbols);
        SchematicModel reversed = new SchematicModel(model.source(), symbols, model.wires(), model.labels(),
                model.junctions(), model.sheets(), model.issues());

        assertEquals(diagram(model), diagram(reversed));
    }
}
