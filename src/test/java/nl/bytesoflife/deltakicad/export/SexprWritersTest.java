package nl.bytesoflife.deltakicad.export;

import nl.bytesoflife.deltakicad.Fixtures;
import nl.bytesoflife.deltakicad.extract.PcbExtractor;
import nl.bytesoflife.deltakicad.extract.SchematicExtractor;
import nl.bytesoflife.deltakicad.model.pcb.PcbModel;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;
import nl.bytesoflife.deltakicad.netlist.PcbNetlistResolver;
import nl.bytesoflife.deltakicad.netlist.SchematicNetlistResolver;
import nl.bytesoflife.deltakicad.sexpr.SExpressionParser;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SexprWritersTest {

    @Test
    void schematicExtractsBackToTheSameDesign() {
        SchematicModel original = Fixtures.schematic("amplifier.kicad_sch");
        String written = new SchematicSexprWriter().write(original);
        SchematicModel reread = new SchematicExtractor().extract(written, "amplifier.kicad_sch");

        assertEquals(original.symbols(), reread.symbols());
        assertEquals(original.wires(), reread.wires());
        assertEquals(original.labels(), reread.labels());

        SchematicNetlistResolver resolver = new SchematicNetlistResolver();
        assertEquals(resolver.resolve(original), resolver.resolve(reread));
    }

    @Test
    void schematicWriterRebuildsLibraryUnits() {
        SNode.SList tree = new SchematicSexprWriter().toTree(Fixtures.schematic("amplifier.kicad_sch"));

        SNode.SList library = tree.find("lib_symbols").orElseThrow();
        SNode.SList opamp = library.findAll("symbol").stream()
                .filter(s -> s.atomAt(1).orElse("").equals("Amplifier_Operational:LM358"))
                .findFirst().orElseThrow();
        assertEquals(2, opamp.findAll("symbol").size());
        SNode.SList ground = library.findAll("symbol").stream()
                .filter(s -> s.atomAt(1).orElse("").equals("power:GND"))
                .findFirst().orElseThrow();
        assertTrue(ground.find("power").isPresent());
        // power labels come back from the power symbol
        assertEquals(1, tree.findAll("label").size());
    }

    @Test
    void boardExtractsBackToTheSameDesign() {
        PcbModel original = Fixtures.pcb("board.kicad_pcb");
        String written = new PcbSexprWriter().write(original);
        PcbModel reread = new PcbExtractor().extract(written, "board.kicad_pcb");

        assertEquals(original.layers(), reread.layers());
        assertEquals(original.nets(), reread.nets());
        assertEquals(original.footprints(), reread.footprints());
        assertEquals(original.tracks(), reread.tracks());
        assertEquals(original.vias(), reread.vias());
        assertEquals(original.zones(), reread.zones());

        PcbNetlistResolver resolver = new PcbNetlistResolver();
        assertEquals(resolver.resolve(original), resolver.resolve(reread));
    }

    @Test
    void writtenBoardIsAWellFormedDocument() {
        String written = new PcbSexprWriter().write(Fixtures.pcb("board.kicad_pcb"));
        SNode.SList root = new SExpressionParser().parseDocument(written);

        assertEquals("kicad_pcb", root.head());
        assertEquals(4, root.findAll("footprint").size());
        assertEquals(7, root.findAll("segment").size());
        assertEquals(2, root.findAll("via").size());
        assertEquals(1, root.findAll("zone").size());
    }
}
