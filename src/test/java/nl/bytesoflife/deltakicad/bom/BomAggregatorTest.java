package nl.bytesoflife.deltakicad.bom;

import nl.bytesoflife.deltakicad.Fixtures;
import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.schematic.Mirror;
import nl.bytesoflife.deltakicad.model.schematic.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BomAggregatorTest {

    private final BomAggregator aggregator = new BomAggregator();

    private static Symbol part(String reference, String value, String footprint, int unit) {
        return new Symbol(reference, value, footprint, "Device:X", Point.ORIGIN, 0, Mirror.NONE, unit,
                true, false, "", "", List.of());
    }

    @Test
    void amplifierBom() {
        BomRecord bom = aggregator.aggregate(Fixtures.schematic("amplifier.kicad_sch"));

        assertEquals(3, bom.getEntries().size());
        assertEquals(5, bom.getTotalQuantity());

        BomEntry capacitors = bom.getEntries().get(0);
        assertEquals(1, capacitors.item());
        assertEquals("100n", capacitors.value());
        assertEquals(List.of("C1"), capacitors.references());

        BomEntry resistors = bom.getEntries().get(1);
        assertEquals(2, resistors.item());
        assertEquals("10k", resistors.value());
        assertEquals("Resistor_SMD:R_0603_1608Metric", resistors.footprint());
        assertEquals(List.of("R1", "R2", "R10"), resistors.references());
        assertEquals(3, resistors.quantity());
        assertEquals("~", resistors.datasheet());
        assertEquals("Resistor", resistors.description());

        BomEntry opamp = bom.getEntries().get(2);
        assertEquals("LM358", opamp.value());
        // two placed units, one part
        assertEquals(List.of("U3"), opamp.references());
    }

    @Test
    void powerSymbolsAndExcludedPartsAreLeftOut() {
        BomRecord bom = aggregator.aggregate(Fixtures.schematic("amplifier.kicad_sch"));

        for (BomEntry entry : bom.getEntries()) {
            assertFalse(entry.references().contains("#PWR01"));
            assertFalse(entry.references().contains("TP1"));
        }
    }

    @Test
    void boardBomSkipsExcludedFootprints() {
        BomRecord bom = aggregator.aggregate(Fixtures.pcb("board.kicad_pcb"));

        assertEquals(2, bom.getEntries().size());
        assertEquals(List.of("R1", "R2"), bom.getEntries().get(1).references());
        assertEquals(3, bom.getTotalQuantity());
    }

    @Test
    void keyIsTrimmedButCaseSensitive() {
        BomRecord bom = aggregator.aggregate("parts", List.of(
                part("R1", "10k ", "R_0603", 1),
                part("R2", "10k", " R_0603", 1),
                part("R3", "10K", "R_0603", 1)));

        assertEquals(2, bom.getEntries().size());
        assertEquals("10K", bom.getEntries().get(0).value());
        assertEquals(List.of("R1", "R2"), bom.getEntries().get(1).references());
    }

    @Test
    void quantitiesSumToDistinctReferences() {
        BomRecord bom = aggregator.aggregate("parts", List.of(
                part("U1", "LM324", "SOIC-14", 1),
                part("U1", "LM324", "SOIC-14", 2),
                part("U1", "LM324", "SOIC-14", 3),
                part("U1", "LM324", "SOIC-14", 4),
                part("C1", "100n", "C_0402", 1)));

        assertEquals(2, bom.getTotalQuantity());
        assertEquals(1, bom.getEntries().get(1).quantity());
    }

    @Test
    void emptyDesignGivesEmptyBom() {
        BomRecord bom = aggregator.aggregate("empty", List.of());

        assertTrue(bom.getEntries().isEmpty());
        assertEquals(0, bom.getTotalQuantity());
    }
}
