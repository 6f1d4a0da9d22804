package nl.bytesoflife.deltakicad.bom;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceComparatorTest {

    @Test
    void numericSuffixesSortNumerically() {
        List<String> references = new ArrayList<>(List.of("R10", "U1", "R2", "C1", "R1", "R"));

        references.sort(ReferenceComparator.INSTANCE);

        assertEquals(List.of("C1", "R", "R1", "R2", "R10", "U1"), references);
    }

    @Test
    void longSuffixesDoNotOverflow() {
        assertTrue(ReferenceComparator.INSTANCE.compare("R99999999999999999998", "R99999999999999999999") < 0);
        assertTrue(ReferenceComparator.INSTANCE.compare("R100000000000000000000", "R9") > 0);
    }

    @Test
    void leadingZerosTieBreakOnText() {
        assertTrue(ReferenceComparator.INSTANCE.compare("R02", "R2") < 0);
        assertEquals(0, ReferenceComparator.INSTANCE.compare("R2", "R2"));
    }
}
