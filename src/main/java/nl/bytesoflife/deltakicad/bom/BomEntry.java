package nl.bytesoflife.deltakicad.bom;

import java.util.List;

/**
 * One BOM line: parts sharing a (value, footprint) key. {@code quantity} is
 * always the number of distinct references.
 */
public record BomEntry(int item, String value, String footprint, List<String> references,
                       String datasheet, String description) {

    public BomEntry {
        references = List.copyOf(references);
    }

    public int quantity() {
        return references.size();
    }
}
