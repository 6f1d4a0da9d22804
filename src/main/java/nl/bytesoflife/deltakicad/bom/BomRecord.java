package nl.bytesoflife.deltakicad.bom;

import java.util.List;

/**
 * Bill of materials for one design, entries sorted by value then footprint.
 */
public class BomRecord {

    private final String source;
    private final List<BomEntry> entries;

    public BomRecord(String source, List<BomEntry> entries) {
        this.source = source;
        this.entries = List.copyOf(entries);
    }

    public String getSource() {
        return source;
    }

    public List<BomEntry> getEntries() {
        return entries;
    }

    public int getTotalQuantity() {
        int total = 0;
        for (BomEntry entry : entries) {
            total += entry.quantity();
        }
        return total;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("BOM ").append(source).append(":\n");
        sb.append("  Lines: ").append(entries.size())
          .append(", parts: ").append(getTotalQuantity()).append("\n");
        for (BomEntry e : entries) {
            sb.append("  ").append(e.item()).append(". ")
              .append(e.quantity()).append(" x ").append(e.value())
              .append(" [").append(e.footprint()).append("] ")
              .append(String.join(", ", e.references())).append("\n");
        }
        return sb.toString();
    }
}
