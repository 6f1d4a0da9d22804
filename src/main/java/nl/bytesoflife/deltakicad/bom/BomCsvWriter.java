package nl.bytesoflife.deltakicad.bom;

/**
 * Writes a BOM as RFC 4180 CSV with a header row.
 */
public class BomCsvWriter {

    private static final String HEADER = "Item,Quantity,References,Value,Footprint,Datasheet,Description";

    public String write(BomRecord bom) {
        StringBuilder sb = new StringBuilder(HEADER).append("\r\n");
        for (BomEntry e : bom.getEntries()) {
            sb.append(e.item()).append(',')
              .append(e.quantity()).append(',')
              .append(field(String.join(", ", e.references()))).append(',')
              .append(field(e.value())).append(',')
              .append(field(e.footprint())).append(',')
              .append(field(e.datasheet())).append(',')
              .append(field(e.description())).append("\r\n");
        }
        return sb.toString();
    }

    static String field(String value) {
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0
                && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
