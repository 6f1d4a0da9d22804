package nl.bytesoflife.deltakicad.bom;

/**
 * Writes a BOM as a Markdown table under a heading naming the source file.
 */
public class BomMarkdownWriter {

    public String write(BomRecord bom) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Bill of Materials: ").append(fileName(bom.getSource())).append("\n\n");
        sb.append("| Item | Quantity | References | Value | Footprint | Datasheet | Description |\n");
        sb.append("|------|----------|------------|-------|-----------|-----------|-------------|\n");
        for (BomEntry e : bom.getEntries()) {
            sb.append("| ").append(e.item())
              .append(" | ").append(e.quantity())
              .append(" | ").append(cell(String.join(", ", e.references())))
              .append(" | ").append(cell(e.value()))
              .append(" | ").append(cell(e.footprint()))
              .append(" | ").append(cell(e.datasheet()))
              .append(" | ").append(cell(e.description()))
              .append(" |\n");
        }
        return sb.toString();
    }

    private static String cell(String value) {
        return value.replace("|", "\\|").replace("\n", " ");
    }

    private static String fileName(String source) {
        int slash = Math.max(source.lastIndexOf('/'), source.lastIndexOf('\\'));
        return source.substring(slash + 1);
    }
}
