package nl.bytesoflife.deltakicad.project;

/**
 * Output projections of a design, with the suffix appended to the input's
 * base name when written to a file.
 */
public enum Projection {
    JSON(".json"),
    MERMAID(".mmd"),
    CLASS_DIAGRAM("_class.mmd"),
    BOM_CSV("_bom.csv"),
    BOM_MARKDOWN("_bom.md"),
    BOM_JSON("_bom.json");

    private final String fileSuffix;

    Projection(String fileSuffix) {
        this.fileSuffix = fileSuffix;
    }

    public String getFileSuffix() {
        return fileSuffix;
    }

    public String outputName(String inputFileName) {
        int dot = inputFileName.lastIndexOf('.');
        String base = dot > 0 ? inputFileName.substring(0, dot) : inputFileName;
        return base + fileSuffix;
    }
}
