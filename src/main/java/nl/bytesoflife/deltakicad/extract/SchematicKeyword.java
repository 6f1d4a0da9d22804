package nl.bytesoflife.deltakicad.extract;

/**
 * Top-level keywords of a {@code kicad_sch} file the extractor acts on.
 */
public enum SchematicKeyword {
    LIB_SYMBOLS("lib_symbols"),
    SYMBOL("symbol"),
    WIRE("wire"),
    JUNCTION("junction"),
    LABEL("label"),
    GLOBAL_LABEL("global_label"),
    HIERARCHICAL_LABEL("hierarchical_label"),
    SHEET("sheet"),
    UNRECOGNIZED("");

    private final String kicadName;

    SchematicKeyword(String kicadName) {
        this.kicadName = kicadName;
    }

    public static SchematicKeyword fromHead(String head) {
        for (SchematicKeyword keyword : values()) {
            if (keyword.kicadName.equals(head)) {
                return keyword;
            }
        }
        return UNRECOGNIZED;
    }
}
