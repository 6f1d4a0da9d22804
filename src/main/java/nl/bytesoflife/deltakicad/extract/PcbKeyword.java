package nl.bytesoflife.deltakicad.extract;

/**
 * Top-level keywords of a {@code kicad_pcb} file the extractor acts on.
 * {@code module} is the pre-6.0 name of {@code footprint}.
 */
public enum PcbKeyword {
    LAYERS,
    NET,
    FOOTPRINT,
    SEGMENT,
    ARC,
    VIA,
    ZONE,
    UNRECOGNIZED;

    public static PcbKeyword fromHead(String head) {
        return switch (head) {
            case "layers" -> LAYERS;
            case "net" -> NET;
            case "footprint", "module" -> FOOTPRINT;
            case "segment", "track" -> SEGMENT;
            case "arc" -> ARC;
            case "via" -> VIA;
            case "zone" -> ZONE;
            default -> UNRECOGNIZED;
        };
    }
}
