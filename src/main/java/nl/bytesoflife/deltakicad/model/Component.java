package nl.bytesoflife.deltakicad.model;

/**
 * A placed part: a schematic symbol or a board footprint.
 */
public interface Component {

    String reference();

    String value();

    String footprint();

    /**
     * Library item the part was placed from: the symbol lib_id or the footprint name.
     */
    String libraryId();

    String datasheet();

    String description();

    /**
     * Whether the part belongs on the bill of materials.
     */
    boolean inBom();

    /**
     * Whether the part only exists on the schematic, like a power symbol.
     */
    default boolean isVirtual() {
        return false;
    }
}
