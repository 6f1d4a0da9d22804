package nl.bytesoflife.deltakicad.model.schematic;

/**
 * Label scope, in increasing naming precedence.
 */
public enum LabelKind {
    LOCAL,
    HIERARCHICAL,
    GLOBAL,
    /** Implicit label placed by a power symbol, named by its value. */
    POWER;

    public boolean isGlobal() {
        return this == GLOBAL || this == POWER;
    }
}
