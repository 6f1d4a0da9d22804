package nl.bytesoflife.deltakicad.model.schematic;

public enum Mirror {
    NONE,
    /** Mirrored about the horizontal axis (Y flipped). */
    X,
    /** Mirrored about the vertical axis (X flipped). */
    Y;

    public static Mirror fromKicadName(String name) {
        if (name == null) return NONE;
        return switch (name) {
            case "x" -> X;
            case "y" -> Y;
            default -> NONE;
        };
    }
}
