package nl.bytesoflife.deltakicad.model.pcb;

/**
 * An entry of the board's layer table, e.g. {@code (0 "F.Cu" signal)}.
 */
public record Layer(int ordinal, String name, String type) {

    public boolean isCopper() {
        return name.endsWith(".Cu");
    }
}
