package nl.bytesoflife.deltakicad.netlist;

import java.util.List;

/**
 * Two or more different explicit names were given to one connected set.
 * The net is still produced under {@code winner}; {@code names} lists every
 * distinct name in the order it was applied.
 */
public record NetConflict(String winner, List<String> names, String sheetPath) {

    public NetConflict {
        names = List.copyOf(names);
    }

    @Override
    public String toString() {
        return "Net name conflict in " + sheetPath + ": " + names + " resolved to '" + winner + "'";
    }
}
