package nl.bytesoflife.deltakicad.diagram;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse part category derived from the alphabetic prefix of a reference
 * designator, used to group diagram nodes.
 */
public enum ComponentCategory {
    CONNECTOR("Connectors and Headers", Set.of("J", "P", "CN", "X")),
    POWER("Power Supply", Set.of("BT", "F", "PS", "VR")),
    PASSIVE("Passive Components", Set.of("R", "C", "L", "FB", "RN", "Y")),
    ACTIVE("Active Components", Set.of("U", "IC", "Q", "D", "LED", "T")),
    OTHER("Other Components", Set.of());

    private final String title;
    private final Set<String> prefixes;

    ComponentCategory(String title, Set<String> prefixes) {
        this.title = title;
        this.prefixes = prefixes;
    }

    public String title() {
        return title;
    }

    public static ComponentCategory of(String reference) {
        int end = 0;
        while (end < reference.length() && Character.isLetter(reference.charAt(end))) {
            end++;
        }
        String prefix = reference.substring(0, end).toUpperCase(Locale.ROOT);
        for (ComponentCategory category : values()) {
            if (category.prefixes.contains(prefix)) {
                return category;
            }
        }
        return OTHER;
    }
}
