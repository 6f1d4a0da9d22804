package nl.bytesoflife.deltakicad.diagram;

import java.util.Locale;

/**
 * Visual class of a net in a grouped diagram, guessed from its name.
 */
public enum NetClass {
    GROUND("stroke:#000000,stroke-width:2px"),
    POWER("stroke:#fa8c16,stroke-width:2px"),
    SIGNAL("stroke:#1890ff,stroke-width:1px");

    private final String style;

    NetClass(String style) {
        this.style = style;
    }

    public String style() {
        return style;
    }

    public static NetClass of(String netName) {
        String name = netName.toUpperCase(Locale.ROOT);
        if (name.contains("GND") || name.contains("VSS") || name.equals("0V")) {
            return GROUND;
        }
        if (name.startsWith("+") || name.contains("VCC") || name.contains("VDD")
                || name.contains("VBUS") || name.contains("VIN")) {
            return POWER;
        }
        return SIGNAL;
    }
}
