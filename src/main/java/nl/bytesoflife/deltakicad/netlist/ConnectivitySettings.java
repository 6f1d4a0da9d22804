package nl.bytesoflife.deltakicad.netlist;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Tolerances and policies used when resolving connectivity.
 * <ul>
 *   <li>{@code schematicResolutionMm}: grid the schematic coordinates are snapped to
 *       before comparison (KiCad stores schematics in 100 nm units)</li>
 *   <li>{@code pcbToleranceMm}: distance under which two board items touch</li>
 *   <li>{@code padToPadConnectivity}: whether pads whose centres coincide on a
 *       shared copper layer connect without a track</li>
 * </ul>
 */
public class ConnectivitySettings {

    static final String RESOURCE = "/delta-kicad/connectivity.properties";

    private static volatile ConnectivitySettings cachedDefaults;

    private double schematicResolutionMm = 0.0001;
    private double pcbToleranceMm = 0.001;
    private boolean padToPadConnectivity = true;

    /**
     * Defaults bundled as a classpath resource. Returns a fresh copy so callers
     * can adjust it.
     */
    public static ConnectivitySettings defaults() {
        if (cachedDefaults == null) {
            synchronized (ConnectivitySettings.class) {
                if (cachedDefaults == null) {
                    cachedDefaults = loadDefaults();
                }
            }
        }
        return cachedDefaults.copy();
    }

    public static ConnectivitySettings fromProperties(Properties properties) {
        ConnectivitySettings settings = new ConnectivitySettings();
        String resolution = properties.getProperty("schematic.resolution.mm");
        if (resolution != null) {
            settings.withSchematicResolutionMm(Double.parseDouble(resolution.trim()));
        }
        String tolerance = properties.getProperty("pcb.tolerance.mm");
        if (tolerance != null) {
            settings.withPcbToleranceMm(Double.parseDouble(tolerance.trim()));
        }
        String padToPad = properties.getProperty("pcb.pad-to-pad");
        if (padToPad != null) {
            settings.withPadToPadConnectivity(Boolean.parseBoolean(padToPad.trim()));
        }
        return settings;
    }

    private static ConnectivitySettings loadDefaults() {
        try (InputStream is = ConnectivitySettings.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                return new ConnectivitySettings();
            }
            Properties properties = new Properties();
            properties.load(is);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + RESOURCE, e);
        }
    }

    public ConnectivitySettings withSchematicResolutionMm(double resolution) {
        if (resolution <= 0) {
            throw new IllegalArgumentException("Schematic resolution must be positive: " + resolution);
        }
        this.schematicResolutionMm = resolution;
        return this;
    }

    public ConnectivitySettings withPcbToleranceMm(double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("PCB tolerance must not be negative: " + tolerance);
        }
        this.pcbToleranceMm = tolerance;
        return this;
    }

    public ConnectivitySettings withPadToPadConnectivity(boolean enabled) {
        this.padToPadConnectivity = enabled;
        return this;
    }

    public double getSchematicResolutionMm() {
        return schematicResolutionMm;
    }

    public double getPcbToleranceMm() {
        return pcbToleranceMm;
    }

    public boolean isPadToPadConnectivity() {
        return padToPadConnectivity;
    }

    private ConnectivitySettings copy() {
        return new ConnectivitySettings()
                .withSchematicResolutionMm(schematicResolutionMm)
                .withPcbToleranceMm(pcbToleranceMm)
                .withPadToPadConnectivity(padToPadConnectivity);
    }
}
