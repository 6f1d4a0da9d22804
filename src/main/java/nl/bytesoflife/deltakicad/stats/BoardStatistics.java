package nl.bytesoflife.deltakicad.stats;

import java.util.Map;
import java.util.TreeMap;

/**
 * Summary counts of a board. Maps are keyed by layer name in natural order.
 */
public class BoardStatistics {

    private final Map<String, Integer> componentsByLayer = new TreeMap<>();
    private final Map<String, Integer> tracksByLayer = new TreeMap<>();
    private final Map<String, Double> trackLengthByLayer = new TreeMap<>();
    private final Map<String, Integer> zonesByLayer = new TreeMap<>();
    private int viaCount;
    private int padCount;
    private int copperLayerCount;

    // Bounding box of all placed items (null when the board is empty)
    private double[] boundingBox;

    public Map<String, Integer> getComponentsByLayer() {
        return componentsByLayer;
    }

    public Map<String, Integer> getTracksByLayer() {
        return tracksByLayer;
    }

    public Map<String, Double> getTrackLengthByLayer() {
        return trackLengthByLayer;
    }

    public Map<String, Integer> getZonesByLayer() {
        return zonesByLayer;
    }

    public int getComponentCount() {
        return componentsByLayer.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getTrackCount() {
        return tracksByLayer.values().stream().mapToInt(Integer::intValue).sum();
    }

    public double getTotalTrackLength() {
        return trackLengthByLayer.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public int getViaCount() {
        return viaCount;
    }

    public void setViaCount(int viaCount) {
        this.viaCount = viaCount;
    }

    public int getPadCount() {
        return padCount;
    }

    public void setPadCount(int padCount) {
        this.padCount = padCount;
    }

    public int getCopperLayerCount() {
        return copperLayerCount;
    }

    public void setCopperLayerCount(int copperLayerCount) {
        this.copperLayerCount = copperLayerCount;
    }

    /**
     * {@code [minX, minY, maxX, maxY]} in mm, or null for an empty board.
     */
    public double[] getBoundingBox() {
        return boundingBox;
    }

    public void setBoundingBox(double minX, double minY, double maxX, double maxY) {
        this.boundingBox = new double[]{minX, minY, maxX, maxY};
    }

    public double getWidth() {
        return boundingBox == null ? 0 : boundingBox[2] - boundingBox[0];
    }

    public double getHeight() {
        return boundingBox == null ? 0 : boundingBox[3] - boundingBox[1];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Board statistics:\n");
        sb.append("  Copper layers: ").append(copperLayerCount).append("\n");
        sb.append("  Components: ").append(getComponentCount()).append(" ").append(componentsByLayer).append("\n");
        sb.append("  Pads: ").append(padCount).append("\n");
        sb.append(String.format("  Tracks: %d (%.3fmm)%n", getTrackCount(), getTotalTrackLength()));
        sb.append("  Vias: ").append(viaCount).append("\n");
        sb.append("  Zones: ").append(zonesByLayer).append("\n");
        if (boundingBox != null) {
            sb.append(String.format("  Size: %.3f x %.3fmm%n", getWidth(), getHeight()));
        }
        return sb.toString();
    }
}
