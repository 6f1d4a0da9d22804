package nl.bytesoflife.deltakicad.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import nl.bytesoflife.deltakicad.bom.BomEntry;
import nl.bytesoflife.deltakicad.bom.BomRecord;
import nl.bytesoflife.deltakicad.model.ExtractionIssue;
import nl.bytesoflife.deltakicad.model.PinRef;
import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.pcb.*;
import nl.bytesoflife.deltakicad.model.schematic.*;
import nl.bytesoflife.deltakicad.netlist.Net;
import nl.bytesoflife.deltakicad.netlist.NetConflict;
import nl.bytesoflife.deltakicad.netlist.Netlist;
import nl.bytesoflife.deltakicad.stats.BoardStatistics;
import nl.bytesoflife.deltakicad.stats.BoardStatisticsScanner;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Builds the structured JSON projection of designs, netlists and BOMs.
 * Keys are written in a fixed order so equal input gives equal output.
 */
public class DesignJsonExporter {

    private final ObjectMapper mapper;
    private boolean pretty = true;

    public DesignJsonExporter() {
        this(new ObjectMapper());
    }

    public DesignJsonExporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public DesignJsonExporter withPrettyPrinting(boolean enabled) {
        this.pretty = enabled;
        return this;
    }

    public ObjectNode toTree(SchematicModel model, Netlist netlist) {
        ObjectNode root = mapper.createObjectNode();
        root.put("source", model.source());
        ArrayNode components = root.putArray("components");
        for (Symbol symbol : model.symbols()) {
            ObjectNode node = components.addObject();
            node.put("reference", symbol.reference());
            node.put("value", symbol.value());
            node.put("footprint", symbol.footprint());
            node.put("libId", symbol.libId());
            node.put("unit", symbol.unit());
            putPoint(node, "position", symbol.position());
            node.put("rotation", symbol.rotation());
            node.put("mirror", symbol.mirror().name());
            node.put("inBom", symbol.inBom());
            node.put("power", symbol.power());
            node.put("datasheet", symbol.datasheet());
            node.put("description", symbol.description());
            ArrayNode pins = node.putArray("pins");
            for (Pin pin : symbol.pins()) {
                ObjectNode p = pins.addObject();
                p.put("number", pin.number());
                p.put("name", pin.name());
                putPoint(p, "position", pin.position());
            }
        }
        putNets(root, netlist);
        ArrayNode sheets = root.putArray("sheets");
        for (Sheet sheet : model.sheets()) {
            ObjectNode node = sheets.addObject();
            node.put("name", sheet.name());
            node.put("file", sheet.file());
            putPoint(node, "position", sheet.position());
            ArrayNode pins = node.putArray("pins");
            for (SheetPin pin : sheet.pins()) {
                ObjectNode p = pins.addObject();
                p.put("name", pin.name());
                putPoint(p, "position", pin.position());
            }
        }
        putIssues(root, model.issues());
        putConflicts(root, netlist.conflicts());
        return root;
    }

    public ObjectNode toTree(PcbModel model, Netlist netlist) {
        ObjectNode root = mapper.createObjectNode();
        root.put("source", model.source());
        ArrayNode modules = root.putArray("modules");
        for (Footprint footprint : model.footprints()) {
            ObjectNode node = modules.addObject();
            node.put("reference", footprint.reference());
            node.put("value", footprint.value());
            node.put("footprint", footprint.footprint());
            node.put("layer", footprint.layer());
            putPoint(node, "position", footprint.position());
            node.put("rotation", footprint.rotation());
            node.put("inBom", footprint.inBom());
            ArrayNode pads = node.putArray("pads");
            for (Pad pad : footprint.pads()) {
                ObjectNode p = pads.addObject();
                p.put("number", pad.number());
                p.put("type", pad.type());
                p.put("shape", pad.shape());
                putPoint(p, "position", pad.position());
                p.put("width", pad.width());
                p.put("height", pad.height());
                putStrings(p, "layers", pad.layers());
                p.put("netCode", pad.netCode());
                if (pad.netName() != null) {
                    p.put("netName", pad.netName());
                }
            }
        }
        ArrayNode tracks = root.putArray("tracks");
        for (Track track : model.tracks()) {
            ObjectNode node = tracks.addObject();
            putPoint(node, "start", track.start());
            putPoint(node, "end", track.end());
            node.put("width", track.width());
            node.put("layer", track.layer());
            node.put("netCode", track.netCode());
        }
        ArrayNode vias = root.putArray("vias");
        for (Via via : model.vias()) {
            ObjectNode node = vias.addObject();
            putPoint(node, "position", via.position());
            node.put("size", via.size());
            node.put("drill", via.drill());
            putStrings(node, "layers", via.layers());
            node.put("netCode", via.netCode());
        }
        ArrayNode zones = root.putArray("zones");
        for (Zone zone : model.zones()) {
            ObjectNode node = zones.addObject();
            node.put("netCode", zone.netCode());
            node.put("netName", zone.netName());
            putStrings(node, "layers", zone.layers());
            ArrayNode outline = node.putArray("outline");
            for (Point p : zone.outline()) {
                outline.addArray().add(p.x()).add(p.y());
            }
        }
        putNets(root, netlist);
        putStatistics(root, new BoardStatisticsScanner().scan(model));
        putIssues(root, model.issues());
        putConflicts(root, netlist.conflicts());
        return root;
    }

    public ObjectNode toTree(BomRecord bom) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode entries = root.putArray("bom");
        for (BomEntry entry : bom.getEntries()) {
            ObjectNode node = entries.addObject();
            node.put("item", entry.item());
            node.put("value", entry.value());
            node.put("footprint", entry.footprint());
            putStrings(node, "references", entry.references());
            node.put("quantity", entry.quantity());
            node.put("datasheet", entry.datasheet());
            node.put("description", entry.description());
        }
        return root;
    }

    public String write(SchematicModel model, Netlist netlist) {
        return serialize(toTree(model, netlist));
    }

    public String write(PcbModel model, Netlist netlist) {
        return serialize(toTree(model, netlist));
    }

    public String write(BomRecord bom) {
        return serialize(toTree(bom));
    }

    private String serialize(ObjectNode tree) {
        try {
            return pretty
                    ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                    : mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize design document", e);
        }
    }

    private static void putNets(ObjectNode root, Netlist netlist) {
        ArrayNode nets = root.putArray("nets");
        for (Net net : netlist.nets()) {
            ObjectNode node = nets.addObject();
            node.put("name", net.name());
            node.put("explicitName", net.explicitName());
            ArrayNode pins = node.putArray("pins");
            for (PinRef pin : net.pins()) {
                ObjectNode p = pins.addObject();
                if (!PinRef.ROOT_SHEET.equals(pin.sheetPath())) {
                    p.put("sheet", pin.sheetPath());
                }
                p.put("reference", pin.reference());
                p.put("pin", pin.pin());
            }
        }
    }

    private static void putStatistics(ObjectNode root, BoardStatistics stats) {
        ObjectNode node = root.putObject("statistics");
        node.put("copperLayers", stats.getCopperLayerCount());
        node.put("components", stats.getComponentCount());
        putCounts(node.putObject("componentsByLayer"), stats.getComponentsByLayer());
        node.put("pads", stats.getPadCount());
        node.put("tracks", stats.getTrackCount());
        putCounts(node.putObject("tracksByLayer"), stats.getTracksByLayer());
        node.put("trackLength", stats.getTotalTrackLength());
        ObjectNode lengths = node.putObject("trackLengthByLayer");
        for (Map.Entry<String, Double> e : stats.getTrackLengthByLayer().entrySet()) {
            lengths.put(e.getKey(), e.getValue());
        }
        node.put("vias", stats.getViaCount());
        putCounts(node.putObject("zonesByLayer"), stats.getZonesByLayer());
        double[] box = stats.getBoundingBox();
        if (box != null) {
            ObjectNode b = node.putObject("boundingBox");
            b.put("minX", box[0]);
            b.put("minY", box[1]);
            b.put("maxX", box[2]);
            b.put("maxY", box[3]);
        }
    }

    private static void putCounts(ObjectNode node, Map<String, Integer> counts) {
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            node.put(e.getKey(), e.getValue());
        }
    }

    private static void putIssues(ObjectNode root, List<ExtractionIssue> issues) {
        ArrayNode array = root.putArray("issues");
        for (ExtractionIssue issue : issues) {
            ObjectNode node = array.addObject();
            node.put("kind", issue.kind().name());
            node.put("line", issue.line());
            if (issue.reference() != null) {
                node.put("reference", issue.reference());
            }
            node.put("message", issue.message());
        }
    }

    private static void putConflicts(ObjectNode root, List<NetConflict> conflicts) {
        ArrayNode array = root.putArray("conflicts");
        for (NetConflict conflict : conflicts) {
            ObjectNode node = array.addObject();
            node.put("winner", conflict.winner());
            putStrings(node, "names", conflict.names());
            node.put("sheet", conflict.sheetPath());
        }
    }

    private static void putPoint(ObjectNode node, String field, Point p) {
        ObjectNode point = node.putObject(field);
        point.put("x", p.x());
        point.put("y", p.y());
    }

    private static void putStrings(ObjectNode node, String field, List<String> values) {
        ArrayNode array = node.putArray(field);
        for (String value : values) {
            array.add(value);
        }
    }
}
