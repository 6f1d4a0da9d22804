package nl.bytesoflife.deltakicad.extract;

import nl.bytesoflife.deltakicad.model.ExtractionIssue;
import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.pcb.*;
import nl.bytesoflife.deltakicad.sexpr.SExpressionParser;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Extracts footprints, pads, tracks, vias, zones and the layer table from a
 * {@code kicad_pcb} tree. Every layer reference is checked against the
 * declared layer table.
 */
public class PcbExtractor {

    private static final Logger log = LoggerFactory.getLogger(PcbExtractor.class);

    public PcbModel extract(String content, String source) {
        SNode.SList root = new SExpressionParser().parseDocument(content, source);
        return extract(root, source);
    }

    public PcbModel extract(SNode.SList root, String source) {
        if (!"kicad_pcb".equals(root.head())) {
            throw new ExtractionException(ExtractionIssue.Kind.INVALID_VALUE,
                    "Not a board file, root is '" + root.head() + "'", null, root.line());
        }
        return new Run(source).extract(root);
    }

    private static final class Run {

        private final String source;
        private final LayerTable layerTable = new LayerTable();
        private final Map<Integer, String> nets = new TreeMap<>();
        private final List<Footprint> footprints = new ArrayList<>();
        private final List<Track> tracks = new ArrayList<>();
        private final List<Via> vias = new ArrayList<>();
        private final List<Zone> zones = new ArrayList<>();
        private final List<ExtractionIssue> issues = new ArrayList<>();

        Run(String source) {
            this.source = source;
        }

        PcbModel extract(SNode.SList root) {
            // layers and nets are referenced by everything else
            root.find("layers").ifPresent(this::readLayers);
            for (SNode.SList net : root.findAll("net")) {
                readNet(net);
            }

            for (SNode.SList node : root.lists()) {
                try {
                    switch (PcbKeyword.fromHead(node.head())) {
                        case FOOTPRINT -> readFootprint(node);
                        case SEGMENT, ARC -> readTrack(node);
                        case VIA -> readVia(node);
                        case ZONE -> readZone(node);
                        case LAYERS, NET, UNRECOGNIZED -> {
                            // layers and nets were read up front
                        }
                    }
                } catch (ExtractionException e) {
                    ExtractionIssue issue = e.toIssue(source);
                    log.warn("Skipping {}: {}", node.head(), issue);
                    issues.add(issue);
                }
            }

            log.debug("Extracted {} footprints, {} tracks, {} vias, {} zones from {} ({} issues)",
                    footprints.size(), tracks.size(), vias.size(), zones.size(), source, issues.size());
            return new PcbModel(source, layerTable.getLayers(), nets, footprints, tracks, vias, zones, issues);
        }

        private void readLayers(SNode.SList layers) {
            for (SNode.SList entry : layers.lists()) {
                try {
                    int ordinal = (int) NodeReader.number(entry.head(), "layer ordinal", null, entry.line());
                    String name = NodeReader.requiredAtom(entry, 1, "layer name", null);
                    String type = entry.atomAt(2).orElse("user");
                    layerTable.add(new Layer(ordinal, name, type));
                } catch (ExtractionException e) {
                    issues.add(e.toIssue(source));
                }
            }
        }

        private void readNet(SNode.SList net) {
            Optional<String> code = net.atomAt(1);
            Optional<String> name = net.atomAt(2);
            if (code.isEmpty()) return;
            try {
                nets.put(Integer.parseInt(code.get()), name.orElse(""));
            } catch (NumberFormatException e) {
                issues.add(new ExtractionIssue(ExtractionIssue.Kind.INVALID_VALUE, source, net.line(), null,
                        "Net code is not a number: '" + code.get() + "'"));
            }
        }

        private void readFootprint(SNode.SList node) {
            String reference = NodeReader.property(node, "Reference")
                    .or(() -> NodeReader.fpText(node, "reference"))
                    .orElseThrow(() -> ExtractionException.missingField("Reference", null, node.line()));
            String value = NodeReader.property(node, "Value")
                    .or(() -> NodeReader.fpText(node, "value"))
                    .orElse("").trim();
            String footprintName = NodeReader.requiredAtom(node, 1, "footprint name", reference).trim();

            String layer = node.find("layer").flatMap(l -> l.atomAt(1)).orElse("F.Cu");
            layerTable.resolve(layer, reference, node.line());

            SNode.SList at = NodeReader.required(node, "at", reference);
            Point position = NodeReader.point(at, "at", reference);
            double rotation = NodeReader.optionalNumber(at, 3, 0, "at", reference);

            boolean excludeFromBom = node.find("attr").map(a -> a.hasFlag("exclude_from_bom")).orElse(false);
            String datasheet = NodeReader.property(node, "Datasheet").orElse("");
            String description = NodeReader.property(node, "Description").orElse("");

            List<Pad> pads = new ArrayList<>();
            for (SNode.SList padNode : node.findAll("pad")) {
                try {
                    pads.add(readPad(padNode, reference, position, rotation));
                } catch (ExtractionException e) {
                    ExtractionIssue issue = e.toIssue(source);
                    log.warn("Skipping pad of {}: {}", reference, issue);
                    issues.add(issue);
                }
            }

            footprints.add(new Footprint(reference, value, footprintName, layer, position, rotation,
                    excludeFromBom, datasheet, description, pads));
        }

        private Pad readPad(SNode.SList node, String reference, Point footprintPosition, double footprintRotation) {
            String number = NodeReader.requiredAtom(node, 1, "pad number", reference);
            String type = node.atomAt(2).orElse("smd");
            String shape = node.atomAt(3).orElse("rect");

            SNode.SList at = NodeReader.required(node, "at", reference);
            Point offset = NodeReader.point(at, "at", reference);
            double padRotation = NodeReader.optionalNumber(at, 3, footprintRotation, "at", reference);

            double width = 0;
            double height = 0;
            Optional<SNode.SList> size = node.find("size");
            if (size.isPresent()) {
                width = NodeReader.number(size.get(), 1, "size", reference);
                height = NodeReader.optionalNumber(size.get(), 2, width, "size", reference);
            }

            List<String> layerExpressions = NodeReader.required(node, "layers", reference).atoms();
            List<String> layers = layerTable.resolveAll(layerExpressions, reference, node.line());

            int netCode = 0;
            String netName = null;
            Optional<SNode.SList> net = node.find("net");
            if (net.isPresent()) {
                String first = NodeReader.requiredAtom(net.get(), 1, "net", reference);
                if (!first.isEmpty() && first.chars().allMatch(Character::isDigit)) {
                    netCode = Integer.parseInt(first);
                    netName = net.get().atomAt(2).orElse(nets.get(netCode));
                } else {
                    netName = first;
                    netCode = codeForName(first);
                }
            }
            if (netName != null && netName.isEmpty()) {
                netName = null;
            }

            Point position = Placement.padPosition(footprintPosition, footprintRotation, offset);
            return new Pad(reference, number, type, shape, offset, position, width, height, padRotation,
                    layers, netCode, netName);
        }

        private int codeForName(String name) {
            for (Map.Entry<Integer, String> entry : nets.entrySet()) {
                if (entry.getValue().equals(name)) {
                    return entry.getKey();
                }
            }
            return -1;
        }

        private void readTrack(SNode.SList node) {
            Point start = NodeReader.requiredPoint(node, "start", null);
            Point end = NodeReader.requiredPoint(node, "end", null);
            double width = node.find("width").map(w -> NodeReader.optionalNumber(w, 1, 0, "width", null)).orElse(0.0);
            String layer = NodeReader.requiredAtom(NodeReader.required(node, "layer", null), 1, "layer", null);
            layerTable.resolve(layer, null, node.line());
            tracks.add(new Track(start, end, width, layer, netCode(node)));
        }

        private void readVia(SNode.SList node) {
            Point position = NodeReader.requiredPoint(node, "at", null);
            double size = node.find("size").map(s -> NodeReader.optionalNumber(s, 1, 0, "size", null)).orElse(0.0);
            double drill = node.find("drill").map(d -> NodeReader.optionalNumber(d, 1, 0, "drill", null)).orElse(0.0);
            List<String> ends = NodeReader.required(node, "layers", null).atoms();
            if (ends.isEmpty()) {
                throw ExtractionException.missingField("layers", null, node.line());
            }
            String from = ends.get(0);
            String to = ends.get(ends.size() - 1);
            List<String> span = layerTable.copperSpan(from, to, null, node.line());
            vias.add(new Via(position, size, drill, span, netCode(node)));
        }

        private void readZone(SNode.SList node) {
            int netCode = netCode(node);
            String netName = node.find("net_name").flatMap(n -> n.atomAt(1)).orElse(nets.getOrDefault(netCode, ""));

            List<String> layerExpressions = new ArrayList<>();
            node.find("layer").flatMap(l -> l.atomAt(1)).ifPresent(layerExpressions::add);
            node.find("layers").ifPresent(l -> layerExpressions.addAll(l.atoms()));
            if (layerExpressions.isEmpty()) {
                throw ExtractionException.missingField("layer", null, node.line());
            }
            List<String> layers = layerTable.resolveAll(layerExpressions, null, node.line());

            SNode.SList polygon = NodeReader.required(node, "polygon", null);
            List<Point> outline = new ArrayList<>();
            for (SNode.SList xy : NodeReader.required(polygon, "pts", null).findAll("xy")) {
                outline.add(NodeReader.point(xy, "xy", null));
            }
            if (outline.size() < 3) {
                throw ExtractionException.missingField("polygon", null, node.line());
            }
            zones.add(new Zone(netCode, netName, layers, outline));
        }

        private int netCode(SNode.SList node) {
            return node.find("net")
                    .flatMap(n -> n.atomAt(1))
                    .map(code -> {
                        if (!code.isEmpty() && code.chars().allMatch(Character::isDigit)) {
                            return Integer.parseInt(code);
                        }
                        return codeForName(code);
                    })
                    .orElse(0);
        }
    }
}
