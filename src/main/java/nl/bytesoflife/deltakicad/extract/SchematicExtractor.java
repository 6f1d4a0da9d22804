package nl.bytesoflife.deltakicad.extract;

import nl.bytesoflife.deltakicad.model.ExtractionIssue;
import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.schematic.*;
import nl.bytesoflife.deltakicad.sexpr.SExpressionParser;
import nl.bytesoflife.deltakicad.sexpr.SNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Extracts symbols, pins, wires, labels, junctions and sheets from a
 * {@code kicad_sch} tree. A problem with one entity skips that entity and is
 * reported in {@link SchematicModel#issues()}.
 */
public class SchematicExtractor {

    private static final Logger log = LoggerFactory.getLogger(SchematicExtractor.class);

    public SchematicModel extract(String content, String source) {
        SNode.SList root = new SExpressionParser().parseDocument(content, source);
        return extract(root, source);
    }

    public SchematicModel extract(SNode.SList root, String source) {
        if (!"kicad_sch".equals(root.head())) {
            throw new ExtractionException(ExtractionIssue.Kind.INVALID_VALUE,
                    "Not a schematic file, root is '" + root.head() + "'", null, root.line());
        }
        return new Run(source).extract(root);
    }

    /**
     * State of one extraction pass.
     */
    private static final class Run {

        private final String source;
        private final Map<String, LibrarySymbol> library = new HashMap<>();
        private final Set<String> placedUnits = new HashSet<>();
        private final List<Symbol> symbols = new ArrayList<>();
        private final Map<Symbol, Set<String>> sharedPins = new IdentityHashMap<>();
        private final List<Wire> wires = new ArrayList<>();
        private final List<Label> labels = new ArrayList<>();
        private final List<Label> powerLabels = new ArrayList<>();
        private final List<Junction> junctions = new ArrayList<>();
        private final List<Sheet> sheets = new ArrayList<>();
        private final List<ExtractionIssue> issues = new ArrayList<>();

        Run(String source) {
            this.source = source;
        }

        SchematicModel extract(SNode.SList root) {
            // the library cache must be known before any symbol is placed
            root.find("lib_symbols").ifPresent(this::readLibrary);

            for (SNode.SList node : root.lists()) {
                try {
                    switch (SchematicKeyword.fromHead(node.head())) {
                        case SYMBOL -> readSymbol(node);
                        case WIRE -> readWire(node);
                        case JUNCTION -> junctions.add(new Junction(NodeReader.requiredPoint(node, "at", null)));
                        case LABEL -> readLabel(node, LabelKind.LOCAL);
                        case GLOBAL_LABEL -> readLabel(node, LabelKind.GLOBAL);
                        case HIERARCHICAL_LABEL -> readLabel(node, LabelKind.HIERARCHICAL);
                        case SHEET -> readSheet(node);
                        case LIB_SYMBOLS, UNRECOGNIZED -> {
                            // lib_symbols was read up front; anything else carries no connectivity
                        }
                    }
                } catch (ExtractionException e) {
                    ExtractionIssue issue = e.toIssue(source);
                    log.warn("Skipping {}: {}", node.head(), issue);
                    issues.add(issue);
                }
            }

            assignSharedPins();
            List<Label> allLabels = new ArrayList<>(labels);
            allLabels.addAll(powerLabels);
            log.debug("Extracted {} symbols, {} wires, {} labels, {} junctions, {} sheets from {} ({} issues)",
                    symbols.size(), wires.size(), allLabels.size(), junctions.size(), sheets.size(),
                    source, issues.size());
            return new SchematicModel(source, symbols, wires, allLabels, junctions, sheets, issues);
        }

        private void readLibrary(SNode.SList libSymbols) {
            for (SNode.SList definition : libSymbols.findAll("symbol")) {
                try {
                    LibrarySymbol symbol = LibrarySymbol.parse(definition);
                    library.put(symbol.name(), symbol);
                } catch (ExtractionException e) {
                    issues.add(e.toIssue(source));
                }
            }
        }

        private void readSymbol(SNode.SList node) {
            String reference = NodeReader.property(node, "Reference").orElse(null);
            String libId = NodeReader.required(node, "lib_id", reference).atomAt(1)
                    .orElseThrow(() -> ExtractionException.missingField("lib_id", reference, node.line()));
            if (reference == null) {
                throw ExtractionException.missingField("Reference", libId, node.line());
            }

            String libraryKey = node.find("lib_name").flatMap(n -> n.atomAt(1)).orElse(libId);
            LibrarySymbol definition = library.get(libraryKey);
            if (definition == null) {
                throw new ExtractionException(ExtractionIssue.Kind.UNKNOWN_LIBRARY,
                        "Library symbol '" + libraryKey + "' is not defined in lib_symbols", reference, node.line());
            }

            SNode.SList at = NodeReader.required(node, "at", reference);
            Point position = NodeReader.point(at, "at", reference);
            double rotation = NodeReader.optionalNumber(at, 3, 0, "at", reference);
            Mirror mirror = Mirror.fromKicadName(node.find("mirror").flatMap(m -> m.atomAt(1)).orElse(null));
            int unit = node.find("unit")
                    .map(u -> NodeReader.optionalNumber(u, 1, 1, "unit", reference)).orElse(1.0).intValue();
            int bodyStyle = node.find("body_style").or(() -> node.find("convert"))
                    .map(c -> NodeReader.optionalNumber(c, 1, 1, "body_style", reference)).orElse(1.0).intValue();

            if (!placedUnits.add(reference + "#" + unit)) {
                throw new ExtractionException(ExtractionIssue.Kind.DUPLICATE_REFERENCE,
                        "Reference '" + reference + "' unit " + unit + " is placed more than once", reference, node.line());
            }

            String value = NodeReader.property(node, "Value").orElse("").trim();
            String footprint = NodeReader.property(node, "Footprint").orElse("").trim();
            String datasheet = NodeReader.property(node, "Datasheet").orElse("");
            String description = NodeReader.property(node, "Description", "ki_description").orElse("");
            boolean power = definition.power() || libId.startsWith("power:");
            boolean inBom = !power && NodeReader.yesNo(node, "in_bom", true)
                    && !node.find("exclude_from_bom").isPresent();

            List<Pin> pins = new ArrayList<>();
            Set<String> shared = new HashSet<>();
            for (LibrarySymbol.LibraryPin libraryPin : definition.pinsFor(unit, bodyStyle)) {
                Point pinPosition = Placement.pinPosition(position, rotation, mirror, libraryPin.offset());
                pins.add(new Pin(reference, libraryPin.number(), libraryPin.name(), libraryPin.offset(), pinPosition));
                if (libraryPin.unit() == 0) {
                    shared.add(libraryPin.number());
                }
                if (power) {
                    powerLabels.add(new Label(value, pinPosition, LabelKind.POWER));
                }
            }

            Symbol symbol = new Symbol(reference, value, footprint, libId, position, rotation, mirror, unit,
                    inBom, power, datasheet, description, pins);
            symbols.add(symbol);
            if (!shared.isEmpty()) {
                sharedPins.put(symbol, shared);
            }
        }

        /**
         * Pins common to all units exist once per reference: they stay on the
         * lowest placed unit and are dropped from the others.
         */
        private void assignSharedPins() {
            Map<String, Integer> lowestUnit = new HashMap<>();
            for (Symbol symbol : symbols) {
                lowestUnit.merge(symbol.reference(), symbol.unit(), Math::min);
            }
            symbols.replaceAll(symbol -> {
                Set<String> shared = sharedPins.get(symbol);
                if (shared == null || symbol.unit() == lowestUnit.get(symbol.reference())) {
                    return symbol;
                }
                List<Pin> own = symbol.pins().stream().filter(p -> !shared.contains(p.number())).toList();
                return new Symbol(symbol.reference(), symbol.value(), symbol.footprint(), symbol.libId(),
                        symbol.position(), symbol.rotation(), symbol.mirror(), symbol.unit(), symbol.inBom(),
                        symbol.power(), symbol.datasheet(), symbol.description(), own);
            });
        }

        private void readWire(SNode.SList node) {
            SNode.SList pts = NodeReader.required(node, "pts", null);
            List<SNode.SList> xy = pts.findAll("xy");
            if (xy.size() < 2) {
                throw ExtractionException.missingField("pts", null, node.line());
            }
            // KiCad writes wires as two-point segments; longer polylines are split
            for (int i = 0; i + 1 < xy.size(); i++) {
                wires.add(new Wire(NodeReader.point(xy.get(i), "xy", null), NodeReader.point(xy.get(i + 1), "xy", null)));
            }
        }

        private void readLabel(SNode.SList node, LabelKind kind) {
            String name = NodeReader.requiredAtom(node, 1, "name", null);
            Point position = NodeReader.requiredPoint(node, "at", name);
            labels.add(new Label(name, position, kind));
        }

        private void readSheet(SNode.SList node) {
            String name = NodeReader.property(node, "Sheetname", "Sheet name").orElse(null);
            String file = NodeReader.property(node, "Sheetfile", "Sheet file")
                    .orElseThrow(() -> ExtractionException.missingField("Sheetfile", name, node.line()));
            Point position = NodeReader.requiredPoint(node, "at", name);

            List<SheetPin> pins = new ArrayList<>();
            for (SNode.SList pin : node.findAll("pin")) {
                String pinName = NodeReader.requiredAtom(pin, 1, "pin name", name);
                pins.add(new SheetPin(pinName, NodeReader.requiredPoint(pin, "at", name)));
            }
            sheets.add(new Sheet(name != null ? name : file, file, position, pins));
        }
    }
}
