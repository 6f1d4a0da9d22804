package nl.bytesoflife.deltakicad.export;

import nl.bytesoflife.deltakicad.model.schematic.*;
import nl.bytesoflife.deltakicad.sexpr.SNode;

import java.util.*;

/**
 * Writes a {@link SchematicModel} back as a {@code kicad_sch} document that
 * extracts to the same symbols, pins and connectivity. Library definitions
 * are rebuilt from the placed pins, one sub-symbol per placed unit. Power
 * labels are not written; they come back from the power symbols.
 */
public class SchematicSexprWriter extends SexprBuilder {

    public String write(SchematicModel model) {
        return render(toTree(model));
    }

    public SNode.SList toTree(SchematicModel model) {
        List<SNode> children = new ArrayList<>();
        children.add(SNode.atom("kicad_sch"));
        children.add(SNode.list("version", "20231120"));
        children.add(SNode.list("generator", SNode.quoted("delta-kicad")));
        children.add(librarySymbols(model));

        for (Junction junction : model.junctions()) {
            children.add(SNode.list("junction", at(junction.position())));
        }
        for (Wire wire : model.wires()) {
            children.add(SNode.list("wire", SNode.list("pts", xy(wire.start()), xy(wire.end()))));
        }
        for (Label label : model.labels()) {
            String head = switch (label.kind()) {
                case LOCAL -> "label";
                case GLOBAL -> "global_label";
                case HIERARCHICAL -> "hierarchical_label";
                case POWER -> null;
            };
            if (head != null) {
                children.add(SNode.list(head, SNode.quoted(label.name()), at(label.position(), 0)));
            }
        }
        for (Symbol symbol : model.symbols()) {
            children.add(symbol(symbol));
        }
        for (Sheet sheet : model.sheets()) {
            children.add(sheet(sheet));
        }
        return new SNode.SList(children, 0);
    }

    private SNode.SList librarySymbols(SchematicModel model) {
        // lib id -> unit -> pins in first-seen order
        Map<String, SortedMap<Integer, Map<String, Pin>>> units = new LinkedHashMap<>();
        Map<String, Boolean> power = new HashMap<>();
        for (Symbol symbol : model.symbols()) {
            Map<String, Pin> pins = units
                    .computeIfAbsent(symbol.libId(), k -> new TreeMap<>())
                    .computeIfAbsent(symbol.unit(), k -> new LinkedHashMap<>());
            for (Pin pin : symbol.pins()) {
                pins.putIfAbsent(pin.number(), pin);
            }
            power.merge(symbol.libId(), symbol.power(), Boolean::logicalOr);
        }

        List<SNode> library = new ArrayList<>();
        library.add(SNode.atom("lib_symbols"));
        for (Map.Entry<String, SortedMap<Integer, Map<String, Pin>>> entry : units.entrySet()) {
            String libId = entry.getKey();
            String baseName = libId.substring(libId.indexOf(':') + 1);
            List<SNode> definition = new ArrayList<>();
            definition.add(SNode.atom("symbol"));
            definition.add(SNode.quoted(libId));
            if (power.get(libId)) {
                definition.add(SNode.list("power"));
            }
            for (Map.Entry<Integer, Map<String, Pin>> unit : entry.getValue().entrySet()) {
                List<SNode> unitNode = new ArrayList<>();
                unitNode.add(SNode.atom("symbol"));
                unitNode.add(SNode.quoted(baseName + "_" + unit.getKey() + "_1"));
                for (Pin pin : unit.getValue().values()) {
                    unitNode.add(SNode.list("pin", "passive", "line",
                            at(pin.offset(), 0),
                            SNode.list("length", "2.54"),
                            SNode.list("name", SNode.quoted(pin.name())),
                            SNode.list("number", SNode.quoted(pin.number()))));
                }
                definition.add(new SNode.SList(unitNode, 0));
            }
            library.add(new SNode.SList(definition, 0));
        }
        return new SNode.SList(library, 0);
    }

    private SNode.SList symbol(Symbol symbol) {
        List<SNode> children = new ArrayList<>();
        children.add(SNode.atom("symbol"));
        children.add(SNode.list("lib_id", SNode.quoted(symbol.libId())));
        children.add(at(symbol.position(), symbol.rotation()));
        if (symbol.mirror() != Mirror.NONE) {
            children.add(SNode.list("mirror", symbol.mirror().name().toLowerCase(Locale.ROOT)));
        }
        children.add(SNode.list("unit", symbol.unit()));
        children.add(yesNo("in_bom", symbol.inBom()));
        children.add(property("Reference", symbol.reference()));
        children.add(property("Value", symbol.value()));
        children.add(property("Footprint", symbol.footprint()));
        children.add(property("Datasheet", symbol.datasheet()));
        children.add(property("Description", symbol.description()));
        return new SNode.SList(children, 0);
    }

    private SNode.SList sheet(Sheet sheet) {
        List<SNode> children = new ArrayList<>();
        children.add(SNode.atom("sheet"));
        children.add(at(sheet.position()));
        children.add(property("Sheetname", sheet.name()));
        children.add(property("Sheetfile", sheet.file()));
        for (SheetPin pin : sheet.pins()) {
            children.add(SNode.list("pin", SNode.quoted(pin.name()), "passive", at(pin.position(), 0)));
        }
        return new SNode.SList(children, 0);
    }
}
