package nl.bytesoflife.deltakicad.export;

import nl.bytesoflife.deltakicad.model.Point;
import nl.bytesoflife.deltakicad.model.pcb.*;
import nl.bytesoflife.deltakicad.sexpr.SNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link PcbModel} back as a {@code kicad_pcb} document in the
 * KiCad 8 form: {@code footprint} with {@code property} fields, {@code segment}
 * tracks and filled zone outlines as {@code polygon}.
 */
public class PcbSexprWriter extends SexprBuilder {

    public String write(PcbModel model) {
        return render(toTree(model));
    }

    public SNode.SList toTree(PcbModel model) {
        List<SNode> children = new ArrayList<>();
        children.add(SNode.atom("kicad_pcb"));
        children.add(SNode.list("version", "20240108"));
        children.add(SNode.list("generator", SNode.quoted("delta-kicad")));

        List<SNode> layers = new ArrayList<>();
        layers.add(SNode.atom("layers"));
        for (Layer layer : model.layers()) {
            layers.add(new SNode.SList(List.of(
                    SNode.atom(String.valueOf(layer.ordinal())),
                    SNode.quoted(layer.name()),
                    SNode.atom(layer.type())), 0));
        }
        children.add(new SNode.SList(layers, 0));

        for (Map.Entry<Integer, String> net : model.nets().entrySet()) {
            children.add(SNode.list("net", net.getKey(), SNode.quoted(net.getValue())));
        }
        for (Footprint footprint : model.footprints()) {
            children.add(footprint(footprint));
        }
        for (Track track : model.tracks()) {
            children.add(SNode.list("segment",
                    SNode.list("start", num(track.start().x()), num(track.start().y())),
                    SNode.list("end", num(track.end().x()), num(track.end().y())),
                    SNode.list("width", num(track.width())),
                    SNode.list("layer", SNode.quoted(track.layer())),
                    SNode.list("net", track.netCode())));
        }
        for (Via via : model.vias()) {
            if (via.layers().isEmpty()) continue;
            List<SNode> span = new ArrayList<>();
            span.add(SNode.atom("layers"));
            span.add(SNode.quoted(via.layers().get(0)));
            span.add(SNode.quoted(via.layers().get(via.layers().size() - 1)));
            children.add(SNode.list("via",
                    at(via.position()),
                    SNode.list("size", num(via.size())),
                    SNode.list("drill", num(via.drill())),
                    new SNode.SList(span, 0),
                    SNode.list("net", via.netCode())));
        }
        for (Zone zone : model.zones()) {
            children.add(zone(zone));
        }
        return new SNode.SList(children, 0);
    }

    private SNode.SList footprint(Footprint footprint) {
        List<SNode> children = new ArrayList<>();
        children.add(SNode.atom("footprint"));
        children.add(SNode.quoted(footprint.footprint()));
        children.add(SNode.list("layer", SNode.quoted(footprint.layer())));
        children.add(at(footprint.position(), footprint.rotation()));
        children.add(property("Reference", footprint.reference()));
        children.add(property("Value", footprint.value()));
        if (!footprint.datasheet().isEmpty()) {
            children.add(property("Datasheet", footprint.datasheet()));
        }
        if (!footprint.description().isEmpty()) {
            children.add(property("Description", footprint.description()));
        }
        if (footprint.excludeFromBom()) {
            children.add(SNode.list("attr", "smd", "exclude_from_bom"));
        }
        for (Pad pad : footprint.pads()) {
            List<SNode> layers = new ArrayList<>();
            layers.add(SNode.atom("layers"));
            for (String layer : pad.layers()) {
                layers.add(SNode.quoted(layer));
            }
            List<SNode> padNode = new ArrayList<>(List.of(
                    SNode.atom("pad"),
                    SNode.quoted(pad.number()),
                    SNode.atom(pad.type()),
                    SNode.atom(pad.shape()),
                    at(pad.offset(), pad.rotation()),
                    SNode.list("size", num(pad.width()), num(pad.height())),
                    new SNode.SList(layers, 0)));
            if (pad.netCode() < 0) {
                // named net missing from the net table
                padNode.add(SNode.list("net", SNode.quoted(pad.netName())));
            } else if (pad.netCode() != 0 || pad.netName() != null) {
                padNode.add(SNode.list("net", pad.netCode(),
                        SNode.quoted(pad.netName() == null ? "" : pad.netName())));
            }
            children.add(new SNode.SList(padNode, 0));
        }
        return new SNode.SList(children, 0);
    }

    private SNode.SList zone(Zone zone) {
        List<SNode> layers = new ArrayList<>();
        layers.add(SNode.atom("layers"));
        for (String layer : zone.layers()) {
            layers.add(SNode.quoted(layer));
        }
        List<SNode> pts = new ArrayList<>();
        pts.add(SNode.atom("pts"));
        for (Point p : zone.outline()) {
            pts.add(xy(p));
        }
        return SNode.list("zone",
                SNode.list("net", zone.netCode()),
                SNode.list("net_name", SNode.quoted(zone.netName())),
                new SNode.SList(layers, 0),
                SNode.list("polygon", new SNode.SList(pts, 0)));
    }
}
