package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.Fixtures;
import nl.bytesoflife.deltakicad.extract.PcbExtractor;
import nl.bytesoflife.deltakicad.model.PinRef;
import nl.bytesoflife.deltakicad.model.pcb.PcbModel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PcbNetlistResolverTest {

    private static final String HEADER = """
            (kicad_pcb (version 20240108)
              (layers (0 "F.Cu" signal) (31 "B.Cu" signal))
              (net 0 "")
              (net 1 "GND")
              (net 2 "VCC")
            """;

    private final PcbNetlistResolver resolver = new PcbNetlistResolver();

    private static PcbModel board(String body) {
        return new PcbExtractor().extract(HEADER + body + ")", "test.kicad_pcb");
    }

    private static final String STACKED_PADS = """
            (footprint "A" (layer "F.Cu") (at 10 10)
              (property "Reference" "R1")
              (pad "1" smd rect (at 0 0) (size 1 1) (layers "F.Cu")))
            (footprint "B" (layer "F.Cu") (at 10.0004 10)
              (property "Reference" "R2")
              (pad "1" smd rect (at 0 0) (size 1 1) (layers "%s")))
            """;

    @Test
    void boardFixtureNets() {
        Netlist netlist = resolver.resolve(Fixtures.pcb("board.kicad_pcb"));

        assertEquals(List.of("GND", "Net-(J1-1)", "SIG", "VCC"),
                netlist.nets().stream().map(Net::name).toList());
        assertEquals(7, netlist.pinCount());
        assertEquals(List.of(new PinRef("C1", "1"), new PinRef("R1", "2")),
                netlist.find("GND").orElseThrow().pins());
        assertEquals(List.of(new PinRef("R1", "1"), new PinRef("R2", "1")),
                netlist.find("SIG").orElseThrow().pins());
        assertEquals(List.of(new PinRef("C1", "2"), new PinRef("R2", "2")),
                netlist.find("VCC").orElseThrow().pins());
        assertFalse(netlist.hasConflicts());
    }

    @Test
    void padsSharingANumberAreOnePin() {
        PcbModel model = board("""
                (footprint "Package_TO_SOT_SMD:SOT-223" (layer "F.Cu") (at 10 10)
                  (property "Reference" "U1")
                  (pad "1" smd rect (at -3 2) (size 1 1) (layers "F.Cu"))
                  (pad "2" smd rect (at 0 3) (size 1 1) (layers "F.Cu"))
                  (pad "2" smd rect (at 0 -3) (size 3 1) (layers "F.Cu") (net 2 "VCC")))
                (footprint "R" (layer "F.Cu") (at 20 13)
                  (property "Reference" "R1")
                  (pad "1" smd rect (at 0 0) (size 1 1) (layers "F.Cu")))
                (segment (start 10 13) (end 20 13) (width 0.25) (layer "F.Cu") (net 2))
                """);

        Netlist netlist = resolver.resolve(model);

        assertEquals(List.of("Net-(U1-1)", "VCC"), netlist.nets().stream().map(Net::name).toList());
        assertEquals(3, netlist.pinCount());
        assertEquals(List.of(new PinRef("R1", "1"), new PinRef("U1", "2")),
                netlist.netOf(new PinRef("U1", "2")).orElseThrow().pins());
        assertEquals(Set.of(Set.of(new PinRef("U1", "1")), Set.of(new PinRef("R1", "1"), new PinRef("U1", "2"))),
                netlist.partition());
    }

    @Test
    void unconnectedTabPadsStillShareANet() {
        PcbModel model = board("""
                (footprint "Package_TO_SOT_SMD:SOT-223" (layer "F.Cu") (at 10 10)
                  (property "Reference" "U1")
                  (pad "1" smd rect (at -3 2) (size 1 1) (layers "F.Cu"))
                  (pad "2" smd rect (at 0 3) (size 1 1) (layers "F.Cu"))
                  (pad "2" smd rect (at 0 -3) (size 3 1) (layers "F.Cu")))
                """);

        Netlist netlist = resolver.resolve(model);

        assertEquals(List.of("Net-(U1-1)", "Net-(U1-2)"), netlist.nets().stream().map(Net::name).toList());
        assertEquals(2, netlist.pinCount());
    }

    @Test
    void zoneJoinsPadsOfItsOwnNet() {
        PcbModel withZone = Fixtures.pcb("board.kicad_pcb");
        PcbModel withoutZone = new PcbModel(withZone.source(), withZone.layers(), withZone.nets(),
                withZone.footprints(), withZone.tracks(), withZone.vias(), List.of(), withZone.issues());

        Netlist netlist = resolver.resolve(withoutZone);

        assertEquals(5, netlist.nets().size());
        assertTrue(netlist.partition().contains(Set.of(new PinRef("C1", "2"))));
    }

    @Test
    void padsWithCoincidingCentresConnect() {
        Netlist netlist = resolver.resolve(board(STACKED_PADS.formatted("F.Cu")));

        assertEquals(1, netlist.nets().size());
        assertEquals("Net-(R1-1)", netlist.nets().get(0).name());
        assertEquals(2, netlist.nets().get(0).pins().size());
    }

    @Test
    void padsOnDifferentLayersStaySeparate() {
        Netlist netlist = resolver.resolve(board(STACKED_PADS.formatted("B.Cu")));

        assertEquals(2, netlist.nets().size());
    }

    @Test
    void padToPadConnectivityCanBeDisabled() {
        PcbNetlistResolver strict = new PcbNetlistResolver(
                ConnectivitySettings.defaults().withPadToPadConnectivity(false));

        Netlist netlist = strict.resolve(board(STACKED_PADS.formatted("F.Cu")));

        assertEquals(2, netlist.nets().size());
    }

    @Test
    void trackEndInsidePadConnects() {
        Netlist netlist = resolver.resolve(board("""
                (footprint "A" (layer "F.Cu") (at 0 0)
                  (property "Reference" "R1")
                  (pad "1" smd rect (at 0 0) (size 1 1) (layers "F.Cu")))
                (footprint "B" (layer "F.Cu") (at 10 0)
                  (property "Reference" "R2")
                  (pad "1" smd rect (at 0 0) (size 1 1) (layers "F.Cu")))
                (segment (start 0.0005 0) (end 9.9995 0) (width 0.25) (layer "F.Cu") (net 0))
                """));

        assertEquals(1, netlist.nets().size());
    }

    @Test
    void trackOnOtherLayerDoesNotConnect() {
        Netlist netlist = resolver.resolve(board("""
                (footprint "A" (layer "F.Cu") (at 0 0)
                  (property "Reference" "R1")
                  (pad "1" smd rect (at 0 0) (size 1 1) (layers "F.Cu")))
                (footprint "B" (layer "F.Cu") (at 10 0)
                  (property "Reference" "R2")
                  (pad "1" smd rect (at 0 0) (size 1 1) (layers "F.Cu")))
                (segment (start 0 0) (end 10 0) (width 0.25) (layer "B.Cu") (net 0))
                """));

        assertEquals(2, netlist.nets().size());
    }

    @Test
    void viaLinksTracksOnBothSides() {
        Netlist netlist = resolver.resolve(board("""
                (footprint "A" (layer "F.Cu") (at 0 0)
                  (property "Reference" "R1")
                  (pad "1" smd rect (at 0 0) (size 1 1) (layers "F.Cu")))
                (footprint "B" (layer "B.Cu") (at 10 0)
                  (property "Reference" "R2")
                  (pad "1" smd rect (at 0 0) (size 1 1) (layers "B.Cu")))
                (segment (start 0 0) (end 5 0) (width 0.25) (layer "F.Cu") (net 0))
                (via (at 5 0) (size 0.6) (drill 0.3) (layers "F.Cu" "B.Cu") (net 0))
                (segment (start 5 0) (end 10 0) (width 0.25) (layer "B.Cu") (net 0))
                """));

        assertEquals(1, netlist.nets().size());
    }

    @Test
    void conflictingDeclaredNamesAreReported() {
        Netlist netlist = resolver.resolve(board("""
                (footprint "A" (layer "F.Cu") (at 0 0)
                  (property "Reference" "R1")
                  (pad "1" smd rect (at 0 0) (size 1 1) (layers "F.Cu") (net 1 "GND")))
                (footprint "B" (layer "F.Cu") (at 10 0)
                  (property "Reference" "R2")
                  (pad "1" smd rect (at 0 0) (size 1 1) (layers "F.Cu") (net 2 "VCC")))
                (segment (start 0 0) (end 10 0) (width 0.25) (layer "F.Cu") (net 1))
                """));

        assertEquals(1, netlist.nets().size());
        assertEquals("VCC", netlist.nets().get(0).name());
        NetConflict conflict = netlist.conflicts().get(0);
        assertEquals(List.of("GND", "VCC"), conflict.names());
        assertEquals(PinRef.ROOT_SHEET, conflict.sheetPath());
    }

    @Test
    void resultDoesNotDependOnDeclarationOrder() {
        PcbModel model = Fixtures.pcb("board.kicad_pcb");
        PcbModel reversed = new PcbModel(model.source(), model.layers(), model.nets(),
                reverse(model.footprints()), reverse(model.tracks()), reverse(model.vias()),
                reverse(model.zones()), model.issues());

        assertEquals(resolver.resolve(model), resolver.resolve(reversed));
    }

    private static <T> List<T> reverse(List<T> list) {
        List<T> copy = new ArrayList<>(list);
        Collections.reverse(copy);
        return copy;
    }
}
