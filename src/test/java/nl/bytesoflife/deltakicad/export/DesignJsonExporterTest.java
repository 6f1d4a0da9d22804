package nl.bytesoflife.deltakicad.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import nl.bytesoflife.deltakicad.Fixtures;
import nl.bytesoflife.deltakicad.bom.BomAggregator;
import nl.bytesoflife.deltakicad.model.pcb.PcbModel;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;
import nl.bytesoflife.deltakicad.netlist.PcbNetlistResolver;
import nl.bytesoflife.deltakicad.netlist.SchematicNetlistResolver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DesignJsonExporterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DesignJsonExporter exporter = new DesignJsonExporter();

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Test
    void schematicDocument() throws Exception {
        SchematicModel model = Fixtures.schematic("amplifier.kicad_sch");
        JsonNode json = mapper.readTree(exporter.write(model, new SchematicNetlistResolver().resolve(model)));

        assertEquals(List.of("source", "components", "nets", "sheets", "issues", "conflicts"), fieldNames(json));
        assertEquals("amplifier.kicad_sch", json.get("source").asText());
        assertEquals(model.symbols().size(), json.get("components").size());
        assertEquals(11, json.get("nets").size());

        JsonNode r1 = json.get("components").get(0);
        assertEquals("R1", r1.get("reference").asText());
        assertEquals("Device:R", r1.get("libId").asText());
        assertEquals("NONE", r1.get("mirror").asText());
        assertEquals(2, r1.get("pins").size());

        JsonNode gnd = null;
        for (JsonNode net : json.get("nets")) {
            if (net.get("name").asText().equals("GND")) {
                gnd = net;
            }
        }
        assertNotNull(gnd);
        assertTrue(gnd.get("explicitName").asBoolean());
        assertEquals("#PWR01", gnd.get("pins").get(0).get("reference").asText());
        assertFalse(gnd.get("pins").get(0).has("sheet"));
        assertEquals(0, json.get("conflicts").size());
    }

    @Test
    void boardDocumentCarriesStatistics() throws Exception {
        PcbModel model = Fixtures.pcb("board.kicad_pcb");
        JsonNode json = mapper.readTree(exporter.write(model, new PcbNetlistResolver().resolve(model)));

        assertEquals(List.of("source", "modules", "tracks", "vias", "zones", "nets", "statistics", "issues",
                "conflicts"), fieldNames(json));
        assertEquals(4, json.get("modules").size());
        assertEquals(7, json.get("tracks").size());
        assertEquals(2, json.get("vias").size());
        assertEquals("VCC", json.get("zones").get(0).get("netName").asText());
        assertEquals(4, json.get("zones").get(0).get("outline").size());

        JsonNode j1 = json.get("modules").get(3);
        assertEquals("J1", j1.get("reference").asText());
        assertFalse(j1.get("inBom").asBoolean());
        assertFalse(j1.get("pads").get(0).has("netName"));

        JsonNode stats = json.get("statistics");
        assertEquals(2, stats.get("copperLayers").asInt());
        assertEquals(4, stats.get("components").asInt());
        assertEquals(7, stats.get("pads").asInt());
        assertEquals(2, stats.get("vias").asInt());
        assertEquals(6, stats.get("tracksByLayer").get("F.Cu").asInt());
        assertTrue(stats.has("boundingBox"));
    }

    @Test
    void bomDocument() throws Exception {
        JsonNode json = mapper.readTree(
                exporter.write(new BomAggregator().aggregate(Fixtures.schematic("amplifier.kicad_sch"))));

        JsonNode entries = json.get("bom");
        assertEquals(3, entries.size());
        JsonNode resistors = entries.get(1);
        assertEquals(2, resistors.get("item").asInt());
        assertEquals(3, resistors.get("quantity").asInt());
        assertEquals("R10", resistors.get("references").get(2).asText());
        assertEquals("Resistor", resistors.get("description").asText());
    }

    @Test
    void compactOutputHasNoLineBreaks() {
        SchematicModel model = Fixtures.schematic("simple.kicad_sch");
        String json = new DesignJsonExporter().withPrettyPrinting(false)
                .write(model, new SchematicNetlistResolver().resolve(model));

        assertFalse(json.contains("\n"));
        assertTrue(json.startsWith("{\"source\":\"simple.kicad_sch\""));
    }

    @Test
    void equalInputGivesEqualOutput() {
        SchematicModel model = Fixtures.schematic("amplifier.kicad_sch");
        SchematicNetlistResolver resolver = new SchematicNetlistResolver();

        assertEquals(exporter.write(model, resolver.resolve(model)),
                exporter.write(Fixtures.schematic("amplifier.kicad_sch"), resolver.resolve(model)));
    }
}
