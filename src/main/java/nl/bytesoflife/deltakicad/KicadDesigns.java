package nl.bytesoflife.deltakicad;

import nl.bytesoflife.deltakicad.bom.BomAggregator;
import nl.bytesoflife.deltakicad.bom.BomCsvWriter;
import nl.bytesoflife.deltakicad.bom.BomMarkdownWriter;
import nl.bytesoflife.deltakicad.bom.BomRecord;
import nl.bytesoflife.deltakicad.diagram.MermaidClassDiagramExporter;
import nl.bytesoflife.deltakicad.diagram.MermaidExporter;
import nl.bytesoflife.deltakicad.export.DesignJsonExporter;
import nl.bytesoflife.deltakicad.extract.PcbExtractor;
import nl.bytesoflife.deltakicad.extract.SchematicExtractor;
import nl.bytesoflife.deltakicad.model.DesignModel;
import nl.bytesoflife.deltakicad.model.pcb.PcbModel;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;
import nl.bytesoflife.deltakicad.netlist.*;
import nl.bytesoflife.deltakicad.project.Projection;
import nl.bytesoflife.deltakicad.project.SchematicProject;
import nl.bytesoflife.deltakicad.project.SchematicProjectLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.SortedMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point for reading KiCad designs and deriving their projections.
 * <pre>
 * KicadDesigns designs = new KicadDesigns();
 * SchematicModel schematic = designs.parseSchematic(Path.of("board.kicad_sch"));
 * BomRecord bom = designs.toBom(schematic);
 * String mermaid = designs.toDiagram(schematic);
 * </pre>
 * Extractors and resolvers keep no state between calls, so one instance can
 * serve several threads.
 */
public class KicadDesigns {

    private static final Logger log = LoggerFactory.getLogger(KicadDesigns.class);

    public static final String SCHEMATIC_EXTENSION = ".kicad_sch";
    public static final String PCB_EXTENSION = ".kicad_pcb";

    private final ConnectivitySettings settings;
    private final SchematicExtractor schematicExtractor = new SchematicExtractor();
    private final PcbExtractor pcbExtractor = new PcbExtractor();
    private final BomAggregator bomAggregator = new BomAggregator();

    public KicadDesigns() {
        this(ConnectivitySettings.defaults());
    }

    public KicadDesigns(ConnectivitySettings settings) {
        this.settings = settings;
    }

    public SchematicModel parseSchematic(Path path) throws IOException {
        log.debug("Parsing schematic {}", path);
        return schematicExtractor.extract(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    public PcbModel parsePcb(Path path) throws IOException {
        log.debug("Parsing board {}", path);
        return pcbExtractor.extract(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    /**
     * Parses a schematic or board, chosen by file extension.
     */
    public DesignModel parse(Path path) throws IOException {
        String name = path.getFileName().toString();
        if (name.endsWith(SCHEMATIC_EXTENSION)) {
            return parseSchematic(path);
        }
        if (name.endsWith(PCB_EXTENSION)) {
            return parsePcb(path);
        }
        throw new IllegalArgumentException("Not a KiCad schematic or board file: " + path);
    }

    /**
     * Loads a root schematic and every sheet below it, using a private pool
     * sized to the machine.
     */
    public SchematicProject loadProject(Path rootSchematic) throws IOException {
        ExecutorService executor = Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors());
        try {
            return new SchematicProjectLoader(executor, schematicExtractor).load(rootSchematic);
        } finally {
            executor.shutdownNow();
        }
    }

    public Netlist resolveNets(DesignModel model) {
        if (model instanceof SchematicModel schematic) {
            return new SchematicNetlistResolver(settings).resolve(schematic);
        }
        if (model instanceof PcbModel board) {
            return new PcbNetlistResolver(settings).resolve(board);
        }
        throw new IllegalArgumentException("Unsupported design model: " + model.getClass().getName());
    }

    public Netlist resolveNets(SchematicProject project) {
        return new HierarchicalNetlistResolver(settings).resolve(project.instances());
    }

    public BomRecord toBom(DesignModel model) {
        return bomAggregator.aggregate(model);
    }

    public String toDiagram(DesignModel model) {
        return new MermaidExporter().export(model, resolveNets(model));
    }

    public String toClassDiagram(DesignModel model) {
        return new MermaidClassDiagramExporter().export(model, resolveNets(model));
    }

    /**
     * Number of distinct parts per symbol lib_id or footprint name.
     */
    public SortedMap<String, Integer> componentTypes(DesignModel model) {
        return new MermaidClassDiagramExporter().componentTypes(model);
    }

    public String toJson(DesignModel model) {
        DesignJsonExporter exporter = new DesignJsonExporter();
        if (model instanceof SchematicModel schematic) {
            return exporter.write(schematic, resolveNets(schematic));
        }
        if (model instanceof PcbModel board) {
            return exporter.write(board, resolveNets(board));
        }
        throw new IllegalArgumentException("Unsupported design model: " + model.getClass().getName());
    }

    /**
     * Renders one projection of a design as text.
     */
    public String render(DesignModel model, Projection projection) {
        return switch (projection) {
            case JSON -> toJson(model);
            case MERMAID -> toDiagram(model);
            case CLASS_DIAGRAM -> toClassDiagram(model);
            case BOM_CSV -> new BomCsvWriter().write(toBom(model));
            case BOM_MARKDOWN -> new BomMarkdownWriter().write(toBom(model));
            case BOM_JSON -> new DesignJsonExporter().write(toBom(model));
        };
    }

    public ConnectivitySettings getSettings() {
        return settings;
    }
}
