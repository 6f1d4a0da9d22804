package nl.bytesoflife.deltakicad.project;

import nl.bytesoflife.deltakicad.model.ExtractionIssue;
import nl.bytesoflife.deltakicad.model.schematic.SchematicModel;
import nl.bytesoflife.deltakicad.netlist.SheetInstance;

import java.util.List;
import java.util.Map;

/**
 * A root schematic with every sheet file below it.
 *
 * @param sheets    sheet models keyed by {@link SheetInstance#fileKey(String)}
 * @param instances sheet placements, depth first, root first
 * @param issues    problems found while loading: unreadable or unparsable
 *                  sheet files, missing sheets and sheet cycles
 */
public record SchematicProject(SchematicModel root, Map<String, SchematicModel> sheets,
                               List<SheetInstance> instances, List<ExtractionIssue> issues) {

    public SchematicProject {
        sheets = Map.copyOf(sheets);
        instances = List.copyOf(instances);
        issues = List.copyOf(issues);
    }
}
