package nl.bytesoflife.deltakicad.bom;

import nl.bytesoflife.deltakicad.model.Component;
import nl.bytesoflife.deltakicad.model.DesignModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Groups the parts of a design into BOM lines keyed by trimmed, case-sensitive
 * (value, footprint). Parts excluded from the BOM and virtual parts are left
 * out. A reference seen more than once (one per unit of a multi-unit symbol)
 * is counted once.
 */
public class BomAggregator {

    private static final Logger log = LoggerFactory.getLogger(BomAggregator.class);

    private static final Comparator<Key> KEY_ORDER = Comparator
            .comparing(Key::value)
            .thenComparing(Key::footprint);

    private record Key(String value, String footprint) {
    }

    private static final class Group {
        final SortedSet<String> references = new TreeSet<>(ReferenceComparator.INSTANCE);
        String datasheet = "";
        String description = "";
    }

    public BomRecord aggregate(DesignModel model) {
        return aggregate(model.source(), model.components());
    }

    public BomRecord aggregate(String source, Collection<? extends Component> components) {
        Map<Key, Group> groups = new TreeMap<>(KEY_ORDER);
        int skipped = 0;
        for (Component component : components) {
            if (!component.inBom() || component.isVirtual()) {
                skipped++;
                continue;
            }
            Key key = new Key(normalize(component.value()), normalize(component.footprint()));
            Group group = groups.computeIfAbsent(key, k -> new Group());
            group.references.add(component.reference());
            if (group.datasheet.isEmpty() && component.datasheet() != null) {
                group.datasheet = component.datasheet().trim();
            }
            if (group.description.isEmpty() && component.description() != null) {
                group.description = component.description().trim();
            }
        }

        List<BomEntry> entries = new ArrayList<>();
        for (Map.Entry<Key, Group> entry : groups.entrySet()) {
            Group group = entry.getValue();
            entries.add(new BomEntry(entries.size() + 1, entry.getKey().value(), entry.getKey().footprint(),
                    new ArrayList<>(group.references), group.datasheet, group.description));
        }
        log.debug("BOM for {}: {} lines, {} parts left out", source, entries.size(), skipped);
        return new BomRecord(source, entries);
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim();
    }
}
