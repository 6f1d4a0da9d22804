package nl.bytesoflife.deltakicad.netlist;

import nl.bytesoflife.deltakicad.model.PinRef;

import java.util.*;

/**
 * The partition of a design's pins into named nets, plus any naming conflicts
 * found while resolving it.
 */
public record Netlist(List<Net> nets, List<NetConflict> conflicts) {

    public Netlist {
        nets = List.copyOf(nets);
        conflicts = List.copyOf(conflicts);
    }

    public Optional<Net> find(String name) {
        return nets.stream().filter(n -> n.name().equals(name)).findFirst();
    }

    public Optional<Net> netOf(PinRef pin) {
        return nets.stream().filter(n -> n.pins().contains(pin)).findFirst();
    }

    public int pinCount() {
        int count = 0;
        for (Net net : nets) {
            count += net.pins().size();
        }
        return count;
    }

    /**
     * The nets as plain pin sets, for comparing partitions independent of naming.
     */
    public Set<Set<PinRef>> partition() {
        Set<Set<PinRef>> partition = new HashSet<>();
        for (Net net : nets) {
            partition.add(Set.copyOf(net.pins()));
        }
        return partition;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    static List<Net> sorted(Collection<Net> nets) {
        List<Net> result = new ArrayList<>(nets);
        result.sort(Comparator.comparing(Net::name).thenComparing(n -> n.pins().get(0)));
        return result;
    }
}
