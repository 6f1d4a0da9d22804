package nl.bytesoflife.deltakicad.netlist;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Disjoint-set forest with path compression and union by rank. Elements are
 * added on first use. Not thread safe; each resolve call owns its own instance.
 */
public class UnionFind<T> {

    private final Map<T, T> parent = new LinkedHashMap<>();
    private final Map<T, Integer> rank = new HashMap<>();

    public void add(T element) {
        if (!parent.containsKey(element)) {
            parent.put(element, element);
            rank.put(element, 0);
        }
    }

    public boolean contains(T element) {
        return parent.containsKey(element);
    }

    public T find(T element) {
        add(element);
        T root = element;
        while (!parent.get(root).equals(root)) {
            root = parent.get(root);
        }
        T current = element;
        while (!current.equals(root)) {
            T next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    public void union(T a, T b) {
        T rootA = find(a);
        T rootB = find(b);
        if (rootA.equals(rootB)) return;
        int rankA = rank.get(rootA);
        int rankB = rank.get(rootB);
        if (rankA < rankB) {
            parent.put(rootA, rootB);
        } else if (rankA > rankB) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootB, rootA);
            rank.put(rootA, rankA + 1);
        }
    }

    public boolean connected(T a, T b) {
        return find(a).equals(find(b));
    }

    /**
     * All sets, keyed by their root, members in insertion order.
     */
    public Map<T, List<T>> groups() {
        Map<T, List<T>> groups = new LinkedHashMap<>();
        for (T element : new ArrayList<>(parent.keySet())) {
            groups.computeIfAbsent(find(element), k -> new ArrayList<>()).add(element);
        }
        return groups;
    }
}
