package tree;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import utils.SetRelations;

/**
 * Clade table shared by the collection, subdivision and reconstruction phases.
 *
 * The table owns every clade observed in the input forest together with the
 * universe of taxa. It only grows during collection; the later phases read
 * it and keep their own working sets of clade ids.
 */
public class CladeTable {

    private final Map<Integer, Clade> clades = new TreeMap<>();
    private final NavigableSet<String> universe = new TreeSet<>();
    private int cladeCount = 0;

    /**
     * Adds support to the clade with exactly these members, or records a new
     * clade under the next unused id. Member sets with fewer than two taxa
     * are ignored and null is returned.
     */
    public synchronized Clade insertOrAccumulate(List<String> members, long support) {
        if (members.size() < 2) {
            return null;
        }
        Clade existing = findIdentical(members);
        if (existing != null) {
            existing.addSupport(support);
            return existing;
        }
        cladeCount++;
        Clade clade = new Clade(cladeCount, members, support);
        clades.put(clade.id, clade);
        return clade;
    }

    /**
     * Linear search by size and mutual containment.
     */
    public synchronized Clade findIdentical(List<String> members) {
        for (Clade clade : clades.values()) {
            if (SetRelations.isSameSet(clade.members, members)) {
                return clade;
            }
        }
        return null;
    }

    public synchronized void addTaxon(String label) {
        universe.add(label);
    }

    public synchronized Clade get(int id) {
        Clade clade = clades.get(id);
        if (clade == null) {
            throw new IllegalArgumentException("Unknown clade id " + id);
        }
        return clade;
    }

    /**
     * A fresh, modifiable copy of all clade ids in ascending order.
     */
    public synchronized SortedSet<Integer> cladeIds() {
        return new TreeSet<>(clades.keySet());
    }

    public synchronized SortedSet<String> getUniverse() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(universe));
    }

    public synchronized int size() {
        return clades.size();
    }

    public synchronized boolean isEmpty() {
        return clades.isEmpty();
    }
}
