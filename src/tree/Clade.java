package tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A set of taxa united by at least one input tree as the descendants of a
 * common internal node.
 *
 * A clade is identified by the id it received when its member set was first
 * observed. Members are kept sorted; only membership is meaningful. Support
 * is the sum of the labels of every input node with exactly this leaf set.
 */
public class Clade {
    public final int id;
    public final List<String> members;
    private long support;

    public Clade(int id, List<String> members, long support) {
        if (members == null || members.size() < 2) {
            throw new IllegalArgumentException("A clade needs at least two members, got " + members);
        }
        if (support < 0) {
            throw new IllegalArgumentException("Negative clade support: " + support);
        }
        List<String> sorted = new ArrayList<>(members);
        Collections.sort(sorted);

        this.id = id;
        this.members = Collections.unmodifiableList(sorted);
        this.support = support;
    }

    public long getSupport() {
        return support;
    }

    /**
     * Adds the support label of another node with the same leaf set.
     */
    void addSupport(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Negative clade support: " + value);
        }
        support += value;
    }

    public int size() {
        return members.size();
    }

    public boolean contains(String taxon) {
        return Collections.binarySearch(members, taxon) >= 0;
    }

    @Override
    public String toString() {
        return "Clade[id=" + id + ", support=" + support + ", members=" + members + "]";
    }
}
