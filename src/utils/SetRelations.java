package utils;

import java.util.Collection;

/**
 * Set predicates over collections of taxon labels.
 *
 * Clade member lists are compared by membership only, so two lists with the
 * same labels in a different order describe the same clade.
 */
public final class SetRelations {

    private SetRelations() {
    }

    /**
     * Returns true if every element of {@code a} is contained in {@code b}.
     * Equal sets are subsets of each other.
     */
    public static boolean isSubset(Collection<String> a, Collection<String> b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Cannot compare a null taxon set");
        }
        for (String x : a) {
            if (!b.contains(x)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Same cardinality and mutual containment.
     */
    public static boolean isSameSet(Collection<String> a, Collection<String> b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Cannot compare a null taxon set");
        }
        return a.size() == b.size() && isSubset(a, b) && isSubset(b, a);
    }
}
