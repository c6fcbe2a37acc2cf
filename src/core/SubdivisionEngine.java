package core;

import java.util.Collection;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

import tree.Clade;
import tree.CladeTable;
import utils.Config;
import utils.SetRelations;

/**
 * Exhaustive subdivision of the taxa into phylogenetic species.
 *
 * For every taxon, the smallest clade that contains it and has sufficient
 * support is chosen, and every clade nested inside the chosen one is
 * discarded. Clades with too little support are dropped in favour of the
 * next larger enclosing clade, as long as more than one clade is left.
 *
 * Taxa are processed in lexicographic order. Among clades of equal size the
 * one with the lower clade id is chosen first.
 */
public class SubdivisionEngine {

    /**
     * Runs the subdivision over a working copy of candidateIds.
     *
     * @param universe every taxon of the input forest
     * @param candidateIds ids of the clades to choose from; not modified
     * @param table clade table the ids refer to
     * @param minSupport lowest support accepted while a larger clade remains
     * @return ids of the clades delimiting the species; empty if there were
     *         no candidates
     */
    public SortedSet<Integer> subdivide(Collection<String> universe, Collection<Integer> candidateIds,
                                        CladeTable table, long minSupport) {
        SortedSet<Integer> ids = new TreeSet<>(candidateIds);

        for (String taxon : new TreeSet<>(universe)) {
            while (true) {
                Clade now = smallestContaining(taxon, ids, table);
                if (now == null) {
                    // no clade left for this taxon: it stays a species of its own
                    if (Config.VERBOSE)
                        System.err.println("Taxon " + taxon + " is not in any remaining clade");
                    break;
                }

                // Remove all subclades of the selected clade
                Iterator<Integer> it = ids.iterator();
                while (it.hasNext()) {
                    int id = it.next();
                    if (id != now.id && SetRelations.isSubset(table.get(id).members, now.members)) {
                        it.remove();
                    }
                }

                if (now.getSupport() < minSupport && ids.size() > 1) {
                    // insufficient support: look for the next enclosing clade
                    ids.remove(now.id);
                    continue;
                }

                if (Config.VERBOSE)
                    System.err.println("Taxon " + taxon + " -> clade " + now.id
                            + " (" + now.size() + " taxa, support " + now.getSupport() + ")");
                break;
            }
        }
        return ids;
    }

    /**
     * Smallest clade among ids containing the taxon; lowest id on ties.
     */
    static Clade smallestContaining(String taxon, SortedSet<Integer> ids, CladeTable table) {
        Clade best = null;
        for (int id : ids) {
            Clade clade = table.get(id);
            if (!clade.contains(taxon)) {
                continue;
            }
            if (best == null || clade.size() < best.size()) {
                best = clade;
            }
        }
        return best;
    }
}
