package core;

import java.util.List;
import java.util.SortedSet;

import preprocessing.CladeCollector;
import tree.Clade;
import tree.CladeTable;
import tree.Tree;
import utils.Config;

/**
 * Collection, subdivision and reconstruction in one call.
 */
public class ExhaustiveSubdivision {

    /**
     * Outcome of one analysis.
     */
    public static class Result {
        public final CladeTable cladeTable;
        public final SortedSet<Integer> retainedIds;   // clades delimiting the species
        public final String newick;

        Result(CladeTable cladeTable, SortedSet<Integer> retainedIds, String newick) {
            this.cladeTable = cladeTable;
            this.retainedIds = retainedIds;
            this.newick = newick;
        }
    }

    private final long minSupport;
    private final SubdivisionEngine engine = new SubdivisionEngine();
    private final TreeReconstructor reconstructor = new TreeReconstructor();

    public ExhaustiveSubdivision(long minSupport) {
        this.minSupport = minSupport;
    }

    /**
     * Collects the clades of the trees into a fresh table and analyses it.
     */
    public Result run(List<Tree> trees) {
        CladeTable table = new CladeTable();
        CladeCollector collector = new CladeCollector(table);
        for (Tree tree : trees) {
            collector.collect(tree);
        }
        return run(table);
    }

    public Result run(CladeTable table) {
        SortedSet<String> universe = table.getUniverse();
        if (universe.isEmpty()) {
            System.err.println("Warning: No taxa found in the input trees.");
        }

        SortedSet<Integer> retained = engine.subdivide(universe, table.cladeIds(), table, minSupport);

        if (Config.VERBOSE) {
            System.err.println("\n=== Exhaustive Subdivision Complete ===");
            System.err.println("Minimum support: " + minSupport);
            System.err.println("Retained clades: " + retained.size() + " of " + table.size());
            for (int id : retained) {
                Clade clade = table.get(id);
                System.err.println("  " + id + " : " + clade.getSupport() + " : " + String.join(",", clade.members));
            }
        }

        String newick = reconstructor.renderNewick(universe, retained, table);
        return new Result(table, retained, newick);
    }
}
