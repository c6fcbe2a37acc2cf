package preprocessing;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import taxon.Taxon;
import tree.CladeTable;
import tree.Tree;
import utils.Config;
import utils.Threading;

/**
 * ConcordanceTrees: the input forest of the exhaustive subdivision.
 *
 * Every input is the concordance / non-discordance tree of one analysis,
 * whose internal node labels count the single-locus trees supporting the
 * clade. This class reads the first tree of every input, with consistent
 * Taxon objects across all of them, and folds their clades into one
 * {@link CladeTable}.
 *
 * Parsing of separate inputs may run in parallel. Folding into the table is
 * always done afterwards in input order, so clade ids do not depend on
 * thread scheduling.
 */
public class ConcordanceTrees {

    // Core data structures
    public final List<String> inputs;               // Command line tree arguments
    public final ArrayList<Tree> trees;             // Parsed trees, in input order
    public final Map<String, Taxon> taxaMap;        // Label to Taxon mapping
    public final CladeTable cladeTable;

    private final TreeFileReader reader;

    public ConcordanceTrees(List<String> inputs) {
        this(inputs, new TreeFileReader());
    }

    public ConcordanceTrees(List<String> inputs, TreeFileReader reader) {
        this.inputs = new ArrayList<>(inputs);
        this.trees = new ArrayList<>();
        this.taxaMap = new HashMap<>();
        this.cladeTable = new CladeTable();
        this.reader = reader;
    }

    /**
     * Reads and parses the first tree of every input.
     *
     * Inputs without a tree are skipped with a warning. A malformed tree
     * aborts the whole run.
     */
    public void readTrees() throws IOException {
        if (Config.VERBOSE) {
            System.err.println("Reading " + inputs.size() + " tree input(s) using "
                    + Math.min(Config.threadCount(), Math.max(1, inputs.size())) + " thread(s)...");
        }

        List<Tree> parsed = Threading.mapInOrder(inputs, this::parseInput, Config.threadCount());

        for (int i = 0; i < parsed.size(); i++) {
            Tree tree = parsed.get(i);
            if (tree == null) {
                System.err.println("Warning: No tree found in '" + inputs.get(i) + "'.");
                continue;
            }
            trees.add(tree);
        }
    }

    private Tree parseInput(String input) throws IOException {
        TreeFileReader.TreeText text = reader.read(input);
        if (text == null) {
            return null;
        }
        Tree tree = new Tree(text.newick, taxaMap, text.translate);
        if (Config.VERBOSE) {
            System.err.println("Parsed " + input + ": " + tree.leavesCount + " taxa, "
                    + tree.internalNodeCount() + " internal nodes");
        }
        return tree;
    }

    /**
     * Folds the clades of every parsed tree into the clade table, one tree
     * after another.
     */
    public CladeTable collectClades() {
        CladeCollector collector = new CladeCollector(cladeTable);
        int contributing = 0;
        for (Tree tree : trees) {
            contributing += collector.collect(tree);
        }

        if (Config.VERBOSE) {
            System.err.println("\n=== Clade Collection Complete ===");
            System.err.println("Trees: " + trees.size());
            System.err.println("Taxa: " + cladeTable.getUniverse().size());
            System.err.println("Supported internal nodes: " + contributing);
            System.err.println("Unique clades: " + cladeTable.size());
        }
        return cladeTable;
    }
}
