package preprocessing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import tree.Clade;
import tree.CladeTable;
import tree.MalformedTreeException;
import tree.Tree;
import tree.TreeNode;

/**
 * Folds the clades of one input tree into the shared clade table.
 *
 * Every internal node contributes its leaf set as a candidate clade. Leaf
 * sets already present in the table (same taxa, in any order) receive the
 * node's support label; new leaf sets are recorded under the next clade id.
 * Calling collect twice with the same tree counts its support twice.
 */
public class CladeCollector {

    private final CladeTable table;

    public CladeCollector(CladeTable table) {
        this.table = table;
    }

    /**
     * Collects the taxa and clades of a tree.
     *
     * @return number of internal nodes that contributed support
     */
    public int collect(Tree tree) {
        Map<TreeNode, List<String>> leafSets = new HashMap<>();
        int contributed = 0;

        // post-order, so children are resolved before their parent
        for (TreeNode node : tree.topSortedNodes) {
            if (node.isLeaf()) {
                table.addTaxon(node.taxon.label);
                leafSets.put(node, Collections.singletonList(node.taxon.label));
                continue;
            }

            SortedSet<String> below = new TreeSet<>();
            for (TreeNode child : node.childs) {
                below.addAll(leafSets.get(child));
            }
            List<String> members = new ArrayList<>(below);
            leafSets.put(node, members);

            if (members.size() < 2) {
                continue;
            }
            if (node.supportValue == null) {
                if (node.isRoot()) {
                    // unlabelled root: outer wrapper of the Newick string
                    continue;
                }
                throw new MalformedTreeException("Internal node above " + members + " has no support value");
            }

            Clade clade = table.insertOrAccumulate(members, node.supportValue);
            if (clade != null) {
                contributed++;
            }
        }
        return contributed;
    }
}
