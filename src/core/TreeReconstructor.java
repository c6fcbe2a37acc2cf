package core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import taxon.Taxon;
import tree.Clade;
import tree.CladeTable;
import tree.Tree;
import tree.TreeNode;
import utils.SetRelations;

/**
 * Turns the clades kept by the subdivision back into a nested tree.
 *
 * At every level the largest remaining clade becomes a group and claims the
 * remaining clades nested inside it; the claimed clades are resolved by the
 * recursive call for that group. Taxa not covered by any group at a level
 * are appended as loose leaves in lexicographic order. Each group is
 * annotated with the support of its clade.
 */
public class TreeReconstructor {

    /**
     * Builds the output tree. The root has no support label.
     */
    public Tree reconstruct(Collection<String> looseTaxa, Collection<Integer> retainedIds, CladeTable table) {
        Tree out = new Tree();
        ArrayList<TreeNode> children = build(out, new TreeSet<>(looseTaxa), new TreeSet<>(retainedIds), table);
        out.root = out.addInternalNode(children);
        out.topSort();
        return out;
    }

    /**
     * Comma separated rendering of one level, without the enclosing brackets.
     */
    public String render(Collection<String> looseTaxa, Collection<Integer> retainedIds, CladeTable table) {
        Tree out = new Tree();
        List<TreeNode> children = build(out, new TreeSet<>(looseTaxa), new TreeSet<>(retainedIds), table);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < children.size(); i++) {
            if (i > 0)
                sb.append(",");
            sb.append(out.getNewickFormat(children.get(i)));
        }
        return sb.toString();
    }

    /**
     * Full output line: {@code (<groups and loose taxa>);}
     */
    public String renderNewick(Collection<String> universe, Collection<Integer> retainedIds, CladeTable table) {
        return reconstruct(universe, retainedIds, table).getNewickFormat();
    }

    private ArrayList<TreeNode> build(Tree out, SortedSet<String> names, SortedSet<Integer> ids, CladeTable table) {
        ArrayList<TreeNode> nodes = new ArrayList<>();

        // Group clades as supersets and the subsets they claim
        Map<Clade, SortedSet<Integer>> supers = new LinkedHashMap<>();
        while (!ids.isEmpty()) {
            Clade now = largest(ids, table);
            ids.remove(now.id);
            SortedSet<Integer> claimed = new TreeSet<>();
            Iterator<Integer> it = ids.iterator();
            while (it.hasNext()) {
                int id = it.next();
                if (SetRelations.isSubset(table.get(id).members, now.members)) {
                    claimed.add(id);
                    it.remove();
                }
            }
            supers.put(now, claimed);
        }

        // Taxa inside a group are not loose at this level
        for (Clade group : supers.keySet()) {
            names.removeAll(group.members);
        }

        for (Map.Entry<Clade, SortedSet<Integer>> entry : supers.entrySet()) {
            Clade group = entry.getKey();
            ArrayList<TreeNode> children = build(out, new TreeSet<>(group.members), entry.getValue(), table);
            nodes.add(out.addInternalNode(children, group.getSupport()));
        }

        for (String name : names) {
            nodes.add(out.addLeaf(new Taxon(out.leavesCount, name)));
        }
        return nodes;
    }

    /**
     * Largest clade among ids; lowest id on ties.
     */
    static Clade largest(SortedSet<Integer> ids, CladeTable table) {
        Clade best = null;
        for (int id : ids) {
            Clade clade = table.get(id);
            if (best == null || clade.size() > best.size()) {
                best = clade;
            }
        }
        return best;
    }
}
