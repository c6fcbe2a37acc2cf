package tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;
import java.util.Stack;

import taxon.Taxon;

/**
 * Tree: rooted tree with integer support labels on internal nodes.
 *
 * Input trees are the majority-rule concordance trees of the single-locus
 * analysis, where the label of an internal node counts the locus trees that
 * recover the grouping. The same structure is used for the output of the
 * reconstruction, whose internal nodes carry the summed clade support.
 */
public class Tree {

    // Core tree structure
    public ArrayList<TreeNode> nodes;               // All nodes in tree (internal + leaves)
    public ArrayList<TreeNode> topSortedNodes;      // Post-order, children before parents

    public TreeNode root;
    public Map<String, Taxon> taxaMap;              // Label to Taxon, shared by all input trees

    public int leavesCount;

    /**
     * Creates a new internal or leaf tree node.
     */
    public TreeNode addNode(ArrayList<TreeNode> children, TreeNode parent){

        TreeNode nd = new TreeNode().setIndex(nodes.size()).setChilds(children).setParent(parent);
        nodes.add(nd);
        return nd;
    }

    /**
     * Creates a new internal node with specified children.
     */
    public TreeNode addInternalNode(ArrayList<TreeNode> children){
        var nd = addNode(children, null);
        for (var x : children)
            x.setParent(nd);
        return nd;
    }

    /**
     * Creates a new internal node carrying a support value.
     */
    public TreeNode addInternalNode(ArrayList<TreeNode> children, Long support){
        return addInternalNode(children).setSupportValue(support);
    }

    public TreeNode addLeaf(Taxon taxon){
        var nd = addNode(null, null).setTaxon(taxon);
        leavesCount++;
        return nd;
    }

    /**
     * Parses a rooted tree from Newick format.
     *
     * Labels after a closing parenthesis are read as support counts, branch
     * lengths and bracketed comments are skipped. Leaf labels are mapped to
     * Taxon objects through taxaMap (and through the NEXUS translation table
     * first, when one is given).
     */
    private void parseFromNewick(String newickLine, Map<String, String> translate){

        nodes = new ArrayList<>();
        leavesCount = 0;

        Stack<TreeNode> stack = new Stack<>();
        int open = 0;
        boolean expectNode = true;

        int n = newickLine.length();
        int i = 0;

        while(i < n){
            char curr = newickLine.charAt(i);
            if(Character.isWhitespace(curr)){
                ++i;
            }
            else if(curr == '['){
                i = skipComment(newickLine, i);
            }
            else if(curr == '('){
                if(!expectNode)
                    throw new MalformedTreeException("Unexpected '('", i);
                // Start of internal node - push sentinel
                stack.push(null);
                open++;
                ++i;
            }
            else if(curr == ')'){
                if(open == 0)
                    throw new MalformedTreeException("Unbalanced ')'", i);
                if(expectNode)
                    throw new MalformedTreeException("Empty node before ')'", i);
                // End of internal node - collect children and create internal node
                ArrayList<TreeNode> arr = new ArrayList<>();
                while(stack.peek() != null){
                    arr.add(stack.pop());
                }
                stack.pop();
                open--;
                Collections.reverse(arr);

                StringBuilder label = new StringBuilder();
                i = readLabel(newickLine, i + 1, label);
                TreeNode internal = addInternalNode(arr, parseSupport(label.toString(), i));
                i = skipBranchLength(newickLine, i);
                stack.push(internal);
                expectNode = false;
            }
            else if(curr == ','){
                if(expectNode || open == 0)
                    throw new MalformedTreeException("Unexpected ','", i);
                expectNode = true;
                ++i;
            }
            else if(curr == ';'){
                break;
            }
            else{
                if(!expectNode)
                    throw new MalformedTreeException("Unexpected label", i);
                StringBuilder label = new StringBuilder();
                i = readLabel(newickLine, i, label);
                if(Taxon.normalizeLabel(label.toString()).isEmpty())
                    throw new MalformedTreeException("Empty leaf label", i);
                stack.push(addLeaf(lookupTaxon(label.toString(), translate)));
                i = skipBranchLength(newickLine, i);
                expectNode = false;
            }
        }

        if(open != 0)
            throw new MalformedTreeException("Unbalanced '(' in tree");
        if(stack.isEmpty())
            throw new MalformedTreeException("Tree contains no nodes");
        if(stack.size() > 1)
            throw new MalformedTreeException("Tree has more than one root");

        root = stack.pop();
        topSort();
    }

    private Taxon lookupTaxon(String rawLabel, Map<String, String> translate){
        String label = Taxon.normalizeLabel(rawLabel);
        if(translate != null && translate.containsKey(label))
            label = translate.get(label);
        synchronized (taxaMap) {
            Taxon taxon = taxaMap.get(label);
            if(taxon == null){
                taxon = new Taxon(taxaMap.size(), label);
                taxaMap.put(taxon.label, taxon);
            }
            return taxon;
        }
    }

    /**
     * Reads a quoted or unquoted label starting at index i. Returns the index
     * of the first character after the label.
     */
    private static int readLabel(String s, int i, StringBuilder out){
        int n = s.length();
        while(i < n && Character.isWhitespace(s.charAt(i)))
            ++i;
        if(i < n && s.charAt(i) == '\''){
            ++i;
            while(i < n){
                char c = s.charAt(i);
                if(c == '\''){
                    // '' is an escaped quote inside a quoted label
                    if(i + 1 < n && s.charAt(i + 1) == '\''){
                        out.append('\'');
                        i += 2;
                        continue;
                    }
                    return i + 1;
                }
                out.append(c);
                ++i;
            }
            throw new MalformedTreeException("Unterminated quoted label", i);
        }
        while(i < n){
            char c = s.charAt(i);
            if(c == '(' || c == ')' || c == ',' || c == ':' || c == ';' || c == '['){
                break;
            }
            out.append(c);
            ++i;
        }
        return i;
    }

    private static int skipBranchLength(String s, int i){
        int n = s.length();
        while(i < n && (Character.isWhitespace(s.charAt(i)) || s.charAt(i) == '[')){
            i = s.charAt(i) == '[' ? skipComment(s, i) : i + 1;
        }
        if(i < n && s.charAt(i) == ':'){
            i++;
            while(i < n){
                char c = s.charAt(i);
                if(c == ',' || c == ')' || c == ';' || c == '['){
                    break;
                }
                i++;
            }
        }
        return i;
    }

    private static int skipComment(String s, int i){
        int end = s.indexOf(']', i);
        if(end < 0)
            throw new MalformedTreeException("Unterminated comment", i);
        return end + 1;
    }

    private static Long parseSupport(String label, int position){
        String trimmed = label.trim();
        if(trimmed.isEmpty())
            return null;
        long value;
        try {
            value = Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            throw new MalformedTreeException("Support value '" + trimmed + "' is not an integer", position);
        }
        if(value < 0)
            throw new MalformedTreeException("Support value " + value + " is negative", position);
        return value;
    }

    public Tree(String newickLine, Map<String, Taxon> taxaMap){
        this(newickLine, taxaMap, null);
    }

    public Tree(String newickLine, Map<String, Taxon> taxaMap, Map<String, String> translate){
        this.taxaMap = taxaMap;
        parseFromNewick(newickLine, translate);
    }

    public Tree(){
        taxaMap = null;
        nodes = new ArrayList<>();
    }

    private void newickFormatUtil(TreeNode node, StringBuilder sb){
        if(node.isLeaf()){
            sb.append(node.taxon.label);
            return;
        }
        sb.append("(");
        for(int i = 0; i < node.childs.size(); ++i){
            newickFormatUtil(node.childs.get(i), sb);
            if(i != node.childs.size() - 1)
                sb.append(",");
        }
        sb.append(")");
        if(node.supportValue != null)
            sb.append(node.supportValue);
    }

    public String getNewickFormat(){
        return getNewickFormat(root) + ";";
    }

    /**
     * Newick text of the subtree below node, without the terminating ';'.
     */
    public String getNewickFormat(TreeNode node){
        StringBuilder sb = new StringBuilder();
        newickFormatUtil(node, sb);
        return sb.toString();
    }

    private void topSortUtil(TreeNode node, ArrayList<TreeNode> topSort){
        if(!node.isLeaf()){
            for(var x : node.childs){
                topSortUtil(x, topSort);
            }
        }
        topSort.add(node);
    }

    public void topSort(){
        ArrayList<TreeNode> topSort = new ArrayList<>();
        topSortUtil(root, topSort);
        this.topSortedNodes = topSort;
    }

    public int internalNodeCount(){
        return nodes.size() - leavesCount;
    }
}
