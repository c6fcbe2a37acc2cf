package tree;

import java.util.ArrayList;

import taxon.Taxon;

/**
 * Node of a rooted tree. Leaves carry a taxon, internal nodes carry the
 * support label read from the tree file (null when the node had none).
 */
public class TreeNode {

    public int index;
    public ArrayList<TreeNode> childs;      // null for leaves
    public TreeNode parent;
    public Taxon taxon;
    public Long supportValue;

    public TreeNode setIndex(int index){
        this.index = index;
        return this;
    }

    public TreeNode setChilds(ArrayList<TreeNode> childs){
        this.childs = childs;
        return this;
    }

    public TreeNode setParent(TreeNode parent){
        this.parent = parent;
        return this;
    }

    public TreeNode setTaxon(Taxon taxon){
        this.taxon = taxon;
        return this;
    }

    public TreeNode setSupportValue(Long supportValue){
        this.supportValue = supportValue;
        return this;
    }

    public boolean isLeaf(){
        return childs == null;
    }

    public boolean isRoot(){
        return parent == null;
    }

    @Override
    public String toString(){
        if(isLeaf())
            return "Leaf[" + index + ", " + taxon + "]";
        return "Node[" + index + ", children=" + childs.size() + ", support=" + supportValue + "]";
    }
}
