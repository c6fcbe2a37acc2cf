package core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import junit.framework.TestCase;
import taxon.Taxon;
import tree.Tree;

public class ExhaustiveSubdivisionTest extends TestCase {

    private Map<String, Taxon> taxaMap;

    @Override
    protected void setUp() {
        taxaMap = new HashMap<>();
    }

    private List<Tree> trees(String... newick) {
        List<Tree> trees = new ArrayList<>();
        for (String line : newick) {
            trees.add(new Tree(line, taxaMap));
        }
        return trees;
    }

    public void testEmptyForest() {
        ExhaustiveSubdivision.Result result = new ExhaustiveSubdivision(1).run(Collections.<Tree>emptyList());

        assertEquals("();", result.newick);
        assertTrue(result.retainedIds.isEmpty());
        assertTrue(result.cladeTable.isEmpty());
    }

    public void testSingleCladeOfTwoTaxa() {
        ExhaustiveSubdivision.Result result = new ExhaustiveSubdivision(1).run(trees("(X,Y)5;"));
        assertEquals("((X,Y)5);", result.newick);
    }

    public void testNestedCladeIsAbsorbedByCladeChosenForLaterTaxon() {
        ExhaustiveSubdivision.Result result = new ExhaustiveSubdivision(2).run(trees("(((A,B)2,C)1,D);"));

        assertEquals("((A,B,C)1,D);", result.newick);
        assertEquals(Collections.singletonList(2), new ArrayList<>(result.retainedIds));
    }

    public void testSupportFromSeveralTreesIsCombined() {
        ExhaustiveSubdivision.Result result = new ExhaustiveSubdivision(2).run(
                trees("(((A,B)4,C)3,(D,E)1)2;", "((A,B)1,(F,G)2);"));

        assertEquals("((A,B,C,D,E)2,(F,G)2);", result.newick);
        assertEquals(5, result.cladeTable.findIdentical(Arrays.asList("A", "B")).getSupport());
    }

    public void testEveryTaxonAppearsOnceInOutput() {
        ExhaustiveSubdivision.Result result = new ExhaustiveSubdivision(3).run(
                trees("((((A,B)5,C)2,(D,E)3)1,(F,G)1);", "(((A,B)1,C)2,H);"));

        Map<String, Integer> seen = new HashMap<>();
        for (String token : result.newick.split("[(),;]")) {
            if (!token.isEmpty() && !token.matches("\\d+")) {
                seen.merge(token, 1, Integer::sum);
            }
        }
        assertEquals(result.cladeTable.getUniverse(), new java.util.TreeSet<>(seen.keySet()));
        for (int count : seen.values()) {
            assertEquals(1, count);
        }
    }

    public void testTaxaWithTrailingWhitespaceAreNotDuplicated() {
        ExhaustiveSubdivision.Result result = new ExhaustiveSubdivision(1).run(
                trees("((A ,B)2,C);", "((A,B)3,C );"));

        assertEquals("((A,B)5,C);", result.newick);
        assertEquals(3, result.cladeTable.getUniverse().size());
    }
}
