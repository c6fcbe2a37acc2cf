package tree;

import java.util.Arrays;
import java.util.Collections;

import junit.framework.TestCase;

public class CladeTableTest extends TestCase {

    public void testNewMemberSetsGetIncreasingIds() {
        CladeTable table = new CladeTable();
        Clade first = table.insertOrAccumulate(Arrays.asList("A", "B"), 2);
        Clade second = table.insertOrAccumulate(Arrays.asList("A", "B", "C"), 1);

        assertEquals(1, first.id);
        assertEquals(2, second.id);
        assertEquals(2, table.size());
        assertEquals(Arrays.asList(1, 2), Arrays.asList(table.cladeIds().toArray(new Integer[0])));
    }

    public void testIdenticalMemberSetsAccumulateSupport() {
        CladeTable table = new CladeTable();
        table.insertOrAccumulate(Arrays.asList("A", "B", "C"), 2);
        Clade again = table.insertOrAccumulate(Arrays.asList("C", "A", "B"), 3);

        assertEquals(1, again.id);
        assertEquals(5, again.getSupport());
        assertEquals(1, table.size());
    }

    public void testSameSizeDifferentMembersAreDistinct() {
        CladeTable table = new CladeTable();
        table.insertOrAccumulate(Arrays.asList("A", "B"), 1);
        table.insertOrAccumulate(Arrays.asList("A", "C"), 1);

        assertEquals(2, table.size());
    }

    public void testSingletonsAreNotRecorded() {
        CladeTable table = new CladeTable();
        assertNull(table.insertOrAccumulate(Collections.singletonList("A"), 4));
        assertTrue(table.isEmpty());
    }

    public void testMembersAreSorted() {
        CladeTable table = new CladeTable();
        Clade clade = table.insertOrAccumulate(Arrays.asList("C", "A", "B"), 1);
        assertEquals(Arrays.asList("A", "B", "C"), clade.members);
        assertTrue(clade.contains("B"));
        assertFalse(clade.contains("D"));
    }

    public void testCladeIdsIsACopy() {
        CladeTable table = new CladeTable();
        table.insertOrAccumulate(Arrays.asList("A", "B"), 1);
        table.cladeIds().clear();
        assertEquals(1, table.cladeIds().size());
    }

    public void testUniverseIsSorted() {
        CladeTable table = new CladeTable();
        table.addTaxon("C");
        table.addTaxon("A");
        table.addTaxon("C");
        assertEquals(Arrays.asList("A", "C"), Arrays.asList(table.getUniverse().toArray(new String[0])));
    }

    public void testUnknownIdIsRejected() {
        try {
            new CladeTable().get(7);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testCladeNeedsTwoMembers() {
        try {
            new Clade(1, Collections.singletonList("A"), 1);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
