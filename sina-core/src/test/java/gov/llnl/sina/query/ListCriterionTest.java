package gov.llnl.sina.query;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class ListCriterionTest {

    @Test
    public void testRangeOperation() {
        final ListCriterion criterion = ListCriterion.allIn(DataRange.create(0, 4));
        Assert.assertEquals(ListOperation.ALL_IN, criterion.getOperation());
        Assert.assertTrue(criterion.isNumeric());
        Assert.assertEquals(DataRange.create(0, 4), criterion.getRange());
        Assert.assertTrue(ListOperation.ANY_IN.isRangeOperation());
        Assert.assertFalse(ListOperation.ONLY.isRangeOperation());
    }

    @Test
    public void testEntriesAreNormalized() {
        final ListCriterion criterion = ListCriterion.hasAll(1, 2L, 3.5f);
        Assert.assertEquals(ImmutableList.<Object>of(1.0, 2.0, 3.5), criterion.getEntries());
        Assert.assertEquals(ImmutableList.of(DataRange.equalTo(1), DataRange.equalTo(2),
                DataRange.equalTo(3.5)), criterion.getRanges());
    }

    @Test
    public void testValuesAndRanges() {
        final ListCriterion criterion = ListCriterion.hasAny("a", DataRange.atLeast("x"));
        Assert.assertFalse(criterion.isNumeric());
        Assert.assertEquals(ImmutableList.of(DataRange.equalTo("a"), DataRange.atLeast("x")),
                criterion.getRanges());
    }

    @Test(expected = IllegalStateException.class)
    public void testGetRangeOfMembershipOperation() {
        ListCriterion.only("a", "b").getRange();
    }

    @Test(expected = MixedCriteriaException.class)
    public void testMixedEntries() {
        ListCriterion.hasAny("a", 1);
    }

    @Test(expected = MixedCriteriaException.class)
    public void testMixedRangeAndValue() {
        ListCriterion.hasAll(DataRange.create(1, 2), "b");
    }

    @Test(expected = MixedCriteriaException.class)
    public void testNoEntries() {
        ListCriterion.only();
    }

    @Test(expected = MixedCriteriaException.class)
    public void testUnsupportedEntry() {
        ListCriterion.hasAny(true);
    }

    @Test
    public void testEquality() {
        Assert.assertEquals(ListCriterion.hasAll("a", "b"), ListCriterion.hasAll("a", "b"));
        Assert.assertNotEquals(ListCriterion.hasAll("a", "b"), ListCriterion.only("a", "b"));
        Assert.assertEquals("HAS_ALL[a, b]", ListCriterion.hasAll("a", "b").toString());
    }

}
