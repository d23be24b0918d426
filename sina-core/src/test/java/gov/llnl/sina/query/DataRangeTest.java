package gov.llnl.sina.query;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import gov.llnl.sina.data.ParseException;

public class DataRangeTest {

    @Test
    public void testDefaultInclusiveness() {
        final DataRange range = DataRange.create(1, 2);
        Assert.assertEquals(1.0, range.getMin());
        Assert.assertEquals(2.0, range.getMax());
        Assert.assertTrue(range.isMinInclusive());
        Assert.assertFalse(range.isMaxInclusive());
        Assert.assertTrue(range.isNumeric());
        Assert.assertFalse(range.isLexicographic());
    }

    @Test
    public void testAbsentBoundIsNeverInclusive() {
        final DataRange range = DataRange.create(null, 5, true, true);
        Assert.assertFalse(range.hasMin());
        Assert.assertFalse(range.isMinInclusive());
        Assert.assertTrue(range.isMaxInclusive());
    }

    @Test
    public void testContains() {
        final DataRange range = DataRange.create(1, 2, false, true);
        Assert.assertFalse(range.contains(1));
        Assert.assertTrue(range.contains(1.5));
        Assert.assertTrue(range.contains(2));
        Assert.assertFalse(range.contains(2.0001));
        Assert.assertFalse(range.contains("1.5"));
        Assert.assertFalse(range.contains(null));

        final DataRange strings = DataRange.lexicographic("apple", "banana", true, false);
        Assert.assertTrue(strings.contains("apple"));
        Assert.assertTrue(strings.contains("avocado"));
        Assert.assertFalse(strings.contains("banana"));
        Assert.assertFalse(strings.contains(1));
    }

    @Test
    public void testSingleValue() {
        Assert.assertTrue(DataRange.equalTo(3).isSingleValue());
        Assert.assertTrue(DataRange.equalTo("x").contains("x"));
        Assert.assertFalse(DataRange.atLeast(3).isSingleValue());
    }

    @Test
    public void testNegativeZero() {
        final DataRange zero = DataRange.equalTo(-0.0);
        Assert.assertEquals(DataRange.equalTo(0), zero);
        Assert.assertTrue(zero.contains(0.0));
        Assert.assertTrue(DataRange.equalTo(0).contains(-0.0));
        Assert.assertTrue(DataRange.create(-0.0, 0.0, true, true).isSingleValue());
        Assert.assertFalse(DataRange.create(0, 1, false, true).contains(-0.0));
    }

    @Test
    public void testSpan() {
        Assert.assertEquals(DataRange.create(0, 6), DataRange.span(ImmutableList.of(
                DataRange.create(0, 2), DataRange.create(4, 6))));
        Assert.assertEquals(DataRange.create(4, 7, true, true), DataRange.span(ImmutableList.of(
                DataRange.create(4, 6, true, true), DataRange.equalTo(7))));
        Assert.assertEquals(DataRange.create(1, 3, true, true), DataRange.span(ImmutableList.of(
                DataRange.create(1, 3, false, true), DataRange.create(1, 2, true, false))));
        Assert.assertEquals(DataRange.atMost(5), DataRange.span(ImmutableList.of(
                DataRange.lessThan(2), DataRange.create(3, 5, true, true))));
        Assert.assertNull(DataRange.span(ImmutableList.of(DataRange.lessThan(2),
                DataRange.atLeast(3))));
    }

    @Test(expected = MixedCriteriaException.class)
    public void testSpanMixed() {
        DataRange.span(ImmutableList.of(DataRange.equalTo(1), DataRange.equalTo("a")));
    }

    @Test(expected = InvalidRangeException.class)
    public void testNoBounds() {
        DataRange.create(null, null);
    }

    @Test(expected = InvalidRangeException.class)
    public void testMixedBounds() {
        DataRange.create(1, "b");
    }

    @Test(expected = InvalidRangeException.class)
    public void testMinAboveMax() {
        DataRange.create(5, 1);
    }

    @Test(expected = InvalidRangeException.class)
    public void testEmptyDegenerateRange() {
        DataRange.create(2, 2, true, false);
    }

    @Test(expected = InvalidRangeException.class)
    public void testNaN() {
        DataRange.atLeast(Double.NaN);
    }

    @Test
    public void testParse() {
        Assert.assertEquals(DataRange.create(1, 2, true, false), DataRange.parse("[1,2)"));
        Assert.assertEquals(DataRange.create(null, 2, false, true), DataRange.parse("(,2]"));
        Assert.assertEquals(DataRange.greaterThan("cat"), DataRange.parse("(cat,)"));
        Assert.assertEquals(DataRange.equalTo(5), DataRange.parse("5"));
        Assert.assertEquals(DataRange.equalTo("fast"), DataRange.parse("fast"));
        Assert.assertEquals(DataRange.create(-1.5, 3e2, true, true),
                DataRange.parse(" [ -1.5 , 3e2 ] "));
    }

    @Test
    public void testParseErrors() {
        for (final String string : new String[] { "", "[1,2", "1,2]", "{1,2}", "[1,2,3]",
                "[2,1]", "[,]", "[1" }) {
            try {
                DataRange.parse(string);
                Assert.fail("Expected ParseException for '" + string + "'");
            } catch (final ParseException ex) {
                // expected
            }
        }
    }

    @Test
    public void testToString() {
        Assert.assertEquals("[1.0,2.0)", DataRange.create(1, 2).toString());
        Assert.assertEquals("(,b]", DataRange.atMost("b").toString());
    }

    @Test
    public void testHalves() {
        final DataRange range = DataRange.create(1, 4, false, true);
        Assert.assertEquals(DataRange.greaterThan(1), range.lowerHalf());
        Assert.assertEquals(DataRange.atMost(4), range.upperHalf());
        Assert.assertNull(DataRange.atMost(4).lowerHalf());
        Assert.assertNull(DataRange.atLeast(4).upperHalf());
        final DataRange half = DataRange.atLeast(4);
        Assert.assertSame(half, half.lowerHalf());
    }

    @Test
    public void testComplementOfBoundedRange() {
        final List<DataRange> complement = DataRange.complement(ImmutableList.of(DataRange
                .create(1, 4)));
        Assert.assertEquals(ImmutableList.of(DataRange.lessThan(1), DataRange.atLeast(4)),
                complement);
    }

    @Test
    public void testComplementOfValues() {
        final List<DataRange> complement = DataRange.complement(ImmutableList.of(
                DataRange.equalTo("b"), DataRange.equalTo("a")));
        Assert.assertEquals(ImmutableList.of(DataRange.lessThan("a"),
                DataRange.create("a", "b", false, false), DataRange.greaterThan("b")),
                complement);
    }

    @Test
    public void testComplementMergesOverlaps() {
        final List<DataRange> complement = DataRange.complement(ImmutableList.of(
                DataRange.create(0, 5), DataRange.create(3, 8),
                DataRange.create(8, 10, false, false)));
        Assert.assertEquals(ImmutableList.of(DataRange.lessThan(0), DataRange.equalTo(8),
                DataRange.atLeast(10)), complement);
    }

    @Test
    public void testComplementOfUnboundedRanges() {
        Assert.assertEquals(ImmutableList.of(DataRange.create(2, 5, true, false)), DataRange
                .complement(ImmutableList.of(DataRange.lessThan(2), DataRange.atLeast(5))));
        Assert.assertTrue(DataRange.complement(
                ImmutableList.of(DataRange.atMost(2), DataRange.greaterThan(1))).isEmpty());
    }

    @Test(expected = MixedCriteriaException.class)
    public void testComplementMixed() {
        DataRange.complement(ImmutableList.of(DataRange.equalTo(1), DataRange.equalTo("a")));
    }

}
