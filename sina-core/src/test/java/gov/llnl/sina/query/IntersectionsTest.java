package gov.llnl.sina.query;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import gov.llnl.sina.data.Stream;

public class IntersectionsTest {

    private static Stream<String> sorted(final String... ids) {
        return Stream.create(ids).setProperty(Stream.PROPERTY_SORTED, true);
    }

    @Test
    public void testMergeIntersect() {
        final Stream<String> first = sorted("a", "b", "c", "e", "g");
        final Stream<String> second = sorted("b", "c", "d", "g");
        final Stream<String> third = sorted("a", "c", "g", "h");
        final Stream<String> result = Intersections.intersect(ImmutableList.of(first, second,
                third));
        Assert.assertTrue(Intersections.isSorted(result));
        Assert.assertEquals(ImmutableList.of("c", "g"), result.toList());
        Assert.assertTrue(first.isClosed());
        Assert.assertTrue(second.isClosed());
        Assert.assertTrue(third.isClosed());
    }

    @Test
    public void testMergeIntersectSkipsDuplicates() {
        final Stream<String> result = Intersections.intersect(ImmutableList.of(
                sorted("a", "a", "b", "b", "c"), sorted("a", "b", "b")));
        Assert.assertEquals(ImmutableList.of("a", "b"), result.toList());
    }

    @Test
    public void testMergeIntersectEmptyInput() {
        final Stream<String> result = Intersections.intersect(ImmutableList.of(sorted("a", "b"),
                Stream.<String>create().setProperty(Stream.PROPERTY_SORTED, true)));
        Assert.assertTrue(result.toList().isEmpty());
    }

    @Test
    public void testIntersectIgnoresInputOrder() {
        final List<List<String>> inputs = ImmutableList.<List<String>>of(
                ImmutableList.of("a", "b", "d", "f", "k"),
                ImmutableList.of("b", "d", "e", "k"),
                ImmutableList.of("a", "b", "c", "d", "k", "z"));
        for (final List<List<String>> permutation : Collections2.permutations(inputs)) {
            final List<Stream<String>> merged = Lists.newArrayList();
            final List<Stream<String>> hashed = Lists.newArrayList();
            for (final List<String> ids : permutation) {
                merged.add(Stream.create(ids).setProperty(Stream.PROPERTY_SORTED, true));
                hashed.add(Stream.create(Lists.reverse(ids)));
            }
            Assert.assertEquals(ImmutableList.of("b", "d", "k"), Intersections.intersect(merged)
                    .toList());
            Assert.assertEquals(ImmutableSet.of("b", "d", "k"), Intersections.intersect(hashed)
                    .toSet());
        }
    }

    @Test
    public void testSetIntersect() {
        final Stream<String> result = Intersections.intersect(ImmutableList.of(
                Stream.create("d", "a", "c", "a"), sorted("a", "b", "c"),
                Stream.create("c", "a", "z")));
        Assert.assertFalse(Intersections.isSorted(result));
        Assert.assertEquals(ImmutableList.of("a", "c"), result.toList());
    }

    @Test
    public void testSingleStream() {
        final Stream<String> result = Intersections.intersect(ImmutableList.of(Stream.create(
                "b", "a", "b")));
        Assert.assertEquals(ImmutableList.of("b", "a"), result.toList());
    }

    @Test(expected = EmptyQueryException.class)
    public void testNothingToIntersect() {
        Intersections.intersect(ImmutableList.<Stream<String>>of());
    }

    @Test
    public void testUnion() {
        final List<Stream<String>> streams = ImmutableList.of(Stream.create("a", "b"),
                Stream.create("b", "c"));
        Assert.assertEquals(ImmutableSet.of("a", "b", "c"), Intersections.union(streams)
                .toSet());
        Assert.assertTrue(streams.get(1).isClosed());
    }

    @Test
    public void testSorted() {
        final Stream<String> stream = Intersections.sorted(ImmutableList.of("c", "a", "b", "a"));
        Assert.assertTrue(Intersections.isSorted(stream));
        Assert.assertEquals(ImmutableList.of("a", "b", "c"), stream.toList());
    }

}
