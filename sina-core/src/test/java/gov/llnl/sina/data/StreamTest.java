package gov.llnl.sina.data;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.base.Function;
import com.google.common.base.Predicate;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;

public class StreamTest {

    @Test
    public void testIntermediateOperations() {
        final List<Integer> result = Stream.create(5, 1, 4, 1, 3, 2, 4)
                .filter(new Predicate<Integer>() {

                    @Override
                    public boolean apply(final Integer value) {
                        return value != 3;
                    }

                }).transform(new Function<Integer, Integer>() {

                    @Override
                    public Integer apply(final Integer value) {
                        return value * 10;
                    }

                }).distinct().slice(1, 3).toList();
        Assert.assertEquals(ImmutableList.of(10, 40, 20), result);
    }

    @Test
    public void testChunk() {
        final List<List<String>> chunks = Stream.create("a", "b", "c", "d", "e").chunk(2)
                .toList();
        Assert.assertEquals(ImmutableList.of(ImmutableList.of("a", "b"),
                ImmutableList.of("c", "d"), ImmutableList.of("e")), chunks);
    }

    @Test
    public void testConcat() {
        final Stream<String> stream = Stream.concat(ImmutableList.of(Stream.create("a", "b"),
                ImmutableList.<String>of(), Stream.create("c")));
        Assert.assertEquals(ImmutableList.of("a", "b", "c"), stream.toList());
    }

    @Test
    public void testTerminalOperations() {
        Assert.assertEquals(3, Stream.create("x", "y", "z").count());
        Assert.assertEquals(ImmutableList.of(1, 2, 3), Stream.create(3, 1, 2).toSortedList(
                Ordering.natural()));
        Assert.assertEquals("u", Stream.create("u").getUnique());
        Assert.assertEquals("d", Stream.<String>create().getUnique("d"));
    }

    @Test
    public void testToCollectionOfSupertype() {
        final AtomicBoolean closed = new AtomicBoolean();
        final Stream<String> stream = Stream.create("b", "a").onClose(new Closeable() {

            @Override
            public void close() {
                closed.set(true);
            }

        });
        final List<Object> target = Lists.<Object>newArrayList(1);
        Assert.assertSame(target, stream.toCollection(target));
        Assert.assertEquals(ImmutableList.<Object>of(1, "b", "a"), target);
        Assert.assertTrue(closed.get());
    }

    @Test(expected = IllegalStateException.class)
    public void testGetUniqueWithManyElements() {
        Stream.create("a", "b").getUnique();
    }

    @Test
    public void testSinglePass() {
        final Stream<String> stream = Stream.create("a", "b");
        Assert.assertEquals(2, stream.toList().size());
        Assert.assertFalse(stream.isAvailable());
        try {
            stream.toList();
            Assert.fail("Second terminal operation should fail");
        } catch (final IllegalStateException ex) {
            // expected
        }
    }

    @Test
    public void testPropertiesAreShared() {
        final Stream<String> stream = Stream.create("a", "b").setProperty(
                Stream.PROPERTY_SORTED, true);
        final Stream<String> distinct = stream.distinct();
        Assert.assertEquals(Boolean.TRUE, distinct.getProperty(Stream.PROPERTY_SORTED,
                Boolean.class));
        Assert.assertNull(distinct.getProperty("missing", String.class));
    }

    @Test
    public void testCloseActions() {
        final AtomicInteger closed = new AtomicInteger();
        final Stream<String> stream = Stream.create("a", "b", "c").onClose(new Runnable() {

            @Override
            public void run() {
                closed.incrementAndGet();
            }

        });
        final Iterator<String> iterator = stream.iterator();
        Assert.assertEquals("a", iterator.next());
        Assert.assertEquals(0, closed.get());
        stream.close();
        stream.close();
        Assert.assertTrue(stream.isClosed());
        Assert.assertEquals(1, closed.get());
    }

    @Test
    public void testClosedWhenExhausted() {
        final AtomicBoolean closed = new AtomicBoolean();
        final Stream<Integer> stream = Stream.create(new CountingIterator(3, closed));
        Assert.assertEquals(ImmutableList.of(0, 1, 2), stream.toList());
        Assert.assertTrue(closed.get());
        Assert.assertTrue(stream.isClosed());
    }

    @Test
    public void testTrack() {
        final AtomicLong count = new AtomicLong();
        final AtomicBoolean eof = new AtomicBoolean();
        final Stream<String> stream = Stream.create("a", "b", "c").track(count, eof);
        final Iterator<String> iterator = stream.iterator();
        iterator.next();
        iterator.next();
        Assert.assertEquals(2, count.get());
        Assert.assertFalse(eof.get());
        iterator.next();
        Assert.assertFalse(iterator.hasNext());
        Assert.assertEquals(3, count.get());
        Assert.assertTrue(eof.get());
    }

    private static final class CountingIterator extends AbstractIterator<Integer> implements
            Closeable {

        private final int size;

        private final AtomicBoolean closed;

        private int next;

        CountingIterator(final int size, final AtomicBoolean closed) {
            this.size = size;
            this.closed = closed;
        }

        @Override
        protected Integer computeNext() {
            return this.next < this.size ? this.next++ : endOfData();
        }

        @Override
        public void close() {
            this.closed.set(true);
        }

    }

}
