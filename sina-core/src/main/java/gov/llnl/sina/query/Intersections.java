package gov.llnl.sina.query;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Predicate;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;

import gov.llnl.sina.data.Stream;

/**
 * Set operations over streams of record ids.
 * <p>
 * The intersection uses a lazy ordered merge when every input is flagged with
 * {@link Stream#PROPERTY_SORTED}, so that no input is ever materialized; otherwise all inputs but
 * the first are materialized into sets and the first one is filtered against them. In both cases
 * the result is free of duplicates and is closed together with its inputs.
 * </p>
 */
public final class Intersections {

    /**
     * Intersects the supplied streams of ids.
     *
     * @param streams
     *            the streams to intersect, at least one
     * @return a stream with the ids returned by every input stream, sorted if every input is
     * @throws EmptyQueryException
     *             if no stream is supplied
     */
    public static Stream<String> intersect(final List<? extends Stream<String>> streams)
            throws EmptyQueryException {
        if (streams.isEmpty()) {
            throw new EmptyQueryException("Nothing to intersect");
        } else if (streams.size() == 1) {
            return streams.get(0).distinct();
        }
        boolean allSorted = true;
        for (final Stream<String> stream : streams) {
            allSorted &= isSorted(stream);
        }
        final List<Stream<String>> inputs = ImmutableList.copyOf(streams);
        return allSorted ? mergeIntersect(inputs) : setIntersect(inputs);
    }

    /**
     * Returns the distinct ids returned by any of the supplied streams. Inputs are consumed one
     * after the other.
     */
    public static Stream<String> union(final List<? extends Stream<String>> streams) {
        final Stream<String> result = Stream.concat(streams);
        for (final Stream<String> stream : streams) {
            result.onClose(stream);
        }
        return result.distinct();
    }

    /**
     * Returns a stream over the supplied ids in ascending order, flagged as sorted.
     */
    public static Stream<String> sorted(final Collection<String> ids) {
        return Stream.create(ImmutableSortedSet.copyOf(ids)).setProperty(Stream.PROPERTY_SORTED,
                true);
    }

    public static boolean isSorted(final Stream<?> stream) {
        return Boolean.TRUE.equals(stream.getProperty(Stream.PROPERTY_SORTED, Boolean.class));
    }

    private static Stream<String> setIntersect(final List<Stream<String>> streams) {
        final List<Set<String>> sets = Lists.newArrayList();
        for (final Stream<String> stream : streams.subList(1, streams.size())) {
            sets.add(stream.toSet());
        }
        final Stream<String> first = streams.get(0);
        return first.filter(new Predicate<String>() {

            @Override
            public boolean apply(@Nullable final String id) {
                for (final Set<String> set : sets) {
                    if (!set.contains(id)) {
                        return false;
                    }
                }
                return true;
            }

        }).distinct();
    }

    private static Stream<String> mergeIntersect(final List<Stream<String>> streams) {
        final Stream<String> result = new Stream<String>() {

            @Override
            protected Iterator<String> doIterator() throws Throwable {
                final List<Iterator<String>> iterators = Lists.newArrayList();
                for (final Stream<String> stream : streams) {
                    iterators.add(stream.iterator());
                }
                return new MergeIterator(iterators);
            }

            @Override
            protected String doToString() {
                return streams.toString();
            }

        };
        for (final Stream<String> stream : streams) {
            result.onClose(stream);
        }
        return result.setProperty(Stream.PROPERTY_SORTED, true);
    }

    private static final class MergeIterator extends AbstractIterator<String> {

        private final List<Iterator<String>> iterators;

        private final String[] heads;

        @Nullable
        private String last;

        MergeIterator(final List<Iterator<String>> iterators) {
            this.iterators = iterators;
            this.heads = new String[iterators.size()];
        }

        @Override
        protected String computeNext() {
            // Advance every input past the last emitted id, tracking the greatest head
            String target = null;
            for (int i = 0; i < this.heads.length; ++i) {
                if (!advance(i, this.last)) {
                    return endOfData();
                }
                if (target == null || this.heads[i].compareTo(target) > 0) {
                    target = this.heads[i];
                }
            }
            while (true) {
                boolean aligned = true;
                for (int i = 0; i < this.heads.length; ++i) {
                    if (this.heads[i].compareTo(target) < 0) {
                        if (!advanceTo(i, target)) {
                            return endOfData();
                        }
                    }
                    if (this.heads[i].compareTo(target) > 0) {
                        target = this.heads[i];
                        aligned = false;
                    }
                }
                if (aligned) {
                    this.last = target;
                    return target;
                }
            }
        }

        private boolean advance(final int index, @Nullable final String bound) {
            if (this.heads[index] != null
                    && (bound == null || this.heads[index].compareTo(bound) > 0)) {
                return true;
            }
            return advanceTo(index, bound);
        }

        private boolean advanceTo(final int index, @Nullable final String bound) {
            final Iterator<String> iterator = this.iterators.get(index);
            while (iterator.hasNext()) {
                final String id = iterator.next();
                if (bound == null || id.compareTo(bound) >= 0) {
                    if (id.equals(this.last)) {
                        continue;
                    }
                    this.heads[index] = id;
                    return true;
                }
            }
            return false;
        }

    }

    private Intersections() {
    }

}
