package gov.llnl.sina.data;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.google.common.collect.UnmodifiableIterator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.internal.Util;

/**
 * A lazy, single-pass sequence of elements, with support for intermediate operations, terminal
 * operations and resource release.
 * <p>
 * A {@code Stream} is the return type of every query returning a possibly large number of
 * results (record ids, records, data rows). It behaves as an {@code Iterable} that can be
 * iterated <b>only once</b>: the elements are produced on demand, typically by reading from a
 * JDBC {@code ResultSet} or from an HBase scanner, and are never materialized unless explicitly
 * requested. Callers needing multiple passes must materialize the elements themselves, e.g.,
 * using {@link #toList()} or {@link #toSet()}.
 * </p>
 * <p>
 * Operations are divided in:
 * <ul>
 * <li><i>intermediate operations</i> ({@link #filter(Predicate)}, {@link #transform(Function)},
 * {@link #distinct()}, {@link #slice(long, long)}, {@link #chunk(int)},
 * {@link #track(AtomicLong, AtomicBoolean)}), which return a new {@code Stream} wrapping this one
 * and sharing its state (closing one closes all of them);</li>
 * <li><i>terminal operations</i> ({@link #iterator()}, {@link #count()}, {@link #toList()},
 * {@link #toSet()}, {@link #toSortedList(Comparator)}, {@link #toCollection(Collection)},
 * {@link #getUnique()}), which consume the elements. After a terminal operation has been invoked,
 * the {@code Stream} is no more <i>available</i> and invoking another operation results in an
 * {@code IllegalStateException}.</li>
 * </ul>
 * </p>
 * <p>
 * A {@code Stream} is automatically closed when all its elements have been consumed. It can be
 * closed explicitly at any time via {@link #close()}, e.g., to stop consuming elements after the
 * first K ones; this releases any underlying resource (cursor, scanner, connection) associated to
 * the {@code Stream} and registered via {@link #onClose(Object...)}. Implementations of the
 * underlying iterators may propagate backend failures as unchecked exceptions.
 * </p>
 * <p>
 * Metadata about a {@code Stream} can be attached via {@link #setProperty(String, Object)}; the
 * query engine uses the {@link #PROPERTY_SORTED} property to mark streams whose elements are
 * returned in ascending natural order.
 * </p>
 *
 * @param <T>
 *            the type of element
 */
public abstract class Stream<T> implements Iterable<T>, Closeable {

    /**
     * Name of the boolean property marking streams returning distinct elements in ascending
     * natural order.
     */
    public static final String PROPERTY_SORTED = "sorted";

    private static final Logger LOGGER = LoggerFactory.getLogger(Stream.class);

    private static final Object EOF = new Object();

    final State state;

    /**
     * Constructor for use by non-delegating sub-classes.
     */
    protected Stream() {
        this(new State());
    }

    Stream(final State state) {
        this.state = state;
        state.closeObjects.add(this);
    }

    /**
     * Creates a new Stream for the supplied elements. Use this method without arguments to
     * produce an <i>empty</i> Stream.
     *
     * @param elements
     *            the elements to be returned by the Stream, not null
     * @param <T>
     *            the type of elements
     * @return a Stream over the supplied elements
     */
    @SafeVarargs
    public static <T> Stream<T> create(final T... elements) {
        if (elements.length == 0) {
            return new EmptyStream<T>();
        } else {
            return new IteratorStream<T>(Iterators.forArray(elements));
        }
    }

    /**
     * Creates a new Stream over the elements of the supplied {@code Iterable}. If the supplied
     * {@code Iterable} is a {@code Stream}, it will be returned unchanged. If the supplied
     * {@code Iterable} implements {@code Closeable}, method {@link Closeable#close()} will be
     * called when the {@code Stream} is closed.
     *
     * @param iterable
     *            an {@code Iterable} of non-null elements, possibly empty but not null
     * @param <T>
     *            the type of element
     * @return a {@code Stream} over the elements in the {@code Iterable}
     */
    @SuppressWarnings("unchecked")
    public static <T> Stream<T> create(final Iterable<? extends T> iterable) {
        if (iterable instanceof Stream) {
            return (Stream<T>) iterable;
        } else if (iterable instanceof ImmutableCollection<?>
                && ((ImmutableCollection<? extends T>) iterable).isEmpty()) {
            return new EmptyStream<T>();
        } else {
            return new IterableStream<T>(iterable);
        }
    }

    /**
     * Creates a new Stream over the elements returned by the supplied Iterator. If the iterator
     * implements {@code Closeable}, it will be closed together with the Stream.
     *
     * @param iterator
     *            an Iterator returning non-null elements
     * @param <T>
     *            the type of elements
     * @return a Stream over the elements returned by the supplied Iterator
     */
    public static <T> Stream<T> create(final Iterator<? extends T> iterator) {
        return new IteratorStream<T>(iterator);
    }

    /**
     * Returns a Stream concatenating all the elements of the supplied {@code Iterable}s.
     *
     * @param iterables
     *            the {@code Iterable}s to concatenate, possibly {@code Stream}s
     * @param <T>
     *            the type of elements
     * @return the resulting Stream
     */
    public static <T> Stream<T> concat(final Iterable<? extends Iterable<? extends T>> iterables) {
        return new ConcatStream<Iterable<? extends T>, T>(create(iterables));
    }

    /**
     * Intermediate operation returning a Stream with only the elements of this Stream that
     * satisfy the specified predicate.
     *
     * @param predicate
     *            the predicate, never called with a null input
     * @return a Stream over the elements satisfying the predicate
     */
    public final Stream<T> filter(final Predicate<? super T> predicate) {
        synchronized (this.state) {
            checkState();
            return new FilterStream<T>(this, predicate);
        }
    }

    /**
     * Intermediate operation returning a Stream with the elements obtained by applying a
     * function to each element of this Stream. Null results are dropped.
     *
     * @param function
     *            the function, never called with a null input
     * @param <R>
     *            the type of transformed elements
     * @return a Stream over the elements transformed by the supplied function
     */
    public final <R> Stream<R> transform(final Function<? super T, ? extends R> function) {
        synchronized (this.state) {
            checkState();
            return new TransformStream<T, R>(this, function);
        }
    }

    /**
     * Intermediate operation returning a Stream with only the distinct elements of this Stream.
     * Duplicates are removed lazily during the iteration; memory proportional to the number of
     * distinct elements is required.
     *
     * @return a Stream over de-duplicated elements
     */
    public final Stream<T> distinct() {
        synchronized (this.state) {
            checkState();
            return this instanceof DistinctStream<?> ? this : new DistinctStream<T>(this);
        }
    }

    /**
     * Intermediate operation returning a Stream with max {@code limit} elements with index
     * starting at {@code offset} taken from this Stream. After those elements are returned, the
     * wrapped Stream is automatically closed.
     *
     * @param offset
     *            the offset where to start returning elements from, not negative
     * @param limit
     *            the maximum number of elements to return (starting from offset), not negative
     * @return a Stream wrapping this Stream and limiting the number of returned elements
     */
    public final Stream<T> slice(final long offset, final long limit) {
        synchronized (this.state) {
            checkState();
            return new SliceStream<T>(this, offset, limit);
        }
    }

    /**
     * Intermediate operation returning a Stream of elements chunks of the specified size obtained
     * from this Stream (the last chunk may be smaller).
     *
     * @param chunkSize
     *            the chunk size, positive
     * @return a Stream wrapping this Stream and returning chunks of elements
     */
    public final Stream<List<T>> chunk(final int chunkSize) {
        synchronized (this.state) {
            checkState();
            return new ChunkStream<T>(this, chunkSize);
        }
    }

    /**
     * Intermediate operation returning a Stream that returns the elements of this {@code Stream}
     * and tracks the number of elements returned so far.
     *
     * @param counter
     *            the variable where to hold the number of returned elements, possibly null
     * @param eof
     *            the variable where to store whether end of sequence has been reached, possibly
     *            null
     * @return a {@code Stream} tracking the number of returned elements
     */
    public final Stream<T> track(@Nullable final AtomicLong counter,
            @Nullable final AtomicBoolean eof) {
        synchronized (this.state) {
            checkState();
            return new TrackStream<T>(this, counter, eof);
        }
    }

    /**
     * Terminal operation returning the number of elements in this Stream. Only one element is
     * materialized at any time, so it is safe to use this method with arbitrarily large Streams.
     *
     * @return the number of elements in this Stream
     */
    public final long count() {
        long count = 0;
        final Iterator<T> iterator = iterator();
        try {
            while (iterator.hasNext()) {
                iterator.next();
                ++count;
            }
        } finally {
            close();
        }
        return count;
    }

    /**
     * Terminal operation returning an Iterator over the elements of this Stream. {@inheritDoc}
     */
    @Override
    public final Iterator<T> iterator() {
        synchronized (this.state) {
            checkState();
            this.state.available = false;
            final Iterator<T> iterator;
            try {
                iterator = new CheckedIterator<T>(doIterator(), this);
            } catch (final Throwable ex) {
                close();
                throw Util.propagate(ex);
            }
            this.state.activeIterator = iterator;
            return iterator;
        }
    }

    /**
     * Terminal operation returning an immutable list with all the elements of this Stream.
     *
     * @return a list with the elements of this Stream
     */
    public final List<T> toList() {
        return ImmutableList.copyOf(toCollection(Lists.<T>newArrayList()));
    }

    /**
     * Terminal operation returning a set with all the elements of this Stream, in iteration
     * order.
     *
     * @return a set with the elements of this Stream
     */
    public final Set<T> toSet() {
        return toCollection(Sets.<T>newLinkedHashSet());
    }

    /**
     * Terminal operation returning a list with all the elements of this Stream, sorted with the
     * supplied comparator.
     *
     * @param comparator
     *            the comparator to use
     * @return a sorted list with the elements of this Stream
     */
    public final List<T> toSortedList(final Comparator<? super T> comparator) {
        final List<T> list = toCollection(Lists.<T>newArrayList());
        list.sort(comparator);
        return ImmutableList.copyOf(list);
    }

    /**
     * Terminal operation adding all the elements of this Stream to the supplied collection.
     *
     * @param collection
     *            the collection where to add elements
     * @param <C>
     *            the type of collection
     * @return the supplied collection
     */
    public final <C extends Collection<? super T>> C toCollection(final C collection) {
        Preconditions.checkNotNull(collection);
        try {
            final Iterator<T> iterator = iterator();
            while (iterator.hasNext()) {
                collection.add(iterator.next());
            }
        } finally {
            close();
        }
        return collection;
    }

    /**
     * Terminal operation returning the only element of this Stream, or the default value
     * specified if the Stream is empty.
     *
     * @param defaultValue
     *            the value to return in case the stream is empty
     * @return the only element in the Stream, or the default value
     * @throws IllegalStateException
     *             in case the stream contains more than one element
     */
    @Nullable
    public final T getUnique(@Nullable final T defaultValue) throws IllegalStateException {
        try {
            final Iterator<T> iterator = iterator();
            if (!iterator.hasNext()) {
                return defaultValue;
            }
            final T result = iterator.next();
            if (iterator.hasNext()) {
                throw new IllegalStateException("Stream contains more than one element: " + this);
            }
            return result;
        } finally {
            close();
        }
    }

    /**
     * Terminal operation returning the only element of this Stream.
     *
     * @return the only element in the Stream
     * @throws IllegalStateException
     *             in case the stream is empty or contains more than one element
     */
    public final T getUnique() throws IllegalStateException {
        final T result = getUnique(null);
        Preconditions.checkState(result != null, "Stream is empty: %s", this);
        return result;
    }

    /**
     * Returns a metadata property about the stream. Wrapper {@code Stream}s obtained through
     * intermediate operations share the properties of the source {@code Stream}.
     *
     * @param name
     *            the name of the property
     * @param type
     *            the type of the property value
     * @param <V>
     *            the type of value
     * @return the value of the property, or null if the property is undefined
     */
    @Nullable
    public final <V> V getProperty(final String name, final Class<V> type) {
        Preconditions.checkNotNull(name);
        synchronized (this.state) {
            return this.state.properties == null ? null : type.cast(this.state.properties
                    .get(name));
        }
    }

    /**
     * Sets a metadata property about the stream.
     *
     * @param name
     *            the name of the property
     * @param value
     *            the value of the property, null to clear it
     * @return this {@code Stream}, for call chaining
     */
    public final Stream<T> setProperty(final String name, @Nullable final Object value) {
        Preconditions.checkNotNull(name);
        synchronized (this.state) {
            if (this.state.properties != null) {
                this.state.properties.put(name, value);
            } else if (value != null) {
                this.state.properties = Maps.newHashMap();
                this.state.properties.put(name, value);
            }
        }
        return this;
    }

    /**
     * Checks whether this Stream is available, i.e., intermediate and terminal operations can be
     * called.
     *
     * @return true, if the Stream is available
     */
    public final boolean isAvailable() {
        synchronized (this.state) {
            return this.state.available;
        }
    }

    /**
     * Checks whether this Stream has been closed.
     *
     * @return true, if the Stream has been closed
     */
    public final boolean isClosed() {
        synchronized (this.state) {
            return this.state.closed;
        }
    }

    /**
     * Register zero or more objects for activation when this {@code Stream} will be closed. Each
     * supplied object can be a {@code Closeable}, a {@code Runnable} or a {@code Callable}; any
     * other type of object is rejected. In case the {@code Stream} has already been closed,
     * activation of supplied objects is done immediately.
     *
     * @param objects
     *            the objects to activate when the {@code Stream} will be closed
     * @return this {@code Stream}, for call chaining.
     */
    public final Stream<T> onClose(final Object... objects) {
        synchronized (this.state) {
            for (final Object object : objects) {
                if (!(object instanceof Closeable) && !(object instanceof Runnable)
                        && !(object instanceof Callable)) {
                    throw new IllegalArgumentException("Illegal object: " + object);
                } else if (this.state.closed) {
                    closeAction(object);
                } else {
                    boolean alreadyContained = false;
                    for (final Object o : this.state.closeObjects) {
                        if (o == object) {
                            alreadyContained = true;
                            break;
                        }
                    }
                    if (!alreadyContained) {
                        this.state.closeObjects.add(object);
                    }
                }
            }
        }
        return this;
    }

    /**
     * Closes this {@code Stream} and releases any resource associated to it. The operation causes
     * any {@code Stream} wrapping or wrapped by this {@code Stream} to be closed. If this
     * {@code Stream} has already been closed, then calling this method has no effect.
     */
    @Override
    public final void close() {
        synchronized (this.state) {
            if (this.state.closed) {
                return;
            }
            this.state.closed = true;
            this.state.available = false;
            for (final Object object : this.state.closeObjects) {
                closeAction(object);
            }
            this.state.activeIterator = null;
        }
    }

    @Override
    public final String toString() {
        final StringBuilder builder = new StringBuilder();
        toStringHelper(builder);
        return builder.toString();
    }

    void toStringHelper(final StringBuilder builder) {
        final String name = getClass().getSimpleName();
        builder.append(name.isEmpty() ? "anon-Stream" : name);
        final String args = doToString();
        if (args != null) {
            builder.append("<").append(args).append(">");
        }
    }

    final void checkState() {
        synchronized (this.state) {
            if (this.state.closed) {
                throw new IllegalStateException("Stream already closed: " + this);
            } else if (!this.state.available) {
                throw new IllegalStateException("Stream already being iterated: " + this);
            }
        }
    }

    final void closeAction(final Object object) {
        try {
            if (object instanceof Stream<?>) {
                ((Stream<?>) object).doClose();
            } else if (object instanceof Closeable) {
                ((Closeable) object).close();
            } else if (object instanceof Runnable) {
                ((Runnable) object).run();
            } else if (object instanceof Callable<?>) {
                ((Callable<?>) object).call();
            }
        } catch (final Throwable ex) {
            LOGGER.error("Error performing close action on " + object, ex);
        }
    }

    /**
     * Implementation method responsible of producing an Iterator over the elements of the Stream.
     * This method is called by {@link #iterator()} with the guarantee that it is called at most
     * once and with the Stream in the <i>available</i> state. If the returned Iterator implements
     * the {@link Closeable} interface, it will be automatically closed when the Stream is closed.
     *
     * @return an Iterator over the elements of the Stream
     * @throws Throwable
     *             in case of failure
     */
    protected abstract Iterator<T> doIterator() throws Throwable;

    /**
     * Implementation method supporting the generation of a string representation of this Stream.
     *
     * @return an optional string with the arguments / state characterizing this {@code Stream},
     *         possibly null
     */
    @Nullable
    protected String doToString() {
        return null;
    }

    /**
     * Implementation method responsible of closing optional resources associated to this Stream.
     * The default implementation does nothing.
     *
     * @throws Throwable
     *             in case of failure
     */
    protected void doClose() throws Throwable {
    }

    private static final class State {

        List<Object> closeObjects = Lists.newArrayList();

        @Nullable
        Map<String, Object> properties;

        @Nullable
        Iterator<?> activeIterator;

        boolean available = true;

        boolean closed = false;

    }

    /**
     * Base iterator computing elements on demand, where a null result of {@link #advance()}
     * signals the end of the sequence.
     */
    private abstract static class AbstractIterator<T> extends UnmodifiableIterator<T> implements
            Closeable {

        @Nullable
        private T next;

        @Override
        public final boolean hasNext() {
            if (this.next == null) {
                this.next = advance();
            }
            return this.next != null;
        }

        @Override
        public final T next() {
            if (this.next == null) {
                final T result = advance();
                if (result != null) {
                    return result;
                }
                throw new NoSuchElementException();
            } else {
                final T result = this.next;
                this.next = null;
                return result;
            }
        }

        @Override
        public void close() throws IOException {
        }

        @Nullable
        protected abstract T advance();

    }

    private static final class CheckedIterator<T> extends UnmodifiableIterator<T> {

        private final Iterator<T> iterator;

        private final Stream<T> stream;

        private final State state;

        CheckedIterator(final Iterator<T> iterator, final Stream<T> stream) {
            this.iterator = iterator;
            this.stream = stream;
            this.state = stream.state;
        }

        @Override
        public boolean hasNext() {
            synchronized (this.state) {
                if (this.state.closed) {
                    return false;
                }
            }
            boolean result = false;
            try {
                result = this.iterator.hasNext();
            } finally {
                if (!result) {
                    this.stream.close();
                }
            }
            return result;
        }

        @Override
        public T next() {
            synchronized (this.state) {
                Preconditions.checkState(!this.state.closed, "Stream has been closed");
            }
            try {
                return this.iterator.next();
            } catch (final Throwable ex) {
                this.stream.close();
                throw Util.propagate(ex);
            }
        }

    }

    private static final class EmptyStream<T> extends Stream<T> {

        @Override
        protected Iterator<T> doIterator() {
            return Collections.emptyIterator();
        }

    }

    private static final class IterableStream<T> extends Stream<T> {

        private Iterable<? extends T> iterable;

        IterableStream(final Iterable<? extends T> iterable) {
            this.iterable = Preconditions.checkNotNull(iterable);
        }

        @SuppressWarnings("unchecked")
        @Override
        protected Iterator<T> doIterator() throws Throwable {
            return ((Iterable<T>) this.iterable).iterator();
        }

        @Override
        protected void doClose() throws Throwable {
            if (this.iterable instanceof Closeable) {
                ((Closeable) this.iterable).close();
            }
            this.iterable = null;
        }

    }

    private static final class IteratorStream<T> extends Stream<T> {

        private Iterator<? extends T> iterator;

        IteratorStream(final Iterator<? extends T> iterator) {
            this.iterator = Preconditions.checkNotNull(iterator);
        }

        @SuppressWarnings("unchecked")
        @Override
        protected Iterator<T> doIterator() {
            return (Iterator<T>) this.iterator;
        }

        @Override
        protected void doClose() throws Throwable {
            if (this.iterator instanceof Closeable) {
                ((Closeable) this.iterator).close();
            }
            this.iterator = null;
        }

    }

    private abstract static class DelegatingStream<I, O> extends Stream<O> {

        final Stream<I> delegate;

        DelegatingStream(final Stream<I> delegate) {
            super(delegate.state);
            this.delegate = delegate;
        }

        @Override
        void toStringHelper(final StringBuilder builder) {
            super.toStringHelper(builder);
            builder.append(" (");
            this.delegate.toStringHelper(builder);
            builder.append(")");
        }

    }

    private static final class ConcatStream<I extends Iterable<? extends O>, O> extends
            DelegatingStream<I, O> {

        ConcatStream(final Stream<I> delegate) {
            super(delegate);
        }

        @Override
        protected Iterator<O> doIterator() throws Throwable {
            final Iterator<I> streamIterator = this.delegate.doIterator();
            final Iterator<O> elementIterator = new AbstractIterator<O>() {

                private Stream<? extends O> stream;

                private Iterator<? extends O> iterator;

                @Override
                protected O advance() {
                    while (this.iterator == null || !this.iterator.hasNext()) {
                        if (this.stream != null) {
                            this.stream.close();
                        }
                        if (!streamIterator.hasNext()) {
                            return null;
                        }
                        this.stream = create(streamIterator.next());
                        this.iterator = this.stream.iterator();
                    }
                    return this.iterator.next();
                }

                @Override
                public void close() {
                    if (this.stream != null) {
                        this.stream.close();
                    }
                }

            };
            onClose(elementIterator);
            return elementIterator;
        }

    }

    private abstract static class ProcessingStream<I, O> extends DelegatingStream<I, O> {

        ProcessingStream(final Stream<I> delegate) {
            super(delegate);
        }

        @Override
        protected final Iterator<O> doIterator() throws Throwable {
            final Iterator<I> iterator = this.delegate.doIterator();
            return new AbstractIterator<O>() {

                private boolean eof;

                @SuppressWarnings("unchecked")
                @Override
                protected O advance() {
                    while (!this.eof && iterator.hasNext()) {
                        final Object processed = process(iterator.next());
                        if (processed == EOF) {
                            this.eof = true;
                        } else if (processed != null) {
                            return (O) processed;
                        }
                    }
                    return null;
                }

            };
        }

        /**
         * Processes an input element, returning the output element, null to skip it or
         * {@code EOF} to stop the iteration.
         */
        @Nullable
        protected abstract Object process(I element);

    }

    private static final class FilterStream<T> extends ProcessingStream<T, T> {

        private final Predicate<? super T> predicate;

        FilterStream(final Stream<T> delegate, final Predicate<? super T> predicate) {
            super(delegate);
            this.predicate = Preconditions.checkNotNull(predicate);
        }

        @Override
        protected Object process(final T element) {
            return this.predicate.apply(element) ? element : null;
        }

        @Override
        protected String doToString() {
            return this.predicate.toString();
        }

    }

    private static final class TransformStream<I, O> extends ProcessingStream<I, O> {

        private final Function<? super I, ? extends O> function;

        TransformStream(final Stream<I> delegate, final Function<? super I, ? extends O> function) {
            super(delegate);
            this.function = Preconditions.checkNotNull(function);
        }

        @Override
        protected Object process(final I element) {
            return this.function.apply(element);
        }

        @Override
        protected String doToString() {
            return this.function.toString();
        }

    }

    private static final class DistinctStream<T> extends ProcessingStream<T, T> {

        private final Set<T> seen;

        DistinctStream(final Stream<T> delegate) {
            super(delegate);
            this.seen = Sets.newHashSet();
        }

        @Override
        protected Object process(final T element) {
            return this.seen.add(element) ? element : null;
        }

    }

    private static final class SliceStream<T> extends ProcessingStream<T, T> {

        private final long startIndex;

        private final long endIndex;

        private long index;

        SliceStream(final Stream<T> delegate, final long offset, final long limit) {
            super(delegate);
            Preconditions.checkArgument(offset >= 0, "Negative offset: %s", offset);
            Preconditions.checkArgument(limit >= 0, "Negative limit: %s", limit);
            this.startIndex = offset;
            this.endIndex = offset + limit;
            this.index = 0;
        }

        @Override
        protected Object process(final T element) {
            Object result = null;
            if (this.index >= this.endIndex) {
                result = EOF;
            } else if (this.index >= this.startIndex) {
                result = element;
            }
            ++this.index;
            return result;
        }

        @Override
        protected String doToString() {
            return this.startIndex + ", " + (this.endIndex - this.startIndex);
        }

    }

    private static final class ChunkStream<T> extends DelegatingStream<T, List<T>> {

        private final int chunkSize;

        ChunkStream(final Stream<T> delegate, final int chunkSize) {
            super(delegate);
            Preconditions.checkArgument(chunkSize > 0, "Invalid chunk size: %s", chunkSize);
            this.chunkSize = chunkSize;
        }

        @Override
        protected Iterator<List<T>> doIterator() throws Throwable {
            final Iterator<T> iterator = this.delegate.doIterator();
            return new AbstractIterator<List<T>>() {

                @Override
                protected List<T> advance() {
                    final List<T> chunk = Lists.newArrayListWithCapacity(ChunkStream.this.chunkSize);
                    while (chunk.size() < ChunkStream.this.chunkSize && iterator.hasNext()) {
                        chunk.add(iterator.next());
                    }
                    return chunk.isEmpty() ? null : ImmutableList.copyOf(chunk);
                }

            };
        }

        @Override
        protected String doToString() {
            return Integer.toString(this.chunkSize);
        }

    }

    private static final class TrackStream<T> extends DelegatingStream<T, T> {

        private final AtomicLong counter;

        private final AtomicBoolean eof;

        TrackStream(final Stream<T> delegate, @Nullable final AtomicLong counter,
                @Nullable final AtomicBoolean eof) {
            super(delegate);
            this.counter = counter != null ? counter : new AtomicLong();
            this.eof = eof != null ? eof : new AtomicBoolean();
            this.counter.set(0L);
            this.eof.set(false);
        }

        @Override
        protected Iterator<T> doIterator() throws Throwable {
            final Iterator<T> iterator = this.delegate.doIterator();
            return new UnmodifiableIterator<T>() {

                private long count = 0L;

                @Override
                public boolean hasNext() {
                    final boolean result = iterator.hasNext();
                    TrackStream.this.eof.set(!result);
                    return result;
                }

                @Override
                public T next() {
                    final T next = iterator.next();
                    TrackStream.this.counter.set(++this.count);
                    return next;
                }

            };
        }

    }

}
