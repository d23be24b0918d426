package gov.llnl.sina.datastore;

import java.io.IOException;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Predicate;
import com.google.common.base.Throwables;
import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.data.Datum;
import gov.llnl.sina.data.Record;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.internal.Util;
import gov.llnl.sina.query.Criteria;
import gov.llnl.sina.query.DataRange;
import gov.llnl.sina.query.Intersections;
import gov.llnl.sina.query.ListCriterion;
import gov.llnl.sina.query.UnsupportedQueryException;

/**
 * Base implementation of {@code RecordDAO} evaluating data queries on top of two backend
 * primitives.
 * <p>
 * A data query is split by {@link Criteria#classify(Map)} into buckets. Scalar and string
 * criteria are evaluated in a single call to {@link #matchAll(TableFamily, List)}, which
 * backends implement with their own multi-predicate AND strategy. List criteria are translated
 * into set operations over {@code matchAll} results: operations over scalar lists test the
 * min/max synopsis of each list, while string list operations query the per-element rows. Existence criteria use {@link #queryRows(TableFamily, String, DataRange)} on
 * every table family. The id streams of all buckets are finally combined with
 * {@link Intersections#intersect(List)}.
 * </p>
 */
public abstract class AbstractRecordDAO implements RecordDAO {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractRecordDAO.class);

    private static final Function<DataRow, String> ROW_ID = new Function<DataRow, String>() {

        @Override
        public String apply(final DataRow row) {
            return row.getRecordId();
        }

    };

    private static final List<TableFamily> EXISTENCE_FAMILIES = ImmutableList.of(
            TableFamily.SCALAR, TableFamily.STRING, TableFamily.SCALAR_LIST_MIN,
            TableFamily.STRING_LIST);

    /**
     * Returns the rows of a table family for the datum name specified, optionally restricted to
     * values in a range.
     *
     * @param family
     *            the table family
     * @param name
     *            the datum name
     * @param range
     *            the range values must fall in, null to return every row with that name
     * @return a stream of rows
     * @throws IOException
     *             in case of backend failure
     */
    protected abstract Stream<DataRow> queryRows(TableFamily family, String name,
            @Nullable DataRange range) throws IOException;

    /**
     * Returns the distinct ids of the records having, for every supplied (name, range) pair, a
     * row in the table family with that name and a value in the range (any value if the range is
     * null).
     *
     * @param family
     *            the table family
     * @param criteria
     *            the (name, range) pairs, not empty, in evaluation order
     * @return a stream of distinct record ids, flagged as sorted if ids are returned in
     *         ascending order
     * @throws IOException
     *             in case of backend failure
     */
    protected abstract Stream<String> matchAll(TableFamily family,
            List<Map.Entry<String, DataRange>> criteria) throws IOException;

    @Override
    public Record get(final String id) throws RecordNotFoundException, IOException {
        return get(ImmutableList.of(id)).getUnique();
    }

    /**
     * {@inheritDoc} This implementation decodes the requested data from the stored records.
     */
    @Override
    public Map<String, Map<String, Datum>> getDataForRecords(final Collection<String> ids,
            @Nullable final Collection<String> names) throws RecordNotFoundException,
            IOException {
        final Set<String> wanted = names == null ? null : ImmutableSet.copyOf(names);
        final Map<String, Map<String, Datum>> result = Maps.newLinkedHashMap();
        try (Stream<Record> records = get(ids)) {
            for (final Record record : records) {
                final Map<String, Datum> data = Maps.newLinkedHashMap();
                for (final Map.Entry<String, Datum> entry : record.getData().entrySet()) {
                    if (wanted == null || wanted.contains(entry.getKey())) {
                        data.put(entry.getKey(), entry.getValue());
                    }
                }
                result.put(record.getId(), data);
            }
        }
        return result;
    }

    /**
     * {@inheritDoc} This implementation decodes the stored records of the type specified,
     * ignoring empty lists.
     */
    @Override
    public Set<String> getDataNames(final String type,
            @Nullable final Collection<Datum.Kind> kinds) throws IOException {
        final Set<Datum.Kind> wanted = kinds == null ? EnumSet.allOf(Datum.Kind.class) : Sets
                .immutableEnumSet(kinds);
        final List<String> ids;
        try (Stream<String> stream = getAllOfType(type)) {
            ids = stream.toList();
        }
        final Set<String> names = Sets.newTreeSet();
        if (!ids.isEmpty()) {
            try (Stream<Record> records = get(ids)) {
                for (final Record record : records) {
                    for (final Map.Entry<String, Datum> entry : record.getData().entrySet()) {
                        final Datum datum = entry.getValue();
                        // empty lists have no searchable rows
                        if (wanted.contains(datum.getKind()) && !(datum.getKind().isList()
                                && ((List<?>) datum.getValue()).isEmpty())) {
                            names.add(entry.getKey());
                        }
                    }
                }
            }
        }
        return ImmutableSet.copyOf(names);
    }

    @Override
    public Stream<String> dataQuery(final Map<String, ?> criteria) throws IOException {

        final Criteria classified = Criteria.classify(criteria);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} - evaluating data query over {} buckets: {}", this,
                    classified.getBucketCount(), classified);
        }

        final List<Stream<String>> streams = Lists.newArrayList();
        try {
            if (!classified.getScalars().isEmpty()) {
                streams.add(matchAll(TableFamily.SCALAR, entries(classified.getScalars())));
            }
            if (!classified.getStrings().isEmpty()) {
                streams.add(matchAll(TableFamily.STRING, entries(classified.getStrings())));
            }
            for (final Map.Entry<String, ListCriterion> entry : classified.getScalarLists()
                    .entrySet()) {
                streams.add(queryScalarList(entry.getKey(), entry.getValue()));
            }
            for (final Map.Entry<String, ListCriterion> entry : classified.getStringLists()
                    .entrySet()) {
                streams.add(queryStringList(entry.getKey(), entry.getValue()));
            }
            if (!classified.getUniversal().isEmpty()) {
                streams.add(queryExisting(classified.getUniversal()));
            }
            return Intersections.intersect(streams);
        } catch (final Throwable ex) {
            for (final Stream<String> stream : streams) {
                Util.closeQuietly(stream);
            }
            Throwables.propagateIfPossible(ex, IOException.class);
            throw Util.propagate(ex);
        }
    }

    @Override
    public Stream<String> getList(final String name, final ListCriterion criterion)
            throws IOException {
        if (criterion.isNumeric()) {
            return queryScalarList(name, criterion);
        } else {
            return queryStringList(name, criterion);
        }
    }

    private Stream<String> queryScalarList(final String name, final ListCriterion criterion)
            throws IOException {

        // Only the min/max synopsis of a numeric list is stored: an entry is deemed contained
        // if it overlaps [min, max], and ONLY further requires [min, max] to lie in the span
        // of the entries
        final List<DataRange> ranges = criterion.getRanges();
        final List<Stream<String>> streams = Lists.newArrayList();
        try {
            switch (criterion.getOperation()) {
            case ALL_IN:
                return querySynopsis(name, criterion.getRange(), true);

            case ANY_IN:
                return querySynopsis(name, criterion.getRange(), false);

            case HAS_ALL:
                for (final DataRange range : ranges) {
                    streams.add(querySynopsis(name, range, false));
                }
                return Intersections.intersect(streams);

            case HAS_ANY:
                for (final DataRange range : ranges) {
                    streams.add(querySynopsis(name, range, false));
                }
                return Intersections.union(streams);

            case ONLY:
                for (final DataRange range : ranges) {
                    streams.add(querySynopsis(name, range, false));
                }
                final DataRange span = DataRange.span(ranges);
                if (span != null) {
                    streams.add(querySynopsis(name, span, true));
                }
                return Intersections.intersect(streams);

            default:
                throw new UnsupportedQueryException("Unsupported list operation "
                        + criterion.getOperation());
            }
        } catch (final Throwable ex) {
            for (final Stream<String> stream : streams) {
                Util.closeQuietly(stream);
            }
            Throwables.propagateIfPossible(ex, IOException.class);
            throw Util.propagate(ex);
        }
    }

    private Stream<String> querySynopsis(final String name, final DataRange range,
            final boolean all) throws IOException {

        // all: min >= lower and max <= upper; otherwise: max >= lower and min <= upper
        final DataRange lower = range.lowerHalf();
        final DataRange upper = range.upperHalf();
        final List<Stream<String>> streams = Lists.newArrayList();
        try {
            if (lower != null) {
                streams.add(matchAll(all ? TableFamily.SCALAR_LIST_MIN
                        : TableFamily.SCALAR_LIST_MAX, entries(name, lower)));
            }
            if (upper != null) {
                streams.add(matchAll(all ? TableFamily.SCALAR_LIST_MAX
                        : TableFamily.SCALAR_LIST_MIN, entries(name, upper)));
            }
            return Intersections.intersect(streams);
        } catch (final Throwable ex) {
            for (final Stream<String> stream : streams) {
                Util.closeQuietly(stream);
            }
            Throwables.propagateIfPossible(ex, IOException.class);
            throw Util.propagate(ex);
        }
    }

    private Stream<String> queryStringList(final String name, final ListCriterion criterion)
            throws IOException {

        switch (criterion.getOperation()) {
        case ANY_IN:
            return matchAll(TableFamily.STRING_LIST, entries(name, criterion.getRange()));

        case ALL_IN:
            return minus(matchAll(TableFamily.STRING_LIST, entries(name, null)),
                    queryAnyElement(name, DataRange.complement(criterion.getRanges())));

        case HAS_ALL:
            final List<Stream<String>> streams = Lists.newArrayList();
            for (final DataRange range : criterion.getRanges()) {
                streams.add(matchAll(TableFamily.STRING_LIST, entries(name, range)));
            }
            return Intersections.intersect(streams);

        case HAS_ANY:
            return queryAnyElement(name, criterion.getRanges());

        case ONLY:
            return minus(queryAnyElement(name, criterion.getRanges()),
                    queryAnyElement(name, DataRange.complement(criterion.getRanges())));

        default:
            throw new UnsupportedQueryException("Unsupported list operation "
                    + criterion.getOperation());
        }
    }

    private Stream<String> queryAnyElement(final String name, final List<DataRange> ranges)
            throws IOException {
        final List<Stream<String>> streams = Lists.newArrayList();
        for (final DataRange range : ranges) {
            streams.add(matchAll(TableFamily.STRING_LIST, entries(name, range)));
        }
        return Intersections.union(streams);
    }

    private Stream<String> queryExisting(final Set<String> names) throws IOException {
        final Multiset<String> tally = HashMultiset.create();
        for (final String name : names) {
            final List<Stream<String>> streams = Lists.newArrayList();
            for (final TableFamily family : EXISTENCE_FAMILIES) {
                streams.add(queryRows(family, name, null).transform(ROW_ID));
            }
            tally.addAll(Intersections.union(streams).toSet());
        }
        final List<String> ids = Lists.newArrayList();
        for (final Multiset.Entry<String> entry : tally.entrySet()) {
            if (entry.getCount() == names.size()) {
                ids.add(entry.getElement());
            }
        }
        return Intersections.sorted(ids);
    }

    /**
     * Returns the ids of the first stream not returned by the second one. The second stream is
     * consumed immediately.
     */
    protected static Stream<String> minus(final Stream<String> stream,
            final Stream<String> excluded) {
        final Set<String> excludedIds;
        try {
            excludedIds = excluded.toSet();
        } catch (final Throwable ex) {
            stream.close();
            throw Util.propagate(ex);
        }
        if (excludedIds.isEmpty()) {
            return stream;
        }
        return stream.filter(new Predicate<String>() {

            @Override
            public boolean apply(final String id) {
                return !excludedIds.contains(id);
            }

        });
    }

    private static List<Map.Entry<String, DataRange>> entries(final Map<String, DataRange> map) {
        return ImmutableList.copyOf(map.entrySet());
    }

    private static List<Map.Entry<String, DataRange>> entries(final String name,
            @Nullable final DataRange range) {
        return ImmutableList.of(Maps.immutableEntry(name, range));
    }

    /**
     * Returns the record ids among the ones supplied that are not stored, in input order.
     */
    protected final List<String> missing(final Collection<String> ids) throws IOException {
        final List<String> list = ImmutableList.copyOf(ids);
        final List<Boolean> flags = exist(list);
        final List<String> missing = Lists.newArrayList();
        for (int i = 0; i < list.size(); ++i) {
            if (!flags.get(i)) {
                missing.add(list.get(i));
            }
        }
        return missing;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

}
