package gov.llnl.sina.datastore.hbase;

import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.FAMILY_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.META_QUA_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RAW_QUA_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_FROM_CURVE_SET_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_FROM_DOCUMENT_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_FROM_MIMETYPE_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_FROM_SCALAR_LIST_MAX_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_FROM_SCALAR_LIST_MIN_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_FROM_SCALAR_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_FROM_STRING_LIST_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_FROM_STRING_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_FROM_TYPE_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.RECORD_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.SCALAR_FROM_RECORD_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.SCALAR_LIST_FROM_RECORD_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.STRING_FROM_RECORD_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.STRING_LIST_FROM_RECORD_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.TYPE_QUA_NAME;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import org.apache.hadoop.hbase.client.Delete;
import org.apache.hadoop.hbase.client.Get;
import org.apache.hadoop.hbase.client.Put;
import org.apache.hadoop.hbase.client.Result;
import org.apache.hadoop.hbase.client.Scan;
import org.apache.hadoop.hbase.util.Bytes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.data.CurveSet;
import gov.llnl.sina.data.Datum;
import gov.llnl.sina.data.FileEntry;
import gov.llnl.sina.data.JsonCodec;
import gov.llnl.sina.data.Record;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.datastore.AbstractRecordDAO;
import gov.llnl.sina.datastore.DataRow;
import gov.llnl.sina.datastore.NotInsertedException;
import gov.llnl.sina.datastore.RecordExistsException;
import gov.llnl.sina.datastore.RecordNotFoundException;
import gov.llnl.sina.datastore.TableFamily;
import gov.llnl.sina.datastore.hbase.utils.AbstractHBaseUtils;
import gov.llnl.sina.internal.Util;
import gov.llnl.sina.query.DataRange;
import gov.llnl.sina.query.Intersections;
import gov.llnl.sina.runtime.DataCorruptedException;

/**
 * {@code RecordDAO} for {@link HBaseDataStore}.
 * <p>
 * The criteria of a bucket are evaluated by sequential narrowing: the first criterion is
 * answered by a range scan of its index table ({@code record_from_X}), and the resulting
 * candidates are checked against each following criterion with batched multi-gets on the
 * corresponding {@code X_from_record} table, stopping as soon as no candidate is left. There
 * are no foreign keys: deleting a record enumerates the rows derived from its stored
 * representation and deletes them table by table, together with its relationships.
 * </p>
 */
final class HBaseRecordDAO extends AbstractRecordDAO {

    private static final Logger LOGGER = LoggerFactory.getLogger(HBaseRecordDAO.class);

    private static final byte[] FAMILY = Bytes.toBytes(FAMILY_NAME);

    private static final byte[] TYPE = Bytes.toBytes(TYPE_QUA_NAME);

    private static final byte[] RAW = Bytes.toBytes(RAW_QUA_NAME);

    private static final byte[] META = Bytes.toBytes(META_QUA_NAME);

    private static final byte[] EMPTY = new byte[0];

    private final AbstractHBaseUtils hbaseUtils;

    private final HBaseRelationshipDAO relationshipDAO;

    HBaseRecordDAO(final AbstractHBaseUtils hbaseUtils,
            final HBaseRelationshipDAO relationshipDAO) {
        this.hbaseUtils = Preconditions.checkNotNull(hbaseUtils);
        this.relationshipDAO = Preconditions.checkNotNull(relationshipDAO);
    }

    @Override
    public void insert(final Iterable<Record> records) throws RecordExistsException, IOException {
        final List<Record> list = ImmutableList.copyOf(records);
        final Set<String> ids = Sets.newHashSet();
        for (final Record record : list) {
            if (!ids.add(record.getId())) {
                throw new RecordExistsException(record.getId(), "Duplicate id in insert batch");
            }
        }
        final Set<String> existing = existing(ids);
        if (!existing.isEmpty()) {
            throw new RecordExistsException(existing.iterator().next(), null);
        }
        final Cells cells = new Cells();
        for (final Record record : list) {
            addCells(cells, record);
        }
        write(cells);
    }

    /**
     * {@inheritDoc} Only the rows that the new version no longer has are deleted; all the other
     * rows are overwritten in place.
     */
    @Override
    public void update(final Iterable<Record> records) throws NotInsertedException, IOException {
        final Map<String, Record> updates = Maps.newLinkedHashMap();
        for (final Record record : records) {
            updates.put(record.getId(), record);
        }
        final Set<String> existing = existing(updates.keySet());
        for (final String id : updates.keySet()) {
            if (!existing.contains(id)) {
                throw new NotInsertedException(id, null);
            }
        }
        final Cells oldCells = new Cells();
        for (final Record record : fetch(ImmutableList.copyOf(updates.keySet()))) {
            addCells(oldCells, record);
        }
        final Cells newCells = new Cells();
        for (final Record record : updates.values()) {
            addCells(newCells, record);
        }
        for (final Map.Entry<String, NavigableMap<byte[], NavigableMap<byte[], byte[]>>> entry : oldCells.tables
                .entrySet()) {
            final String table = entry.getKey();
            final NavigableMap<byte[], NavigableMap<byte[], byte[]>> newRows = newCells
                    .rows(table);
            final List<Delete> deletes = Lists.newArrayList();
            for (final Map.Entry<byte[], NavigableMap<byte[], byte[]>> row : entry.getValue()
                    .entrySet()) {
                final NavigableMap<byte[], byte[]> newColumns = newRows.get(row.getKey());
                if (newColumns == null) {
                    deletes.add(new Delete(row.getKey()));
                    continue;
                }
                for (final byte[] qualifier : row.getValue().keySet()) {
                    if (!newColumns.containsKey(qualifier)) {
                        deletes.add(new Delete(row.getKey()).addColumns(FAMILY, qualifier));
                    }
                }
            }
            if (!deletes.isEmpty()) {
                this.hbaseUtils.delete(table, deletes);
            }
        }
        write(newCells);
    }

    private void write(final Cells cells) throws IOException {
        // the record table is written last, so that a record exists only once fully indexed
        for (final Map.Entry<String, NavigableMap<byte[], NavigableMap<byte[], byte[]>>> entry : cells.tables
                .entrySet()) {
            if (!entry.getKey().equals(RECORD_TAB_NAME)) {
                this.hbaseUtils.put(entry.getKey(), toPuts(entry.getValue()));
            }
        }
        this.hbaseUtils.put(RECORD_TAB_NAME, toPuts(cells.rows(RECORD_TAB_NAME)));
    }

    private static List<Put> toPuts(final NavigableMap<byte[], NavigableMap<byte[], byte[]>> rows) {
        final List<Put> puts = Lists.newArrayListWithCapacity(rows.size());
        for (final Map.Entry<byte[], NavigableMap<byte[], byte[]>> row : rows.entrySet()) {
            final Put put = new Put(row.getKey());
            for (final Map.Entry<byte[], byte[]> column : row.getValue().entrySet()) {
                put.addColumn(FAMILY, column.getKey(), column.getValue());
            }
            puts.add(put);
        }
        return puts;
    }

    /**
     * Enumerates all the cells that store a record, in every table but the relationship ones.
     */
    private static void addCells(final Cells cells, final Record record) {
        final String id = record.getId();
        final byte[] row = Bytes.toBytes(id);
        cells.add(RECORD_TAB_NAME, row, TYPE, Bytes.toBytes(record.getType()));
        cells.add(RECORD_TAB_NAME, row, RAW, Bytes.toBytes(JsonCodec.toJson(record)));
        cells.add(RECORD_FROM_TYPE_TAB_NAME, RowKeys.key(record.getType(), id), META, EMPTY);
        for (final Map.Entry<String, Datum> entry : record.getData().entrySet()) {
            final String name = entry.getKey();
            final Datum datum = entry.getValue();
            final byte[] qualifier = Bytes.toBytes(name);
            final byte[] json = Bytes.toBytes(JsonCodec.writeDatum(datum).toString());
            final byte[] meta = encodeMeta(datum.getUnits(), datum.getTags());
            switch (datum.getKind()) {
            case SCALAR:
                cells.add(SCALAR_FROM_RECORD_TAB_NAME, row, qualifier, json);
                cells.add(RECORD_FROM_SCALAR_TAB_NAME, RowKeys.key(name, datum.asScalar(), id),
                        META, meta);
                break;
            case STRING:
                cells.add(STRING_FROM_RECORD_TAB_NAME, row, qualifier, json);
                cells.add(RECORD_FROM_STRING_TAB_NAME, RowKeys.key(name, datum.asString(), id),
                        META, meta);
                break;
            case SCALAR_LIST:
                cells.add(SCALAR_LIST_FROM_RECORD_TAB_NAME, row, qualifier, json);
                // empty lists have no synopsis
                if (!datum.asScalarList().isEmpty()) {
                    cells.add(RECORD_FROM_SCALAR_LIST_MIN_TAB_NAME,
                            RowKeys.key(name, datum.getMin(), id), META, meta);
                    cells.add(RECORD_FROM_SCALAR_LIST_MAX_TAB_NAME,
                            RowKeys.key(name, datum.getMax(), id), META, meta);
                }
                break;
            case STRING_LIST:
                cells.add(STRING_LIST_FROM_RECORD_TAB_NAME, row, qualifier, json);
                final List<String> values = datum.asStringList();
                for (int i = 0; i < values.size(); ++i) {
                    cells.add(RECORD_FROM_STRING_LIST_TAB_NAME,
                            RowKeys.key(name, values.get(i), id, i), META, meta);
                }
                break;
            default:
                throw new Error("Unexpected datum kind " + datum.getKind());
            }
        }
        for (final FileEntry file : record.getFiles().values()) {
            cells.add(RECORD_FROM_DOCUMENT_TAB_NAME, RowKeys.key(file.getURI(), id), META,
                    encodeMeta(null, file.getTags()));
            if (file.getMimeType() != null) {
                cells.add(RECORD_FROM_MIMETYPE_TAB_NAME, RowKeys.key(file.getMimeType(), id),
                        META, EMPTY);
            }
        }
        for (final CurveSet curveSet : record.getCurveSets().values()) {
            cells.add(RECORD_FROM_CURVE_SET_TAB_NAME, RowKeys.key(curveSet.getName(), id), META,
                    EMPTY);
        }
    }

    @Override
    public void delete(final Iterable<String> ids) throws IOException {
        final Set<String> requested = ImmutableSet.copyOf(ids);
        for (final List<String> batch : Iterables.partition(requested,
                this.hbaseUtils.getBatchSize())) {
            final List<String> present = Lists.newArrayList(existing(batch));
            if (present.isEmpty()) {
                continue;
            }
            final Cells cells = new Cells();
            for (final Record record : fetch(present)) {
                addCells(cells, record);
            }
            this.relationshipDAO.deleteInvolving(present);
            for (final Map.Entry<String, NavigableMap<byte[], NavigableMap<byte[], byte[]>>> entry : cells.tables
                    .entrySet()) {
                if (!entry.getKey().equals(RECORD_TAB_NAME)) {
                    this.hbaseUtils.delete(entry.getKey(), toDeletes(entry.getValue()));
                }
            }
            this.hbaseUtils.delete(RECORD_TAB_NAME, toDeletes(cells.rows(RECORD_TAB_NAME)));
            LOGGER.debug("{} - deleted {} records", this, present.size());
        }
    }

    private static List<Delete> toDeletes(
            final NavigableMap<byte[], NavigableMap<byte[], byte[]>> rows) {
        final List<Delete> deletes = Lists.newArrayListWithCapacity(rows.size());
        for (final byte[] row : rows.keySet()) {
            deletes.add(new Delete(row));
        }
        return deletes;
    }

    @Override
    public Stream<Record> get(final Collection<String> ids) throws RecordNotFoundException,
            IOException {
        final List<String> missing = missing(ids);
        if (!missing.isEmpty()) {
            throw new RecordNotFoundException(missing, null);
        }
        return Stream.concat(Stream.create(ids).chunk(this.hbaseUtils.getBatchSize()).transform(
                new Function<List<String>, List<Record>>() {

                    @Override
                    public List<Record> apply(final List<String> batch) {
                        try {
                            return fetch(batch);
                        } catch (final IOException ex) {
                            throw Util.propagate(ex);
                        }
                    }

                }));
    }

    private List<Record> fetch(final List<String> ids) throws IOException {
        final List<Get> gets = Lists.newArrayListWithCapacity(ids.size());
        for (final String id : ids) {
            gets.add(new Get(Bytes.toBytes(id)).addColumn(FAMILY, RAW));
        }
        final Result[] results = this.hbaseUtils.get(RECORD_TAB_NAME, gets);
        final List<Record> records = Lists.newArrayListWithCapacity(ids.size());
        for (int i = 0; i < results.length; ++i) {
            final byte[] raw = results[i].getValue(FAMILY, RAW);
            if (raw == null) {
                throw new RecordNotFoundException(ImmutableList.of(ids.get(i)),
                        "Deleted concurrently");
            }
            try {
                records.add(JsonCodec.readRecord(Bytes.toString(raw)));
            } catch (final IllegalArgumentException ex) {
                throw new DataCorruptedException("Cannot decode record " + ids.get(i), ex);
            }
        }
        return records;
    }

    @Override
    public List<Boolean> exist(final Iterable<String> ids) throws IOException {
        final List<String> list = ImmutableList.copyOf(ids);
        final Set<String> existing = existing(list);
        final List<Boolean> result = Lists.newArrayListWithCapacity(list.size());
        for (final String id : list) {
            result.add(existing.contains(id));
        }
        return result;
    }

    private Set<String> existing(final Collection<String> ids) throws IOException {
        final Set<String> existing = Sets.newHashSet();
        for (final List<String> batch : Iterables.partition(ImmutableSet.copyOf(ids),
                this.hbaseUtils.getBatchSize())) {
            final List<Get> gets = Lists.newArrayListWithCapacity(batch.size());
            for (final String id : batch) {
                gets.add(new Get(Bytes.toBytes(id)).addColumn(FAMILY, TYPE));
            }
            final Result[] results = this.hbaseUtils.get(RECORD_TAB_NAME, gets);
            for (int i = 0; i < results.length; ++i) {
                if (!results[i].isEmpty()) {
                    existing.add(batch.get(i));
                }
            }
        }
        return existing;
    }

    @Override
    protected Stream<DataRow> queryRows(final TableFamily family, final String name,
            @Nullable final DataRange range) throws IOException {
        return scanIndex(family, name, range).transform(new Function<Result, DataRow>() {

            @Override
            public DataRow apply(final Result result) {
                final List<Object> key = RowKeys.decode(result.getRow());
                final JsonNode meta = decodeMeta(result.getValue(FAMILY, META));
                final JsonNode units = meta.get("units");
                final List<String> tags = Lists.newArrayList();
                for (final JsonNode tag : meta.path("tags")) {
                    tags.add(tag.asText());
                }
                return new DataRow((String) key.get(2), name, key.get(1),
                        units == null ? null : units.asText(), tags);
            }

        }).filter(new Predicate<DataRow>() {

            @Override
            public boolean apply(final DataRow row) {
                return range == null || range.contains(row.getValue());
            }

        });
    }

    /**
     * Scans the index table of a family over the smallest key interval containing all the rows
     * with the name specified and a value in the range. Rows at the edges of the interval may
     * still fall outside the range and must be filtered.
     */
    private Stream<Result> scanIndex(final TableFamily family, final String name,
            @Nullable final DataRange range) throws IOException {
        final byte[] start = range != null && range.hasMin() ? RowKeys.key(name, range.getMin())
                : RowKeys.key(name);
        final byte[] stop = RowKeys.stopRowForPrefix(range != null && range.hasMax() ? RowKeys
                .key(name, range.getMax()) : RowKeys.key(name));
        return this.hbaseUtils.scan(indexTable(family), new Scan().withStartRow(start)
                .withStopRow(stop));
    }

    @Override
    protected Stream<String> matchAll(final TableFamily family,
            final List<Map.Entry<String, DataRange>> criteria) throws IOException {
        Preconditions.checkArgument(!criteria.isEmpty());
        final Map.Entry<String, DataRange> first = criteria.get(0);
        final Set<String> candidates = Sets.newTreeSet();
        try (Stream<DataRow> rows = queryRows(family, first.getKey(), first.getValue())) {
            for (final DataRow row : rows) {
                candidates.add(row.getRecordId());
            }
        }
        for (final Map.Entry<String, DataRange> criterion : criteria.subList(1, criteria.size())) {
            if (candidates.isEmpty()) {
                break;
            }
            final int before = candidates.size();
            narrow(family, candidates, criterion.getKey(), criterion.getValue());
            LOGGER.debug("{} - {} {} narrowed candidates from {} to {}", this, family,
                    criterion.getKey(), before, candidates.size());
        }
        return Intersections.sorted(candidates);
    }

    /**
     * Removes the candidates whose datum with the name specified does not satisfy the range,
     * reading the data of all candidates with batched multi-gets.
     */
    private void narrow(final TableFamily family, final Set<String> candidates, final String name,
            @Nullable final DataRange range) throws IOException {
        final byte[] qualifier = Bytes.toBytes(name);
        for (final List<String> batch : Iterables.partition(ImmutableList.copyOf(candidates),
                this.hbaseUtils.getBatchSize())) {
            final List<Get> gets = Lists.newArrayListWithCapacity(batch.size());
            for (final String id : batch) {
                gets.add(new Get(Bytes.toBytes(id)).addColumn(FAMILY, qualifier));
            }
            final Result[] results = this.hbaseUtils.get(dataTable(family), gets);
            for (int i = 0; i < results.length; ++i) {
                final byte[] json = results[i].getValue(FAMILY, qualifier);
                if (json == null || !matches(family, decodeDatum(json), range)) {
                    candidates.remove(batch.get(i));
                }
            }
        }
    }

    private static boolean matches(final TableFamily family, final Datum datum,
            @Nullable final DataRange range) {
        switch (family) {
        case SCALAR:
        case STRING:
            return range == null || range.contains(datum.getValue());
        case SCALAR_LIST_MIN:
            return datum.getMin() != null && (range == null || range.contains(datum.getMin()));
        case SCALAR_LIST_MAX:
            return datum.getMax() != null && (range == null || range.contains(datum.getMax()));
        case STRING_LIST:
            if (datum.getKind() != Datum.Kind.STRING_LIST) {
                return false; // empty lists decode as scalar lists
            }
            for (final String value : datum.asStringList()) {
                if (range == null || range.contains(value)) {
                    return true;
                }
            }
            return false;
        default:
            throw new Error("Unexpected family " + family);
        }
    }

    @Override
    public Stream<String> getWithMax(final String name, final int count) throws IOException {
        Preconditions.checkArgument(count >= 0, "Invalid count %s", count);
        if (count == 0) {
            return Stream.create();
        }
        final byte[] prefix = RowKeys.key(name);
        return toIds(this.hbaseUtils.scan(RECORD_FROM_SCALAR_TAB_NAME, new Scan()
                .withStartRow(RowKeys.stopRowForPrefix(prefix), false)
                .withStopRow(prefix, true).setReversed(true).setLimit(count)), 2);
    }

    @Override
    public Stream<String> getWithMin(final String name, final int count) throws IOException {
        Preconditions.checkArgument(count >= 0, "Invalid count %s", count);
        if (count == 0) {
            return Stream.create();
        }
        final byte[] prefix = RowKeys.key(name);
        return toIds(this.hbaseUtils.scan(RECORD_FROM_SCALAR_TAB_NAME, new Scan()
                .withStartRow(prefix).withStopRow(RowKeys.stopRowForPrefix(prefix))
                .setLimit(count)), 2);
    }

    @Override
    public Stream<String> getGivenDocumentUri(final String uri,
            @Nullable final Collection<String> acceptedIds) throws IOException {
        final int wildcard = uri.indexOf('%');
        final Scan scan = new Scan();
        Pattern pattern = null;
        if (wildcard < 0) {
            final byte[] prefix = RowKeys.key(uri);
            scan.withStartRow(prefix).withStopRow(RowKeys.stopRowForPrefix(prefix));
        } else {
            final StringBuilder regex = new StringBuilder();
            for (final String piece : uri.split("%", -1)) {
                regex.append(regex.length() == 0 ? "" : ".*").append(Pattern.quote(piece));
            }
            pattern = Pattern.compile(regex.toString(), Pattern.DOTALL);
            if (wildcard > 0) {
                final byte[] prefix = RowKeys.stringPrefix(uri.substring(0, wildcard));
                scan.withStartRow(prefix).withStopRow(RowKeys.stopRowForPrefix(prefix));
            } else {
                LOGGER.warn("{} - full scan of {} for URI pattern {}", this,
                        RECORD_FROM_DOCUMENT_TAB_NAME, uri);
            }
        }
        final Set<String> accepted = acceptedIds == null ? null : ImmutableSet
                .copyOf(acceptedIds);
        final Set<String> ids = Sets.newTreeSet();
        try (Stream<Result> stream = this.hbaseUtils.scan(RECORD_FROM_DOCUMENT_TAB_NAME, scan)) {
            for (final Result result : stream) {
                final List<Object> key = RowKeys.decode(result.getRow());
                final String id = (String) key.get(1);
                if ((pattern == null || pattern.matcher((String) key.get(0)).matches())
                        && (accepted == null || accepted.contains(id))) {
                    ids.add(id);
                }
            }
        }
        return Intersections.sorted(ids);
    }

    @Override
    public Stream<String> getWithMimeType(final String mimeType,
            @Nullable final Collection<String> acceptedIds) throws IOException {
        final Stream<String> stream = idsWithKey(RECORD_FROM_MIMETYPE_TAB_NAME, mimeType);
        if (acceptedIds == null) {
            return stream;
        }
        final Set<String> accepted = ImmutableSet.copyOf(acceptedIds);
        return stream.filter(new Predicate<String>() {

            @Override
            public boolean apply(final String id) {
                return accepted.contains(id);
            }

        });
    }

    @Override
    public Stream<String> getWithCurveSet(final String curveSetName) throws IOException {
        return idsWithKey(RECORD_FROM_CURVE_SET_TAB_NAME, curveSetName);
    }

    @Override
    public Set<String> getCurveSetNames() throws IOException {
        return distinctKeys(RECORD_FROM_CURVE_SET_TAB_NAME);
    }

    @Override
    public Stream<String> getAllOfType(final String type) throws IOException {
        return idsWithKey(RECORD_FROM_TYPE_TAB_NAME, type);
    }

    @Override
    public Set<String> getAvailableTypes() throws IOException {
        return distinctKeys(RECORD_FROM_TYPE_TAB_NAME);
    }

    /**
     * Returns the ids of an index table whose row keys are (key, id) pairs, for the key
     * specified, in ascending order.
     */
    private Stream<String> idsWithKey(final String table, final String key) throws IOException {
        final byte[] prefix = RowKeys.key(key);
        return toIds(this.hbaseUtils.scan(table, new Scan().withStartRow(prefix).withStopRow(
                RowKeys.stopRowForPrefix(prefix))), 1).setProperty(Stream.PROPERTY_SORTED, true);
    }

    /**
     * Returns the distinct keys of an index table whose row keys are (key, id) pairs.
     */
    private Set<String> distinctKeys(final String table) throws IOException {
        final Set<String> keys = Sets.newHashSet();
        byte[] start = new byte[0];
        while (true) {
            // skip to the next key after each hit
            final String key;
            try (Stream<Result> stream = this.hbaseUtils.scan(table, new Scan().withStartRow(
                    start).setLimit(1))) {
                final Result result = Iterables.getFirst(stream, null);
                if (result == null) {
                    break;
                }
                key = (String) RowKeys.decode(result.getRow()).get(0);
            }
            keys.add(key);
            start = RowKeys.stopRowForPrefix(RowKeys.key(key));
        }
        return ImmutableSet.copyOf(keys);
    }

    @Override
    public Stream<String> getAll() throws IOException {
        return this.hbaseUtils.scan(RECORD_TAB_NAME, new Scan().addColumn(FAMILY, TYPE))
                .transform(new Function<Result, String>() {

                    @Override
                    public String apply(final Result result) {
                        return Bytes.toString(result.getRow());
                    }

                }).setProperty(Stream.PROPERTY_SORTED, true);
    }

    private static Stream<String> toIds(final Stream<Result> results, final int position) {
        return results.transform(new Function<Result, String>() {

            @Override
            public String apply(final Result result) {
                return (String) RowKeys.decode(result.getRow()).get(position);
            }

        });
    }

    private static String indexTable(final TableFamily family) {
        switch (family) {
        case SCALAR:
            return RECORD_FROM_SCALAR_TAB_NAME;
        case STRING:
            return RECORD_FROM_STRING_TAB_NAME;
        case SCALAR_LIST_MIN:
            return RECORD_FROM_SCALAR_LIST_MIN_TAB_NAME;
        case SCALAR_LIST_MAX:
            return RECORD_FROM_SCALAR_LIST_MAX_TAB_NAME;
        case STRING_LIST:
            return RECORD_FROM_STRING_LIST_TAB_NAME;
        default:
            throw new Error("Unexpected family " + family);
        }
    }

    private static String dataTable(final TableFamily family) {
        switch (family) {
        case SCALAR:
            return SCALAR_FROM_RECORD_TAB_NAME;
        case STRING:
            return STRING_FROM_RECORD_TAB_NAME;
        case SCALAR_LIST_MIN:
        case SCALAR_LIST_MAX:
            return SCALAR_LIST_FROM_RECORD_TAB_NAME;
        case STRING_LIST:
            return STRING_LIST_FROM_RECORD_TAB_NAME;
        default:
            throw new Error("Unexpected family " + family);
        }
    }

    private static byte[] encodeMeta(@Nullable final String units, final List<String> tags) {
        final ObjectNode node = JsonCodec.getMapper().createObjectNode();
        if (units != null) {
            node.put("units", units);
        }
        if (!tags.isEmpty()) {
            final ArrayNode array = node.putArray("tags");
            for (final String tag : tags) {
                array.add(tag);
            }
        }
        return Bytes.toBytes(node.toString());
    }

    private static JsonNode decodeMeta(@Nullable final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return JsonCodec.getMapper().createObjectNode();
        }
        try {
            return JsonCodec.parse(Bytes.toString(bytes));
        } catch (final IllegalArgumentException ex) {
            throw Util.propagate(new DataCorruptedException("Cannot decode index metadata "
                    + Bytes.toStringBinary(bytes), ex));
        }
    }

    private static Datum decodeDatum(final byte[] bytes) {
        try {
            return JsonCodec.readDatum(JsonCodec.parse(Bytes.toString(bytes)));
        } catch (final IllegalArgumentException ex) {
            throw Util.propagate(new DataCorruptedException("Cannot decode datum "
                    + Bytes.toStringBinary(bytes), ex));
        }
    }

    /**
     * The cells of one or more records, grouped by table, row and qualifier.
     */
    private static final class Cells {

        final Map<String, NavigableMap<byte[], NavigableMap<byte[], byte[]>>> tables = Maps
                .newLinkedHashMap();

        void add(final String table, final byte[] row, final byte[] qualifier,
                final byte[] value) {
            final NavigableMap<byte[], NavigableMap<byte[], byte[]>> rows = rows(table);
            NavigableMap<byte[], byte[]> columns = rows.get(row);
            if (columns == null) {
                columns = Maps.newTreeMap(Bytes.BYTES_COMPARATOR);
                rows.put(row, columns);
            }
            columns.put(qualifier, value);
        }

        NavigableMap<byte[], NavigableMap<byte[], byte[]>> rows(final String table) {
            NavigableMap<byte[], NavigableMap<byte[], byte[]>> rows = this.tables.get(table);
            if (rows == null) {
                rows = Maps.newTreeMap(Bytes.BYTES_COMPARATOR);
                this.tables.put(table, rows);
            }
            return rows;
        }

    }

}
