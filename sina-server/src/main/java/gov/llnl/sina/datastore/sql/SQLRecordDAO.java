package gov.llnl.sina.datastore.sql;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Function;
import com.google.common.base.Joiner;
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
import gov.llnl.sina.data.ParseException;
import gov.llnl.sina.data.Record;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.datastore.AbstractRecordDAO;
import gov.llnl.sina.datastore.DataRow;
import gov.llnl.sina.datastore.NotInsertedException;
import gov.llnl.sina.datastore.RecordExistsException;
import gov.llnl.sina.datastore.RecordNotFoundException;
import gov.llnl.sina.datastore.TableFamily;
import gov.llnl.sina.internal.Util;
import gov.llnl.sina.query.DataRange;
import gov.llnl.sina.query.Intersections;
import gov.llnl.sina.runtime.DataCorruptedException;

/**
 * {@code RecordDAO} for {@link SQLDataStore}.
 * <p>
 * The criteria of a bucket are evaluated with a single statement selecting the rows matching
 * any criterion and keeping, via {@code GROUP BY record_id HAVING COUNT(DISTINCT name) = n},
 * the records that matched all of them. Ids are read eagerly and sorted in {@code String}
 * order, independently of the database collation, so that result streams hold no connection
 * and can be intersected by ordered merge.
 * </p>
 */
final class SQLRecordDAO extends AbstractRecordDAO {

    private static final Logger LOGGER = LoggerFactory.getLogger(SQLRecordDAO.class);

    private static final int BATCH_SIZE = 500;

    private static final List<String> DATA_TABLES = ImmutableList.of("scalar_data",
            "string_data", "scalar_list_data", "string_list_data", "document", "curve_set_meta");

    private static final SQLDataStore.RowMapper<String> ID_MAPPER = new SQLDataStore.RowMapper<String>() {

        @Override
        public String map(final ResultSet resultSet) throws SQLException {
            return resultSet.getString(1);
        }

    };

    private final SQLDataStore store;

    SQLRecordDAO(final SQLDataStore store) {
        this.store = Preconditions.checkNotNull(store);
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
        for (final Record record : list) {
            write(record, false);
        }
    }

    @Override
    public void update(final Iterable<Record> records) throws NotInsertedException, IOException {
        final List<Record> list = ImmutableList.copyOf(records);
        final Set<String> ids = Sets.newLinkedHashSet();
        for (final Record record : list) {
            ids.add(record.getId());
        }
        final Set<String> existing = existing(ids);
        for (final String id : ids) {
            if (!existing.contains(id)) {
                throw new NotInsertedException(id, null);
            }
        }
        for (final Record record : list) {
            write(record, true);
        }
    }

    private void write(final Record record, final boolean replace) throws IOException {
        try (Connection connection = this.store.getConnection()) {
            connection.setAutoCommit(false);
            try {
                final String id = record.getId();
                if (replace) {
                    for (final String table : DATA_TABLES) {
                        execute(connection, "DELETE FROM " + table + " WHERE record_id = ?", id);
                    }
                    execute(connection, "UPDATE record SET record_type = ?, raw = ? WHERE id = ?",
                            record.getType(), JsonCodec.toJson(record), id);
                } else {
                    execute(connection, "INSERT INTO record (id, record_type, raw) "
                            + "VALUES (?, ?, ?)", id, record.getType(), JsonCodec.toJson(record));
                }
                for (final Map.Entry<String, Datum> entry : record.getData().entrySet()) {
                    writeDatum(connection, id, entry.getKey(), entry.getValue());
                }
                for (final FileEntry file : record.getFiles().values()) {
                    execute(connection, "INSERT INTO document (record_id, uri, mimetype, tags) "
                            + "VALUES (?, ?, ?, ?)", id, file.getURI(), file.getMimeType(),
                            encodeTags(file.getTags()));
                }
                for (final CurveSet curveSet : record.getCurveSets().values()) {
                    execute(connection, "INSERT INTO curve_set_meta (record_id, name) "
                            + "VALUES (?, ?)", id, curveSet.getName());
                }
                connection.commit();
            } catch (final SQLException | IOException | RuntimeException ex) {
                connection.rollback();
                throw ex;
            }
        } catch (final SQLException ex) {
            throw new IOException("Failed to write record " + record.getId() + ": "
                    + ex.getMessage(), ex);
        }
    }

    private void writeDatum(final Connection connection, final String id, final String name,
            final Datum datum) throws SQLException, IOException {
        final String units = datum.getUnits();
        final String tags = encodeTags(datum.getTags());
        switch (datum.getKind()) {
        case SCALAR:
            execute(connection, "INSERT INTO scalar_data (record_id, name, val, units, tags) "
                    + "VALUES (?, ?, ?, ?, ?)", id, name, datum.asScalar(), units, tags);
            break;
        case STRING:
            execute(connection, "INSERT INTO string_data (record_id, name, val, units, tags) "
                    + "VALUES (?, ?, ?, ?, ?)", id, name, datum.asString(), units, tags);
            break;
        case SCALAR_LIST:
            // empty lists have no synopsis
            if (!datum.asScalarList().isEmpty()) {
                execute(connection, "INSERT INTO scalar_list_data (record_id, name, min_val, "
                        + "max_val, units, tags) VALUES (?, ?, ?, ?, ?, ?)", id, name,
                        datum.getMin(), datum.getMax(), units, tags);
            }
            break;
        case STRING_LIST:
            final List<String> values = datum.asStringList();
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO "
                    + "string_list_data (record_id, name, idx, val, units, tags) "
                    + "VALUES (?, ?, ?, ?, ?, ?)")) {
                for (int i = 0; i < values.size(); ++i) {
                    SQLDataStore.bind(statement, Lists.<Object>newArrayList(id, name, i,
                            values.get(i), units, tags));
                    statement.addBatch();
                }
                statement.executeBatch();
            }
            break;
        default:
            throw new Error("Unexpected datum kind " + datum.getKind());
        }
    }

    @Override
    public void delete(final Iterable<String> ids) throws IOException {
        for (final List<String> batch : Iterables.partition(ImmutableSet.copyOf(ids),
                BATCH_SIZE)) {
            final String in = placeholders(batch.size());
            try (Connection connection = this.store.getConnection()) {
                connection.setAutoCommit(false);
                try {
                    for (final String table : DATA_TABLES) {
                        execute(connection, "DELETE FROM " + table + " WHERE record_id IN " + in,
                                batch.toArray());
                    }
                    final List<Object> parameters = Lists.<Object>newArrayList(batch);
                    parameters.addAll(batch);
                    execute(connection, "DELETE FROM relationship WHERE subject_id IN " + in
                            + " OR object_id IN " + in, parameters.toArray());
                    execute(connection, "DELETE FROM record WHERE id IN " + in,
                            batch.toArray());
                    connection.commit();
                } catch (final SQLException | RuntimeException ex) {
                    connection.rollback();
                    throw ex;
                }
            } catch (final SQLException ex) {
                throw new IOException("Failed to delete records " + batch + ": "
                        + ex.getMessage(), ex);
            }
        }
    }

    @Override
    public Stream<Record> get(final Collection<String> ids) throws RecordNotFoundException,
            IOException {
        final List<String> missing = missing(ids);
        if (!missing.isEmpty()) {
            throw new RecordNotFoundException(missing, null);
        }
        return Stream.concat(Stream.create(ids).chunk(BATCH_SIZE).transform(
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
        final Map<String, Record> records = Maps.newHashMap();
        try (Stream<Record> stream = this.store.query("SELECT id, raw FROM record WHERE id IN "
                + placeholders(ids.size()), ids, new SQLDataStore.RowMapper<Record>() {

            @Override
            public Record map(final ResultSet resultSet) throws SQLException {
                final String id = resultSet.getString(1);
                try {
                    return JsonCodec.readRecord(resultSet.getString(2));
                } catch (final ParseException ex) {
                    throw Util.propagate(new DataCorruptedException("Cannot decode record " + id,
                            ex));
                }
            }

        })) {
            for (final Record record : stream) {
                records.put(record.getId(), record);
            }
        }
        final List<Record> result = Lists.newArrayListWithCapacity(ids.size());
        for (final String id : ids) {
            final Record record = records.get(id);
            if (record == null) {
                throw new RecordNotFoundException(ImmutableList.of(id), "Deleted concurrently");
            }
            result.add(record);
        }
        return result;
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
                BATCH_SIZE)) {
            existing.addAll(this.store.query("SELECT id FROM record WHERE id IN "
                    + placeholders(batch.size()), batch, ID_MAPPER).toSet());
        }
        return existing;
    }

    @Override
    protected Stream<DataRow> queryRows(final TableFamily family, final String name,
            @Nullable final DataRange range) throws IOException {
        final String column = column(family);
        final StringBuilder sql = new StringBuilder();
        final List<Object> parameters = Lists.newArrayList();
        sql.append("SELECT record_id, name, ").append(column).append(", units, tags FROM ")
                .append(table(family)).append(" WHERE name = ?");
        parameters.add(name);
        if (range != null) {
            sql.append(" AND ");
            appendCondition(sql, parameters, column, range);
        }
        final List<DataRow> rows = this.store.query(sql.toString(), parameters,
                new SQLDataStore.RowMapper<DataRow>() {

                    @Override
                    public DataRow map(final ResultSet resultSet) throws SQLException {
                        final Object value = family.isNumeric() ? (Object) resultSet
                                .getDouble(3) : resultSet.getString(3);
                        return new DataRow(resultSet.getString(1), resultSet.getString(2),
                                value, resultSet.getString(4), decodeTags(resultSet
                                        .getString(5)));
                    }

                }).toList();
        return Stream.create(rows);
    }

    @Override
    protected Stream<String> matchAll(final TableFamily family,
            final List<Map.Entry<String, DataRange>> criteria) throws IOException {
        Preconditions.checkArgument(!criteria.isEmpty());
        final String column = column(family);
        final StringBuilder sql = new StringBuilder();
        final List<Object> parameters = Lists.newArrayList();
        sql.append("SELECT record_id FROM ").append(table(family)).append(" WHERE ");
        String separator = "";
        for (final Map.Entry<String, DataRange> criterion : criteria) {
            sql.append(separator).append("(name = ?");
            parameters.add(criterion.getKey());
            if (criterion.getValue() != null) {
                sql.append(" AND ");
                appendCondition(sql, parameters, column, criterion.getValue());
            }
            sql.append(")");
            separator = " OR ";
        }
        sql.append(" GROUP BY record_id HAVING COUNT(DISTINCT name) = ?");
        parameters.add(criteria.size());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} - {} {}", this, sql, parameters);
        }
        return queryIds(sql.toString(), parameters);
    }

    /**
     * Runs a query returning record ids and returns them in ascending {@code String} order. Ids
     * are read eagerly, so that the connection goes back to the pool before the caller combines
     * this stream with others.
     */
    private Stream<String> queryIds(final String sql, final List<?> parameters)
            throws IOException {
        return Intersections.sorted(this.store.query(sql, parameters, ID_MAPPER).toSet());
    }

    private static void appendCondition(final StringBuilder sql, final List<Object> parameters,
            final String column, final DataRange range) {
        if (range.isSingleValue()) {
            sql.append(column).append(" = ?");
            parameters.add(range.getMin());
            return;
        }
        String separator = "";
        if (range.hasMin()) {
            sql.append(column).append(range.isMinInclusive() ? " >= ?" : " > ?");
            parameters.add(range.getMin());
            separator = " AND ";
        }
        if (range.hasMax()) {
            sql.append(separator).append(column).append(range.isMaxInclusive() ? " <= ?" : " < ?");
            parameters.add(range.getMax());
        }
    }

    @Override
    public Stream<String> getWithMax(final String name, final int count) throws IOException {
        return topK(name, count, "DESC");
    }

    @Override
    public Stream<String> getWithMin(final String name, final int count) throws IOException {
        return topK(name, count, "ASC");
    }

    private Stream<String> topK(final String name, final int count, final String order)
            throws IOException {
        Preconditions.checkArgument(count >= 0, "Invalid count %s", count);
        return this.store.query("SELECT record_id FROM scalar_data WHERE name = ? ORDER BY val "
                + order + ", record_id LIMIT ?", ImmutableList.<Object>of(name, count), ID_MAPPER);
    }

    @Override
    public Stream<String> getGivenDocumentUri(final String uri,
            @Nullable final Collection<String> acceptedIds) throws IOException {
        final Stream<String> stream;
        if (uri.indexOf('%') >= 0) {
            final String pattern = uri.replace("\\", "\\\\").replace("_", "\\_");
            stream = queryIds("SELECT DISTINCT record_id FROM document "
                    + "WHERE uri LIKE ? ESCAPE '\\'", ImmutableList.of(pattern));
        } else {
            stream = queryIds("SELECT DISTINCT record_id FROM document WHERE uri = ?",
                    ImmutableList.of(uri));
        }
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
    public Stream<String> getWithMimeType(final String mimeType,
            @Nullable final Collection<String> acceptedIds) throws IOException {
        final Stream<String> stream = queryIds("SELECT DISTINCT record_id FROM document "
                + "WHERE mimetype = ?", ImmutableList.of(mimeType));
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
        return queryIds("SELECT record_id FROM curve_set_meta WHERE name = ?",
                ImmutableList.of(curveSetName));
    }

    @Override
    public Set<String> getCurveSetNames() throws IOException {
        return ImmutableSet.copyOf(this.store.query("SELECT DISTINCT name FROM curve_set_meta",
                ImmutableList.of(), ID_MAPPER).toSet());
    }

    @Override
    public Set<String> getDataNames(final String type,
            @Nullable final Collection<Datum.Kind> kinds) throws IOException {
        final Set<String> names = Sets.newTreeSet();
        for (final Datum.Kind kind : kinds == null ? EnumSet.allOf(Datum.Kind.class) : Sets
                .immutableEnumSet(kinds)) {
            names.addAll(this.store.query("SELECT DISTINCT d.name FROM " + table(kind)
                    + " d JOIN record r ON r.id = d.record_id WHERE r.record_type = ?",
                    ImmutableList.of(type), ID_MAPPER).toSet());
        }
        return ImmutableSet.copyOf(names);
    }

    @Override
    public Stream<String> getAllOfType(final String type) throws IOException {
        return queryIds("SELECT id FROM record WHERE record_type = ?", ImmutableList.of(type));
    }

    @Override
    public Set<String> getAvailableTypes() throws IOException {
        return ImmutableSet.copyOf(this.store.query("SELECT DISTINCT record_type FROM record",
                ImmutableList.of(), ID_MAPPER).toSet());
    }

    @Override
    public Stream<String> getAll() throws IOException {
        return queryIds("SELECT id FROM record", ImmutableList.of());
    }

    private static String table(final Datum.Kind kind) {
        switch (kind) {
        case SCALAR:
            return "scalar_data";
        case STRING:
            return "string_data";
        case SCALAR_LIST:
            return "scalar_list_data";
        case STRING_LIST:
            return "string_list_data";
        default:
            throw new Error("Unexpected datum kind " + kind);
        }
    }

    private static String table(final TableFamily family) {
        switch (family) {
        case SCALAR:
            return "scalar_data";
        case STRING:
            return "string_data";
        case SCALAR_LIST_MIN:
        case SCALAR_LIST_MAX:
            return "scalar_list_data";
        case STRING_LIST:
            return "string_list_data";
        default:
            throw new Error("Unexpected family " + family);
        }
    }

    private static String column(final TableFamily family) {
        return family == TableFamily.SCALAR_LIST_MIN ? "min_val"
                : family == TableFamily.SCALAR_LIST_MAX ? "max_val" : "val";
    }

    private static String placeholders(final int count) {
        return "(" + Joiner.on(", ").join(Collections.nCopies(count, "?")) + ")";
    }

    private static void execute(final Connection connection, final String sql,
            final Object... parameters) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < parameters.length; ++i) {
                final Object parameter = parameters[i];
                if (parameter == null) {
                    statement.setNull(i + 1, Types.VARCHAR);
                } else if (parameter instanceof Double) {
                    statement.setDouble(i + 1, (Double) parameter);
                } else {
                    statement.setString(i + 1, parameter.toString());
                }
            }
            statement.executeUpdate();
        }
    }

    @Nullable
    private static String encodeTags(final List<String> tags) throws JsonProcessingException {
        return tags.isEmpty() ? null : JsonCodec.getMapper().writeValueAsString(tags);
    }

    @Nullable
    private static List<String> decodeTags(@Nullable final String tags) {
        if (tags == null) {
            return null;
        }
        try {
            final List<String> result = Lists.newArrayList();
            for (final JsonNode node : JsonCodec.getMapper().readTree(tags)) {
                result.add(node.asText());
            }
            return result;
        } catch (final IOException ex) {
            throw Util.propagate(new DataCorruptedException("Cannot decode tags " + tags, ex));
        }
    }

}
