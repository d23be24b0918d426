package gov.llnl.sina.datastore.sql;

import java.io.Closeable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.data.Stream;
import gov.llnl.sina.datastore.DataStore;
import gov.llnl.sina.datastore.RecordDAO;
import gov.llnl.sina.datastore.RelationshipDAO;
import gov.llnl.sina.internal.Util;

/**
 * A {@code DataStore} backed by a relational database accessed through a HikariCP connection
 * pool.
 * <p>
 * Records are stored in table {@code record} (id, type and JSON representation), with their
 * searchable facts in per-kind tables: {@code scalar_data}, {@code string_data},
 * {@code scalar_list_data} (min/max synopsis of each list), {@code string_list_data} (one row
 * per element), {@code document} and {@code curve_set_meta}. Relationships are stored in table
 * {@code relationship}. The schema is created at initialization time unless property
 * {@link #PROPERTY_SCHEMA_CREATE} is false.
 * </p>
 * <p>
 * Configuration properties:
 * <ul>
 * <li>{@code sina.sql.url} (mandatory), the JDBC URL of the database;</li>
 * <li>{@code sina.sql.user}, {@code sina.sql.password}, the optional credentials;</li>
 * <li>{@code sina.sql.pool.max}, the maximum number of pooled connections (default 10);</li>
 * <li>{@code sina.sql.schema.create}, whether to create missing tables (default true).</li>
 * </ul>
 * </p>
 */
public class SQLDataStore implements DataStore {

    public static final String PROPERTY_URL = "sina.sql.url";

    public static final String PROPERTY_USER = "sina.sql.user";

    public static final String PROPERTY_PASSWORD = "sina.sql.password";

    public static final String PROPERTY_POOL_MAX = "sina.sql.pool.max";

    public static final String PROPERTY_SCHEMA_CREATE = "sina.sql.schema.create";

    private static final Logger LOGGER = LoggerFactory.getLogger(SQLDataStore.class);

    private static final int DEFAULT_POOL_MAX = 10;

    private static final List<String> SCHEMA = ImmutableList.of(
            "CREATE TABLE IF NOT EXISTS record (id VARCHAR(255) NOT NULL PRIMARY KEY, "
                    + "record_type VARCHAR(255) NOT NULL, raw CLOB NOT NULL)",
            "CREATE TABLE IF NOT EXISTS scalar_data (record_id VARCHAR(255) NOT NULL, "
                    + "name VARCHAR(255) NOT NULL, val DOUBLE PRECISION NOT NULL, "
                    + "units VARCHAR(255), tags VARCHAR(4096), PRIMARY KEY (record_id, name))",
            "CREATE TABLE IF NOT EXISTS string_data (record_id VARCHAR(255) NOT NULL, "
                    + "name VARCHAR(255) NOT NULL, val VARCHAR(4096) NOT NULL, "
                    + "units VARCHAR(255), tags VARCHAR(4096), PRIMARY KEY (record_id, name))",
            "CREATE TABLE IF NOT EXISTS scalar_list_data (record_id VARCHAR(255) NOT NULL, "
                    + "name VARCHAR(255) NOT NULL, min_val DOUBLE PRECISION NOT NULL, "
                    + "max_val DOUBLE PRECISION NOT NULL, units VARCHAR(255), "
                    + "tags VARCHAR(4096), PRIMARY KEY (record_id, name))",
            "CREATE TABLE IF NOT EXISTS string_list_data (record_id VARCHAR(255) NOT NULL, "
                    + "name VARCHAR(255) NOT NULL, idx INTEGER NOT NULL, "
                    + "val VARCHAR(4096) NOT NULL, units VARCHAR(255), tags VARCHAR(4096), "
                    + "PRIMARY KEY (record_id, name, idx))",
            "CREATE TABLE IF NOT EXISTS document (record_id VARCHAR(255) NOT NULL, "
                    + "uri VARCHAR(1024) NOT NULL, mimetype VARCHAR(255), tags VARCHAR(4096), "
                    + "PRIMARY KEY (record_id, uri))",
            "CREATE TABLE IF NOT EXISTS curve_set_meta (record_id VARCHAR(255) NOT NULL, "
                    + "name VARCHAR(255) NOT NULL, PRIMARY KEY (record_id, name))",
            "CREATE TABLE IF NOT EXISTS relationship (subject_id VARCHAR(255) NOT NULL, "
                    + "predicate VARCHAR(255) NOT NULL, object_id VARCHAR(255) NOT NULL)",
            "CREATE INDEX IF NOT EXISTS record_type_idx ON record (record_type)",
            "CREATE INDEX IF NOT EXISTS scalar_data_idx ON scalar_data (name, val)",
            "CREATE INDEX IF NOT EXISTS string_data_idx ON string_data (name, val)",
            "CREATE INDEX IF NOT EXISTS scalar_list_min_idx ON scalar_list_data (name, min_val)",
            "CREATE INDEX IF NOT EXISTS scalar_list_max_idx ON scalar_list_data (name, max_val)",
            "CREATE INDEX IF NOT EXISTS string_list_data_idx ON string_list_data (name, val)",
            "CREATE INDEX IF NOT EXISTS document_uri_idx ON document (uri)",
            "CREATE INDEX IF NOT EXISTS document_mimetype_idx ON document (mimetype)",
            "CREATE INDEX IF NOT EXISTS curve_set_meta_idx ON curve_set_meta (name)",
            "CREATE INDEX IF NOT EXISTS relationship_subject_idx "
                    + "ON relationship (subject_id, predicate)",
            "CREATE INDEX IF NOT EXISTS relationship_object_idx "
                    + "ON relationship (object_id, predicate)");

    private final HikariConfig config;

    private final boolean createSchema;

    @Nullable
    private HikariDataSource dataSource;

    @Nullable
    private SQLRecordDAO recordDAO;

    @Nullable
    private SQLRelationshipDAO relationshipDAO;

    private boolean closed;

    /**
     * Creates a new instance configured with the properties specified.
     *
     * @param properties
     *            the configuration properties
     * @throws IllegalArgumentException
     *             if the configuration is not valid
     */
    public SQLDataStore(final Properties properties) {
        final String url = properties.getProperty(PROPERTY_URL);
        Preconditions.checkArgument(url != null, "Missing property %s", PROPERTY_URL);
        final int poolMax = Integer.parseInt(properties.getProperty(PROPERTY_POOL_MAX,
                Integer.toString(DEFAULT_POOL_MAX)));
        Preconditions.checkArgument(poolMax > 0, "Invalid pool size %s", poolMax);

        this.config = new HikariConfig();
        this.config.setJdbcUrl(url);
        this.config.setUsername(properties.getProperty(PROPERTY_USER));
        this.config.setPassword(properties.getProperty(PROPERTY_PASSWORD));
        this.config.setMinimumIdle(Math.min(2, poolMax));
        this.config.setMaximumPoolSize(poolMax);
        this.config.setConnectionTimeout(30000); // default 30000 ms (30 s)
        this.config.setIdleTimeout(600000); // default 600000 ms (10 m)
        this.config.setMaxLifetime(1800000); // default 1800000 ms (30 m)
        this.config.setPoolName("sina-sql");
        this.createSchema = Boolean.parseBoolean(properties.getProperty(PROPERTY_SCHEMA_CREATE,
                "true"));

        LOGGER.debug("{} configured for {}", getClass().getSimpleName(), url);
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(this.dataSource == null && !this.closed,
                "Already initialized or closed");
        this.dataSource = new HikariDataSource(this.config);
        if (this.createSchema) {
            try (Connection connection = this.dataSource.getConnection();
                    Statement statement = connection.createStatement()) {
                for (final String sql : SCHEMA) {
                    statement.execute(sql);
                }
            } catch (final SQLException ex) {
                throw new IOException("Cannot create schema: " + ex.getMessage(), ex);
            }
        }
        this.recordDAO = new SQLRecordDAO(this);
        this.relationshipDAO = new SQLRelationshipDAO(this);
        LOGGER.info("{} initialized, {} {}", this, this.config.getJdbcUrl(),
                this.createSchema ? "(schema checked)" : "");
    }

    @Override
    public synchronized RecordDAO getRecordDAO() throws IllegalStateException {
        checkInitialized();
        return this.recordDAO;
    }

    @Override
    public synchronized RelationshipDAO getRelationshipDAO() throws IllegalStateException {
        checkInitialized();
        return this.relationshipDAO;
    }

    @Override
    public boolean supportsParallelIngestion() {
        return false;
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        if (this.dataSource != null) {
            this.dataSource.close();
            LOGGER.info("{} closed", this);
        }
    }

    private void checkInitialized() {
        Preconditions.checkState(this.dataSource != null && !this.closed,
                "%s not initialized or already closed", this);
    }

    /**
     * Returns a new connection from the pool, in auto-commit mode.
     */
    Connection getConnection() throws SQLException {
        final HikariDataSource source;
        synchronized (this) {
            checkInitialized();
            source = this.dataSource;
        }
        return source.getConnection();
    }

    /**
     * Executes a query lazily. The returned stream holds a pooled connection, released when the
     * stream is closed or exhausted.
     *
     * @param sql
     *            the SQL query, with {@code ?} placeholders
     * @param parameters
     *            the parameter values
     * @param mapper
     *            the function converting each row of the result set
     * @return a stream over the mapped rows
     * @throws IOException
     *             on failure
     */
    <T> Stream<T> query(final String sql, final List<?> parameters, final RowMapper<T> mapper)
            throws IOException {
        Connection connection = null;
        PreparedStatement statement = null;
        ResultSet resultSet = null;
        try {
            connection = getConnection();
            statement = connection.prepareStatement(sql);
            bind(statement, parameters);
            resultSet = statement.executeQuery();
            return Stream.create(new ResultSetIterator<T>(connection, statement, resultSet,
                    mapper));
        } catch (final SQLException ex) {
            closeAll(resultSet, statement, connection);
            throw new IOException("Query failed: " + sql + " - " + ex.getMessage(), ex);
        }
    }

    static void bind(final PreparedStatement statement, final List<?> parameters)
            throws SQLException {
        for (int i = 0; i < parameters.size(); ++i) {
            final Object parameter = parameters.get(i);
            if (parameter instanceof Double) {
                statement.setDouble(i + 1, (Double) parameter);
            } else if (parameter instanceof Integer) {
                statement.setInt(i + 1, (Integer) parameter);
            } else {
                statement.setString(i + 1, (String) parameter);
            }
        }
    }

    private static void closeAll(@Nullable final AutoCloseable... closeables) {
        for (final AutoCloseable closeable : closeables) {
            if (closeable != null) {
                try {
                    closeable.close();
                } catch (final Exception ex) {
                    LOGGER.warn("Failed to close " + closeable, ex);
                }
            }
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("url", this.config.getJdbcUrl()).toString();
    }

    /**
     * Converts the current row of a {@code ResultSet} into an object.
     */
    interface RowMapper<T> {

        T map(ResultSet resultSet) throws SQLException;

    }

    private static final class ResultSetIterator<T> extends AbstractIterator<T> implements
            Closeable {

        private final Connection connection;

        private final PreparedStatement statement;

        private final ResultSet resultSet;

        private final RowMapper<T> mapper;

        private boolean closed;

        ResultSetIterator(final Connection connection, final PreparedStatement statement,
                final ResultSet resultSet, final RowMapper<T> mapper) {
            this.connection = connection;
            this.statement = statement;
            this.resultSet = resultSet;
            this.mapper = mapper;
        }

        @Override
        protected T computeNext() {
            try {
                if (!this.closed && this.resultSet.next()) {
                    return this.mapper.map(this.resultSet);
                }
            } catch (final SQLException ex) {
                close();
                throw Util.propagate(new IOException("Error reading query results", ex));
            }
            close();
            return endOfData();
        }

        @Override
        public void close() {
            if (!this.closed) {
                this.closed = true;
                closeAll(this.resultSet, this.statement, this.connection);
            }
        }

    }

}
