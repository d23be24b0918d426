package gov.llnl.sina.datastore.hbase.utils;

import java.io.IOException;
import java.util.List;
import java.util.Properties;

import javax.annotation.Nullable;

import org.apache.hadoop.hbase.TableExistsException;
import org.apache.hadoop.hbase.TableName;
import org.apache.hadoop.hbase.client.Admin;
import org.apache.hadoop.hbase.client.ColumnFamilyDescriptorBuilder;
import org.apache.hadoop.hbase.client.Connection;
import org.apache.hadoop.hbase.client.ConnectionFactory;
import org.apache.hadoop.hbase.client.Delete;
import org.apache.hadoop.hbase.client.Get;
import org.apache.hadoop.hbase.client.Put;
import org.apache.hadoop.hbase.client.Result;
import org.apache.hadoop.hbase.client.ResultScanner;
import org.apache.hadoop.hbase.client.Scan;
import org.apache.hadoop.hbase.client.Table;
import org.apache.hadoop.hbase.client.TableDescriptorBuilder;
import org.apache.hadoop.hbase.util.Bytes;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import gov.llnl.sina.data.Stream;
import gov.llnl.sina.internal.Util;

/**
 * {@code AbstractHBaseUtils} accessing an HBase cluster through the native HBase client.
 * <p>
 * A single {@code Connection} is shared by all operations; {@code Table} handles are lightweight
 * and obtained per operation.
 * </p>
 */
public class HBaseUtils extends AbstractHBaseUtils {

    @Nullable
    private volatile Connection connection;

    public HBaseUtils(final Properties properties) {
        super(properties);
    }

    @Override
    public synchronized void init() throws IOException {
        Preconditions.checkState(this.connection == null, "Already initialized");
        this.connection = ConnectionFactory.createConnection(getHbcfg());
        LOGGER.debug("NATIVE connection opened");
    }

    private Connection getConnection() {
        final Connection connection = this.connection;
        Preconditions.checkState(connection != null, "Not initialized");
        return connection;
    }

    private Table getTable(final String tableName) throws IOException {
        return getConnection().getTable(TableName.valueOf(getTableName(tableName)));
    }

    @Override
    public void checkAndCreateTable(final String tableName, final String familyName)
            throws IOException {
        final TableName name = TableName.valueOf(getTableName(tableName));
        try (Admin admin = getConnection().getAdmin()) {
            if (!admin.tableExists(name)) {
                LOGGER.info("NATIVE creating table {}", name);
                admin.createTable(TableDescriptorBuilder.newBuilder(name)
                        .setColumnFamily(ColumnFamilyDescriptorBuilder.of(familyName)).build());
            }
        } catch (final TableExistsException ex) {
            LOGGER.debug("NATIVE table {} created concurrently", name);
        }
    }

    @Override
    public void put(final String tableName, final List<Put> puts) throws IOException {
        LOGGER.debug("NATIVE put of {} rows into {}", puts.size(), tableName);
        try (Table table = getTable(tableName)) {
            for (final List<Put> batch : Lists.partition(puts, getBatchSize())) {
                table.put(batch);
            }
        }
    }

    @Override
    public void delete(final String tableName, final List<Delete> deletes) throws IOException {
        LOGGER.debug("NATIVE delete of {} rows from {}", deletes.size(), tableName);
        try (Table table = getTable(tableName)) {
            for (final List<Delete> batch : Lists.partition(deletes, getBatchSize())) {
                // Table.delete removes the processed elements from a mutable list
                table.delete(Lists.newArrayList(batch));
            }
        }
    }

    @Override
    public Result[] get(final String tableName, final List<Get> gets) throws IOException {
        try (Table table = getTable(tableName)) {
            return table.get(gets);
        }
    }

    @Override
    public Stream<Result> scan(final String tableName, final Scan scan) throws IOException {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("NATIVE scan of {} from {} to {}", tableName,
                    Bytes.toStringBinary(scan.getStartRow()),
                    Bytes.toStringBinary(scan.getStopRow()));
        }
        final Table table = getTable(tableName);
        try {
            final ResultScanner scanner = table.getScanner(scan);
            return Stream.create(scanner.iterator()).onClose(scanner, table);
        } catch (final IOException | RuntimeException ex) {
            Util.closeQuietly(table);
            throw ex;
        }
    }

    @Override
    public synchronized void close() {
        final Connection connection = this.connection;
        if (connection != null) {
            this.connection = null;
            try {
                connection.close();
            } catch (final IOException ex) {
                LOGGER.warn("NATIVE failed to close connection", ex);
            }
        }
    }

}
