package gov.llnl.sina.datastore.hbase.utils;

import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.BATCHSIZE_DEFAULT;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.BATCHSIZE_PROP;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.HBASE_ZOOKEEPER_CLIENT_PORT;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.HBASE_ZOOKEEPER_CLIENT_PORT_DEFAULT;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.HBASE_ZOOKEEPER_QUORUM;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.HBASE_ZOOKEEPER_QUORUM_DEFAULT;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.LAYER_PROP;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.MEMORY_LAYER_OPT;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.NATIVE_LAYER_OPT;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.TABLEPREFIX_DEFAULT;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.TABLEPREFIX_PROP;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Properties;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.hbase.HBaseConfiguration;
import org.apache.hadoop.hbase.client.Delete;
import org.apache.hadoop.hbase.client.Get;
import org.apache.hadoop.hbase.client.Put;
import org.apache.hadoop.hbase.client.Result;
import org.apache.hadoop.hbase.client.Scan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import gov.llnl.sina.data.Stream;

/**
 * Class defining all the HBase operations used by the data store.
 * <p>
 * Table names passed to the methods of this class are logical names, to which the configured
 * table prefix is prepended. Every table has the single column family
 * {@link HBaseConstants#FAMILY_NAME}.
 * </p>
 */
public abstract class AbstractHBaseUtils implements Closeable {

    protected static final Logger LOGGER = LoggerFactory.getLogger(AbstractHBaseUtils.class);

    private final Configuration hbcfg;

    private final String tableNamePrefix;

    private final int batchSize;

    /**
     * Constructor.
     *
     * @param properties
     *            holds all configuration properties
     */
    public AbstractHBaseUtils(final Properties properties) {
        this.hbcfg = createConfiguration(properties);
        this.tableNamePrefix = properties.getProperty(TABLEPREFIX_PROP, TABLEPREFIX_DEFAULT);
        this.batchSize = Integer.parseInt(properties.getProperty(BATCHSIZE_PROP,
                Integer.toString(BATCHSIZE_DEFAULT)));
        Preconditions.checkArgument(this.batchSize > 0, "Invalid batch size %s", this.batchSize);
    }

    /**
     * Creates the {@code AbstractHBaseUtils} for the layer selected by property
     * {@link HBaseConstants#LAYER_PROP}.
     *
     * @param properties
     *            the configuration properties
     * @return the created object, not yet initialized
     */
    public static AbstractHBaseUtils factoryHBaseUtils(final Properties properties) {
        final String layer = properties.getProperty(LAYER_PROP, NATIVE_LAYER_OPT);
        if (layer.equalsIgnoreCase(MEMORY_LAYER_OPT)) {
            LOGGER.info("Using memory HBaseUtils");
            return new MemoryHBaseUtils(properties);
        } else if (layer.equalsIgnoreCase(NATIVE_LAYER_OPT)) {
            LOGGER.info("Using native HBaseUtils");
            return new HBaseUtils(properties);
        }
        throw new IllegalArgumentException("Unknown HBase layer '" + layer + "', expected "
                + NATIVE_LAYER_OPT + " or " + MEMORY_LAYER_OPT);
    }

    /**
     * Creates an HBase configuration object.
     *
     * @param properties
     *            the configuration properties
     * @return the created configuration
     */
    private static Configuration createConfiguration(final Properties properties) {
        final Configuration configuration = HBaseConfiguration.create();
        configuration.set(HBASE_ZOOKEEPER_QUORUM,
                properties.getProperty(HBASE_ZOOKEEPER_QUORUM, HBASE_ZOOKEEPER_QUORUM_DEFAULT));
        configuration.set(HBASE_ZOOKEEPER_CLIENT_PORT, properties.getProperty(
                HBASE_ZOOKEEPER_CLIENT_PORT, HBASE_ZOOKEEPER_CLIENT_PORT_DEFAULT));
        return configuration;
    }

    /**
     * Opens the connection to the storage.
     *
     * @throws IOException
     *             on failure
     */
    public abstract void init() throws IOException;

    /**
     * Creates a table with the column family specified, if it does not exist.
     *
     * @param tableName
     *            the logical name of the table
     * @param familyName
     *            the name of the single column family
     * @throws IOException
     *             on failure
     */
    public abstract void checkAndCreateTable(String tableName, String familyName)
            throws IOException;

    public abstract void put(String tableName, List<Put> puts) throws IOException;

    public abstract void delete(String tableName, List<Delete> deletes) throws IOException;

    /**
     * Performs a multi-get, returning one {@code Result} per {@code Get}, in the same order.
     * Results of missing rows are empty.
     */
    public abstract Result[] get(String tableName, List<Get> gets) throws IOException;

    /**
     * Starts a scan. The returned stream must be closed to release the scanner.
     */
    public abstract Stream<Result> scan(String tableName, Scan scan) throws IOException;

    /**
     * Releases the connection to the storage.
     */
    @Override
    public abstract void close();

    public Configuration getHbcfg() {
        return this.hbcfg;
    }

    public String getTableName(final String tableName) {
        return this.tableNamePrefix + tableName;
    }

    public int getBatchSize() {
        return this.batchSize;
    }

}
