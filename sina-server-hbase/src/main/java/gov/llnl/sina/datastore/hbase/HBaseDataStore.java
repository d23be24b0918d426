package gov.llnl.sina.datastore.hbase;

import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.FAMILY_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.OBJECT_FROM_SUBJECT_TAB_NAME;
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
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.SUBJECT_FROM_OBJECT_TAB_NAME;

import java.io.IOException;
import java.util.List;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.datastore.DataStore;
import gov.llnl.sina.datastore.RecordDAO;
import gov.llnl.sina.datastore.RelationshipDAO;
import gov.llnl.sina.datastore.hbase.utils.AbstractHBaseUtils;

/**
 * HBaseDataStore used to read and write records and relationships into a set of HBase tables.
 * <p>
 * Every searchable fact is stored twice: once in a table keyed by record id (e.g.,
 * {@code scalar_from_record}), used to read and check the facts of given records, and once in
 * an index table keyed by name, value and record id (e.g., {@code record_from_scalar}), used to
 * find the records whose value falls in a range with a single scan. The low-level access layer
 * is selected with property {@code sina.hbase.layer} (see
 * {@link AbstractHBaseUtils#factoryHBaseUtils(Properties)}).
 * </p>
 */
public class HBaseDataStore implements DataStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(HBaseDataStore.class);

    static final List<String> TABLES = ImmutableList.of(RECORD_TAB_NAME,
            RECORD_FROM_TYPE_TAB_NAME, SCALAR_FROM_RECORD_TAB_NAME, STRING_FROM_RECORD_TAB_NAME,
            SCALAR_LIST_FROM_RECORD_TAB_NAME, STRING_LIST_FROM_RECORD_TAB_NAME,
            RECORD_FROM_SCALAR_TAB_NAME, RECORD_FROM_STRING_TAB_NAME,
            RECORD_FROM_SCALAR_LIST_MIN_TAB_NAME, RECORD_FROM_SCALAR_LIST_MAX_TAB_NAME,
            RECORD_FROM_STRING_LIST_TAB_NAME, RECORD_FROM_DOCUMENT_TAB_NAME,
            RECORD_FROM_MIMETYPE_TAB_NAME, RECORD_FROM_CURVE_SET_TAB_NAME,
            OBJECT_FROM_SUBJECT_TAB_NAME, SUBJECT_FROM_OBJECT_TAB_NAME);

    /** hbase utilities hiding the access layer (NATIVE or MEMORY) */
    private final AbstractHBaseUtils hbaseUtils;

    @Nullable
    private HBaseRecordDAO recordDAO;

    @Nullable
    private HBaseRelationshipDAO relationshipDAO;

    private boolean closed;

    /**
     * Constructor.
     *
     * @param properties
     *            the configuration properties
     */
    public HBaseDataStore(final Properties properties) {
        this.hbaseUtils = AbstractHBaseUtils.factoryHBaseUtils(properties);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    public synchronized void init() throws IOException, IllegalStateException {
        Preconditions.checkState(this.recordDAO == null && !this.closed,
                "Already initialized or closed");
        this.hbaseUtils.init();
        // check if the htables exist: create them if necessary
        for (final String table : TABLES) {
            this.hbaseUtils.checkAndCreateTable(table, FAMILY_NAME);
        }
        this.relationshipDAO = new HBaseRelationshipDAO(this.hbaseUtils);
        this.recordDAO = new HBaseRecordDAO(this.hbaseUtils, this.relationshipDAO);
        LOGGER.info("{} initialized, {} tables checked", this, TABLES.size());
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
        return true;
    }

    @Override
    public synchronized void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        this.hbaseUtils.close();
        LOGGER.info("{} closed", this);
    }

    private void checkInitialized() {
        Preconditions.checkState(this.recordDAO != null && !this.closed,
                "%s not initialized or already closed", this);
    }

    /**
     * @return the hbaseUtils
     */
    public AbstractHBaseUtils getHbaseUtils() {
        return this.hbaseUtils;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("prefix", this.hbaseUtils.getTableName("")).toString();
    }

}
