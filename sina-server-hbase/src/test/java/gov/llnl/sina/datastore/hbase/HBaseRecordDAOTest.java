package gov.llnl.sina.datastore.hbase;

import java.io.IOException;
import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import gov.llnl.sina.data.Record;
import gov.llnl.sina.datastore.AbstractRecordDAOTest;
import gov.llnl.sina.datastore.DataStore;
import gov.llnl.sina.datastore.hbase.utils.HBaseConstants;
import gov.llnl.sina.datastore.hbase.utils.MemoryHBaseUtils;
import gov.llnl.sina.query.DataRange;
import gov.llnl.sina.query.ListCriterion;

public class HBaseRecordDAOTest extends AbstractRecordDAOTest {

    private static Properties memoryProperties() {
        final Properties properties = new Properties();
        properties.setProperty(HBaseConstants.LAYER_PROP, HBaseConstants.MEMORY_LAYER_OPT);
        properties.setProperty(HBaseConstants.BATCHSIZE_PROP, "2");
        return properties;
    }

    @Override
    protected DataStore createDataStore() {
        return new HBaseDataStore(memoryProperties());
    }

    @Test
    public void testMemoryLayer() throws IOException {
        final HBaseDataStore store = new HBaseDataStore(memoryProperties());
        try {
            Assert.assertTrue(store.getHbaseUtils() instanceof MemoryHBaseUtils);
            Assert.assertTrue(store.supportsParallelIngestion());
            store.init();
            Assert.assertTrue(store.getRecordDAO().getAll().toList().isEmpty());
        } finally {
            store.close();
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testNotInitialized() {
        new HBaseDataStore(memoryProperties()).getRecordDAO();
    }

    @Test
    public void testEmptyScalarListHasNoSynopsis() throws IOException {
        final HBaseDataStore store = new HBaseDataStore(memoryProperties());
        try {
            store.init();
            store.getRecordDAO().insert(ImmutableList.of(Record.builder("empty", "trial").datum(
                    "samples", ImmutableList.of()).build()));
            Assert.assertTrue(store.getRecordDAO().dataQuery(ImmutableMap.of("samples",
                    ListCriterion.anyIn(DataRange.atLeast(0)))).toList().isEmpty());
            Assert.assertEquals(ImmutableList.of("empty"), store.getRecordDAO().getAll()
                    .toList());
        } finally {
            store.close();
        }
    }

}
