package gov.llnl.sina.runtime;

import java.io.IOException;
import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import gov.llnl.sina.data.Record;
import gov.llnl.sina.datastore.DataStore;
import gov.llnl.sina.datastore.LoggingDataStore;
import gov.llnl.sina.datastore.sql.SQLDataStore;

public class DataStoresTest {

    @Test
    public void testDefaultClass() {
        final Properties properties = new Properties();
        properties.setProperty(SQLDataStore.PROPERTY_URL, "jdbc:h2:mem:sina-default");
        Assert.assertTrue(DataStores.create(properties) instanceof SQLDataStore);
    }

    @Test
    public void testLoadWithLogging() throws IOException {
        final DataStore store = DataStores.load("sina-test.properties");
        Assert.assertTrue(store instanceof LoggingDataStore);
        try {
            store.init();
            store.getRecordDAO().insert(ImmutableList.of(Record.builder("r1", "trial").datum(
                    "x", 2).build()));
            Assert.assertEquals(ImmutableSet.of("r1"), store.getRecordDAO().dataQuery(
                    ImmutableMap.of("x", 2)).toSet());
        } finally {
            store.close();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownClass() {
        final Properties properties = new Properties();
        properties.setProperty(DataStores.PROPERTY_CLASS, "gov.llnl.sina.NoSuchStore");
        DataStores.create(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNotADataStore() {
        final Properties properties = new Properties();
        properties.setProperty(DataStores.PROPERTY_CLASS, String.class.getName());
        DataStores.create(properties);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidConfiguration() {
        DataStores.create(new Properties());
    }

}
