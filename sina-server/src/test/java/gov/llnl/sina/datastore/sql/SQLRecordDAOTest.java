package gov.llnl.sina.datastore.sql;

import java.io.IOException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import gov.llnl.sina.data.Record;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.datastore.AbstractRecordDAOTest;
import gov.llnl.sina.datastore.DataStore;
import gov.llnl.sina.datastore.RecordDAO;
import gov.llnl.sina.query.DataRange;
import gov.llnl.sina.query.ListCriterion;

public class SQLRecordDAOTest extends AbstractRecordDAOTest {

    private static final AtomicInteger COUNTER = new AtomicInteger();

    static Properties h2Properties() {
        final Properties properties = new Properties();
        properties.setProperty(SQLDataStore.PROPERTY_URL, "jdbc:h2:mem:sina"
                + COUNTER.incrementAndGet() + ";DB_CLOSE_DELAY=-1");
        properties.setProperty(SQLDataStore.PROPERTY_USER, "sa");
        properties.setProperty(SQLDataStore.PROPERTY_PASSWORD, "");
        properties.setProperty(SQLDataStore.PROPERTY_POOL_MAX, "4");
        return properties;
    }

    @Override
    protected DataStore createDataStore() {
        return new SQLDataStore(h2Properties());
    }

    @Test
    public void testNoParallelIngestion() throws IOException {
        final DataStore store = createDataStore();
        Assert.assertFalse(store.supportsParallelIngestion());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingUrl() {
        new SQLDataStore(new Properties());
    }

    @Test(expected = IllegalStateException.class)
    public void testNotInitialized() {
        new SQLDataStore(h2Properties()).getRecordDAO();
    }

    @Test(timeout = 20000)
    public void testMoreSubQueriesThanPooledConnections() throws IOException {
        final DataStore store = createDataStore();
        store.init();
        try {
            final RecordDAO records = store.getRecordDAO();
            final List<String> labels = Lists.newArrayList();
            final List<Object> samples = Lists.newArrayList();
            for (int i = 0; i < 8; ++i) {
                labels.add("l" + i);
                samples.add(DataRange.equalTo(i));
            }
            records.insert(ImmutableList.of(
                    Record.builder("all", "trial").datum("labels", labels)
                            .datum("samples", ImmutableList.of(0, 7)).datum("speed", 1).build(),
                    Record.builder("some", "trial").datum("labels", labels.subList(0, 3))
                            .datum("samples", ImmutableList.of(0, 2)).datum("speed", 1)
                            .build()));

            Assert.assertEquals(ImmutableSet.of("all"), ids(records.getList("labels",
                    ListCriterion.hasAll(labels.toArray()))));
            Assert.assertEquals(ImmutableSet.of("all", "some"), ids(records.getList("labels",
                    ListCriterion.only(labels.toArray()))));
            Assert.assertEquals(ImmutableSet.of("all"), ids(records.getList("samples",
                    ListCriterion.hasAll(samples.toArray()))));

            final Map<String, Object> criteria = ImmutableMap.<String, Object>of(
                    "labels", ListCriterion.hasAll(labels.toArray()),
                    "samples", ListCriterion.hasAny(samples.toArray()),
                    "speed", DataRange.atLeast(1));
            Assert.assertEquals(ImmutableSet.of("all"), ids(records.dataQuery(criteria)));
        } finally {
            store.close();
        }
    }

    @Test
    public void testIdOrderIgnoresDatabaseCollation() throws IOException, SQLException {
        final Properties properties = h2Properties();
        final String url = properties.getProperty(SQLDataStore.PROPERTY_URL);
        try (Connection connection = DriverManager.getConnection(url, "sa", "");
                Statement statement = connection.createStatement()) {
            statement.execute("SET COLLATION ENGLISH STRENGTH PRIMARY");
        }
        final DataStore store = new SQLDataStore(properties);
        store.init();
        try {
            final RecordDAO records = store.getRecordDAO();
            final List<Record> list = Lists.newArrayList();
            for (final String id : ImmutableList.of("a", "B", "c")) {
                list.add(Record.builder(id, "trial").datum("speed", 1).datum("mode", "x")
                        .build());
            }
            records.insert(list);
            Assert.assertEquals(ImmutableList.of("B", "a", "c"), records.getAll().toList());
            Assert.assertEquals(ImmutableList.of("B", "a", "c"), records.getAllOfType("trial")
                    .toList());
            Assert.assertEquals(ImmutableSet.of("a", "B", "c"), ids(records.dataQuery(
                    ImmutableMap.<String, Object>of("speed", 1, "mode", "x"))));
        } finally {
            store.close();
        }
    }

    private static Set<String> ids(final Stream<String> stream) {
        try (Stream<String> s = stream) {
            return s.toSet();
        }
    }

}
