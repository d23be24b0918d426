package gov.llnl.sina.runtime;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Properties;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

import gov.llnl.sina.data.Record;
import gov.llnl.sina.datastore.DataStore;
import gov.llnl.sina.datastore.RecordNotFoundException;
import gov.llnl.sina.datastore.sql.SQLDataStore;

public class ExporterTest {

    private DataStore store;

    @Before
    public void setUp() throws IOException {
        final Properties properties = new Properties();
        properties.setProperty(SQLDataStore.PROPERTY_URL, "jdbc:h2:mem:sina-export"
                + System.nanoTime() + ";DB_CLOSE_DELAY=-1");
        this.store = new SQLDataStore(properties);
        this.store.init();
        this.store.getRecordDAO().insert(ImmutableList.of(
                Record.builder("r1", "trial").datum("speed", 1.5).datum("labels",
                        ImmutableList.of("a", "b")).build(),
                Record.builder("r2", "trial").datum("speed", 2).datum("note", "say \"hi\"")
                        .build(),
                Record.builder("r3", "trial").datum("other", 0).build()));
    }

    @After
    public void tearDown() {
        this.store.close();
    }

    @Test
    public void testExport() throws IOException {
        final StringWriter writer = new StringWriter();
        final int rows = new Exporter(this.store).exportCSV(ImmutableList.of("r2", "r3", "r1"),
                ImmutableList.of("speed", "labels", "note"), writer);
        Assert.assertEquals(2, rows);
        Assert.assertEquals("id,speed,labels,note\r\n"
                + "r2,2.0,,\"say \"\"hi\"\"\"\r\n"
                + "r1,1.5,\"[a, b]\",\r\n", writer.toString());
    }

    @Test(expected = RecordNotFoundException.class)
    public void testExportMissingRecord() throws IOException {
        new Exporter(this.store).exportCSV(ImmutableList.of("r1", "missing"), ImmutableList
                .of("speed"), new StringWriter());
    }

    @Test
    public void testEscape() {
        Assert.assertEquals("plain", Exporter.escape("plain"));
        Assert.assertEquals("\"a,b\"", Exporter.escape("a,b"));
        Assert.assertEquals("\"line\nbreak\"", Exporter.escape("line\nbreak"));
    }

}
