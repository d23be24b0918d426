package gov.llnl.sina.datastore.hbase;

import org.apache.hadoop.hbase.util.Bytes;
import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class RowKeysTest {

    @Test
    public void testOrder() {
        final byte[][] keys = new byte[][] { RowKeys.key("a", -10.5, "x"),
                RowKeys.key("a", -1.0, "x"), RowKeys.key("a", 0.0, "x"),
                RowKeys.key("a", 2.0, "a"), RowKeys.key("a", 2.0, "b"),
                RowKeys.key("a", 100.0, "a"), RowKeys.key("ab", -100.0, "a"),
                RowKeys.key("b", "a"), RowKeys.key("b", "a", 0), RowKeys.key("b", "a", 1),
                RowKeys.key("b", "ab") };
        for (int i = 1; i < keys.length; ++i) {
            Assert.assertTrue("key " + i, Bytes.compareTo(keys[i - 1], keys[i]) < 0);
        }
    }

    @Test
    public void testDecode() {
        Assert.assertEquals(ImmutableList.<Object>of("speed", 3.5, "rec_1", 7), RowKeys
                .decode(RowKeys.key("speed", 3.5, "rec_1", 7)));
        Assert.assertEquals(ImmutableList.<Object>of("", "été"), RowKeys
                .decode(RowKeys.key("", "été")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNulCharacter() {
        RowKeys.key("a\u0000b");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedComponent() {
        RowKeys.key("a", 1L);
    }

    @Test
    public void testStringPrefix() {
        final byte[] prefix = RowKeys.stringPrefix("uri", "/data/");
        Assert.assertTrue(Bytes.startsWith(RowKeys.key("uri", "/data/a.png", "id"), prefix));
        Assert.assertFalse(Bytes.startsWith(RowKeys.key("uri", "/dat", "id"), prefix));
        Assert.assertTrue(Bytes.startsWith(RowKeys.key("uri", "/data/", "id"), prefix));
    }

    @Test
    public void testStopRowForPrefix() {
        Assert.assertArrayEquals(new byte[] { 1, 3 }, RowKeys.stopRowForPrefix(new byte[] { 1,
                2 }));
        Assert.assertArrayEquals(new byte[] { 2 }, RowKeys.stopRowForPrefix(new byte[] { 1,
                (byte) 0xFF }));
        Assert.assertArrayEquals(new byte[0], RowKeys.stopRowForPrefix(new byte[] {
                (byte) 0xFF, (byte) 0xFF }));
        final byte[] prefix = RowKeys.key("name");
        Assert.assertTrue(Bytes.compareTo(RowKeys.key("name", Double.MAX_VALUE), RowKeys
                .stopRowForPrefix(prefix)) < 0);
        Assert.assertTrue(Bytes.compareTo(RowKeys.key("namf"), RowKeys.stopRowForPrefix(
                prefix)) >= 0);
    }

}
