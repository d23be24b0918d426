package gov.llnl.sina.data;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class JsonCodecTest {

    private static final String DOCUMENT = "{"
            + "\"records\": ["
            + "  {\"id\": \"run_1\", \"type\": \"run\", \"application\": \"kripke\","
            + "   \"user\": \"bob\","
            + "   \"data\": {\"speed\": {\"value\": 5, \"units\": \"m/s\", \"tags\": [\"in\"]},"
            + "            \"mode\": {\"value\": \"fast\"},"
            + "            \"samples\": {\"value\": [1, 2.5, 3]},"
            + "            \"labels\": {\"value\": [\"a\", \"b\"]}},"
            + "   \"files\": [{\"uri\": \"/out/run_1.png\", \"mimetype\": \"image/png\"}],"
            + "   \"curve_sets\": {\"ts\": {\"independent\": {\"time\": {\"value\": [0, 1]}},"
            + "                          \"dependent\": {\"energy\": {\"value\": [4, 5]}}}},"
            + "   \"user_defined\": {\"note\": \"ok\"}},"
            + "  {\"local_id\": \"in\", \"type\": \"input\","
            + "   \"files\": {\"/in/deck.txt\": {\"tags\": [\"deck\"]}}}"
            + "],"
            + "\"relationships\": ["
            + "  {\"subject\": \"run_1\", \"predicate\": \"reads\", \"local_object\": \"in\"}"
            + "]}";

    @Test
    public void testReadDocument() {
        final Document document = JsonCodec.readDocument(DOCUMENT);
        Assert.assertEquals(2, document.getRecords().size());

        final Record run = document.getRecords().get(0);
        Assert.assertEquals("run_1", run.getId());
        Assert.assertEquals(Datum.scalar(5).withUnits("m/s").withTags(ImmutableList.of("in")),
                run.getDatum("speed"));
        Assert.assertEquals(Datum.string("fast"), run.getDatum("mode"));
        Assert.assertEquals(ImmutableList.of(1.0, 2.5, 3.0), run.getDatum("samples")
                .asScalarList());
        Assert.assertEquals(1.0, run.getDatum("samples").getMin().doubleValue(), 0.0);
        Assert.assertEquals(3.0, run.getDatum("samples").getMax().doubleValue(), 0.0);
        Assert.assertEquals(ImmutableList.of("a", "b"), run.getDatum("labels").asStringList());
        Assert.assertEquals("image/png", run.getFiles().get("/out/run_1.png").getMimeType());
        Assert.assertEquals(ImmutableList.of(4.0, 5.0), run.getCurveSets().get("ts")
                .getDependent().get("energy").getValues());
        Assert.assertEquals("ok", run.getUserDefined().get("note").asText());

        final RunExtension extension = run.getExtension(RunExtension.class);
        Assert.assertNotNull(extension);
        Assert.assertEquals("kripke", extension.getApplication());
        Assert.assertEquals("bob", extension.getUser());

        final Record input = document.getRecords().get(1);
        Assert.assertNotNull(input.getId());
        Assert.assertNull(input.getExtension());
        Assert.assertEquals(ImmutableList.of("deck"), input.getFiles().get("/in/deck.txt")
                .getTags());
        Assert.assertEquals(ImmutableList.of(new Relationship("run_1", "reads", input.getId())),
                document.getRelationships());
    }

    @Test
    public void testWriteAndReadBack() throws Exception {
        final Document document = JsonCodec.readDocument(DOCUMENT);
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonCodec.writeDocument(document, out);
        final Document copy = JsonCodec.readDocument(new ByteArrayInputStream(out.toByteArray()));
        Assert.assertEquals(document.getRecords(), copy.getRecords());
        Assert.assertEquals(document.getRelationships(), copy.getRelationships());
        Assert.assertTrue(new String(out.toByteArray(), StandardCharsets.UTF_8).contains(
                "\"/out/run_1.png\" : {"));
    }

    @Test(expected = ParseException.class)
    public void testUnresolvedLocalId() {
        JsonCodec.readDocument("{\"records\": [], \"relationships\": [{\"subject\": \"a\", "
                + "\"predicate\": \"p\", \"local_object\": \"missing\"}]}");
    }

    @Test(expected = ParseException.class)
    public void testRecordWithoutId() {
        JsonCodec.readDocument("{\"records\": [{\"type\": \"run\"}]}");
    }

    @Test(expected = ParseException.class)
    public void testMixedList() {
        JsonCodec.readRecord("{\"id\": \"x\", \"type\": \"t\", "
                + "\"data\": {\"bad\": {\"value\": [1, \"a\"]}}}");
    }

    @Test(expected = ParseException.class)
    public void testMalformedJson() {
        JsonCodec.readDocument("{\"records\": [");
    }

    @Test(expected = ParseException.class)
    public void testRunWithoutApplication() {
        JsonCodec.readRecord("{\"id\": \"x\", \"type\": \"run\"}");
    }

}
