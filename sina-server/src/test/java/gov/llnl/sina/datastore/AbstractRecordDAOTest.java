package gov.llnl.sina.datastore;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import gov.llnl.sina.data.Curve;
import gov.llnl.sina.data.CurveSet;
import gov.llnl.sina.data.Datum;
import gov.llnl.sina.data.FileEntry;
import gov.llnl.sina.data.JsonCodec;
import gov.llnl.sina.data.Record;
import gov.llnl.sina.data.Relationship;
import gov.llnl.sina.data.RunExtension;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.query.Criteria;
import gov.llnl.sina.query.DataRange;
import gov.llnl.sina.query.EmptyQueryException;
import gov.llnl.sina.query.ListCriterion;

/**
 * Behaviour shared by every {@code DataStore} implementation, run against a small fixed data
 * set of four records.
 */
public abstract class AbstractRecordDAOTest {

    protected static final String A = "rec_a";

    protected static final String B = "rec_b";

    protected static final String C = "rec_c";

    protected static final String D = "rec_d";

    private DataStore store;

    private RecordDAO records;

    private RelationshipDAO relationships;

    /**
     * Returns a new, non-initialized and empty store.
     */
    protected abstract DataStore createDataStore() throws IOException;

    @Before
    public void setUp() throws IOException {
        this.store = createDataStore();
        this.store.init();
        this.records = this.store.getRecordDAO();
        this.relationships = this.store.getRelationshipDAO();
        this.records.insert(fixture());
        this.relationships.insert(ImmutableList.of(new Relationship(A, "contains", B),
                new Relationship(C, "uses", A)));
    }

    @After
    public void tearDown() {
        this.store.close();
    }

    protected static List<Record> fixture() {
        final ObjectNode userDefined = JsonCodec.getMapper().createObjectNode();
        userDefined.put("note", "first");
        final Record a = Record.builder(A, "trial")
                .datum("speed", Datum.scalar(1).withUnits("m/s"))
                .datum("mode", "fast")
                .datum("samples", ImmutableList.of(1, 2, 3))
                .datum("labels", Datum.stringList(ImmutableList.of("a", "b")).withTags(
                        ImmutableList.of("input")))
                .file(new FileEntry("/data/a/out.png", "image/png", ImmutableList.of("plot")))
                .curveSet(new CurveSet("ts", ImmutableList.of(new Curve("time", ImmutableList
                        .of(0, 1), "s", null)), ImmutableList.of(new Curve("energy",
                        ImmutableList.of(4, 5), null, null))))
                .userDefined(userDefined).build();
        final Record b = Record.builder(B, "trial")
                .datum("speed", 5)
                .datum("mode", "slow")
                .datum("samples", ImmutableList.of(5, 6, 7))
                .datum("labels", ImmutableList.of("a"))
                .file("/data/b/out.txt").build();
        final Record c = Record.builder(C, "run")
                .datum("speed", 10)
                .datum("mode", "fast")
                .datum("samples", ImmutableList.of(2, 4, 6))
                .datum("labels", ImmutableList.of("a", "b", "c"))
                .file("/other/c.png")
                .extension(new RunExtension("kripke", "bob", null)).build();
        final Record d = Record.builder(D, "trial").datum("energy", 3).build();
        return ImmutableList.of(a, b, c, d);
    }

    private static Set<String> ids(final Stream<String> stream) {
        try (Stream<String> s = stream) {
            return s.toSet();
        }
    }

    private Set<String> query(final String name, final Object criterion) throws IOException {
        return ids(this.records.dataQuery(ImmutableMap.of(name, criterion)));
    }

    @Test
    public void testGetRoundTrip() throws IOException {
        for (final Record record : fixture()) {
            Assert.assertEquals(record, this.records.get(record.getId()));
        }
        final List<Record> list = this.records.get(ImmutableList.of(C, A)).toList();
        Assert.assertEquals(ImmutableList.of(C, A), ImmutableList.of(list.get(0).getId(),
                list.get(1).getId()));
    }

    @Test
    public void testGetMissing() throws IOException {
        try {
            this.records.get(ImmutableList.of(A, "missing"));
            Assert.fail();
        } catch (final RecordNotFoundException ex) {
            Assert.assertEquals(ImmutableSet.of("missing"), ex.getIds());
        }
    }

    @Test
    public void testExist() throws IOException {
        Assert.assertEquals(ImmutableList.of(true, false, true), this.records.exist(ImmutableList
                .of(A, "missing", D)));
    }

    @Test(expected = RecordExistsException.class)
    public void testInsertExisting() throws IOException {
        this.records.insert(ImmutableList.of(Record.builder(B, "trial").build()));
    }

    @Test
    public void testScalarQueries() throws IOException {
        Assert.assertEquals(ImmutableSet.of(A, B), query("speed", DataRange.create(1, 6)));
        Assert.assertEquals(ImmutableSet.of(B), query("speed", DataRange.create(1, 6, false,
                false)));
        Assert.assertEquals(ImmutableSet.of(C), query("speed", 10));
        Assert.assertEquals(ImmutableSet.of(B, C), query("speed", DataRange.atLeast(5)));
        Assert.assertTrue(query("speed", DataRange.greaterThan(10)).isEmpty());
        Assert.assertTrue(query("nothing", DataRange.atLeast(0)).isEmpty());
    }

    @Test
    public void testStringQueries() throws IOException {
        Assert.assertEquals(ImmutableSet.of(A, C), query("mode", "fast"));
        Assert.assertEquals(ImmutableSet.of(B), query("mode", DataRange.greaterThan("g")));
        Assert.assertEquals(ImmutableSet.of(A, C), query("mode", DataRange.lessThan("g")));
    }

    @Test
    public void testMultipleCriteria() throws IOException {
        final Map<String, Object> criteria = ImmutableMap.<String, Object>of(
                "speed", DataRange.atLeast(2),
                "mode", "fast");
        Assert.assertEquals(ImmutableSet.of(C), ids(this.records.dataQuery(criteria)));

        final Map<String, Object> all = ImmutableMap.<String, Object>of(
                "speed", DataRange.create(0, 6),
                "mode", "fast",
                "samples", ListCriterion.allIn(DataRange.create(0, 4, true, true)),
                "labels", ListCriterion.hasAll("a", "b"),
                "energy", Criteria.exists());
        Assert.assertTrue(ids(this.records.dataQuery(all)).isEmpty());

        final Map<String, Object> some = ImmutableMap.<String, Object>of(
                "speed", DataRange.create(0, 6),
                "mode", "fast",
                "samples", ListCriterion.allIn(DataRange.create(0, 4, true, true)),
                "labels", ListCriterion.hasAll("a", "b"));
        Assert.assertEquals(ImmutableSet.of(A), ids(this.records.dataQuery(some)));
    }

    @Test
    public void testScalarListQueries() throws IOException {
        Assert.assertEquals(ImmutableSet.of(A), query("samples", ListCriterion.allIn(DataRange
                .create(0, 4, true, true))));
        Assert.assertEquals(ImmutableSet.of(A, C), query("samples", ListCriterion.allIn(
                DataRange.atMost(6))));
        Assert.assertEquals(ImmutableSet.of(C), query("samples", ListCriterion.anyIn(DataRange
                .create(3.5, 4.5))));
        Assert.assertEquals(ImmutableSet.of(B, C), query("samples", ListCriterion.anyIn(
                DataRange.atLeast(6))));
        Assert.assertEquals(ImmutableSet.of(C), ids(this.records.getList("samples",
                ListCriterion.anyIn(DataRange.create(3.5, 4.5)))));
    }

    @Test
    public void testStringListQueries() throws IOException {
        Assert.assertEquals(ImmutableSet.of(A, C), query("labels", ListCriterion.hasAll("a",
                "b")));
        Assert.assertEquals(ImmutableSet.of(A, C), query("labels", ListCriterion.hasAny("b",
                "c")));
        Assert.assertEquals(ImmutableSet.of(A, B), query("labels", ListCriterion.only("a",
                "b")));
        Assert.assertEquals(ImmutableSet.of(B), query("labels", ListCriterion.only("a")));
        Assert.assertEquals(ImmutableSet.of(A, B), query("labels", ListCriterion.allIn(
                DataRange.create("a", "b", true, true))));
        Assert.assertEquals(ImmutableSet.of(C), query("labels", ListCriterion.anyIn(DataRange
                .atLeast("c"))));
        Assert.assertTrue(query("labels", ListCriterion.hasAll("a", "z")).isEmpty());
        Assert.assertEquals(ImmutableSet.of(A, C), ids(this.records.getList("labels",
                ListCriterion.hasAll("b"))));
    }

    @Test
    public void testExistenceQueries() throws IOException {
        Assert.assertEquals(ImmutableSet.of(D), query("energy", Criteria.exists()));
        Assert.assertEquals(ImmutableSet.of(A, B, C), ids(this.records.dataQuery(ImmutableMap.of(
                "speed", Criteria.exists(), "labels", Criteria.exists(), "samples", Criteria
                        .exists()))));
        Assert.assertTrue(ids(this.records.dataQuery(ImmutableMap.of("speed", Criteria.exists(),
                "energy", Criteria.exists()))).isEmpty());
    }

    @Test
    public void testMembershipOnScalarList() throws IOException {
        Assert.assertEquals(ImmutableSet.of(A), query("samples", ListCriterion.hasAll(1, 2)));
        Assert.assertEquals(ImmutableSet.of(B), query("samples", ListCriterion.hasAny(7, 8)));
        Assert.assertEquals(ImmutableSet.of(A, C), ids(this.records.getList("samples",
                ListCriterion.only(DataRange.create(0, 6, true, true)))));
    }

    @Test
    public void testHasAllOnScalarList() throws IOException {
        this.records.insert(eggs());
        Assert.assertEquals(ImmutableSet.of("egg_1", "egg_2"), ids(this.records.getList("eggs",
                ListCriterion.hasAll(DataRange.create(0, 2), DataRange.create(3, 6)))));
        Assert.assertEquals(ImmutableSet.of("egg_2"), ids(this.records.getList("eggs",
                ListCriterion.hasAll(DataRange.create(0, 3), 4))));
    }

    @Test
    public void testHasAnyOnScalarList() throws IOException {
        this.records.insert(eggs());
        Assert.assertEquals(ImmutableSet.of("egg_1", "egg_2", "egg_3"), ids(this.records.getList(
                "eggs", ListCriterion.hasAny(DataRange.create(0, 2), DataRange.create(4, 6)))));
        Assert.assertEquals(ImmutableSet.of("egg_2", "egg_3"), ids(this.records.getList("eggs",
                ListCriterion.hasAny(DataRange.create(4, 5), 7))));
    }

    @Test
    public void testOnlyOnScalarList() throws IOException {
        this.records.insert(eggs());
        Assert.assertEquals(ImmutableSet.of("egg_2"), query("eggs", ListCriterion.only(DataRange
                .create(0, 2), DataRange.create(4, 6))));
        Assert.assertEquals(ImmutableSet.of("egg_3"), query("eggs", ListCriterion.only(DataRange
                .create(4, 6, true, true), 7)));
    }

    private static List<Record> eggs() {
        return ImmutableList.of(
                Record.builder("egg_1", "sample").datum("eggs", ImmutableList.of(0, 1, 2, 3))
                        .build(),
                Record.builder("egg_2", "sample").datum("eggs", ImmutableList.of(1, 2, 3, 4, 5))
                        .build(),
                Record.builder("egg_3", "sample").datum("eggs", ImmutableList.of(4, 5, 6, 7))
                        .build());
    }

    @Test
    public void testAnyInAcrossDisjointLists() throws IOException {
        Assert.assertEquals(ImmutableSet.of(A, B, C), query("samples", ListCriterion.anyIn(
                DataRange.create(2, 6, true, true))));
        Assert.assertEquals(ImmutableSet.of(B), query("samples", ListCriterion.anyIn(
                DataRange.create(6.5, 10))));
    }

    @Test
    public void testSeveralCriteriaInSameBucket() throws IOException {
        this.records.insert(ImmutableList.of(
                Record.builder("rec_e", "trial").datum("speed", 5).datum("depth", 2)
                        .datum("mode", "fast").datum("kind", "x").build(),
                Record.builder("rec_f", "trial").datum("speed", 5).datum("depth", 0)
                        .datum("mode", "fast").datum("kind", "y").build()));
        Assert.assertEquals(ImmutableSet.of("rec_e"), ids(this.records.dataQuery(ImmutableMap
                .<String, Object>of("speed", 5, "depth", DataRange.atLeast(1)))));
        Assert.assertEquals(ImmutableSet.of("rec_e"), ids(this.records.dataQuery(ImmutableMap
                .<String, Object>of("mode", "fast", "kind", "x"))));
        Assert.assertEquals(ImmutableSet.of(B, "rec_e", "rec_f"), query("speed", 5));
        Assert.assertEquals(ImmutableSet.of("rec_e"), ids(this.records.dataQuery(ImmutableMap
                .<String, Object>of("speed", 5, "depth", DataRange.atLeast(1), "mode", "fast",
                        "kind", "x"))));
        Assert.assertTrue(ids(this.records.dataQuery(ImmutableMap.<String, Object>of("speed",
                5, "depth", DataRange.atLeast(1), "kind", "y"))).isEmpty());
    }

    @Test(expected = EmptyQueryException.class)
    public void testEmptyQuery() throws IOException {
        this.records.dataQuery(ImmutableMap.<String, Object>of());
    }

    @Test
    public void testTopK() throws IOException {
        Assert.assertEquals(ImmutableList.of(C, B), this.records.getWithMax("speed", 2)
                .toList());
        Assert.assertEquals(ImmutableList.of(A, B), this.records.getWithMin("speed", 2)
                .toList());
        Assert.assertEquals(ImmutableList.of(A, B, C), this.records.getWithMin("speed", 10)
                .toList());
        Assert.assertTrue(this.records.getWithMax("speed", 0).toList().isEmpty());
        Assert.assertTrue(this.records.getWithMax("nothing", 3).toList().isEmpty());
    }

    @Test
    public void testDocumentUri() throws IOException {
        Assert.assertEquals(ImmutableSet.of(C), ids(this.records.getGivenDocumentUri(
                "/other/c.png", null)));
        Assert.assertEquals(ImmutableSet.of(A, B), ids(this.records.getGivenDocumentUri(
                "/data/%", null)));
        Assert.assertEquals(ImmutableSet.of(A, C), ids(this.records.getGivenDocumentUri(
                "%.png", null)));
        Assert.assertEquals(ImmutableSet.of(C), ids(this.records.getGivenDocumentUri("%",
                ImmutableList.of(C, D))));
        Assert.assertTrue(ids(this.records.getGivenDocumentUri("/none", null)).isEmpty());
    }

    @Test
    public void testTypes() throws IOException {
        Assert.assertEquals(ImmutableList.of(A, B, D), this.records.getAllOfType("trial")
                .toList());
        Assert.assertEquals(ImmutableSet.of("trial", "run"), this.records.getAvailableTypes());
        Assert.assertEquals(ImmutableList.of(A, B, C, D), this.records.getAll().toList());
    }

    @Test
    public void testMimeTypes() throws IOException {
        Assert.assertEquals(ImmutableList.of(A), this.records.getWithMimeType("image/png", null)
                .toList());
        Assert.assertTrue(ids(this.records.getWithMimeType("image/png", ImmutableList.of(B, C)))
                .isEmpty());
        Assert.assertTrue(ids(this.records.getWithMimeType("text/plain", null)).isEmpty());
    }

    @Test
    public void testCurveSets() throws IOException {
        Assert.assertEquals(ImmutableList.of(A), this.records.getWithCurveSet("ts").toList());
        Assert.assertTrue(ids(this.records.getWithCurveSet("t")).isEmpty());
        Assert.assertEquals(ImmutableSet.of("ts"), this.records.getCurveSetNames());

        this.records.delete(ImmutableList.of(A));
        Assert.assertTrue(ids(this.records.getWithCurveSet("ts")).isEmpty());
        Assert.assertTrue(this.records.getCurveSetNames().isEmpty());
        Assert.assertTrue(ids(this.records.getWithMimeType("image/png", null)).isEmpty());
    }

    @Test
    public void testDataNames() throws IOException {
        Assert.assertEquals(ImmutableSet.of("speed", "mode", "samples", "labels", "energy"),
                this.records.getDataNames("trial", null));
        Assert.assertEquals(ImmutableSet.of("speed", "energy"), this.records.getDataNames(
                "trial", ImmutableList.of(Datum.Kind.SCALAR)));
        Assert.assertEquals(ImmutableSet.of("samples", "labels"), this.records.getDataNames(
                "run", ImmutableList.of(Datum.Kind.STRING_LIST, Datum.Kind.SCALAR_LIST)));
        Assert.assertTrue(this.records.getDataNames("none", null).isEmpty());
    }

    @Test
    public void testGetDataForRecords() throws IOException {
        final Collection<String> names = ImmutableList.of("speed", "mode");
        final Map<String, Map<String, Datum>> data = this.records.getDataForRecords(
                ImmutableList.of(A, D), names);
        Assert.assertEquals(ImmutableSet.of(A, D), data.keySet());
        Assert.assertEquals(ImmutableMap.of("speed", Datum.scalar(1).withUnits("m/s"), "mode",
                Datum.string("fast")), data.get(A));
        Assert.assertTrue(data.get(D).isEmpty());
        Assert.assertEquals(4, this.records.getDataForRecords(ImmutableList.of(A), null).get(A)
                .size());
    }

    @Test
    public void testUpdate() throws IOException {
        final Record updated = Record.builder(A, "trial").datum("speed", 100).datum("labels",
                ImmutableList.of("z")).build();
        this.records.update(ImmutableList.of(updated));
        Assert.assertEquals(updated, this.records.get(A));
        Assert.assertEquals(ImmutableSet.of(A), query("speed", DataRange.atLeast(50)));
        Assert.assertEquals(ImmutableSet.of(C), query("mode", "fast"));
        Assert.assertEquals(ImmutableSet.of(B, C), query("labels", ListCriterion.hasAny("a")));
        Assert.assertEquals(ImmutableSet.of(A), query("labels", ListCriterion.only("z")));
        Assert.assertEquals(ImmutableSet.of(B, C), query("samples", Criteria.exists()));
        Assert.assertTrue(ids(this.records.getGivenDocumentUri("/data/a/%", null)).isEmpty());
        Assert.assertEquals(2, this.relationships.get(A, null, null).toList().size()
                + this.relationships.get(null, null, A).toList().size());
    }

    @Test(expected = NotInsertedException.class)
    public void testUpdateMissing() throws IOException {
        this.records.update(ImmutableList.of(Record.builder("missing", "trial").build()));
    }

    @Test
    public void testDelete() throws IOException {
        this.records.delete(ImmutableList.of(A, "missing"));
        Assert.assertEquals(ImmutableList.of(false, true), this.records.exist(ImmutableList.of(A,
                B)));
        Assert.assertEquals(ImmutableSet.of(B, C), query("speed", Criteria.exists()));
        Assert.assertEquals(ImmutableSet.of(C), query("labels", ListCriterion.hasAll("a", "b")));
        Assert.assertTrue(ids(this.records.getGivenDocumentUri("/data/a/out.png", null))
                .isEmpty());
        Assert.assertEquals(ImmutableList.of(B, D), this.records.getAllOfType("trial").toList());
        Assert.assertTrue(this.relationships.get(A, null, null).toList().isEmpty());
        Assert.assertTrue(this.relationships.get(null, null, A).toList().isEmpty());

        // deleting again has no effect
        this.records.delete(ImmutableList.of(A));
        Assert.assertEquals(ImmutableList.of(B, C, D), this.records.getAll().toList());
    }

    @Test
    public void testRelationships() throws IOException {
        this.relationships.insert(ImmutableList.of(new Relationship(A, "contains", B),
                new Relationship(A, "contains", D)));
        Assert.assertEquals(3, this.relationships.get(A, null, null).toList().size());
        Assert.assertEquals(2, this.relationships.get(A, "contains", B).toList().size());
        Assert.assertEquals(ImmutableSet.of(new Relationship(C, "uses", A)), this.relationships
                .get(null, null, A).toSet());
        Assert.assertEquals(ImmutableSet.of(new Relationship(C, "uses", A)), this.relationships
                .get(null, "uses", null).toSet());
        Assert.assertTrue(this.relationships.get(null, "uses", B).toList().isEmpty());

        this.relationships.delete(new Relationship(A, "contains", B));
        Assert.assertEquals(ImmutableList.of(new Relationship(A, "contains", D)),
                this.relationships.get(A, null, null).toList());
        Assert.assertTrue(this.relationships.get(null, null, B).toList().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRelationshipQueryWithoutComponents() throws IOException {
        this.relationships.get(null, null, null);
    }

}
