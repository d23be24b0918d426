package gov.llnl.sina.query;

import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import gov.llnl.sina.data.ParseException;

public class CriteriaTest {

    @Test
    public void testClassify() {
        final Map<String, Object> query = Maps.newLinkedHashMap();
        query.put("speed", DataRange.create(1, 2));
        query.put("mode", "fast");
        query.put("height", 4);
        query.put("samples", ListCriterion.anyIn(DataRange.create(2, 6)));
        query.put("labels", ListCriterion.only("a", "b"));
        query.put("output", Criteria.exists());
        query.put("name", DataRange.atLeast("m"));

        final Criteria criteria = Criteria.classify(query);
        Assert.assertEquals(ImmutableList.of("speed", "height"), ImmutableList.copyOf(criteria
                .getScalars().keySet()));
        Assert.assertEquals(DataRange.equalTo(4), criteria.getScalars().get("height"));
        Assert.assertEquals(ImmutableMap.of("mode", DataRange.equalTo("fast"), "name",
                DataRange.atLeast("m")), criteria.getStrings());
        Assert.assertEquals(ImmutableMap.of("samples", ListCriterion.anyIn(DataRange
                .create(2, 6))), criteria.getScalarLists());
        Assert.assertEquals(ImmutableMap.of("labels", ListCriterion.only("a", "b")),
                criteria.getStringLists());
        Assert.assertEquals(ImmutableList.of("output"), ImmutableList.copyOf(criteria
                .getUniversal()));
        Assert.assertEquals(5, criteria.getBucketCount());
    }

    @Test
    public void testSingleBucket() {
        final Criteria criteria = Criteria.classify(ImmutableMap.of("mode", "slow"));
        Assert.assertEquals(1, criteria.getBucketCount());
        Assert.assertTrue(criteria.getScalars().isEmpty());
    }

    @Test(expected = EmptyQueryException.class)
    public void testEmptyQuery() {
        Criteria.classify(ImmutableMap.<String, Object>of());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedCriterion() {
        Criteria.classify(ImmutableMap.of("flag", Boolean.TRUE));
    }

    @Test
    public void testParse() {
        final Map<String, DataRange> parsed = Criteria.parse("speed=(3,4]  mode=fast");
        Assert.assertEquals(ImmutableList.of("speed", "mode"), ImmutableList.copyOf(parsed
                .keySet()));
        Assert.assertEquals(DataRange.create(3, 4, false, true), parsed.get("speed"));
        Assert.assertEquals(DataRange.equalTo("fast"), parsed.get("mode"));
    }

    @Test(expected = ParseException.class)
    public void testParseMissingRange() {
        Criteria.parse("speed=");
    }

    @Test(expected = ParseException.class)
    public void testParseMissingName() {
        Criteria.parse("=3");
    }

}
