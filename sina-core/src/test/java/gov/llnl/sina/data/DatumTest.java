package gov.llnl.sina.data;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class DatumTest {

    @Test
    public void testNegativeZeroIsStoredAsZero() {
        Assert.assertEquals(Datum.scalar(0), Datum.scalar(-0.0));
        Assert.assertEquals(0, Double.compare(0.0, Datum.scalar(-0.0).asScalar()));
        Assert.assertEquals(0, Double.compare(0.0, Datum.of(-0.0f, null, null).asScalar()));
        Assert.assertEquals(ImmutableList.of(0.0, 1.0), Datum.scalarList(ImmutableList.of(-0.0,
                1.0)).asScalarList());
        Assert.assertEquals(ImmutableList.of(0.0), Datum.of(ImmutableList.of(-0.0), null, null)
                .getValue());
    }

    @Test
    public void testKindFromValue() {
        Assert.assertEquals(Datum.Kind.SCALAR, Datum.of(3, null, null).getKind());
        Assert.assertEquals(Datum.Kind.STRING, Datum.of("x", null, null).getKind());
        Assert.assertEquals(Datum.Kind.STRING_LIST, Datum.of(ImmutableList.of("x"), "u", null)
                .getKind());
    }

}
