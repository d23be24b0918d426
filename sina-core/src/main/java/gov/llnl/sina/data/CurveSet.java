package gov.llnl.sina.data;

import java.io.Serializable;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * A named group of curves sharing their independent variables.
 */
public final class CurveSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;

    private final ImmutableMap<String, Curve> independent;

    private final ImmutableMap<String, Curve> dependent;

    public CurveSet(final String name, final Iterable<Curve> independent,
            final Iterable<Curve> dependent) {
        this.name = Preconditions.checkNotNull(name);
        this.independent = index(independent);
        this.dependent = index(dependent);
    }

    private static ImmutableMap<String, Curve> index(final Iterable<Curve> curves) {
        final ImmutableMap.Builder<String, Curve> builder = ImmutableMap.builder();
        for (final Curve curve : curves) {
            builder.put(curve.getName(), curve);
        }
        return builder.build();
    }

    public String getName() {
        return this.name;
    }

    public Map<String, Curve> getIndependent() {
        return this.independent;
    }

    public Map<String, Curve> getDependent() {
        return this.dependent;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof CurveSet)) {
            return false;
        }
        final CurveSet other = (CurveSet) object;
        return this.name.equals(other.name) && this.independent.equals(other.independent)
                && this.dependent.equals(other.dependent);
    }

    @Override
    public int hashCode() {
        return this.name.hashCode() ^ this.independent.hashCode() ^ this.dependent.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", this.name)
                .add("independent", this.independent.keySet())
                .add("dependent", this.dependent.keySet()).toString();
    }

}
