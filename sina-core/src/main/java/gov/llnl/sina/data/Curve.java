package gov.llnl.sina.data;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A named series of real values belonging to a {@link CurveSet}.
 */
public final class Curve implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;

    private final ImmutableList<Double> values;

    @Nullable
    private final String units;

    private final ImmutableList<String> tags;

    public Curve(final String name, final Iterable<? extends Number> values,
            @Nullable final String units, @Nullable final Iterable<String> tags) {
        this.name = Preconditions.checkNotNull(name);
        final ImmutableList.Builder<Double> builder = ImmutableList.builder();
        for (final Number value : values) {
            builder.add(value.doubleValue());
        }
        this.values = builder.build();
        this.units = units;
        this.tags = tags == null ? ImmutableList.<String>of() : ImmutableList.copyOf(tags);
    }

    public String getName() {
        return this.name;
    }

    public List<Double> getValues() {
        return this.values;
    }

    @Nullable
    public String getUnits() {
        return this.units;
    }

    public List<String> getTags() {
        return this.tags;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Curve)) {
            return false;
        }
        final Curve other = (Curve) object;
        return this.name.equals(other.name) && this.values.equals(other.values)
                && Objects.equals(this.units, other.units) && this.tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.values, this.units, this.tags);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", this.name)
                .add("size", this.values.size()).toString();
    }

}
