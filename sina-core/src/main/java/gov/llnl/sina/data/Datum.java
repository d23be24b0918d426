package gov.llnl.sina.data;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

/**
 * A named value attached to a {@link Record}, together with optional units and tags.
 * <p>
 * The value is exactly one of a real number, a string, a list of reals or a list of strings, as
 * reported by {@link #getKind()}. Lists never mix numbers and strings; an empty list is treated
 * as an empty list of reals. Instances are immutable.
 * </p>
 */
public final class Datum implements Serializable {

    private static final long serialVersionUID = 1L;

    /** The kind of value held by a {@code Datum}. */
    public enum Kind {

        SCALAR,

        STRING,

        SCALAR_LIST,

        STRING_LIST;

        public boolean isList() {
            return this == SCALAR_LIST || this == STRING_LIST;
        }

    }

    private final Kind kind;

    private final Object value;

    @Nullable
    private final String units;

    private final ImmutableList<String> tags;

    private Datum(final Kind kind, final Object value, @Nullable final String units,
            @Nullable final Iterable<String> tags) {
        this.kind = kind;
        this.value = value;
        this.units = units;
        this.tags = tags == null ? ImmutableList.<String>of() : ImmutableList.copyOf(tags);
    }

    public static Datum scalar(final double value) {
        return new Datum(Kind.SCALAR, toDouble(value), null, null);
    }

    public static Datum string(final String value) {
        return new Datum(Kind.STRING, Preconditions.checkNotNull(value), null, null);
    }

    public static Datum scalarList(final Iterable<? extends Number> values) {
        final ImmutableList.Builder<Double> builder = ImmutableList.builder();
        for (final Number number : values) {
            builder.add(toDouble(number.doubleValue()));
        }
        return new Datum(Kind.SCALAR_LIST, builder.build(), null, null);
    }

    public static Datum stringList(final Iterable<String> values) {
        return new Datum(Kind.STRING_LIST, ImmutableList.copyOf(values), null, null);
    }

    /**
     * Creates a {@code Datum} for a value of unknown type, choosing its kind from the Java type
     * of the value: a {@code Number}, a {@code String} or a list of either.
     *
     * @param value
     *            the value, not null
     * @param units
     *            the optional units
     * @param tags
     *            the optional tags
     * @return the created {@code Datum}
     * @throws IllegalArgumentException
     *             if the value has an unsupported type or is a list mixing numbers and strings
     */
    public static Datum of(final Object value, @Nullable final String units,
            @Nullable final Iterable<String> tags) throws IllegalArgumentException {
        Preconditions.checkNotNull(value, "Null datum value");
        if (value instanceof Number) {
            return new Datum(Kind.SCALAR, toDouble(((Number) value).doubleValue()), units,
                    tags);
        } else if (value instanceof String) {
            return new Datum(Kind.STRING, value, units, tags);
        } else if (value instanceof Iterable<?>) {
            boolean numbers = false;
            boolean strings = false;
            final ImmutableList.Builder<Object> builder = ImmutableList.builder();
            for (final Object element : (Iterable<?>) value) {
                if (element instanceof Number) {
                    numbers = true;
                    builder.add(toDouble(((Number) element).doubleValue()));
                } else if (element instanceof String) {
                    strings = true;
                    builder.add(element);
                } else {
                    throw new IllegalArgumentException("Unsupported list element: " + element);
                }
            }
            if (numbers && strings) {
                throw new IllegalArgumentException("List mixes numbers and strings: " + value);
            }
            return new Datum(strings ? Kind.STRING_LIST : Kind.SCALAR_LIST, builder.build(),
                    units, tags);
        }
        throw new IllegalArgumentException("Unsupported datum value: " + value + " ("
                + value.getClass().getSimpleName() + ")");
    }

    // -0.0 and 0.0 must be stored and compared as the same value
    private static double toDouble(final double value) {
        return value == 0.0 ? 0.0 : value;
    }

    public Datum withUnits(@Nullable final String units) {
        return new Datum(this.kind, this.value, units, this.tags);
    }

    public Datum withTags(@Nullable final Iterable<String> tags) {
        return new Datum(this.kind, this.value, this.units, tags);
    }

    public Kind getKind() {
        return this.kind;
    }

    /**
     * Returns the value, as a {@code Double}, a {@code String}, or an immutable list of them.
     */
    public Object getValue() {
        return this.value;
    }

    @Nullable
    public String getUnits() {
        return this.units;
    }

    public List<String> getTags() {
        return this.tags;
    }

    public double asScalar() {
        Preconditions.checkState(this.kind == Kind.SCALAR, "Not a scalar: %s", this);
        return (Double) this.value;
    }

    public String asString() {
        Preconditions.checkState(this.kind == Kind.STRING, "Not a string: %s", this);
        return (String) this.value;
    }

    @SuppressWarnings("unchecked")
    public List<Double> asScalarList() {
        Preconditions.checkState(this.kind == Kind.SCALAR_LIST, "Not a scalar list: %s", this);
        return (List<Double>) this.value;
    }

    @SuppressWarnings("unchecked")
    public List<String> asStringList() {
        Preconditions.checkState(this.kind == Kind.STRING_LIST, "Not a string list: %s", this);
        return (List<String>) this.value;
    }

    /**
     * Returns the smallest element of a scalar list, or null if the list is empty.
     */
    @Nullable
    public Double getMin() {
        final List<Double> list = asScalarList();
        return list.isEmpty() ? null : Ordering.natural().min(list);
    }

    /**
     * Returns the largest element of a scalar list, or null if the list is empty.
     */
    @Nullable
    public Double getMax() {
        final List<Double> list = asScalarList();
        return list.isEmpty() ? null : Ordering.natural().max(list);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Datum)) {
            return false;
        }
        final Datum other = (Datum) object;
        return this.kind == other.kind && this.value.equals(other.value)
                && Objects.equals(this.units, other.units) && this.tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.value, this.units, this.tags);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("value", this.value)
                .add("units", this.units).add("tags", this.tags.isEmpty() ? null : this.tags)
                .toString();
    }

}
