package gov.llnl.sina.query;

import java.io.Serializable;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import gov.llnl.sina.data.ParseException;

/**
 * An interval over numbers or strings, with each side independently inclusive, exclusive or
 * unbounded.
 * <p>
 * A range has an optional minimum and an optional maximum, of the same type: either
 * {@code Double} (numeric range; any {@code Number} supplied is converted) or {@code String}
 * (lexicographic range). At least one bound must be present, the minimum cannot exceed the
 * maximum, and a degenerate range with equal bounds must be closed on both sides, in which case
 * it denotes a single value (see {@link #isSingleValue()}). The inclusive flag of an absent bound
 * is always false. Violations are reported at construction time with an
 * {@link InvalidRangeException}.
 * </p>
 * <p>
 * Ranges can also be parsed from the compact form {@code [min,max)}, where either value may be
 * omitted, or from a bare value denoting equality; see {@link #parse(String)}.
 * </p>
 * <p>
 * Instances are immutable; equality is structural.
 * </p>
 */
public final class DataRange implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Comparator<DataRange> MIN_ORDERING = new Comparator<DataRange>() {

        @Override
        public int compare(final DataRange first, final DataRange second) {
            if (first.min == null || second.min == null) {
                return first.min == null ? second.min == null ? 0 : -1 : 1;
            }
            final int result = compareValues(first.min, second.min);
            if (result != 0) {
                return result;
            }
            return first.minInclusive == second.minInclusive ? 0 : first.minInclusive ? -1 : 1;
        }

    };

    @Nullable
    private final Object min;

    @Nullable
    private final Object max;

    private final boolean minInclusive;

    private final boolean maxInclusive;

    private DataRange(@Nullable final Object min, @Nullable final Object max,
            final boolean minInclusive, final boolean maxInclusive) {
        this.min = normalize(min);
        this.max = normalize(max);
        this.minInclusive = this.min != null && minInclusive;
        this.maxInclusive = this.max != null && maxInclusive;
        if (this.min == null && this.max == null) {
            throw new InvalidRangeException("A range needs at least one bound");
        }
        if (this.min != null && this.max != null) {
            if (this.min.getClass() != this.max.getClass()) {
                throw new InvalidRangeException("Mixed bound types in range: " + this.min
                        + ", " + this.max);
            }
            final int comparison = compareValues(this.min, this.max);
            if (comparison > 0) {
                throw new InvalidRangeException("Min exceeds max in range " + this);
            } else if (comparison == 0 && !(this.minInclusive && this.maxInclusive)) {
                throw new InvalidRangeException("Empty range " + this
                        + ": equal bounds must both be inclusive");
            }
        }
    }

    @Nullable
    private static Object normalize(@Nullable final Object value) {
        if (value == null || value instanceof String) {
            return value;
        } else if (value instanceof Number) {
            final double number = ((Number) value).doubleValue();
            if (Double.isNaN(number)) {
                throw new InvalidRangeException("NaN is not a valid range bound");
            }
            return number == 0.0 ? 0.0 : number;
        }
        throw new InvalidRangeException("Unsupported range bound: " + value + " ("
                + value.getClass().getSimpleName() + ")");
    }

    /**
     * Creates a range including the minimum and excluding the maximum.
     *
     * @param min
     *            the minimum, a number or a string, null if unbounded
     * @param max
     *            the maximum, a number or a string, null if unbounded
     * @return the created range
     * @throws InvalidRangeException
     *             if the bounds are not valid
     */
    public static DataRange create(@Nullable final Object min, @Nullable final Object max)
            throws InvalidRangeException {
        return new DataRange(min, max, true, false);
    }

    public static DataRange create(@Nullable final Object min, @Nullable final Object max,
            final boolean minInclusive, final boolean maxInclusive) throws InvalidRangeException {
        return new DataRange(min, max, minInclusive, maxInclusive);
    }

    public static DataRange numeric(@Nullable final Number min, @Nullable final Number max,
            final boolean minInclusive, final boolean maxInclusive) throws InvalidRangeException {
        return new DataRange(min, max, minInclusive, maxInclusive);
    }

    public static DataRange lexicographic(@Nullable final String min, @Nullable final String max,
            final boolean minInclusive, final boolean maxInclusive) throws InvalidRangeException {
        return new DataRange(min, max, minInclusive, maxInclusive);
    }

    /**
     * Creates a closed range matching exactly the value specified.
     *
     * @param value
     *            the value, a number or a string
     * @return the created range
     */
    public static DataRange equalTo(final Object value) {
        Preconditions.checkNotNull(value);
        return new DataRange(value, value, true, true);
    }

    public static DataRange atLeast(final Object min) {
        return new DataRange(min, null, true, false);
    }

    public static DataRange greaterThan(final Object min) {
        return new DataRange(min, null, false, false);
    }

    public static DataRange atMost(final Object max) {
        return new DataRange(null, max, false, true);
    }

    public static DataRange lessThan(final Object max) {
        return new DataRange(null, max, false, false);
    }

    /**
     * Parses a range in the form {@code <open><min>,<max><close>}, with {@code <open>} among
     * {@code [} and {@code (}, {@code <close>} among {@code ]} and {@code )}, and either value
     * possibly empty to denote an unbounded side. A string without brackets and commas denotes
     * the single-value range for that value. Values parseable as numbers are read as numbers,
     * any other value as a string.
     *
     * @param string
     *            the string to parse
     * @return the parsed range
     * @throws ParseException
     *             if the string is malformed or denotes an invalid range
     */
    public static DataRange parse(final String string) throws ParseException {
        final String trimmed = string.trim();
        if (trimmed.isEmpty()) {
            throw new ParseException(string, "Empty range");
        }
        final String[] values = trimmed.split(",", -1);
        try {
            if (values.length == 1) {
                if ("[(".indexOf(trimmed.charAt(0)) >= 0
                        || "])".indexOf(trimmed.charAt(trimmed.length() - 1)) >= 0) {
                    throw new ParseException(string, "Missing comma in range");
                }
                return equalTo(parseValue(trimmed));
            } else if (values.length != 2 || trimmed.length() < 3) {
                throw new ParseException(string, "Range must have exactly two sides");
            }
            final char open = trimmed.charAt(0);
            final char close = trimmed.charAt(trimmed.length() - 1);
            if (open != '[' && open != '(') {
                throw new ParseException(string, "Bad inclusiveness specifier for range: " + open);
            } else if (close != ']' && close != ')') {
                throw new ParseException(string, "Bad inclusiveness specifier for range: " + close);
            }
            final String min = values[0].substring(1).trim();
            final String max = values[1].substring(0, values[1].length() - 1).trim();
            return new DataRange(min.isEmpty() ? null : parseValue(min),
                    max.isEmpty() ? null : parseValue(max), open == '[', close == ']');
        } catch (final InvalidRangeException ex) {
            throw new ParseException(string, ex.getMessage(), ex);
        }
    }

    private static Object parseValue(final String string) {
        try {
            return Double.parseDouble(string);
        } catch (final NumberFormatException ex) {
            return string;
        }
    }

    /**
     * Returns the complement of the union of the supplied ranges, i.e., the ranges covering any
     * value not contained in any of them. Each boundary of the result takes the opposite
     * inclusivity of the boundary it derives from, so that a value is contained either in an
     * input range or in the complement, never in both.
     *
     * @param ranges
     *            the ranges, all numeric or all lexicographic, at least one
     * @return the complement, possibly empty if the ranges cover every value
     * @throws MixedCriteriaException
     *             if numeric and lexicographic ranges are mixed
     */
    public static List<DataRange> complement(final Iterable<DataRange> ranges)
            throws MixedCriteriaException {

        final List<DataRange> sorted = Lists.newArrayList(ranges);
        Preconditions.checkArgument(!sorted.isEmpty(), "No ranges to invert");
        final boolean numeric = sorted.get(0).isNumeric();
        for (final DataRange range : sorted) {
            if (range.isNumeric() != numeric) {
                throw new MixedCriteriaException("Cannot invert numeric and lexicographic "
                        + "ranges together: " + sorted);
            }
        }
        sorted.sort(MIN_ORDERING);

        // Merge overlapping ranges, keeping track of the lowest min and the running max
        final List<Object[]> merged = Lists.newArrayList();
        Object[] current = null;
        for (final DataRange range : sorted) {
            if (current != null && overlaps(current[2], (Boolean) current[3], range)) {
                if (current[2] != null
                        && (range.max == null || compareValues(range.max, current[2]) > 0
                                || compareValues(range.max, current[2]) == 0
                                && range.maxInclusive)) {
                    current[2] = range.max;
                    current[3] = range.maxInclusive;
                }
            } else {
                current = new Object[] { range.min, range.minInclusive, range.max,
                        range.maxInclusive };
                merged.add(current);
            }
        }

        final ImmutableList.Builder<DataRange> builder = ImmutableList.builder();
        final Object[] first = merged.get(0);
        if (first[0] != null) {
            builder.add(new DataRange(null, first[0], false, !(Boolean) first[1]));
        }
        for (int i = 1; i < merged.size(); ++i) {
            final Object[] prior = merged.get(i - 1);
            final Object[] next = merged.get(i);
            builder.add(new DataRange(prior[2], next[0], !(Boolean) prior[3],
                    !(Boolean) next[1]));
        }
        final Object[] last = merged.get(merged.size() - 1);
        if (last[2] != null) {
            builder.add(new DataRange(last[2], null, !(Boolean) last[3], false));
        }
        return builder.build();
    }

    /**
     * Returns the smallest range containing all the supplied ranges, or null if that range is
     * unbounded on both sides.
     *
     * @param ranges
     *            the ranges, all numeric or all lexicographic, at least one
     * @return the enclosing range, or null if it has no bound
     * @throws MixedCriteriaException
     *             if numeric and lexicographic ranges are mixed
     */
    @Nullable
    public static DataRange span(final Iterable<DataRange> ranges) throws MixedCriteriaException {
        DataRange first = null;
        Object min = null;
        Object max = null;
        boolean minInclusive = false;
        boolean maxInclusive = false;
        boolean minUnbounded = false;
        boolean maxUnbounded = false;
        for (final DataRange range : ranges) {
            if (first == null) {
                first = range;
            } else if (range.isNumeric() != first.isNumeric()) {
                throw new MixedCriteriaException("Cannot span numeric and lexicographic "
                        + "ranges together: " + first + ", " + range);
            }
            if (range.min == null) {
                minUnbounded = true;
            } else if (min == null || compareValues(range.min, min) < 0) {
                min = range.min;
                minInclusive = range.minInclusive;
            } else if (compareValues(range.min, min) == 0) {
                minInclusive |= range.minInclusive;
            }
            if (range.max == null) {
                maxUnbounded = true;
            } else if (max == null || compareValues(range.max, max) > 0) {
                max = range.max;
                maxInclusive = range.maxInclusive;
            } else if (compareValues(range.max, max) == 0) {
                maxInclusive |= range.maxInclusive;
            }
        }
        Preconditions.checkArgument(first != null, "No ranges to span");
        if (minUnbounded && maxUnbounded) {
            return null;
        }
        return new DataRange(minUnbounded ? null : min, maxUnbounded ? null : max, minInclusive,
                maxInclusive);
    }

    private static boolean overlaps(@Nullable final Object max, final boolean maxInclusive,
            final DataRange next) {
        if (max == null || next.min == null) {
            return true;
        }
        final int comparison = compareValues(max, next.min);
        return comparison > 0 || comparison == 0 && (maxInclusive || next.minInclusive);
    }

    static int compareValues(final Object first, final Object second) {
        if (first instanceof Double) {
            return Double.compare((Double) first, (Double) second);
        }
        return ((String) first).compareTo((String) second);
    }

    @Nullable
    public Object getMin() {
        return this.min;
    }

    @Nullable
    public Object getMax() {
        return this.max;
    }

    public boolean hasMin() {
        return this.min != null;
    }

    public boolean hasMax() {
        return this.max != null;
    }

    public boolean isMinInclusive() {
        return this.minInclusive;
    }

    public boolean isMaxInclusive() {
        return this.maxInclusive;
    }

    public boolean isNumeric() {
        return (this.min != null ? this.min : this.max) instanceof Double;
    }

    public boolean isLexicographic() {
        return (this.min != null ? this.min : this.max) instanceof String;
    }

    /**
     * Returns true if this range matches exactly one value, i.e., min and max are equal (and
     * thus both inclusive).
     */
    public boolean isSingleValue() {
        return this.min != null && this.max != null && compareValues(this.min, this.max) == 0;
    }

    /**
     * Tests whether the value specified falls in this range. Values of a type different from the
     * range type (e.g., strings for a numeric range) are never contained.
     *
     * @param value
     *            the value to test, possibly null
     * @return true if the value is contained in the range
     */
    public boolean contains(@Nullable final Object value) {
        final Object normalized;
        if (value instanceof Number) {
            final double number = ((Number) value).doubleValue();
            normalized = number == 0.0 ? 0.0 : number;
        } else if (value instanceof String) {
            normalized = value;
        } else {
            return false;
        }
        if (isNumeric() != normalized instanceof Double) {
            return false;
        }
        if (this.min != null) {
            final int comparison = compareValues(normalized, this.min);
            if (comparison < 0 || comparison == 0 && !this.minInclusive) {
                return false;
            }
        }
        if (this.max != null) {
            final int comparison = compareValues(normalized, this.max);
            if (comparison > 0 || comparison == 0 && !this.maxInclusive) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the range keeping only the lower bound of this range, or null if this range has
     * no lower bound.
     */
    @Nullable
    public DataRange lowerHalf() {
        return this.min == null ? null : this.max == null ? this : new DataRange(this.min, null,
                this.minInclusive, false);
    }

    /**
     * Returns the range keeping only the upper bound of this range, or null if this range has
     * no upper bound.
     */
    @Nullable
    public DataRange upperHalf() {
        return this.max == null ? null : this.min == null ? this : new DataRange(null, this.max,
                false, this.maxInclusive);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof DataRange)) {
            return false;
        }
        final DataRange other = (DataRange) object;
        return Objects.equals(this.min, other.min) && Objects.equals(this.max, other.max)
                && this.minInclusive == other.minInclusive
                && this.maxInclusive == other.maxInclusive;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.min, this.max, this.minInclusive, this.maxInclusive);
    }

    @Override
    public String toString() {
        return (this.minInclusive ? "[" : "(") + (this.min == null ? "" : this.min) + ","
                + (this.max == null ? "" : this.max) + (this.maxInclusive ? "]" : ")");
    }

}
