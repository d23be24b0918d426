package gov.llnl.sina.query;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A criterion over a list datum, consisting of a {@link ListOperation} and its arguments.
 * <p>
 * Range operations ({@link ListOperation#ALL_IN}, {@link ListOperation#ANY_IN}) take exactly one
 * {@link DataRange}. Membership operations ({@link ListOperation#HAS_ALL},
 * {@link ListOperation#HAS_ANY}, {@link ListOperation#ONLY}) take one or more entries, each
 * either a value (number or string) or a {@code DataRange}. All the entries of a criterion must
 * be of the same type, either numeric or lexicographic.
 * </p>
 */
public final class ListCriterion implements Serializable {

    private static final long serialVersionUID = 1L;

    private final ListOperation operation;

    private final ImmutableList<Object> entries;

    private final boolean numeric;

    private ListCriterion(final ListOperation operation, final Object... entries) {
        Preconditions.checkNotNull(operation);
        if (entries.length == 0) {
            throw new MixedCriteriaException("No entries for list operation " + operation);
        }
        final ImmutableList.Builder<Object> builder = ImmutableList.builder();
        Boolean numeric = null;
        for (final Object entry : entries) {
            final Object normalized;
            final boolean entryNumeric;
            if (entry instanceof DataRange) {
                normalized = entry;
                entryNumeric = ((DataRange) entry).isNumeric();
            } else if (entry instanceof Number) {
                normalized = ((Number) entry).doubleValue();
                entryNumeric = true;
            } else if (entry instanceof String) {
                normalized = entry;
                entryNumeric = false;
            } else {
                throw new MixedCriteriaException("Unsupported entry for list operation "
                        + operation + ": " + entry);
            }
            if (numeric != null && numeric != entryNumeric) {
                throw new MixedCriteriaException("Mixed numeric and string entries for list "
                        + "operation " + operation);
            }
            numeric = entryNumeric;
            builder.add(normalized);
        }
        this.operation = operation;
        this.entries = builder.build();
        this.numeric = numeric;
    }

    public static ListCriterion allIn(final DataRange range) {
        return new ListCriterion(ListOperation.ALL_IN, range);
    }

    public static ListCriterion anyIn(final DataRange range) {
        return new ListCriterion(ListOperation.ANY_IN, range);
    }

    public static ListCriterion hasAll(final Object... entries) {
        return new ListCriterion(ListOperation.HAS_ALL, entries);
    }

    public static ListCriterion hasAny(final Object... entries) {
        return new ListCriterion(ListOperation.HAS_ANY, entries);
    }

    public static ListCriterion only(final Object... entries) {
        return new ListCriterion(ListOperation.ONLY, entries);
    }

    public ListOperation getOperation() {
        return this.operation;
    }

    /**
     * Returns the entries of the criterion, as doubles, strings or {@code DataRange}s.
     */
    public List<Object> getEntries() {
        return this.entries;
    }

    public boolean isNumeric() {
        return this.numeric;
    }

    /**
     * Returns the entries of the criterion as ranges, mapping each value to its single-value
     * range.
     */
    public List<DataRange> getRanges() {
        final ImmutableList.Builder<DataRange> builder = ImmutableList.builder();
        for (final Object entry : this.entries) {
            builder.add(entry instanceof DataRange ? (DataRange) entry : DataRange
                    .equalTo(entry));
        }
        return builder.build();
    }

    /**
     * Returns the single range of an {@code ALL_IN} / {@code ANY_IN} criterion.
     *
     * @throws IllegalStateException
     *             if the criterion is not a range operation
     */
    public DataRange getRange() {
        Preconditions.checkState(this.operation.isRangeOperation(), "Not a range operation: %s",
                this.operation);
        return getRanges().get(0);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof ListCriterion)) {
            return false;
        }
        final ListCriterion other = (ListCriterion) object;
        return this.operation == other.operation && this.entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.operation, this.entries);
    }

    @Override
    public String toString() {
        return this.operation + this.entries.toString();
    }

}
