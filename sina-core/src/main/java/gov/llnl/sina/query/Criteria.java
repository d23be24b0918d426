package gov.llnl.sina.query;

import java.util.Map;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import gov.llnl.sina.data.ParseException;

/**
 * A set of data criteria, classified by the kind of storage they need to be evaluated against.
 * <p>
 * A query is expressed as a map from datum names to criteria, where a criterion can be:
 * <ul>
 * <li>a number or a string, matching scalar or string data equal to it;</li>
 * <li>a {@link DataRange}, matching scalar data (numeric range) or string data (lexicographic
 * range) within it;</li>
 * <li>a {@link ListCriterion}, matching list data of the same type;</li>
 * <li>{@link UniversalCriterion#EXISTS} (see {@link #exists()}), matching any datum with the given
 * name.</li>
 * </ul>
 * {@link #classify(Map)} sorts the criteria into five buckets, each preserving the order of the
 * input map, so that each bucket can be evaluated with a single backend-specific strategy and
 * the resulting record id sets can be intersected.
 * </p>
 */
public final class Criteria {

    private final ImmutableMap<String, DataRange> scalars;

    private final ImmutableMap<String, DataRange> strings;

    private final ImmutableMap<String, ListCriterion> scalarLists;

    private final ImmutableMap<String, ListCriterion> stringLists;

    private final ImmutableSet<String> universal;

    private Criteria(final Map<String, DataRange> scalars, final Map<String, DataRange> strings,
            final Map<String, ListCriterion> scalarLists,
            final Map<String, ListCriterion> stringLists, final Set<String> universal) {
        this.scalars = ImmutableMap.copyOf(scalars);
        this.strings = ImmutableMap.copyOf(strings);
        this.scalarLists = ImmutableMap.copyOf(scalarLists);
        this.stringLists = ImmutableMap.copyOf(stringLists);
        this.universal = ImmutableSet.copyOf(universal);
    }

    /**
     * Returns the criterion matching any datum with a given name, whatever its value.
     */
    public static UniversalCriterion exists() {
        return UniversalCriterion.EXISTS;
    }

    /**
     * Classifies the supplied criteria.
     *
     * @param criteria
     *            a map from datum names to criteria, not empty
     * @return the classified criteria
     * @throws EmptyQueryException
     *             if no criteria were given
     * @throws IllegalArgumentException
     *             if a criterion of an unsupported type was given
     */
    public static Criteria classify(final Map<String, ?> criteria) throws EmptyQueryException {
        Preconditions.checkNotNull(criteria);
        if (criteria.isEmpty()) {
            throw new EmptyQueryException("No criteria given for data query");
        }
        final Map<String, DataRange> scalars = Maps.newLinkedHashMap();
        final Map<String, DataRange> strings = Maps.newLinkedHashMap();
        final Map<String, ListCriterion> scalarLists = Maps.newLinkedHashMap();
        final Map<String, ListCriterion> stringLists = Maps.newLinkedHashMap();
        final Set<String> universal = Sets.newLinkedHashSet();
        for (final Map.Entry<String, ?> entry : criteria.entrySet()) {
            final String name = entry.getKey();
            final Object criterion = entry.getValue();
            if (criterion instanceof Number || criterion instanceof String) {
                final DataRange range = DataRange.equalTo(criterion);
                (range.isNumeric() ? scalars : strings).put(name, range);
            } else if (criterion instanceof DataRange) {
                final DataRange range = (DataRange) criterion;
                (range.isNumeric() ? scalars : strings).put(name, range);
            } else if (criterion instanceof ListCriterion) {
                final ListCriterion list = (ListCriterion) criterion;
                (list.isNumeric() ? scalarLists : stringLists).put(name, list);
            } else if (criterion instanceof UniversalCriterion) {
                universal.add(name);
            } else {
                throw new IllegalArgumentException("Unsupported criterion for '" + name + "': "
                        + criterion);
            }
        }
        return new Criteria(scalars, strings, scalarLists, stringLists, universal);
    }

    /**
     * Parses a space-separated list of {@code name=range} specifications into a criteria map,
     * using {@link DataRange#parse(String)} for the range part. Example:
     * {@code "speed=(3,4] mode=fast"}.
     *
     * @param string
     *            the string to parse
     * @return a map from datum names to ranges, in the order they were specified
     * @throws ParseException
     *             on bad syntax
     */
    public static Map<String, DataRange> parse(final String string) throws ParseException {
        final Map<String, DataRange> result = Maps.newLinkedHashMap();
        for (final String token : string.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            final int index = token.indexOf('=');
            if (index <= 0 || index == token.length() - 1) {
                throw new ParseException(string, "Bad syntax for criterion '" + token + "'");
            }
            result.put(token.substring(0, index), DataRange.parse(token.substring(index + 1)));
        }
        return result;
    }

    public Map<String, DataRange> getScalars() {
        return this.scalars;
    }

    public Map<String, DataRange> getStrings() {
        return this.strings;
    }

    public Map<String, ListCriterion> getScalarLists() {
        return this.scalarLists;
    }

    public Map<String, ListCriterion> getStringLists() {
        return this.stringLists;
    }

    public Set<String> getUniversal() {
        return this.universal;
    }

    /**
     * Returns the number of non-empty buckets.
     */
    public int getBucketCount() {
        return (this.scalars.isEmpty() ? 0 : 1) + (this.strings.isEmpty() ? 0 : 1)
                + (this.scalarLists.isEmpty() ? 0 : 1) + (this.stringLists.isEmpty() ? 0 : 1)
                + (this.universal.isEmpty() ? 0 : 1);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("scalars", this.scalars)
                .add("strings", this.strings).add("scalarLists", this.scalarLists)
                .add("stringLists", this.stringLists).add("universal", this.universal)
                .toString();
    }

}
