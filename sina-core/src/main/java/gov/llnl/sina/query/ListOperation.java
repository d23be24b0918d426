package gov.llnl.sina.query;

/**
 * Operations supported when querying list data.
 */
public enum ListOperation {

    /** Every element of the list falls in a given range. */
    ALL_IN,

    /** At least one element of the list falls in a given range. */
    ANY_IN,

    /** The list contains every one of the given values or ranges. */
    HAS_ALL,

    /** The list contains at least one of the given values or ranges. */
    HAS_ANY,

    /** Every element of the list matches one of the given values or ranges. */
    ONLY;

    /**
     * Returns true if the operation takes a single range argument.
     */
    public boolean isRangeOperation() {
        return this == ALL_IN || this == ANY_IN;
    }

}
