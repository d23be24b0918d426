package gov.llnl.sina.datastore;

/**
 * The families of searchable data rows a backend keeps for each kind of datum.
 */
public enum TableFamily {

    /** One row per scalar datum. */
    SCALAR(false),

    /** One row per string datum. */
    STRING(false),

    /** One row per scalar list datum, holding the minimum of the list. */
    SCALAR_LIST_MIN(true),

    /** One row per scalar list datum, holding the maximum of the list. */
    SCALAR_LIST_MAX(true),

    /** One row per element of a string list datum. */
    STRING_LIST(true);

    private final boolean list;

    private TableFamily(final boolean list) {
        this.list = list;
    }

    public boolean isList() {
        return this.list;
    }

    public boolean isNumeric() {
        return this == SCALAR || this == SCALAR_LIST_MIN || this == SCALAR_LIST_MAX;
    }

}
