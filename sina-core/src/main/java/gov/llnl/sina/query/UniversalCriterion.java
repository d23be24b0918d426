package gov.llnl.sina.query;

/**
 * Criteria that match any value of a datum, whatever its type.
 */
public enum UniversalCriterion {

    /** Matches records having a datum with the given name, regardless of its value. */
    EXISTS

}
