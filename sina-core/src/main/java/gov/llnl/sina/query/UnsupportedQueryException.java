package gov.llnl.sina.query;

import javax.annotation.Nullable;

/**
 * Signals a query that is well-formed but cannot be evaluated on the stored data, e.g., a
 * membership test on a numeric list, of which only the minimum and maximum are stored.
 */
public class UnsupportedQueryException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    public UnsupportedQueryException(final String message) {
        super(message);
    }

    public UnsupportedQueryException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
