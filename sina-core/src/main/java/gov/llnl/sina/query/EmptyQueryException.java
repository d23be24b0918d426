package gov.llnl.sina.query;

import javax.annotation.Nullable;

/**
 * Signals that a query was issued without any criterion.
 */
public class EmptyQueryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public EmptyQueryException(final String message) {
        super(message);
    }

    public EmptyQueryException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
