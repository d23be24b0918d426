package gov.llnl.sina.query;

import javax.annotation.Nullable;

/**
 * Signals that a {@link DataRange} cannot be built from the supplied bounds, because both bounds are
 * absent, their types differ, or they describe an empty interval.
 */
public class InvalidRangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidRangeException(final String message) {
        super(message);
    }

    public InvalidRangeException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
