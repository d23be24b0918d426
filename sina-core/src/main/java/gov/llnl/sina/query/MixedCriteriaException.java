package gov.llnl.sina.query;

import javax.annotation.Nullable;

/**
 * Signals that a list criterion mixes numeric and string values or ranges, so that it is not
 * possible to decide which kind of list data it targets.
 */
public class MixedCriteriaException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MixedCriteriaException(final String message) {
        super(message);
    }

    public MixedCriteriaException(final String message, @Nullable final Throwable cause) {
        super(message, cause);
    }

}
