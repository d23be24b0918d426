package gov.llnl.sina.runtime;

import java.io.IOException;

import javax.annotation.Nullable;

/**
 * Signals that persisted data is missing or corrupted, e.g., a record row references data that
 * cannot be decoded, or a record id listed in an index has no corresponding record.
 * <p>
 * This exception differentiates from other {@code IOException}s, which may be addressed by
 * re-attempting the operation, as recovery requires the affected data to be re-ingested.
 * </p>
 */
public class DataCorruptedException extends IOException {

    private static final long serialVersionUID = 1L;

    public DataCorruptedException(@Nullable final String message) {
        this(message, null);
    }

    public DataCorruptedException(@Nullable final String message,
            @Nullable final Throwable cause) {
        super(message, cause);
    }

}
