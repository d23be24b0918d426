package gov.llnl.sina.datastore;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals an attempt at updating a record that was never inserted.
 */
public class NotInsertedException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String id;

    public NotInsertedException(final String id, @Nullable final String message) {
        this(id, message, null);
    }

    public NotInsertedException(final String id, @Nullable final String message,
            @Nullable final Throwable cause) {
        super("Record " + id + " has not been inserted." + (message == null ? "" : " "
                + message), cause);
        this.id = Preconditions.checkNotNull(id);
    }

    public final String getId() {
        return this.id;
    }

}
