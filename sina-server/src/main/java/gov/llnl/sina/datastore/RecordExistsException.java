package gov.llnl.sina.datastore;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals an attempt at inserting a record whose id is already stored.
 * <p>
 * Existing records must be modified with {@link RecordDAO#update(Iterable)}. Mandatory property
 * {@link #getId()} provides the id of the existing record.
 * </p>
 */
public class RecordExistsException extends IOException {

    private static final long serialVersionUID = 1L;

    private final String id;

    public RecordExistsException(final String id, @Nullable final String message) {
        this(id, message, null);
    }

    public RecordExistsException(final String id, @Nullable final String message,
            @Nullable final Throwable cause) {
        super("Record " + id + " already exists." + (message == null ? "" : " " + message), cause);
        this.id = Preconditions.checkNotNull(id);
    }

    /**
     * Returns the id of the existing record.
     */
    public final String getId() {
        return this.id;
    }

}
