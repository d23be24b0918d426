package gov.llnl.sina.datastore;

import java.io.IOException;
import java.util.Collection;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Signals that one or more records requested by id are not stored.
 * <p>
 * Property {@link #getIds()} lists all the ids that could not be found, not just the first one.
 * </p>
 */
public class RecordNotFoundException extends IOException {

    private static final long serialVersionUID = 1L;

    private final Set<String> ids;

    public RecordNotFoundException(final Collection<String> ids, @Nullable final String message) {
        this(ids, message, null);
    }

    public RecordNotFoundException(final Collection<String> ids, @Nullable final String message,
            @Nullable final Throwable cause) {
        super((ids.size() == 1 ? "Record " + ids.iterator().next() + " not found." : "Records "
                + ids + " not found.") + (message == null ? "" : " " + message), cause);
        Preconditions.checkArgument(!ids.isEmpty());
        this.ids = ImmutableSet.copyOf(ids);
    }

    /**
     * Returns the ids of the missing records.
     */
    public final Set<String> getIds() {
        return this.ids;
    }

}
