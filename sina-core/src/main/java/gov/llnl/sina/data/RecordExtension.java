package gov.llnl.sina.data;

import java.util.Map;

/**
 * Type-specific metadata attached to a {@link Record}.
 * <p>
 * Extensions are looked up by record type through {@link RecordExtensions}; in JSON documents
 * their fields appear as top-level string fields of the record object.
 * </p>
 */
public interface RecordExtension {

    /**
     * Returns the top-level fields contributed by this extension, in the order they should be
     * serialized. Absent optional fields are omitted.
     *
     * @return an immutable map from field name to value
     */
    Map<String, String> getFields();

}
