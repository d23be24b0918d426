package gov.llnl.sina.data;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

/**
 * Registry of {@link RecordExtension} factories, keyed by record type.
 * <p>
 * The {@code run} type is registered by default and mapped to {@link RunExtension}. Additional
 * types can be registered at startup via {@link #register(String, Function)}.
 * </p>
 */
public final class RecordExtensions {

    private static final Map<String, Function<Map<String, String>, ? extends RecordExtension>> FACTORIES = new ConcurrentHashMap<String, Function<Map<String, String>, ? extends RecordExtension>>();

    static {
        register(RunExtension.TYPE, new Function<Map<String, String>, RunExtension>() {

            @Override
            public RunExtension apply(final Map<String, String> fields) {
                return RunExtension.fromFields(fields);
            }

        });
    }

    public static void register(final String type,
            final Function<Map<String, String>, ? extends RecordExtension> factory) {
        FACTORIES.put(Preconditions.checkNotNull(type), Preconditions.checkNotNull(factory));
    }

    public static boolean isRegistered(final String type) {
        return FACTORIES.containsKey(type);
    }

    /**
     * Creates the extension for the record type specified out of the top-level fields of a
     * record.
     *
     * @param type
     *            the record type
     * @param fields
     *            the candidate fields
     * @return the created extension, or null if no extension is registered for the type
     * @throws IllegalArgumentException
     *             if the fields are not valid for the extension
     */
    @Nullable
    public static RecordExtension create(final String type, final Map<String, String> fields)
            throws IllegalArgumentException {
        final Function<Map<String, String>, ? extends RecordExtension> factory = FACTORIES
                .get(type);
        return factory == null ? null : factory.apply(fields);
    }

    private RecordExtensions() {
    }

}
