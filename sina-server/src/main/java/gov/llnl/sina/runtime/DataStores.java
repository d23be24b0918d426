package gov.llnl.sina.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.net.URL;
import java.util.Properties;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.datastore.DataStore;
import gov.llnl.sina.datastore.LoggingDataStore;
import gov.llnl.sina.datastore.sql.SQLDataStore;
import gov.llnl.sina.internal.Util;

/**
 * Factory methods for instantiating {@code DataStore}s from configuration properties.
 * <p>
 * The implementation class is read from property {@link #PROPERTY_CLASS} (default
 * {@link SQLDataStore}) and must expose a public constructor accepting a {@link Properties}
 * object. If property {@link #PROPERTY_LOGGING} is true, the store is wrapped in a
 * {@link LoggingDataStore}. Returned stores are not initialized.
 * </p>
 */
public final class DataStores {

    public static final String PROPERTY_CLASS = "sina.datastore.class";

    public static final String PROPERTY_LOGGING = "sina.datastore.logging";

    private static final Logger LOGGER = LoggerFactory.getLogger(DataStores.class);

    /**
     * Creates a {@code DataStore} configured with the properties specified.
     *
     * @param properties
     *            the configuration properties
     * @return the created, non-initialized {@code DataStore}
     * @throws IllegalArgumentException
     *             if the configuration is not valid
     */
    public static DataStore create(final Properties properties) throws IllegalArgumentException {
        Preconditions.checkNotNull(properties);
        final String className = properties.getProperty(PROPERTY_CLASS,
                SQLDataStore.class.getName());
        final DataStore store;
        try {
            final Class<? extends DataStore> clazz = Class.forName(className).asSubclass(
                    DataStore.class);
            final Constructor<? extends DataStore> constructor = clazz
                    .getConstructor(Properties.class);
            store = constructor.newInstance(properties);
        } catch (final ClassNotFoundException | ClassCastException | NoSuchMethodException ex) {
            throw new IllegalArgumentException("Invalid DataStore class " + className + ": "
                    + ex.getMessage(), ex);
        } catch (final InvocationTargetException ex) {
            Throwables.throwIfUnchecked(ex.getCause());
            throw new IllegalArgumentException("Cannot instantiate " + className, ex.getCause());
        } catch (final ReflectiveOperationException ex) {
            throw new IllegalArgumentException("Cannot instantiate " + className, ex);
        }
        LOGGER.debug("Created {} from {}", store, className);
        return Boolean.parseBoolean(properties.getProperty(PROPERTY_LOGGING, "false"))
                ? new LoggingDataStore(store) : store;
    }

    /**
     * Creates a {@code DataStore} from a properties file, located via
     * {@link Util#getURL(String)}.
     *
     * @param location
     *            the classpath resource, file or URL of the properties file
     * @return the created, non-initialized {@code DataStore}
     * @throws IOException
     *             if the properties file cannot be read
     */
    public static DataStore load(final String location) throws IOException {
        return load(Util.getURL(location));
    }

    public static DataStore load(final URL url) throws IOException {
        final Properties properties = new Properties();
        try (InputStream stream = url.openStream()) {
            properties.load(stream);
        }
        return create(properties);
    }

    private DataStores() {
    }

}
