package gov.llnl.sina.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * A Sina server-side component with an explicit lifecycle.
 * <p>
 * A {@code Component} is created from a set of key/value properties, from which it configures
 * itself without allocating any resource; configuration errors are reported at this stage with
 * an {@code IllegalArgumentException}. Method {@link #init()} then makes the component
 * operational, e.g., by opening connections and creating missing storage structures, and
 * {@link #close()} releases any allocated resource. {@code close()} can be called at any time
 * after instantiation, even before {@code init()}, and calling it multiple times has no effect.
 * </p>
 * <p>
 * Components access external storage, hence their methods may throw {@link IOException}s. As a
 * special kind of {@code IOException}, a {@link DataCorruptedException} signals that persisted
 * data is missing or damaged.
 * </p>
 */
public interface Component extends Closeable {

    /**
     * Initializes the {@code Component}, making it operational.
     *
     * @throws IOException
     *             in case initialization fails
     * @throws IllegalStateException
     *             in case the component has already been initialized or closed
     */
    void init() throws IOException, IllegalStateException;

    /**
     * Closes the {@code Component}, releasing any resource allocated to it. Stored data is not
     * affected.
     */
    @Override
    void close();

}
