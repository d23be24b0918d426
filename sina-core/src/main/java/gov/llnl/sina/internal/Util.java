package gov.llnl.sina.internal;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.net.URL;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

import javax.annotation.Nullable;

import com.google.common.base.Throwables;
import com.google.common.io.Resources;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    public static URL getURL(final String location) {
        try {
            return Resources.getResource(location.startsWith("/") ? location.substring(1)
                    : location);
        } catch (final IllegalArgumentException ex) {
            // not a classpath resource - ignore
        }
        try {
            final File file = new File(location);
            if (file.exists() && file.isFile()) {
                return file.toURI().toURL();
            }
        } catch (final IOException ex) {
            // not a file - ignore
        }
        try {
            return new URL(location);
        } catch (final IOException ex) {
            throw new IllegalArgumentException("Cannot extract a URL from: " + location);
        }
    }

    @Nullable
    public static <T> T closeQuietly(@Nullable final T object) {
        if (object instanceof Closeable) {
            try {
                ((Closeable) object).close();
            } catch (final Throwable ex) {
                LOGGER.error("Error closing " + object.getClass().getSimpleName(), ex);
            }
        }
        return object;
    }

    /**
     * Rethrows the supplied exception unchanged if unchecked, wrapping it otherwise. Checked
     * {@code IOException}s become {@link UncheckedIOException}s so that callers can unwrap them.
     */
    public static RuntimeException propagate(final Throwable ex) {
        Throwables.throwIfUnchecked(ex);
        if (ex instanceof IOException) {
            throw new UncheckedIOException((IOException) ex);
        }
        throw new RuntimeException(ex);
    }

    public static ListeningExecutorService newPool(final int numThreads, final String nameFormat) {
        final ThreadFactory factory = new ThreadFactoryBuilder().setDaemon(true)
                .setNameFormat(nameFormat)
                .setUncaughtExceptionHandler(new UncaughtExceptionHandler() {

                    @Override
                    public void uncaughtException(final Thread thread, final Throwable ex) {
                        LOGGER.error("Uncaught exception in thread " + thread.getName(), ex);
                    }

                }).build();
        return MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(numThreads, factory));
    }

    private Util() {
    }

}
