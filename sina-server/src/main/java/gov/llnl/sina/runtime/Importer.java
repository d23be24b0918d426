package gov.llnl.sina.runtime;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.data.Document;
import gov.llnl.sina.data.JsonCodec;
import gov.llnl.sina.datastore.DataStore;
import gov.llnl.sina.internal.Util;

/**
 * Imports JSON documents into a {@code DataStore}.
 * <p>
 * Each document is read with {@link JsonCodec#readDocument(InputStream)}; its records are
 * inserted first, then its relationships. When the store supports parallel ingestion and more
 * than one file is supplied, files are imported concurrently by a bounded pool of at most
 * {@link #MAX_THREADS} threads, and the import returns once every file has been processed.
 * </p>
 */
public final class Importer {

    /** The maximum number of threads used for parallel ingestion. */
    public static final int MAX_THREADS = 8;

    private static final Logger LOGGER = LoggerFactory.getLogger(Importer.class);

    private final DataStore store;

    public Importer(final DataStore store) {
        this.store = Preconditions.checkNotNull(store);
    }

    /**
     * Imports the supplied JSON files.
     *
     * @param files
     *            the files to import
     * @throws IOException
     *             if any file cannot be read or stored; with parallel ingestion this is thrown
     *             after all the files have been processed, reporting the first failure
     */
    public void importFiles(final Iterable<File> files) throws IOException {
        final List<File> list = ImmutableList.copyOf(files);
        final long ts = System.currentTimeMillis();
        if (!this.store.supportsParallelIngestion() || list.size() < 2) {
            LOGGER.debug("Importing {} files sequentially", list.size());
            for (final File file : list) {
                importFile(file);
            }
        } else {
            final int threads = Math.min(list.size(), MAX_THREADS);
            LOGGER.debug("Importing {} files with {} threads", list.size(), threads);
            final ListeningExecutorService pool = Util.newPool(threads, "sina-import-%d");
            try {
                final List<ListenableFuture<File>> futures = Lists.newArrayList();
                for (final File file : list) {
                    futures.add(pool.submit(new Callable<File>() {

                        @Override
                        public File call() throws IOException {
                            importFile(file);
                            return file;
                        }

                    }));
                }
                // wait for every file before reporting failures
                Futures.successfulAsList(futures).get();
                for (final ListenableFuture<File> future : futures) {
                    try {
                        future.get();
                    } catch (final ExecutionException ex) {
                        Throwables.propagateIfPossible(ex.getCause(), IOException.class);
                        throw new IOException("Import failed", ex.getCause());
                    }
                }
            } catch (final InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while importing files", ex);
            } catch (final ExecutionException ex) {
                throw new IOException("Import failed", ex.getCause());
            } finally {
                pool.shutdownNow();
            }
        }
        LOGGER.info("{} files imported in {} ms", list.size(), System.currentTimeMillis() - ts);
    }

    /**
     * Imports a single JSON file.
     *
     * @param file
     *            the file to import
     * @throws IOException
     *             if the file cannot be read or stored
     */
    public void importFile(final File file) throws IOException {
        final Document document;
        try (InputStream stream = new BufferedInputStream(new FileInputStream(file))) {
            document = JsonCodec.readDocument(stream);
        } catch (final IllegalArgumentException ex) {
            throw new IOException("Cannot parse " + file + ": " + ex.getMessage(), ex);
        }
        importDocument(document);
        LOGGER.debug("Imported {}: {} records, {} relationships", file,
                document.getRecords().size(), document.getRelationships().size());
    }

    public void importDocument(final Document document) throws IOException {
        this.store.getRecordDAO().insert(document.getRecords());
        if (!document.getRelationships().isEmpty()) {
            this.store.getRelationshipDAO().insert(document.getRelationships());
        }
    }

}
