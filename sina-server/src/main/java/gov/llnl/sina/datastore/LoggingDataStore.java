package gov.llnl.sina.datastore;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.data.Record;
import gov.llnl.sina.data.Relationship;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.query.ListCriterion;

/**
 * A {@code DataStore} wrapper that logs calls to the operations of a wrapped {@code DataStore},
 * of its DAOs, and their execution times.
 * <p>
 * Request information and execution times are logged via SLF4J (level DEBUG, logger named after
 * this class). Result streams are tracked so that the number of returned elements and whether
 * they were consumed to the end are logged when the stream is closed. The overhead introduced
 * when logging is disabled is negligible.
 * </p>
 */
public final class LoggingDataStore extends ForwardingDataStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingDataStore.class);

    private final DataStore delegate;

    /**
     * Creates a new instance for the wrapped {@code DataStore} specified.
     *
     * @param delegate
     *            the wrapped {@code DataStore}
     */
    public LoggingDataStore(final DataStore delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    protected DataStore delegate() {
        return this.delegate;
    }

    @Override
    public void init() throws IOException {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.init();
            LOGGER.debug("{} - initialized in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.init();
        }
    }

    @Override
    public RecordDAO getRecordDAO() throws IllegalStateException {
        final RecordDAO dao = super.getRecordDAO();
        return LOGGER.isDebugEnabled() ? new LoggingRecordDAO(dao) : dao;
    }

    @Override
    public RelationshipDAO getRelationshipDAO() throws IllegalStateException {
        final RelationshipDAO dao = super.getRelationshipDAO();
        return LOGGER.isDebugEnabled() ? new LoggingRelationshipDAO(dao) : dao;
    }

    @Override
    public void close() {

        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.close();
        }
    }

    private static <T> Stream<T> logClose(final Object caller, final Stream<T> stream,
            final String name, final long ts) {
        LOGGER.debug("{} - {} obtained in {} ms", caller, name, System.currentTimeMillis() - ts);
        final AtomicLong count = new AtomicLong(0);
        final AtomicBoolean eof = new AtomicBoolean(false);
        return stream.track(count, eof).onClose(new Runnable() {

            @Override
            public void run() {
                LOGGER.debug("{} - {} closed after {} ms, {} results, eof={}", caller, name,
                        System.currentTimeMillis() - ts, count, eof);
            }

        });
    }

    private static final class LoggingRecordDAO extends ForwardingRecordDAO {

        private final RecordDAO delegate;

        LoggingRecordDAO(final RecordDAO delegate) {
            this.delegate = Preconditions.checkNotNull(delegate);
        }

        @Override
        protected RecordDAO delegate() {
            return this.delegate;
        }

        @Override
        public void insert(final Iterable<Record> records) throws IOException {
            final long ts = System.currentTimeMillis();
            super.insert(records);
            LOGGER.debug("{} - {} records inserted in {} ms", this, Iterables.size(records),
                    System.currentTimeMillis() - ts);
        }

        @Override
        public void update(final Iterable<Record> records) throws IOException {
            final long ts = System.currentTimeMillis();
            super.update(records);
            LOGGER.debug("{} - {} records updated in {} ms", this, Iterables.size(records),
                    System.currentTimeMillis() - ts);
        }

        @Override
        public void delete(final Iterable<String> ids) throws IOException {
            final long ts = System.currentTimeMillis();
            super.delete(ids);
            LOGGER.debug("{} - records {} deleted in {} ms", this, ids,
                    System.currentTimeMillis() - ts);
        }

        @Override
        public Stream<Record> get(final Collection<String> ids) throws IOException {
            final long ts = System.currentTimeMillis();
            return logClose(this, super.get(ids), "get() result stream for " + ids.size()
                    + " ids", ts);
        }

        @Override
        public Stream<String> dataQuery(final Map<String, ?> criteria) throws IOException {
            final long ts = System.currentTimeMillis();
            return logClose(this, super.dataQuery(criteria), "dataQuery() result stream for "
                    + criteria, ts);
        }

        @Override
        public Stream<String> getList(final String name, final ListCriterion criterion)
                throws IOException {
            final long ts = System.currentTimeMillis();
            return logClose(this, super.getList(name, criterion), "getList() result stream for "
                    + name + " " + criterion, ts);
        }

        @Override
        public Stream<String> getWithMax(final String name, final int count) throws IOException {
            final long ts = System.currentTimeMillis();
            return logClose(this, super.getWithMax(name, count), "getWithMax() result stream for "
                    + name + ", " + count, ts);
        }

        @Override
        public Stream<String> getWithMin(final String name, final int count) throws IOException {
            final long ts = System.currentTimeMillis();
            return logClose(this, super.getWithMin(name, count), "getWithMin() result stream for "
                    + name + ", " + count, ts);
        }

        @Override
        public Stream<String> getGivenDocumentUri(final String uri,
                @Nullable final Collection<String> acceptedIds) throws IOException {
            final long ts = System.currentTimeMillis();
            return logClose(this, super.getGivenDocumentUri(uri, acceptedIds),
                    "getGivenDocumentUri() result stream for " + uri, ts);
        }

        @Override
        public String toString() {
            return "Logging" + this.delegate;
        }

    }

    private static final class LoggingRelationshipDAO extends ForwardingRelationshipDAO {

        private final RelationshipDAO delegate;

        LoggingRelationshipDAO(final RelationshipDAO delegate) {
            this.delegate = Preconditions.checkNotNull(delegate);
        }

        @Override
        protected RelationshipDAO delegate() {
            return this.delegate;
        }

        @Override
        public void insert(final Iterable<Relationship> relationships) throws IOException {
            final long ts = System.currentTimeMillis();
            super.insert(relationships);
            LOGGER.debug("{} - {} relationships inserted in {} ms", this,
                    Iterables.size(relationships), System.currentTimeMillis() - ts);
        }

        @Override
        public Stream<Relationship> get(@Nullable final String subject,
                @Nullable final String predicate, @Nullable final String object)
                throws IOException {
            final long ts = System.currentTimeMillis();
            return logClose(this, super.get(subject, predicate, object), "get() result stream "
                    + "for (" + subject + ", " + predicate + ", " + object + ")", ts);
        }

        @Override
        public String toString() {
            return "Logging" + this.delegate;
        }

    }

}
