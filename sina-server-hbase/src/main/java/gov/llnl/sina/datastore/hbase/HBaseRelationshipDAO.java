package gov.llnl.sina.datastore.hbase;

import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.FAMILY_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.META_QUA_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.OBJECT_FROM_SUBJECT_TAB_NAME;
import static gov.llnl.sina.datastore.hbase.utils.HBaseConstants.SUBJECT_FROM_OBJECT_TAB_NAME;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

import javax.annotation.Nullable;

import org.apache.hadoop.hbase.client.Delete;
import org.apache.hadoop.hbase.client.Put;
import org.apache.hadoop.hbase.client.Result;
import org.apache.hadoop.hbase.client.Scan;
import org.apache.hadoop.hbase.util.Bytes;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.data.Relationship;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.datastore.RelationshipDAO;
import gov.llnl.sina.datastore.hbase.utils.AbstractHBaseUtils;

/**
 * {@code RelationshipDAO} for {@link HBaseDataStore}.
 * <p>
 * Each relationship is stored in two tables, keyed by (subject, predicate, object, uuid) and by
 * (object, predicate, subject, uuid), so that lookups by subject or by object are prefix scans.
 * The trailing uuid keeps duplicate triples apart.
 * </p>
 */
final class HBaseRelationshipDAO implements RelationshipDAO {

    private static final Logger LOGGER = LoggerFactory.getLogger(HBaseRelationshipDAO.class);

    private static final byte[] FAMILY = Bytes.toBytes(FAMILY_NAME);

    private static final byte[] META = Bytes.toBytes(META_QUA_NAME);

    private static final byte[] EMPTY = new byte[0];

    private final AbstractHBaseUtils hbaseUtils;

    HBaseRelationshipDAO(final AbstractHBaseUtils hbaseUtils) {
        this.hbaseUtils = Preconditions.checkNotNull(hbaseUtils);
    }

    @Override
    public void insert(final Iterable<Relationship> relationships) throws IOException {
        final List<Put> bySubject = Lists.newArrayList();
        final List<Put> byObject = Lists.newArrayList();
        for (final Relationship relationship : relationships) {
            final String uuid = UUID.randomUUID().toString();
            bySubject.add(new Put(RowKeys.key(relationship.getSubject(),
                    relationship.getPredicate(), relationship.getObject(), uuid)).addColumn(
                    FAMILY, META, EMPTY));
            byObject.add(new Put(RowKeys.key(relationship.getObject(),
                    relationship.getPredicate(), relationship.getSubject(), uuid)).addColumn(
                    FAMILY, META, EMPTY));
        }
        this.hbaseUtils.put(OBJECT_FROM_SUBJECT_TAB_NAME, bySubject);
        this.hbaseUtils.put(SUBJECT_FROM_OBJECT_TAB_NAME, byObject);
    }

    @Override
    public Stream<Relationship> get(@Nullable final String subject,
            @Nullable final String predicate, @Nullable final String object) throws IOException {
        Preconditions.checkArgument(subject != null || predicate != null || object != null,
                "At least one of subject, predicate and object must be specified");
        if (subject != null) {
            return scan(OBJECT_FROM_SUBJECT_TAB_NAME, false, subject, predicate, object);
        } else if (object != null) {
            return scan(SUBJECT_FROM_OBJECT_TAB_NAME, true, object, predicate, null);
        }
        LOGGER.warn("{} - full scan of {} for predicate {}", this, OBJECT_FROM_SUBJECT_TAB_NAME,
                predicate);
        return scan(OBJECT_FROM_SUBJECT_TAB_NAME, false, null, predicate, null);
    }

    /**
     * Scans one of the two tables, using as much of the supplied key components as possible as
     * prefix and filtering on the remaining ones.
     */
    private Stream<Relationship> scan(final String table, final boolean inverted,
            @Nullable final String first, @Nullable final String predicate,
            @Nullable final String last) throws IOException {
        final Scan scan = new Scan();
        if (first != null) {
            final byte[] prefix = predicate == null ? RowKeys.key(first)
                    : last == null ? RowKeys.key(first, predicate) : RowKeys.key(first,
                            predicate, last);
            scan.withStartRow(prefix).withStopRow(RowKeys.stopRowForPrefix(prefix));
        }
        return this.hbaseUtils.scan(table, scan).transform(new Function<Result, Relationship>() {

            @Override
            public Relationship apply(final Result result) {
                final List<Object> key = RowKeys.decode(result.getRow());
                return inverted ? new Relationship((String) key.get(2), (String) key.get(1),
                        (String) key.get(0)) : new Relationship((String) key.get(0),
                        (String) key.get(1), (String) key.get(2));
            }

        }).filter(new Predicate<Relationship>() {

            @Override
            public boolean apply(final Relationship relationship) {
                return predicate == null || relationship.getPredicate().equals(predicate);
            }

        });
    }

    @Override
    public void delete(final Relationship relationship) throws IOException {
        final List<Delete> bySubject = Lists.newArrayList();
        final List<Delete> byObject = Lists.newArrayList();
        collect(OBJECT_FROM_SUBJECT_TAB_NAME, RowKeys.key(relationship.getSubject(),
                relationship.getPredicate(), relationship.getObject()), bySubject, byObject);
        this.hbaseUtils.delete(OBJECT_FROM_SUBJECT_TAB_NAME, bySubject);
        this.hbaseUtils.delete(SUBJECT_FROM_OBJECT_TAB_NAME, byObject);
    }

    /**
     * Deletes every relationship having one of the record ids specified as subject or object.
     */
    void deleteInvolving(final Iterable<String> ids) throws IOException {
        final List<Delete> bySubject = Lists.newArrayList();
        final List<Delete> byObject = Lists.newArrayList();
        for (final String id : ids) {
            collect(OBJECT_FROM_SUBJECT_TAB_NAME, RowKeys.key(id), bySubject, byObject);
            collect(SUBJECT_FROM_OBJECT_TAB_NAME, RowKeys.key(id), byObject, bySubject);
        }
        this.hbaseUtils.delete(OBJECT_FROM_SUBJECT_TAB_NAME, bySubject);
        this.hbaseUtils.delete(SUBJECT_FROM_OBJECT_TAB_NAME, byObject);
    }

    /**
     * Collects the deletes for the rows of a table starting with the prefix specified, together
     * with the deletes of their mirror rows in the other table.
     */
    private void collect(final String table, final byte[] prefix, final List<Delete> deletes,
            final List<Delete> mirrorDeletes) throws IOException {
        try (Stream<Result> stream = this.hbaseUtils.scan(table, new Scan().withStartRow(prefix)
                .withStopRow(RowKeys.stopRowForPrefix(prefix)))) {
            for (final Result result : stream) {
                final List<Object> key = RowKeys.decode(result.getRow());
                deletes.add(new Delete(result.getRow()));
                mirrorDeletes.add(new Delete(RowKeys.key(key.get(2), key.get(1), key.get(0),
                        key.get(3))));
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

}
