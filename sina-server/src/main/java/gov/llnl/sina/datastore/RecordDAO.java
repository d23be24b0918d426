package gov.llnl.sina.datastore;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import gov.llnl.sina.data.Datum;
import gov.llnl.sina.data.Record;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.query.DataRange;
import gov.llnl.sina.query.EmptyQueryException;
import gov.llnl.sina.query.ListCriterion;
import gov.llnl.sina.query.UniversalCriterion;
import gov.llnl.sina.query.UnsupportedQueryException;

/**
 * Access to stored records, their data and the queries over them.
 * <p>
 * Queries return lazy, single-pass {@code Stream}s of record ids, which must be closed (or
 * exhausted) to release the underlying backend resources. Validation errors are raised before
 * any backend access; a query matching nothing returns an empty stream.
 * </p>
 */
public interface RecordDAO {

    /**
     * Inserts new records, storing their data, files and curve sets.
     *
     * @param records
     *            the records to insert
     * @throws RecordExistsException
     *             if a record with the same id is already stored
     * @throws IOException
     *             in case of backend failure
     */
    void insert(Iterable<Record> records) throws RecordExistsException, IOException;

    /**
     * Replaces stored records with the supplied ones, matching them by id. Data, files and curve
     * sets are replaced; relationships involving the records are kept.
     *
     * @param records
     *            the new versions of the records
     * @throws NotInsertedException
     *             if a record was never inserted
     * @throws IOException
     *             in case of backend failure
     */
    void update(Iterable<Record> records) throws NotInsertedException, IOException;

    /**
     * Deletes records together with their data, files, curve sets and the relationships they
     * participate in. Ids not stored are ignored.
     *
     * @param ids
     *            the ids of the records to delete
     * @throws IOException
     *             in case of backend failure
     */
    void delete(Iterable<String> ids) throws IOException;

    Record get(String id) throws RecordNotFoundException, IOException;

    /**
     * Retrieves the records with the ids specified, in the order of the ids.
     *
     * @param ids
     *            the ids of the records
     * @return a stream of records
     * @throws RecordNotFoundException
     *             if any of the ids is not stored, checked before returning the stream
     * @throws IOException
     *             in case of backend failure
     */
    Stream<Record> get(Collection<String> ids) throws RecordNotFoundException, IOException;

    /**
     * Checks which of the ids specified are stored.
     *
     * @return a list of flags, in the order of the supplied ids
     */
    List<Boolean> exist(Iterable<String> ids) throws IOException;

    /**
     * Returns the ids of records satisfying every supplied criterion. Each criterion is
     * associated to a datum name and can be a number, a string, a {@link DataRange}, a
     * {@link ListCriterion} or {@link UniversalCriterion#EXISTS}.
     *
     * @param criteria
     *            the criteria, not empty
     * @return a stream with the distinct ids of matching records
     * @throws EmptyQueryException
     *             if no criteria are supplied
     * @throws UnsupportedQueryException
     *             if a list operation cannot be evaluated by the backend
     * @throws IOException
     *             in case of backend failure
     */
    Stream<String> dataQuery(Map<String, ?> criteria) throws IOException;

    /**
     * Returns the ids of records whose list datum {@code name} satisfies the criterion.
     */
    Stream<String> getList(String name, ListCriterion criterion) throws IOException;

    /**
     * Returns the ids of the records with the {@code count} highest values of scalar datum
     * {@code name}, highest first.
     */
    Stream<String> getWithMax(String name, int count) throws IOException;

    /**
     * Returns the ids of the records with the {@code count} lowest values of scalar datum
     * {@code name}, lowest first.
     */
    Stream<String> getWithMin(String name, int count) throws IOException;

    /**
     * Returns the ids of records associated to a file with the URI specified.
     *
     * @param uri
     *            the URI, where {@code %} matches any sequence of characters
     * @param acceptedIds
     *            if not null, restricts the result to these ids
     * @return a stream with the distinct ids of matching records
     * @throws IOException
     *             in case of backend failure
     */
    Stream<String> getGivenDocumentUri(String uri, @Nullable Collection<String> acceptedIds)
            throws IOException;

    /**
     * Returns the ids of records associated to at least one file with the MIME type specified.
     *
     * @param mimeType
     *            the MIME type, matched exactly
     * @param acceptedIds
     *            if not null, restricts the result to these ids
     * @return a stream with the distinct ids of matching records
     * @throws IOException
     *             in case of backend failure
     */
    Stream<String> getWithMimeType(String mimeType, @Nullable Collection<String> acceptedIds)
            throws IOException;

    /**
     * Returns the ids of records having a curve set with the name specified.
     */
    Stream<String> getWithCurveSet(String curveSetName) throws IOException;

    /**
     * Returns the names of all the curve sets stored.
     */
    Set<String> getCurveSetNames() throws IOException;

    /**
     * Returns the names of the data of records of the type specified, optionally restricted to
     * some kinds of data. Names only used for empty lists are not returned.
     *
     * @param type
     *            the record type
     * @param kinds
     *            the kinds of data to consider, null for all of them
     * @return the distinct datum names
     * @throws IOException
     *             in case of backend failure
     */
    Set<String> getDataNames(String type, @Nullable Collection<Datum.Kind> kinds)
            throws IOException;

    Stream<String> getAllOfType(String type) throws IOException;

    Set<String> getAvailableTypes() throws IOException;

    Stream<String> getAll() throws IOException;

    /**
     * Returns the data of the records specified, optionally restricted to some datum names.
     * Records without any of the requested data are mapped to an empty map.
     *
     * @param ids
     *            the record ids
     * @param names
     *            the datum names to return, null for all of them
     * @return a map from record ids to maps from datum names to data
     * @throws RecordNotFoundException
     *             if any of the ids is not stored
     * @throws IOException
     *             in case of backend failure
     */
    Map<String, Map<String, Datum>> getDataForRecords(Collection<String> ids,
            @Nullable Collection<String> names) throws RecordNotFoundException, IOException;

}
