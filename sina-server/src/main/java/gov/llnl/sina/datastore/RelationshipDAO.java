package gov.llnl.sina.datastore;

import java.io.IOException;

import javax.annotation.Nullable;

import gov.llnl.sina.data.Relationship;
import gov.llnl.sina.data.Stream;

/**
 * Access to the subject / predicate / object relationships linking records.
 */
public interface RelationshipDAO {

    void insert(Iterable<Relationship> relationships) throws IOException;

    /**
     * Returns the stored relationships matching the supplied components. At least one
     * component must be specified.
     *
     * @param subject
     *            the subject id, null for any
     * @param predicate
     *            the predicate, null for any
     * @param object
     *            the object id, null for any
     * @return a stream of matching relationships
     * @throws IllegalArgumentException
     *             if no component is specified
     * @throws IOException
     *             in case of backend failure
     */
    Stream<Relationship> get(@Nullable String subject, @Nullable String predicate,
            @Nullable String object) throws IllegalArgumentException, IOException;

    /**
     * Deletes every stored copy of the relationship specified.
     */
    void delete(Relationship relationship) throws IOException;

}
