package gov.llnl.sina.datastore;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;

import gov.llnl.sina.data.Relationship;
import gov.llnl.sina.data.Stream;

/**
 * A {@code RelationshipDAO} forwarding all its method calls to another {@code RelationshipDAO}.
 */
public abstract class ForwardingRelationshipDAO extends ForwardingObject implements
        RelationshipDAO {

    @Override
    protected abstract RelationshipDAO delegate();

    @Override
    public void insert(final Iterable<Relationship> relationships) throws IOException {
        delegate().insert(relationships);
    }

    @Override
    public Stream<Relationship> get(@Nullable final String subject,
            @Nullable final String predicate, @Nullable final String object) throws IOException {
        return delegate().get(subject, predicate, object);
    }

    @Override
    public void delete(final Relationship relationship) throws IOException {
        delegate().delete(relationship);
    }

}
