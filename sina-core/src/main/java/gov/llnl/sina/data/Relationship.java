package gov.llnl.sina.data;

import java.io.Serializable;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * An immutable subject-predicate-object triple linking two record ids.
 * <p>
 * Storage does not enforce uniqueness: the same triple can be stored several times and every
 * copy is returned by queries.
 * </p>
 */
public final class Relationship implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String subject;

    private final String predicate;

    private final String object;

    public Relationship(final String subject, final String predicate, final String object) {
        Preconditions.checkArgument(!subject.isEmpty(), "Empty subject");
        Preconditions.checkArgument(!predicate.isEmpty(), "Empty predicate");
        Preconditions.checkArgument(!object.isEmpty(), "Empty object");
        this.subject = subject;
        this.predicate = predicate;
        this.object = object;
    }

    public String getSubject() {
        return this.subject;
    }

    public String getPredicate() {
        return this.predicate;
    }

    public String getObject() {
        return this.object;
    }

    @Override
    public boolean equals(final Object other) {
        if (other == this) {
            return true;
        }
        if (!(other instanceof Relationship)) {
            return false;
        }
        final Relationship r = (Relationship) other;
        return this.subject.equals(r.subject) && this.predicate.equals(r.predicate)
                && this.object.equals(r.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.subject, this.predicate, this.object);
    }

    @Override
    public String toString() {
        return "(" + this.subject + " " + this.predicate + " " + this.object + ")";
    }

}
