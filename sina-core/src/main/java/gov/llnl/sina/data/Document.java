package gov.llnl.sina.data;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The content of a JSON document: records and the relationships among them, with all local ids
 * already resolved to global ids.
 */
public final class Document {

    private final ImmutableList<Record> records;

    private final ImmutableList<Relationship> relationships;

    public Document(final Iterable<Record> records, final Iterable<Relationship> relationships) {
        this.records = ImmutableList.copyOf(records);
        this.relationships = ImmutableList.copyOf(relationships);
    }

    public List<Record> getRecords() {
        return this.records;
    }

    public List<Relationship> getRelationships() {
        return this.relationships;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("records", this.records.size())
                .add("relationships", this.relationships.size()).toString();
    }

}
