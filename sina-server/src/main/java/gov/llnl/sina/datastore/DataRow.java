package gov.llnl.sina.datastore;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A searchable data row, as returned by backend row queries: the value of a datum for a record,
 * or the synopsis value / element of a list datum.
 */
public final class DataRow {

    private final String recordId;

    private final String name;

    private final Object value;

    @Nullable
    private final String units;

    private final List<String> tags;

    public DataRow(final String recordId, final String name, final Object value,
            @Nullable final String units, @Nullable final Iterable<String> tags) {
        this.recordId = Preconditions.checkNotNull(recordId);
        this.name = Preconditions.checkNotNull(name);
        this.value = Preconditions.checkNotNull(value);
        this.units = units;
        this.tags = tags == null ? ImmutableList.<String>of() : ImmutableList.copyOf(tags);
    }

    public String getRecordId() {
        return this.recordId;
    }

    public String getName() {
        return this.name;
    }

    /**
     * Returns the value of the row, either a {@code Double} or a {@code String}.
     */
    public Object getValue() {
        return this.value;
    }

    @Nullable
    public String getUnits() {
        return this.units;
    }

    public List<String> getTags() {
        return this.tags;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("id", this.recordId)
                .add("name", this.name).add("value", this.value).add("units", this.units)
                .toString();
    }

}
