package gov.llnl.sina.data;

import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/**
 * A uniquely identified, typed container of data, files and curve sets.
 * <p>
 * A {@code Record} is an immutable snapshot identified by its {@link #getId() id}, which never
 * changes once assigned. Besides its {@link #getType() type}, a record owns:
 * <ul>
 * <li>a map of named {@link Datum}s, the only content that can be searched by the query
 * engine;</li>
 * <li>a map of {@link FileEntry}s keyed by URI, searchable by URI;</li>
 * <li>a map of named {@link CurveSet}s;</li>
 * <li>optional {@code library_data} and {@code user_defined} JSON trees, stored but never
 * indexed;</li>
 * <li>an optional {@link RecordExtension} holding type-specific metadata (e.g.,
 * {@link RunExtension} for records of type {@code run}).</li>
 * </ul>
 * </p>
 * <p>
 * Use {@link #builder(String, String)} to create instances and {@link #toBuilder()} to derive
 * modified copies.
 * </p>
 */
public final class Record {

    private final String id;

    private final String type;

    private final ImmutableMap<String, Datum> data;

    private final ImmutableMap<String, FileEntry> files;

    private final ImmutableMap<String, CurveSet> curveSets;

    @Nullable
    private final JsonNode libraryData;

    @Nullable
    private final JsonNode userDefined;

    @Nullable
    private final RecordExtension extension;

    private Record(final Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.data = ImmutableMap.copyOf(builder.data);
        this.files = ImmutableMap.copyOf(builder.files);
        this.curveSets = ImmutableMap.copyOf(builder.curveSets);
        this.libraryData = builder.libraryData;
        this.userDefined = builder.userDefined;
        this.extension = builder.extension;
    }

    public static Builder builder(final String id, final String type) {
        return new Builder(id, type);
    }

    public Builder toBuilder() {
        final Builder builder = new Builder(this.id, this.type);
        builder.data.putAll(this.data);
        builder.files.putAll(this.files);
        builder.curveSets.putAll(this.curveSets);
        builder.libraryData = this.libraryData;
        builder.userDefined = this.userDefined;
        builder.extension = this.extension;
        return builder;
    }

    public String getId() {
        return this.id;
    }

    public String getType() {
        return this.type;
    }

    public Map<String, Datum> getData() {
        return this.data;
    }

    @Nullable
    public Datum getDatum(final String name) {
        return this.data.get(name);
    }

    public Map<String, FileEntry> getFiles() {
        return this.files;
    }

    public Map<String, CurveSet> getCurveSets() {
        return this.curveSets;
    }

    @Nullable
    public JsonNode getLibraryData() {
        return this.libraryData;
    }

    @Nullable
    public JsonNode getUserDefined() {
        return this.userDefined;
    }

    @Nullable
    public RecordExtension getExtension() {
        return this.extension;
    }

    /**
     * Returns the extension of this record if it is an instance of the class specified.
     *
     * @param extensionClass
     *            the expected extension class
     * @param <E>
     *            the type of extension
     * @return the extension, or null if missing or of a different class
     */
    @Nullable
    public <E extends RecordExtension> E getExtension(final Class<E> extensionClass) {
        return extensionClass.isInstance(this.extension) ? extensionClass.cast(this.extension)
                : null;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Record)) {
            return false;
        }
        final Record other = (Record) object;
        return this.id.equals(other.id) && this.type.equals(other.type)
                && this.data.equals(other.data) && this.files.equals(other.files)
                && this.curveSets.equals(other.curveSets)
                && Objects.equals(this.libraryData, other.libraryData)
                && Objects.equals(this.userDefined, other.userDefined)
                && Objects.equals(this.extension, other.extension);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.type, this.data, this.files);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("id", this.id).add("type", this.type)
                .add("data", this.data.size()).add("files", this.files.size())
                .add("curve_sets", this.curveSets.size()).toString();
    }

    public static final class Builder {

        private final String id;

        private final String type;

        private final Map<String, Datum> data = Maps.newLinkedHashMap();

        private final Map<String, FileEntry> files = Maps.newLinkedHashMap();

        private final Map<String, CurveSet> curveSets = Maps.newLinkedHashMap();

        @Nullable
        private JsonNode libraryData;

        @Nullable
        private JsonNode userDefined;

        @Nullable
        private RecordExtension extension;

        Builder(final String id, final String type) {
            Preconditions.checkArgument(!id.isEmpty(), "Empty record id");
            Preconditions.checkArgument(!type.isEmpty(), "Empty type for record %s", id);
            this.id = id;
            this.type = type;
        }

        public Builder datum(final String name, final Datum datum) {
            Preconditions.checkArgument(!name.isEmpty(), "Empty datum name");
            this.data.put(name, Preconditions.checkNotNull(datum));
            return this;
        }

        public Builder datum(final String name, final Object value) {
            return datum(name, Datum.of(value, null, null));
        }

        public Builder removeDatum(final String name) {
            this.data.remove(name);
            return this;
        }

        public Builder file(final FileEntry file) {
            this.files.put(file.getURI(), file);
            return this;
        }

        public Builder file(final String uri) {
            return file(new FileEntry(uri, null, null));
        }

        public Builder curveSet(final CurveSet curveSet) {
            this.curveSets.put(curveSet.getName(), curveSet);
            return this;
        }

        public Builder libraryData(@Nullable final JsonNode libraryData) {
            this.libraryData = libraryData;
            return this;
        }

        public Builder userDefined(@Nullable final JsonNode userDefined) {
            this.userDefined = userDefined;
            return this;
        }

        public Builder extension(@Nullable final RecordExtension extension) {
            this.extension = extension;
            return this;
        }

        public Record build() {
            return new Record(this);
        }

    }

}
