package gov.llnl.sina.data;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A file associated to a {@link Record}, identified by its URI.
 */
public final class FileEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String uri;

    @Nullable
    private final String mimeType;

    private final ImmutableList<String> tags;

    public FileEntry(final String uri, @Nullable final String mimeType,
            @Nullable final Iterable<String> tags) {
        Preconditions.checkArgument(!uri.isEmpty(), "Empty file URI");
        this.uri = uri;
        this.mimeType = mimeType;
        this.tags = tags == null ? ImmutableList.<String>of() : ImmutableList.copyOf(tags);
    }

    public String getURI() {
        return this.uri;
    }

    @Nullable
    public String getMimeType() {
        return this.mimeType;
    }

    public List<String> getTags() {
        return this.tags;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof FileEntry)) {
            return false;
        }
        final FileEntry other = (FileEntry) object;
        return this.uri.equals(other.uri) && Objects.equals(this.mimeType, other.mimeType)
                && this.tags.equals(other.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.uri, this.mimeType, this.tags);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("uri", this.uri)
                .add("mimetype", this.mimeType).toString();
    }

}
