package gov.llnl.sina.data;

import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Metadata of records of type {@code run}: the application that produced the run, and the
 * optional user and application version.
 */
public final class RunExtension implements RecordExtension {

    public static final String TYPE = "run";

    public static final String APPLICATION = "application";

    public static final String USER = "user";

    public static final String VERSION = "version";

    private final String application;

    @Nullable
    private final String user;

    @Nullable
    private final String version;

    public RunExtension(final String application, @Nullable final String user,
            @Nullable final String version) {
        Preconditions.checkArgument(!application.isEmpty(), "Empty application");
        this.application = application;
        this.user = user;
        this.version = version;
    }

    static RunExtension fromFields(final Map<String, String> fields) {
        final String application = fields.get(APPLICATION);
        Preconditions.checkArgument(application != null, "Missing '%s' for run", APPLICATION);
        return new RunExtension(application, fields.get(USER), fields.get(VERSION));
    }

    public String getApplication() {
        return this.application;
    }

    @Nullable
    public String getUser() {
        return this.user;
    }

    @Nullable
    public String getVersion() {
        return this.version;
    }

    @Override
    public Map<String, String> getFields() {
        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        builder.put(APPLICATION, this.application);
        if (this.user != null) {
            builder.put(USER, this.user);
        }
        if (this.version != null) {
            builder.put(VERSION, this.version);
        }
        return builder.build();
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof RunExtension)) {
            return false;
        }
        final RunExtension other = (RunExtension) object;
        return this.application.equals(other.application)
                && Objects.equals(this.user, other.user)
                && Objects.equals(this.version, other.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.application, this.user, this.version);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues()
                .add(APPLICATION, this.application).add(USER, this.user)
                .add(VERSION, this.version).toString();
    }

}
