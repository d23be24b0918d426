package gov.llnl.sina.datastore;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;

import gov.llnl.sina.data.Datum;
import gov.llnl.sina.data.Record;
import gov.llnl.sina.data.Stream;
import gov.llnl.sina.query.ListCriterion;

/**
 * A {@code RecordDAO} forwarding all its method calls to another {@code RecordDAO}.
 */
public abstract class ForwardingRecordDAO extends ForwardingObject implements RecordDAO {

    @Override
    protected abstract RecordDAO delegate();

    @Override
    public void insert(final Iterable<Record> records) throws IOException {
        delegate().insert(records);
    }

    @Override
    public void update(final Iterable<Record> records) throws IOException {
        delegate().update(records);
    }

    @Override
    public void delete(final Iterable<String> ids) throws IOException {
        delegate().delete(ids);
    }

    @Override
    public Record get(final String id) throws IOException {
        return delegate().get(id);
    }

    @Override
    public Stream<Record> get(final Collection<String> ids) throws IOException {
        return delegate().get(ids);
    }

    @Override
    public List<Boolean> exist(final Iterable<String> ids) throws IOException {
        return delegate().exist(ids);
    }

    @Override
    public Stream<String> dataQuery(final Map<String, ?> criteria) throws IOException {
        return delegate().dataQuery(criteria);
    }

    @Override
    public Stream<String> getList(final String name, final ListCriterion criterion)
            throws IOException {
        return delegate().getList(name, criterion);
    }

    @Override
    public Stream<String> getWithMax(final String name, final int count) throws IOException {
        return delegate().getWithMax(name, count);
    }

    @Override
    public Stream<String> getWithMin(final String name, final int count) throws IOException {
        return delegate().getWithMin(name, count);
    }

    @Override
    public Stream<String> getGivenDocumentUri(final String uri,
            @Nullable final Collection<String> acceptedIds) throws IOException {
        return delegate().getGivenDocumentUri(uri, acceptedIds);
    }

    @Override
    public Stream<String> getAllOfType(final String type) throws IOException {
        return delegate().getAllOfType(type);
    }

    @Override
    public Stream<String> getWithMimeType(final String mimeType,
            @Nullable final Collection<String> acceptedIds) throws IOException {
        return delegate().getWithMimeType(mimeType, acceptedIds);
    }

    @Override
    public Stream<String> getWithCurveSet(final String curveSetName) throws IOException {
        return delegate().getWithCurveSet(curveSetName);
    }

    @Override
    public Set<String> getCurveSetNames() throws IOException {
        return delegate().getCurveSetNames();
    }

    @Override
    public Set<String> getDataNames(final String type,
            @Nullable final Collection<Datum.Kind> kinds) throws IOException {
        return delegate().getDataNames(type, kinds);
    }

    @Override
    public Set<String> getAvailableTypes() throws IOException {
        return delegate().getAvailableTypes();
    }

    @Override
    public Stream<String> getAll() throws IOException {
        return delegate().getAll();
    }

    @Override
    public Map<String, Map<String, Datum>> getDataForRecords(final Collection<String> ids,
            @Nullable final Collection<String> names) throws IOException {
        return delegate().getDataForRecords(ids, names);
    }

}
