package gov.llnl.sina.runtime;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gov.llnl.sina.data.Datum;
import gov.llnl.sina.datastore.DataStore;

/**
 * Exports the values of selected data of selected records as CSV.
 * <p>
 * The output has a header row {@code id,name1,name2,...} followed by one row per record having
 * at least one of the requested data, in the order the ids were supplied. Missing values are
 * written as empty cells, and list values in the form {@code [a, b, c]}. Cells are quoted as
 * per RFC 4180 when they contain commas, quotes or line breaks.
 * </p>
 */
public final class Exporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(Exporter.class);

    private static final Joiner JOINER = Joiner.on(',');

    private final DataStore store;

    public Exporter(final DataStore store) {
        this.store = Preconditions.checkNotNull(store);
    }

    /**
     * Writes the CSV export of the records and data specified.
     *
     * @param ids
     *            the record ids
     * @param names
     *            the data names, defining the columns after the id
     * @param writer
     *            the writer to write to, not closed by this method
     * @return the number of rows written, excluding the header
     * @throws IOException
     *             on failure, including if any record is not stored
     */
    public int exportCSV(final List<String> ids, final List<String> names, final Writer writer)
            throws IOException {
        Preconditions.checkArgument(!names.isEmpty(), "No data names to export");
        LOGGER.debug("Exporting {} data for {} records", names.size(), ids.size());
        final Map<String, Map<String, Datum>> data = this.store.getRecordDAO()
                .getDataForRecords(ids, names);
        final List<String> header = Lists.newArrayList("id");
        header.addAll(names);
        writeRow(writer, header);
        int rows = 0;
        for (final String id : ids) {
            final Map<String, Datum> values = data.get(id);
            if (values == null || values.isEmpty()) {
                continue;
            }
            final List<String> row = Lists.newArrayList(id);
            for (final String name : names) {
                final Datum datum = values.get(name);
                row.add(datum == null ? "" : format(datum.getValue()));
            }
            writeRow(writer, row);
            ++rows;
        }
        writer.flush();
        LOGGER.info("Exported {} rows", rows);
        return rows;
    }

    private static String format(final Object value) {
        if (value instanceof List<?>) {
            final List<String> elements = Lists.newArrayList();
            for (final Object element : (List<?>) value) {
                elements.add(format(element));
            }
            return "[" + Joiner.on(", ").join(elements) + "]";
        }
        return value.toString();
    }

    private static void writeRow(final Writer writer, final List<String> cells)
            throws IOException {
        final List<String> escaped = Lists.newArrayListWithCapacity(cells.size());
        for (final String cell : cells) {
            escaped.add(escape(cell));
        }
        writer.write(JOINER.join(escaped));
        writer.write("\r\n");
    }

    static String escape(final String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0 && cell.indexOf('\n') < 0
                && cell.indexOf('\r') < 0) {
            return cell;
        }
        return "\"" + cell.replace("\"", "\"\"") + "\"";
    }

}
