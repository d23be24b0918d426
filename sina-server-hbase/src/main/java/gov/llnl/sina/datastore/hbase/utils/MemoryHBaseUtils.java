package gov.llnl.sina.datastore.hbase.utils;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.Properties;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;

import javax.annotation.Nullable;

import org.apache.hadoop.hbase.Cell;
import org.apache.hadoop.hbase.CellBuilderFactory;
import org.apache.hadoop.hbase.CellBuilderType;
import org.apache.hadoop.hbase.CellUtil;
import org.apache.hadoop.hbase.client.Delete;
import org.apache.hadoop.hbase.client.Get;
import org.apache.hadoop.hbase.client.Put;
import org.apache.hadoop.hbase.client.Result;
import org.apache.hadoop.hbase.client.Scan;
import org.apache.hadoop.hbase.util.Bytes;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import gov.llnl.sina.data.Stream;

/**
 * {@code AbstractHBaseUtils} keeping tables in memory, with the semantics of the HBase client
 * API for the operations used by the data store.
 * <p>
 * Each table is a sorted map from row keys to sorted maps from qualifiers to values, ordered by
 * {@link Bytes#BYTES_COMPARATOR}; column families and timestamps are not modeled. Scans are
 * evaluated over a snapshot of the rows in range. This layer is meant for tests and local,
 * single-process usage.
 * </p>
 */
public class MemoryHBaseUtils extends AbstractHBaseUtils {

    private final ConcurrentMap<String, ConcurrentSkipListMap<byte[], NavigableMap<byte[], byte[]>>> tables;

    private final Map<String, byte[]> families;

    public MemoryHBaseUtils(final Properties properties) {
        super(properties);
        this.tables = Maps.newConcurrentMap();
        this.families = Maps.newConcurrentMap();
    }

    @Override
    public void init() {
        LOGGER.debug("MEMORY layer initialized");
    }

    @Override
    public void checkAndCreateTable(final String tableName, final String familyName) {
        final String name = getTableName(tableName);
        this.families.putIfAbsent(name, Bytes.toBytes(familyName));
        this.tables.putIfAbsent(name,
                new ConcurrentSkipListMap<byte[], NavigableMap<byte[], byte[]>>(
                        Bytes.BYTES_COMPARATOR));
    }

    private ConcurrentSkipListMap<byte[], NavigableMap<byte[], byte[]>> getTable(
            final String tableName) throws IOException {
        final ConcurrentSkipListMap<byte[], NavigableMap<byte[], byte[]>> table = this.tables
                .get(getTableName(tableName));
        if (table == null) {
            throw new IOException("No table " + getTableName(tableName));
        }
        return table;
    }

    @Override
    public void put(final String tableName, final List<Put> puts) throws IOException {
        final ConcurrentSkipListMap<byte[], NavigableMap<byte[], byte[]>> table = getTable(tableName);
        for (final Put put : puts) {
            synchronized (table) {
                NavigableMap<byte[], byte[]> row = table.get(put.getRow());
                if (row == null) {
                    row = new ConcurrentSkipListMap<byte[], byte[]>(Bytes.BYTES_COMPARATOR);
                }
                for (final List<Cell> cells : put.getFamilyCellMap().values()) {
                    for (final Cell cell : cells) {
                        row.put(CellUtil.cloneQualifier(cell), CellUtil.cloneValue(cell));
                    }
                }
                table.put(put.getRow(), row);
            }
        }
    }

    @Override
    public void delete(final String tableName, final List<Delete> deletes) throws IOException {
        final ConcurrentSkipListMap<byte[], NavigableMap<byte[], byte[]>> table = getTable(tableName);
        for (final Delete delete : deletes) {
            synchronized (table) {
                if (delete.getFamilyCellMap().isEmpty()) {
                    table.remove(delete.getRow());
                    continue;
                }
                final NavigableMap<byte[], byte[]> row = table.get(delete.getRow());
                if (row == null) {
                    continue;
                }
                for (final List<Cell> cells : delete.getFamilyCellMap().values()) {
                    for (final Cell cell : cells) {
                        row.remove(CellUtil.cloneQualifier(cell));
                    }
                }
                if (row.isEmpty()) {
                    table.remove(delete.getRow());
                }
            }
        }
    }

    @Override
    public Result[] get(final String tableName, final List<Get> gets) throws IOException {
        final ConcurrentSkipListMap<byte[], NavigableMap<byte[], byte[]>> table = getTable(tableName);
        final byte[] family = this.families.get(getTableName(tableName));
        final Result[] results = new Result[gets.size()];
        for (int i = 0; i < results.length; ++i) {
            final Get get = gets.get(i);
            final NavigableMap<byte[], byte[]> row = table.get(get.getRow());
            NavigableSet<byte[]> qualifiers = null;
            for (final NavigableSet<byte[]> set : get.getFamilyMap().values()) {
                qualifiers = set;
            }
            results[i] = toResult(get.getRow(), family, row, qualifiers);
        }
        return results;
    }

    @Override
    public Stream<Result> scan(final String tableName, final Scan scan) throws IOException {
        final ConcurrentSkipListMap<byte[], NavigableMap<byte[], byte[]>> table = getTable(tableName);
        final byte[] family = this.families.get(getTableName(tableName));
        final byte[] start = scan.getStartRow();
        final byte[] stop = scan.getStopRow();
        NavigableMap<byte[], NavigableMap<byte[], byte[]>> range = table;
        if (!scan.isReversed()) {
            if (start.length > 0) {
                range = range.tailMap(start, scan.includeStartRow());
            }
            if (stop.length > 0) {
                range = range.headMap(stop, scan.includeStopRow());
            }
        } else {
            range = range.descendingMap();
            if (start.length > 0) {
                range = range.tailMap(start, scan.includeStartRow());
            }
            if (stop.length > 0) {
                range = range.headMap(stop, scan.includeStopRow());
            }
        }
        final int limit = scan.getLimit();
        final List<Result> results = Lists.newArrayList();
        for (final Map.Entry<byte[], NavigableMap<byte[], byte[]>> entry : range.entrySet()) {
            if (limit > 0 && results.size() >= limit) {
                break;
            }
            results.add(toResult(entry.getKey(), family, entry.getValue(), null));
        }
        return Stream.create(results);
    }

    private static Result toResult(final byte[] row, final byte[] family,
            @Nullable final NavigableMap<byte[], byte[]> columns,
            @Nullable final NavigableSet<byte[]> qualifiers) {
        if (columns == null) {
            return Result.create(ImmutableList.<Cell>of());
        }
        final List<Cell> cells = Lists.newArrayList();
        for (final Map.Entry<byte[], byte[]> column : columns.entrySet()) {
            if (qualifiers == null || qualifiers.contains(column.getKey())) {
                cells.add(CellBuilderFactory.create(CellBuilderType.DEEP_COPY).setRow(row)
                        .setFamily(family).setQualifier(column.getKey())
                        .setTimestamp(Long.MAX_VALUE - 1).setType(Cell.Type.Put)
                        .setValue(column.getValue()).build());
            }
        }
        return Result.create(cells);
    }

    @Override
    public void close() {
        LOGGER.debug("MEMORY layer closed, {} tables discarded", this.tables.size());
        this.tables.clear();
    }

}
