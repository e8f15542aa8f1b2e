package guildupdater;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import tabular.Table;

/**
 * Working copy of one table for the length of a run.
 * Managed columns are written by the sync; every other column belongs to the operators.
 * The key index is rebuilt from the row list after every mutation.
 */
public class TableSnapshot {

    private final String tableName;
    private final List<String> headers;
    private final List<List<String>> rows;
    private final Set<Integer> managedColumns;
    private final Function<List<String>, String> keyFunction;
    private final Map<String, Integer> index;

    public TableSnapshot(Table table, Collection<Integer> managedColumns, Function<List<String>, String> keyFunction) {
        this.tableName = table.getName();
        this.headers = new ArrayList<>(table.getHeaders());
        this.rows = new ArrayList<>();
        for (List<String> row : table.getRows()) {
            rows.add(Table.fit(row, headers.size()));
        }
        this.managedColumns = new HashSet<>(managedColumns);
        this.keyFunction = keyFunction;
        this.index = new HashMap<>();
        rebuildIndex();
    }

    /**
     * Key made of one column's trimmed value
     */
    public static Function<List<String>, String> columnKey(int column) {
        return row -> row.get(column).trim();
    }

    /**
     * Key made of two columns' trimmed values, e.g. guild and player name
     */
    public static Function<List<String>, String> compositeKey(int first, int second) {
        return row -> compositeKey(row.get(first), row.get(second));
    }

    public static String compositeKey(String first, String second) {
        return first.trim() + "\u0000" + second.trim();
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    /**
     * @return The live row list, in table order
     */
    public List<List<String>> getRows() {
        return rows;
    }

    public int width() {
        return headers.size();
    }

    public boolean isManaged(int column) {
        return managedColumns.contains(column);
    }

    public String keyOf(List<String> row) {
        return keyFunction.apply(row);
    }

    /**
     * @return A new row of empty cells, as wide as the table
     */
    public List<String> newRow() {
        return Table.fit(Collections.emptyList(), headers.size());
    }

    /**
     * @return Position of the first row with this key, or -1
     */
    public int positionOf(String key) {
        Integer position = index.get(key);
        return position == null ? -1 : position;
    }

    /**
     * @return The first row with this key, or null
     */
    public List<String> findRow(String key) {
        int position = positionOf(key);
        return position < 0 ? null : rows.get(position);
    }

    /**
     * Appends a row, padding it to the table width
     */
    public void appendRow(List<String> row) {
        rows.add(Table.fit(row, headers.size()));
        rebuildIndex();
    }

    /**
     * Rebuilds key → position from the current rows. Rows with a blank key are not indexed;
     * with duplicate keys the first row wins.
     */
    public void rebuildIndex() {
        index.clear();
        for (int i = 0; i < rows.size(); i++) {
            String key = keyFunction.apply(rows.get(i));
            if (key != null && !key.replace("\u0000", "").isEmpty()) {
                index.putIfAbsent(key, i);
            }
        }
    }

    /**
     * Removes whole columns and drops the key index, so it is meant for the last step before writing.
     * Managed column positions are shifted to match.
     * @param columns 0-based column indices
     */
    public void removeColumns(Set<Integer> columns) {
        if (columns.isEmpty()) {
            return;
        }
        List<Integer> descending = new ArrayList<>(columns);
        descending.sort(Collections.reverseOrder());
        for (int column : descending) {
            headers.remove(column);
            for (List<String> row : rows) {
                row.remove(column);
            }
        }

        Set<Integer> shifted = new HashSet<>();
        for (int managed : managedColumns) {
            if (columns.contains(managed)) {
                continue;
            }
            int offset = 0;
            for (int removed : columns) {
                if (removed < managed) {
                    offset++;
                }
            }
            shifted.add(managed - offset);
        }
        managedColumns.clear();
        managedColumns.addAll(shifted);
        index.clear();
    }
}
