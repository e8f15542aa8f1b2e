package guildupdater;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import catalog.GameCatalog;
import catalog.SkillCatalogEntry;
import catalog.UnitCatalogEntry;
import tabular.HeaderResolver;
import tabular.Table;
import tabular.TabularStore;

/**
 * Keeps the two wide tables' headers in line with the catalog.
 * Unit columns are never removed. Skill columns without any value are pruned after the merge.
 * Which catalog entry owns each column is recorded in a side table, so a column keeps its
 * meaning when a same-named entry joins the catalog later.
 */
public class MatrixGrowthManager {

    public static final String OWNER_TABLE = "Table";
    public static final String OWNER_HEADER = "Header";
    public static final String OWNER_KEY = "Catalog Key";
    public static final List<String> OWNER_HEADERS = Arrays.asList(OWNER_TABLE, OWNER_HEADER, OWNER_KEY);

    private final TabularStore store;
    private final String ownersTable;
    // table → header → catalog key, loaded on first use
    private Map<String, Map<String, String>> owners;

    public MatrixGrowthManager(TabularStore store, String ownersTable) {
        this.store = store;
        this.ownersTable = ownersTable;
    }

    /**
     * @return base id → display name, in catalog order
     */
    public static Map<String, String> unitNames(GameCatalog catalog) {
        Map<String, String> names = new LinkedHashMap<>();
        for (UnitCatalogEntry unit : catalog.getUnits()) {
            names.put(unit.getBaseId(), unit.getFriendlyName());
        }
        return names;
    }

    /**
     * @return skill id → display name, in catalog order
     */
    public static Map<String, String> skillNames(GameCatalog catalog) {
        Map<String, String> names = new LinkedHashMap<>();
        for (SkillCatalogEntry skill : catalog.getSkills()) {
            names.put(skill.getSkillId(), skill.getDisplayName());
        }
        return names;
    }

    /**
     * Header names for a wide table, taking the table's current columns and their recorded owners into account
     * @param tableName The wide table
     * @param displayNames catalog key → display name
     * @param keyHeaders The two key columns
     * @return catalog key → header, in catalog order
     */
    public Map<String, String> resolveColumns(String tableName, Map<String, String> displayNames,
                                              List<String> keyHeaders) throws SQLException {
        List<String> existing = store.readTable(tableName).getHeaders();
        return assignHeaders(displayNames, keyHeaders, existing, columnOwners(tableName));
    }

    /**
     * Gives every entry a distinct header.
     * An entry keeps the column it already owns: its "Name (KEY)" column, or the plain-name column
     * recorded as its own. Other entries take the plain name when nobody holds it, else "Name (KEY)".
     * A plain-name column with no recorded owner goes to the first claimant in catalog order.
     * Names are compared ignoring case.
     * @param displayNames catalog key → display name
     * @param keyHeaders The key columns, never used for an entry
     * @param existingHeaders The table's current headers
     * @param headerOwners header → catalog key, as recorded by earlier runs
     * @return catalog key → header, in catalog order
     */
    static Map<String, String> assignHeaders(Map<String, String> displayNames, List<String> keyHeaders,
                                             List<String> existingHeaders, Map<String, String> headerOwners) {
        Set<String> existing = new HashSet<>();
        for (String header : existingHeaders) {
            existing.add(HeaderResolver.normalize(header));
        }
        Map<String, String> ownerOf = new HashMap<>();
        for (Map.Entry<String, String> entry : headerOwners.entrySet()) {
            ownerOf.put(HeaderResolver.normalize(entry.getKey()), entry.getValue());
        }
        Set<String> taken = new HashSet<>();
        for (String header : keyHeaders) {
            taken.add(HeaderResolver.normalize(header));
        }

        Map<String, String> assigned = new HashMap<>();
        for (Map.Entry<String, String> entry : displayNames.entrySet()) {
            String key = entry.getKey();
            String name = plainName(key, entry.getValue());
            String qualified = qualified(name, key);
            String header = null;
            if (existing.contains(HeaderResolver.normalize(qualified)) && ownedBy(ownerOf, qualified, key, true)) {
                header = qualified;
            } else if (existing.contains(HeaderResolver.normalize(name)) && ownedBy(ownerOf, name, key, false)
                    && !taken.contains(HeaderResolver.normalize(name))) {
                header = name;
            }
            if (header != null) {
                assigned.put(key, header);
                taken.add(HeaderResolver.normalize(header));
            }
        }

        for (Map.Entry<String, String> entry : displayNames.entrySet()) {
            String key = entry.getKey();
            if (assigned.containsKey(key)) {
                continue;
            }
            String header = plainName(key, entry.getValue());
            String normalized = HeaderResolver.normalize(header);
            if (taken.contains(normalized) || !ownedBy(ownerOf, header, key, true)) {
                header = qualified(header, key);
            }
            assigned.put(key, header);
            taken.add(HeaderResolver.normalize(header));
        }

        Map<String, String> headers = new LinkedHashMap<>();
        for (String key : displayNames.keySet()) {
            headers.put(key, assigned.get(key));
        }
        return headers;
    }

    private static String plainName(String key, String displayName) {
        return displayName == null || displayName.trim().isEmpty() ? key : displayName.trim();
    }

    private static String qualified(String name, String key) {
        return name + " (" + key + ")";
    }

    /**
     * @param unownedCounts Result when no owner is recorded for the header
     */
    private static boolean ownedBy(Map<String, String> ownerOf, String header, String key, boolean unownedCounts) {
        String owner = ownerOf.get(HeaderResolver.normalize(header));
        return owner == null ? unownedCounts : owner.equals(key);
    }

    /**
     * Makes sure a wide table has its key columns and one column per catalog entry
     * @param tableName The table
     * @param keyHeaders The two key columns
     * @param columns catalog key → header
     * @return header → 0-based column index, for the key headers and every catalog header
     */
    public Map<String, Integer> ensureMatrixHeaders(String tableName, List<String> keyHeaders,
                                                    Collection<String> columns) throws SQLException {
        List<String> required = new ArrayList<>(keyHeaders);
        required.addAll(columns);
        return store.ensureHeaders(tableName, required);
    }

    /**
     * Removes skill columns that have no value in any row
     * @param snapshot The merged skills matrix
     * @param skillColumnIndices Positions of the catalog skill columns
     * @return The headers that were removed
     */
    public List<String> pruneEmptyColumns(TableSnapshot snapshot, Collection<Integer> skillColumnIndices) {
        Set<Integer> empty = new HashSet<>();
        for (int column : skillColumnIndices) {
            boolean used = false;
            for (List<String> row : snapshot.getRows()) {
                if (!row.get(column).trim().isEmpty()) {
                    used = true;
                    break;
                }
            }
            if (!used) {
                empty.add(column);
            }
        }

        List<String> removed = new ArrayList<>();
        for (int column : empty) {
            removed.add(snapshot.getHeaders().get(column));
        }
        snapshot.removeColumns(empty);
        return removed;
    }

    /**
     * Recorded owners of a table's columns
     * @return header → catalog key
     */
    public Map<String, String> columnOwners(String tableName) throws SQLException {
        Map<String, String> tableOwners = loadOwners().get(tableName);
        return tableOwners == null ? new LinkedHashMap<>() : new LinkedHashMap<>(tableOwners);
    }

    /**
     * Updates a table's owners after a run. Columns that no longer exist are forgotten; columns of
     * entries that left the catalog stay reserved for them.
     * @param tableName The wide table
     * @param columns catalog key → header used this run
     * @param finalHeaders The table's headers as written
     */
    public void recordColumnOwners(String tableName, Map<String, String> columns, List<String> finalHeaders)
            throws SQLException {
        Set<String> present = new HashSet<>();
        for (String header : finalHeaders) {
            present.add(HeaderResolver.normalize(header));
        }
        Set<String> reassigned = new HashSet<>();
        for (String header : columns.values()) {
            reassigned.add(HeaderResolver.normalize(header));
        }

        Map<String, String> updated = new LinkedHashMap<>();
        for (Map.Entry<String, String> previous : columnOwners(tableName).entrySet()) {
            String normalized = HeaderResolver.normalize(previous.getKey());
            if (present.contains(normalized) && !reassigned.contains(normalized)) {
                updated.put(previous.getKey(), previous.getValue());
            }
        }
        for (Map.Entry<String, String> column : columns.entrySet()) {
            if (present.contains(HeaderResolver.normalize(column.getValue()))) {
                updated.put(column.getValue(), column.getKey());
            }
        }
        loadOwners().put(tableName, updated);
    }

    /**
     * Writes every recorded owner back to the owners table
     */
    public void saveColumnOwners() throws SQLException {
        List<List<String>> rows = new ArrayList<>();
        for (Map.Entry<String, Map<String, String>> table : loadOwners().entrySet()) {
            for (Map.Entry<String, String> owner : table.getValue().entrySet()) {
                rows.add(Arrays.asList(table.getKey(), owner.getKey(), owner.getValue()));
            }
        }
        store.replaceTable(ownersTable, OWNER_HEADERS, rows);
    }

    private Map<String, Map<String, String>> loadOwners() throws SQLException {
        if (owners != null) {
            return owners;
        }
        owners = new LinkedHashMap<>();
        if (!store.tableExists(ownersTable)) {
            return owners;
        }
        Table table = store.readTable(ownersTable);
        int tableColumn = table.columnIndex(OWNER_TABLE);
        int headerColumn = table.columnIndex(OWNER_HEADER);
        int keyColumn = table.columnIndex(OWNER_KEY);
        if (tableColumn < 0 || headerColumn < 0 || keyColumn < 0) {
            throw new IllegalStateException("Table " + ownersTable + " must have the columns " + OWNER_HEADERS);
        }
        for (List<String> row : table.getRows()) {
            String header = row.get(headerColumn).trim();
            String key = row.get(keyColumn).trim();
            if (!header.isEmpty() && !key.isEmpty()) {
                owners.computeIfAbsent(row.get(tableColumn).trim(), t -> new LinkedHashMap<>()).put(header, key);
            }
        }
        return owners;
    }
}
