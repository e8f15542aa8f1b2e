package guildupdater;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

import tabular.Table;

/**
 * Delete-then-reinsert of one guild's rows in a snapshot.
 * Operator cells of a removed row are carried over to the matching fresh row.
 */
public class ReconciliationEngine {

    /**
     * Replaces a guild's rows, matching removed and fresh rows by the snapshot key
     * @see #replaceGuildRows(TableSnapshot, int, Set, Predicate, Function, List)
     */
    public int replaceGuildRows(TableSnapshot snapshot, int guildColumn, Set<String> guildNames,
                                Predicate<List<String>> alsoRemove, List<List<String>> freshRows) {
        return replaceGuildRows(snapshot, guildColumn, guildNames, alsoRemove, snapshot::keyOf, freshRows);
    }

    /**
     * Replaces a guild's rows
     * @param snapshot The table
     * @param guildColumn Column holding the guild name
     * @param guildNames Names the guild's rows may carry (current and previous)
     * @param alsoRemove Extra rows to remove wherever they are, may be null
     * @param carryKey Pairs a removed row with the fresh row that inherits its operator cells.
     *                 For tables keyed by guild name this must leave the guild out, or a rename loses the cells.
     * @param freshRows Newly computed rows, managed cells filled
     * @return The number of rows removed
     */
    public int replaceGuildRows(TableSnapshot snapshot, int guildColumn, Set<String> guildNames,
                                Predicate<List<String>> alsoRemove, Function<List<String>, String> carryKey,
                                List<List<String>> freshRows) {
        Map<String, List<String>> removedByKey = new HashMap<>();
        int removed = 0;

        Iterator<List<String>> iterator = snapshot.getRows().iterator();
        while (iterator.hasNext()) {
            List<String> row = iterator.next();
            boolean ofGuild = guildNames.contains(row.get(guildColumn).trim());
            if (ofGuild || (alsoRemove != null && alsoRemove.test(row))) {
                removedByKey.putIfAbsent(carryKey.apply(row), row);
                iterator.remove();
                removed++;
            }
        }
        snapshot.rebuildIndex();

        for (List<String> fresh : freshRows) {
            List<String> row = new ArrayList<>(Table.fit(fresh, snapshot.width()));
            List<String> previous = removedByKey.get(carryKey.apply(row));
            if (previous != null) {
                for (int i = 0; i < row.size(); i++) {
                    if (!snapshot.isManaged(i)) {
                        row.set(i, previous.get(i));
                    }
                }
            }
            snapshot.getRows().add(row);
        }
        snapshot.rebuildIndex();
        return removed;
    }

    /**
     * Overwrites the managed cells of one row in place; operator cells stay as they are
     * @param snapshot The table
     * @param position Row position
     * @param values column index → new value
     */
    public void updateManagedCells(TableSnapshot snapshot, int position, Map<Integer, String> values) {
        List<String> row = snapshot.getRows().get(position);
        for (Map.Entry<Integer, String> entry : values.entrySet()) {
            if (snapshot.isManaged(entry.getKey())) {
                row.set(entry.getKey(), entry.getValue() == null ? "" : entry.getValue());
            }
        }
        snapshot.rebuildIndex();
    }
}
