package tabular;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * Header-aware access to the tables shared with operators.
 * Existing headers are never removed or reordered, except by replaceTable.
 */
public interface TabularStore {

    boolean tableExists(String name) throws SQLException;

    /**
     * Reads a table. A table that does not exist reads as having no headers and no rows.
     */
    Table readTable(String name) throws SQLException;

    /**
     * Makes sure every required header is present, creating the table if needed.
     * Names are matched case-insensitively and through synonyms; anything missing is appended at the end.
     * @return required name → 0-based column index, in the order of the required list
     */
    Map<String, Integer> ensureHeaders(String name, List<String> required) throws SQLException;

    /**
     * Replaces every data row in one bulk operation. Rows shorter than the header are padded with "".
     * @throws IllegalArgumentException if a row has more cells than the table has headers
     */
    void writeRows(String name, List<List<String>> rows) throws SQLException;

    /**
     * Replaces headers and rows together in one bulk operation
     * @throws IllegalArgumentException if headers repeat (ignoring case) or a row is wider than the headers
     */
    void replaceTable(String name, List<String> headers, List<List<String>> rows) throws SQLException;
}
