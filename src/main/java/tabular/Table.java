package tabular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable contents of one table: the header row and the data rows.
 * Every row has exactly as many cells as there are headers; missing cells read as "".
 */
public class Table {

    private final String name;
    private final List<String> headers;
    private final List<List<String>> rows;

    public Table(String name, List<String> headers, List<List<String>> rows) {
        this.name = name;
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
        List<List<String>> copy = new ArrayList<>();
        for (List<String> row : rows) {
            copy.add(Collections.unmodifiableList(fit(row, headers.size())));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * Pads a row with "" (or cuts it) to the given width; null cells become ""
     */
    public static List<String> fit(List<String> row, int width) {
        List<String> fitted = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            String value = i < row.size() ? row.get(i) : null;
            fitted.add(value == null ? "" : value);
        }
        return fitted;
    }

    public String getName() {
        return name;
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public boolean hasHeaders() {
        return !headers.isEmpty();
    }

    /**
     * Resolves a column with the default header resolver
     * @return The 0-based index, or -1
     */
    public int columnIndex(String header) {
        return HeaderResolver.DEFAULT.resolve(headers, header);
    }
}
