package tabular;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import utils.UtilsDatabase;

/**
 * Tabular store kept in a SQLite file. Each logical table is one SQL table whose columns are
 * the headers, in order, all typed TEXT. Row order is insertion order (rowid).
 */
public class SqliteTabularStore implements TabularStore {

    private final Path dbPath;
    private final HeaderResolver headerResolver;

    public SqliteTabularStore(Path dbPath) {
        this(dbPath, HeaderResolver.DEFAULT);
    }

    public SqliteTabularStore(Path dbPath, HeaderResolver headerResolver) {
        this.dbPath = dbPath;
        this.headerResolver = headerResolver;
    }

    public Path getDbPath() {
        return dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(UtilsDatabase.getConnectionUrl(dbPath));
    }

    @Override
    public boolean tableExists(String name) throws SQLException {
        try (Connection conn = connect()) {
            return tableExists(conn, name);
        }
    }

    private static boolean tableExists(Connection conn, String name) throws SQLException {
        String sql = "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ? COLLATE NOCASE";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, name);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static List<String> readHeaders(Connection conn, String name) throws SQLException {
        List<String> headers = new ArrayList<>();
        String sql = "PRAGMA table_info(" + UtilsDatabase.quoteIdentifier(name) + ")";
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                headers.add(rs.getString("name"));
            }
        }
        return headers;
    }

    @Override
    public Table readTable(String name) throws SQLException {
        try (Connection conn = connect()) {
            if (!tableExists(conn, name)) {
                return new Table(name, new ArrayList<>(), new ArrayList<>());
            }
            List<String> headers = readHeaders(conn, name);
            List<List<String>> rows = new ArrayList<>();

            String sql = "SELECT * FROM " + UtilsDatabase.quoteIdentifier(name) + " ORDER BY rowid";
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(sql)) {
                while (rs.next()) {
                    List<String> row = new ArrayList<>(headers.size());
                    for (int i = 1; i <= headers.size(); i++) {
                        String value = rs.getString(i);
                        row.add(value == null ? "" : value);
                    }
                    rows.add(row);
                }
            }
            return new Table(name, headers, rows);
        }
    }

    @Override
    public Map<String, Integer> ensureHeaders(String name, List<String> required) throws SQLException {
        if (required.isEmpty()) {
            throw new IllegalArgumentException("At least one header is required for table " + name);
        }
        for (String header : required) {
            if (header == null || header.trim().isEmpty()) {
                throw new IllegalArgumentException("Blank header requested for table " + name);
            }
        }

        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                List<String> headers = tableExists(conn, name) ? readHeaders(conn, name) : new ArrayList<>();
                boolean created = headers.isEmpty();
                Map<String, Integer> resolved = headerResolver.resolveAll(headers, required);

                List<String> toAdd = new ArrayList<>();
                Set<String> seen = new HashSet<>();
                for (String header : required) {
                    if (!resolved.containsKey(header) && seen.add(HeaderResolver.normalize(header))) {
                        toAdd.add(header.trim());
                    }
                }

                if (created) {
                    createTable(conn, name, toAdd);
                } else {
                    for (String header : toAdd) {
                        String sql = "ALTER TABLE " + UtilsDatabase.quoteIdentifier(name)
                                + " ADD COLUMN " + UtilsDatabase.quoteIdentifier(header) + " TEXT";
                        try (Statement stmt = conn.createStatement()) {
                            stmt.executeUpdate(sql);
                        }
                    }
                }
                conn.commit();

                headers.addAll(toAdd);
                Map<String, Integer> result = new LinkedHashMap<>();
                Map<String, Integer> finalIndex = headerResolver.resolveAll(headers, required);
                for (String header : required) {
                    Integer index = finalIndex.get(header);
                    if (index == null) {
                        // a duplicate of another required name, ignoring case
                        index = headerResolver.resolve(headers, header);
                    }
                    result.put(header, index);
                }
                return result;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private static void createTable(Connection conn, String name, List<String> headers) throws SQLException {
        StringBuilder sql = new StringBuilder("CREATE TABLE ").append(UtilsDatabase.quoteIdentifier(name)).append(" (");
        for (int i = 0; i < headers.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(UtilsDatabase.quoteIdentifier(headers.get(i))).append(" TEXT");
        }
        sql.append(")");
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql.toString());
        }
    }

    @Override
    public void writeRows(String name, List<List<String>> rows) throws SQLException {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                if (!tableExists(conn, name)) {
                    throw new IllegalStateException("Table does not exist: " + name);
                }
                List<String> headers = readHeaders(conn, name);
                checkWidth(name, headers.size(), rows);

                try (Statement stmt = conn.createStatement()) {
                    stmt.executeUpdate("DELETE FROM " + UtilsDatabase.quoteIdentifier(name));
                }
                insertRows(conn, name, headers.size(), rows);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    @Override
    public void replaceTable(String name, List<String> headers, List<List<String>> rows) throws SQLException {
        if (headers.isEmpty()) {
            throw new IllegalArgumentException("At least one header is required for table " + name);
        }
        Set<String> seen = new HashSet<>();
        for (String header : headers) {
            if (header == null || header.trim().isEmpty()) {
                throw new IllegalArgumentException("Blank header for table " + name);
            }
            if (!seen.add(HeaderResolver.normalize(header))) {
                throw new IllegalArgumentException("Duplicate header '" + header + "' for table " + name);
            }
        }
        checkWidth(name, headers.size(), rows);

        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try {
                try (Statement stmt = conn.createStatement()) {
                    stmt.executeUpdate("DROP TABLE IF EXISTS " + UtilsDatabase.quoteIdentifier(name));
                }
                createTable(conn, name, headers);
                insertRows(conn, name, headers.size(), rows);
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private static void checkWidth(String name, int width, List<List<String>> rows) {
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).size() > width) {
                throw new IllegalArgumentException("Row " + i + " of table " + name + " has "
                        + rows.get(i).size() + " cells but the table has " + width + " columns");
            }
        }
    }

    private static void insertRows(Connection conn, String name, int width, List<List<String>> rows) throws SQLException {
        if (rows.isEmpty()) {
            return;
        }
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(UtilsDatabase.quoteIdentifier(name)).append(" VALUES (");
        for (int i = 0; i < width; i++) {
            sql.append(i == 0 ? "?" : ", ?");
        }
        sql.append(")");

        try (PreparedStatement pstmt = conn.prepareStatement(sql.toString())) {
            for (List<String> row : rows) {
                List<String> fitted = Table.fit(row, width);
                for (int i = 0; i < width; i++) {
                    UtilsDatabase.setStringOrNull(pstmt, i + 1, fitted.get(i));
                }
                pstmt.addBatch();
            }
            pstmt.executeBatch();
        }
    }
}
