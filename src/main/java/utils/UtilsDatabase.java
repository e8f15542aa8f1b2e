package utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Utility class for database operations
 */
public class UtilsDatabase {

    /**
     * Checks if a database file exists
     * @param dbPath The path of the database file
     * @return true if the file exists, false otherwise
     */
    public static boolean databaseExists(Path dbPath) {
        return Files.exists(dbPath);
    }

    /**
     * Creates the directory that will hold the database file, if needed
     * @param dbPath The path of the database file
     * @throws IOException if the directory cannot be created
     */
    public static void ensureParentDirectory(Path dbPath) throws IOException {
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /**
     * Gets the JDBC connection URL for a database
     * @param dbPath The path of the database file
     * @return The JDBC connection URL
     */
    public static String getConnectionUrl(Path dbPath) {
        return "jdbc:sqlite:" + dbPath.toAbsolutePath();
    }

    /**
     * Quotes a table or column name for use in SQL. Table and column names come from
     * operators, so they may contain spaces, pipes or quotes.
     * @param identifier The raw name
     * @return The quoted identifier
     */
    public static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    /**
     * Sets a string value or NULL in a PreparedStatement
     * @param pstmt The PreparedStatement to set the value in
     * @param index The parameter index (1-based)
     * @param value The string value to set, or null to set NULL
     * @throws SQLException if a database access error occurs
     */
    public static void setStringOrNull(PreparedStatement pstmt, int index, String value) throws SQLException {
        if (value == null) {
            pstmt.setNull(index, java.sql.Types.VARCHAR);
        } else {
            pstmt.setString(index, value);
        }
    }
}
