package guildupdater;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one sync run
 */
public class SyncReport {

    private final List<GuildSyncResult> results = new ArrayList<>();
    private final Map<String, Integer> rowsWritten = new LinkedHashMap<>();
    private final List<String> prunedSkillColumns = new ArrayList<>();

    void addResult(GuildSyncResult result) {
        results.add(result);
    }

    void recordWrite(String tableName, int rows) {
        rowsWritten.put(tableName, rows);
    }

    void recordPruned(List<String> headers) {
        prunedSkillColumns.addAll(headers);
    }

    public List<GuildSyncResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    /**
     * @return The result for a guild id, or null
     */
    public GuildSyncResult getResult(String guildId) {
        for (GuildSyncResult result : results) {
            if (result.getGuildId().equals(guildId)) {
                return result;
            }
        }
        return null;
    }

    public int getSucceeded() {
        return count(GuildSyncState.DONE);
    }

    public int getSkipped() {
        return count(GuildSyncState.SKIPPED);
    }

    public int getFailed() {
        int failed = 0;
        for (GuildSyncResult result : results) {
            if (result.getState().isFailure()) {
                failed++;
            }
        }
        return failed;
    }

    private int count(GuildSyncState state) {
        int count = 0;
        for (GuildSyncResult result : results) {
            if (result.getState() == state) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return Rows in the table after the final write, or -1 if the table was not written
     */
    public int getRowsWritten(String tableName) {
        return rowsWritten.getOrDefault(tableName, -1);
    }

    public List<String> getPrunedSkillColumns() {
        return Collections.unmodifiableList(prunedSkillColumns);
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Guild sync: ").append(getSucceeded()).append(" succeeded, ")
                .append(getFailed()).append(" failed, ")
                .append(getSkipped()).append(" skipped");
        for (Map.Entry<String, Integer> entry : rowsWritten.entrySet()) {
            sb.append("\n  ").append(entry.getKey()).append(": ").append(entry.getValue()).append(" row(s)");
        }
        for (GuildSyncResult result : results) {
            sb.append("\n  ").append(result);
        }
        return sb.toString();
    }
}
