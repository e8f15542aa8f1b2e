package catalog;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import logs.DiscordLog;
import tabular.HeaderResolver;
import tabular.Table;
import tabular.TabularStore;
import utils.SyncConfig;

/**
 * Builds the GameCatalog from the unit and skill catalog tables.
 * Best effort: a missing or malformed source table contributes nothing, and bad rows are skipped.
 */
public class CatalogLoader {

    private static final List<String> BASE_ID_HEADERS = Arrays.asList("base_id", "baseid", "base id", "unit id", "unit_base_id");
    private static final List<String> UNIT_NAME_HEADERS = Arrays.asList("name", "friendly", "display", "ui name", "uiname");
    private static final List<String> ALIGNMENT_HEADERS = Arrays.asList("alignment");
    private static final List<String> SKILL_ID_HEADERS = Arrays.asList("skillid", "skill id", "skill_id");
    private static final List<String> SKILL_NAME_HEADERS = Arrays.asList("skill name", "skillname", "skill_name", "name");

    private final TabularStore store;
    private final String charactersTable;
    private final String shipsTable;
    private final List<String> skillTables;
    private final List<String> excludeSubstrings;
    private final DiscordLog discordLogger;

    public CatalogLoader(TabularStore store, String charactersTable, String shipsTable, List<String> skillTables,
                         List<String> excludeSubstrings, DiscordLog discordLogger) {
        this.store = store;
        this.charactersTable = charactersTable;
        this.shipsTable = shipsTable;
        this.skillTables = skillTables;
        this.excludeSubstrings = excludeSubstrings;
        this.discordLogger = discordLogger;
    }

    public static CatalogLoader fromConfig(TabularStore store, SyncConfig config, DiscordLog discordLogger) {
        return new CatalogLoader(store, config.getCharactersTable(), config.getShipsTable(),
                Arrays.asList(config.getZetasTable(), config.getOmicronsTable()),
                config.getExcludeSubstrings(), discordLogger);
    }

    /**
     * Reads all catalog tables
     * @return The catalog; empty maps when nothing could be read
     */
    public GameCatalog load() {
        Map<String, UnitCatalogEntry> units = new LinkedHashMap<>();
        loadUnits(charactersTable, false, units);
        loadUnits(shipsTable, true, units);

        Map<String, SkillCatalogEntry> skills = new LinkedHashMap<>();
        for (String table : skillTables) {
            loadSkills(table, units, skills);
        }

        discordLogger.logInfo("Catalog loaded: " + units.size() + " unit(s), " + skills.size() + " tracked skill(s)");
        return new GameCatalog(units, skills);
    }

    /**
     * True if the id contains any configured exclusion substring, ignoring case
     */
    public boolean isExcluded(String id) {
        String upper = id.toUpperCase(Locale.ROOT);
        for (String fragment : excludeSubstrings) {
            if (!fragment.isEmpty() && upper.contains(fragment.toUpperCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private Table readSource(String tableName) {
        try {
            if (!store.tableExists(tableName)) {
                discordLogger.logWarning("Catalog table not found, skipping: " + tableName);
                return null;
            }
            return store.readTable(tableName);
        } catch (SQLException e) {
            discordLogger.logError("Failed to read catalog table " + tableName + ": " + e.getMessage());
            return null;
        }
    }

    private void loadUnits(String tableName, boolean ships, Map<String, UnitCatalogEntry> units) {
        Table table = readSource(tableName);
        if (table == null) {
            return;
        }
        List<String> headers = table.getHeaders();
        int keyColumn = locate(headers, BASE_ID_HEADERS, -1);
        int nameColumn = locate(headers, UNIT_NAME_HEADERS, keyColumn);
        if (keyColumn < 0 || nameColumn < 0) {
            discordLogger.logWarning("Catalog table " + tableName + " has no base id or name column, skipping");
            return;
        }
        int alignmentColumn = locate(headers, ALIGNMENT_HEADERS, keyColumn);

        int added = 0;
        for (List<String> row : table.getRows()) {
            String baseId = row.get(keyColumn).trim().toUpperCase(Locale.ROOT);
            String name = row.get(nameColumn).trim();
            if (baseId.isEmpty() || name.isEmpty() || isExcluded(baseId)) {
                continue;
            }
            String alignment = alignmentColumn >= 0 ? row.get(alignmentColumn).trim() : "";
            units.put(baseId, new UnitCatalogEntry(baseId, name, alignment, ships));
            added++;
        }
        discordLogger.logInfo("Catalog table " + tableName + ": " + added + " unit(s)");
    }

    private void loadSkills(String tableName, Map<String, UnitCatalogEntry> units, Map<String, SkillCatalogEntry> skills) {
        Table table = readSource(tableName);
        if (table == null) {
            return;
        }
        List<String> headers = table.getHeaders();
        int keyColumn = locate(headers, SKILL_ID_HEADERS, -1);
        int nameColumn = locate(headers, SKILL_NAME_HEADERS, keyColumn);
        if (keyColumn < 0 || nameColumn < 0) {
            discordLogger.logWarning("Catalog table " + tableName + " has no skill id or skill name column, skipping");
            return;
        }
        int baseIdColumn = locate(headers, BASE_ID_HEADERS, keyColumn);

        int added = 0;
        for (List<String> row : table.getRows()) {
            String skillId = row.get(keyColumn).trim();
            String skillName = row.get(nameColumn).trim();
            String baseId = baseIdColumn >= 0 ? row.get(baseIdColumn).trim().toUpperCase(Locale.ROOT) : "";
            if (skillId.isEmpty() || skillName.isEmpty() || skills.containsKey(skillId)) {
                continue;
            }
            if (isExcluded(skillId) || (!baseId.isEmpty() && isExcluded(baseId))) {
                continue;
            }
            skills.put(skillId, new SkillCatalogEntry(skillId, displayName(skillName, baseId, units)));
            added++;
        }
        discordLogger.logInfo("Catalog table " + tableName + ": " + added + " skill(s)");
    }

    /**
     * "CharacterName|SkillName", unless the name already carries the character part
     */
    static String displayName(String skillName, String baseId, Map<String, UnitCatalogEntry> units) {
        if (skillName.contains("|")) {
            return skillName;
        }
        if (baseId.isEmpty()) {
            return skillName;
        }
        UnitCatalogEntry unit = units.get(baseId);
        String owner = unit != null ? unit.getFriendlyName() : baseId;
        return owner + "|" + skillName;
    }

    /**
     * Finds a column by candidate names: exact matches first, then headers containing a candidate
     * @param skip A column that must not be returned (the key column), or -1
     * @return The 0-based index, or -1
     */
    static int locate(List<String> headers, List<String> candidates, int skip) {
        Map<Integer, String> normalized = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            normalized.put(i, HeaderResolver.normalize(headers.get(i)));
        }
        for (String candidate : candidates) {
            for (int i = 0; i < headers.size(); i++) {
                if (i != skip && normalized.get(i).equals(candidate)) {
                    return i;
                }
            }
        }
        for (String candidate : candidates) {
            for (int i = 0; i < headers.size(); i++) {
                if (i != skip && normalized.get(i).contains(candidate)) {
                    return i;
                }
            }
        }
        return -1;
    }
}
