package guildupdater;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import catalog.GameCatalog;
import comlink.GameDataClient;
import comlink.GuildMember;
import comlink.GuildPayload;
import comlink.PlayerPayload;
import comlink.RosterUnit;
import comlink.SkillLevel;
import logs.DiscordLog;
import tabular.TabularStore;
import utils.SyncConfig;
import utils.UtilsConfig;

/**
 * Syncs every configured guild into the Guilds, Players, Player_Units and Player_Skills tables.
 * Guilds run one after another, each inside its own error handling; the tables are read once at
 * the start and written once at the end.
 */
public class GuildSyncOrchestrator {

    public static final String GUILD_ID = "Guild Id";
    public static final String GUILD_NAME = "Guild Name";
    public static final String MEMBERS = "Members";
    public static final String GUILD_GP = "Guild GP";
    public static final String LAST_RAID_ID = "Last Raid Id";
    public static final String LAST_RAID_SCORE = "Last Raid Score";
    public static final String LAST_UPDATE = "Last Update";

    public static final String PLAYER_ID = "Player Id";
    public static final String PLAYER_NAME = "Player Name";
    public static final String ALLY_CODE = "Ally code";
    public static final String ROLE = "Role";
    public static final String LEVEL = "Level";
    public static final String GP = "GP";
    public static final String GAC_LEAGUE = "GAC League";
    public static final String PLAYER_GUILD = "Player Guild";

    public static final List<String> GUILD_HEADERS = Arrays.asList(
            GUILD_ID, GUILD_NAME, MEMBERS, GUILD_GP, LAST_RAID_ID, LAST_RAID_SCORE, LAST_UPDATE);
    public static final List<String> PLAYER_HEADERS = Arrays.asList(
            PLAYER_ID, PLAYER_NAME, ALLY_CODE, GUILD_NAME, ROLE, LEVEL, GP, GAC_LEAGUE);
    public static final List<String> UNITS_KEY_HEADERS = Arrays.asList(GUILD_NAME, PLAYER_NAME);
    public static final List<String> SKILLS_KEY_HEADERS = Arrays.asList(PLAYER_GUILD, PLAYER_NAME);

    public static final DateTimeFormatter LAST_UPDATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final TabularStore store;
    private final GameDataClient client;
    private final GameCatalog catalog;
    private final SyncConfig config;
    private final DiscordLog discordLogger;
    private final Clock clock;
    private final ReconciliationEngine reconciliation;
    private final MatrixGrowthManager matrixGrowth;

    public GuildSyncOrchestrator(TabularStore store, GameDataClient client, GameCatalog catalog,
                                 SyncConfig config, DiscordLog discordLogger, Clock clock) {
        this.store = store;
        this.client = client;
        this.catalog = catalog;
        this.config = config;
        this.discordLogger = discordLogger;
        this.clock = clock.withZone(config.getZone());
        this.reconciliation = new ReconciliationEngine();
        this.matrixGrowth = new MatrixGrowthManager(store, config.getMatrixColumnsTable());
    }

    /**
     * The four tables as read at the start of a run, with their resolved column positions
     */
    private static class RunTables {
        TableSnapshot guilds;
        Map<String, Integer> guildColumns;
        TableSnapshot players;
        Map<String, Integer> playerColumns;
        TableSnapshot units;
        Map<String, Integer> unitColumns;
        Map<String, String> unitHeaders;
        TableSnapshot skills;
        Map<String, Integer> skillColumns;
        Map<String, String> skillHeaders;
    }

    /**
     * A guild member and its player detail; the detail is null when the fetch failed
     */
    private static class ResolvedMember {
        final GuildMember member;
        final PlayerPayload player;

        ResolvedMember(GuildMember member, PlayerPayload player) {
            this.member = member;
            this.player = player;
        }
    }

    /**
     * Runs one sync pass
     * @return What happened to each guild and how many rows were written
     * @throws IllegalStateException if the Guilds table is missing, the game-data service cannot be
     *         reached, or there are no guild ids
     * @throws SQLException if the store cannot be read or written
     * @throws InterruptedException if interrupted while waiting between retries
     */
    public SyncReport run() throws SQLException, InterruptedException {
        String guildsTable = config.getGuildsTable();
        if (!store.tableExists(guildsTable)) {
            throw new IllegalStateException("Guilds table not found: " + guildsTable);
        }
        checkServiceReachable();

        RunTables tables = new RunTables();
        tables.guildColumns = store.ensureHeaders(guildsTable, GUILD_HEADERS);
        tables.guilds = new TableSnapshot(store.readTable(guildsTable), tables.guildColumns.values(),
                TableSnapshot.columnKey(tables.guildColumns.get(GUILD_ID)));

        List<String> guildIds = resolveGuildIds(tables);
        if (guildIds.isEmpty()) {
            throw new IllegalStateException("No guild ids in table " + guildsTable + " and no guild filter given");
        }

        loadMemberTables(tables);
        discordLogger.logInfo("Syncing " + guildIds.size() + " guild(s) with " + catalog.unitCount()
                + " unit column(s) and " + catalog.skillCount() + " skill column(s)");

        SyncReport report = new SyncReport();
        SkillTierAccumulator skillTiers = new SkillTierAccumulator();
        for (String guildId : guildIds) {
            GuildSyncResult result = new GuildSyncResult(guildId);
            report.addResult(result);
            try {
                syncGuild(guildId, tables, skillTiers, result);
            } catch (RuntimeException e) {
                result.fail(GuildSyncState.FAILED, e.getMessage());
                discordLogger.logError("Guild " + guildId + " failed: " + e.getMessage() + "\n"
                        + UtilsConfig.getStackTraceAsString(e));
            }
        }

        writeTables(tables, report);
        discordLogger.logSuccess(report.summary());
        return report;
    }

    /**
     * Stops the run before any guild is touched when the game-data service does not answer
     */
    private void checkServiceReachable() throws InterruptedException {
        try {
            client.checkReachable();
        } catch (IOException e) {
            throw new IllegalStateException("Game-data service is unreachable at " + config.getComlinkBase()
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Guild ids to sync: the filter when one is set, otherwise every id in the Guilds table.
     * Filter ids missing from the table get a new guild row.
     */
    private List<String> resolveGuildIds(RunTables tables) {
        int idColumn = tables.guildColumns.get(GUILD_ID);
        Set<String> ids = new LinkedHashSet<>();

        List<String> filter = config.getGuildFilter();
        if (filter.isEmpty()) {
            for (List<String> row : tables.guilds.getRows()) {
                String id = row.get(idColumn).trim();
                if (!id.isEmpty()) {
                    ids.add(id);
                }
            }
            return new ArrayList<>(ids);
        }

        for (String id : filter) {
            String trimmed = id.trim();
            if (trimmed.isEmpty() || !ids.add(trimmed)) {
                continue;
            }
            if (tables.guilds.positionOf(trimmed) < 0) {
                List<String> row = tables.guilds.newRow();
                row.set(idColumn, trimmed);
                tables.guilds.appendRow(row);
                discordLogger.logInfo("Guild " + trimmed + " is not in the Guilds table yet, adding it");
            }
        }
        return new ArrayList<>(ids);
    }

    private void loadMemberTables(RunTables tables) throws SQLException {
        String playersTable = config.getPlayersTable();
        tables.playerColumns = store.ensureHeaders(playersTable, PLAYER_HEADERS);
        tables.players = new TableSnapshot(store.readTable(playersTable), tables.playerColumns.values(),
                TableSnapshot.columnKey(tables.playerColumns.get(PLAYER_ID)));

        String unitsTable = config.getPlayerUnitsTable();
        tables.unitHeaders = matrixGrowth.resolveColumns(unitsTable, MatrixGrowthManager.unitNames(catalog), UNITS_KEY_HEADERS);
        tables.unitColumns = matrixGrowth.ensureMatrixHeaders(unitsTable, UNITS_KEY_HEADERS, tables.unitHeaders.values());
        tables.units = new TableSnapshot(store.readTable(unitsTable), tables.unitColumns.values(),
                TableSnapshot.compositeKey(tables.unitColumns.get(GUILD_NAME), tables.unitColumns.get(PLAYER_NAME)));

        String skillsTable = config.getPlayerSkillsTable();
        tables.skillHeaders = matrixGrowth.resolveColumns(skillsTable, MatrixGrowthManager.skillNames(catalog), SKILLS_KEY_HEADERS);
        tables.skillColumns = matrixGrowth.ensureMatrixHeaders(skillsTable, SKILLS_KEY_HEADERS, tables.skillHeaders.values());
        tables.skills = new TableSnapshot(store.readTable(skillsTable), tables.skillColumns.values(),
                TableSnapshot.compositeKey(tables.skillColumns.get(PLAYER_GUILD), tables.skillColumns.get(PLAYER_NAME)));
    }

    private void syncGuild(String guildId, RunTables tables, SkillTierAccumulator skillTiers,
                           GuildSyncResult result) throws InterruptedException {
        int guildRow = tables.guilds.positionOf(guildId);
        List<String> existing = tables.guilds.getRows().get(guildRow);
        String previousName = existing.get(tables.guildColumns.get(GUILD_NAME)).trim();
        String lastUpdate = existing.get(tables.guildColumns.get(LAST_UPDATE)).trim();

        if (config.isSkipSyncedToday() && lastUpdate.startsWith(LocalDate.now(clock).toString())) {
            result.setGuildName(previousName);
            result.moveTo(GuildSyncState.SKIPPED);
            discordLogger.logInfo("Guild " + guildId + " was already synced today, skipping");
            return;
        }

        result.moveTo(GuildSyncState.FETCHING);
        GuildPayload guild;
        try {
            guild = client.fetchGuild(guildId);
        } catch (IOException e) {
            result.fail(GuildSyncState.FETCH_FAILED, e.getMessage());
            discordLogger.logError("Could not fetch guild " + guildId + ", keeping its previous rows: " + e.getMessage());
            return;
        }
        result.moveTo(GuildSyncState.FETCHED);

        String guildName = guild.getGuildName() != null && !guild.getGuildName().trim().isEmpty()
                ? guild.getGuildName().trim() : previousName;
        if (guildName.isEmpty()) {
            throw new IllegalStateException("Guild " + guildId + " has no name in the payload or the Guilds table");
        }
        result.setGuildName(guildName);
        result.setMembersReported(guild.getMembers().size());

        // rows written under the previous name are replaced too when the guild was renamed
        Set<String> guildNames = new LinkedHashSet<>();
        guildNames.add(guildName);
        if (!previousName.isEmpty()) {
            guildNames.add(previousName);
        }

        result.moveTo(GuildSyncState.MEMBER_RESOLUTION);
        List<ResolvedMember> members = resolveMembers(guildName, guild, result);

        result.moveTo(GuildSyncState.AGGREGATING);
        for (ResolvedMember resolved : members) {
            if (resolved.player != null) {
                observeSkills(guildName, playerName(resolved.member, resolved.player), resolved.player, skillTiers);
            }
        }

        List<List<String>> playerRows = new ArrayList<>();
        List<List<String>> unitRows = new ArrayList<>();
        List<List<String>> skillRows = new ArrayList<>();
        for (ResolvedMember resolved : members) {
            if (resolved.player == null) {
                if (carryOver(resolved.member, guildName, guildNames, tables, playerRows, unitRows, skillRows)) {
                    result.memberCarriedOver();
                } else {
                    result.memberSkipped();
                }
                continue;
            }
            String playerName = playerName(resolved.member, resolved.player);
            Map<String, RosterUnit> roster = indexRoster(resolved.player);
            playerRows.add(buildPlayerRow(tables, guildName, playerName, resolved.member, resolved.player));
            unitRows.add(buildUnitRow(tables, guildName, playerName, roster));
            skillRows.add(buildSkillRow(tables, guildName, playerName, skillTiers));
            result.memberSynced();
        }

        result.moveTo(GuildSyncState.UPSERTING);
        Map<Integer, String> guildValues = new HashMap<>();
        guildValues.put(tables.guildColumns.get(GUILD_NAME), guildName);
        guildValues.put(tables.guildColumns.get(MEMBERS), String.valueOf(guild.getMemberCount()));
        guildValues.put(tables.guildColumns.get(GUILD_GP), String.valueOf(guild.getGalacticPower()));
        guildValues.put(tables.guildColumns.get(LAST_RAID_ID), guild.getLastRaidId());
        guildValues.put(tables.guildColumns.get(LAST_RAID_SCORE), guild.getLastRaidScore());
        guildValues.put(tables.guildColumns.get(LAST_UPDATE), LocalDateTime.now(clock).format(LAST_UPDATE_FORMAT));
        reconciliation.updateManagedCells(tables.guilds, guildRow, guildValues);

        int playerIdColumn = tables.playerColumns.get(PLAYER_ID);
        Set<String> playerIds = new HashSet<>();
        for (List<String> row : playerRows) {
            String id = row.get(playerIdColumn).trim();
            if (!id.isEmpty()) {
                playerIds.add(id);
            }
        }
        int removed = reconciliation.replaceGuildRows(tables.players, tables.playerColumns.get(GUILD_NAME), guildNames,
                row -> playerIds.contains(row.get(playerIdColumn).trim()), playerRows);
        // wide tables pair rows by player name alone so operator cells survive a guild rename
        reconciliation.replaceGuildRows(tables.units, tables.unitColumns.get(GUILD_NAME), guildNames, null,
                TableSnapshot.columnKey(tables.unitColumns.get(PLAYER_NAME)), unitRows);
        reconciliation.replaceGuildRows(tables.skills, tables.skillColumns.get(PLAYER_GUILD), guildNames, null,
                TableSnapshot.columnKey(tables.skillColumns.get(PLAYER_NAME)), skillRows);

        result.moveTo(GuildSyncState.DONE);
        discordLogger.logSuccess("Guild " + guildName + " synced: " + playerRows.size() + " player row(s), "
                + removed + " previous row(s) replaced");
    }

    private List<ResolvedMember> resolveMembers(String guildName, GuildPayload guild, GuildSyncResult result)
            throws InterruptedException {
        List<ResolvedMember> members = new ArrayList<>();
        for (GuildMember member : guild.getMembers()) {
            if (member.getPlayerId() == null) {
                result.memberSkipped();
                discordLogger.logWarning("Guild " + guildName + ": member " + describe(member) + " has no player id, skipping");
                continue;
            }
            try {
                members.add(new ResolvedMember(member, client.fetchPlayer(member.getPlayerId())));
            } catch (IOException e) {
                discordLogger.logWarning("Guild " + guildName + ": could not fetch player " + describe(member)
                        + ", keeping the previous rows: " + e.getMessage());
                members.add(new ResolvedMember(member, null));
            }
        }
        return members;
    }

    private static String describe(GuildMember member) {
        if (member.getPlayerName() != null) {
            return member.getPlayerName() + (member.getPlayerId() != null ? " (" + member.getPlayerId() + ")" : "");
        }
        if (member.getPlayerId() != null) {
            return member.getPlayerId();
        }
        return member.getAllyCode() != null ? "with ally code " + member.getAllyCode() : "without name";
    }

    /**
     * Name used in every table: guild member list, then player detail, then ally code, then id
     */
    static String playerName(GuildMember member, PlayerPayload player) {
        if (member.getPlayerName() != null) {
            return member.getPlayerName();
        }
        if (player != null && player.getName() != null) {
            return player.getName();
        }
        if (member.getAllyCode() != null) {
            return member.getAllyCode();
        }
        return member.getPlayerId();
    }

    private static Map<String, RosterUnit> indexRoster(PlayerPayload player) {
        Map<String, RosterUnit> roster = new LinkedHashMap<>();
        for (RosterUnit unit : player.getRoster()) {
            roster.put(unit.getBaseId(), unit);
        }
        return roster;
    }

    private void observeSkills(String guildName, String playerName, PlayerPayload player, SkillTierAccumulator skillTiers) {
        for (RosterUnit unit : player.getRoster()) {
            for (SkillLevel skill : unit.getSkills()) {
                if (catalog.getSkill(skill.getSkillId()) != null) {
                    skillTiers.observe(guildName, playerName, skill.getSkillId(), skill.getTier());
                }
            }
        }
    }

    private List<String> buildPlayerRow(RunTables tables, String guildName, String playerName,
                                        GuildMember member, PlayerPayload player) {
        String allyCode = member.getAllyCode() != null ? member.getAllyCode() : player.getAllyCode();
        Long gp = member.getGalacticPower() != null ? member.getGalacticPower() : player.getGalacticPower();

        List<String> row = tables.players.newRow();
        Map<String, Integer> columns = tables.playerColumns;
        row.set(columns.get(PLAYER_ID), member.getPlayerId());
        row.set(columns.get(PLAYER_NAME), playerName);
        row.set(columns.get(ALLY_CODE), allyCode == null ? "" : allyCode);
        row.set(columns.get(GUILD_NAME), guildName);
        row.set(columns.get(ROLE), RosterLabels.roleLabel(member.getMemberLevel(), member.getRoleText()));
        row.set(columns.get(LEVEL), player.getLevel() == null ? "" : String.valueOf(player.getLevel()));
        row.set(columns.get(GP), String.valueOf(gp == null ? 0L : gp));
        row.set(columns.get(GAC_LEAGUE), RosterLabels.gacLeague(player.getLeagueId(), player.getDivisionId()));
        return row;
    }

    private List<String> buildUnitRow(RunTables tables, String guildName, String playerName, Map<String, RosterUnit> roster) {
        List<String> row = tables.units.newRow();
        row.set(tables.unitColumns.get(GUILD_NAME), guildName);
        row.set(tables.unitColumns.get(PLAYER_NAME), playerName);
        for (Map.Entry<String, String> column : tables.unitHeaders.entrySet()) {
            RosterUnit unit = roster.get(column.getKey());
            if (unit != null) {
                boolean ship = catalog.getUnit(column.getKey()).isShip();
                row.set(tables.unitColumns.get(column.getValue()), RosterLabels.relicLabel(unit.getRelicTier(), ship));
            }
        }
        return row;
    }

    private List<String> buildSkillRow(RunTables tables, String guildName, String playerName, SkillTierAccumulator skillTiers) {
        List<String> row = tables.skills.newRow();
        row.set(tables.skillColumns.get(PLAYER_GUILD), guildName);
        row.set(tables.skillColumns.get(PLAYER_NAME), playerName);
        for (Map.Entry<String, String> column : tables.skillHeaders.entrySet()) {
            row.set(tables.skillColumns.get(column.getValue()), skillTiers.cellValue(guildName, playerName, column.getKey()));
        }
        return row;
    }

    /**
     * Copies a member's rows from the previous run, moved under the current guild name
     * @return false when the member had no previous rows at all
     */
    private boolean carryOver(GuildMember member, String guildName, Set<String> guildNames, RunTables tables,
                              List<List<String>> playerRows, List<List<String>> unitRows, List<List<String>> skillRows) {
        int playerGuildColumn = tables.playerColumns.get(GUILD_NAME);
        int playerNameColumn = tables.playerColumns.get(PLAYER_NAME);

        List<String> previousPlayer = tables.players.findRow(member.getPlayerId());
        if (previousPlayer == null && member.getPlayerName() != null) {
            for (List<String> row : tables.players.getRows()) {
                if (guildNames.contains(row.get(playerGuildColumn).trim())
                        && row.get(playerNameColumn).trim().equals(member.getPlayerName())) {
                    previousPlayer = row;
                    break;
                }
            }
        }

        String playerName = previousPlayer != null ? previousPlayer.get(playerNameColumn).trim() : member.getPlayerName();
        boolean found = false;
        if (previousPlayer != null) {
            List<String> copy = new ArrayList<>(previousPlayer);
            copy.set(playerGuildColumn, guildName);
            playerRows.add(copy);
            found = true;
        }
        if (playerName == null) {
            return found;
        }

        List<String> previousUnits = findInGuild(tables.units, guildNames, playerName);
        if (previousUnits != null) {
            List<String> copy = new ArrayList<>(previousUnits);
            copy.set(tables.unitColumns.get(GUILD_NAME), guildName);
            unitRows.add(copy);
            found = true;
        }
        List<String> previousSkills = findInGuild(tables.skills, guildNames, playerName);
        if (previousSkills != null) {
            List<String> copy = new ArrayList<>(previousSkills);
            copy.set(tables.skillColumns.get(PLAYER_GUILD), guildName);
            skillRows.add(copy);
            found = true;
        }
        return found;
    }

    private static List<String> findInGuild(TableSnapshot snapshot, Set<String> guildNames, String playerName) {
        for (String guildName : guildNames) {
            List<String> row = snapshot.findRow(TableSnapshot.compositeKey(guildName, playerName));
            if (row != null) {
                return row;
            }
        }
        return null;
    }

    private void writeTables(RunTables tables, SyncReport report) throws SQLException {
        Set<Integer> skillColumnIndices = new HashSet<>();
        for (String header : tables.skillHeaders.values()) {
            skillColumnIndices.add(tables.skillColumns.get(header));
        }
        skillColumnIndices.remove(tables.skillColumns.get(PLAYER_GUILD));
        skillColumnIndices.remove(tables.skillColumns.get(PLAYER_NAME));

        List<String> pruned = matrixGrowth.pruneEmptyColumns(tables.skills, skillColumnIndices);
        report.recordPruned(pruned);
        if (!pruned.isEmpty()) {
            discordLogger.logInfo("Removed " + pruned.size() + " unused skill column(s)");
        }

        store.writeRows(config.getGuildsTable(), tables.guilds.getRows());
        report.recordWrite(config.getGuildsTable(), tables.guilds.getRows().size());
        store.writeRows(config.getPlayersTable(), tables.players.getRows());
        report.recordWrite(config.getPlayersTable(), tables.players.getRows().size());
        store.writeRows(config.getPlayerUnitsTable(), tables.units.getRows());
        report.recordWrite(config.getPlayerUnitsTable(), tables.units.getRows().size());
        store.replaceTable(config.getPlayerSkillsTable(), tables.skills.getHeaders(), tables.skills.getRows());
        report.recordWrite(config.getPlayerSkillsTable(), tables.skills.getRows().size());

        matrixGrowth.recordColumnOwners(config.getPlayerUnitsTable(), tables.unitHeaders, tables.units.getHeaders());
        matrixGrowth.recordColumnOwners(config.getPlayerSkillsTable(), tables.skillHeaders, tables.skills.getHeaders());
        matrixGrowth.saveColumnOwners();
    }
}
