package utils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

/**
 * Settings for one guild sync run, read from the .env file and the process environment.
 * Invalid values fail here, before any guild is processed.
 */
public class SyncConfig {

    private final String comlinkBase;
    private final Map<String, String> comlinkHeaders;
    private final Path databasePath;

    private final String guildsTable;
    private final String playersTable;
    private final String playerUnitsTable;
    private final String playerSkillsTable;
    private final String matrixColumnsTable;
    private final String charactersTable;
    private final String shipsTable;
    private final String zetasTable;
    private final String omicronsTable;

    private final List<String> excludeSubstrings;
    private final List<String> guildFilter;
    private final boolean skipSyncedToday;

    private final int httpRetries;
    private final double httpBackoffSeconds;
    private final double httpBackoffFactor;
    private final double httpTimeoutSeconds;
    private final ZoneId zone;

    private final String discordBotToken;
    private final String discordChannelId;
    private final String discordAdminUserId;

    private SyncConfig(Properties props, Map<String, String> env, List<String> guildFilterOverride) {
        this.comlinkBase = validateBaseUrl(UtilsConfig.requireSetting(props, env, "COMLINK_BASE_URL", "COMLINK_BASE"));
        this.comlinkHeaders = parseHeaders(UtilsConfig.getSetting(props, env, "COMLINK_HEADERS_JSON"));
        this.databasePath = Paths.get(orDefault(UtilsConfig.getSetting(props, env, "DATABASE_PATH"), "database/roster.db"));

        this.guildsTable = orDefault(UtilsConfig.getSetting(props, env, "SHEET_GUILDS"), "Guilds");
        this.playersTable = orDefault(UtilsConfig.getSetting(props, env, "SHEET_PLAYERS"), "Players");
        this.playerUnitsTable = orDefault(UtilsConfig.getSetting(props, env, "SHEET_PLAYER_UNITS"), "Player_Units");
        this.playerSkillsTable = orDefault(UtilsConfig.getSetting(props, env, "SHEET_PLAYER_SKILLS"), "Player_Skills");
        this.matrixColumnsTable = orDefault(UtilsConfig.getSetting(props, env, "SHEET_MATRIX_COLUMNS"), "Matrix_Columns");
        this.charactersTable = orDefault(UtilsConfig.getSetting(props, env, "SHEET_CHARACTERS"), "Characters");
        this.shipsTable = orDefault(UtilsConfig.getSetting(props, env, "SHEET_SHIPS"), "Ships");
        this.zetasTable = orDefault(UtilsConfig.getSetting(props, env, "SHEET_CHARACTERS_ZETAS"), "CharactersZetas");
        this.omicronsTable = orDefault(UtilsConfig.getSetting(props, env, "SHEET_CHARACTERS_OMICRONS"), "CharactersOmicrons");

        List<String> excludes = new ArrayList<>();
        for (String item : UtilsConfig.splitList(UtilsConfig.getSetting(props, env, "EXCLUDE_BASEID_CONTAINS"))) {
            excludes.add(item.toUpperCase(Locale.ROOT));
        }
        this.excludeSubstrings = Collections.unmodifiableList(excludes);
        this.guildFilter = Collections.unmodifiableList(guildFilterOverride != null
                ? new ArrayList<>(guildFilterOverride)
                : UtilsConfig.splitList(UtilsConfig.getSetting(props, env, "GUILD_IDS")));
        this.skipSyncedToday = Boolean.parseBoolean(orDefault(UtilsConfig.getSetting(props, env, "SKIP_SYNCED_TODAY"), "false"));

        this.httpRetries = (int) parsePositive(props, env, "HTTP_RETRIES", "5");
        this.httpBackoffSeconds = parseNonNegative(props, env, "HTTP_BACKOFF_SECONDS", "1.0");
        this.httpBackoffFactor = parsePositive(props, env, "HTTP_BACKOFF_FACTOR", "2.0");
        this.httpTimeoutSeconds = parsePositive(props, env, "HTTP_TIMEOUT_SECONDS", "30");
        this.zone = parseZone(orDefault(UtilsConfig.getSetting(props, env, "TIMEZONE"), "Europe/Madrid"));

        this.discordBotToken = UtilsConfig.getSetting(props, env, "DISCORD_BOT_TOKEN");
        this.discordChannelId = UtilsConfig.getSetting(props, env, "DISCORD_LOG_CHANNELID");
        this.discordAdminUserId = UtilsConfig.getSetting(props, env, "DISCORD_ADMIN_USERID");
    }

    /**
     * Loads the configuration from ./.env and the process environment
     */
    public static SyncConfig load() {
        return fromProperties(UtilsConfig.loadEnvFile(), System.getenv());
    }

    /**
     * Builds the configuration from explicit sources
     * @param props Values from an env file
     * @param env Environment values, which take precedence
     * @throws IllegalStateException if a mandatory value is missing or a value is malformed
     */
    public static SyncConfig fromProperties(Properties props, Map<String, String> env) {
        return new SyncConfig(props, env, null);
    }

    /**
     * Builds the configuration with a guild filter that replaces GUILD_IDS
     */
    public static SyncConfig fromProperties(Properties props, Map<String, String> env, List<String> guildFilter) {
        return new SyncConfig(props, env, guildFilter);
    }

    private static String orDefault(String value, String defaultValue) {
        return value != null ? value : defaultValue;
    }

    private static String validateBaseUrl(String base) {
        String trimmed = base.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
            throw new IllegalStateException("COMLINK_BASE_URL must start with http:// or https://, got: " + base);
        }
        return trimmed;
    }

    private static Map<String, String> parseHeaders(String json) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (json == null) {
            return Collections.unmodifiableMap(headers);
        }
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                throw new IllegalStateException("COMLINK_HEADERS_JSON must be a JSON object");
            }
            JsonObject object = parsed.getAsJsonObject();
            for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
                String value = UtilsJson.asString(entry.getValue());
                if (value != null) {
                    headers.put(entry.getKey(), value);
                }
            }
        } catch (JsonSyntaxException e) {
            throw new IllegalStateException("COMLINK_HEADERS_JSON is not valid JSON", e);
        }
        return Collections.unmodifiableMap(headers);
    }

    private static double parsePositive(Properties props, Map<String, String> env, String name, String defaultValue) {
        double value = parseNumber(props, env, name, defaultValue);
        if (value <= 0) {
            throw new IllegalStateException(name + " must be greater than zero, got: " + value);
        }
        return value;
    }

    private static double parseNonNegative(Properties props, Map<String, String> env, String name, String defaultValue) {
        double value = parseNumber(props, env, name, defaultValue);
        if (value < 0) {
            throw new IllegalStateException(name + " must not be negative, got: " + value);
        }
        return value;
    }

    private static double parseNumber(Properties props, Map<String, String> env, String name, String defaultValue) {
        String raw = orDefault(UtilsConfig.getSetting(props, env, name), defaultValue);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(name + " is not a number: " + raw, e);
        }
    }

    private static ZoneId parseZone(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("TIMEZONE is not a valid zone id: " + zone, e);
        }
    }

    public String getComlinkBase() {
        return comlinkBase;
    }

    public Map<String, String> getComlinkHeaders() {
        return comlinkHeaders;
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    public String getGuildsTable() {
        return guildsTable;
    }

    public String getPlayersTable() {
        return playersTable;
    }

    public String getPlayerUnitsTable() {
        return playerUnitsTable;
    }

    public String getPlayerSkillsTable() {
        return playerSkillsTable;
    }

    /**
     * Table recording which catalog entry owns each wide-table column
     */
    public String getMatrixColumnsTable() {
        return matrixColumnsTable;
    }

    public String getCharactersTable() {
        return charactersTable;
    }

    public String getShipsTable() {
        return shipsTable;
    }

    public String getZetasTable() {
        return zetasTable;
    }

    public String getOmicronsTable() {
        return omicronsTable;
    }

    public List<String> getExcludeSubstrings() {
        return excludeSubstrings;
    }

    public List<String> getGuildFilter() {
        return guildFilter;
    }

    public boolean isSkipSyncedToday() {
        return skipSyncedToday;
    }

    public int getHttpRetries() {
        return httpRetries;
    }

    public double getHttpBackoffSeconds() {
        return httpBackoffSeconds;
    }

    public double getHttpBackoffFactor() {
        return httpBackoffFactor;
    }

    public double getHttpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    public ZoneId getZone() {
        return zone;
    }

    public String getDiscordBotToken() {
        return discordBotToken;
    }

    public String getDiscordChannelId() {
        return discordChannelId;
    }

    public String getDiscordAdminUserId() {
        return discordAdminUserId;
    }
}
