package utils;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncConfigTest {

    private static Properties minimal() {
        Properties props = new Properties();
        props.setProperty("COMLINK_BASE_URL", "http://localhost:3200/");
        return props;
    }

    @Test
    void defaultsShouldApplyWhenOnlyTheBaseUrlIsSet() {
        SyncConfig config = SyncConfig.fromProperties(minimal(), Collections.emptyMap());

        assertEquals("http://localhost:3200", config.getComlinkBase());
        assertTrue(config.getComlinkHeaders().isEmpty());
        assertEquals(Paths.get("database/roster.db"), config.getDatabasePath());
        assertEquals("Guilds", config.getGuildsTable());
        assertEquals("Players", config.getPlayersTable());
        assertEquals("Player_Units", config.getPlayerUnitsTable());
        assertEquals("Player_Skills", config.getPlayerSkillsTable());
        assertEquals("CharactersZetas", config.getZetasTable());
        assertEquals("CharactersOmicrons", config.getOmicronsTable());
        assertEquals(5, config.getHttpRetries());
        assertEquals(1.0, config.getHttpBackoffSeconds());
        assertEquals(2.0, config.getHttpBackoffFactor());
        assertEquals(ZoneId.of("Europe/Madrid"), config.getZone());
        assertFalse(config.isSkipSyncedToday());
        assertTrue(config.getGuildFilter().isEmpty());
    }

    @Test
    void environmentShouldOverrideTheEnvFile() {
        Properties props = minimal();
        props.setProperty("HTTP_RETRIES", "3");
        props.setProperty("EXCLUDE_BASEID_CONTAINS", "event, _npc");
        Map<String, String> env = new HashMap<>();
        env.put("HTTP_RETRIES", "7");
        env.put("GUILD_IDS", "g1, g2,,");
        env.put("COMLINK_HEADERS_JSON", "{\"x-api-key\":\"secret\"}");

        SyncConfig config = SyncConfig.fromProperties(props, env);

        assertEquals(7, config.getHttpRetries());
        assertEquals(Arrays.asList("EVENT", "_NPC"), config.getExcludeSubstrings());
        assertEquals(Arrays.asList("g1", "g2"), config.getGuildFilter());
        assertEquals("secret", config.getComlinkHeaders().get("x-api-key"));
    }

    @Test
    void explicitGuildFilterShouldReplaceGuildIds() {
        Properties props = minimal();
        props.setProperty("GUILD_IDS", "g1");

        SyncConfig config = SyncConfig.fromProperties(props, Collections.emptyMap(), Collections.singletonList("g9"));

        assertEquals(Collections.singletonList("g9"), config.getGuildFilter());
    }

    @Test
    void misconfigurationShouldFailFast() {
        assertThrows(IllegalStateException.class, () -> SyncConfig.fromProperties(new Properties(), Collections.emptyMap()));

        Properties badUrl = new Properties();
        badUrl.setProperty("COMLINK_BASE_URL", "localhost:3200");
        assertThrows(IllegalStateException.class, () -> SyncConfig.fromProperties(badUrl, Collections.emptyMap()));

        Properties badNumber = minimal();
        badNumber.setProperty("HTTP_BACKOFF_FACTOR", "fast");
        assertThrows(IllegalStateException.class, () -> SyncConfig.fromProperties(badNumber, Collections.emptyMap()));

        Properties badZone = minimal();
        badZone.setProperty("TIMEZONE", "Mars/Olympus");
        assertThrows(IllegalStateException.class, () -> SyncConfig.fromProperties(badZone, Collections.emptyMap()));

        Properties badHeaders = minimal();
        badHeaders.setProperty("COMLINK_HEADERS_JSON", "[1,2]");
        assertThrows(IllegalStateException.class, () -> SyncConfig.fromProperties(badHeaders, Collections.emptyMap()));
    }

    @Test
    void envFileShouldLoadWhenPresentAndBeEmptyWhenMissing() throws Exception {
        Path dir = Files.createTempDirectory("guild-sync-config-test-");
        Path envFile = dir.resolve(".env");
        Files.write(envFile, Arrays.asList("COMLINK_BASE=https://comlink.example", "SKIP_SYNCED_TODAY=true"));

        Properties props = UtilsConfig.loadEnvFile(envFile);
        SyncConfig config = SyncConfig.fromProperties(props, Collections.emptyMap());

        assertEquals("https://comlink.example", config.getComlinkBase());
        assertTrue(config.isSkipSyncedToday());
        assertTrue(UtilsConfig.loadEnvFile(dir.resolve("missing.env")).isEmpty());
    }
}
