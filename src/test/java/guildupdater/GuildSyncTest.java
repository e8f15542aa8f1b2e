package guildupdater;

import comlink.GuildMember;
import comlink.GuildPayload;
import comlink.PlayerPayload;
import comlink.RosterUnit;
import comlink.SkillLevel;
import logs.DiscordLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tabular.SqliteTabularStore;
import tabular.Table;
import utils.SyncConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GuildSyncTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T10:00:00Z"), ZoneOffset.UTC);

    private Path dbPath;
    private FakeGameDataClient client;

    @BeforeEach
    void setUp() throws Exception {
        dbPath = Files.createTempDirectory("guild-sync-test-").resolve("roster.db");
        client = new FakeGameDataClient();
        client.guilds.put("g1", new GuildPayload("Rebels", 1, 5000000L, "", "",
                Collections.singletonList(new GuildMember("p1", "Luke", "111", 4, null, null))));
        client.players.put("p1", new PlayerPayload("Luke", "111", 85, 5000000L, "KYBER", 5, Arrays.asList(
                new RosterUnit("JEDIMASTERKENOBI", 9, Collections.singletonList(new SkillLevel("uniqueskill_JMK01", 8))),
                new RosterUnit("EVENT_REYTRAINING", 3, Collections.emptyList()))));
    }

    private GuildSync guildSync(SqliteTabularStore store) {
        Properties props = new Properties();
        props.setProperty("COMLINK_BASE_URL", "http://localhost:3200");
        props.setProperty("DATABASE_PATH", dbPath.toString());
        props.setProperty("EXCLUDE_BASEID_CONTAINS", "event_");
        SyncConfig config = SyncConfig.fromProperties(props, new HashMap<>());
        return new GuildSync(config, DiscordLog.consoleOnly(), store, client, CLOCK);
    }

    @Test
    void fromConfigShouldLogThroughTheGivenLogger() {
        Properties props = new Properties();
        props.setProperty("COMLINK_BASE_URL", "http://localhost:3200");
        props.setProperty("DATABASE_PATH", dbPath.toString());
        DiscordLog discordLogger = DiscordLog.consoleOnly();

        GuildSync guildSync = GuildSync.fromConfig(SyncConfig.fromProperties(props, new HashMap<>()), discordLogger);

        assertSame(discordLogger, guildSync.getDiscordLogger());
    }

    @Test
    void missingDatabaseFileShouldStopBeforeAnyFetch() {
        GuildSync guildSync = guildSync(new SqliteTabularStore(dbPath));

        IllegalStateException e = assertThrows(IllegalStateException.class, guildSync::sync);
        assertTrue(e.getMessage().contains("does not exist"));
        assertTrue(client.calls.isEmpty());
        assertFalse(Files.exists(dbPath));
    }

    @Test
    void syncShouldUseTheCatalogStoredNextToTheRoster() throws Exception {
        SqliteTabularStore store = new SqliteTabularStore(dbPath);
        store.replaceTable("Guilds", Arrays.asList("Guild Id", "Guild Name"),
                Collections.singletonList(Arrays.asList("g1", "")));
        store.replaceTable("Characters", Arrays.asList("base_id", "Name", "Alignment"), Arrays.asList(
                Arrays.asList("JEDIMASTERKENOBI", "Jedi Master Kenobi", "Light Side"),
                Arrays.asList("EVENT_REYTRAINING", "Rey (Training Event)", "Light Side")));
        store.replaceTable("CharactersZetas", Arrays.asList("base_id", "skillId", "skillName"),
                Collections.singletonList(Arrays.asList("JEDIMASTERKENOBI", "uniqueskill_JMK01", "Mystic Intervention")));

        SyncReport report = guildSync(store).sync();

        assertEquals(1, report.getSucceeded());
        Table units = store.readTable("Player_Units");
        assertEquals(Arrays.asList("Guild Name", "Player Name", "Jedi Master Kenobi"), units.getHeaders());
        assertEquals(Collections.singletonList(Arrays.asList("Rebels", "Luke", "R7")), units.getRows());

        Table skills = store.readTable("Player_Skills");
        assertEquals(Arrays.asList("Player Guild", "Player Name", "Jedi Master Kenobi|Mystic Intervention"), skills.getHeaders());
        assertEquals(Collections.singletonList(Arrays.asList("Rebels", "Luke", "8")), skills.getRows());
    }
}
