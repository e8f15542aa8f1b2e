package guildupdater;

import java.sql.SQLException;
import java.time.Clock;
import java.util.Arrays;

import catalog.CatalogLoader;
import catalog.GameCatalog;
import comlink.ComlinkClient;
import comlink.GameDataClient;
import logs.DiscordLog;
import tabular.SqliteTabularStore;
import tabular.TabularStore;
import utils.SyncConfig;
import utils.UtilsConfig;
import utils.UtilsDatabase;

/**
 * Runs one guild sync pass: loads the catalog from the store, then syncs every configured guild.
 * Usage: GuildSync [guildId ...] (ids given here replace GUILD_IDS)
 */
public class GuildSync {

    private final SyncConfig config;
    private final DiscordLog discordLogger;
    private final TabularStore store;
    private final GameDataClient client;
    private final Clock clock;

    public GuildSync(SyncConfig config, DiscordLog discordLogger, TabularStore store, GameDataClient client, Clock clock) {
        this.config = config;
        this.discordLogger = discordLogger;
        this.store = store;
        this.client = client;
        this.clock = clock;
    }

    /**
     * Wires the SQLite store, the Comlink client and the logger described by the configuration
     */
    public static GuildSync fromConfig(SyncConfig config) {
        return fromConfig(config, DiscordLog.fromConfig(config));
    }

    /**
     * Same as {@link #fromConfig(SyncConfig)} but logs through an existing logger
     */
    public static GuildSync fromConfig(SyncConfig config, DiscordLog discordLogger) {
        return new GuildSync(config, discordLogger, new SqliteTabularStore(config.getDatabasePath()),
                ComlinkClient.fromConfig(config, discordLogger), Clock.system(config.getZone()));
    }

    public DiscordLog getDiscordLogger() {
        return discordLogger;
    }

    /**
     * Runs the sync
     * @return The run report
     * @throws IllegalStateException if the database file or the Guilds table is missing, or there are no guild ids
     */
    public SyncReport sync() throws SQLException, InterruptedException {
        if (!UtilsDatabase.databaseExists(config.getDatabasePath())) {
            throw new IllegalStateException("Database file does not exist: " + config.getDatabasePath().toAbsolutePath());
        }

        GameCatalog catalog = CatalogLoader.fromConfig(store, config, discordLogger).load();
        GuildSyncOrchestrator orchestrator = new GuildSyncOrchestrator(store, client, catalog, config, discordLogger, clock);
        return orchestrator.run();
    }

    public static void main(String[] args) {
        GuildSync guildSync = null;
        try {
            SyncConfig config = SyncConfig.fromProperties(UtilsConfig.loadEnvFile(), System.getenv(),
                    args.length > 0 ? Arrays.asList(args) : null);
            guildSync = GuildSync.fromConfig(config);
            guildSync.sync();
            guildSync.getDiscordLogger().flush();
        } catch (Exception e) {
            String errorMsg = "Guild sync failed: " + e.getMessage();
            System.err.println(errorMsg);
            e.printStackTrace();

            if (guildSync != null) {
                guildSync.getDiscordLogger().logError(errorMsg);
                guildSync.getDiscordLogger().logError("Stack trace: " + UtilsConfig.getStackTraceAsString(e));
                guildSync.getDiscordLogger().flush();
            }
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            System.exit(1);
        }
    }
}
