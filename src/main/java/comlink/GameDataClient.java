package comlink;

import java.io.IOException;

/**
 * Read access to the game-data service. Implementations retry transient failures themselves;
 * an exception means that one call is given up.
 */
public interface GameDataClient {

    /**
     * Checks that the service answers at all. Any HTTP response counts as reachable.
     * @throws IOException if no connection could be made within the retry budget
     * @throws InterruptedException if interrupted while waiting between attempts
     */
    void checkReachable() throws IOException, InterruptedException;

    /**
     * Fetches a guild's profile and member list
     * @param guildId The guild id
     * @return The parsed payload
     * @throws IOException if the call failed after its retry budget
     * @throws InterruptedException if interrupted while waiting between attempts
     */
    GuildPayload fetchGuild(String guildId) throws IOException, InterruptedException;

    /**
     * Fetches a player's profile, GAC rank and roster
     * @param playerId The player id
     * @return The parsed payload
     * @throws IOException if the call failed after its retry budget
     * @throws InterruptedException if interrupted while waiting between attempts
     */
    PlayerPayload fetchPlayer(String playerId) throws IOException, InterruptedException;
}
