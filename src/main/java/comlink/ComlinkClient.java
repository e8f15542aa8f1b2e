package comlink;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import logs.DiscordLog;
import utils.SyncConfig;

/**
 * Client for a Comlink deployment of the game-data service.
 * Primary endpoint: POST {base}/guild
 * Secondary endpoint: POST {base}/player
 * Reachability: POST {base}/metadata
 * Every call runs under the configured RetryPolicy.
 */
public class ComlinkClient implements GameDataClient {

    private final String baseUrl;
    private final Map<String, String> extraHeaders;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final HttpClient httpClient;
    private final DiscordLog discordLogger;

    public ComlinkClient(String baseUrl, Map<String, String> extraHeaders, Duration timeout,
                         RetryPolicy retryPolicy, HttpClient httpClient, DiscordLog discordLogger) {
        this.baseUrl = baseUrl;
        this.extraHeaders = extraHeaders;
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
        this.httpClient = httpClient;
        this.discordLogger = discordLogger;
    }

    /**
     * Creates the client described by the run configuration
     */
    public static ComlinkClient fromConfig(SyncConfig config, DiscordLog discordLogger) {
        Duration timeout = Duration.ofMillis(Math.round(config.getHttpTimeoutSeconds() * 1000));
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        return new ComlinkClient(config.getComlinkBase(), config.getComlinkHeaders(), timeout,
                RetryPolicy.fromConfig(config), httpClient, discordLogger);
    }

    @Override
    public void checkReachable() throws IOException, InterruptedException {
        JsonObject body = wrap(new JsonObject());
        int status = retryPolicy.execute("Reachability check",
                () -> httpClient.send(buildRequest("/metadata", body), HttpResponse.BodyHandlers.discarding()).statusCode(),
                discordLogger);
        if (status != 200) {
            discordLogger.logWarning("POST /metadata answered " + status + ", the service is up but may not be healthy");
        }
    }

    @Override
    public GuildPayload fetchGuild(String guildId) throws IOException, InterruptedException {
        String gid = requireId(guildId, "guildId");

        JsonObject payload = new JsonObject();
        payload.addProperty("guildId", gid);
        payload.addProperty("includeRecentGuildActivityInfo", true);

        JsonObject response = retryPolicy.execute("Guild fetch " + gid,
                () -> postJson("/guild", wrap(payload)), discordLogger);
        return GuildPayload.fromJson(response);
    }

    @Override
    public PlayerPayload fetchPlayer(String playerId) throws IOException, InterruptedException {
        String pid = requireId(playerId, "playerId");

        JsonObject payload = new JsonObject();
        payload.addProperty("playerId", pid);

        JsonObject response = retryPolicy.execute("Player fetch " + pid,
                () -> postJson("/player", wrap(payload)), discordLogger);
        return PlayerPayload.fromJson(response);
    }

    private static String requireId(String id, String name) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return id.trim();
    }

    private static JsonObject wrap(JsonObject payload) {
        JsonObject body = new JsonObject();
        body.add("payload", payload);
        body.addProperty("enums", false);
        return body;
    }

    private HttpRequest buildRequest(String path, JsonObject body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.POST(HttpRequest.BodyPublishers.ofString(body.toString())).build();
    }

    /**
     * Sends one POST and parses the JSON object it returns. An empty body parses as {}.
     */
    private JsonObject postJson(String path, JsonObject body) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(buildRequest(path, body), HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw GameDataException.forStatus(path, response.statusCode(), response.body());
        }

        String text = response.body();
        if (text == null || text.trim().isEmpty()) {
            return new JsonObject();
        }
        try {
            JsonElement parsed = JsonParser.parseString(text);
            if (!parsed.isJsonObject()) {
                throw new GameDataException("POST " + path + " returned a non-object JSON body", 200, false);
            }
            return parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new GameDataException("POST " + path + " returned malformed JSON: " + e.getMessage(), 200, false, e);
        }
    }
}
