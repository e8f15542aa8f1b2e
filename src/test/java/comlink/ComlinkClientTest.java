package comlink;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpServer;
import logs.DiscordLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComlinkClientTest {

    private HttpServer server;
    private final List<String> requestBodies = new CopyOnWriteArrayList<>();
    private final List<String> apiKeys = new CopyOnWriteArrayList<>();
    private final AtomicInteger guildCalls = new AtomicInteger();
    private final List<Long> sleeps = new ArrayList<>();
    private ComlinkClient client;

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/guild", exchange -> {
            requestBodies.add(readBody(exchange.getRequestBody()));
            apiKeys.add(exchange.getRequestHeaders().getFirst("x-api-key"));
            if (guildCalls.incrementAndGet() == 1) {
                respond(exchange, 503, "{\"message\":\"warming up\"}");
            } else {
                respond(exchange, 200, "{\"guild\":{\"profile\":{\"name\":\"Rebel Yell\",\"memberCount\":1},"
                        + "\"member\":[{\"playerId\":\"p1\",\"playerName\":\"Luke\",\"memberLevel\":4}]}}");
            }
        });
        server.createContext("/player", exchange -> {
            String body = readBody(exchange.getRequestBody());
            requestBodies.add(body);
            if (body.contains("missing")) {
                respond(exchange, 404, "{\"message\":\"not found\"}");
            } else if (body.contains("broken")) {
                respond(exchange, 200, "<html>");
            } else {
                respond(exchange, 200, "{\"name\":\"Luke\",\"rosterUnit\":[]}");
            }
        });
        server.start();

        String base = "http://127.0.0.1:" + server.getAddress().getPort();
        client = new ComlinkClient(base, Collections.singletonMap("x-api-key", "secret"), Duration.ofSeconds(5),
                new RetryPolicy(3, 100, 2.0, sleeps::add), HttpClient.newHttpClient(), DiscordLog.consoleOnly());
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static String readBody(InputStream in) throws java.io.IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        in.transferTo(out);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body) throws java.io.IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void fetchGuildShouldRetryServerErrorsAndSendTheGuildRequest() throws Exception {
        GuildPayload guild = client.fetchGuild(" g1 ");

        assertEquals("Rebel Yell", guild.getGuildName());
        assertEquals("p1", guild.getMembers().get(0).getPlayerId());
        assertEquals(2, guildCalls.get());
        assertEquals(Collections.singletonList(100L), sleeps);
        assertEquals("secret", apiKeys.get(0));

        JsonObject request = JsonParser.parseString(requestBodies.get(0)).getAsJsonObject();
        assertEquals("g1", request.getAsJsonObject("payload").get("guildId").getAsString());
        assertTrue(request.getAsJsonObject("payload").get("includeRecentGuildActivityInfo").getAsBoolean());
        assertFalse(request.get("enums").getAsBoolean());
    }

    @Test
    void anyAnswerShouldCountAsReachable() throws Exception {
        client.checkReachable();

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void closedPortShouldFailTheReachabilityCheckAfterRetries() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        ComlinkClient closed = new ComlinkClient("http://127.0.0.1:" + port, Collections.emptyMap(), Duration.ofSeconds(2),
                new RetryPolicy(3, 100, 2.0, sleeps::add), HttpClient.newHttpClient(), DiscordLog.consoleOnly());

        GameDataException e = assertThrows(GameDataException.class, closed::checkReachable);

        assertEquals(-1, e.getStatusCode());
        assertTrue(e.isTransientFailure());
        assertEquals(Arrays.asList(100L, 200L), sleeps);
    }

    @Test
    void fetchPlayerShouldSendThePlayerId() throws Exception {
        PlayerPayload player = client.fetchPlayer("p1");

        assertEquals("Luke", player.getName());
        JsonObject request = JsonParser.parseString(requestBodies.get(0)).getAsJsonObject();
        assertEquals("p1", request.getAsJsonObject("payload").get("playerId").getAsString());
    }

    @Test
    void clientErrorsAndMalformedBodiesShouldFailWithoutRetry() {
        GameDataException notFound = assertThrows(GameDataException.class, () -> client.fetchPlayer("missing"));
        assertEquals(404, notFound.getStatusCode());
        assertFalse(notFound.isTransientFailure());

        GameDataException malformed = assertThrows(GameDataException.class, () -> client.fetchPlayer("broken"));
        assertFalse(malformed.isTransientFailure());

        assertEquals(2, requestBodies.size());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void blankIdsShouldBeRejectedBeforeAnyRequest() {
        assertThrows(IllegalArgumentException.class, () -> client.fetchGuild("  "));
        assertThrows(IllegalArgumentException.class, () -> client.fetchPlayer(null));
        assertTrue(requestBodies.isEmpty());
    }
}
