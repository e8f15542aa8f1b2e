package logs;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import utils.SyncConfig;
import utils.UtilsJson;

/**
 * Run logger. Every message is printed to the console; when a Discord bot token and channel
 * are configured it is also posted to that channel.
 * Channel messages are queued and processed sequentially to maintain order.
 * Reacts to Discord rate limits (429) with retry_after delays.
 */
public class DiscordLog {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private final String botToken;
    private final String adminUserId;
    private final String discordApiUrl;
    private final BlockingQueue<QueuedMessage> messageQueue;
    private final AtomicBoolean isProcessing;
    private final HttpClient httpClient;

    private static class QueuedMessage {
        final String message;
        final CompletableFuture<Boolean> future;

        QueuedMessage(String message, CompletableFuture<Boolean> future) {
            this.message = message;
            this.future = future;
        }
    }

    /**
     * Creates a logger. A null or empty token or channel gives a console-only logger.
     * @param botToken The Discord bot token
     * @param channelId The log channel id
     * @param adminUserId User pinged on errors, may be null
     */
    public DiscordLog(String botToken, String channelId, String adminUserId) {
        this.messageQueue = new LinkedBlockingQueue<>();
        this.isProcessing = new AtomicBoolean(false);
        this.adminUserId = adminUserId;

        boolean remote = botToken != null && !botToken.isEmpty() && channelId != null && !channelId.isEmpty();
        if (remote) {
            this.botToken = botToken;
            this.discordApiUrl = "https://discord.com/api/v10/channels/" + channelId + "/messages";
            this.httpClient = HttpClient.newHttpClient();

            // Add shutdown hook to ensure all messages are sent before exit
            Runtime.getRuntime().addShutdownHook(new Thread(this::flush));
        } else {
            this.botToken = null;
            this.discordApiUrl = null;
            this.httpClient = null;
        }
    }

    /**
     * Creates the logger described by the run configuration
     */
    public static DiscordLog fromConfig(SyncConfig config) {
        return new DiscordLog(config.getDiscordBotToken(), config.getDiscordChannelId(), config.getDiscordAdminUserId());
    }

    /**
     * Creates a logger that only writes to the console
     */
    public static DiscordLog consoleOnly() {
        return new DiscordLog(null, null, null);
    }

    /**
     * @return true if messages are also sent to a Discord channel
     */
    public boolean isRemoteEnabled() {
        return discordApiUrl != null;
    }

    /**
     * Gets the caller's filename from the stack trace
     * @return The filename of the caller
     */
    private String getCallerFilename() {
        StackTraceElement[] stackTrace = Thread.currentThread().getStackTrace();

        // Skip internal calls and find the first external caller
        for (StackTraceElement element : stackTrace) {
            String className = element.getClassName();
            String fileName = element.getFileName();

            if (fileName != null &&
                !className.equals(DiscordLog.class.getName()) &&
                !className.startsWith("java.") &&
                !className.startsWith("jdk.") &&
                !className.startsWith("sun.")) {
                return fileName;
            }
        }

        return "CLI";
    }

    /**
     * Formats a log message with emote, timestamp, filename, type, and message
     */
    private String formatMessage(String emote, String type, String message, String filename) {
        String timestamp = LocalDateTime.now().format(TIMESTAMP_FORMAT);
        return String.format("%s [%s] [%s] %s: %s", emote, timestamp, filename, type, message);
    }

    /**
     * Sends a message to the Discord channel
     * @param message The message to send
     * @return Retry delay in milliseconds (0 if successful, -1 if failed, >0 if rate limited)
     */
    private long sendMessage(String message) {
        JsonObject payload = new JsonObject();
        payload.addProperty("content", message);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(this.discordApiUrl))
                .header("Authorization", "Bot " + this.botToken)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload.toString()))
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() == 200 || response.statusCode() == 201) {
                return 0;
            }
            System.err.println("Failed to send message to Discord. Status code: " + response.statusCode());
            System.err.println("Response: " + response.body());
            if (response.statusCode() == 429) {
                return parseRetryAfterMillis(response.body());
            }
            return -1;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        } catch (Exception e) {
            System.err.println("Error sending message to Discord: " + e.getMessage());
            return -1;
        }
    }

    /**
     * Reads retry_after (seconds) from a 429 body. Defaults to 1 second when it cannot be parsed.
     */
    static long parseRetryAfterMillis(String body) {
        try {
            JsonElement parsed = JsonParser.parseString(body);
            if (parsed.isJsonObject()) {
                JsonElement retryAfter = parsed.getAsJsonObject().get("retry_after");
                if (retryAfter != null && retryAfter.isJsonPrimitive() && retryAfter.getAsJsonPrimitive().isNumber()) {
                    long millis = (long) (retryAfter.getAsDouble() * 1000);
                    return millis > 0 ? millis : 1000;
                }
                Long fallback = UtilsJson.asLong(retryAfter);
                if (fallback != null && fallback > 0) {
                    return fallback * 1000;
                }
            }
        } catch (JsonParseException e) {
            System.err.println("Error parsing retry_after: " + e.getMessage());
        }
        return 1000;
    }

    /**
     * Processes the message queue sequentially with reactive rate limiting
     */
    private void processQueue() {
        if (!isProcessing.compareAndSet(false, true)) {
            return;
        }

        CompletableFuture.runAsync(() -> {
            try {
                QueuedMessage queuedMsg;
                while ((queuedMsg = messageQueue.poll()) != null) {
                    long result = sendMessage(queuedMsg.message);

                    while (result > 0) {
                        try {
                            Thread.sleep(result);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            result = -1;
                            break;
                        }
                        result = sendMessage(queuedMsg.message);
                    }

                    queuedMsg.future.complete(result == 0);
                }
            } finally {
                isProcessing.set(false);

                // Check if new messages arrived while we were finishing
                if (!messageQueue.isEmpty()) {
                    processQueue();
                }
            }
        });
    }

    /**
     * Waits for all queued messages to be sent
     */
    public void flush() {
        while (!messageQueue.isEmpty() || isProcessing.get()) {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private CompletableFuture<Boolean> queueMessage(String message) {
        if (!isRemoteEnabled()) {
            return CompletableFuture.completedFuture(true);
        }
        CompletableFuture<Boolean> future = new CompletableFuture<>();
        messageQueue.add(new QueuedMessage(message, future));
        processQueue();
        return future;
    }

    /**
     * Sends an error log message, pinging the admin user if one is configured
     * @return CompletableFuture that resolves to true if delivered (always true in console-only mode)
     */
    public CompletableFuture<Boolean> logError(String message) {
        String formattedMessage = formatMessage("🔴", "ERROR", message, getCallerFilename());
        System.err.println(formattedMessage);

        if (adminUserId != null && !adminUserId.isEmpty()) {
            formattedMessage = "<@" + adminUserId + "> " + formattedMessage;
        }
        return queueMessage(formattedMessage);
    }

    public CompletableFuture<Boolean> logSuccess(String message) {
        String formattedMessage = formatMessage("🟢", "SUCCESS", message, getCallerFilename());
        System.out.println(formattedMessage);
        return queueMessage(formattedMessage);
    }

    public CompletableFuture<Boolean> logWarning(String message) {
        String formattedMessage = formatMessage("🟡", "WARNING", message, getCallerFilename());
        System.out.println(formattedMessage);
        return queueMessage(formattedMessage);
    }

    public CompletableFuture<Boolean> logInfo(String message) {
        String formattedMessage = formatMessage("🔵", "INFO", message, getCallerFilename());
        System.out.println(formattedMessage);
        return queueMessage(formattedMessage);
    }
}
