package comlink;

import java.io.IOException;

/**
 * A call to the game-data service that did not produce a usable payload.
 */
public class GameDataException extends IOException {

    private final int statusCode;
    private final boolean transientFailure;

    public GameDataException(String message, int statusCode, boolean transientFailure) {
        super(message);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public GameDataException(String message, int statusCode, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    /**
     * Builds the exception for an unexpected HTTP status. 429 and 5xx are transient.
     */
    public static GameDataException forStatus(String endpoint, int statusCode, String body) {
        boolean transientStatus = statusCode == 429 || statusCode >= 500;
        String snippet = body == null ? "" : body.length() > 200 ? body.substring(0, 200) + "..." : body;
        return new GameDataException("POST " + endpoint + " failed with status code: " + statusCode
                + (snippet.isEmpty() ? "" : " - " + snippet), statusCode, transientStatus);
    }

    /**
     * @return The HTTP status code, or -1 when the failure happened before a response arrived
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return true if retrying the same call may succeed
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
