package comlink;

import java.io.IOException;

import logs.DiscordLog;
import utils.SyncConfig;

/**
 * Bounded retry with exponential backoff for blocking service calls.
 * Before attempt n+1 the caller sleeps baseDelay * factor^(n-1). There is no sleep after the last attempt.
 */
public class RetryPolicy {

    /**
     * A blocking call that may be retried
     */
    @FunctionalInterface
    public interface Call<T> {
        T execute() throws IOException, InterruptedException;
    }

    /**
     * Pause between attempts; replaced in tests
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final double factor;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long baseDelayMillis, double factor, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelayMillis < 0 || factor <= 0) {
            throw new IllegalArgumentException("Backoff delay must not be negative and factor must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = baseDelayMillis;
        this.factor = factor;
        this.sleeper = sleeper;
    }

    /**
     * Creates the policy described by the run configuration, sleeping with Thread.sleep
     */
    public static RetryPolicy fromConfig(SyncConfig config) {
        return new RetryPolicy(config.getHttpRetries(),
                Math.round(config.getHttpBackoffSeconds() * 1000),
                config.getHttpBackoffFactor(),
                Thread::sleep);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay to wait after the given failed attempt (1-based)
     */
    public long delayAfterAttempt(int attempt) {
        return Math.round(baseDelayMillis * Math.pow(factor, attempt - 1));
    }

    /**
     * Runs the call until it succeeds, fails permanently, or runs out of attempts
     * @param description What is being called, for log and error messages
     * @param call The call
     * @param logger Receives a warning per failed attempt, may be null
     * @return The call's result
     * @throws GameDataException if the call failed permanently or every attempt failed
     * @throws InterruptedException if interrupted while waiting between attempts
     */
    public <T> T execute(String description, Call<T> call, DiscordLog logger) throws GameDataException, InterruptedException {
        IOException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.execute();
            } catch (GameDataException e) {
                if (!e.isTransientFailure()) {
                    throw e;
                }
                lastFailure = e;
            } catch (IOException e) {
                lastFailure = e;
            }

            if (attempt < maxAttempts) {
                long delay = delayAfterAttempt(attempt);
                if (logger != null) {
                    logger.logWarning(description + " failed (attempt " + attempt + "/" + maxAttempts + "): "
                            + lastFailure.getMessage() + " - retrying in " + delay + " ms");
                }
                sleeper.sleep(delay);
            }
        }

        int status = lastFailure instanceof GameDataException ? ((GameDataException) lastFailure).getStatusCode() : -1;
        throw new GameDataException(description + " failed after " + maxAttempts + " attempt(s): "
                + lastFailure.getMessage(), status, true, lastFailure);
    }
}
