package comlink;

import logs.DiscordLog;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(4, 1000, 2.0, sleeps::add);
    private final DiscordLog logger = DiscordLog.consoleOnly();

    @Test
    void delaysShouldGrowExponentially() {
        assertEquals(1000, policy.delayAfterAttempt(1));
        assertEquals(2000, policy.delayAfterAttempt(2));
        assertEquals(4000, policy.delayAfterAttempt(3));
    }

    @Test
    void transientFailuresShouldBeRetriedUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("Guild fetch g1", () -> {
            int call = calls.incrementAndGet();
            if (call == 1) {
                throw new SocketTimeoutException("timed out");
            }
            if (call == 2) {
                throw GameDataException.forStatus("/guild", 503, "busy");
            }
            return "ok";
        }, logger);

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(Arrays.asList(1000L, 2000L), sleeps);
    }

    @Test
    void exhaustionShouldSurfaceOneFailureWithoutTrailingSleep() {
        AtomicInteger calls = new AtomicInteger();

        GameDataException failure = assertThrows(GameDataException.class, () -> policy.execute("Player fetch p1", () -> {
            calls.incrementAndGet();
            throw GameDataException.forStatus("/player", 429, "{\"message\":\"slow down\"}");
        }, logger));

        assertEquals(4, calls.get());
        assertEquals(Arrays.asList(1000L, 2000L, 4000L), sleeps);
        assertEquals(429, failure.getStatusCode());
        assertTrue(failure.getMessage().contains("after 4 attempt(s)"));
    }

    @Test
    void permanentFailuresShouldNotBeRetried() {
        AtomicInteger calls = new AtomicInteger();

        GameDataException failure = assertThrows(GameDataException.class, () -> policy.execute("Guild fetch bad", () -> {
            calls.incrementAndGet();
            throw GameDataException.forStatus("/guild", 400, "bad request");
        }, logger));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
        assertEquals(400, failure.getStatusCode());
    }

    @Test
    void statusClassificationShouldMarkRateLimitsAndServerErrorsTransient() {
        assertTrue(GameDataException.forStatus("/guild", 429, "").isTransientFailure());
        assertTrue(GameDataException.forStatus("/guild", 502, "").isTransientFailure());
        assertEquals(false, GameDataException.forStatus("/guild", 404, "").isTransientFailure());
    }

    @Test
    void invalidSettingsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 1000, 2.0, sleeps::add));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, -1, 2.0, sleeps::add));
    }

    @Test
    void nonServiceIoFailuresShouldCountAsTransient() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy twice = new RetryPolicy(2, 10, 2.0, sleeps::add);

        GameDataException failure = assertThrows(GameDataException.class, () -> twice.execute("Player fetch p2", () -> {
            calls.incrementAndGet();
            throw new IOException("connection refused");
        }, null));

        assertEquals(2, calls.get());
        assertEquals(-1, failure.getStatusCode());
        assertTrue(failure.isTransientFailure());
    }
}
