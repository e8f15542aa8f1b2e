package tabular;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class HeaderResolverTest {

    private final HeaderResolver resolver = HeaderResolver.DEFAULT;

    @Test
    void matchingShouldIgnoreCaseAndSpaces() {
        List<String> headers = Arrays.asList("guild id", " GUILD NAME ", "Notes");

        assertEquals(0, resolver.resolve(headers, "Guild Id"));
        assertEquals(1, resolver.resolve(headers, "Guild Name"));
        assertEquals(-1, resolver.resolve(headers, "Members"));
    }

    @Test
    void synonymsShouldResolveLegacyHeaders() {
        List<String> headers = Arrays.asList("Guild Id", "Guild Name", "Number of members", "GP", "Last Updated");

        Map<String, Integer> resolved = resolver.resolveAll(headers,
                Arrays.asList("Guild Id", "Guild Name", "Members", "Guild GP", "Last Update"));

        assertEquals(2, resolved.get("Members"));
        assertEquals(3, resolved.get("Guild GP"));
        assertEquals(4, resolved.get("Last Update"));
    }

    @Test
    void synonymsShouldNotStealExactMatches() {
        List<String> headers = Arrays.asList("Player Guild", "Guild Name", "Player Name");

        Map<String, Integer> resolved = resolver.resolveAll(headers, Arrays.asList("Player Guild", "Guild Name"));

        assertEquals(0, resolved.get("Player Guild"));
        assertEquals(1, resolved.get("Guild Name"));

        Map<String, Integer> unitsKeys = resolver.resolveAll(Arrays.asList("Player Guild", "Player Name"),
                Arrays.asList("Guild Name", "Player Name"));
        assertEquals(0, unitsKeys.get("Guild Name"));
        assertEquals(1, unitsKeys.get("Player Name"));
        assertFalse(resolver.resolveAll(Arrays.asList("Player Name"), Arrays.asList("Guild Name")).containsKey("Guild Name"));
    }
}
