package tabular;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteTabularStoreTest {

    private SqliteTabularStore store;

    @BeforeEach
    void createStore() throws Exception {
        Path dir = Files.createTempDirectory("guild-sync-store-test-");
        store = new SqliteTabularStore(dir.resolve("roster.db"));
    }

    @Test
    void missingTableShouldReadAsEmpty() throws Exception {
        assertFalse(store.tableExists("Guilds"));
        Table table = store.readTable("Guilds");

        assertFalse(table.hasHeaders());
        assertTrue(table.getRows().isEmpty());
    }

    @Test
    void ensureHeadersShouldCreateThenAppendWithoutReordering() throws Exception {
        store.replaceTable("Guilds", Arrays.asList("Guild Id", "Notes", "GP"),
                Collections.singletonList(Arrays.asList("g1", "keep me", "100")));

        Map<String, Integer> columns = store.ensureHeaders("Guilds",
                Arrays.asList("Guild Id", "Guild Name", "Guild GP", "Last Update"));

        assertEquals(0, columns.get("Guild Id"));
        assertEquals(2, columns.get("Guild GP"));
        assertEquals(3, columns.get("Guild Name"));
        assertEquals(4, columns.get("Last Update"));

        Table table = store.readTable("Guilds");
        assertEquals(Arrays.asList("Guild Id", "Notes", "GP", "Guild Name", "Last Update"), table.getHeaders());
        assertEquals(Arrays.asList("g1", "keep me", "100", "", ""), table.getRows().get(0));

        Map<String, Integer> created = store.ensureHeaders("Players", Arrays.asList("Player Id", "Player Name"));
        assertEquals(0, created.get("Player Id"));
        assertTrue(store.tableExists("players"));
    }

    @Test
    void writeRowsShouldReplaceTheBodyAndPadShortRows() throws Exception {
        store.ensureHeaders("Players", Arrays.asList("Player Id", "Player Name", "GP"));
        store.writeRows("Players", Arrays.asList(
                Arrays.asList("p1", "Luke", "100"),
                Arrays.asList("p2", "Leia")));
        store.writeRows("Players", Collections.singletonList(Arrays.asList("p3", "Han", "50")));

        List<List<String>> rows = store.readTable("Players").getRows();
        assertEquals(1, rows.size());
        assertEquals(Arrays.asList("p3", "Han", "50"), rows.get(0));

        store.writeRows("Players", Arrays.asList(Arrays.asList("p1", "Luke"), Arrays.asList("p2", "Leia", "7")));
        rows = store.readTable("Players").getRows();
        assertEquals(Arrays.asList("p1", "Luke", ""), rows.get(0));
        assertEquals("p2", rows.get(1).get(0));
    }

    @Test
    void writeRowsShouldRejectRowsWiderThanTheHeader() throws Exception {
        store.ensureHeaders("Players", Arrays.asList("Player Id", "Player Name"));
        store.writeRows("Players", Collections.singletonList(Arrays.asList("p1", "Luke")));

        assertThrows(IllegalArgumentException.class, () -> store.writeRows("Players",
                Collections.singletonList(Arrays.asList("p1", "Luke", "extra"))));
        assertEquals(1, store.readTable("Players").getRows().size());
        assertThrows(IllegalStateException.class, () -> store.writeRows("Nope", Collections.emptyList()));
    }

    @Test
    void replaceTableShouldRewriteHeadersAndRejectDuplicates() throws Exception {
        store.replaceTable("Player_Skills", Arrays.asList("Player Guild", "Player Name", "Kenobi|Unique"),
                Collections.singletonList(Arrays.asList("Rebels", "Luke", "8")));
        store.replaceTable("Player_Skills", Arrays.asList("Player Guild", "Player Name"),
                Collections.singletonList(Arrays.asList("Rebels", "Luke")));

        Table table = store.readTable("Player_Skills");
        assertEquals(Arrays.asList("Player Guild", "Player Name"), table.getHeaders());
        assertEquals(1, table.getRows().size());

        assertThrows(IllegalArgumentException.class, () -> store.replaceTable("Player_Skills",
                Arrays.asList("Player Name", "player name"), Collections.emptyList()));
    }

    @Test
    void headersWithQuotesShouldSurvive() throws Exception {
        store.ensureHeaders("Player_Units", Arrays.asList("Guild Name", "Player Name", "Padmé \"Queen\" Amidala"));
        store.writeRows("Player_Units", Collections.singletonList(Arrays.asList("Rebels", "Luke", "R5")));

        Table table = store.readTable("Player_Units");
        assertEquals("Padmé \"Queen\" Amidala", table.getHeaders().get(2));
        assertEquals("R5", table.getRows().get(0).get(2));
    }
}
