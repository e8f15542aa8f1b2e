package catalog;

import logs.DiscordLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tabular.SqliteTabularStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogLoaderTest {

    private SqliteTabularStore store;

    @BeforeEach
    void createStore() throws Exception {
        Path dir = Files.createTempDirectory("guild-sync-catalog-test-");
        store = new SqliteTabularStore(dir.resolve("roster.db"));
    }

    private CatalogLoader loader(List<String> excludes) {
        return new CatalogLoader(store, "Characters", "Ships", Arrays.asList("CharactersZetas", "CharactersOmicrons"),
                excludes, DiscordLog.consoleOnly());
    }

    @Test
    void unitsAndSkillsShouldLoadWithDisplayNames() throws Exception {
        store.replaceTable("Characters", Arrays.asList("base_id", "Name", "Alignment"), Arrays.asList(
                Arrays.asList("jedimasterkenobi", "Jedi Master Kenobi", "Light Side"),
                Arrays.asList("", "No Id", "Dark Side"),
                Arrays.asList("GLREY", "", "Light Side")));
        store.replaceTable("Ships", Arrays.asList("base_id", "Name"), Collections.singletonList(
                Arrays.asList("CAPITALEXECUTOR", "Executor")));
        store.replaceTable("CharactersZetas", Arrays.asList("base_id", "skillId", "skillName"), Arrays.asList(
                Arrays.asList("JEDIMASTERKENOBI", "uniqueskill_JMK01", "Mystic Intervention"),
                Arrays.asList("UNKNOWNUNIT", "leaderskill_X", "Lead"),
                Arrays.asList("", "specialskill_Y", "Already|Named")));
        store.replaceTable("CharactersOmicrons", Arrays.asList("base_id", "skillId", "skillName", "omicronMode"), Arrays.asList(
                Arrays.asList("JEDIMASTERKENOBI", "uniqueskill_JMK01", "Duplicate Name", "7"),
                Arrays.asList("", "basicskill_Z", "Strike", "")));

        GameCatalog catalog = loader(Collections.emptyList()).load();

        assertEquals(2, catalog.unitCount());
        UnitCatalogEntry kenobi = catalog.getUnit("JEDIMASTERKENOBI");
        assertEquals("Jedi Master Kenobi", kenobi.getFriendlyName());
        assertEquals("Light Side", kenobi.getAlignment());
        assertFalse(kenobi.isShip());
        assertTrue(catalog.getUnit("CAPITALEXECUTOR").isShip());
        assertNull(catalog.getUnit("GLREY"));

        assertEquals(4, catalog.skillCount());
        assertEquals("Jedi Master Kenobi|Mystic Intervention", catalog.getSkill("uniqueskill_JMK01").getDisplayName());
        assertEquals("UNKNOWNUNIT|Lead", catalog.getSkill("leaderskill_X").getDisplayName());
        assertEquals("Already|Named", catalog.getSkill("specialskill_Y").getDisplayName());
        assertEquals("Strike", catalog.getSkill("basicskill_Z").getDisplayName());
    }

    @Test
    void exclusionsShouldDropUnitsAndTheirSkills() throws Exception {
        store.replaceTable("Characters", Arrays.asList("base_id", "Name"), Arrays.asList(
                Arrays.asList("REY", "Rey"),
                Arrays.asList("EVENT_REY", "Event Rey")));
        store.replaceTable("CharactersZetas", Arrays.asList("base_id", "skillid", "skill name"), Arrays.asList(
                Arrays.asList("REY", "uniqueskill_REY01", "Inspiring"),
                Arrays.asList("EVENT_REY", "uniqueskill_EVENTREY01", "Event")));

        GameCatalog catalog = loader(Collections.singletonList("event")).load();

        assertEquals(1, catalog.unitCount());
        assertNull(catalog.getUnit("EVENT_REY"));
        assertEquals(1, catalog.skillCount());
        assertNull(catalog.getSkill("uniqueskill_EVENTREY01"));
    }

    @Test
    void missingOrMalformedSourcesShouldContributeNothing() throws Exception {
        store.replaceTable("Characters", Arrays.asList("Identifier", "Label"), Collections.singletonList(
                Arrays.asList("REY", "Rey")));
        store.replaceTable("Ships", Arrays.asList("Unit Id", "Display Name"), Collections.singletonList(
                Arrays.asList("HOUNDSTOOTH", "Hound's Tooth")));

        GameCatalog catalog = loader(Collections.emptyList()).load();

        assertEquals(1, catalog.unitCount());
        assertEquals("Hound's Tooth", catalog.getUnit("HOUNDSTOOTH").getFriendlyName());
        assertEquals(0, catalog.skillCount());
    }

    @Test
    void columnLookupShouldPreferExactMatches() {
        List<String> headers = Arrays.asList("Name Notes", "base_id", "name");

        assertEquals(1, CatalogLoader.locate(headers, Arrays.asList("base_id", "baseid"), -1));
        assertEquals(2, CatalogLoader.locate(headers, Arrays.asList("name", "friendly"), 1));
        assertEquals(0, CatalogLoader.locate(Arrays.asList("Name Notes", "base_id"), Arrays.asList("name"), 1));
        assertEquals(-1, CatalogLoader.locate(headers, Arrays.asList("alignment"), -1));
    }
}
