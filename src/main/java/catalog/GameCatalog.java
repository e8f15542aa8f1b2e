package catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Units and tracked skills known for one run. Built once and passed to the sync; never changes afterwards.
 * Both maps iterate in key order.
 */
public class GameCatalog {

    private final Map<String, UnitCatalogEntry> units;
    private final Map<String, SkillCatalogEntry> skills;

    public GameCatalog(Map<String, UnitCatalogEntry> units, Map<String, SkillCatalogEntry> skills) {
        this.units = Collections.unmodifiableMap(new TreeMap<>(units));
        this.skills = Collections.unmodifiableMap(new TreeMap<>(skills));
    }

    public static GameCatalog empty() {
        return new GameCatalog(Collections.emptyMap(), Collections.emptyMap());
    }

    public Collection<UnitCatalogEntry> getUnits() {
        return units.values();
    }

    public Collection<SkillCatalogEntry> getSkills() {
        return skills.values();
    }

    /**
     * @return The unit, or null when the base id is not in the catalog
     */
    public UnitCatalogEntry getUnit(String baseId) {
        return units.get(baseId);
    }

    /**
     * @return The skill, or null when the skill is not tracked
     */
    public SkillCatalogEntry getSkill(String skillId) {
        return skills.get(skillId);
    }

    public int unitCount() {
        return units.size();
    }

    public int skillCount() {
        return skills.size();
    }
}
