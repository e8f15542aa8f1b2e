package comlink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import utils.FieldResolver;

/**
 * A character or ship owned by a player, as reported by /player
 */
public class RosterUnit {

    private static final FieldResolver DEFINITION_ID = FieldResolver.of("definitionId");
    private static final FieldResolver FALLBACK_ID = FieldResolver.of("defId", "baseId", "id");
    private static final FieldResolver RELIC_TIER = FieldResolver.of("relic.currentTier", "currentRelicTier", "relicTier", "relic.tier");
    private static final FieldResolver SKILLS = FieldResolver.of("skill", "skills");
    private static final FieldResolver SKILL_ID = FieldResolver.of("id", "skillId");
    private static final FieldResolver SKILL_TIER = FieldResolver.of("tier");

    private final String baseId;
    private final Integer relicTier;
    private final List<SkillLevel> skills;

    public RosterUnit(String baseId, Integer relicTier, List<SkillLevel> skills) {
        this.baseId = baseId;
        this.relicTier = relicTier;
        this.skills = Collections.unmodifiableList(new ArrayList<>(skills));
    }

    /**
     * Parses a roster entry. definitionId has the form "BASEID:VARIANT"; only the part before ':' is kept.
     * @return The unit, or null if no base id can be found
     */
    public static RosterUnit fromJson(JsonObject json) {
        String baseId;
        String definitionId = DEFINITION_ID.resolveString(json);
        if (definitionId != null) {
            baseId = definitionId.split(":", 2)[0];
        } else {
            baseId = FALLBACK_ID.resolveString(json);
        }
        if (baseId == null || baseId.trim().isEmpty()) {
            return null;
        }

        List<SkillLevel> skills = new ArrayList<>();
        JsonArray skillArray = SKILLS.resolveArray(json);
        if (skillArray != null) {
            for (JsonElement element : skillArray) {
                if (!element.isJsonObject()) {
                    continue;
                }
                JsonObject skill = element.getAsJsonObject();
                String skillId = SKILL_ID.resolveString(skill);
                if (skillId != null) {
                    skills.add(new SkillLevel(skillId.trim(), SKILL_TIER.resolveInt(skill)));
                }
            }
        }

        return new RosterUnit(baseId.trim().toUpperCase(Locale.ROOT), RELIC_TIER.resolveInt(json), skills);
    }

    public String getBaseId() {
        return baseId;
    }

    /**
     * @return The raw relic tier code, or null when absent
     */
    public Integer getRelicTier() {
        return relicTier;
    }

    public List<SkillLevel> getSkills() {
        return skills;
    }

    @Override
    public String toString() {
        return "RosterUnit{" + baseId + ", relicTier=" + relicTier + ", skills=" + skills.size() + "}";
    }

    static List<RosterUnit> parseAll(JsonArray array) {
        List<RosterUnit> units = new ArrayList<>();
        if (array == null) {
            return units;
        }
        for (JsonElement element : array) {
            if (element.isJsonObject()) {
                RosterUnit unit = fromJson(element.getAsJsonObject());
                if (unit != null) {
                    units.add(unit);
                }
            }
        }
        return units;
    }
}
