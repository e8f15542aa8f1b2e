package guildupdater;

import java.util.HashMap;
import java.util.Map;

/**
 * Highest skill tier seen per (guild, player, skill) during one run
 */
public class SkillTierAccumulator {

    private final Map<String, Map<String, Integer>> tiers = new HashMap<>();

    /**
     * Records a tier. A lower tier than the one already recorded, or a null tier, changes nothing.
     */
    public void observe(String guildName, String playerName, String skillId, Integer tier) {
        if (tier == null) {
            return;
        }
        Map<String, Integer> playerTiers = tiers.computeIfAbsent(TableSnapshot.compositeKey(guildName, playerName), k -> new HashMap<>());
        playerTiers.merge(skillId, tier, Math::max);
    }

    /**
     * @return The highest tier seen, or null
     */
    public Integer get(String guildName, String playerName, String skillId) {
        Map<String, Integer> playerTiers = tiers.get(TableSnapshot.compositeKey(guildName, playerName));
        return playerTiers == null ? null : playerTiers.get(skillId);
    }

    /**
     * @return The highest tier seen as a cell value, "" if none
     */
    public String cellValue(String guildName, String playerName, String skillId) {
        Integer tier = get(guildName, playerName, skillId);
        return tier == null ? "" : String.valueOf(tier);
    }
}
