package comlink;

/**
 * One skill of a roster unit with its current tier
 */
public class SkillLevel {

    private final String skillId;
    private final Integer tier;

    public SkillLevel(String skillId, Integer tier) {
        this.skillId = skillId;
        this.tier = tier;
    }

    public String getSkillId() {
        return skillId;
    }

    /**
     * @return The tier, or null when the payload did not carry one
     */
    public Integer getTier() {
        return tier;
    }
}
