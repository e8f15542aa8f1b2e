package catalog;

/**
 * A zeta- or omicron-eligible skill tracked in the skills matrix
 */
public class SkillCatalogEntry {

    private final String skillId;
    private final String displayName;

    public SkillCatalogEntry(String skillId, String displayName) {
        this.skillId = skillId;
        this.displayName = displayName;
    }

    public String getSkillId() {
        return skillId;
    }

    /**
     * @return Usually "CharacterName|SkillName"
     */
    public String getDisplayName() {
        return displayName;
    }
}
