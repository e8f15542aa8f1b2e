package comlink;

import com.google.gson.JsonObject;

import utils.FieldResolver;

/**
 * One entry of a guild's member list
 */
public class GuildMember {

    private static final FieldResolver PLAYER_ID = FieldResolver.of("playerId", "playerID", "id");
    private static final FieldResolver PLAYER_NAME = FieldResolver.of("playerName", "name");
    private static final FieldResolver ALLY_CODE = FieldResolver.of("allyCode", "allycode", "ally");
    private static final FieldResolver MEMBER_LEVEL = FieldResolver.of("memberLevel", "role");
    private static final FieldResolver ROLE_TEXT = FieldResolver.of("role", "memberLevel");
    private static final FieldResolver GALACTIC_POWER = FieldResolver.of("galacticPower", "gp");

    private final String playerId;
    private final String playerName;
    private final String allyCode;
    private final Integer memberLevel;
    private final String roleText;
    private final Long galacticPower;

    public GuildMember(String playerId, String playerName, String allyCode, Integer memberLevel,
                       String roleText, Long galacticPower) {
        this.playerId = playerId;
        this.playerName = playerName;
        this.allyCode = allyCode;
        this.memberLevel = memberLevel;
        this.roleText = roleText;
        this.galacticPower = galacticPower;
    }

    public static GuildMember fromJson(JsonObject json) {
        Integer memberLevel = MEMBER_LEVEL.resolveInt(json);
        String roleText = memberLevel == null ? blankToNull(ROLE_TEXT.resolveString(json)) : null;
        return new GuildMember(
                blankToNull(PLAYER_ID.resolveString(json)),
                blankToNull(PLAYER_NAME.resolveString(json)),
                blankToNull(ALLY_CODE.resolveString(json)),
                memberLevel,
                roleText,
                GALACTIC_POWER.resolveLong(json));
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * @return The player id, or null when the member entry carries no usable id
     */
    public String getPlayerId() {
        return playerId;
    }

    public String getPlayerName() {
        return playerName;
    }

    public String getAllyCode() {
        return allyCode;
    }

    /**
     * @return The numeric member level (2 member, 3 officer, 4 leader), or null
     */
    public Integer getMemberLevel() {
        return memberLevel;
    }

    /**
     * @return A textual role when the payload sent one instead of a numeric level, or null
     */
    public String getRoleText() {
        return roleText;
    }

    public Long getGalacticPower() {
        return galacticPower;
    }
}
