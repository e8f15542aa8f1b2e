package comlink;

import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import utils.FieldResolver;
import utils.UtilsJson;

/**
 * Player detail returned by /player: profile, GAC rank and roster
 */
public class PlayerPayload {

    private static final String GP_STAT_KEY = "STAT_GALACTIC_POWER_ACQUIRED_NAME";

    private static final FieldResolver ROOT = FieldResolver.of("payload");
    private static final FieldResolver NAME = FieldResolver.of("name", "playerName");
    private static final FieldResolver ALLY_CODE = FieldResolver.of("allyCode", "allycode");
    private static final FieldResolver LEVEL = FieldResolver.of("level");
    private static final FieldResolver GALACTIC_POWER = FieldResolver.of("galacticPower", "statistics.galacticPower");
    private static final FieldResolver PROFILE_STATS = FieldResolver.of("profileStat");
    private static final FieldResolver RANK_STATUS = FieldResolver.of("playerRating.playerRankStatus");
    private static final FieldResolver LEAGUE = FieldResolver.of("leagueId", "league", "leagueName");
    private static final FieldResolver DIVISION = FieldResolver.of("divisionId", "division", "divisionNumber");
    private static final FieldResolver ROSTER = FieldResolver.of("rosterUnit");

    private final String name;
    private final String allyCode;
    private final Integer level;
    private final Long galacticPower;
    private final String leagueId;
    private final Integer divisionId;
    private final List<RosterUnit> roster;

    public PlayerPayload(String name, String allyCode, Integer level, Long galacticPower,
                         String leagueId, Integer divisionId, List<RosterUnit> roster) {
        this.name = name;
        this.allyCode = allyCode;
        this.level = level;
        this.galacticPower = galacticPower;
        this.leagueId = leagueId;
        this.divisionId = divisionId;
        this.roster = Collections.unmodifiableList(roster);
    }

    /**
     * Parses a /player response. Fields may sit at the root or under "payload".
     */
    public static PlayerPayload fromJson(JsonObject json) {
        JsonObject root = json;
        if (!json.has("rosterUnit") && !json.has("name")) {
            JsonObject nested = ROOT.resolveObject(json);
            if (nested != null) {
                root = nested;
            }
        }

        String leagueId = null;
        Integer divisionId = null;
        JsonObject rankStatus = RANK_STATUS.resolveObject(root);
        if (rankStatus != null) {
            leagueId = LEAGUE.resolveString(rankStatus);
            divisionId = DIVISION.resolveInt(rankStatus);
        }

        Long galacticPower = GALACTIC_POWER.resolveLong(root);
        if (galacticPower == null) {
            galacticPower = statValue(PROFILE_STATS.resolveArray(root), GP_STAT_KEY);
        }

        return new PlayerPayload(
                trimmed(NAME.resolveString(root)),
                trimmed(ALLY_CODE.resolveString(root)),
                LEVEL.resolveInt(root),
                galacticPower,
                trimmed(leagueId),
                divisionId,
                RosterUnit.parseAll(ROSTER.resolveArray(root)));
    }

    private static Long statValue(JsonArray stats, String nameKey) {
        if (stats == null) {
            return null;
        }
        for (JsonElement element : stats) {
            if (!element.isJsonObject()) {
                continue;
            }
            JsonObject stat = element.getAsJsonObject();
            if (nameKey.equals(UtilsJson.getJsonString(stat, "nameKey"))) {
                return UtilsJson.asLong(stat.get("value"));
            }
        }
        return null;
    }

    private static String trimmed(String value) {
        if (value == null) {
            return null;
        }
        String result = value.trim();
        return result.isEmpty() ? null : result;
    }

    public String getName() {
        return name;
    }

    public String getAllyCode() {
        return allyCode;
    }

    public Integer getLevel() {
        return level;
    }

    public Long getGalacticPower() {
        return galacticPower;
    }

    /**
     * @return The GAC league name as reported, or null
     */
    public String getLeagueId() {
        return leagueId;
    }

    /**
     * @return The raw division code (25, 20, 15, 10, 5), or null
     */
    public Integer getDivisionId() {
        return divisionId;
    }

    public List<RosterUnit> getRoster() {
        return roster;
    }
}
