package comlink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import utils.FieldResolver;

/**
 * Guild profile and member list returned by /guild
 */
public class GuildPayload {

    private static final Gson GSON = new Gson();

    private static final FieldResolver GUILD_ROOT = FieldResolver.of("guild", "payload.guild");
    private static final FieldResolver NAME = FieldResolver.of("profile.name", "guildName", "name");
    private static final FieldResolver MEMBER_COUNT = FieldResolver.of("profile.memberCount", "memberCount");
    private static final FieldResolver GALACTIC_POWER = FieldResolver.of("profile.guildGalacticPower", "profile.galacticPower", "galacticPower");
    private static final FieldResolver MEMBERS = FieldResolver.of("member", "members");
    private static final FieldResolver LAST_RAID = FieldResolver.of("lastRaidPointsSummary", "profile.lastRaidPointsSummary");

    private final String guildName;
    private final int memberCount;
    private final long galacticPower;
    private final String lastRaidId;
    private final String lastRaidScore;
    private final List<GuildMember> members;

    public GuildPayload(String guildName, int memberCount, long galacticPower,
                        String lastRaidId, String lastRaidScore, List<GuildMember> members) {
        this.guildName = guildName;
        this.memberCount = memberCount;
        this.galacticPower = galacticPower;
        this.lastRaidId = lastRaidId;
        this.lastRaidScore = lastRaidScore;
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
    }

    /**
     * Parses a /guild response. The guild may sit under "guild", "payload.guild" or at the root.
     */
    public static GuildPayload fromJson(JsonObject json) {
        JsonObject guild = GUILD_ROOT.resolveObject(json);
        if (guild == null) {
            guild = json;
        }

        List<GuildMember> members = new ArrayList<>();
        JsonArray memberArray = MEMBERS.resolveArray(guild);
        if (memberArray == null) {
            memberArray = MEMBERS.resolveArray(json);
        }
        if (memberArray != null) {
            for (JsonElement element : memberArray) {
                if (element.isJsonObject()) {
                    members.add(GuildMember.fromJson(element.getAsJsonObject()));
                }
            }
        }

        String name = NAME.resolveString(guild);
        Integer memberCount = MEMBER_COUNT.resolveInt(guild);
        Long galacticPower = GALACTIC_POWER.resolveLong(guild);

        String lastRaidId = "";
        String lastRaidScore = "";
        JsonArray raids = LAST_RAID.resolveArray(guild);
        if (raids != null && raids.get(0).isJsonObject()) {
            JsonObject lastRaid = raids.get(0).getAsJsonObject();
            JsonElement identifier = lastRaid.get("identifier");
            lastRaidId = GSON.toJson(identifier != null && !identifier.isJsonNull() ? identifier : new JsonObject());
            lastRaidScore = formatPoints(lastRaid.get("totalPoints"));
        }

        return new GuildPayload(
                name == null ? "" : name.trim(),
                memberCount != null ? memberCount : members.size(),
                galacticPower != null ? galacticPower : 0L,
                lastRaidId,
                lastRaidScore,
                members);
    }

    private static String formatPoints(JsonElement points) {
        if (points == null || !points.isJsonPrimitive()) {
            return "";
        }
        JsonPrimitive primitive = points.getAsJsonPrimitive();
        if (primitive.isNumber()) {
            return String.valueOf((long) primitive.getAsDouble());
        }
        return primitive.getAsString().trim();
    }

    public String getGuildName() {
        return guildName;
    }

    public int getMemberCount() {
        return memberCount;
    }

    public long getGalacticPower() {
        return galacticPower;
    }

    /**
     * @return The last raid identifier serialized as compact JSON, or "" when there is no raid summary
     */
    public String getLastRaidId() {
        return lastRaidId;
    }

    public String getLastRaidScore() {
        return lastRaidScore;
    }

    public List<GuildMember> getMembers() {
        return members;
    }
}
