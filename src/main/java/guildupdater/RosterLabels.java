package guildupdater;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Display values derived from the game-data payloads: member role, GAC league and relic tier
 */
public class RosterLabels {

    public static final String SHIP_LABEL = "Nave";

    private static final Map<Integer, String> ROLES = new HashMap<>();
    private static final Map<Integer, Integer> DIVISIONS = new HashMap<>();
    private static final Map<Integer, String> RELICS = new HashMap<>();

    static {
        ROLES.put(2, "Member");
        ROLES.put(3, "Officer");
        ROLES.put(4, "Leader");

        DIVISIONS.put(25, 1);
        DIVISIONS.put(20, 2);
        DIVISIONS.put(15, 3);
        DIVISIONS.put(10, 4);
        DIVISIONS.put(5, 5);

        RELICS.put(11, "R9");
        RELICS.put(10, "R8");
        RELICS.put(9, "R7");
        RELICS.put(8, "R6");
        RELICS.put(7, "R5");
        RELICS.put(6, "R4");
        RELICS.put(5, "R3");
        RELICS.put(4, "R2");
        RELICS.put(3, "R1");
        RELICS.put(2, "R0");
        RELICS.put(1, "G12");
        RELICS.put(0, "<G12");
    }

    private RosterLabels() {
    }

    /**
     * Role label for a guild member
     * @param memberLevel The numeric member level, may be null
     * @param roleText A textual role sent instead of a level, may be null
     * @return Member, Officer or Leader; the raw number when it is not mapped
     */
    public static String roleLabel(Integer memberLevel, String roleText) {
        if (memberLevel != null) {
            String role = ROLES.get(memberLevel);
            return role != null ? role : String.valueOf(memberLevel);
        }
        if (roleText != null && !roleText.trim().isEmpty()) {
            String text = roleText.trim().toLowerCase(Locale.ROOT);
            return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1);
        }
        return ROLES.get(2);
    }

    /**
     * GAC league label, e.g. "KYBER 5"
     * @param leagueId The league name, may be null
     * @param divisionId The raw division code (25, 20, 15, 10 or 5), may be null
     * @return "LEAGUE N", the league alone when the division is missing or unknown, "" without a league
     */
    public static String gacLeague(String leagueId, Integer divisionId) {
        if (leagueId == null || leagueId.trim().isEmpty()) {
            return "";
        }
        String league = leagueId.trim().toUpperCase(Locale.ROOT);
        Integer division = divisionId == null ? null : DIVISIONS.get(divisionId);
        return division == null ? league : league + " " + division;
    }

    /**
     * Cell value for one roster unit in the units matrix
     * @param relicTier The unit's relic tier, may be null
     * @param ship Whether the unit is a ship
     * @return "Nave" for ships, else the relic label; "" without a tier
     */
    public static String relicLabel(Integer relicTier, boolean ship) {
        if (ship) {
            return SHIP_LABEL;
        }
        if (relicTier == null) {
            return "";
        }
        String label = RELICS.get(relicTier);
        return label != null ? label : String.valueOf(relicTier);
    }
}
