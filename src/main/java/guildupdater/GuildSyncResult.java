package guildupdater;

/**
 * Outcome of one guild within a run
 */
public class GuildSyncResult {

    private final String guildId;
    private GuildSyncState state = GuildSyncState.PENDING;
    private String guildName = "";
    private int membersReported;
    private int membersSynced;
    private int membersCarriedOver;
    private int membersSkipped;
    private String error;

    public GuildSyncResult(String guildId) {
        this.guildId = guildId;
    }

    void moveTo(GuildSyncState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Guild " + guildId + " is already " + state + ", cannot move to " + next);
        }
        this.state = next;
    }

    void fail(GuildSyncState terminal, String message) {
        this.state = terminal;
        this.error = message;
    }

    void setGuildName(String guildName) {
        this.guildName = guildName;
    }

    void setMembersReported(int membersReported) {
        this.membersReported = membersReported;
    }

    void memberSynced() {
        membersSynced++;
    }

    void memberCarriedOver() {
        membersCarriedOver++;
    }

    void memberSkipped() {
        membersSkipped++;
    }

    public String getGuildId() {
        return guildId;
    }

    public GuildSyncState getState() {
        return state;
    }

    public String getGuildName() {
        return guildName;
    }

    public int getMembersReported() {
        return membersReported;
    }

    public int getMembersSynced() {
        return membersSynced;
    }

    /**
     * @return Members whose player fetch failed and whose previous rows were kept
     */
    public int getMembersCarriedOver() {
        return membersCarriedOver;
    }

    /**
     * @return Members left out: no player id, or a failed fetch with nothing to keep
     */
    public int getMembersSkipped() {
        return membersSkipped;
    }

    /**
     * @return The failure message, or null
     */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(guildId);
        if (!guildName.isEmpty()) {
            sb.append(" (").append(guildName).append(")");
        }
        sb.append(": ").append(state);
        if (state == GuildSyncState.DONE) {
            sb.append(", ").append(membersSynced).append("/").append(membersReported).append(" member(s) synced");
            if (membersCarriedOver > 0) {
                sb.append(", ").append(membersCarriedOver).append(" kept from the previous run");
            }
            if (membersSkipped > 0) {
                sb.append(", ").append(membersSkipped).append(" skipped");
            }
        }
        if (error != null) {
            sb.append(" - ").append(error);
        }
        return sb.toString();
    }
}
