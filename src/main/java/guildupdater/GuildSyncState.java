package guildupdater;

/**
 * Where a guild is in its sync. DONE, SKIPPED, FETCH_FAILED and FAILED are terminal.
 */
public enum GuildSyncState {
    PENDING,
    FETCHING,
    FETCH_FAILED,
    FETCHED,
    MEMBER_RESOLUTION,
    AGGREGATING,
    UPSERTING,
    DONE,
    SKIPPED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == SKIPPED || this == FETCH_FAILED || this == FAILED;
    }

    public boolean isFailure() {
        return this == FETCH_FAILED || this == FAILED;
    }
}
