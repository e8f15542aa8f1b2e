package catalog;

/**
 * A character or ship known to the catalog tables
 */
public class UnitCatalogEntry {

    private final String baseId;
    private final String friendlyName;
    private final String alignment;
    private final boolean ship;

    public UnitCatalogEntry(String baseId, String friendlyName, String alignment, boolean ship) {
        this.baseId = baseId;
        this.friendlyName = friendlyName;
        this.alignment = alignment;
        this.ship = ship;
    }

    public String getBaseId() {
        return baseId;
    }

    public String getFriendlyName() {
        return friendlyName;
    }

    public String getAlignment() {
        return alignment;
    }

    public boolean isShip() {
        return ship;
    }
}
