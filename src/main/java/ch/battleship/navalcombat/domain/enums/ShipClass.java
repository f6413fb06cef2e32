package ch.battleship.navalcombat.domain.enums;

/**
 * Ship classes known to the engine together with their conventional sizes.
 *
 * <p>The size is only a default; era configurations may declare a different size per ship.
 */
public enum ShipClass {

    CARRIER(5, "Carrier"),
    BATTLESHIP(4, "Battleship"),
    CRUISER(3, "Cruiser"),
    SUBMARINE(3, "Submarine"),
    DESTROYER(2, "Destroyer"),
    PT_BOAT(2, "PT Boat"),
    SLOOP(2, "Sloop"),
    FRIGATE(3, "Frigate"),
    GALLEON(4, "Galleon");

    private final int defaultSize;
    private final String displayName;

    ShipClass(int defaultSize, String displayName) {
        this.defaultSize = defaultSize;
        this.displayName = displayName;
    }

    public int getDefaultSize() {
        return defaultSize;
    }

    public String getDisplayName() {
        return displayName;
    }
}
