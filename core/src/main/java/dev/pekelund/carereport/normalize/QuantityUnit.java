package dev.pekelund.carereport.normalize;

/**
 * Units recognised in free-text quantities.
 */
public enum QuantityUnit {

    OUNCE(true),
    MILLILITER(true),
    MINUTE(false),
    HOUR(false),
    UNKNOWN(false);

    private final boolean volume;

    QuantityUnit(boolean volume) {
        this.volume = volume;
    }

    public boolean isVolume() {
        return volume;
    }
}
