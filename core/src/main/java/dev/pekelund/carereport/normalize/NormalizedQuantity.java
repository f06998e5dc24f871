package dev.pekelund.carereport.normalize;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Typed view of a free-text quantity such as "5 oz" or "15 mins".
 *
 * @param amount numeric value, {@code 0} when the text held no number
 * @param unit   recognised unit, {@link QuantityUnit#UNKNOWN} when none was found
 */
public record NormalizedQuantity(BigDecimal amount, QuantityUnit unit) {

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    public static final NormalizedQuantity NONE = new NormalizedQuantity(BigDecimal.ZERO, QuantityUnit.UNKNOWN);

    public NormalizedQuantity {
        amount = amount != null ? amount : BigDecimal.ZERO;
        unit = Objects.requireNonNullElse(unit, QuantityUnit.UNKNOWN);
    }

    public boolean isVolume() {
        return unit.isVolume();
    }

    public boolean hasAmount() {
        return amount.signum() != 0;
    }

    /**
     * Duration in minutes for time units, {@code null} for volumes and unknown units.
     */
    public BigDecimal toMinutes() {
        return switch (unit) {
            case MINUTE -> amount;
            case HOUR -> amount.multiply(MINUTES_PER_HOUR);
            default -> null;
        };
    }
}
