package de.bsommerfeld.bytesize.decimal;

import java.math.RoundingMode;
import java.util.Locale;

/**
 * Rounding strategies available to the formatter.
 *
 * <p>
 * {@link #ROUND} breaks ties towards positive infinity, so {@code 1.5} becomes
 * {@code 2} but {@code -1.5} becomes {@code -1}, the same tie breaking as
 * {@link Math#round(double)}.
 */
public enum RoundingMethod {

    ROUND,
    FLOOR,
    CEIL,
    TRUNC;

    /**
     * Maps this method onto a {@link RoundingMode} for a value with the given
     * sign.
     */
    RoundingMode toRoundingMode(int signum) {
        return switch (this) {
            case ROUND -> signum < 0 ? RoundingMode.HALF_DOWN : RoundingMode.HALF_UP;
            case FLOOR -> RoundingMode.FLOOR;
            case CEIL -> RoundingMode.CEILING;
            case TRUNC -> RoundingMode.DOWN;
        };
    }

    /**
     * Resolves a rounding method from its case-insensitive name.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RoundingMethod fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rounding method must not be empty");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rounding method: " + name, e);
        }
    }
}
