package de.bsommerfeld.bytesize.unit;

import java.util.Locale;

/**
 * Display conventions for byte sizes.
 */
public enum UnitSystem {

    /** Decimal prefixes, base 1000 ({@code kB}, {@code MB}). */
    SI,
    /** Binary prefixes with the {@code i} marker ({@code KiB}, {@code MiB}). */
    IEC,
    /** Binary magnitudes with decimal-looking symbols ({@code KB}, {@code MB}). */
    JEDEC,
    /** Octet symbols ({@code ko}, {@code Mo}), rendered on the binary scale. */
    FRENCH;

    /** Base used when formatting in this system. */
    public int base() {
        return this == SI ? 1000 : 1024;
    }

    /**
     * Resolves a system from its case-insensitive name ({@code "si"},
     * {@code "iec"}, {@code "jedec"}, {@code "french"}).
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static UnitSystem fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Unit system must not be empty");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown unit system: " + name, e);
        }
    }
}
