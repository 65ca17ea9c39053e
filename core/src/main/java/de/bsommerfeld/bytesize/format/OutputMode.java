package de.bsommerfeld.bytesize.format;

import java.util.Locale;

/**
 * Shape of the value returned by {@link ByteSizeFormatter#output}.
 */
public enum OutputMode {

    /** Composed text such as {@code "1.5 KiB"}. */
    STRING,
    /** Two element list of rounded value and unit. */
    ARRAY,
    /** A {@link FormatResult}. */
    OBJECT,
    /** The selected exponent as an {@link Integer}. */
    EXPONENT;

    public static OutputMode fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Output mode must not be empty");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown output mode: " + name, e);
        }
    }
}
