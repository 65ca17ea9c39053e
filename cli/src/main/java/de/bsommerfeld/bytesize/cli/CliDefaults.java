package de.bsommerfeld.bytesize.cli;

import de.bsommerfeld.bytesize.ByteSizeConfig;
import de.bsommerfeld.bytesize.format.FormatSpec;
import de.bsommerfeld.bytesize.unit.UnitSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default unit system and decimals for the command line, resolved from
 * system properties ({@code bytesize.system}, {@code bytesize.decimals}) or
 * environment variables ({@code BYTESIZE_SYSTEM}, {@code BYTESIZE_DECIMALS}).
 * Missing or unusable values fall back to IEC and two decimals.
 */
public final class CliDefaults {

    static final String SYSTEM_PROPERTY = "bytesize.system";
    static final String SYSTEM_ENV = "BYTESIZE_SYSTEM";
    static final String DECIMALS_PROPERTY = "bytesize.decimals";
    static final String DECIMALS_ENV = "BYTESIZE_DECIMALS";

    private static final Logger LOG = LoggerFactory.getLogger(CliDefaults.class);

    private CliDefaults() {}

    public static UnitSystem system() {
        String value = lookup(SYSTEM_PROPERTY, SYSTEM_ENV);
        if (value == null) {
            return UnitSystem.IEC;
        }
        try {
            return UnitSystem.fromString(value);
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown unit system '{}'. Defaulting to IEC.", value);
            return UnitSystem.IEC;
        }
    }

    public static int decimals() {
        String value = lookup(DECIMALS_PROPERTY, DECIMALS_ENV);
        if (value == null) {
            return FormatSpec.DEFAULT_DECIMALS;
        }
        try {
            int decimals = Integer.parseInt(value.trim());
            if (decimals >= 0) {
                return decimals;
            }
        } catch (NumberFormatException e) {
            LOG.debug("Unreadable decimals '{}'", value, e);
        }
        LOG.warn("Invalid decimals '{}'. Defaulting to {}.", value, FormatSpec.DEFAULT_DECIMALS);
        return FormatSpec.DEFAULT_DECIMALS;
    }

    /** Engine defaults built from {@link #system()} and {@link #decimals()}. */
    public static ByteSizeConfig config() {
        return ByteSizeConfig.of(FormatSpec.builder()
                .system(system())
                .decimals(decimals())
                .build());
    }

    private static String lookup(String property, String env) {
        String value = System.getProperty(property);
        if (value == null || value.isEmpty()) {
            value = System.getenv(env);
        }
        return value == null || value.isEmpty() ? null : value;
    }
}
