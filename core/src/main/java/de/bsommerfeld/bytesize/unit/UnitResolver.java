package de.bsommerfeld.bytesize.unit;

import de.bsommerfeld.bytesize.decimal.Decimal;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps magnitudes to unit tiers and unit strings to {@link UnitInfo}.
 *
 * <p>
 * Unit strings are resolved in three steps:
 * <ol>
 * <li>An uppercase prefix followed by a capital {@code B} ({@code KB},
 * {@code GB}) is ambiguous. Its base follows the caller's {@code iec} flag.</li>
 * <li>Otherwise the lowercase token is looked up in the {@link UnitTable}. An
 * {@code i} marker means base 1024, a plain prefix means base 1000.</li>
 * <li>Tokens the table lacks but that are built like a unit ({@code kbyte},
 * {@code kioctet}, {@code kbits}) are decomposed into prefix, marker and
 * suffix.</li>
 * </ol>
 * Lowercasing happens before the table lookup, so {@code Kib} reads as
 * kibibytes.
 */
public final class UnitResolver {

    private static final Pattern JEDEC_STYLE = Pattern.compile("^[KMGTPEZY]B$");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s_-]+");
    private static final Pattern STRUCTURED_UNIT =
            Pattern.compile("^([kmgtpezy])(i?)(b(?:ytes?|its?)?|o(?:ctets?)?)$");

    private UnitResolver() {}

    /**
     * Largest exponent {@code e <= maxExponent} with {@code base^e <= absBytes},
     * or 0 when the value is smaller than one unit.
     */
    public static int tierFor(Decimal absBytes, int base, int maxExponent) {
        if (absBytes.isNaN() || absBytes.isZero()) {
            return 0;
        }
        for (int exponent = clamp(maxExponent, UnitTable.MAX_EXPONENT); exponent > 0; exponent--) {
            if (Decimal.power(base, exponent).lessThanOrEqual(absBytes)) {
                return exponent;
            }
        }
        return 0;
    }

    /** Clamps {@code exponent} into {@code [0, maxExponent]}. */
    public static int clamp(int exponent, int maxExponent) {
        return Math.max(0, Math.min(maxExponent, exponent));
    }

    /**
     * Exponent implied by a forced output unit. Custom tables are searched by
     * symbol and name; built-in units use their leading prefix letter, and a
     * unit without one is exponent 0.
     */
    public static int exponentOfForcedUnit(String unit, CustomUnitTable customUnits) {
        if (customUnits != null) {
            OptionalInt exponent = customUnits.exponentOf(unit);
            if (exponent.isPresent()) {
                return exponent.getAsInt();
            }
        }
        if (unit == null || unit.isEmpty()) {
            return 0;
        }
        int exponent = UnitTable.prefixExponent(unit.charAt(0));
        return Math.max(exponent, 0);
    }

    /**
     * Resolves a unit token as written in input text.
     *
     * @param token unit as matched, case preserved
     * @param iec   whether ambiguous {@code KB}-style units are binary
     * @return the resolved unit, or empty when the token is unknown
     */
    public static Optional<UnitInfo> resolve(String token, boolean iec) {
        if (token == null || token.isBlank()) {
            return Optional.of(UnitInfo.BYTE);
        }
        String trimmed = token.trim();
        if (JEDEC_STYLE.matcher(trimmed).matches()) {
            int exponent = UnitTable.prefixExponent(trimmed.charAt(0));
            return Optional.of(new UnitInfo(iec ? 1024 : 1000, exponent, false));
        }

        String normalized = SEPARATORS.matcher(trimmed).replaceAll("").toLowerCase(Locale.ROOT);
        Optional<UnitInfo> known = UnitTable.lookup(normalized);
        if (known.isPresent()) {
            return known;
        }

        Matcher matcher = STRUCTURED_UNIT.matcher(normalized);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int exponent = UnitTable.prefixExponent(matcher.group(1).charAt(0));
        boolean binary = !matcher.group(2).isEmpty() || iec;
        boolean bit = matcher.group(3).startsWith("bit");
        return Optional.of(new UnitInfo(binary ? 1024 : 1000, exponent, bit));
    }
}
