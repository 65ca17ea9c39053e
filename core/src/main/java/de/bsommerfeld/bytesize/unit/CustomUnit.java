package de.bsommerfeld.bytesize.unit;

import com.google.common.base.Preconditions;

/**
 * One tier of a {@link CustomUnitTable}.
 *
 * @param symbol   short symbol used in default output, e.g. {@code "bl"}
 * @param singular long name for exactly one unit, e.g. {@code "block"}
 * @param plural   long name for every other amount, e.g. {@code "blocks"}
 */
public record CustomUnit(String symbol, String singular, String plural) {

    public CustomUnit {
        Preconditions.checkArgument(symbol != null && !symbol.isBlank(), "symbol must not be blank");
        Preconditions.checkArgument(singular != null && !singular.isBlank(), "singular name must not be blank");
        Preconditions.checkArgument(plural != null && !plural.isBlank(), "plural name must not be blank");
    }

    public static CustomUnit of(String symbol, String singular, String plural) {
        return new CustomUnit(symbol, singular, plural);
    }
}
