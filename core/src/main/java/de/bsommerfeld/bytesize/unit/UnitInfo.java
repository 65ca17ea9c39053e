package de.bsommerfeld.bytesize.unit;

/**
 * Resolved meaning of a unit token: {@code base^exponent} bytes, or bits when
 * {@code bit} is set. The unprefixed units carry exponent 0.
 */
public record UnitInfo(int base, int exponent, boolean bit) {

    public static final UnitInfo BYTE = new UnitInfo(1024, 0, false);
    public static final UnitInfo BIT = new UnitInfo(1024, 0, true);
}
