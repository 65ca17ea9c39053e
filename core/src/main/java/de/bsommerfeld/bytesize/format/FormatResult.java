package de.bsommerfeld.bytesize.format;

/**
 * Structured formatting result.
 *
 * @param bytes    the input byte count
 * @param value    display value, rounded and signed
 * @param unit     unit string as it would be displayed
 * @param exponent selected tier
 */
public record FormatResult(double bytes, double value, String unit, int exponent) {
}
