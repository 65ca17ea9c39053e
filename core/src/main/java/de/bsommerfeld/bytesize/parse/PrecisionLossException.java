package de.bsommerfeld.bytesize.parse;

/**
 * Thrown in strict mode when an integer input lies outside
 * {@code [-(2^53 - 1), 2^53 - 1]} and cannot be represented exactly as a
 * double.
 */
public class PrecisionLossException extends ArithmeticException {

    public PrecisionLossException(String message) {
        super(message);
    }

    public PrecisionLossException(String message, Throwable cause) {
        // ArithmeticException has no (message, cause) constructor
        super(message);
        initCause(cause);
    }
}
