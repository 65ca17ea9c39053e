package de.bsommerfeld.bytesize.parse;

/**
 * Thrown when a value cannot be interpreted as a byte size: a non-finite
 * number, an unparseable string, an unknown unit or a result that overflows
 * the double range.
 */
public class InvalidByteSizeException extends IllegalArgumentException {

    public InvalidByteSizeException(String message) {
        super(message);
    }

    public InvalidByteSizeException(String message, Throwable cause) {
        super(message, cause);
    }
}
