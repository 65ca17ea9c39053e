package de.bsommerfeld.bytesize.parse;

import java.util.regex.Pattern;

/**
 * Regular expressions for size literals such as {@code "1.5 GiB"},
 * {@code "1,5 Mo"}, {@code "-50 bytes"} or {@code "2 kibibytes"}.
 *
 * <p>
 * Group 1 captures the number (sign, comma or dot decimal separator, optional
 * exponent), group 2 the unit token when present. Both patterns are case
 * insensitive and safe to share; callers create their own {@link
 * java.util.regex.Matcher}.
 */
public final class BytePatterns {

    static final String NUMBER = "([+-]?\\d+(?:[.,]\\d+)?(?:e[+-]?\\d+)?)";

    static final String UNIT = "("
            + "(?:kilo|mega|giga|tera|peta|exa|zetta|yotta|kibi|mebi|gibi|tebi|pebi|exbi|zebi|yobi)"
            + "(?:bytes?|bits?|octets?)"
            + "|(?:[kmgtpezy]i?)?(?:b(?:ytes?|its?)?|o(?:ctets?)?)"
            + ")";

    /** A whole string holding exactly one size. */
    public static final Pattern BYTE_PATTERN =
            Pattern.compile("^" + NUMBER + "(?:\\s*" + UNIT + ")?$", Pattern.CASE_INSENSITIVE);

    /** Every size in a longer text, unit optional. */
    public static final Pattern GLOBAL_BYTE_PATTERN =
            Pattern.compile(NUMBER + "(?:\\s*" + UNIT + ")?", Pattern.CASE_INSENSITIVE);

    /** A number followed by any unit token, for user-defined unit tables. */
    static final Pattern CUSTOM_UNIT_PATTERN =
            Pattern.compile("^" + NUMBER + "(?:\\s*(\\S.*?))?$", Pattern.CASE_INSENSITIVE);

    private BytePatterns() {}
}
