package de.bsommerfeld.bytesize.unit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static registry of the built-in unit symbols and names.
 *
 * <p>
 * Holds, per {@link UnitSystem} and flavour (bytes or bits), the nine display
 * symbols and long names for exponents 0 to 8, and a lowercase lookup from
 * every recognised token to its {@link UnitInfo}.
 */
public final class UnitTable {

    public static final int MAX_EXPONENT = 8;

    private static final String PREFIXES = "kmgtpezy";

    private static final List<String> IEC_BYTES =
            ImmutableList.of("B", "KiB", "MiB", "GiB", "TiB", "PiB", "EiB", "ZiB", "YiB");
    private static final List<String> IEC_BITS =
            ImmutableList.of("b", "Kib", "Mib", "Gib", "Tib", "Pib", "Eib", "Zib", "Yib");
    private static final List<String> JEDEC_BYTES =
            ImmutableList.of("B", "KB", "MB", "GB", "TB", "PB", "EB", "ZB", "YB");
    private static final List<String> JEDEC_BITS =
            ImmutableList.of("b", "Kb", "Mb", "Gb", "Tb", "Pb", "Eb", "Zb", "Yb");
    private static final List<String> SI_BYTES =
            ImmutableList.of("B", "kB", "MB", "GB", "TB", "PB", "EB", "ZB", "YB");
    private static final List<String> SI_BITS =
            ImmutableList.of("b", "kb", "Mb", "Gb", "Tb", "Pb", "Eb", "Zb", "Yb");
    private static final List<String> FRENCH_BYTES =
            ImmutableList.of("o", "ko", "Mo", "Go", "To", "Po", "Eo", "Zo", "Yo");

    private static final List<String> DECIMAL_STEMS =
            ImmutableList.of("", "kilo", "mega", "giga", "tera", "peta", "exa", "zetta", "yotta");
    private static final List<String> BINARY_STEMS =
            ImmutableList.of("", "kibi", "mebi", "gibi", "tebi", "pebi", "exbi", "zebi", "yobi");

    private static final Map<String, UnitInfo> TOKENS = buildTokens();

    private UnitTable() {}

    /**
     * Display symbol for a tier, e.g. {@code KiB} for IEC bytes at exponent 1.
     * French has no bit symbols of its own and uses the SI ones.
     */
    public static String symbol(UnitSystem system, boolean bits, int exponent) {
        checkExponent(exponent);
        return symbols(system, bits).get(exponent);
    }

    public static List<String> symbols(UnitSystem system, boolean bits) {
        Preconditions.checkNotNull(system, "system");
        return switch (system) {
            case IEC -> bits ? IEC_BITS : IEC_BYTES;
            case JEDEC -> bits ? JEDEC_BITS : JEDEC_BYTES;
            case SI -> bits ? SI_BITS : SI_BYTES;
            case FRENCH -> bits ? SI_BITS : FRENCH_BYTES;
        };
    }

    /**
     * Lowercase long name for a tier, e.g. {@code kibibyte} or
     * {@code kibibytes}.
     */
    public static String longName(UnitSystem system, boolean bits, int exponent, boolean singular) {
        checkExponent(exponent);
        Preconditions.checkNotNull(system, "system");
        String stem = system == UnitSystem.IEC ? BINARY_STEMS.get(exponent) : DECIMAL_STEMS.get(exponent);
        String noun;
        if (bits) {
            noun = "bit";
        } else if (system == UnitSystem.FRENCH) {
            noun = "octet";
        } else {
            noun = "byte";
        }
        return singular ? stem + noun : stem + noun + "s";
    }

    /**
     * Looks up a unit token, ignoring case. Knows every symbol of every system
     * and the singular and plural long names.
     */
    public static Optional<UnitInfo> lookup(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(TOKENS.get(token.toLowerCase(Locale.ROOT)));
    }

    /**
     * Exponent of an SI prefix letter ({@code k} is 1, {@code y} is 8), or -1
     * when the character is not a prefix.
     */
    public static int prefixExponent(char prefix) {
        int index = PREFIXES.indexOf(Character.toLowerCase(prefix));
        return index < 0 ? -1 : index + 1;
    }

    private static void checkExponent(int exponent) {
        Preconditions.checkArgument(exponent >= 0 && exponent <= MAX_EXPONENT,
                "exponent must be an integer between 0 and %s", MAX_EXPONENT);
    }

    private static Map<String, UnitInfo> buildTokens() {
        ImmutableMap.Builder<String, UnitInfo> tokens = ImmutableMap.builder();
        for (String name : List.of("b", "byte", "bytes", "o", "octet", "octets")) {
            tokens.put(name, UnitInfo.BYTE);
        }
        tokens.put("bit", UnitInfo.BIT);
        tokens.put("bits", UnitInfo.BIT);

        for (int exponent = 1; exponent <= MAX_EXPONENT; exponent++) {
            char prefix = PREFIXES.charAt(exponent - 1);
            UnitInfo decimalBytes = new UnitInfo(1000, exponent, false);
            UnitInfo binaryBytes = new UnitInfo(1024, exponent, false);
            UnitInfo decimalBits = new UnitInfo(1000, exponent, true);
            UnitInfo binaryBits = new UnitInfo(1024, exponent, true);

            // "kib" stays kibibytes: lowercasing cannot tell "KiB" from "Kib".
            tokens.put(prefix + "b", decimalBytes);
            tokens.put(prefix + "ib", binaryBytes);
            tokens.put(prefix + "o", decimalBytes);

            String decimal = DECIMAL_STEMS.get(exponent);
            String binary = BINARY_STEMS.get(exponent);
            putNames(tokens, decimal + "byte", decimalBytes);
            putNames(tokens, decimal + "octet", decimalBytes);
            putNames(tokens, decimal + "bit", decimalBits);
            putNames(tokens, binary + "byte", binaryBytes);
            putNames(tokens, binary + "bit", binaryBits);
        }
        return tokens.build();
    }

    private static void putNames(ImmutableMap.Builder<String, UnitInfo> tokens, String singular, UnitInfo info) {
        tokens.put(singular, info);
        tokens.put(singular + "s", info);
    }
}
