package de.bsommerfeld.bytesize.parse;

import com.google.common.base.Preconditions;
import com.google.inject.Singleton;
import de.bsommerfeld.bytesize.decimal.Decimal;
import de.bsommerfeld.bytesize.format.LocaleFormatCache;
import de.bsommerfeld.bytesize.unit.CustomUnitTable;
import de.bsommerfeld.bytesize.unit.UnitInfo;
import de.bsommerfeld.bytesize.unit.UnitResolver;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.text.DecimalFormatSymbols;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;

/**
 * Parses size strings and numbers into byte counts.
 *
 * <p>
 * Failures either return {@link Double#NaN} or throw an
 * {@link InvalidByteSizeException}, depending on {@link ParseSpec#isStrict()}.
 * Integers beyond {@code 2^53 - 1} in magnitude are narrowed to the nearest
 * double; strict mode refuses them with a {@link PrecisionLossException}.
 */
@Singleton
public class ByteSizeParser {

    private static final Logger LOG = LoggerFactory.getLogger(ByteSizeParser.class);

    static final long MAX_SAFE_INTEGER = (1L << 53) - 1;
    private static final BigInteger MAX_SAFE = BigInteger.valueOf(MAX_SAFE_INTEGER);
    private static final BigInteger MIN_SAFE = MAX_SAFE.negate();

    private final LocaleFormatCache localeFormats;

    @Inject
    public ByteSizeParser(LocaleFormatCache localeFormats) {
        this.localeFormats = localeFormats;
    }

    public ByteSizeParser() {
        this(LocaleFormatCache.shared());
    }

    /** Parses with the default options. */
    public double parse(String input) {
        return parse(input, ParseSpec.defaults());
    }

    /**
     * Parses a size string such as {@code "1.5 GiB"}. A missing unit means
     * bytes.
     */
    public double parse(String input, ParseSpec spec) {
        Preconditions.checkNotNull(spec, "spec");
        if (input == null) {
            return invalid("Expected a string, got: null", spec);
        }
        String trimmed = input.trim();
        if (trimmed.isEmpty()) {
            return invalid("Empty string", spec);
        }
        CustomUnitTable customUnits = spec.getCustomUnits();
        Matcher matcher = customUnits != null
                ? BytePatterns.CUSTOM_UNIT_PATTERN.matcher(trimmed)
                : BytePatterns.BYTE_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            return invalid("Invalid byte string: " + input, spec);
        }

        String unit = matcher.group(2);
        int base;
        int exponent;
        boolean bit = false;
        if (customUnits != null) {
            base = customUnits.base();
            exponent = 0;
            if (unit != null) {
                OptionalInt custom = customUnits.exponentOf(unit);
                if (custom.isEmpty()) {
                    return invalid("Unknown unit '" + unit + "' in: " + input, spec);
                }
                exponent = custom.getAsInt();
            }
        } else {
            Optional<UnitInfo> resolved = UnitResolver.resolve(unit, spec.isIec());
            if (resolved.isEmpty()) {
                return invalid("Unknown unit '" + unit + "' in: " + input, spec);
            }
            UnitInfo info = resolved.get();
            base = info.base();
            exponent = info.exponent();
            bit = info.bit() || spec.isBits();
        }

        Decimal bytes;
        try {
            Decimal value = Decimal.of(normalizeNumber(matcher.group(1), spec.getLocale()));
            bytes = value.times(Decimal.power(base, exponent));
            if (bit) {
                bytes = bytes.dividedBy(Decimal.EIGHT);
            }
        } catch (NumberFormatException e) {
            return invalid("Invalid number in byte string: " + input, spec);
        } catch (ArithmeticException e) {
            // scale overflow or underflow from extreme exponents
            return invalid("Value out of range: " + input, spec);
        }

        double result = bytes.toDouble();
        if (!Double.isFinite(result)) {
            return invalid("Value out of range: " + input, spec);
        }
        return result;
    }

    /**
     * Accepts a number of bytes as is.
     */
    public double parse(double bytes, ParseSpec spec) {
        Preconditions.checkNotNull(spec, "spec");
        if (!Double.isFinite(bytes)) {
            return invalid("Expected a finite number, got: " + bytes, spec);
        }
        return bytes;
    }

    public double parse(long bytes, ParseSpec spec) {
        return parse(BigInteger.valueOf(bytes), spec);
    }

    /**
     * Narrows an integer to a double, checking that no precision is lost.
     *
     * @throws PrecisionLossException in strict mode, for values beyond
     *                                {@code 2^53 - 1} in magnitude
     */
    public double parse(BigInteger bytes, ParseSpec spec) {
        Preconditions.checkNotNull(bytes, "bytes");
        Preconditions.checkNotNull(spec, "spec");
        if (bytes.compareTo(MAX_SAFE) > 0 || bytes.compareTo(MIN_SAFE) < 0) {
            if (spec.isStrict()) {
                throw new PrecisionLossException(
                        "Integer value " + bytes + " exceeds safe integer range, precision would be lost");
            }
            LOG.warn("Integer value {} exceeds safe integer range, precision may be lost", bytes);
        }
        return bytes.doubleValue();
    }

    private String normalizeNumber(String literal, String locale) {
        if (locale != null) {
            Optional<DecimalFormatSymbols> symbols = localeFormats.symbols(locale);
            if (symbols.isPresent()) {
                String grouping = String.valueOf(symbols.get().getGroupingSeparator());
                char decimal = symbols.get().getDecimalSeparator();
                String normalized = literal.replace(grouping, "");
                return decimal == '.' ? normalized : normalized.replace(decimal, '.');
            }
        }
        return literal.replaceFirst(",", ".");
    }

    private static double invalid(String message, ParseSpec spec) {
        if (spec.isStrict()) {
            throw new InvalidByteSizeException(message);
        }
        LOG.debug("{}, returning NaN", message);
        return Double.NaN;
    }
}
