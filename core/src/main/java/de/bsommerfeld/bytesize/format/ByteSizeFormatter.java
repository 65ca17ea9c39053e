package de.bsommerfeld.bytesize.format;

import com.google.common.base.Preconditions;
import com.google.inject.Singleton;
import de.bsommerfeld.bytesize.decimal.Decimal;
import de.bsommerfeld.bytesize.parse.InvalidByteSizeException;
import de.bsommerfeld.bytesize.unit.CustomUnit;
import de.bsommerfeld.bytesize.unit.CustomUnitTable;
import de.bsommerfeld.bytesize.unit.UnitResolver;
import de.bsommerfeld.bytesize.unit.UnitTable;
import jakarta.inject.Inject;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Formats byte counts as human-readable sizes.
 *
 * <p>
 * The tier is chosen from the forced unit, then the forced exponent, then the
 * magnitude of the value. The value is divided by the exact power of the
 * system base, rounded with the configured {@link
 * de.bsommerfeld.bytesize.decimal.RoundingMethod} and rendered either with a
 * locale number format or locale independently.
 *
 * <pre>
 * formatter.format(1536, FormatSpec.defaults());                       // "1.5 KiB"
 * formatter.format(1_000_000_000, FormatSpec.builder().system(SI).build()); // "1 GB"
 * </pre>
 */
@Singleton
public class ByteSizeFormatter {

    public static final String NBSP = "\u00A0";

    private static final Pattern TEMPLATE_TOKEN = Pattern.compile("\\{(value|unit|longUnit|bytes|exponent)}");

    private final NumberRenderer renderer;

    @Inject
    public ByteSizeFormatter(LocaleFormatCache localeFormats) {
        this.renderer = new NumberRenderer(localeFormats);
    }

    public ByteSizeFormatter() {
        this(LocaleFormatCache.shared());
    }

    /**
     * Formats the byte count as text.
     *
     * @throws InvalidByteSizeException if {@code bytes} is NaN or infinite
     * @throws IllegalArgumentException if the spec holds invalid options
     */
    public String format(double bytes, FormatSpec spec) {
        return compute(toDecimal(bytes), spec).text();
    }

    public String format(long bytes, FormatSpec spec) {
        return compute(Decimal.of(bytes), spec).text();
    }

    public String format(BigInteger bytes, FormatSpec spec) {
        Preconditions.checkNotNull(bytes, "bytes");
        return compute(Decimal.of(bytes), spec).text();
    }

    /** Formats with the default options. */
    public String format(double bytes) {
        return format(bytes, FormatSpec.defaults());
    }

    /** Returns the structured result regardless of the spec's output mode. */
    public FormatResult render(double bytes, FormatSpec spec) {
        return compute(toDecimal(bytes), spec).result();
    }

    public FormatResult render(BigInteger bytes, FormatSpec spec) {
        Preconditions.checkNotNull(bytes, "bytes");
        return compute(Decimal.of(bytes), spec).result();
    }

    /** Selected tier for the byte count. */
    public int exponent(double bytes, FormatSpec spec) {
        return compute(toDecimal(bytes), spec).exponent();
    }

    /**
     * Returns the shape chosen by {@link FormatSpec#getOutput()}: a
     * {@link String}, a {@code List} of value and unit, a
     * {@link FormatResult} or an {@link Integer} exponent.
     */
    public Object output(double bytes, FormatSpec spec) {
        return shape(compute(toDecimal(bytes), spec), spec);
    }

    public Object output(BigInteger bytes, FormatSpec spec) {
        Preconditions.checkNotNull(bytes, "bytes");
        return shape(compute(Decimal.of(bytes), spec), spec);
    }

    private static Object shape(Formatted formatted, FormatSpec spec) {
        return switch (spec.getOutput()) {
            case STRING -> formatted.text();
            case ARRAY -> List.of(formatted.value().toDouble(), formatted.unit());
            case OBJECT -> formatted.result();
            case EXPONENT -> formatted.exponent();
        };
    }

    private static Decimal toDecimal(double bytes) {
        if (!Double.isFinite(bytes)) {
            throw new InvalidByteSizeException("Expected a finite number, got: " + bytes);
        }
        // Decimal.of maps -0.0 to zero
        return Decimal.of(bytes);
    }

    static void validate(FormatSpec spec) {
        Preconditions.checkNotNull(spec, "spec");
        Preconditions.checkArgument(spec.getDecimals() >= 0, "decimals must be a non-negative finite number");
        Double exponent = spec.getExponent();
        if (exponent != null) {
            Preconditions.checkArgument(
                    exponent == Math.rint(exponent) && exponent >= 0 && exponent <= UnitTable.MAX_EXPONENT,
                    "exponent must be an integer between 0 and 8");
        }
        Integer fixedWidth = spec.getFixedWidth();
        Preconditions.checkArgument(fixedWidth == null || fixedWidth >= 0, "fixedWidth must be non-negative");
        Integer min = spec.getMinimumFractionDigits();
        Preconditions.checkArgument(min == null || min >= 0, "minimumFractionDigits must be non-negative");
        Integer max = spec.getMaximumFractionDigits();
        Preconditions.checkArgument(max == null || max >= 0, "maximumFractionDigits must be non-negative");
    }

    private Formatted compute(Decimal bytes, FormatSpec spec) {
        validate(spec);
        boolean negative = bytes.signum() < 0;
        Decimal abs = bytes.abs();

        CustomUnitTable table = spec.getCustomUnits();
        int base = table != null ? table.base() : spec.getSystem().base();
        int maxExponent = table != null ? table.maxExponent() : UnitTable.MAX_EXPONENT;
        boolean bits = spec.isBits() && table == null;

        boolean carry = spec.getUnit() == null;
        int exponent;
        if (spec.getUnit() != null) {
            exponent = UnitResolver.exponentOfForcedUnit(spec.getUnit(), table);
        } else if (spec.getExponent() != null) {
            exponent = spec.getExponent().intValue();
        } else {
            exponent = UnitResolver.tierFor(abs, base, maxExponent);
        }
        exponent = UnitResolver.clamp(exponent, maxExponent);

        Decimal value = abs.dividedBy(Decimal.power(base, exponent));
        if (bits) {
            value = value.times(Decimal.EIGHT);
            Decimal baseValue = Decimal.of(base);
            if (carry && value.greaterThanOrEqual(baseValue) && exponent < maxExponent) {
                value = value.dividedBy(baseValue);
                exponent++;
            }
        }

        Decimal rounded = value.round(NumberRenderer.maxFractionDigits(spec), spec.getRoundingMethod());
        boolean singular = rounded.compareTo(Decimal.ONE) == 0;
        Decimal signedValue = negative ? rounded.negate() : rounded;

        String longUnit = longUnit(spec, table, bits, exponent, singular);
        String unit;
        if (spec.getUnit() != null) {
            unit = spec.getUnit();
        } else if (spec.isLongForm()) {
            unit = longUnit;
        } else if (table != null) {
            unit = table.unit(exponent).symbol();
        } else {
            unit = UnitTable.symbol(spec.getSystem(), bits, exponent);
        }

        String valueText = renderer.render(signedValue, spec);
        if (spec.isSigned() && !negative && !rounded.isZero()) {
            valueText = "+" + valueText;
        }

        String text;
        if (spec.getTemplate() != null) {
            text = applyTemplate(spec.getTemplate(), Map.of(
                    "value", valueText,
                    "unit", unit,
                    "longUnit", longUnit,
                    "bytes", bytes.toPlainString(),
                    "exponent", Integer.toString(exponent)));
        } else {
            text = valueText + spacer(spec) + unit;
        }
        text = padStart(text, spec.getFixedWidth());

        FormatResult result = new FormatResult(bytes.toDouble(), signedValue.toDouble(), unit, exponent);
        return new Formatted(text, signedValue, unit, exponent, result);
    }

    private static String longUnit(FormatSpec spec, CustomUnitTable table, boolean bits, int exponent,
                                   boolean singular) {
        if (table != null) {
            CustomUnit custom = table.unit(exponent);
            return singular ? custom.singular() : custom.plural();
        }
        List<String> overrides = spec.getLongForms();
        if (overrides != null && exponent < overrides.size() && overrides.get(exponent) != null) {
            String name = overrides.get(exponent).toLowerCase(Locale.ROOT);
            return singular && name.endsWith("s") ? name.substring(0, name.length() - 1) : name;
        }
        return UnitTable.longName(spec.getSystem(), bits, exponent, singular);
    }

    static String spacer(FormatSpec spec) {
        if (spec.getSpacer() != null) {
            return spec.getSpacer();
        }
        if (!spec.isSpace()) {
            return "";
        }
        return spec.isNonBreakingSpace() ? NBSP : " ";
    }

    private static String applyTemplate(String template, Map<String, String> tokens) {
        Matcher matcher = TEMPLATE_TOKEN.matcher(template);
        return matcher.replaceAll(match -> Matcher.quoteReplacement(tokens.get(match.group(1))));
    }

    private static String padStart(String text, Integer width) {
        if (width == null || text.length() >= width) {
            return text;
        }
        return " ".repeat(width - text.length()) + text;
    }

    private record Formatted(String text, Decimal value, String unit, int exponent, FormatResult result) {
    }
}
