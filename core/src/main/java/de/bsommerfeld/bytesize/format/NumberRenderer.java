package de.bsommerfeld.bytesize.format;

import de.bsommerfeld.bytesize.decimal.Decimal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an already rounded display value into text.
 *
 * <p>
 * With a supported locale the cached {@link DecimalFormat} is used. Otherwise
 * the value is written with a dot as decimal separator, trailing zeros are
 * trimmed unless padding or a minimum fraction digit count asks for them, and
 * an optional thousands separator is inserted into the integer part.
 */
class NumberRenderer {

    private static final Pattern THOUSANDS = Pattern.compile("\\B(?=(\\d{3})+(?!\\d))");
    private static final Pattern TRAILING_ZEROS = Pattern.compile("\\.?0+$");

    private final LocaleFormatCache localeFormats;

    NumberRenderer(LocaleFormatCache localeFormats) {
        this.localeFormats = localeFormats;
    }

    String render(Decimal rounded, FormatSpec spec) {
        int max = maxFractionDigits(spec);
        Integer minOverride = spec.getMinimumFractionDigits();

        if (spec.getLocale() != null) {
            int min = minOverride != null ? minOverride : (spec.isPad() ? max : 0);
            Optional<DecimalFormat> format = localeFormats.numberFormat(spec.getLocale(), min, max);
            if (format.isPresent()) {
                return format.get().format(rounded.toBigDecimal());
            }
        }
        return renderPlain(rounded.toBigDecimal(), max, minOverride, spec);
    }

    static int maxFractionDigits(FormatSpec spec) {
        Integer max = spec.getMaximumFractionDigits();
        return max != null ? max : spec.getDecimals();
    }

    private static String renderPlain(BigDecimal value, int max, Integer minOverride, FormatSpec spec) {
        int min = minOverride != null ? minOverride : (spec.isPad() ? max : 0);
        String text = value.setScale(max, RoundingMode.DOWN).toPlainString();

        if (!spec.isPad() && min < max && text.indexOf('.') >= 0) {
            text = TRAILING_ZEROS.matcher(text).replaceFirst("");
            text = padFraction(text, min);
        }
        return groupThousands(text, spec.getThousandsSeparator());
    }

    private static String padFraction(String text, int min) {
        if (min == 0) {
            return text;
        }
        int dot = text.indexOf('.');
        String integer = dot < 0 ? text : text.substring(0, dot);
        StringBuilder fraction = new StringBuilder(dot < 0 ? "" : text.substring(dot + 1));
        if (fraction.length() >= min) {
            return text;
        }
        while (fraction.length() < min) {
            fraction.append('0');
        }
        return integer + '.' + fraction;
    }

    private static String groupThousands(String text, String separator) {
        if (separator == null || separator.isEmpty()) {
            return text;
        }
        int dot = text.indexOf('.');
        String integer = dot < 0 ? text : text.substring(0, dot);
        String rest = dot < 0 ? "" : text.substring(dot);
        return THOUSANDS.matcher(integer).replaceAll(Matcher.quoteReplacement(separator)) + rest;
    }
}
