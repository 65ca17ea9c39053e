package de.bsommerfeld.bytesize;

import com.google.common.base.Preconditions;
import de.bsommerfeld.bytesize.decimal.Decimal;
import de.bsommerfeld.bytesize.extract.ByteSizeExtractor;
import de.bsommerfeld.bytesize.extract.ExtractedMatch;
import de.bsommerfeld.bytesize.format.ByteSizeFormatter;
import de.bsommerfeld.bytesize.format.FormatResult;
import de.bsommerfeld.bytesize.format.FormatSpec;
import de.bsommerfeld.bytesize.parse.ByteSizeParser;
import de.bsommerfeld.bytesize.parse.InvalidByteSizeException;
import de.bsommerfeld.bytesize.parse.ParseSpec;
import jakarta.inject.Inject;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Entry point bundling formatter, parser and extractor with a set of
 * defaults.
 *
 * <pre>
 * ByteSizes si = ByteSizes.create(ByteSizeConfig.of(FormatSpec.builder().system(UnitSystem.SI).build()));
 * si.format(1500);          // "1.5 kB"
 * si.parse("1.5 kB");       // 1500.0
 * si.gt("1 GiB", "1 GB");   // true
 * </pre>
 *
 * Options passed to a single call are merged over the instance defaults.
 */
public class ByteSizes {

    private final ByteSizeConfig config;
    private final ByteSizeFormatter formatter;
    private final ByteSizeParser parser;
    private final ByteSizeExtractor extractor;

    @Inject
    public ByteSizes(ByteSizeConfig config, ByteSizeFormatter formatter, ByteSizeParser parser,
                     ByteSizeExtractor extractor) {
        this.config = Preconditions.checkNotNull(config, "config");
        this.formatter = Preconditions.checkNotNull(formatter, "formatter");
        this.parser = Preconditions.checkNotNull(parser, "parser");
        this.extractor = Preconditions.checkNotNull(extractor, "extractor");
    }

    public static ByteSizes create() {
        return Holder.DEFAULT;
    }

    public static ByteSizes create(ByteSizeConfig config) {
        ByteSizeParser parser = new ByteSizeParser();
        return new ByteSizes(config, new ByteSizeFormatter(), parser, new ByteSizeExtractor(parser));
    }

    /**
     * Creates an instance with only the given defaults. Nothing is inherited
     * from this instance, custom units included.
     */
    public ByteSizes derive(ByteSizeConfig config) {
        return new ByteSizes(config, formatter, parser, extractor);
    }

    public ByteSizeConfig config() {
        return config;
    }

    public String format(double bytes) {
        return formatter.format(bytes, config.format());
    }

    public String format(double bytes, FormatSpec options) {
        return formatter.format(bytes, FormatSpec.merge(config.format(), options));
    }

    public String format(BigInteger bytes, FormatSpec options) {
        return formatter.format(bytes, FormatSpec.merge(config.format(), options));
    }

    public FormatResult render(double bytes, FormatSpec options) {
        return formatter.render(bytes, FormatSpec.merge(config.format(), options));
    }

    /** Result shaped by the merged {@link FormatSpec#getOutput()}. */
    public Object output(double bytes, FormatSpec options) {
        return formatter.output(bytes, FormatSpec.merge(config.format(), options));
    }

    public double parse(String input) {
        return parser.parse(input, config.parse());
    }

    public double parse(String input, ParseSpec options) {
        return parser.parse(input, ParseSpec.merge(config.parse(), options));
    }

    public double parse(double bytes, ParseSpec options) {
        return parser.parse(bytes, ParseSpec.merge(config.parse(), options));
    }

    public double parse(BigInteger bytes, ParseSpec options) {
        return parser.parse(bytes, ParseSpec.merge(config.parse(), options));
    }

    public List<ExtractedMatch> extract(String text) {
        return extractor.extract(text);
    }

    /**
     * Parses strings and formats numbers: {@code convert("1 KiB")} is
     * {@code 1024.0}, {@code convert(1024)} is {@code "1 KiB"}.
     *
     * @throws IllegalArgumentException for any other argument type
     */
    public Object convert(Object value) {
        if (value instanceof String text) {
            return parse(text);
        }
        if (value instanceof BigInteger integer) {
            return format(integer, null);
        }
        if (value instanceof Number number) {
            return format(number.doubleValue());
        }
        throw new IllegalArgumentException("Cannot convert " + (value == null ? "null" : value.getClass().getName()));
    }

    /** Wraps the value for chained arithmetic. */
    public ByteSize size(Object value) {
        return new ByteSize(bytesOf(value), this);
    }

    public int compare(Object a, Object b) {
        return exact(a).compareTo(exact(b));
    }

    public boolean gt(Object a, Object b) {
        return compare(a, b) > 0;
    }

    public boolean gte(Object a, Object b) {
        return compare(a, b) >= 0;
    }

    public boolean lt(Object a, Object b) {
        return compare(a, b) < 0;
    }

    public boolean lte(Object a, Object b) {
        return compare(a, b) <= 0;
    }

    public boolean eq(Object a, Object b) {
        return compare(a, b) == 0;
    }

    private Decimal exact(Object value) {
        return Decimal.of(bytesOf(value));
    }

    /**
     * Resolves a number, {@link BigInteger} or size string to bytes.
     *
     * @throws InvalidByteSizeException if the value is no valid size
     */
    double bytesOf(Object value) {
        double bytes;
        if (value instanceof String text) {
            bytes = parse(text);
        } else if (value instanceof BigInteger integer) {
            bytes = parser.parse(integer, config.parse());
        } else if (value instanceof BigDecimal decimal) {
            bytes = decimal.doubleValue();
        } else if (value instanceof Number number) {
            bytes = number.doubleValue();
        } else {
            throw new InvalidByteSizeException("Invalid byte value: " + value);
        }
        if (!Double.isFinite(bytes)) {
            throw new InvalidByteSizeException("Invalid byte value: " + value);
        }
        return bytes;
    }

    private static final class Holder {
        private static final ByteSizes DEFAULT = create(ByteSizeConfig.defaults());
    }
}
