package de.bsommerfeld.bytesize;

import de.bsommerfeld.bytesize.format.FormatSpec;
import de.bsommerfeld.bytesize.parse.ParseSpec;
import de.bsommerfeld.bytesize.unit.CustomUnitTable;

/**
 * Instance defaults for a {@link ByteSizes}. Per-call specs are merged over
 * these.
 *
 * @param format formatting defaults, never {@code null}
 * @param parse  parsing defaults, never {@code null}
 */
public record ByteSizeConfig(FormatSpec format, ParseSpec parse) {

    private static final ByteSizeConfig DEFAULTS = new ByteSizeConfig(FormatSpec.defaults(), ParseSpec.defaults());

    public ByteSizeConfig {
        format = format != null ? format : FormatSpec.defaults();
        parse = parse != null ? parse : ParseSpec.defaults();
    }

    public static ByteSizeConfig defaults() {
        return DEFAULTS;
    }

    public static ByteSizeConfig of(FormatSpec format) {
        return new ByteSizeConfig(format, null);
    }

    /** Uses the table for both formatting and parsing. */
    public static ByteSizeConfig customUnits(CustomUnitTable table) {
        return new ByteSizeConfig(
                FormatSpec.builder().customUnits(table).build(),
                ParseSpec.builder().customUnits(table).build());
    }

    public ByteSizeConfig withFormat(FormatSpec format) {
        return new ByteSizeConfig(format, parse);
    }

    public ByteSizeConfig withParse(ParseSpec parse) {
        return new ByteSizeConfig(format, parse);
    }
}
