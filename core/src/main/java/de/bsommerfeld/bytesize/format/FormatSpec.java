package de.bsommerfeld.bytesize.format;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.bytesize.decimal.RoundingMethod;
import de.bsommerfeld.bytesize.unit.CustomUnitTable;
import de.bsommerfeld.bytesize.unit.UnitSystem;

import java.util.List;
import java.util.Objects;

/**
 * Immutable formatting options.
 *
 * <p>
 * Every option is optional. Unset options fall back to the defaults exposed by
 * the getters (IEC units, two decimals, {@link RoundingMethod#ROUND}, a plain
 * space between value and unit, string output). Two specs can be layered with
 * {@link #merge(FormatSpec, FormatSpec)}, which is how instance defaults and
 * per-call options combine.
 */
public final class FormatSpec {

    public static final int DEFAULT_DECIMALS = 2;

    private static final FormatSpec DEFAULTS = builder().build();

    private final UnitSystem system;
    private final Boolean bits;
    private final Integer decimals;
    private final RoundingMethod roundingMethod;
    private final Integer minimumFractionDigits;
    private final Integer maximumFractionDigits;
    private final String locale;
    private final Boolean space;
    private final Boolean nonBreakingSpace;
    private final String spacer;
    private final String thousandsSeparator;
    private final Boolean signed;
    private final Boolean pad;
    private final Integer fixedWidth;
    private final Boolean longForm;
    private final List<String> longForms;
    private final String unit;
    private final Double exponent;
    private final OutputMode output;
    private final String template;
    private final CustomUnitTable customUnits;

    private FormatSpec(Builder builder) {
        this.system = builder.system;
        this.bits = builder.bits;
        this.decimals = builder.decimals;
        this.roundingMethod = builder.roundingMethod;
        this.minimumFractionDigits = builder.minimumFractionDigits;
        this.maximumFractionDigits = builder.maximumFractionDigits;
        this.locale = builder.locale;
        this.space = builder.space;
        this.nonBreakingSpace = builder.nonBreakingSpace;
        this.spacer = builder.spacer;
        this.thousandsSeparator = builder.thousandsSeparator;
        this.signed = builder.signed;
        this.pad = builder.pad;
        this.fixedWidth = builder.fixedWidth;
        this.longForm = builder.longForm;
        this.longForms = builder.longForms == null ? null : ImmutableList.copyOf(builder.longForms);
        this.unit = builder.unit;
        this.exponent = builder.exponent;
        this.output = builder.output;
        this.template = builder.template;
        this.customUnits = builder.customUnits;
    }

    /** A spec with nothing set. */
    public static FormatSpec defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.system = system;
        builder.bits = bits;
        builder.decimals = decimals;
        builder.roundingMethod = roundingMethod;
        builder.minimumFractionDigits = minimumFractionDigits;
        builder.maximumFractionDigits = maximumFractionDigits;
        builder.locale = locale;
        builder.space = space;
        builder.nonBreakingSpace = nonBreakingSpace;
        builder.spacer = spacer;
        builder.thousandsSeparator = thousandsSeparator;
        builder.signed = signed;
        builder.pad = pad;
        builder.fixedWidth = fixedWidth;
        builder.longForm = longForm;
        builder.longForms = longForms;
        builder.unit = unit;
        builder.exponent = exponent;
        builder.output = output;
        builder.template = template;
        builder.customUnits = customUnits;
        return builder;
    }

    /**
     * Layers {@code override} over {@code base}: every option set in the
     * override wins, every other option is taken from the base.
     */
    public static FormatSpec merge(FormatSpec base, FormatSpec override) {
        if (base == null) return override == null ? DEFAULTS : override;
        if (override == null) return base;
        Builder merged = new Builder();
        merged.system = pick(override.system, base.system);
        merged.bits = pick(override.bits, base.bits);
        merged.decimals = pick(override.decimals, base.decimals);
        merged.roundingMethod = pick(override.roundingMethod, base.roundingMethod);
        merged.minimumFractionDigits = pick(override.minimumFractionDigits, base.minimumFractionDigits);
        merged.maximumFractionDigits = pick(override.maximumFractionDigits, base.maximumFractionDigits);
        merged.locale = pick(override.locale, base.locale);
        merged.space = pick(override.space, base.space);
        merged.nonBreakingSpace = pick(override.nonBreakingSpace, base.nonBreakingSpace);
        merged.spacer = pick(override.spacer, base.spacer);
        merged.thousandsSeparator = pick(override.thousandsSeparator, base.thousandsSeparator);
        merged.signed = pick(override.signed, base.signed);
        merged.pad = pick(override.pad, base.pad);
        merged.fixedWidth = pick(override.fixedWidth, base.fixedWidth);
        merged.longForm = pick(override.longForm, base.longForm);
        merged.longForms = pick(override.longForms, base.longForms);
        merged.unit = pick(override.unit, base.unit);
        merged.exponent = pick(override.exponent, base.exponent);
        merged.output = pick(override.output, base.output);
        merged.template = pick(override.template, base.template);
        merged.customUnits = pick(override.customUnits, base.customUnits);
        return merged.build();
    }

    private static <T> T pick(T override, T base) {
        return override != null ? override : base;
    }

    public UnitSystem getSystem() {
        return system != null ? system : UnitSystem.IEC;
    }

    public boolean isBits() {
        return Boolean.TRUE.equals(bits);
    }

    public int getDecimals() {
        return decimals != null ? decimals : DEFAULT_DECIMALS;
    }

    public RoundingMethod getRoundingMethod() {
        return roundingMethod != null ? roundingMethod : RoundingMethod.ROUND;
    }

    /** Minimum fraction digits, or {@code null} when not overridden. */
    public Integer getMinimumFractionDigits() {
        return minimumFractionDigits;
    }

    /** Maximum fraction digits, or {@code null} to use {@link #getDecimals()}. */
    public Integer getMaximumFractionDigits() {
        return maximumFractionDigits;
    }

    /** BCP 47 language tag, or {@code null} for locale independent output. */
    public String getLocale() {
        return locale;
    }

    public boolean isSpace() {
        return space == null || space;
    }

    public boolean isNonBreakingSpace() {
        return Boolean.TRUE.equals(nonBreakingSpace);
    }

    public String getSpacer() {
        return spacer;
    }

    public String getThousandsSeparator() {
        return thousandsSeparator;
    }

    public boolean isSigned() {
        return Boolean.TRUE.equals(signed);
    }

    public boolean isPad() {
        return Boolean.TRUE.equals(pad);
    }

    public Integer getFixedWidth() {
        return fixedWidth;
    }

    public boolean isLongForm() {
        return Boolean.TRUE.equals(longForm);
    }

    /** Replacement long names indexed by exponent, or {@code null}. */
    public List<String> getLongForms() {
        return longForms;
    }

    /** Forced output unit, or {@code null} for automatic selection. */
    public String getUnit() {
        return unit;
    }

    /** Forced exponent, or {@code null} for automatic selection. */
    public Double getExponent() {
        return exponent;
    }

    public OutputMode getOutput() {
        return output != null ? output : OutputMode.STRING;
    }

    public String getTemplate() {
        return template;
    }

    public CustomUnitTable getCustomUnits() {
        return customUnits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormatSpec other)) return false;
        return Objects.equals(system, other.system)
                && Objects.equals(bits, other.bits)
                && Objects.equals(decimals, other.decimals)
                && Objects.equals(roundingMethod, other.roundingMethod)
                && Objects.equals(minimumFractionDigits, other.minimumFractionDigits)
                && Objects.equals(maximumFractionDigits, other.maximumFractionDigits)
                && Objects.equals(locale, other.locale)
                && Objects.equals(space, other.space)
                && Objects.equals(nonBreakingSpace, other.nonBreakingSpace)
                && Objects.equals(spacer, other.spacer)
                && Objects.equals(thousandsSeparator, other.thousandsSeparator)
                && Objects.equals(signed, other.signed)
                && Objects.equals(pad, other.pad)
                && Objects.equals(fixedWidth, other.fixedWidth)
                && Objects.equals(longForm, other.longForm)
                && Objects.equals(longForms, other.longForms)
                && Objects.equals(unit, other.unit)
                && Objects.equals(exponent, other.exponent)
                && Objects.equals(output, other.output)
                && Objects.equals(template, other.template)
                && Objects.equals(customUnits, other.customUnits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(system, bits, decimals, roundingMethod, minimumFractionDigits,
                maximumFractionDigits, locale, space, nonBreakingSpace, spacer, thousandsSeparator,
                signed, pad, fixedWidth, longForm, longForms, unit, exponent, output, template,
                customUnits);
    }

    public static final class Builder {

        private UnitSystem system;
        private Boolean bits;
        private Integer decimals;
        private RoundingMethod roundingMethod;
        private Integer minimumFractionDigits;
        private Integer maximumFractionDigits;
        private String locale;
        private Boolean space;
        private Boolean nonBreakingSpace;
        private String spacer;
        private String thousandsSeparator;
        private Boolean signed;
        private Boolean pad;
        private Integer fixedWidth;
        private Boolean longForm;
        private List<String> longForms;
        private String unit;
        private Double exponent;
        private OutputMode output;
        private String template;
        private CustomUnitTable customUnits;

        private Builder() {}

        public Builder system(UnitSystem system) {
            this.system = system;
            return this;
        }

        public Builder bits(boolean bits) {
            this.bits = bits;
            return this;
        }

        public Builder decimals(int decimals) {
            this.decimals = decimals;
            return this;
        }

        public Builder roundingMethod(RoundingMethod roundingMethod) {
            this.roundingMethod = roundingMethod;
            return this;
        }

        public Builder minimumFractionDigits(int minimumFractionDigits) {
            this.minimumFractionDigits = minimumFractionDigits;
            return this;
        }

        public Builder maximumFractionDigits(int maximumFractionDigits) {
            this.maximumFractionDigits = maximumFractionDigits;
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder space(boolean space) {
            this.space = space;
            return this;
        }

        public Builder nonBreakingSpace(boolean nonBreakingSpace) {
            this.nonBreakingSpace = nonBreakingSpace;
            return this;
        }

        public Builder spacer(String spacer) {
            this.spacer = spacer;
            return this;
        }

        public Builder thousandsSeparator(String thousandsSeparator) {
            this.thousandsSeparator = thousandsSeparator;
            return this;
        }

        public Builder signed(boolean signed) {
            this.signed = signed;
            return this;
        }

        public Builder pad(boolean pad) {
            this.pad = pad;
            return this;
        }

        public Builder fixedWidth(int fixedWidth) {
            this.fixedWidth = fixedWidth;
            return this;
        }

        public Builder longForm(boolean longForm) {
            this.longForm = longForm;
            return this;
        }

        public Builder longForms(List<String> longForms) {
            this.longForms = longForms;
            return this;
        }

        public Builder unit(String unit) {
            this.unit = unit;
            return this;
        }

        /** Forces the exponent. Checked when formatting: must be an integer in 0..8. */
        public Builder exponent(double exponent) {
            this.exponent = exponent;
            return this;
        }

        public Builder output(OutputMode output) {
            this.output = output;
            return this;
        }

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder customUnits(CustomUnitTable customUnits) {
            this.customUnits = customUnits;
            return this;
        }

        public FormatSpec build() {
            return new FormatSpec(this);
        }
    }
}
