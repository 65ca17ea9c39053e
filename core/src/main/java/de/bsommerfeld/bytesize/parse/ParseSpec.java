package de.bsommerfeld.bytesize.parse;

import de.bsommerfeld.bytesize.unit.CustomUnitTable;

import java.util.Objects;

/**
 * Immutable parsing options. Unset options fall back to the getter defaults:
 * ambiguous units are binary, numbers are bytes, failures return NaN.
 */
public final class ParseSpec {

    private static final ParseSpec DEFAULTS = builder().build();

    private final Boolean iec;
    private final Boolean bits;
    private final Boolean strict;
    private final String locale;
    private final CustomUnitTable customUnits;

    private ParseSpec(Builder builder) {
        this.iec = builder.iec;
        this.bits = builder.bits;
        this.strict = builder.strict;
        this.locale = builder.locale;
        this.customUnits = builder.customUnits;
    }

    public static ParseSpec defaults() {
        return DEFAULTS;
    }

    public static ParseSpec strict() {
        return builder().strict(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.iec = iec;
        builder.bits = bits;
        builder.strict = strict;
        builder.locale = locale;
        builder.customUnits = customUnits;
        return builder;
    }

    /** Options set in {@code override} win over those in {@code base}. */
    public static ParseSpec merge(ParseSpec base, ParseSpec override) {
        if (base == null) return override == null ? DEFAULTS : override;
        if (override == null) return base;
        Builder merged = new Builder();
        merged.iec = override.iec != null ? override.iec : base.iec;
        merged.bits = override.bits != null ? override.bits : base.bits;
        merged.strict = override.strict != null ? override.strict : base.strict;
        merged.locale = override.locale != null ? override.locale : base.locale;
        merged.customUnits = override.customUnits != null ? override.customUnits : base.customUnits;
        return merged.build();
    }

    /** Whether {@code KB}-style units are read as 1024-based. Defaults to true. */
    public boolean isIec() {
        return iec == null || iec;
    }

    /** Whether the number counts bits rather than bytes. */
    public boolean isBits() {
        return Boolean.TRUE.equals(bits);
    }

    /** Whether failures throw instead of returning NaN. */
    public boolean isStrict() {
        return Boolean.TRUE.equals(strict);
    }

    public String getLocale() {
        return locale;
    }

    public CustomUnitTable getCustomUnits() {
        return customUnits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParseSpec other)) return false;
        return Objects.equals(iec, other.iec)
                && Objects.equals(bits, other.bits)
                && Objects.equals(strict, other.strict)
                && Objects.equals(locale, other.locale)
                && Objects.equals(customUnits, other.customUnits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(iec, bits, strict, locale, customUnits);
    }

    public static final class Builder {

        private Boolean iec;
        private Boolean bits;
        private Boolean strict;
        private String locale;
        private CustomUnitTable customUnits;

        private Builder() {}

        public Builder iec(boolean iec) {
            this.iec = iec;
            return this;
        }

        public Builder bits(boolean bits) {
            this.bits = bits;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder customUnits(CustomUnitTable customUnits) {
            this.customUnits = customUnits;
            return this;
        }

        public ParseSpec build() {
            return new ParseSpec(this);
        }
    }
}
