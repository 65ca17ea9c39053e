package de.bsommerfeld.bytesize.decimal;

import com.google.common.base.Preconditions;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Immutable decimal number used for every size computation.
 *
 * <p>
 * Wraps a {@link BigDecimal} evaluated with 80 significant digits, so chained
 * divisions by 1000 or 1024 do not accumulate the drift of binary floating
 * point. A dedicated {@link #NaN} value stands in for undefined results such
 * as a division by zero; any operation involving it yields {@link #NaN} again.
 *
 * <p>
 * Exact powers {@code base^0 .. base^8} are memoised per base, see
 * {@link #power(int, int)}.
 */
public final class Decimal implements Comparable<Decimal> {

    public static final MathContext CONTEXT = new MathContext(80, RoundingMode.HALF_UP);

    /** Highest exponent covered by the power cache. */
    public static final int MAX_EXPONENT = 8;

    public static final Decimal NaN = new Decimal(null);
    public static final Decimal ZERO = new Decimal(BigDecimal.ZERO);
    public static final Decimal ONE = new Decimal(BigDecimal.ONE);
    public static final Decimal EIGHT = new Decimal(BigDecimal.valueOf(8));

    private static final Map<Integer, List<Decimal>> POWERS = new ConcurrentHashMap<>();

    private final BigDecimal value;

    private Decimal(BigDecimal value) {
        this.value = value;
    }

    /**
     * Creates a decimal from a finite double, using its shortest decimal
     * representation ({@code 0.1} stays {@code 0.1}).
     *
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    public static Decimal of(double value) {
        Preconditions.checkArgument(Double.isFinite(value), "Value must be finite: %s", value);
        if (value == 0) {
            return ZERO;
        }
        return new Decimal(BigDecimal.valueOf(value));
    }

    public static Decimal of(long value) {
        return new Decimal(BigDecimal.valueOf(value));
    }

    public static Decimal of(BigInteger value) {
        Preconditions.checkNotNull(value, "value");
        return new Decimal(new BigDecimal(value));
    }

    public static Decimal of(BigDecimal value) {
        Preconditions.checkNotNull(value, "value");
        return new Decimal(value);
    }

    /**
     * Parses plain or scientific notation ({@code "1.5"}, {@code "-2e3"}).
     *
     * @throws NumberFormatException if the text is not a decimal literal or its
     *                               exponent is out of range
     */
    public static Decimal of(String text) {
        Preconditions.checkNotNull(text, "text");
        return new Decimal(new BigDecimal(text.trim(), CONTEXT));
    }

    /**
     * Returns {@code base^exponent} exactly. The table for a base is built on
     * first use and shared afterwards.
     *
     * @throws IllegalArgumentException if {@code base} is not positive or the
     *                                  exponent lies outside {@code [0, 8]}
     */
    public static Decimal power(int base, int exponent) {
        Preconditions.checkArgument(base > 0, "base must be positive: %s", base);
        Preconditions.checkArgument(exponent >= 0 && exponent <= MAX_EXPONENT,
                "exponent must be an integer between 0 and %s", MAX_EXPONENT);
        return POWERS.computeIfAbsent(base, Decimal::buildPowers).get(exponent);
    }

    private static List<Decimal> buildPowers(int base) {
        List<Decimal> powers = new ArrayList<>(MAX_EXPONENT + 1);
        BigDecimal current = BigDecimal.ONE;
        BigDecimal factor = BigDecimal.valueOf(base);
        for (int i = 0; i <= MAX_EXPONENT; i++) {
            powers.add(new Decimal(current));
            current = current.multiply(factor);
        }
        return Collections.unmodifiableList(powers);
    }

    public boolean isNaN() {
        return value == null;
    }

    public boolean isZero() {
        return value != null && value.signum() == 0;
    }

    /** Returns -1, 0 or 1. Undefined for {@link #NaN}. */
    public int signum() {
        Preconditions.checkState(value != null, "NaN has no sign");
        return value.signum();
    }

    public Decimal plus(Decimal other) {
        if (isNaN() || other.isNaN()) return NaN;
        return new Decimal(value.add(other.value, CONTEXT));
    }

    public Decimal minus(Decimal other) {
        if (isNaN() || other.isNaN()) return NaN;
        return new Decimal(value.subtract(other.value, CONTEXT));
    }

    public Decimal times(Decimal other) {
        if (isNaN() || other.isNaN()) return NaN;
        return new Decimal(value.multiply(other.value, CONTEXT));
    }

    /**
     * Divides this value by {@code divisor}. Dividing by zero returns
     * {@link #NaN} instead of throwing.
     */
    public Decimal dividedBy(Decimal divisor) {
        if (isNaN() || divisor.isNaN() || divisor.isZero()) return NaN;
        return new Decimal(value.divide(divisor.value, CONTEXT));
    }

    public Decimal abs() {
        if (isNaN()) return NaN;
        return value.signum() < 0 ? new Decimal(value.negate()) : this;
    }

    public Decimal negate() {
        if (isNaN()) return NaN;
        return new Decimal(value.negate());
    }

    /**
     * Rounds to {@code places} fraction digits.
     *
     * @throws IllegalArgumentException if {@code places} is negative
     */
    public Decimal round(int places, RoundingMethod method) {
        Preconditions.checkArgument(places >= 0, "places must not be negative: %s", places);
        Preconditions.checkNotNull(method, "method");
        if (isNaN()) return NaN;
        return new Decimal(value.setScale(places, method.toRoundingMode(value.signum())));
    }

    /** Rounds to an integer. */
    public Decimal roundInteger(RoundingMethod method) {
        return round(0, method);
    }

    public boolean greaterThan(Decimal other) {
        return !isNaN() && !other.isNaN() && value.compareTo(other.value) > 0;
    }

    public boolean greaterThanOrEqual(Decimal other) {
        return !isNaN() && !other.isNaN() && value.compareTo(other.value) >= 0;
    }

    public boolean lessThan(Decimal other) {
        return !isNaN() && !other.isNaN() && value.compareTo(other.value) < 0;
    }

    public boolean lessThanOrEqual(Decimal other) {
        return !isNaN() && !other.isNaN() && value.compareTo(other.value) <= 0;
    }

    /**
     * Narrows to a double. Magnitudes beyond the double range become an
     * infinity, which callers treat as an overflow.
     */
    public double toDouble() {
        return isNaN() ? Double.NaN : value.doubleValue();
    }

    /**
     * @throws IllegalStateException for {@link #NaN}
     */
    public BigDecimal toBigDecimal() {
        Preconditions.checkState(value != null, "NaN has no decimal value");
        return value;
    }

    /** Plain notation without trailing zeros, {@code "NaN"} for {@link #NaN}. */
    public String toPlainString() {
        if (isNaN()) return "NaN";
        if (value.signum() == 0) return "0";
        return value.stripTrailingZeros().toPlainString();
    }

    /**
     * Orders by numeric value. {@link #NaN} sorts above every number and equal
     * to itself, as {@link Double#compare(double, double)} does.
     */
    @Override
    public int compareTo(Decimal other) {
        if (isNaN()) return other.isNaN() ? 0 : 1;
        if (other.isNaN()) return -1;
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Decimal other)) return false;
        return compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        return isNaN() ? 0 : toPlainString().hashCode();
    }

    @Override
    public String toString() {
        return toPlainString();
    }
}
