package de.bsommerfeld.bytesize;

import de.bsommerfeld.bytesize.decimal.Decimal;
import de.bsommerfeld.bytesize.format.FormatResult;
import de.bsommerfeld.bytesize.format.FormatSpec;
import de.bsommerfeld.bytesize.format.OutputMode;
import de.bsommerfeld.bytesize.parse.InvalidByteSizeException;
import de.bsommerfeld.bytesize.unit.UnitSystem;

/**
 * Immutable byte count with chainable arithmetic.
 *
 * <pre>
 * ByteSize.of("1 GiB").plus("512 MiB").times(2).toSI();   // "3.22 GB"
 * </pre>
 *
 * Operands may be numbers, {@link java.math.BigInteger}s or size strings.
 * Arithmetic runs on {@link Decimal} and every step yields a new instance.
 */
public final class ByteSize implements Comparable<ByteSize> {

    private final double bytes;
    private final ByteSizes sizes;

    ByteSize(double bytes, ByteSizes sizes) {
        if (!Double.isFinite(bytes)) {
            throw new InvalidByteSizeException("Invalid byte value: " + bytes);
        }
        this.bytes = bytes;
        this.sizes = sizes;
    }

    /**
     * @throws InvalidByteSizeException if the value is not a valid size
     */
    public static ByteSize of(Object value) {
        return ByteSizes.create().size(value);
    }

    public double bytes() {
        return bytes;
    }

    public ByteSize plus(Object... values) {
        return new ByteSize(Decimal.of(bytes).plus(sum(values)).toDouble(), sizes);
    }

    public ByteSize minus(Object... values) {
        return new ByteSize(Decimal.of(bytes).minus(sum(values)).toDouble(), sizes);
    }

    public ByteSize times(double... factors) {
        return new ByteSize(Decimal.of(bytes).times(product(factors)).toDouble(), sizes);
    }

    /**
     * @throws IllegalArgumentException if the divisors multiply to zero
     */
    public ByteSize dividedBy(double... divisors) {
        Decimal divisor = product(divisors);
        if (divisor.isZero()) {
            throw new IllegalArgumentException("Division by zero");
        }
        return new ByteSize(Decimal.of(bytes).dividedBy(divisor).toDouble(), sizes);
    }

    /** Formats in the given unit, e.g. {@code to("MiB")}. */
    public String to(String unit) {
        return to(unit, null);
    }

    public String to(String unit, FormatSpec options) {
        return sizes.format(bytes, override(options).unit(unit).build());
    }

    public String toSI() {
        return inSystem(UnitSystem.SI);
    }

    public String toIEC() {
        return inSystem(UnitSystem.IEC);
    }

    public String toJEDEC() {
        return inSystem(UnitSystem.JEDEC);
    }

    public String toBits() {
        return sizes.format(bytes, FormatSpec.builder().bits(true).build());
    }

    public String toString(FormatSpec options) {
        return sizes.format(bytes, options);
    }

    public FormatResult toResult() {
        return sizes.render(bytes, FormatSpec.builder().output(OutputMode.OBJECT).build());
    }

    private String inSystem(UnitSystem system) {
        return sizes.format(bytes, FormatSpec.builder().system(system).build());
    }

    private static FormatSpec.Builder override(FormatSpec options) {
        return options != null ? options.toBuilder() : FormatSpec.builder();
    }

    private Decimal sum(Object[] values) {
        Decimal sum = Decimal.ZERO;
        for (Object value : values) {
            sum = sum.plus(Decimal.of(sizes.bytesOf(value)));
        }
        return sum;
    }

    private static Decimal product(double[] values) {
        Decimal product = Decimal.ONE;
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw new InvalidByteSizeException("Expected finite number, got " + value);
            }
            product = product.times(Decimal.of(value));
        }
        return product;
    }

    @Override
    public int compareTo(ByteSize other) {
        return Decimal.of(bytes).compareTo(Decimal.of(other.bytes));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteSize other)) return false;
        return Double.compare(bytes, other.bytes) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(bytes);
    }

    @Override
    public String toString() {
        return sizes.format(bytes);
    }
}
