package de.bsommerfeld.bytesize.decimal;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class DecimalTest {

    @Test
    void power_shouldBeExactForAllExponents() {
        assertEquals("1", Decimal.power(1024, 0).toPlainString());
        assertEquals("1024", Decimal.power(1024, 1).toPlainString());
        assertEquals("1208925819614629174706176", Decimal.power(1024, 8).toPlainString());
        assertEquals("1000000000000000000000000", Decimal.power(1000, 8).toPlainString());
    }

    @Test
    void power_shouldReturnCachedInstance() {
        assertSame(Decimal.power(1024, 5), Decimal.power(1024, 5));
    }

    @Test
    void power_shouldRejectExponentOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> Decimal.power(1024, 9));
        assertThrows(IllegalArgumentException.class, () -> Decimal.power(1024, -1));
        assertThrows(IllegalArgumentException.class, () -> Decimal.power(0, 1));
    }

    @Test
    void dividedBy_shouldNotDriftLikeDoubles() {
        Decimal value = Decimal.of(1500);
        for (int i = 0; i < 5; i++) {
            value = value.dividedBy(Decimal.of(1024));
        }
        for (int i = 0; i < 5; i++) {
            value = value.times(Decimal.of(1024));
        }
        assertEquals(0, value.round(10, RoundingMethod.ROUND).compareTo(Decimal.of(1500)));
    }

    @Test
    void dividedBy_shouldReturnNaNForZeroDivisor() {
        Decimal result = Decimal.of(1).dividedBy(Decimal.ZERO);
        assertTrue(result.isNaN());
        assertTrue(Double.isNaN(result.toDouble()));
    }

    @Test
    void operations_shouldPropagateNaN() {
        assertTrue(Decimal.NaN.plus(Decimal.ONE).isNaN());
        assertTrue(Decimal.ONE.minus(Decimal.NaN).isNaN());
        assertTrue(Decimal.NaN.times(Decimal.ONE).isNaN());
        assertTrue(Decimal.NaN.abs().isNaN());
        assertTrue(Decimal.NaN.round(2, RoundingMethod.FLOOR).isNaN());
    }

    @Test
    void round_shouldBreakNegativeTiesTowardsZero() {
        assertEquals("2", Decimal.of(1.5).roundInteger(RoundingMethod.ROUND).toPlainString());
        assertEquals("3", Decimal.of(2.5).roundInteger(RoundingMethod.ROUND).toPlainString());
        assertEquals("-1", Decimal.of(-1.5).roundInteger(RoundingMethod.ROUND).toPlainString());
        assertEquals("-2", Decimal.of(-2.5).roundInteger(RoundingMethod.ROUND).toPlainString());
        assertEquals("-3", Decimal.of(-2.6).roundInteger(RoundingMethod.ROUND).toPlainString());
    }

    @Test
    void round_shouldSupportAllMethods() {
        Decimal value = Decimal.of(1.4649);
        assertEquals("1.46", value.round(2, RoundingMethod.ROUND).toPlainString());
        assertEquals("1.46", value.round(2, RoundingMethod.FLOOR).toPlainString());
        assertEquals("1.47", value.round(2, RoundingMethod.CEIL).toPlainString());
        assertEquals("1.46", value.round(2, RoundingMethod.TRUNC).toPlainString());

        Decimal negative = Decimal.of(-1.4649);
        assertEquals("-1.47", negative.round(2, RoundingMethod.FLOOR).toPlainString());
        assertEquals("-1.46", negative.round(2, RoundingMethod.CEIL).toPlainString());
        assertEquals("-1.46", negative.round(2, RoundingMethod.TRUNC).toPlainString());
    }

    @Test
    void round_shouldRejectNegativePlaces() {
        assertThrows(IllegalArgumentException.class, () -> Decimal.ONE.round(-1, RoundingMethod.ROUND));
    }

    @Test
    void of_shouldRejectNonFiniteDoubles() {
        assertThrows(IllegalArgumentException.class, () -> Decimal.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Decimal.of(Double.POSITIVE_INFINITY));
    }

    @Test
    void of_shouldCollapseNegativeZero() {
        assertSame(Decimal.ZERO, Decimal.of(-0.0));
        assertEquals(0, Decimal.of(-0.0).signum());
    }

    @Test
    void of_shouldParseScientificNotation() {
        assertEquals("1500000", Decimal.of("1.5e6").toPlainString());
        assertEquals("-0.002", Decimal.of("-2E-3").toPlainString());
    }

    @Test
    void of_shouldRejectGarbage() {
        assertThrows(NumberFormatException.class, () -> Decimal.of("abc"));
    }

    @Test
    void toDouble_shouldOverflowToInfinity() {
        Decimal huge = Decimal.of("1e309");
        assertEquals(Double.POSITIVE_INFINITY, huge.toDouble());
    }

    @Test
    void of_shouldKeepBigIntegersExact() {
        BigInteger big = BigInteger.TWO.pow(80);
        assertEquals(new BigDecimal(big), Decimal.of(big).toBigDecimal());
    }

    @Test
    void compareTo_shouldOrderNumericallyWithNaNLast() {
        assertTrue(Decimal.of(1).compareTo(Decimal.of(2)) < 0);
        assertEquals(0, Decimal.of(1.0).compareTo(Decimal.of("1.000")));
        assertTrue(Decimal.NaN.compareTo(Decimal.of(1e300)) > 0);
        assertFalse(Decimal.NaN.greaterThan(Decimal.ONE));
        assertFalse(Decimal.NaN.lessThan(Decimal.ONE));
    }

    @Test
    void equals_shouldIgnoreScale() {
        assertEquals(Decimal.of("1.50"), Decimal.of(1.5));
        assertEquals(Decimal.of("1.50").hashCode(), Decimal.of(1.5).hashCode());
    }

    @Test
    void abs_shouldDropSign() {
        assertEquals(Decimal.of(5), Decimal.of(-5).abs());
        assertEquals(Decimal.of(-5), Decimal.of(5).negate());
    }

    @Test
    void fromString_shouldResolveRoundingMethodIgnoringCase() {
        assertEquals(RoundingMethod.FLOOR, RoundingMethod.fromString("floor"));
        assertEquals(RoundingMethod.TRUNC, RoundingMethod.fromString(" Trunc "));
        assertThrows(IllegalArgumentException.class, () -> RoundingMethod.fromString("banker"));
        assertThrows(IllegalArgumentException.class, () -> RoundingMethod.fromString(""));
    }
}
