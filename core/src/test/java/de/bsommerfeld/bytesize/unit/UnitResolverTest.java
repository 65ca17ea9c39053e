package de.bsommerfeld.bytesize.unit;

import de.bsommerfeld.bytesize.decimal.Decimal;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnitResolverTest {

    @Test
    void tierFor_shouldPickLargestFittingExponent() {
        assertEquals(0, UnitResolver.tierFor(Decimal.of(1023), 1024, 8));
        assertEquals(1, UnitResolver.tierFor(Decimal.of(1024), 1024, 8));
        assertEquals(1, UnitResolver.tierFor(Decimal.of(1_048_575), 1024, 8));
        assertEquals(2, UnitResolver.tierFor(Decimal.of(1_048_576), 1024, 8));
        assertEquals(3, UnitResolver.tierFor(Decimal.of(1_000_000_000), 1000, 8));
    }

    @Test
    void tierFor_shouldReturnZeroForZeroAndFractions() {
        assertEquals(0, UnitResolver.tierFor(Decimal.ZERO, 1024, 8));
        assertEquals(0, UnitResolver.tierFor(Decimal.of(0.5), 1024, 8));
    }

    @Test
    void tierFor_shouldClampToMaxExponent() {
        Decimal huge = Decimal.power(1024, 8).times(Decimal.of(1024));
        assertEquals(8, UnitResolver.tierFor(huge, 1024, 8));
        assertEquals(3, UnitResolver.tierFor(huge, 1024, 3));
    }

    @Test
    void tierFor_shouldGrowMonotonicallyWithMagnitude() {
        for (int base : new int[] {1000, 1024}) {
            int previous = 0;
            Decimal bytes = Decimal.ONE;
            for (int step = 0; step < 200; step++) {
                int exponent = UnitResolver.tierFor(bytes, base, 8);
                assertTrue(exponent >= previous, "base " + base + " dropped a tier at " + bytes);
                previous = exponent;
                bytes = bytes.plus(Decimal.ONE).times(Decimal.of(1.5));
            }
            assertEquals(8, previous);
        }
    }

    @Test
    void resolve_shouldTreatJedecStyleAsBinaryByDefault() {
        assertEquals(new UnitInfo(1024, 3, false), UnitResolver.resolve("GB", true).orElseThrow());
    }

    @Test
    void resolve_shouldTreatJedecStyleAsDecimalWithoutIec() {
        assertEquals(new UnitInfo(1000, 3, false), UnitResolver.resolve("GB", false).orElseThrow());
    }

    @Test
    void resolve_shouldKeepIecUnitsBinaryRegardlessOfFlag() {
        assertEquals(new UnitInfo(1024, 3, false), UnitResolver.resolve("GiB", false).orElseThrow());
        assertEquals(new UnitInfo(1024, 3, false), UnitResolver.resolve("GiB", true).orElseThrow());
    }

    @Test
    void resolve_shouldTreatLowercasePrefixAsDecimal() {
        assertEquals(new UnitInfo(1000, 1, false), UnitResolver.resolve("kb", true).orElseThrow());
        assertEquals(new UnitInfo(1000, 1, false), UnitResolver.resolve("kB", true).orElseThrow());
    }

    @Test
    void resolve_shouldDecomposeUnlistedTokens() {
        assertEquals(new UnitInfo(1024, 1, false), UnitResolver.resolve("kbyte", true).orElseThrow());
        assertEquals(new UnitInfo(1000, 1, false), UnitResolver.resolve("kbyte", false).orElseThrow());
        assertEquals(new UnitInfo(1024, 1, false), UnitResolver.resolve("kibyte", false).orElseThrow());
        assertEquals(new UnitInfo(1024, 1, false), UnitResolver.resolve("koctet", true).orElseThrow());
        assertEquals(new UnitInfo(1000, 2, true), UnitResolver.resolve("mbits", false).orElseThrow());
    }

    @Test
    void resolve_shouldIgnoreSeparatorsInLongNames() {
        assertEquals(new UnitInfo(1000, 1, false), UnitResolver.resolve("kilo-bytes", true).orElseThrow());
    }

    @Test
    void resolve_shouldTreatMissingUnitAsBytes() {
        UnitInfo info = UnitResolver.resolve(null, true).orElseThrow();
        assertEquals(0, info.exponent());
        assertFalse(info.bit());
    }

    @Test
    void resolve_shouldReturnEmptyForUnknownUnit() {
        assertTrue(UnitResolver.resolve("furlong", true).isEmpty());
    }

    @Test
    void exponentOfForcedUnit_shouldUsePrefixLetter() {
        assertEquals(2, UnitResolver.exponentOfForcedUnit("MiB", null));
        assertEquals(1, UnitResolver.exponentOfForcedUnit("kB", null));
        assertEquals(0, UnitResolver.exponentOfForcedUnit("B", null));
    }

    @Test
    void exponentOfForcedUnit_shouldSearchCustomTable() {
        CustomUnitTable table = CustomUnitTable.of(1024,
                CustomUnit.of("ch", "chunk", "chunks"),
                CustomUnit.of("bl", "block", "blocks"));
        assertEquals(1, UnitResolver.exponentOfForcedUnit("blocks", table));
    }

    @Test
    void clamp_shouldBoundExponent() {
        assertEquals(0, UnitResolver.clamp(-3, 8));
        assertEquals(8, UnitResolver.clamp(12, 8));
        assertEquals(3, UnitResolver.clamp(5, 3));
    }
}
