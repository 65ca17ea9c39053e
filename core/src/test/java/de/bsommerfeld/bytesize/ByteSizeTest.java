package de.bsommerfeld.bytesize;

import de.bsommerfeld.bytesize.format.FormatResult;
import de.bsommerfeld.bytesize.format.FormatSpec;
import de.bsommerfeld.bytesize.parse.InvalidByteSizeException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ByteSizeTest {

    @Test
    void chain_shouldAccumulateExactly() {
        ByteSize size = ByteSize.of("1 GiB").plus("512 MiB").times(2);

        assertEquals(3_221_225_472d, size.bytes());
        assertEquals("3.22 GB", size.toSI());
        assertEquals("3 GiB", size.toIEC());
        assertEquals("3 GB", size.toJEDEC());
    }

    @Test
    void plus_shouldAcceptMixedOperands() {
        ByteSize size = ByteSize.of(1024).plus("1 KiB", 512, BigInteger.valueOf(512));
        assertEquals(3072, size.bytes());
    }

    @Test
    void minus_shouldAllowNegativeResults() {
        ByteSize size = ByteSize.of("1 KiB").minus("2 KiB");
        assertEquals(-1024, size.bytes());
        assertEquals("-1 KiB", size.toString());
    }

    @Test
    void arithmetic_shouldAvoidFloatingPointDrift() {
        assertEquals(0.3, ByteSize.of(0.1).plus(0.2).bytes());
    }

    @Test
    void dividedBy_shouldDivideByProductOfDivisors() {
        assertEquals(256, ByteSize.of("1 KiB").dividedBy(2, 2).bytes());
    }

    @Test
    void dividedBy_shouldRejectZero() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ByteSize.of("1 KiB").dividedBy(0));
        assertEquals("Division by zero", e.getMessage());
    }

    @Test
    void of_shouldRejectInvalidValues() {
        assertThrows(InvalidByteSizeException.class, () -> ByteSize.of("not a size"));
        assertThrows(InvalidByteSizeException.class, () -> ByteSize.of(Double.POSITIVE_INFINITY));
        assertThrows(InvalidByteSizeException.class, () -> ByteSize.of(1).times(Double.NaN));
    }

    @Test
    void to_shouldForceUnit() {
        ByteSize size = ByteSize.of("1 GiB");
        assertEquals("1024 MiB", size.to("MiB"));
        assertEquals("1,024.00 MiB", size.to("MiB", FormatSpec.builder().pad(true).thousandsSeparator(",").build()));
    }

    @Test
    void toBits_shouldFormatInBits() {
        assertEquals("8 Kib", ByteSize.of(1024).toBits());
    }

    @Test
    void toResult_shouldExposeParts() {
        FormatResult result = ByteSize.of(1536).toResult();
        assertEquals(1536, result.bytes());
        assertEquals(1.5, result.value());
        assertEquals("KiB", result.unit());
        assertEquals(1, result.exponent());
    }

    @Test
    void compareTo_shouldOrderByBytes() {
        assertTrue(ByteSize.of("1 GiB").compareTo(ByteSize.of("1 GB")) > 0);
        assertEquals(0, ByteSize.of("1 KiB").compareTo(ByteSize.of(1024)));
        assertEquals(ByteSize.of("1 KiB"), ByteSize.of(1024));
    }

    @Test
    void operations_shouldNotMutate() {
        ByteSize original = ByteSize.of(1024);
        original.plus(1024);
        original.times(4);
        assertEquals(1024, original.bytes());
    }
}
