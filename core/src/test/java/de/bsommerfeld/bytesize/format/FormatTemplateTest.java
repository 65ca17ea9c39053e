package de.bsommerfeld.bytesize.format;

import de.bsommerfeld.bytesize.unit.UnitSystem;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class FormatTemplateTest {

    private final ByteSizeFormatter formatter = new ByteSizeFormatter(new LocaleFormatCache());

    private String format(double bytes, String template) {
        return formatter.format(bytes, FormatSpec.builder().template(template).build());
    }

    @Test
    void template_shouldSubstituteValueAndUnit() {
        assertEquals("1.5KiB", format(1536, "{value}{unit}"));
        assertEquals("1.5 KiB", format(1536, "{value} {unit}"));
    }

    @Test
    void template_shouldSubstituteLongUnit() {
        assertEquals("1.5 kibibytes", format(1536, "{value} {longUnit}"));
        assertEquals("1 kibibyte", format(1024, "{value} {longUnit}"));
        assertEquals("0 bytes", format(0, "{value} {longUnit}"));
        assertEquals("1 byte", format(1, "{value} {longUnit}"));
    }

    @Test
    void template_shouldSubstituteBytesAndExponent() {
        assertEquals("1536 bytes = 1.5 KiB", format(1536, "{bytes} bytes = {value} {unit}"));
        assertEquals("1.5|KiB|1", format(1536, "{value}|{unit}|{exponent}"));
        assertEquals("500 B (exp 0)", format(500, "{value} {unit} (exp {exponent})"));
    }

    @Test
    void template_shouldKeepUnknownTokens() {
        assertEquals("1 {unknown}", format(1024, "{value} {unknown}"));
    }

    @Test
    void template_shouldHandleEdgeCases() {
        assertEquals("", format(1024, ""));
        assertEquals("static text", format(1024, "static text"));
        assertEquals("KiB - KiB", format(1024, "{unit} - {unit}"));
        assertEquals("1024", format(1024, "{bytes}"));
    }

    @Test
    void template_shouldApplySignDecimalsAndWidth() {
        FormatSpec.Builder base = FormatSpec.builder().template("{value} {unit}");
        assertEquals("+1 KiB", formatter.format(1024, base.signed(true).build()));
        assertEquals("-1 KiB", formatter.format(-1024, FormatSpec.builder().template("{value} {unit}").build()));
        assertEquals("1.00 KiB", formatter.format(1024,
                FormatSpec.builder().template("{value} {unit}").pad(true).build()));
        assertEquals("          1 KiB", formatter.format(1024,
                FormatSpec.builder().template("{value} {unit}").fixedWidth(15).build()));
    }

    @Test
    void template_shouldUseBitNames() {
        FormatSpec options = FormatSpec.builder().bits(true).template("{value} {longUnit}").build();
        assertEquals("8 kibibits", formatter.format(1024, options));
    }

    @Test
    void template_shouldUseSystemNames() {
        FormatSpec options = FormatSpec.builder().system(UnitSystem.SI).template("{value} {longUnit}").build();
        assertEquals("1.5 kilobytes", formatter.format(1500, options));
    }

    @Test
    void template_shouldRenderBigIntegerBytes() {
        FormatSpec options = FormatSpec.builder().template("{bytes} -> {value} {unit}").build();
        assertEquals("1024 -> 1 KiB", formatter.format(BigInteger.valueOf(1024), options));
    }

    @Test
    void template_shouldUseForcedUnit() {
        FormatSpec options = FormatSpec.builder().template("{value} {unit}").unit("KiB").build();
        assertEquals("1024 KiB", formatter.format(1_048_576, options));
    }

    @Test
    void template_shouldTolerateReplacementCharacters() {
        FormatSpec options = FormatSpec.builder().template("{value}{unit}").unit("$B\\").build();
        assertEquals("1024$B\\", formatter.format(1024, options));
    }
}
