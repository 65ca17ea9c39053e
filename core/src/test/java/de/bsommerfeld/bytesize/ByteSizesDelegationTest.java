package de.bsommerfeld.bytesize;

import de.bsommerfeld.bytesize.extract.ByteSizeExtractor;
import de.bsommerfeld.bytesize.extract.ExtractedMatch;
import de.bsommerfeld.bytesize.format.ByteSizeFormatter;
import de.bsommerfeld.bytesize.format.FormatSpec;
import de.bsommerfeld.bytesize.parse.ByteSizeParser;
import de.bsommerfeld.bytesize.parse.InvalidByteSizeException;
import de.bsommerfeld.bytesize.parse.ParseSpec;
import de.bsommerfeld.bytesize.unit.UnitSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ByteSizesDelegationTest {

    @Mock
    private ByteSizeFormatter formatter;

    @Mock
    private ByteSizeParser parser;

    @Mock
    private ByteSizeExtractor extractor;

    private ByteSizes sizes;

    @BeforeEach
    void setUp() {
        ByteSizeConfig config = new ByteSizeConfig(
                FormatSpec.builder().system(UnitSystem.SI).decimals(3).build(),
                ParseSpec.builder().iec(false).build());
        sizes = new ByteSizes(config, formatter, parser, extractor);
    }

    @Test
    void format_shouldPassMergedSpecToFormatter() {
        when(formatter.format(eq(1500.0), any(FormatSpec.class))).thenReturn("1.5 kB");

        assertEquals("1.5 kB", sizes.format(1500, FormatSpec.builder().decimals(1).build()));

        verify(formatter).format(eq(1500.0), argThat((FormatSpec spec) ->
                spec.getSystem() == UnitSystem.SI && spec.getDecimals() == 1));
    }

    @Test
    void parse_shouldPassMergedSpecToParser() {
        when(parser.parse(eq("1 KB"), any(ParseSpec.class))).thenReturn(1000.0);

        assertEquals(1000.0, sizes.parse("1 KB", ParseSpec.strict()));

        verify(parser).parse(eq("1 KB"), argThat((ParseSpec spec) -> !spec.isIec() && spec.isStrict()));
    }

    @Test
    void extract_shouldDelegateToExtractor() {
        List<ExtractedMatch> matches = List.of(new ExtractedMatch(1, "KiB", 1024, "1 KiB", 0, 5));
        when(extractor.extract("1 KiB")).thenReturn(matches);

        assertSame(matches, sizes.extract("1 KiB"));
    }

    @Test
    void compare_shouldRejectOperandsTheParserCannotRead() {
        when(parser.parse(eq("bogus"), any(ParseSpec.class))).thenReturn(Double.NaN);

        assertThrows(InvalidByteSizeException.class, () -> sizes.compare("bogus", 1));
        verifyNoInteractions(formatter);
    }

    @Test
    void derive_shouldKeepCollaboratorsButNotConfig() {
        when(formatter.format(eq(1024.0), any(FormatSpec.class))).thenReturn("1 KiB");

        ByteSizes derived = sizes.derive(ByteSizeConfig.defaults());
        derived.format(1024);

        verify(formatter).format(eq(1024.0), argThat((FormatSpec spec) -> spec.getSystem() == UnitSystem.IEC));
        assertEquals(ByteSizeConfig.defaults(), derived.config());
    }
}
