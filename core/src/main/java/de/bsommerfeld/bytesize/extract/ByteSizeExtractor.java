package de.bsommerfeld.bytesize.extract;

import com.google.inject.Singleton;
import de.bsommerfeld.bytesize.parse.ByteSizeParser;
import de.bsommerfeld.bytesize.parse.BytePatterns;
import de.bsommerfeld.bytesize.parse.ParseSpec;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Finds every size literal in a text, left to right.
 *
 * <p>
 * Extraction is best effort and never throws: literals whose number or byte
 * count cannot be represented are left out of the result.
 */
@Singleton
public class ByteSizeExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ByteSizeExtractor.class);

    private final ByteSizeParser parser;

    @Inject
    public ByteSizeExtractor(ByteSizeParser parser) {
        this.parser = parser;
    }

    public ByteSizeExtractor() {
        this(new ByteSizeParser());
    }

    public List<ExtractedMatch> extract(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<ExtractedMatch> matches = new ArrayList<>();
        Matcher matcher = BytePatterns.GLOBAL_BYTE_PATTERN.matcher(text);
        while (matcher.find()) {
            double value = parseLiteral(matcher.group(1));
            double bytes = parser.parse(matcher.group(), ParseSpec.defaults());
            if (!Double.isFinite(value) || !Double.isFinite(bytes)) {
                LOG.debug("Skipping unreadable size '{}' at {}", matcher.group(), matcher.start());
                continue;
            }
            String unit = matcher.group(2) != null ? matcher.group(2) : "B";
            matches.add(new ExtractedMatch(value, unit, bytes, matcher.group(), matcher.start(), matcher.end()));
        }
        return List.copyOf(matches);
    }

    private static double parseLiteral(String literal) {
        try {
            return Double.parseDouble(literal.replace(',', '.'));
        } catch (NumberFormatException e) {
            LOG.debug("Unreadable number '{}'", literal, e);
            return Double.NaN;
        }
    }
}
