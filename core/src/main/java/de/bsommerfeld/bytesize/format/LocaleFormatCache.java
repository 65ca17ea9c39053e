package de.bsommerfeld.bytesize.format;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableSet;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.NumberFormat;
import java.util.IllformedLocaleException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * Bounded cache of locale specific number formats.
 *
 * <p>
 * Entries are keyed by language tag and fraction digit settings and evicted
 * least recently used first once {@value #MAX_SIZE} formats are held. Cached
 * instances act as prototypes only: callers always receive a clone, because
 * {@link DecimalFormat} is not thread safe.
 *
 * <p>
 * Tags that are ill-formed or name a locale the JDK has no number format for
 * yield an empty result, and callers fall back to locale independent
 * rendering.
 */
@Singleton
public class LocaleFormatCache {

    public static final int MAX_SIZE = 100;

    private static final Logger LOG = LoggerFactory.getLogger(LocaleFormatCache.class);
    private static final Set<Locale> AVAILABLE = ImmutableSet.copyOf(NumberFormat.getAvailableLocales());

    private final Cache<String, DecimalFormat> formats;

    public LocaleFormatCache() {
        this(MAX_SIZE);
    }

    @VisibleForTesting
    LocaleFormatCache(int maximumSize) {
        this.formats = CacheBuilder.newBuilder().maximumSize(maximumSize).build();
    }

    /** Process wide instance for callers that do not use injection. */
    public static LocaleFormatCache shared() {
        return Holder.INSTANCE;
    }

    /**
     * Returns a fresh copy of the number format for the tag.
     *
     * @param languageTag       BCP 47 tag such as {@code "de-DE"}
     * @param minFractionDigits minimum digits after the decimal separator
     * @param maxFractionDigits maximum digits after the decimal separator
     * @return the format, or empty if the locale is not supported
     */
    public Optional<DecimalFormat> numberFormat(String languageTag, int minFractionDigits, int maxFractionDigits) {
        Optional<Locale> locale = resolve(languageTag);
        if (locale.isEmpty()) {
            return Optional.empty();
        }
        int min = Math.max(0, minFractionDigits);
        int max = Math.max(min, maxFractionDigits);
        String key = languageTag + '|' + min + '|' + max;
        try {
            DecimalFormat prototype = formats.get(key, () -> create(locale.get(), min, max));
            return Optional.of((DecimalFormat) prototype.clone());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to create number format for " + languageTag, e.getCause());
        }
    }

    /**
     * Separator symbols of the locale, or empty if it is not supported.
     */
    public Optional<DecimalFormatSymbols> symbols(String languageTag) {
        return numberFormat(languageTag, 0, 0).map(DecimalFormat::getDecimalFormatSymbols);
    }

    public long size() {
        formats.cleanUp();
        return formats.size();
    }

    public void clear() {
        formats.invalidateAll();
    }

    private static DecimalFormat create(Locale locale, int min, int max) {
        LOG.debug("Creating number format for {} with {}..{} fraction digits", locale, min, max);
        NumberFormat format = NumberFormat.getNumberInstance(locale);
        if (!(format instanceof DecimalFormat decimalFormat)) {
            throw new IllegalStateException("No decimal format available for " + locale);
        }
        decimalFormat.setMinimumFractionDigits(min);
        decimalFormat.setMaximumFractionDigits(max);
        decimalFormat.setGroupingUsed(true);
        return decimalFormat;
    }

    static Optional<Locale> resolve(String languageTag) {
        if (languageTag == null || languageTag.isBlank()) {
            return Optional.empty();
        }
        Locale locale;
        try {
            locale = new Locale.Builder().setLanguageTag(languageTag.trim()).build();
        } catch (IllformedLocaleException e) {
            LOG.debug("Ignoring ill-formed locale '{}': {}", languageTag, e.getMessage());
            return Optional.empty();
        }
        if (AVAILABLE.contains(locale) || AVAILABLE.contains(Locale.forLanguageTag(locale.getLanguage()))) {
            return Optional.of(locale);
        }
        LOG.debug("No number format for locale '{}', rendering without locale", languageTag);
        return Optional.empty();
    }

    private static final class Holder {
        private static final LocaleFormatCache INSTANCE = new LocaleFormatCache();
    }
}
