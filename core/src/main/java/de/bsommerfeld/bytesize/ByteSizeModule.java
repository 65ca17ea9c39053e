package de.bsommerfeld.bytesize;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import de.bsommerfeld.bytesize.format.LocaleFormatCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice module wiring the conversion engine. Formatter and parser share one
 * {@link LocaleFormatCache}.
 */
public class ByteSizeModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ByteSizeModule.class);

    private final ByteSizeConfig config;

    public ByteSizeModule() {
        this(ByteSizeConfig.defaults());
    }

    public ByteSizeModule(ByteSizeConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        LOG.debug("Binding byte size engine with format defaults {}", config.format().getSystem());
        bind(ByteSizeConfig.class).toInstance(config);
        bind(LocaleFormatCache.class).in(Singleton.class);
        bind(ByteSizes.class).in(Singleton.class);
    }
}
