package de.bsommerfeld.bytesize.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import de.bsommerfeld.bytesize.ByteSizeConfig;
import de.bsommerfeld.bytesize.ByteSizeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guice wiring for the command line: the conversion engine with the
 * {@link CliDefaults} and one shared JSON mapper.
 */
public class CliModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(CliModule.class);

    private final ByteSizeConfig config;

    public CliModule() {
        this(CliDefaults.config());
    }

    public CliModule(ByteSizeConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        LOG.debug("Command line defaults: system={}, decimals={}",
                config.format().getSystem(), config.format().getDecimals());
        install(new ByteSizeModule(config));
        bind(ObjectMapper.class).toInstance(new ObjectMapper());
    }
}
