package de.bsommerfeld.bytesize.cli;

import de.bsommerfeld.bytesize.format.FormatSpec;
import de.bsommerfeld.bytesize.parse.ParseSpec;
import de.bsommerfeld.bytesize.unit.UnitSystem;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Output options shared by all commands. Options left out on the command
 * line keep the engine defaults from {@link CliDefaults}.
 */
public class FormatOptions {

    @Option(names = {"-s", "--system"}, paramLabel = "SYSTEM",
            description = "Unit system: ${COMPLETION-CANDIDATES} (default: IEC).")
    UnitSystem system;

    @Option(names = {"-d", "--decimals"}, paramLabel = "N",
            description = "Maximum number of decimal places (default: 2).")
    Integer decimals;

    @Option(names = "--bits", description = "Show sizes in bits instead of bytes.")
    boolean bits;

    @Option(names = {"-l", "--long"}, description = "Spell out unit names, e.g. 'kibibytes'.")
    boolean longForm;

    @Option(names = "--locale", paramLabel = "TAG",
            description = "Language tag for number separators, e.g. de-DE.")
    String locale;

    @Option(names = "--json", description = "Print results as JSON.")
    boolean json;

    @Spec(Spec.Target.MIXEE)
    CommandSpec mixee;

    FormatSpec formatSpec() {
        FormatSpec.Builder builder = FormatSpec.builder();
        if (system != null) {
            builder.system(system);
        }
        if (decimals != null) {
            if (decimals < 0) {
                throw new ParameterException(mixee.commandLine(),
                        "Decimals must be a non-negative integer, got: " + decimals);
            }
            builder.decimals(decimals);
        }
        if (bits) {
            builder.bits(true);
        }
        if (longForm) {
            builder.longForm(true);
        }
        if (locale != null) {
            builder.locale(locale);
        }
        return builder.build();
    }

    ParseSpec parseSpec() {
        return locale != null ? ParseSpec.builder().locale(locale).build() : ParseSpec.defaults();
    }

    boolean isJson() {
        return json;
    }
}
