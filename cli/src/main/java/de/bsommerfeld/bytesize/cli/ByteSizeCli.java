package de.bsommerfeld.bytesize.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.bytesize.ByteSizes;
import de.bsommerfeld.bytesize.decimal.Decimal;
import de.bsommerfeld.bytesize.extract.ExtractedMatch;
import de.bsommerfeld.bytesize.format.FormatSpec;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry point.
 *
 * <pre>
 * bytesize 1073741824               # 1 GiB
 * bytesize "1.5 GB" -b              # 1610612736
 * bytesize 1000000000 -s si         # 1 GB
 * bytesize compare "1 GB" "500 MB"  # 1 GiB > 500 MiB
 * echo "File: 1.5GB" | bytesize -e  # 1.5 GiB
 * </pre>
 */
@Command(
        name = "bytesize",
        description = "Converts between byte counts and human-readable sizes.",
        mixinStandardHelpOptions = true,
        versionProvider = ManifestVersionProvider.class,
        exitCodeOnInvalidInput = ExitCode.ERROR,
        exitCodeOnExecutionException = ExitCode.ERROR,
        subcommands = {
                CompareCommand.class,
        }
)
public class ByteSizeCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ByteSizeCli.class);

    @Mixin
    FormatOptions options;

    @Option(names = {"-b", "--to-bytes"}, description = "Print the raw byte count instead of a formatted size.")
    boolean toBytes;

    @Option(names = {"-e", "--extract"}, description = "Read text from standard input and print every size in it.")
    boolean extract;

    @Parameters(paramLabel = "VALUE", arity = "0..*",
            description = "A byte count or size string. Several arguments are joined with spaces.")
    List<String> values = new ArrayList<>();

    @Spec
    CommandSpec spec;

    private final ByteSizes sizes;
    private final ObjectMapper mapper;
    private final InputStream stdin;

    @Inject
    public ByteSizeCli(ByteSizes sizes, ObjectMapper mapper) {
        this(sizes, mapper, System.in);
    }

    ByteSizeCli(ByteSizes sizes, ObjectMapper mapper, InputStream stdin) {
        this.sizes = sizes;
        this.mapper = mapper;
        this.stdin = stdin;
    }

    @Override
    public Integer call() throws Exception {
        FormatSpec format = options.formatSpec();
        if (extract) {
            return extract(format);
        }
        if (values.isEmpty()) {
            return fail("No value provided. Use --help for usage.");
        }

        String input = String.join(" ", values);
        double bytes = sizes.parse(input, options.parseSpec());
        if (Double.isNaN(bytes)) {
            return fail((toBytes ? "Invalid byte string: " : "Invalid input: ") + input);
        }

        PrintWriter out = spec.commandLine().getOut();
        if (toBytes) {
            out.println(Decimal.of(bytes).toPlainString());
        } else if (options.isJson()) {
            out.println(mapper.writeValueAsString(sizes.render(bytes, format)));
        } else {
            out.println(sizes.format(bytes, format));
        }
        out.flush();
        return ExitCode.OK;
    }

    private int extract(FormatSpec format) throws IOException {
        String text = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        List<ExtractedMatch> matches = sizes.extract(text);
        LOG.debug("Extracted {} sizes from {} characters", matches.size(), text.length());
        if (matches.isEmpty()) {
            return fail("No byte values found in input.");
        }

        PrintWriter out = spec.commandLine().getOut();
        if (options.isJson()) {
            out.println(mapper.writeValueAsString(matches));
        } else {
            for (ExtractedMatch match : matches) {
                out.println(sizes.format(match.bytes(), format));
            }
        }
        out.flush();
        return ExitCode.OK;
    }

    private int fail(String message) {
        PrintWriter err = spec.commandLine().getErr();
        err.println(message);
        err.flush();
        return ExitCode.ERROR;
    }

    /**
     * Builds the command line for {@code command}, creating subcommands
     * through the injector.
     */
    static CommandLine commandLine(ByteSizeCli command, Injector injector) {
        CommandLine cli = new CommandLine(command, new GuiceFactory(injector));
        cli.setCaseInsensitiveEnumValuesAllowed(true);
        cli.setExecutionExceptionHandler(new ShortErrorHandler());
        cli.setUsageHelpAutoWidth(true);
        return cli;
    }

    public static void main(String[] args) {
        Injector injector = Guice.createInjector(new CliModule());
        CommandLine cli = commandLine(injector.getInstance(ByteSizeCli.class), injector);
        System.exit(cli.execute(args));
    }

    static class ShortErrorHandler implements IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd, ParseResult parseResult) {
            LOG.debug("Command failed", ex);
            cmd.getErr().println(cmd.getColorScheme().errorText("ERROR: " + ex.getMessage()));
            cmd.getErr().flush();
            return cmd.getCommandSpec().exitCodeOnExecutionException();
        }
    }
}
