package de.bsommerfeld.bytesize.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.bytesize.ByteSizes;
import de.bsommerfeld.bytesize.format.FormatSpec;
import de.bsommerfeld.bytesize.parse.ParseSpec;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * {@code bytesize compare <a> <b>}: prints both sizes with the relation
 * between them, e.g. {@code 1 GiB > 500 MiB}.
 */
@Command(
        name = "compare",
        description = "Compares two sizes.",
        mixinStandardHelpOptions = true,
        exitCodeOnInvalidInput = ExitCode.ERROR,
        exitCodeOnExecutionException = ExitCode.ERROR
)
public class CompareCommand implements Callable<Integer> {

    @Mixin
    FormatOptions options;

    @Parameters(index = "0", paramLabel = "A", description = "First size.")
    String first;

    @Parameters(index = "1", paramLabel = "B", description = "Second size.")
    String second;

    @Spec
    CommandSpec spec;

    private final ByteSizes sizes;
    private final ObjectMapper mapper;

    @Inject
    public CompareCommand(ByteSizes sizes, ObjectMapper mapper) {
        this.sizes = sizes;
        this.mapper = mapper;
    }

    @Override
    public Integer call() throws Exception {
        ParseSpec parse = options.parseSpec();
        double a = sizes.parse(first, parse);
        double b = sizes.parse(second, parse);
        if (Double.isNaN(a) || Double.isNaN(b)) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Invalid byte values provided.");
            err.flush();
            return ExitCode.ERROR;
        }

        FormatSpec format = options.formatSpec();
        Comparison comparison = new Comparison(sizes.format(a, format), sizes.format(b, format),
                relation(sizes.compare(a, b)));

        PrintWriter out = spec.commandLine().getOut();
        if (options.isJson()) {
            out.println(mapper.writeValueAsString(comparison));
        } else {
            out.println(comparison.a() + " " + comparison.relation() + " " + comparison.b());
        }
        out.flush();
        return ExitCode.OK;
    }

    static String relation(int comparison) {
        if (comparison > 0) return ">";
        if (comparison < 0) return "<";
        return "=";
    }

    record Comparison(String a, String b, String relation) {
    }
}
