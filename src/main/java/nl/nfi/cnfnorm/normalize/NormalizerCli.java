package nl.nfi.cnfnorm.normalize;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.MalformedGrammarException;
import nl.nfi.cnfnorm.serialize.GrammarFormatter;
import nl.nfi.cnfnorm.serialize.GrammarParser;
import nl.nfi.cnfnorm.serialize.TraceCodec;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "cnf_normalizer")
public class NormalizerCli implements Callable<Integer> {

    @Option(names = {"--grammar"}, description = "The grammar file to normalize, - for standard input", required = true)
    private String grammarPath;

    @Option(names = {"--config"}, description = "INI file with pipeline and trace settings")
    private String configPath = null;

    @Option(names = {"--trace"}, description = "The file to write the transformation trace to")
    private String tracePath = null;

    @Option(names = {"--output"}, description = "The file to write the normalized grammar to")
    private String outputPath = "-";

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() throws Exception {
        // must be set before the first logger is created
        if (logPath != null) {
            System.setProperty("LOG_DIRECTORY_PATH", logPath);
        }

        try {
            final NormalizerConfig config = configPath != null
                    ? NormalizerConfig.loadFrom(Paths.get(configPath))
                    : NormalizerConfig.defaults();
            final Grammar grammar = readGrammar();

            final NormalizationResult result = normalize(grammar, config);

            if (outputPath.equals("-")) {
                print(result, System.out);
                System.out.flush();
                return ExitCode.OK;
            }
            try (final PrintStream output = new PrintStream(new BufferedOutputStream(new FileOutputStream(Paths.get(outputPath).toFile())), false, UTF_8)) {
                print(result, output);
            }
        } catch (final MalformedGrammarException e) {
            LoggerFactory.getLogger(NormalizerCli.class).error("Malformed grammar", e);
            System.err.println("Malformed grammar: " + e.getMessage());
            return ExitCode.USAGE;
        } catch (final Throwable t) {
            LoggerFactory.getLogger(NormalizerCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }

    private Grammar readGrammar() throws IOException {
        if (grammarPath.equals("-")) {
            final BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, UTF_8));
            return GrammarParser.parse(reader.lines().toList());
        }
        return GrammarParser.loadFrom(Paths.get(grammarPath));
    }

    private NormalizationResult normalize(final Grammar grammar, final NormalizerConfig config) throws IOException {
        final CnfNormalizer normalizer = CnfNormalizer.create().config(config);
        if (tracePath == null) {
            return normalizer.normalize(grammar);
        }
        try (final TraceCodec.Encoder encoder = TraceCodec.forOutput(new FileOutputStream(Paths.get(tracePath).toFile()), config.includeSnapshots())) {
            encoder.writeHeader(grammar);
            return normalizer.trace(encoder).normalize(grammar);
        }
    }

    static void print(final NormalizationResult result, final PrintStream output) {
        final String formatted = GrammarFormatter.format(result.grammar());
        if (!formatted.isEmpty()) {
            output.println(formatted);
        }
        output.println("empty: " + result.empty());
        output.println("infinite: " + result.infinite());
    }
}
