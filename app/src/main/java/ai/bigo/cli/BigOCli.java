package ai.bigo.cli;

import ai.bigo.config.AnalyzerSettings;
import ai.bigo.estimate.AnalysisError;
import ai.bigo.estimate.EstimationOrchestrator;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

/**
 * Reads one Python source file (or stdin) and prints a complexity estimate for every function in it.
 *
 * <p>Exit codes: 0 on success, 1 when the input cannot be read, 2 when it is not valid Python or the analysis was
 * cancelled, 3 when the report cannot be serialized.
 */
@CommandLine.Command(
        name = "big-o",
        mixinStandardHelpOptions = true,
        version = "big-o-tracker 0.1.0",
        description = "Estimate the time and space complexity of each function in a Python source file.")
public final class BigOCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(BigOCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT = 1;
    static final int EXIT_PARSE = 2;
    static final int EXIT_SERIALIZATION = 3;

    @CommandLine.Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "FILE",
            description = "Python source file; reads stdin when omitted.")
    @Nullable
    private Path file;

    @CommandLine.Option(names = "--model", description = "Model identifier for remote classification.")
    @Nullable
    private String model;

    @CommandLine.Option(names = "--base-url", description = "OpenAI-compatible endpoint for remote classification.")
    @Nullable
    private String baseUrl;

    @CommandLine.Option(names = "--timeout", description = "Upper bound in seconds on one remote call.")
    @Nullable
    private Double timeoutSeconds;

    @CommandLine.Option(names = "--no-remote", description = "Use only the structural heuristic.")
    private boolean noRemote = false;

    @CommandLine.Option(names = "--parallel", description = "Number of functions classified concurrently.")
    private int parallelism = 1;

    @CommandLine.Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES}.")
    private OutputFormat format = OutputFormat.JSON;

    @CommandLine.Option(
            names = {"-v", "--verbose"},
            description = "Include verdict source, line, early termination and notes.")
    private boolean verbose = false;

    @CommandLine.Option(names = "--pretty", description = "Indent JSON output.")
    private boolean pretty = false;

    @CommandLine.Option(names = "--debug", description = "Log classifier decisions to stderr.")
    private boolean debug = false;

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final Map<String, String> environment;

    public BigOCli() {
        this(System.in, System.out, System.err, System.getenv());
    }

    BigOCli(InputStream in, PrintStream out, PrintStream err, Map<String, String> environment) {
        this.in = in;
        this.out = out;
        this.err = err;
        this.environment = environment;
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new BigOCli()).execute(args);
        System.exit(exitCode);
    }

    /** Accepts {@code --format text} as well as {@code --format TEXT}. */
    static CommandLine commandLine(BigOCli cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        if (debug) {
            Configurator.setLevel("ai.bigo", Level.DEBUG);
        }

        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            logger.debug("Failed to read input", e);
            err.println("Error: cannot read " + (file == null ? "stdin" : file) + ": " + e.getMessage());
            return EXIT_INPUT;
        }

        AnalyzerSettings settings;
        try {
            settings = settings();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return CommandLine.ExitCode.USAGE;
        }
        logger.debug("Analyzing with {}", settings);

        var formatter = new ReportFormatter(verbose, pretty);
        try (var orchestrator = EstimationOrchestrator.create(settings)) {
            var report = orchestrator.analyze(source);
            var rendered = formatter.format(report, format);
            out.println(rendered);

            var error = report.error();
            if (error != null) {
                err.println(describe(error));
                return EXIT_PARSE;
            }
            return EXIT_OK;
        } catch (JsonProcessingException e) {
            err.println(e.getMessage());
            return EXIT_SERIALIZATION;
        }
    }

    private String readSource() throws IOException {
        if (file != null) {
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    private AnalyzerSettings settings() {
        var settings = AnalyzerSettings.fromEnvironment(environment);
        if (model != null) {
            settings = settings.withModel(model);
        }
        if (baseUrl != null) {
            settings = settings.withBaseUrl(baseUrl);
        }
        if (timeoutSeconds != null) {
            settings = settings.withRemoteTimeout(Duration.ofMillis(Math.round(timeoutSeconds * 1000)));
        }
        if (noRemote) {
            settings = settings.withoutRemote();
        }
        return settings.withParallelism(parallelism);
    }

    private static String describe(AnalysisError error) {
        if (error.kind() == AnalysisError.Kind.PARSE_ERROR) {
            return "%s at line %d, column %d: %s"
                    .formatted(error.kind().wireName(), error.line(), error.column(), error.message());
        }
        return error.kind().wireName() + ": " + error.message();
    }
}
