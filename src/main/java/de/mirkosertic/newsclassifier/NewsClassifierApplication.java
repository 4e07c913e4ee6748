package de.mirkosertic.newsclassifier;

import de.mirkosertic.newsclassifier.config.ApplicationConfig;
import de.mirkosertic.newsclassifier.config.BuildInfo;
import de.mirkosertic.newsclassifier.config.LoggingConfigurator;
import de.mirkosertic.newsclassifier.model.InvalidModelBundleException;
import de.mirkosertic.newsclassifier.model.ModelBundle;
import de.mirkosertic.newsclassifier.model.ModelBundleLoader;
import de.mirkosertic.newsclassifier.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 * newsclassifier [--model &lt;path&gt;] [--explain] [file ...]
 * newsclassifier --version | --help
 * </pre>
 *
 * <p>Classifies each file, or stdin when no file is given, and prints one JSON document per
 * input to stdout. Logging goes to stderr, or to a log file in the deployed profile.</p>
 */
public class NewsClassifierApplication {

    private static final Logger logger = LoggerFactory.getLogger(NewsClassifierApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String STDIN_SOURCE = "stdin";

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: newsclassifier [--model <path>] [--explain] [file ...]",
            "       newsclassifier --version | --help",
            "",
            "Classifies news article text as likely fake or likely reliable.",
            "Reads stdin when no file is given and prints one JSON result per input.",
            "",
            "  --model <path>  model JSON (default: classifier.model.path or $NEWSCLASSIFIER_MODEL_PATH)",
            "  --explain       include the top contributing features in the result",
            "  --version       print version information",
            "  --help          print this help");

    private final ApplicationConfig config;
    private final ModelBundleLoader loader;

    public NewsClassifierApplication(final ApplicationConfig config) {
        this(config, new ModelBundleLoader());
    }

    NewsClassifierApplication(final ApplicationConfig config, final ModelBundleLoader loader) {
        this.config = config;
        this.loader = loader;
    }

    /**
     * Runs the command line.
     *
     * @return the process exit code
     */
    public int run(final String[] args, final InputStream stdin, final PrintStream out, final PrintStream err) {
        String modelPath = config.getModelPath();
        boolean explain = false;
        final List<Path> inputs = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            switch (arg) {
                case "--help", "-h" -> {
                    out.println(USAGE);
                    return EXIT_OK;
                }
                case "--version" -> {
                    out.println("newsclassifier " + BuildInfo.getVersion() + " (built " + BuildInfo.getBuildTimestamp() + ")");
                    return EXIT_OK;
                }
                case "--explain" -> explain = true;
                case "--model" -> {
                    if (i + 1 >= args.length) {
                        err.println("Missing value for --model");
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    modelPath = args[++i];
                }
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("Unknown option: " + arg);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    inputs.add(Paths.get(arg));
                }
            }
        }

        if (modelPath == null || modelPath.isBlank()) {
            err.println("No model configured. Use --model or set NEWSCLASSIFIER_MODEL_PATH.");
            return EXIT_USAGE;
        }

        final ModelBundle bundle;
        try {
            bundle = loader.load(Paths.get(modelPath));
        } catch (final IOException | InvalidModelBundleException e) {
            logger.error("Failed to load model from {}", modelPath, e);
            out.println(JsonSupport.errorJson(modelPath, "Failed to load model: " + e.getMessage()));
            return EXIT_FAILURE;
        }

        int exitCode = EXIT_OK;
        try (final NewsClassificationService service = NewsClassificationService.create(bundle, config)) {
            if (inputs.isEmpty()) {
                try {
                    final String text = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
                    out.println(JsonSupport.toJson(service.classify(text, explain).withSource(STDIN_SOURCE)));
                } catch (final IOException e) {
                    logger.error("Failed to read stdin", e);
                    out.println(JsonSupport.errorJson(STDIN_SOURCE, "Failed to read input: " + e.getMessage()));
                    exitCode = EXIT_FAILURE;
                }
            }
            for (final Path input : inputs) {
                try {
                    // Malformed UTF-8 is replaced, not rejected; such characters only separate tokens
                    final String text = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
                    out.println(JsonSupport.toJson(service.classify(text, explain).withSource(input.toString())));
                } catch (final IOException e) {
                    logger.error("Failed to read {}", input, e);
                    out.println(JsonSupport.errorJson(input.toString(), "Failed to read input: " + e.getMessage()));
                    exitCode = EXIT_FAILURE;
                }
            }
        }
        return exitCode;
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equalsIgnoreCase(System.getProperty("newsclassifier.profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            final int exitCode = new NewsClassifierApplication(config).run(args, System.in, System.out, System.err);
            System.exit(exitCode);
        } catch (final Exception e) {
            System.err.println("News classifier failed: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(EXIT_FAILURE);
        }
    }
}
