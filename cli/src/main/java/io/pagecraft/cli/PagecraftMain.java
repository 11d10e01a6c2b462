package io.pagecraft.cli;

import io.pagecraft.cli.config.CliConfig;
import io.pagecraft.cli.config.ConfigLoadException;
import io.pagecraft.cli.config.ConfigLoader;
import io.pagecraft.core.engine.EvaluatorRegistry;
import io.pagecraft.core.engine.LoopBudget;
import io.pagecraft.core.engine.TemplateEngine;
import io.pagecraft.core.error.TemplateException;
import io.pagecraft.core.model.Template;
import io.pagecraft.core.model.TreePrinter;
import io.pagecraft.core.spi.ExpressionEvaluator;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code pagecraft} command.
 *
 * <p>Reads a template from a file or standard input, renders it and writes the result to standard
 * output or the {@code -o} file. The output file is only written after a successful render. Exit
 * status is 0 on success and 1 on any error, with the message on standard error.
 */
public final class PagecraftMain {

    private static final Logger LOG = LoggerFactory.getLogger(PagecraftMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String STDIN_NAME = "<stdin>";

    private PagecraftMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments, see {@link CliArguments#USAGE}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err, System::getenv));
    }

    /** Runs the command and returns its exit status. Never calls {@link System#exit(int)}. */
    static int run(
            String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr, Function<String, String> env) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            stderr.println("pagecraft: " + e.getMessage());
            stderr.println(CliArguments.USAGE);
            return EXIT_FAILURE;
        }
        if (arguments.help()) {
            stdout.println(CliArguments.USAGE);
            return EXIT_OK;
        }

        try {
            CliConfig config = arguments.configPath() != null
                    ? ConfigLoader.load(arguments.configPath(), env)
                    : ConfigLoader.loadOptional(Path.of(ConfigLoader.DEFAULT_CONFIG_FILE), env);
            LogbackConfigurator.configure(config);

            String evaluatorId = arguments.evaluator() != null ? arguments.evaluator() : config.evaluator();
            ExpressionEvaluator evaluator = EvaluatorRegistry.withDefaults().requireEvaluator(evaluatorId);
            TemplateEngine engine = new TemplateEngine(evaluator, LoopBudget.ofMillis(config.whileTimeLimitMs()));

            String source = readSource(arguments, stdin);
            Template template = engine.parse(templateName(arguments), source);
            if (arguments.printTree()) {
                stdout.println(TreePrinter.print(template));
                stdout.flush();
                return EXIT_OK;
            }

            Map<String, Object> seed = arguments.data() != null ? SeedData.parse(arguments.data()) : Map.of();
            String output = engine.render(template, seed);
            writeOutput(arguments, output, stdout);
            return EXIT_OK;
        } catch (TemplateException e) {
            stderr.println(e.detail());
            return EXIT_FAILURE;
        } catch (ConfigLoadException | IllegalArgumentException | IOException e) {
            stderr.println("pagecraft: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure: {}", e.getMessage(), e);
            stderr.println("pagecraft: unexpected failure: " + e);
            return EXIT_FAILURE;
        }
    }

    private static String readSource(CliArguments arguments, InputStream stdin) throws IOException {
        if (arguments.readsStdin()) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Path.of(arguments.source());
        if (!Files.isRegularFile(path)) {
            throw new IOException("File '" + path + "' does not exist.");
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private static String templateName(CliArguments arguments) {
        return arguments.readsStdin() ? STDIN_NAME : arguments.source();
    }

    private static void writeOutput(CliArguments arguments, String output, PrintStream stdout) throws IOException {
        if (arguments.outputPath() != null) {
            Files.writeString(arguments.outputPath(), output, StandardCharsets.UTF_8);
        } else {
            stdout.print(output);
            stdout.flush();
        }
    }
}
