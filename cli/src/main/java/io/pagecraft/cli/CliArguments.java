package io.pagecraft.cli;

import java.nio.file.Path;

/**
 * Parsed command line of {@code pagecraft}.
 *
 * @param source     template path, or {@value #STDIN} for standard input
 * @param outputPath output file, or {@code null} for standard output
 * @param data       JSON object with seed bindings, or {@code null}
 * @param printTree  print the parsed tree instead of rendering
 * @param evaluator  evaluator id overriding the configuration, or {@code null}
 * @param configPath configuration file, or {@code null} for the default lookup
 * @param help       print usage and exit
 */
record CliArguments(
        String source, Path outputPath, String data, boolean printTree, String evaluator, Path configPath, boolean help) {

    static final String STDIN = "-";

    static final String USAGE = String.join(
            "\n",
            "Usage: pagecraft [options] <source | ->",
            "",
            "Renders a template to standard output.",
            "",
            "Options:",
            "  -o, --output <file>      write the output to <file> instead of standard output",
            "  -d, --data <json>        JSON object whose entries are bound before rendering",
            "  -e, --evaluator <id>     expression evaluator (spel, jslt)",
            "      --config <file>      configuration file (default: ./pagecraft.yaml if present)",
            "      --tree               print the parsed template tree and exit",
            "  -h, --help               print this help and exit");

    boolean readsStdin() {
        return STDIN.equals(source);
    }

    /**
     * Parses the command line.
     *
     * @throws IllegalArgumentException on unknown options, missing option values or a missing or
     *     repeated source
     */
    static CliArguments parse(String[] args) {
        String source = null;
        Path outputPath = null;
        String data = null;
        boolean printTree = false;
        String evaluator = null;
        Path configPath = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h", "--help" -> {
                    return new CliArguments(null, null, null, false, null, null, true);
                }
                case "-o", "--output" -> outputPath = Path.of(value(args, ++i, arg));
                case "-d", "--data" -> data = value(args, ++i, arg);
                case "-e", "--evaluator" -> evaluator = value(args, ++i, arg);
                case "--config" -> configPath = Path.of(value(args, ++i, arg));
                case "--tree" -> printTree = true;
                default -> {
                    if (arg.startsWith("-") && !arg.equals(STDIN)) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (source != null) {
                        throw new IllegalArgumentException(
                                "Only one source may be given, got '" + source + "' and '" + arg + "'");
                    }
                    source = arg;
                }
            }
        }
        if (source == null) {
            throw new IllegalArgumentException("Missing source file (use - to read from standard input)");
        }
        return new CliArguments(source, outputPath, data, printTree, evaluator, configPath, false);
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }
}
