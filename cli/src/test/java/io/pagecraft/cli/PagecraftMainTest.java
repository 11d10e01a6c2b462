package io.pagecraft.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** End-to-end runs of the command with captured standard streams. */
@DisplayName("pagecraft command")
class PagecraftMainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private final Map<String, String> env = new HashMap<>();
    private Path config;

    @BeforeEach
    void setUp() throws IOException {
        config = dir.resolve("pagecraft.yaml");
        Files.writeString(config, "logging:\n  level: ERROR\n");
    }

    private int runWithStdin(String stdin, String... args) {
        String[] withConfig = Stream.concat(Stream.of("--config", config.toString()), Stream.of(args))
                .toArray(String[]::new);
        return PagecraftMain.run(
                withConfig,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                new PrintStream(stderr, true, StandardCharsets.UTF_8),
                env::get);
    }

    private int run(String... args) {
        return runWithStdin("", args);
    }

    private Path template(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    // --- Rendering ---

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("File → standard output")
        void rendersFileToStdout() throws IOException {
            Path page = template("page.tpl", "{% for i in {1, 2, 3} %}{{ i * i }} {% endfor %}");

            assertThat(run(page.toString())).isEqualTo(PagecraftMain.EXIT_OK);
            assertThat(out()).isEqualTo("1 4 9 ");
            assertThat(err()).isEmpty();
        }

        @Test
        @DisplayName("- → template read from standard input")
        void readsStdin() {
            assertThat(runWithStdin("Hello {{ __name__ }}", "-")).isEqualTo(PagecraftMain.EXIT_OK);
            assertThat(out()).isEqualTo("Hello pagecraft_page");
        }

        @Test
        @DisplayName("-d binds the JSON object's entries")
        void seedsDataFromJson() throws IOException {
            Path page = template("greet.tpl", "Hello {{ name }}!");

            assertThat(run("-d", "{\"name\": \"World\"}", page.toString())).isEqualTo(PagecraftMain.EXIT_OK);
            assertThat(out()).isEqualTo("Hello World!");
        }

        @Test
        @DisplayName("-o writes the file and nothing to standard output")
        void writesOutputFile() throws IOException {
            Path page = template("page.tpl", "{% if true %}yes{% else %}no{% endif %}");
            Path target = dir.resolve("page.html");

            assertThat(run("-o", target.toString(), page.toString())).isEqualTo(PagecraftMain.EXIT_OK);
            assertThat(Files.readString(target)).isEqualTo("yes");
            assertThat(out()).isEmpty();
        }

        @Test
        @DisplayName("-e jslt switches the expression language")
        void jsltEvaluator() throws IOException {
            Path page = template("page.tpl", "{% for x in $items %}<{{ $x }}>{% endfor %}");

            int status = run("-e", "jslt", "-d", "{\"items\": [\"a\", \"b\"]}", page.toString());

            assertThat(status).isEqualTo(PagecraftMain.EXIT_OK);
            assertThat(out()).isEqualTo("<a><b>");
        }

        @Test
        @DisplayName("PAGECRAFT_EVALUATOR selects the evaluator when -e is absent")
        void evaluatorFromEnvironment() throws IOException {
            env.put("PAGECRAFT_EVALUATOR", "jslt");
            Path page = template("page.tpl", "{{ 1 + 2 }}");

            assertThat(run(page.toString())).isEqualTo(PagecraftMain.EXIT_OK);
            assertThat(out()).isEqualTo("3");
        }

        @Test
        @DisplayName("--tree prints the parsed outline instead of rendering")
        void printsTree() throws IOException {
            Path page = template("page.tpl", "Hello {{ name }}");

            assertThat(run("--tree", page.toString())).isEqualTo(PagecraftMain.EXIT_OK);
            assertThat(out()).startsWith("Root:\n").contains("Text:", "'Hello '", "Expr-inline:");
        }
    }

    // --- Help and usage ---

    @Nested
    @DisplayName("Usage")
    class Usage {

        @Test
        void helpPrintsUsage() {
            assertThat(run("--help")).isEqualTo(PagecraftMain.EXIT_OK);
            assertThat(out()).startsWith("Usage: pagecraft");
        }

        @Test
        @DisplayName("Bad arguments → message + usage on stderr, exit 1")
        void badArguments() {
            assertThat(run("--nope", "x.tpl")).isEqualTo(PagecraftMain.EXIT_FAILURE);
            assertThat(err()).startsWith("pagecraft: Unknown option: --nope").contains("Usage: pagecraft");
            assertThat(out()).isEmpty();
        }
    }

    // --- Failures ---

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Syntax error → detail on stderr, exit 1")
        void syntaxError() throws IOException {
            Path page = template("broken.tpl", "{% if true %}never closed");

            assertThat(run(page.toString())).isEqualTo(PagecraftMain.EXIT_FAILURE);
            assertThat(err().strip())
                    .isEqualTo("Missing closing '{% endif %}' tag for opening '{% if true %}' at line 1, column 1.");
            assertThat(out()).isEmpty();
        }

        @Test
        @DisplayName("Render error → no partial output file")
        void renderErrorLeavesNoOutputFile() throws IOException {
            Path page = template("page.tpl", "before {{ missing.call() }} after");
            Path target = dir.resolve("page.html");

            assertThat(run("-o", target.toString(), page.toString())).isEqualTo(PagecraftMain.EXIT_FAILURE);
            assertThat(target).doesNotExist();
            assertThat(err()).contains("(at line 1, column 8)");
        }

        @Test
        void missingFile() {
            Path missing = dir.resolve("absent.tpl");

            assertThat(run(missing.toString())).isEqualTo(PagecraftMain.EXIT_FAILURE);
            assertThat(err().strip()).isEqualTo("pagecraft: File '" + missing + "' does not exist.");
        }

        @Test
        void unknownEvaluator() throws IOException {
            Path page = template("page.tpl", "x");

            assertThat(run("-e", "groovy", page.toString())).isEqualTo(PagecraftMain.EXIT_FAILURE);
            assertThat(err()).contains("No expression evaluator registered for id: 'groovy'");
        }

        @Test
        void invalidData() throws IOException {
            Path page = template("page.tpl", "x");

            assertThat(run("-d", "[]", page.toString())).isEqualTo(PagecraftMain.EXIT_FAILURE);
            assertThat(err()).startsWith("pagecraft: --data must be a JSON object");
        }
    }
}
