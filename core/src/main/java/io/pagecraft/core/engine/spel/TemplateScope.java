package io.pagecraft.core.engine.spel;

import io.pagecraft.core.spi.Environment;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Root object of every SpEL evaluation. Bare identifiers resolve to environment bindings through
 * {@link ScopePropertyAccessor}; the public methods are callable from template code.
 */
public final class TemplateScope {

    private final Environment env;

    TemplateScope(Environment env) {
        this.env = env;
    }

    Environment environment() {
        return env;
    }

    /**
     * Writes the values, separated by a space and followed by a newline, to the output of the
     * current code tag. {@code null} values are written as empty strings.
     */
    public void write(Object... values) {
        emit(" ", "\n", false, values);
    }

    /** Like {@link #write(Object...)} with a caller-chosen separator and terminator. */
    public void writeWith(String sep, String end, Object... values) {
        emit(sep == null ? "" : sep, end == null ? "" : end, false, values);
    }

    /** Like {@link #write(Object...)}, with every value passed through {@link #escape(Object)}. */
    public void writeEscaped(Object... values) {
        emit(" ", "\n", true, values);
    }

    private void emit(String sep, String end, boolean escaped, Object[] values) {
        String line = values == null
                ? ""
                : Arrays.stream(values)
                        .map(value -> escaped ? escape(value) : text(value))
                        .collect(Collectors.joining(sep));
        env.write(line + end);
    }

    /** Escapes {@code &}, {@code <}, {@code >}, {@code "} and {@code '} for HTML output. */
    public String escape(Object value) {
        String text = text(value);
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#x27;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
