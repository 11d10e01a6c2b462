package io.pagecraft.core.model;

import java.util.Objects;

/**
 * The evaluable form of an expression tag body.
 *
 * <p>An expression fragment is handed to the evaluator as a single expression and its value is
 * written out. A statement fragment is executed for its side effects; only text produced through
 * the {@code write} channel is output. Multi-line statement fragments have their common
 * indentation stripped before execution and re-applied to every non-blank output line.
 *
 * @param code        code to hand to the evaluator
 * @param indentation indentation stripped from the second and following lines, empty if none
 * @param statements  {@code true} for statement mode, {@code false} for a single expression
 */
public record CodeFragment(String code, String indentation, boolean statements) {

    public CodeFragment {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(indentation, "indentation must not be null");
    }

    /** Creates a single-expression fragment. */
    public static CodeFragment expression(String code) {
        return new CodeFragment(code, "", false);
    }

    /** Prefixes every non-blank line of {@code output} with this fragment's indentation. */
    public String reindent(String output) {
        if (indentation.isEmpty() || output.isEmpty()) {
            return output;
        }
        String[] lines = output.split("\n", -1);
        StringBuilder sb = new StringBuilder(output.length() + lines.length * indentation.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            if (!lines[i].isBlank()) {
                sb.append(indentation);
            }
            sb.append(lines[i]);
        }
        return sb.toString();
    }
}
