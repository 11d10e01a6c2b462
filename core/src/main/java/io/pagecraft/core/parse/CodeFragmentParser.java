package io.pagecraft.core.parse;

import io.pagecraft.core.error.MismatchingIndentationException;
import io.pagecraft.core.model.CodeFragment;
import io.pagecraft.core.model.Location;

/**
 * Prepares the body of an expression tag for evaluation.
 *
 * <p>A single-line body without a top-level {@code ;} is an expression. Anything else is a
 * statement block. In a multi-line block every line after the first must start with the leading
 * whitespace of the second line (blank lines are exempt); that indentation is stripped here and
 * re-applied to the output by the executor.
 */
final class CodeFragmentParser {

    private CodeFragmentParser() {}

    static CodeFragment parse(String body, Location location) {
        String[] lines = body.split("\n", -1);
        if (lines.length == 1) {
            String code = body.strip();
            return hasTopLevelSemicolon(code) ? new CodeFragment(code, "", true) : CodeFragment.expression(code);
        }

        String indentation = leadingWhitespace(lines[1]);
        StringBuilder code = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (!line.startsWith(indentation) && !line.isBlank()) {
                throw new MismatchingIndentationException(
                        location.line() + i, line, location.line() + 1, indentation, location);
            }
            code.append('\n');
            if (line.startsWith(indentation)) {
                code.append(line, indentation.length(), line.length());
            }
        }
        return new CodeFragment(code.toString(), indentation, true);
    }

    /** Finds a {@code ;} outside string literals. */
    static boolean hasTopLevelSemicolon(String code) {
        char quote = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == ';') {
                return true;
            }
        }
        return false;
    }

    private static String leadingWhitespace(String line) {
        int end = 0;
        while (end < line.length() && Character.isWhitespace(line.charAt(end))) {
            end++;
        }
        return line.substring(0, end);
    }
}
