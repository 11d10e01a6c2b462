package io.pagecraft.core.parse;

import io.pagecraft.core.error.ExpressionMissingException;
import io.pagecraft.core.error.ExpressionProhibitedException;
import io.pagecraft.core.error.InvalidCaptureNameException;
import io.pagecraft.core.error.InvalidFunctionDefinitionException;
import io.pagecraft.core.error.UnknownTagException;
import io.pagecraft.core.model.BlockKind;
import io.pagecraft.core.model.Location;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Identifies the kind of a {@code {% ... %}} directive and validates its syntax.
 *
 * <p>The leading keyword of the trimmed body selects the kind. {@code if}, {@code elif}, {@code else}
 * and {@code comment} may be followed by any non-identifier character, so {@code if(x)} is a
 * conditional; the other keywords need a space. An empty body, or any body starting with
 * {@code end}, is an end tag whose remainder names the block it closes.
 */
public final class BlockClassifier {

    private static final String END = "end";
    private static final String DOFIRST = "dofirst";
    private static final String SLOW = "slow";

    /** Keywords that may be followed directly by their expression, as in {@code if(x)}. */
    private static final Set<String> PREFIX_KEYWORDS = Set.of(
            BlockKind.Conditional.IF, BlockKind.Conditional.ELIF, BlockKind.Conditional.ELSE, "comment");

    private BlockClassifier() {}

    public static BlockKind classify(String body, Location location) {
        String directive = body.strip();
        if (directive.isEmpty() || directive.startsWith(END)) {
            return new BlockKind.End(directive.isEmpty() ? "" : directive.substring(END.length()).strip());
        }

        int split = keywordEnd(directive);
        String keyword = directive.substring(0, split);
        String rest = directive.substring(split).strip();
        if (split < directive.length()
                && !Character.isWhitespace(directive.charAt(split))
                && !PREFIX_KEYWORDS.contains(keyword)) {
            throw new UnknownTagException(directive, location);
        }

        switch (keyword) {
            case BlockKind.Conditional.IF, BlockKind.Conditional.ELIF -> {
                if (rest.isEmpty()) {
                    throw new ExpressionMissingException(keyword, location);
                }
                return new BlockKind.Conditional(keyword, rest);
            }
            case BlockKind.Conditional.ELSE -> {
                if (!rest.isEmpty()) {
                    throw new ExpressionProhibitedException(keyword, location);
                }
                return BlockKind.Conditional.otherwise();
            }
            case "for" -> {
                return ForClauseParser.parse(directive, location);
            }
            case "while" -> {
                return parseWhile(rest, location);
            }
            case "capture" -> {
                if (!Identifiers.isIdentifier(rest)) {
                    throw new InvalidCaptureNameException(rest, location);
                }
                return new BlockKind.Capture(rest);
            }
            case "comment" -> {
                return new BlockKind.CommentBlock();
            }
            case "def" -> {
                return parseFunctionDef(directive, rest, location);
            }
            default -> throw new UnknownTagException(directive, location);
        }
    }

    private static BlockKind.WhileLoop parseWhile(String rest, Location location) {
        String expression = rest;
        boolean doFirst = false;
        boolean slow = false;

        int split = firstWhitespace(expression);
        if (expression.substring(0, split).equals(DOFIRST)) {
            doFirst = true;
            expression = expression.substring(split).strip();
        }
        int last = lastWhitespace(expression);
        if (last >= 0 && expression.substring(last + 1).equals(SLOW)) {
            slow = true;
            expression = expression.substring(0, last).strip();
        }

        if (expression.isEmpty()) {
            throw new ExpressionMissingException("while", location);
        }
        return new BlockKind.WhileLoop(expression, doFirst, slow);
    }

    private static BlockKind.FunctionDef parseFunctionDef(String directive, String rest, Location location) {
        if (rest.isEmpty()) {
            throw new InvalidFunctionDefinitionException(directive, location);
        }
        List<String> words = Arrays.asList(rest.split("\\s+"));
        if (!words.stream().allMatch(Identifiers::isIdentifier)) {
            throw new InvalidFunctionDefinitionException(directive, location);
        }
        return new BlockKind.FunctionDef(words.get(0), words.subList(1, words.size()));
    }

    private static int keywordEnd(String s) {
        int i = 0;
        while (i < s.length() && Identifiers.isIdentifierPart(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int firstWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return s.length();
    }

    private static int lastWhitespace(String s) {
        for (int i = s.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
