package io.pagecraft.core.parse;

import io.pagecraft.core.error.IncorrectForTagException;
import io.pagecraft.core.model.BlockKind;
import io.pagecraft.core.model.ForClause;
import io.pagecraft.core.model.Location;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Parses {@code for <targets> in <source> ( for <targets> in <source> | if <condition> )*}.
 *
 * <p>Keywords are whole whitespace-delimited words found outside string literals and brackets.
 * Only {@code in} ends a target list, so {@code in} inside a source or condition is left to the
 * evaluator. Target candidates are split on commas, stripped of non-identifier characters (so
 * {@code (k, v)} works) and kept only if they are identifiers.
 */
final class ForClauseParser {

    private static final String FOR = "for";
    private static final String IN = "in";
    private static final String IF = "if";

    private ForClauseParser() {}

    /** A keyword occurrence: {@code start} and {@code end} delimit the word itself. */
    private record Keyword(String word, int start, int end) {}

    static BlockKind.ForLoop parse(String body, Location location) {
        List<Keyword> keywords = scanKeywords(body);
        if (keywords.isEmpty() || !keywords.get(0).word().equals(FOR) || keywords.get(0).start() != 0) {
            throw new IncorrectForTagException(body, "must start with 'for'", location);
        }

        List<ForClause> clauses = new ArrayList<>();
        SortedSet<String> allTargets = new TreeSet<>();
        int k = 0;
        while (k < keywords.size()) {
            Keyword keyword = keywords.get(k);
            if (keyword.word().equals(FOR)) {
                int in = nextIndex(keywords, k + 1, IN);
                if (in < 0) {
                    throw new IncorrectForTagException(body, "missing 'in'", location);
                }
                List<String> targets = parseTargets(body.substring(keyword.end(), keywords.get(in).start()));
                if (targets.isEmpty()) {
                    throw new IncorrectForTagException(body, "no loop targets", location);
                }
                int next = nextClauseIndex(keywords, in + 1);
                String source = body.substring(keywords.get(in).end(), endOf(body, keywords, next)).strip();
                if (source.isEmpty()) {
                    throw new IncorrectForTagException(body, "missing source expression", location);
                }
                clauses.add(new ForClause.Iteration(targets, source));
                allTargets.addAll(targets);
                k = next;
            } else {
                int next = nextClauseIndex(keywords, k + 1);
                String condition = body.substring(keyword.end(), endOf(body, keywords, next)).strip();
                if (condition.isEmpty()) {
                    throw new IncorrectForTagException(body, "missing filter condition", location);
                }
                clauses.add(new ForClause.Filter(condition));
                k = next;
            }
        }
        return new BlockKind.ForLoop(new ArrayList<>(allTargets), clauses);
    }

    private static List<String> parseTargets(String text) {
        List<String> targets = new ArrayList<>();
        for (String candidate : text.split(",")) {
            StringBuilder sb = new StringBuilder();
            for (char c : candidate.toCharArray()) {
                if (Identifiers.isIdentifierPart(c)) {
                    sb.append(c);
                }
            }
            String target = sb.toString();
            if (Identifiers.isIdentifier(target)) {
                targets.add(target);
            }
        }
        return targets;
    }

    private static int nextIndex(List<Keyword> keywords, int from, String word) {
        for (int i = from; i < keywords.size(); i++) {
            if (keywords.get(i).word().equals(word)) {
                return i;
            }
        }
        return -1;
    }

    /** Index of the next {@code for} or {@code if} keyword, or {@code keywords.size()}. */
    private static int nextClauseIndex(List<Keyword> keywords, int from) {
        for (int i = from; i < keywords.size(); i++) {
            String word = keywords.get(i).word();
            if (word.equals(FOR) || word.equals(IF)) {
                return i;
            }
        }
        return keywords.size();
    }

    private static int endOf(String body, List<Keyword> keywords, int index) {
        return index < keywords.size() ? keywords.get(index).start() : body.length();
    }

    private static List<Keyword> scanKeywords(String body) {
        List<Keyword> keywords = new ArrayList<>();
        char quote = 0;
        int depth = 0;
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                i++;
            } else if (c == '\'' || c == '"') {
                quote = c;
                i++;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
                i++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else {
                int start = i;
                while (i < body.length() && Identifiers.isIdentifierPart(body.charAt(i))) {
                    i++;
                }
                if (i == start) {
                    i++;
                    continue;
                }
                String word = body.substring(start, i);
                boolean delimited = (start == 0 || Character.isWhitespace(body.charAt(start - 1)))
                        && (i == body.length() || Character.isWhitespace(body.charAt(i)));
                if (depth == 0 && delimited && (word.equals(FOR) || word.equals(IN) || word.equals(IF))) {
                    keywords.add(new Keyword(word, start, i));
                }
            }
        }
        return keywords;
    }
}
