package io.pagecraft.core.parse;

/** Identifier rules shared by the block classifier and the for-clause parser. */
final class Identifiers {

    private Identifiers() {}

    /**
     * Returns {@code true} if {@code s} is non-empty, starts with a letter or {@code _}, and
     * continues with letters, digits or {@code _}.
     */
    static boolean isIdentifier(String s) {
        if (s == null || s.isEmpty()) {
            return false;
        }
        char first = s.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return false;
        }
        for (int i = 1; i < s.length(); i++) {
            if (!isIdentifierPart(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
