package io.authscript.spl;

import java.util.List;
import java.util.Locale;

/**
 * Fix-it suggestions attached to syntax diagnostics.
 */
final class ErrorHints {
    private static final List<String> STATEMENT_KEYWORDS =
        List.of("ROLE", "USER", "RESOURCE", "ALLOW", "DENY");
    private static final List<String> KEYWORDS =
        List.of("ROLE", "USER", "RESOURCE", "ALLOW", "DENY", "ON", "IF", "AND", "OR", "NOT");

    private ErrorHints() {}

    /**
     * Hint for a word found where a statement should start, e.g. {@code ALOW} or {@code role}.
     * Returns null when the word is not close to any statement keyword.
     */
    static String forStatementStart(Token token) {
        if (!token.is(TokenKind.IDENTIFIER)) return null;
        String similar = similarKeyword(token.value(), STATEMENT_KEYWORDS);
        return similar != null ? "did you mean '" + similar + "'?" : null;
    }

    /** Hint for an unexpected token when {@code expected} was required. */
    static String forExpected(Token token, TokenKind expected) {
        if (token.is(TokenKind.IDENTIFIER)) {
            String similar = similarKeyword(token.value(), KEYWORDS);
            if (similar != null && similar.equals(expected.name())) {
                return "keywords are case-sensitive, write '" + similar + "'";
            }
        }
        if (expected == TokenKind.COLON) return "properties are written as name: value";
        if (expected == TokenKind.RPAREN) return "check that every '(' has a matching ')'";
        if (expected == TokenKind.RBRACE) return "close the block with '}'";
        return null;
    }

    static String similarKeyword(String word, List<String> keywords) {
        String upper = word.toUpperCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (keyword.equals(upper)) return keyword;
        }
        if (word.length() < 3) return null;
        for (String keyword : keywords) {
            if (editDistance(upper, keyword) <= 2) return keyword;
        }
        return null;
    }

    static int editDistance(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int subst = prev[j - 1] + (a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1);
                cur[j] = Math.min(subst, Math.min(prev[j] + 1, cur[j - 1] + 1));
            }
            int[] t = prev;
            prev = cur;
            cur = t;
        }
        return prev[b.length()];
    }
}
