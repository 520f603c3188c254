package io.authscript.spl;

import java.util.Locale;

/**
 * Lexical categories of SPL.
 */
public enum TokenKind {
    // structural keywords, matched case-sensitively
    ROLE, USER, RESOURCE, ALLOW, DENY, ON, IF, AND, OR, NOT,

    // action keywords, matched case-insensitively
    READ, WRITE, DELETE, EXECUTE, CREATE, UPDATE, LIST,

    IDENTIFIER, STRING, NUMBER,

    EQUALS("=="), NOT_EQUALS("!="), LESS_THAN("<"), GREATER_THAN(">"),
    LESS_EQUAL("<="), GREATER_EQUAL(">="),

    LBRACE("{"), RBRACE("}"), LPAREN("("), RPAREN(")"),
    COMMA(","), COLON(":"), DOT("."), ASTERISK("*"),

    EOF;

    private final String symbol;

    TokenKind() {
        this.symbol = null;
    }

    TokenKind(String symbol) {
        this.symbol = symbol;
    }

    /** The fixed spelling of operator and delimiter tokens, or the keyword itself. */
    public String symbol() {
        return symbol != null ? symbol : name();
    }

    public boolean isAction() {
        return ordinal() >= READ.ordinal() && ordinal() <= LIST.ordinal();
    }

    public boolean isStructuralKeyword() {
        return ordinal() <= NOT.ordinal();
    }

    /**
     * Classifies a word: an exact structural keyword, an action keyword in any case, or
     * otherwise an identifier.
     */
    public static TokenKind ofWord(String word) {
        for (TokenKind k : values()) {
            if (k.isStructuralKeyword() && k.name().equals(word)) return k;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        for (TokenKind k : values()) {
            if (k.isAction() && k.name().toLowerCase(Locale.ROOT).equals(lower)) return k;
        }
        return IDENTIFIER;
    }
}
