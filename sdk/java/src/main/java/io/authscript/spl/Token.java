package io.authscript.spl;

/**
 * A lexical token. String tokens carry their unescaped contents; every other token carries
 * its raw lexeme.
 */
public record Token(TokenKind kind, String value, int line) {

    public boolean is(TokenKind k) {
        return kind == k;
    }

    /** Human-readable form used in syntax diagnostics. */
    public String describe() {
        return switch (kind) {
            case EOF -> "end of input";
            case STRING -> "string \"" + value + "\"";
            case NUMBER -> "number " + value;
            case IDENTIFIER -> "identifier '" + value + "'";
            default -> "'" + value + "'";
        };
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")@" + line;
    }
}
