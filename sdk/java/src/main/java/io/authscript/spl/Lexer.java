package io.authscript.spl;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-written scanner for SPL source text.
 *
 * <p>Every call starts from line 1 with fresh state, so a single source always produces the
 * same tokens. Problems are reported as warnings and scanning continues past them: an
 * unrecognized character is skipped, an unterminated string drops the rest of its line and an
 * unterminated block comment drops the rest of the input. The returned token list always
 * ends with an {@link TokenKind#EOF} token.
 */
public final class Lexer {
    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int pos;
    private int line = 1;

    private Lexer(String src) {
        this.src = src;
    }

    public record Result(List<Token> tokens, List<Diagnostic> diagnostics) {
        public Result {
            tokens = List.copyOf(tokens);
            diagnostics = List.copyOf(diagnostics);
        }
    }

    public static Result tokenize(String src) {
        if (src == null) throw new NullPointerException("src");
        Lexer lexer = new Lexer(src);
        lexer.run();
        return new Result(lexer.tokens, lexer.diagnostics);
    }

    private void run() {
        while (pos < src.length()) {
            char ch = src.charAt(pos);
            switch (ch) {
                case '\n' -> {
                    line++;
                    pos++;
                }
                case ' ', '\t', '\r' -> pos++;
                case '"', '\'' -> string(ch);
                case '/' -> comment();
                case '=' -> {
                    if (peek(1) == '=') {
                        emit(TokenKind.EQUALS, "==", 2);
                    } else {
                        diagnostics.add(Diagnostic.warning(line, "Unexpected character '='")
                            .withHint("use '==' for comparison"));
                        pos++;
                    }
                }
                case '!' -> {
                    if (peek(1) == '=') {
                        emit(TokenKind.NOT_EQUALS, "!=", 2);
                    } else {
                        diagnostics.add(Diagnostic.warning(line, "Unexpected character '!'")
                            .withHint("use NOT for negation"));
                        pos++;
                    }
                }
                case '<' -> {
                    if (peek(1) == '=') emit(TokenKind.LESS_EQUAL, "<=", 2);
                    else emit(TokenKind.LESS_THAN, "<", 1);
                }
                case '>' -> {
                    if (peek(1) == '=') emit(TokenKind.GREATER_EQUAL, ">=", 2);
                    else emit(TokenKind.GREATER_THAN, ">", 1);
                }
                case '{' -> emit(TokenKind.LBRACE, "{", 1);
                case '}' -> emit(TokenKind.RBRACE, "}", 1);
                case '(' -> emit(TokenKind.LPAREN, "(", 1);
                case ')' -> emit(TokenKind.RPAREN, ")", 1);
                case ',' -> emit(TokenKind.COMMA, ",", 1);
                case ':' -> emit(TokenKind.COLON, ":", 1);
                case '.' -> emit(TokenKind.DOT, ".", 1);
                case '*' -> emit(TokenKind.ASTERISK, "*", 1);
                default -> {
                    if (isWordStart(ch)) {
                        word();
                    } else if (isDigit(ch)) {
                        number();
                    } else {
                        diagnostics.add(Diagnostic.warning(line,
                            "Unexpected character '" + ch + "'"));
                        pos++;
                    }
                }
            }
        }
        tokens.add(new Token(TokenKind.EOF, "", line));
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private void emit(TokenKind kind, String value, int width) {
        tokens.add(new Token(kind, value, line));
        pos += width;
    }

    private void word() {
        int start = pos;
        while (pos < src.length() && isWordPart(src.charAt(pos))) pos++;
        String text = src.substring(start, pos);
        tokens.add(new Token(TokenKind.ofWord(text), text, line));
    }

    private void number() {
        int start = pos;
        while (pos < src.length() && isDigit(src.charAt(pos))) pos++;
        if (peek(0) == '.' && isDigit(peek(1))) {
            pos++;
            while (pos < src.length() && isDigit(src.charAt(pos))) pos++;
        }
        tokens.add(new Token(TokenKind.NUMBER, src.substring(start, pos), line));
    }

    private void string(char quote) {
        int startLine = line;
        StringBuilder buf = new StringBuilder();
        int i = pos + 1;
        while (i < src.length()) {
            char ch = src.charAt(i);
            if (ch == quote) {
                tokens.add(new Token(TokenKind.STRING, buf.toString(), startLine));
                pos = i + 1;
                return;
            }
            if (ch == '\n') break;
            if (ch == '\\' && i + 1 < src.length()) {
                char esc = src.charAt(i + 1);
                switch (esc) {
                    case 'n' -> buf.append('\n');
                    case 't' -> buf.append('\t');
                    case 'r' -> buf.append('\r');
                    default -> buf.append(esc);
                }
                i += 2;
                continue;
            }
            buf.append(ch);
            i++;
        }
        diagnostics.add(Diagnostic.warning(startLine, "Unterminated string literal")
            .withHint("add a closing " + quote));
        // drop the rest of the line, the newline itself is counted by the main loop
        pos = i;
    }

    private void comment() {
        if (peek(1) == '/') {
            while (pos < src.length() && src.charAt(pos) != '\n') pos++;
        } else if (peek(1) == '*') {
            int startLine = line;
            int end = src.indexOf("*/", pos + 2);
            int stop = end < 0 ? src.length() : end + 2;
            for (int i = pos; i < stop; i++) {
                if (src.charAt(i) == '\n') line++;
            }
            if (end < 0) {
                diagnostics.add(Diagnostic.warning(startLine, "Unterminated block comment")
                    .withHint("close the comment with */"));
            }
            pos = stop;
        } else {
            diagnostics.add(Diagnostic.warning(line, "Unexpected character '/'"));
            pos++;
        }
    }

    private static boolean isWordStart(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || ch == '_';
    }

    private static boolean isWordPart(char ch) {
        return isWordStart(ch) || isDigit(ch);
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
