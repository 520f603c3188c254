package io.authscript.spl;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for SPL programs and conditions.
 *
 * <p>Condition precedence, lowest first: {@code OR < AND < NOT < (== !=) < (< > <= >=)}.
 * A malformed statement is reported with its line and the parser skips ahead to the next
 * statement keyword, so one run reports every broken statement. The program is only returned
 * when no diagnostic was recorded.
 */
public final class Parser {
    private final List<Token> tokens;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int pos;

    private Parser(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            List<Token> terminated = new ArrayList<>(tokens);
            int line = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).line();
            terminated.add(new Token(TokenKind.EOF, "", line));
            tokens = terminated;
        }
        this.tokens = tokens;
    }

    /**
     * @param program the AST, or null when {@code diagnostics} is non-empty
     */
    public record Result(Node.Program program, List<Diagnostic> diagnostics) {
        public Result {
            diagnostics = List.copyOf(diagnostics);
        }

        public boolean success() {
            return program != null;
        }
    }

    /** Lexes and parses; lexical warnings are not part of the parser result. */
    public static Result parse(String src) {
        return parse(Lexer.tokenize(src).tokens());
    }

    public static Result parse(List<Token> tokens) {
        Parser parser = new Parser(tokens);
        Node.Program program = parser.program();
        if (!parser.diagnostics.isEmpty()) return new Result(null, parser.diagnostics);
        return new Result(program, List.of());
    }

    /**
     * Parses a stand-alone condition such as {@code user.role == "Admin" AND time.hour < 18}.
     *
     * @throws SplException if the text is not exactly one well-formed expression
     */
    public static Node.Expr parseCondition(String text) {
        Lexer.Result lexed = Lexer.tokenize(text);
        if (!lexed.diagnostics().isEmpty()) {
            throw new SplException("invalid condition: " + lexed.diagnostics().get(0).message());
        }
        Parser parser = new Parser(lexed.tokens());
        try {
            Node.Expr expr = parser.expression();
            parser.expect(TokenKind.EOF, "end of condition");
            return expr;
        } catch (SyntaxError e) {
            throw new SplException("invalid condition: " + e.diagnostic.message());
        }
    }

    private static final class SyntaxError extends RuntimeException {
        final Diagnostic diagnostic;

        SyntaxError(Diagnostic diagnostic) {
            super(diagnostic.message(), null, false, false);
            this.diagnostic = diagnostic;
        }
    }

    // --- statements ---

    private Node.Program program() {
        List<Node.Statement> statements = new ArrayList<>();
        while (!peek().is(TokenKind.EOF)) {
            int start = pos;
            try {
                statements.add(statement());
            } catch (SyntaxError e) {
                diagnostics.add(e.diagnostic);
                synchronize(start);
            }
        }
        return new Node.Program(statements);
    }

    private Node.Statement statement() {
        Token tok = peek();
        return switch (tok.kind()) {
            case ROLE, USER, RESOURCE -> definition();
            case ALLOW, DENY -> policy();
            default -> throw error(tok, "a statement (ROLE, USER, RESOURCE, ALLOW or DENY)",
                ErrorHints.forStatementStart(tok));
        };
    }

    /** Skips to the next token that can start a statement, always making progress. */
    private void synchronize(int statementStart) {
        pos = Math.max(pos, statementStart + 1);
        while (!peek().is(TokenKind.EOF) && !atStatementStart()) pos++;
    }

    private boolean atStatementStart() {
        return switch (peek().kind()) {
            case ROLE, USER, ALLOW, DENY -> true;
            // RESOURCE also appears inside a rule as "ON RESOURCE:"
            case RESOURCE -> pos == 0 || !tokens.get(pos - 1).is(TokenKind.ON);
            default -> false;
        };
    }

    private Node.Definition definition() {
        Token keyword = advance();
        String name = expect(TokenKind.IDENTIFIER, "a name").value();
        expect(TokenKind.LBRACE, "'{'");
        Map<String, List<Object>> properties = new LinkedHashMap<>();
        while (!peek().is(TokenKind.RBRACE)) {
            Token key = expect(TokenKind.IDENTIFIER, "a property name or '}'");
            expect(TokenKind.COLON, "':'");
            List<Object> values = key.value().equals("can") ? actionValues() : values();
            properties.put(key.value(), values);
            if (peek().is(TokenKind.COMMA)) advance();
        }
        expect(TokenKind.RBRACE, "'}'");
        return switch (keyword.kind()) {
            case ROLE -> new Node.Role(name, properties, keyword.line());
            case USER -> new Node.User(name, properties, keyword.line());
            default -> new Node.Resource(name, properties, keyword.line());
        };
    }

    private List<Object> values() {
        List<Object> values = new ArrayList<>();
        values.add(value());
        while (continuesList()) {
            advance();
            values.add(value());
        }
        return values;
    }

    private List<Object> actionValues() {
        List<Object> values = new ArrayList<>();
        values.add(actionValue());
        while (continuesList()) {
            advance();
            values.add(actionValue());
        }
        return values;
    }

    /** A comma continues a value list unless it is followed by the next {@code name:}. */
    private boolean continuesList() {
        return peek().is(TokenKind.COMMA)
            && !(peek(1).is(TokenKind.IDENTIFIER) && peek(2).is(TokenKind.COLON));
    }

    private Object value() {
        Token tok = peek();
        if (tok.kind().isAction()) {
            advance();
            return tok.value();
        }
        return switch (tok.kind()) {
            case STRING -> advance().value();
            case NUMBER -> number(advance());
            case ASTERISK -> advance().value();
            case IDENTIFIER -> {
                advance();
                yield bareWord(tok.value());
            }
            default -> throw error(tok, "a value", null);
        };
    }

    private String actionValue() {
        Token tok = peek();
        if (tok.kind().isAction() || tok.is(TokenKind.ASTERISK)) {
            advance();
            return tok.value().toLowerCase(Locale.ROOT);
        }
        throw error(tok, "an action (read, write, delete, execute, create, update, list) or '*'",
            null);
    }

    private Node.Policy policy() {
        Token keyword = advance();
        Effect effect = keyword.is(TokenKind.ALLOW) ? Effect.ALLOW : Effect.DENY;

        Token actionWord = peek();
        if (!actionWord.is(TokenKind.IDENTIFIER) || !actionWord.value().equals("action")) {
            throw error(actionWord, "'action:'", "rules are written as "
                + keyword.value() + " action: <actions> ON RESOURCE: <resource>");
        }
        advance();
        expect(TokenKind.COLON, "':'");
        Set<String> actions = new LinkedHashSet<>();
        actions.add(actionValue());
        while (peek().is(TokenKind.COMMA)) {
            advance();
            actions.add(actionValue());
        }

        expect(TokenKind.ON, "ON");
        expect(TokenKind.RESOURCE, "RESOURCE");
        expect(TokenKind.COLON, "':'");
        String resource = resourceSpec();

        Node.Expr condition = null;
        if (peek().is(TokenKind.IF)) {
            advance();
            expect(TokenKind.LPAREN, "'(' after IF");
            condition = expression();
            expect(TokenKind.RPAREN, "')'");
        }
        return new Node.Policy(effect, new ArrayList<>(actions), resource, condition,
            keyword.line());
    }

    private String resourceSpec() {
        Token tok = peek();
        if (tok.is(TokenKind.STRING) || tok.is(TokenKind.ASTERISK)) return advance().value();
        if (!isSegment(tok)) throw error(tok, "a resource name, path or string", null);

        StringBuilder spec = new StringBuilder(advance().value());
        while (peek().is(TokenKind.DOT)) {
            advance();
            Token seg = peek();
            if (seg.is(TokenKind.ASTERISK)) {
                spec.append(".*");
                advance();
                break;
            }
            if (!isSegment(seg)) throw error(seg, "a path segment or '*'", null);
            spec.append('.').append(advance().value());
        }
        return spec.toString();
    }

    private static boolean isSegment(Token tok) {
        return tok.is(TokenKind.IDENTIFIER) || tok.kind().isAction();
    }

    // --- conditions ---

    private Node.Expr expression() {
        return or();
    }

    private Node.Expr or() {
        Node.Expr left = and();
        while (peek().is(TokenKind.OR)) {
            Token op = advance();
            left = new Node.BinaryOp(Node.Operator.OR, left, and(), op.line());
        }
        return left;
    }

    private Node.Expr and() {
        Node.Expr left = not();
        while (peek().is(TokenKind.AND)) {
            Token op = advance();
            left = new Node.BinaryOp(Node.Operator.AND, left, not(), op.line());
        }
        return left;
    }

    private Node.Expr not() {
        if (peek().is(TokenKind.NOT)) {
            Token op = advance();
            return new Node.UnaryOp(Node.Operator.NOT, not(), op.line());
        }
        return equality();
    }

    private Node.Expr equality() {
        Node.Expr left = relational();
        while (peek().is(TokenKind.EQUALS) || peek().is(TokenKind.NOT_EQUALS)) {
            Token op = advance();
            left = new Node.BinaryOp(Node.Operator.of(op.kind()), left, relational(), op.line());
        }
        return left;
    }

    private Node.Expr relational() {
        Node.Expr left = primary();
        while (isRelational(peek().kind())) {
            Token op = advance();
            left = new Node.BinaryOp(Node.Operator.of(op.kind()), left, primary(), op.line());
        }
        return left;
    }

    private static boolean isRelational(TokenKind kind) {
        return kind == TokenKind.LESS_THAN || kind == TokenKind.GREATER_THAN
            || kind == TokenKind.LESS_EQUAL || kind == TokenKind.GREATER_EQUAL;
    }

    private Node.Expr primary() {
        Token tok = peek();
        if (tok.is(TokenKind.LPAREN)) {
            advance();
            Node.Expr inner = expression();
            expect(TokenKind.RPAREN, "')'");
            return inner;
        }
        if (tok.is(TokenKind.IDENTIFIER) && peek(1).is(TokenKind.DOT)) {
            advance();
            advance();
            Token field = peek();
            if (!isSegment(field)) throw error(field, "an attribute name after '.'", null);
            advance();
            return new Node.Attribute(tok.value(), field.value(), tok.line());
        }
        if (tok.kind().isAction()) {
            advance();
            return new Node.Literal(tok.value(), tok.line());
        }
        return switch (tok.kind()) {
            case STRING -> new Node.Literal(advance().value(), tok.line());
            case NUMBER -> new Node.Literal(number(advance()), tok.line());
            case IDENTIFIER -> new Node.Literal(bareWord(advance().value()), tok.line());
            default -> throw error(tok, "an attribute, literal or '('", null);
        };
    }

    // --- helpers ---

    private Object number(Token tok) {
        String text = tok.value();
        if (text.indexOf('.') < 0) {
            BigInteger integral = new BigInteger(text);
            if (integral.bitLength() < 64) return integral.longValue();
        }
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value)) {
            throw new SyntaxError(new Diagnostic(tok.line(), Diagnostic.Severity.ERROR,
                "Syntax error at line " + tok.line() + ": number out of range: " + abbreviate(text),
                "numbers must fit in a 64-bit floating point value"));
        }
        return value;
    }

    private static String abbreviate(String text) {
        return text.length() <= 20 ? text : text.substring(0, 20) + "...";
    }

    /** {@code true} and {@code false} are booleans; any other bare word is a string. */
    private static Object bareWord(String word) {
        return switch (word) {
            case "true" -> Boolean.TRUE;
            case "false" -> Boolean.FALSE;
            default -> word;
        };
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int offset) {
        int i = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token advance() {
        Token tok = tokens.get(pos);
        if (!tok.is(TokenKind.EOF)) pos++;
        return tok;
    }

    private Token expect(TokenKind kind, String expected) {
        Token tok = peek();
        if (!tok.is(kind)) throw error(tok, expected, ErrorHints.forExpected(tok, kind));
        return advance();
    }

    private SyntaxError error(Token tok, String expected, String hint) {
        String message = "Syntax error at line " + tok.line() + ": unexpected " + tok.describe()
            + " (expected " + expected + ")";
        return new SyntaxError(new Diagnostic(tok.line(), Diagnostic.Severity.ERROR, message, hint));
    }
}
