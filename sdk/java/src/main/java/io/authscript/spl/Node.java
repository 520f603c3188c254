package io.authscript.spl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * AST for SPL programs. Sealed interface with record variants; statements and condition
 * expressions each have their own visitor so every pass handles every variant.
 */
public sealed interface Node {

    /** 1-based line the construct starts on. */
    int line();

    interface Visitor<R> {
        R visitProgram(Program program);
        R visitRole(Role role);
        R visitUser(User user);
        R visitResource(Resource resource);
        R visitPolicy(Policy policy);
    }

    record Program(List<Statement> statements) implements Node {
        public Program {
            statements = List.copyOf(statements);
        }

        @Override
        public int line() {
            return statements.isEmpty() ? 1 : statements.get(0).line();
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProgram(this);
        }
    }

    sealed interface Statement extends Node {
        <R> R accept(Visitor<R> visitor);
    }

    /**
     * A ROLE, USER or RESOURCE block. Properties keep declaration order and every value is
     * a list, so {@code can: read} and {@code can: read, write} have the same shape.
     */
    sealed interface Definition extends Statement {
        String name();

        Map<String, List<Object>> properties();

        default List<Object> property(String key) {
            return properties().getOrDefault(key, List.of());
        }

        /** First value of a property as text, or null when the property is absent. */
        default String text(String key) {
            List<Object> values = property(key);
            return values.isEmpty() ? null : String.valueOf(values.get(0));
        }
    }

    record Role(String name, Map<String, List<Object>> properties, int line) implements Definition {
        public Role {
            properties = copyProperties(properties);
        }

        /** Actions granted by {@code can}, lower-cased. */
        public List<String> permissions() {
            return property("can").stream().map(v -> String.valueOf(v).toLowerCase(Locale.ROOT)).toList();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRole(this);
        }
    }

    record User(String name, Map<String, List<Object>> properties, int line) implements Definition {
        public User {
            properties = copyProperties(properties);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUser(this);
        }
    }

    record Resource(String name, Map<String, List<Object>> properties, int line) implements Definition {
        public Resource {
            properties = copyProperties(properties);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitResource(this);
        }
    }

    /**
     * An ALLOW or DENY rule.
     *
     * @param actions lower-cased actions in declaration order without duplicates; may hold "*"
     * @param resource resource name, quoted string, path or dotted spec exactly as written
     * @param condition guard expression, or null when the rule is unconditional
     */
    record Policy(Effect effect, List<String> actions, String resource, Expr condition, int line)
            implements Statement {
        public Policy {
            actions = List.copyOf(actions);
        }

        public boolean grants(String action) {
            return actions.contains("*") || actions.contains(action);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPolicy(this);
        }
    }

    /** Operators of the condition language, lowest precedence first. */
    enum Operator {
        OR("OR", 1),
        AND("AND", 2),
        NOT("NOT", 3),
        EQ("==", 4),
        NE("!=", 4),
        LT("<", 5),
        GT(">", 5),
        LE("<=", 5),
        GE(">=", 5);

        private final String symbol;
        private final int precedence;

        Operator(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }

        public String symbol() {
            return symbol;
        }

        public int precedence() {
            return precedence;
        }

        public boolean isLogical() {
            return this == OR || this == AND || this == NOT;
        }

        public boolean isEquality() {
            return this == EQ || this == NE;
        }

        static Operator of(TokenKind kind) {
            return switch (kind) {
                case OR -> OR;
                case AND -> AND;
                case NOT -> NOT;
                case EQUALS -> EQ;
                case NOT_EQUALS -> NE;
                case LESS_THAN -> LT;
                case GREATER_THAN -> GT;
                case LESS_EQUAL -> LE;
                case GREATER_EQUAL -> GE;
                default -> throw new SplException("not an operator: " + kind);
            };
        }
    }

    /** Condition expressions. */
    sealed interface Expr extends Node {
        interface Visitor<R> {
            R visitBinary(BinaryOp node);
            R visitUnary(UnaryOp node);
            R visitAttribute(Attribute node);
            R visitLiteral(Literal node);
        }

        <R> R accept(Visitor<R> visitor);

        /** Binding strength, used when printing minimal parentheses. */
        default int precedence() {
            return 6;
        }
    }

    record BinaryOp(Operator op, Expr left, Expr right, int line) implements Expr {
        @Override
        public <R> R accept(Expr.Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public int precedence() {
            return op.precedence();
        }
    }

    record UnaryOp(Operator op, Expr operand, int line) implements Expr {
        @Override
        public <R> R accept(Expr.Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public int precedence() {
            return op.precedence();
        }
    }

    /** {@code object.field}, e.g. {@code user.role} or {@code time.hour}. */
    record Attribute(String object, String field, int line) implements Expr {
        public String path() {
            return object + "." + field;
        }

        @Override
        public <R> R accept(Expr.Visitor<R> visitor) {
            return visitor.visitAttribute(this);
        }
    }

    /** A String, Long, Double or Boolean constant. */
    record Literal(Object value, int line) implements Expr {
        @Override
        public <R> R accept(Expr.Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    private static Map<String, List<Object>> copyProperties(Map<String, List<Object>> properties) {
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        properties.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
