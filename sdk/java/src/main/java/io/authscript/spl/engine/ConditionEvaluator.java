package io.authscript.spl.engine;

import io.authscript.spl.Node;
import io.authscript.spl.SplException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Tree-walk evaluator for rule conditions, with gas and depth metering. One instance per
 * evaluation.
 *
 * <p>{@link #test} fails closed: an unknown attribute, a type mismatch, an exhausted budget
 * or a non-Boolean result all make the condition false.
 */
public final class ConditionEvaluator implements Node.Expr.Visitor<Object> {
    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    public static final int DEFAULT_GAS = 10_000;
    public static final int MAX_DEPTH = 64;

    private final EvaluationContext ctx;
    private int gas;
    private int depth;

    public ConditionEvaluator(EvaluationContext ctx) {
        this(ctx, DEFAULT_GAS);
    }

    public ConditionEvaluator(EvaluationContext ctx, int maxGas) {
        this.ctx = ctx;
        this.gas = maxGas;
    }

    public boolean test(Node.Expr condition) {
        try {
            return asBoolean(eval(condition));
        } catch (RuntimeException e) {
            log.debug("Condition evaluated to false: {}", e.getMessage());
            return false;
        }
    }

    /** @throws SplException on any evaluation failure */
    public Object eval(Node.Expr node) {
        gas--;
        if (gas < 0) throw new SplException("gas budget exceeded");
        depth++;
        if (depth > MAX_DEPTH) {
            depth--;
            throw new SplException("max nesting depth exceeded");
        }
        try {
            return node.accept(this);
        } finally {
            depth--;
        }
    }

    @Override
    public Object visitBinary(Node.BinaryOp node) {
        return switch (node.op()) {
            case AND -> asBoolean(eval(node.left())) && asBoolean(eval(node.right()));
            case OR -> asBoolean(eval(node.left())) || asBoolean(eval(node.right()));
            case EQ -> equal(eval(node.left()), eval(node.right()));
            case NE -> !equal(eval(node.left()), eval(node.right()));
            case LT -> compare(eval(node.left()), eval(node.right())) < 0;
            case GT -> compare(eval(node.left()), eval(node.right())) > 0;
            case LE -> compare(eval(node.left()), eval(node.right())) <= 0;
            case GE -> compare(eval(node.left()), eval(node.right())) >= 0;
            case NOT -> throw new SplException("NOT is unary");
        };
    }

    @Override
    public Object visitUnary(Node.UnaryOp node) {
        if (node.op() != Node.Operator.NOT) throw new SplException("unsupported unary operator: " + node.op());
        return !asBoolean(eval(node.operand()));
    }

    @Override
    public Object visitAttribute(Node.Attribute node) {
        return ctx.lookup(node.object(), node.field());
    }

    @Override
    public Object visitLiteral(Node.Literal node) {
        return node.value();
    }

    private static boolean asBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        throw new SplException("expected a boolean but got " + describe(value));
    }

    static boolean equal(Object a, Object b) {
        if (a instanceof Map || b instanceof Map) return false;
        if (a == null || b == null) return a == b;
        if (a instanceof Number x && b instanceof Number y) {
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        if (a instanceof Boolean && b instanceof Boolean) return a.equals(b);
        return String.valueOf(a).equals(String.valueOf(b));
    }

    static int compare(Object a, Object b) {
        if (a instanceof String x && b instanceof String y) return x.compareTo(y);
        return Double.compare(number(a), number(b));
    }

    private static double number(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new SplException("not a number: \"" + s + "\"", e);
            }
        }
        throw new SplException("cannot order " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }
}
