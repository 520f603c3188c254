package io.authscript.spl;

import java.math.BigDecimal;

/**
 * Renders condition expressions as normalized infix text: upper-case logical operators,
 * double-quoted strings and only the parentheses precedence requires. The output parses back
 * with {@link Parser#parseCondition(String)} to the same expression shape.
 */
public final class ConditionPrinter implements Node.Expr.Visitor<String> {
    private static final ConditionPrinter INSTANCE = new ConditionPrinter();

    private ConditionPrinter() {}

    /** @return the text, or null for a null expression */
    public static String print(Node.Expr expr) {
        return expr == null ? null : expr.accept(INSTANCE);
    }

    @Override
    public String visitBinary(Node.BinaryOp node) {
        int p = node.precedence();
        String left = wrap(node.left(), node.left().precedence() < p);
        String right = wrap(node.right(), node.right().precedence() <= p);
        return left + " " + node.op().symbol() + " " + right;
    }

    @Override
    public String visitUnary(Node.UnaryOp node) {
        return node.op().symbol() + " " + wrap(node.operand(), node.operand().precedence() < node.precedence());
    }

    @Override
    public String visitAttribute(Node.Attribute node) {
        return node.path();
    }

    @Override
    public String visitLiteral(Node.Literal node) {
        return literal(node.value());
    }

    static String literal(Object value) {
        if (value instanceof String s) return quote(s);
        if (value instanceof Double d) return BigDecimal.valueOf(d).toPlainString();
        return String.valueOf(value);
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(ch);
            }
        }
        return sb.append('"').toString();
    }

    private String wrap(Node.Expr expr, boolean parens) {
        String text = expr.accept(this);
        return parens ? "(" + text + ")" : text;
    }
}
