package io.authscript.spl;

import java.util.List;
import java.util.Map;

/**
 * Indented text dump of a program, one node per line.
 */
public final class AstPrinter implements Node.Visitor<Void> {
    private final StringBuilder out = new StringBuilder();

    private AstPrinter() {}

    public static String print(Node.Program program) {
        AstPrinter printer = new AstPrinter();
        program.accept(printer);
        return printer.out.toString();
    }

    @Override
    public Void visitProgram(Node.Program program) {
        line(0, "Program (" + program.statements().size() + " statements)");
        for (Node.Statement s : program.statements()) s.accept(this);
        return null;
    }

    @Override
    public Void visitRole(Node.Role role) {
        definition("Role", role);
        return null;
    }

    @Override
    public Void visitUser(Node.User user) {
        definition("User", user);
        return null;
    }

    @Override
    public Void visitResource(Node.Resource resource) {
        definition("Resource", resource);
        return null;
    }

    @Override
    public Void visitPolicy(Node.Policy policy) {
        line(1, policy.effect() + " " + String.join(", ", policy.actions()) + " ON " + policy.resource()
            + " @" + policy.line());
        if (policy.condition() != null) {
            line(2, "IF");
            expr(policy.condition(), 3);
        }
        return null;
    }

    private void definition(String kind, Node.Definition def) {
        line(1, kind + " " + def.name() + " @" + def.line());
        for (Map.Entry<String, List<Object>> e : def.properties().entrySet()) {
            StringBuilder values = new StringBuilder();
            for (Object v : e.getValue()) {
                if (values.length() > 0) values.append(", ");
                values.append(ConditionPrinter.literal(v));
            }
            line(2, e.getKey() + ": " + values);
        }
    }

    private void expr(Node.Expr expr, int depth) {
        expr.accept(new Node.Expr.Visitor<Void>() {
            @Override
            public Void visitBinary(Node.BinaryOp node) {
                line(depth, node.op().symbol());
                expr(node.left(), depth + 1);
                expr(node.right(), depth + 1);
                return null;
            }

            @Override
            public Void visitUnary(Node.UnaryOp node) {
                line(depth, node.op().symbol());
                expr(node.operand(), depth + 1);
                return null;
            }

            @Override
            public Void visitAttribute(Node.Attribute node) {
                line(depth, node.path());
                return null;
            }

            @Override
            public Void visitLiteral(Node.Literal node) {
                line(depth, ConditionPrinter.literal(node.value()));
                return null;
            }
        });
    }

    private void line(int depth, String text) {
        out.append("  ".repeat(depth)).append(text).append('\n');
    }
}
