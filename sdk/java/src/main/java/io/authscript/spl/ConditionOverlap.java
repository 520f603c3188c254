package io.authscript.spl;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conservative test for whether two guards can never hold together. Two conditions are
 * disjoint only when each has a top-level {@code attr == literal} conjunct on the same
 * attribute with literals that can never compare equal. Anything else may overlap.
 */
final class ConditionOverlap {
    private ConditionOverlap() {}

    static boolean provablyDisjoint(Node.Expr a, Node.Expr b) {
        if (a == null || b == null) return false;
        Map<String, Object> left = equalities(a, new LinkedHashMap<>());
        Map<String, Object> right = equalities(b, new LinkedHashMap<>());
        for (Map.Entry<String, Object> e : left.entrySet()) {
            if (right.containsKey(e.getKey()) && differ(e.getValue(), right.get(e.getKey()))) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Object> equalities(Node.Expr expr, Map<String, Object> out) {
        if (!(expr instanceof Node.BinaryOp b)) return out;
        if (b.op() == Node.Operator.AND) {
            equalities(b.left(), out);
            equalities(b.right(), out);
        } else if (b.op() == Node.Operator.EQ) {
            if (b.left() instanceof Node.Attribute attr && b.right() instanceof Node.Literal lit) {
                out.putIfAbsent(attr.path(), lit.value());
            } else if (b.right() instanceof Node.Attribute attr && b.left() instanceof Node.Literal lit) {
                out.putIfAbsent(attr.path(), lit.value());
            }
        }
        return out;
    }

    // mixed types may still compare equal at evaluation time
    private static boolean differ(Object x, Object y) {
        if (x instanceof Number n && y instanceof Number m) {
            return Double.compare(n.doubleValue(), m.doubleValue()) != 0;
        }
        if (x instanceof String && y instanceof String) return !x.equals(y);
        if (x instanceof Boolean && y instanceof Boolean) return !x.equals(y);
        return false;
    }
}
