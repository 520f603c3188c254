package io.authscript.spl;

/**
 * Two rules on the same resource whose actions overlap and whose conditions may hold at once.
 */
public record PolicyConflict(Node.Policy policy1, Node.Policy policy2, ConflictType type,
                             String description) {

    public int riskScore() {
        return type.riskScore();
    }

    public int policy1Line() {
        return policy1.line();
    }

    public int policy2Line() {
        return policy2.line();
    }

    @Override
    public String toString() {
        return "[" + type + "] risk " + riskScore() + "/100: " + description;
    }
}
