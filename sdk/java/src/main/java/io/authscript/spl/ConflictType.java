package io.authscript.spl;

/**
 * Kinds of policy conflicts with their fixed risk scores (0-100).
 */
public enum ConflictType {
    PRIVILEGE_ESCALATION(95),
    ALLOW_DENY_CONFLICT(85),
    LOGICAL_CONTRADICTION(60),
    REDUNDANT_POLICY(20);

    private final int riskScore;

    ConflictType(int riskScore) {
        this.riskScore = riskScore;
    }

    public int riskScore() {
        return riskScore;
    }
}
