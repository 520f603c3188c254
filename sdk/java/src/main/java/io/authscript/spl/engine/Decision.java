package io.authscript.spl.engine;

import io.authscript.spl.Effect;

import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link PolicyEngine#checkAccess}.
 *
 * @param evaluationContext the attribute values the conditions saw; empty when an entity
 *                          could not be resolved
 */
public record Decision(boolean allowed, Effect decision, String reason,
                       List<MatchedPolicy> matchedPolicies,
                       Map<String, Map<String, Object>> evaluationContext) {

    public Decision {
        matchedPolicies = List.copyOf(matchedPolicies);
        evaluationContext = evaluationContext == null ? Map.of() : evaluationContext;
    }

    static Decision deny(String reason) {
        return new Decision(false, Effect.DENY, reason, List.of(), Map.of());
    }
}
