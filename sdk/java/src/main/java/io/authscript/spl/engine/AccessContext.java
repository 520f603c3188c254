package io.authscript.spl.engine;

import java.util.HashMap;
import java.util.Map;

/**
 * Caller-supplied request attributes. Fields set here override the engine's defaults for the
 * same namespace; the {@code user} and {@code resource} namespaces always come from the policy.
 */
public class AccessContext {
    public Map<String, Object> time = new HashMap<>();
    public Map<String, Object> request = new HashMap<>();
    public Map<String, Object> device = new HashMap<>();
    public int maxGas = ConditionEvaluator.DEFAULT_GAS;

    /** Builds a context from {@code {"time": {...}, "request": {...}, "device": {...}}}; other groups are ignored. */
    public static AccessContext of(Map<String, ? extends Map<String, ?>> groups) {
        AccessContext ctx = new AccessContext();
        if (groups == null) return ctx;
        copy(groups.get("time"), ctx.time);
        copy(groups.get("request"), ctx.request);
        copy(groups.get("device"), ctx.device);
        return ctx;
    }

    private static void copy(Map<String, ?> from, Map<String, Object> to) {
        if (from != null) to.putAll(from);
    }
}
