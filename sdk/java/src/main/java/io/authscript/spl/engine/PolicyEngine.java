package io.authscript.spl.engine;

import io.authscript.spl.Effect;
import io.authscript.spl.Node;
import io.authscript.spl.Parser;
import io.authscript.spl.PolicyIr;
import io.authscript.spl.SplException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Runtime access checks against a compiled policy. Deny overrides allow and anything
 * unmatched is denied.
 *
 * <p>Indexes and parsed conditions are built once in the constructor and never change, so a
 * single engine can serve concurrent callers. To change the policy build a new engine, see
 * {@link ActivePolicy}.
 */
public final class PolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final PolicyIr ir;
    private final Clock clock;
    private final Map<String, PolicyIr.Role> roles;
    private final Map<String, PolicyIr.User> users;
    private final Map<String, PolicyIr.Resource> resources;
    private final List<Rule> rules;

    public PolicyEngine(PolicyIr ir) {
        this(ir, Clock.systemDefaultZone());
    }

    public PolicyEngine(PolicyIr ir, Clock clock) {
        this.ir = Objects.requireNonNull(ir, "ir");
        this.clock = Objects.requireNonNull(clock, "clock");

        Map<String, PolicyIr.Role> r = new LinkedHashMap<>();
        for (PolicyIr.Role role : ir.roles()) r.putIfAbsent(role.name(), role);
        Map<String, PolicyIr.User> u = new LinkedHashMap<>();
        for (PolicyIr.User user : ir.users()) u.putIfAbsent(user.name(), user);
        Map<String, PolicyIr.Resource> res = new LinkedHashMap<>();
        for (PolicyIr.Resource resource : ir.resources()) res.putIfAbsent(resource.name(), resource);
        this.roles = Collections.unmodifiableMap(r);
        this.users = Collections.unmodifiableMap(u);
        this.resources = Collections.unmodifiableMap(res);

        List<Rule> compiled = new ArrayList<>();
        for (PolicyIr.Policy p : ir.policies()) compiled.add(Rule.compile(p));
        this.rules = List.copyOf(compiled);

        log.info("Loaded policy engine: {} role(s), {} user(s), {} resource(s), {} rule(s)",
            roles.size(), users.size(), resources.size(), rules.size());
    }

    public static PolicyEngine load(PolicyIr ir) {
        return new PolicyEngine(ir);
    }

    public PolicyIr ir() {
        return ir;
    }

    public Decision checkAccess(String username, String action, String resourceName) {
        return checkAccess(username, action, resourceName, new AccessContext());
    }

    public Decision checkAccess(String username, String action, String resourceName, AccessContext context) {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(resourceName, "resourceName");
        if (context == null) context = new AccessContext();

        PolicyIr.User user = users.get(username);
        if (user == null) return Decision.deny("User '" + username + "' not found");
        PolicyIr.Resource resource = resources.get(resourceName);
        if (resource == null) return Decision.deny("Resource '" + resourceName + "' not found");
        if (user.role() == null || user.role().isEmpty()) {
            return Decision.deny("User '" + username + "' has no role assigned");
        }
        if (!roles.containsKey(user.role())) {
            return Decision.deny("Role '" + user.role() + "' of user '" + username + "' is not defined");
        }

        EvaluationContext ctx = buildContext(user, resource, context);
        String wanted = action.toLowerCase(Locale.ROOT);

        List<MatchedPolicy> matched = new ArrayList<>();
        boolean denied = false;
        boolean allowed = false;
        for (Rule rule : rules) {
            if (!rule.matchesResource(resource) || !rule.matchesAction(wanted)) continue;
            if (!rule.holds(ctx, context.maxGas)) continue;
            matched.add(rule.view());
            if (rule.policy.effect() == Effect.DENY) denied = true;
            else allowed = true;
        }

        Decision decision;
        if (denied) {
            decision = new Decision(false, Effect.DENY, "Explicit DENY policy matched", matched, ctx.asMap());
        } else if (allowed) {
            decision = new Decision(true, Effect.ALLOW, "ALLOW policy matched", matched, ctx.asMap());
        } else {
            decision = new Decision(false, Effect.DENY, "No matching policies (default deny)", matched,
                ctx.asMap());
        }
        log.debug("{} {} {} -> {} ({})", username, wanted, resourceName, decision.decision(),
            decision.reason());
        return decision;
    }

    /** @return empty for an unknown user */
    public Optional<PermissionView> getUserPermissions(String username) {
        Objects.requireNonNull(username, "username");
        PolicyIr.User user = users.get(username);
        if (user == null) return Optional.empty();

        PolicyIr.Role role = user.role() == null ? null : roles.get(user.role());
        List<MatchedPolicy> applicable = new ArrayList<>();
        for (Rule rule : rules) {
            String condition = rule.policy.condition();
            if (condition == null || condition.contains("user.role")) applicable.add(rule.view());
        }
        return Optional.of(new PermissionView(username, user.role(),
            role == null ? List.of() : role.permissions(), applicable));
    }

    private EvaluationContext buildContext(PolicyIr.User user, PolicyIr.Resource resource,
                                           AccessContext caller) {
        Map<String, Map<String, Object>> ns = new LinkedHashMap<>();

        Map<String, Object> userNs = scalars(user.properties());
        userNs.put("name", user.name());
        userNs.put("role", user.role());
        ns.put("user", userNs);

        ZonedDateTime now = ZonedDateTime.now(clock);
        String dayName = now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH);
        Map<String, Object> time = new LinkedHashMap<>();
        time.put("hour", now.getHour());
        time.put("minute", now.getMinute());
        time.put("day", dayName);
        time.put("weekday", dayName);
        time.put("month", now.getMonthValue());
        time.put("year", now.getYear());
        time.put("date", now.toLocalDate().toString());
        time.putAll(caller.time);
        ns.put("time", time);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("ip", "");
        request.put("method", "");
        request.put("path", "");
        request.put("user_agent", "");
        request.put("headers", Map.of());
        request.putAll(caller.request);
        ns.put("request", request);

        Map<String, Object> device = new LinkedHashMap<>();
        device.put("type", "unknown");
        device.put("id", "");
        device.put("os", "unknown");
        device.put("browser", "unknown");
        device.put("location", "unknown");
        device.put("trusted", false);
        device.putAll(caller.device);
        ns.put("device", device);

        Map<String, Object> res = new LinkedHashMap<>();
        res.put("name", resource.name());
        res.put("path", resource.path() == null ? "" : resource.path());
        res.put("type", "");
        res.putAll(scalars(resource.properties()));
        res.put("name", resource.name());
        ns.put("resource", res);

        return new EvaluationContext(ns);
    }

    /** Single-valued properties as plain values; multi-valued ones are left out. */
    private static Map<String, Object> scalars(Map<String, List<Object>> properties) {
        Map<String, Object> out = new LinkedHashMap<>();
        properties.forEach((k, v) -> {
            if (v.size() == 1) out.put(k, v.get(0));
        });
        return out;
    }

    /** A policy with its condition parsed and its resource pattern compiled. */
    private static final class Rule {
        final PolicyIr.Policy policy;
        final Node.Expr condition;
        final boolean broken;
        final Pattern glob;

        private Rule(PolicyIr.Policy policy, Node.Expr condition, boolean broken, Pattern glob) {
            this.policy = policy;
            this.condition = condition;
            this.broken = broken;
            this.glob = glob;
        }

        static Rule compile(PolicyIr.Policy policy) {
            Node.Expr condition = null;
            boolean broken = false;
            if (policy.condition() != null) {
                try {
                    condition = Parser.parseCondition(policy.condition());
                } catch (SplException e) {
                    log.warn("Rule at line {} has an unparseable condition and will never match: {}",
                        policy.line(), e.getMessage());
                    broken = true;
                }
            }
            return new Rule(policy, condition, broken, globOf(policy.resource()));
        }

        private static Pattern globOf(String spec) {
            if (!spec.contains("*")) return null;
            StringBuilder regex = new StringBuilder();
            String[] parts = spec.split("\\*", -1);
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) regex.append(".*");
                if (!parts[i].isEmpty()) regex.append(Pattern.quote(parts[i]));
            }
            return Pattern.compile(regex.toString());
        }

        boolean matchesResource(PolicyIr.Resource resource) {
            String spec = policy.resource();
            if (spec.equals(resource.name())) return true;
            if (glob != null && glob.matcher(resource.name()).matches()) return true;
            if (spec.startsWith("/") && resource.path() != null) {
                return spec.equals(resource.path())
                    || (glob != null && glob.matcher(resource.path()).matches());
            }
            return false;
        }

        boolean matchesAction(String action) {
            for (String a : policy.actions()) {
                if (a.equals("*") || a.toLowerCase(Locale.ROOT).equals(action)) return true;
            }
            return false;
        }

        boolean holds(EvaluationContext ctx, int maxGas) {
            if (broken) return false;
            if (condition == null) return true;
            return new ConditionEvaluator(ctx, maxGas).test(condition);
        }

        MatchedPolicy view() {
            return new MatchedPolicy(policy.effect(), policy.actions(), policy.resource(),
                policy.condition(), policy.line());
        }
    }
}
