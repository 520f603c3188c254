package io.authscript.spl.engine;

import io.authscript.spl.PolicyIr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder for the engine currently serving checks. {@link #activate} builds the new engine
 * before publishing it, so readers see either the old policy or the new one in full.
 */
public final class ActivePolicy {
    private static final Logger log = LoggerFactory.getLogger(ActivePolicy.class);

    private final AtomicReference<PolicyEngine> engine = new AtomicReference<>();
    private final Clock clock;

    public ActivePolicy() {
        this(Clock.systemDefaultZone());
    }

    public ActivePolicy(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PolicyEngine activate(PolicyIr ir) {
        PolicyEngine next = new PolicyEngine(ir, clock);
        PolicyEngine previous = engine.getAndSet(next);
        log.debug("Activated policy with {} rule(s){}", ir.policies().size(),
            previous == null ? "" : ", replacing the previous policy");
        return next;
    }

    public Optional<PolicyEngine> current() {
        return Optional.ofNullable(engine.get());
    }

    public Decision checkAccess(String username, String action, String resource, AccessContext context) {
        PolicyEngine e = engine.get();
        if (e == null) return Decision.deny("No active policy loaded");
        return e.checkAccess(username, action, resource, context);
    }

    public Decision checkAccess(String username, String action, String resource) {
        return checkAccess(username, action, resource, new AccessContext());
    }
}
