package io.authscript.spl.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Publishes access decisions as structured JSON on the {@code SPL_AUDIT} logger: INFO for
 * allowed requests, WARN for denied ones.
 */
public final class AuditTrail {
    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("SPL_AUDIT");

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditTrail() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public AuditTrail(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public AuditRecord record(String username, String action, String resource, Decision decision) {
        Objects.requireNonNull(decision, "decision");
        AuditRecord entry = new AuditRecord(clock.instant().toString(), username, action, resource,
            decision.allowed(), decision.reason());
        try {
            String json = objectMapper.writeValueAsString(entry);
            if (entry.allowed()) AUDIT_LOG.info(json);
            else AUDIT_LOG.warn(json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit record: {}", e.getMessage());
            AUDIT_LOG.warn("SPL {} - user={}, action={}, resource={}, reason={}",
                entry.allowed() ? "ALLOW" : "DENY", username, action, resource, entry.reason());
        }
        return entry;
    }
}
