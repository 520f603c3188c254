package io.authscript.spl.engine;

/**
 * One audited access decision.
 *
 * @param timestamp ISO-8601 instant of the check
 */
public record AuditRecord(String timestamp, String user, String action, String resource,
                          boolean allowed, String reason) {}
