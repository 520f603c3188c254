package io.authscript.spl;

/**
 * Unchecked failure raised by the SPL toolchain for contract violations: malformed stand-alone
 * conditions, unreadable IR documents and the like. Ordinary compile problems are reported as
 * {@link Diagnostic}s and access outcomes as decisions, never as exceptions.
 */
public class SplException extends RuntimeException {
    public SplException(String message) {
        super(message);
    }

    public SplException(String message, Throwable cause) {
        super(message, cause);
    }
}
