package io.authscript.spl;

/**
 * A line-tagged message produced by any compiler stage.
 *
 * @param line 1-based source line, or 0 when the message is not tied to a line
 * @param severity how the message affects compilation
 * @param message human-readable description
 * @param hint optional suggestion for fixing the problem, may be null
 */
public record Diagnostic(int line, Severity severity, String message, String hint) {

    public enum Severity {
        /** Blocks compilation. */
        ERROR,
        /** Reported but never blocking. */
        WARNING,
        /** Security finding, reported as a warning. */
        RISK
    }

    public static Diagnostic error(int line, String message) {
        return new Diagnostic(line, Severity.ERROR, message, null);
    }

    public static Diagnostic warning(int line, String message) {
        return new Diagnostic(line, Severity.WARNING, message, null);
    }

    public static Diagnostic risk(int line, String message) {
        return new Diagnostic(line, Severity.RISK, message, null);
    }

    public Diagnostic withHint(String hint) {
        return new Diagnostic(line, severity, message, hint);
    }

    @Override
    public String toString() {
        String s = "[" + severity + "] line " + line + ": " + message;
        return hint != null ? s + " (" + hint + ")" : s;
    }
}
