package io.authscript.spl;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiler settings. Defaults give the strict, source-of-truth compile mode.
 */
public class CompilerOptions {
    /**
     * Undefined role references (from a USER block or a {@code user.role} comparison) are
     * errors when true and warnings when false.
     */
    public boolean strictRoleReferences = true;

    /** Run IR generation after a successful analysis. */
    public boolean generateCode = true;

    /** Synthesize one ALLOW per role and resource when a program declares no rules. */
    public boolean synthesizeRolePolicies = true;

    /** Extra checks run in the recommendation pass; their findings become warnings. */
    public List<Recommendation> recommendations = new ArrayList<>();

    /**
     * Recommendation pass hook.
     */
    @FunctionalInterface
    public interface Recommendation {
        List<Diagnostic> review(Node.Program program, SymbolTable symbols);
    }

    public static CompilerOptions lenient() {
        CompilerOptions options = new CompilerOptions();
        options.strictRoleReferences = false;
        return options;
    }
}
