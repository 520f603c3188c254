package io.authscript.spl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Outcome of semantic analysis. {@code success} is false exactly when {@code errors} is
 * non-empty; warnings and conflicts never block.
 */
public record AnalysisResult(boolean success, List<Diagnostic> errors, List<Diagnostic> warnings,
                             List<PolicyConflict> conflicts, Statistics statistics,
                             SymbolTable symbolTable) {

    public AnalysisResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        conflicts = List.copyOf(conflicts);
    }

    public record Statistics(int rolesDefined, int usersDefined, int resourcesDefined,
                             int policiesDefined, int conflictsFound, int undefinedReferences,
                             int roleReferencesInConditions, int securityRisks) {}

    /** Errors and warnings together, ordered by line. */
    public List<Diagnostic> diagnostics() {
        List<Diagnostic> all = new ArrayList<>(errors);
        all.addAll(warnings);
        all.sort(Comparator.comparingInt(Diagnostic::line));
        return all;
    }
}
