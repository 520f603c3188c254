package io.authscript.spl;

import java.util.List;

/**
 * Output of {@link SplCompiler#compile}. Later-stage fields are null when the pipeline
 * stopped before reaching them.
 *
 * @param stage last stage reached
 * @param astText indented AST dump, or null when parsing failed
 * @param diagnostics every diagnostic from every stage that ran, ordered by stage then line
 * @param analysis semantic analysis outcome, or null when parsing failed
 * @param ir compiled policy, or null when generation did not run
 */
public record CompileResult(Stage stage, boolean success, List<Token> tokens, String astText,
                            List<Diagnostic> diagnostics, AnalysisResult analysis, PolicyIr ir) {

    public enum Stage { SYNTAX, SEMANTIC, GENERATION, COMPLETE }

    public CompileResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.severity() == Diagnostic.Severity.ERROR).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.severity() != Diagnostic.Severity.ERROR).toList();
    }

    public List<PolicyConflict> conflicts() {
        return analysis == null ? List.of() : analysis.conflicts();
    }
}
