package io.authscript.spl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles SPL source to {@link PolicyIr}: lexing, parsing, semantic analysis and code
 * generation. Lexical warnings never stop the pipeline; syntax or semantic errors stop it
 * after their stage. Every call starts from fresh state.
 */
public final class SplCompiler {
    private static final Logger log = LoggerFactory.getLogger(SplCompiler.class);

    private final CompilerOptions options;

    public SplCompiler() {
        this(new CompilerOptions());
    }

    public SplCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public CompileResult compile(String source) {
        Objects.requireNonNull(source, "source");
        List<Diagnostic> diagnostics = new ArrayList<>();

        Lexer.Result lexed = Lexer.tokenize(source);
        diagnostics.addAll(lexed.diagnostics());
        log.debug("Lexed {} token(s), {} warning(s)", lexed.tokens().size(), lexed.diagnostics().size());

        Parser.Result parsed = Parser.parse(lexed.tokens());
        diagnostics.addAll(parsed.diagnostics());
        if (!parsed.success()) {
            log.debug("Compilation stopped: {} syntax error(s)", parsed.diagnostics().size());
            return new CompileResult(CompileResult.Stage.SYNTAX, false, lexed.tokens(), null,
                diagnostics, null, null);
        }
        String astText = AstPrinter.print(parsed.program());

        AnalysisResult analysis = new SemanticAnalyzer(options).analyze(parsed.program());
        diagnostics.addAll(analysis.diagnostics());
        if (!analysis.success()) {
            log.debug("Compilation stopped: {} semantic error(s)", analysis.errors().size());
            return new CompileResult(CompileResult.Stage.SEMANTIC, false, lexed.tokens(), astText,
                diagnostics, analysis, null);
        }
        if (!options.generateCode) {
            return new CompileResult(CompileResult.Stage.SEMANTIC, true, lexed.tokens(), astText,
                diagnostics, analysis, null);
        }

        PolicyIr ir;
        try {
            ir = new CodeGenerator(options).generate(parsed.program());
        } catch (RuntimeException e) {
            log.error("Code generation failed", e);
            diagnostics.add(Diagnostic.error(0, "Code generation failed: " + e.getMessage()));
            return new CompileResult(CompileResult.Stage.GENERATION, false, lexed.tokens(), astText,
                diagnostics, analysis, null);
        }
        log.debug("Generated {} rule(s), {} synthesized", ir.policies().size(),
            ir.metadata().counts().synthesized());
        return new CompileResult(CompileResult.Stage.COMPLETE, true, lexed.tokens(), astText,
            diagnostics, analysis, ir);
    }
}
