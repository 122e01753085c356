package org.dxworks.cobolsim;

import org.dxworks.cobolsim.model.Program;
import org.dxworks.cobolsim.model.debug.DebugTreeBuilder;
import org.dxworks.cobolsim.parser.CompileResult;
import org.dxworks.cobolsim.parser.Parser;
import org.dxworks.cobolsim.preprocessor.CobolPreprocessor;
import org.dxworks.cobolsim.preprocessor.CopybookLibrary;
import org.dxworks.cobolsim.preprocessor.PreprocessorResult;
import org.dxworks.cobolsim.validator.ColumnValidator;
import org.dxworks.cobolsim.validator.Diagnostic;
import org.dxworks.cobolsim.validator.SemanticValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Source to program: copy expansion, lexing and parsing, then column and semantic checks.
 * Fatal stages stop the pipeline; the validators always run to completion.
 */
public class CobolCompiler {

    private static final Logger log = LoggerFactory.getLogger(CobolCompiler.class);

    private final CobolPreprocessor preprocessor;

    public CobolCompiler() {
        this(CobolSimConfig.defaults());
    }

    public CobolCompiler(CobolSimConfig config) {
        this.preprocessor = new CobolPreprocessor(config.getMaxCopyPasses());
    }

    public Compilation compile(String source, CopybookLibrary library) {
        PreprocessorResult expansion = preprocessor.process(source, library);
        if (!expansion.isComplete()) {
            log.debug("Copy expansion stopped: missing={} error={}", expansion.missingCopy, expansion.error);
            return new Compilation(expansion.expandedSource, null, expansion.error, expansion.missingCopy, List.of(), null);
        }

        String expanded = expansion.expandedSource;
        CompileResult parsed = Parser.parse(expanded);
        if (!parsed.isSuccess()) {
            log.debug("Parsing failed: {}", parsed.getError().format());
            return new Compilation(expanded, null, parsed.getError(), null, List.of(), null);
        }

        Program program = parsed.getProgram();
        List<Diagnostic> diagnostics = new ArrayList<>(ColumnValidator.validate(expanded));
        diagnostics.addAll(SemanticValidator.validate(program));
        diagnostics.sort(Diagnostic.BY_POSITION);
        log.debug("Compiled {} with {} diagnostic(s)", program.id, diagnostics.size());
        return new Compilation(expanded, program, null, null, diagnostics, DebugTreeBuilder.build(program));
    }
}
