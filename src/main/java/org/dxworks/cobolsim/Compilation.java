package org.dxworks.cobolsim;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.dxworks.cobolsim.model.Program;
import org.dxworks.cobolsim.model.debug.DebugNode;
import org.dxworks.cobolsim.preprocessor.MissingCopy;
import org.dxworks.cobolsim.validator.Diagnostic;

import java.util.List;

/**
 * Everything the pipeline learned about one source: the expanded text, then either the
 * program with its diagnostics and debug tree, a missing copybook, or a fatal error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Compilation {
    public final String programId;
    @JsonIgnore
    public final String expandedSource;
    @JsonIgnore
    public final Program program;
    public final CompilationError error;
    public final MissingCopy missingCopy;
    public final List<Diagnostic> diagnostics;
    public final DebugNode debugTree;

    Compilation(String expandedSource, Program program, CompilationError error, MissingCopy missingCopy,
                List<Diagnostic> diagnostics, DebugNode debugTree) {
        this.programId = program == null ? null : program.id;
        this.expandedSource = expandedSource;
        this.program = program;
        this.error = error;
        this.missingCopy = missingCopy;
        this.diagnostics = List.copyOf(diagnostics);
        this.debugTree = debugTree;
    }

    /**
     * True when a program was built and no diagnostic has ERROR severity.
     */
    @JsonIgnore
    public boolean isExecutable() {
        return program != null && diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    @JsonIgnore
    public List<Diagnostic> getErrors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }
}
