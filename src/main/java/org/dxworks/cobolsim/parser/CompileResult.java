package org.dxworks.cobolsim.parser;

import org.dxworks.cobolsim.CompilationError;
import org.dxworks.cobolsim.model.Program;

/**
 * Either a parsed {@link Program} or the fatal error that stopped lexing or parsing.
 */
public final class CompileResult {

    private final Program program;
    private final CompilationError error;

    private CompileResult(Program program, CompilationError error) {
        this.program = program;
        this.error = error;
    }

    public static CompileResult ofProgram(Program program) {
        return new CompileResult(program, null);
    }

    public static CompileResult ofError(CompilationError error) {
        return new CompileResult(null, error);
    }

    public boolean isSuccess() {
        return program != null;
    }

    public Program getProgram() {
        if (program == null) {
            throw new IllegalStateException("Compilation failed: " + error.format());
        }
        return program;
    }

    public CompilationError getError() {
        if (error == null) {
            throw new IllegalStateException("Compilation succeeded, there is no error");
        }
        return error;
    }
}
