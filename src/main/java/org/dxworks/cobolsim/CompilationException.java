package org.dxworks.cobolsim;

/**
 * Fatal, position-attributed failure raised inside the lexer, parser and preprocessor.
 * Stage boundaries convert it into a {@link CompilationError} value.
 */
public class CompilationException extends Exception {

    public final CompilationError error;

    public CompilationException(String code, int line, int column, String message) {
        super(code + " " + message);
        this.error = new CompilationError(code, line, column, message);
    }

    public CompilationException(CompilationError error) {
        super(error.code + " " + error.message);
        this.error = error;
    }
}
