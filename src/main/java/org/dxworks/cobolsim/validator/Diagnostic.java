package org.dxworks.cobolsim.validator;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Comparator;

/**
 * A finding of the column or semantic validator. Only {@link Severity#ERROR} blocks execution.
 */
public final class Diagnostic {

    public static final Comparator<Diagnostic> BY_POSITION = Comparator
            .comparingInt((Diagnostic d) -> d.line)
            .thenComparingInt(d -> d.column);

    public final int line;
    public final int column;
    public final String code;
    public final String message;
    public final Severity severity;

    public Diagnostic(int line, int column, String code, String message, Severity severity) {
        this.line = line;
        this.column = column;
        this.code = code;
        this.message = message;
        this.severity = severity;
    }

    public static Diagnostic error(int line, int column, String code, String message) {
        return new Diagnostic(line, column, code, message, Severity.ERROR);
    }

    public static Diagnostic warning(int line, int column, String code, String message) {
        return new Diagnostic(line, column, code, message, Severity.WARNING);
    }

    public static Diagnostic info(int line, int column, String code, String message) {
        return new Diagnostic(line, column, code, message, Severity.INFO);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return code + " " + message + " (Line " + line + ", Column " + column + ")";
    }
}
