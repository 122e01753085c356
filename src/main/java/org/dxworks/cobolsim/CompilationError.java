package org.dxworks.cobolsim;

import com.fasterxml.jackson.annotation.JsonIgnore;

public final class CompilationError {
    public final String code;
    public final int line;
    public final int column;
    public final String message;

    public CompilationError(String code, int line, int column, String message) {
        this.code = code;
        this.line = line;
        this.column = column;
        this.message = message;
    }

    @JsonIgnore
    public String format() {
        if (line <= 0) {
            return code + " " + message;
        }
        return code + " " + message + " (Line " + line + ", Column " + column + ")";
    }

    @Override
    public String toString() {
        return format();
    }
}
