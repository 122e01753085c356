package org.dxworks.cobolsim.preprocessor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.dxworks.cobolsim.CompilationError;

/**
 * Outcome of copybook expansion: the expanded text, plus either nothing, a missing copybook
 * the caller may supply before retrying, or a fatal error.
 */
public final class PreprocessorResult {
    public final String expandedSource;
    public final MissingCopy missingCopy;
    public final CompilationError error;

    private PreprocessorResult(String expandedSource, MissingCopy missingCopy, CompilationError error) {
        this.expandedSource = expandedSource;
        this.missingCopy = missingCopy;
        this.error = error;
    }

    public static PreprocessorResult expanded(String expandedSource) {
        return new PreprocessorResult(expandedSource, null, null);
    }

    public static PreprocessorResult missing(String expandedSource, MissingCopy missingCopy) {
        return new PreprocessorResult(expandedSource, missingCopy, null);
    }

    public static PreprocessorResult failed(String expandedSource, CompilationError error) {
        return new PreprocessorResult(expandedSource, null, error);
    }

    @JsonIgnore
    public boolean isComplete() {
        return missingCopy == null && error == null;
    }
}
