package org.dxworks.cobolsim.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read view of the call stack handed to debug adapters.
 */
public final class CallStackView {
    private final CobolRuntime runtime;

    CallStackView(CobolRuntime runtime) {
        this.runtime = runtime;
    }

    public int depth() {
        return runtime.getCallDepth();
    }

    /**
     * Program ids from the outermost frame to the current one.
     */
    public List<String> programIds() {
        List<String> ids = new ArrayList<>();
        for (StackFrame frame : runtime.frames()) {
            ids.add(frame.programId);
        }
        return Collections.unmodifiableList(ids);
    }

    public Map<String, VariableCell> visibleVariables() {
        return runtime.getMemory();
    }

    /**
     * Variables of every active frame, keyed by program id; a recursive program keeps the innermost frame.
     */
    public Map<String, Map<String, VariableCell>> variablesByProgram() {
        Map<String, Map<String, VariableCell>> all = new LinkedHashMap<>();
        for (StackFrame frame : runtime.frames()) {
            all.put(frame.programId, runtime.variablesOf(frame));
        }
        return all;
    }
}
