package org.dxworks.cobolsim.debug;

import org.dxworks.cobolsim.runtime.VariableCell;

import java.util.Map;

/**
 * Observer for debugger front ends. All methods are optional.
 */
public interface DebuggerListener {

    default void onStatusChange(DebugStatus status) {
    }

    default void onStatement(int line) {
    }

    default void onVariables(Map<String, VariableCell> variables) {
    }
}
