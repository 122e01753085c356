package org.dxworks.cobolsim.debug;

import org.dxworks.cobolsim.model.statement.Statement;
import org.dxworks.cobolsim.runtime.CallStackView;

/**
 * Consulted by the runtime before every statement. Answering {@link DebugDecision#SUSPEND}
 * ends the current step with a DEBUG suspension; resuming it executes that statement without
 * asking again.
 */
public interface DebugAdapter {

    DebugDecision beforeStatement(Statement statement, CallStackView callStack);

    default void onTerminated() {
    }
}
