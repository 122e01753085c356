package org.dxworks.cobolsim.debug;

public enum DebugMode {
    /** Stop only at breakpoints or on request. */
    RUN,
    /** Stop before the next statement, wherever it is. */
    STEP,
    /** Stop before the next statement at the same or an outer call depth. */
    NEXT
}
