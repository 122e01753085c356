package org.dxworks.cobolsim.debug;

public enum DebugDecision {
    PROCEED,
    SUSPEND
}
