package org.dxworks.cobolsim.debug;

public enum DebugStatus {
    STOPPED,
    RUNNING,
    PAUSED,
    TERMINATED
}
