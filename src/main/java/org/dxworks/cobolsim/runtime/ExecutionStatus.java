package org.dxworks.cobolsim.runtime;

public enum ExecutionStatus {
    COMPLETED,
    SUSPENDED
}
