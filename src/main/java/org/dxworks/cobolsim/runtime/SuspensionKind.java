package org.dxworks.cobolsim.runtime;

public enum SuspensionKind {
    /** ACCEPT is waiting for a value. */
    ACCEPT,
    /** RECEIVE MAP is waiting for operator input on the screen. */
    RECEIVE_MAP,
    /** The debug adapter stopped before a statement. */
    DEBUG
}
