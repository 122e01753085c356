package org.dxworks.cobolsim.model;

public enum AccessMode {
    SEQUENTIAL,
    RANDOM,
    DYNAMIC
}
