package org.dxworks.cobolsim.model;

public enum DataSection {
    FILE,
    WORKING_STORAGE,
    LINKAGE
}
