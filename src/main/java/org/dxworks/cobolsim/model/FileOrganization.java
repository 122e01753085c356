package org.dxworks.cobolsim.model;

public enum FileOrganization {
    SEQUENTIAL,
    INDEXED
}
