package org.dxworks.cobolsim.model;

/**
 * A SELECT clause from FILE-CONTROL.
 */
public final class FileControlEntry {
    public final String fileName;
    /** Dataset name from ASSIGN TO, quotes removed. */
    public final String externalName;
    public final FileOrganization organization;
    public final AccessMode accessMode;
    /** Data item holding the record key of an indexed file; null for sequential files. */
    public final String recordKey;
    public final int line;

    public FileControlEntry(String fileName, String externalName, FileOrganization organization,
                            AccessMode accessMode, String recordKey, int line) {
        this.fileName = fileName;
        this.externalName = externalName;
        this.organization = organization;
        this.accessMode = accessMode;
        this.recordKey = recordKey;
        this.line = line;
    }

    public boolean isIndexed() {
        return organization == FileOrganization.INDEXED;
    }
}
