package org.dxworks.cobolsim.model;

import java.util.List;

/**
 * An FD entry of the File Section and the record items declared under it.
 */
public final class FileDescription {
    public final String fileName;
    public final List<VariableDeclaration> records;
    public final int line;

    public FileDescription(String fileName, List<VariableDeclaration> records, int line) {
        this.fileName = fileName;
        this.records = List.copyOf(records);
        this.line = line;
    }

    public boolean declaresRecord(String name) {
        return records.stream().anyMatch(r -> r.name.equals(name));
    }
}
