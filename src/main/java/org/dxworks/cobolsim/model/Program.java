package org.dxworks.cobolsim.model;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Executable tree of one compiled program.
 */
public final class Program {
    public final String id;
    public final List<FileControlEntry> fileControl;
    public final DataDivision dataDivision;
    public final ProcedureDivision procedureDivision;
    public final SourceSpan span;

    public Program(String id, List<FileControlEntry> fileControl, DataDivision dataDivision,
                   ProcedureDivision procedureDivision, SourceSpan span) {
        this.id = id;
        this.fileControl = List.copyOf(fileControl);
        this.dataDivision = dataDivision;
        this.procedureDivision = procedureDivision;
        this.span = span;
    }

    public String registryKey() {
        return id.toUpperCase(Locale.ROOT);
    }

    public Optional<FileControlEntry> findFile(String fileName) {
        return fileControl.stream().filter(f -> f.fileName.equals(fileName)).findFirst();
    }
}
