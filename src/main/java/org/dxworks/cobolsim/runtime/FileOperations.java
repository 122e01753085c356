package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.model.FileControlEntry;
import org.dxworks.cobolsim.model.FileDescription;
import org.dxworks.cobolsim.model.statement.CloseStatement;
import org.dxworks.cobolsim.model.statement.OpenStatement;
import org.dxworks.cobolsim.model.statement.ReadStatement;
import org.dxworks.cobolsim.model.statement.WriteStatement;
import org.dxworks.cobolsim.runtime.file.Dataset;
import org.dxworks.cobolsim.runtime.file.DatasetCatalog;
import org.dxworks.cobolsim.runtime.file.FileHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * OPEN, CLOSE, READ and WRITE against the runtime's dataset catalog.
 */
final class FileOperations {

    private static final Logger log = LoggerFactory.getLogger(FileOperations.class);

    private final CobolRuntime runtime;
    private final StatementExecutor executor;

    FileOperations(CobolRuntime runtime, StatementExecutor executor) {
        this.runtime = runtime;
        this.executor = executor;
    }

    void open(OpenStatement statement) {
        Map<String, FileHandle> openFiles = runtime.openFiles();
        DatasetCatalog catalog = runtime.getDatasets();
        for (OpenStatement.Target target : statement.targets) {
            FileControlEntry entry = entry(target.fileName);
            if (openFiles.containsKey(entry.fileName)) {
                throw new RuntimeAbend(RuntimeAbend.FILE_ALREADY_OPEN, "FILE '" + entry.fileName + "' IS ALREADY OPEN.");
            }
            Dataset dataset = switch (target.mode) {
                case INPUT, I_O -> catalog.find(entry.externalName).orElseThrow(() -> new RuntimeAbend(
                        RuntimeAbend.OPEN_FAILED, "OPEN FAILED FOR FILE '" + entry.fileName + "'. DATASET '"
                        + entry.externalName + "' NOT FOUND."));
                case OUTPUT -> catalog.create(entry.externalName, entry.organization);
                case EXTEND -> catalog.find(entry.externalName)
                        .orElseGet(() -> catalog.create(entry.externalName, entry.organization));
            };
            openFiles.put(entry.fileName, new FileHandle(entry, target.mode, dataset));
            log.debug("Opened {} ({}) {}", entry.fileName, entry.externalName, target.mode);
        }
    }

    void close(CloseStatement statement) {
        for (String fileName : statement.fileNames) {
            if (runtime.openFiles().remove(fileName) == null) {
                throw notOpen(fileName);
            }
        }
    }

    void read(ReadStatement statement) {
        FileHandle handle = runtime.openFiles().get(statement.fileName);
        if (handle == null) {
            throw notOpen(statement.fileName);
        }
        if (!handle.canRead()) {
            throw new RuntimeAbend(RuntimeAbend.WRONG_OPEN_MODE,
                    "READ OF FILE '" + statement.fileName + "' OPENED " + handle.mode + ".");
        }

        String record;
        if (handle.isRandomAccess()) {
            String key = recordKey(handle);
            record = handle.getDataset().get(key).orElseThrow(() -> new RuntimeAbend(RuntimeAbend.RECORD_NOT_FOUND,
                    "RECORD NOT FOUND FOR KEY '" + key + "' IN FILE '" + statement.fileName + "'."));
        } else if (handle.hasNext()) {
            record = handle.next();
        } else if (statement.hasAtEnd) {
            runtime.pushBlock(statement.atEnd);
            return;
        } else {
            throw new RuntimeAbend(RuntimeAbend.READ_PAST_END,
                    "READ PAST END OF FILE '" + statement.fileName + "' WITHOUT AT END.");
        }

        runtime.currentProgram().dataDivision.fileSection.stream()
                .filter(fd -> fd.fileName.equals(statement.fileName) && !fd.records.isEmpty())
                .findFirst()
                .ifPresent(fd -> runtime.cell(fd.records.get(0).name).storeText(record));
        if (statement.into != null) {
            executor.store(statement.into, record);
        }
    }

    void write(WriteStatement statement) {
        FileDescription fd = runtime.currentProgram().dataDivision.findFileByRecord(statement.recordName)
                .orElseThrow(() -> new RuntimeAbend(RuntimeAbend.FILE_NOT_DECLARED,
                        "RECORD '" + statement.recordName + "' IS NOT DEFINED IN THE FILE SECTION."));
        FileHandle handle = runtime.openFiles().get(fd.fileName);
        if (handle == null) {
            throw notOpen(fd.fileName);
        }
        if (!handle.canWrite()) {
            throw new RuntimeAbend(RuntimeAbend.WRONG_OPEN_MODE,
                    "WRITE TO FILE '" + fd.fileName + "' OPENED " + handle.mode + ".");
        }

        VariableCell recordCell = runtime.cell(statement.recordName);
        if (statement.from != null) {
            executor.move(statement.from, recordCell);
        }
        String record = recordCell.getDisplayValue();
        Dataset dataset = handle.getDataset();
        if (dataset.isKeyed()) {
            String key = recordKey(handle);
            if (dataset.containsKey(key)) {
                throw new RuntimeAbend(RuntimeAbend.DUPLICATE_KEY,
                        "DUPLICATE KEY '" + key + "' IN FILE '" + fd.fileName + "'.");
            }
            dataset.put(key, record);
        } else {
            dataset.append(record);
        }
    }

    private FileControlEntry entry(String fileName) {
        return runtime.currentProgram().findFile(fileName).orElseThrow(() -> new RuntimeAbend(
                RuntimeAbend.FILE_NOT_DECLARED, "FILE '" + fileName + "' IS NOT DECLARED IN FILE-CONTROL."));
    }

    private String recordKey(FileHandle handle) {
        if (handle.entry.recordKey == null) {
            throw new RuntimeAbend(RuntimeAbend.RECORD_NOT_FOUND,
                    "FILE '" + handle.entry.fileName + "' HAS NO RECORD KEY.");
        }
        return runtime.cell(handle.entry.recordKey).getDisplayValue().trim();
    }

    private static RuntimeAbend notOpen(String fileName) {
        return new RuntimeAbend(RuntimeAbend.FILE_NOT_OPEN, "FILE '" + fileName + "' IS NOT OPEN.");
    }
}
