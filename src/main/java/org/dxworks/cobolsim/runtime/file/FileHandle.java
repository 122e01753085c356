package org.dxworks.cobolsim.runtime.file;

import org.dxworks.cobolsim.model.AccessMode;
import org.dxworks.cobolsim.model.FileControlEntry;
import org.dxworks.cobolsim.model.statement.OpenMode;

/**
 * An open file: the FILE-CONTROL entry, the mode it was opened in, the backing dataset and
 * the sequential read position.
 */
public final class FileHandle {
    public final FileControlEntry entry;
    public final OpenMode mode;
    private final Dataset dataset;
    private int position;

    public FileHandle(FileControlEntry entry, OpenMode mode, Dataset dataset) {
        this.entry = entry;
        this.mode = mode;
        this.dataset = dataset;
    }

    public Dataset getDataset() {
        return dataset;
    }

    public int getPosition() {
        return position;
    }

    public boolean canRead() {
        return mode == OpenMode.INPUT || mode == OpenMode.I_O;
    }

    public boolean canWrite() {
        return mode != OpenMode.INPUT;
    }

    /**
     * True when READ looks records up by key instead of walking them in order.
     */
    public boolean isRandomAccess() {
        return entry.isIndexed() && entry.accessMode != AccessMode.SEQUENTIAL;
    }

    public boolean hasNext() {
        return position < dataset.size();
    }

    public String next() {
        return dataset.recordAt(position++);
    }
}
