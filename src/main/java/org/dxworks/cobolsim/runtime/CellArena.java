package org.dxworks.cobolsim.runtime;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns every cell of a run. Frames address cells by handle; cells are released in LIFO order
 * together with the frame that allocated them, so a handle never outlives its owner.
 */
final class CellArena {
    private final List<VariableCell> cells = new ArrayList<>();

    int allocate(VariableCell cell) {
        cells.add(cell);
        return cells.size() - 1;
    }

    VariableCell get(int handle) {
        if (handle < 0 || handle >= cells.size()) {
            throw new IllegalStateException("Stale cell handle " + handle);
        }
        return cells.get(handle);
    }

    int mark() {
        return cells.size();
    }

    void release(int mark) {
        cells.subList(mark, cells.size()).clear();
    }

    int size() {
        return cells.size();
    }

    void clear() {
        cells.clear();
    }
}
