package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.model.Program;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Activation of one program: handles of its own storage and of its Linkage items, which may
 * alias cells owned by the caller.
 */
public final class StackFrame {
    public final String programId;
    final Program program;
    final int arenaMark;
    final Deque<Cursor> cursors = new ArrayDeque<>();

    private final Map<String, Integer> storage = new LinkedHashMap<>();
    private final Map<String, Integer> linkage = new LinkedHashMap<>();

    StackFrame(Program program, int arenaMark) {
        this.programId = program.id;
        this.program = program;
        this.arenaMark = arenaMark;
    }

    void bindStorage(String name, int handle) {
        storage.put(name, handle);
    }

    void bindLinkage(String name, int handle) {
        linkage.put(name, handle);
    }

    Integer handleOf(String name) {
        Integer handle = storage.get(name);
        return handle != null ? handle : linkage.get(name);
    }

    /**
     * Visible names in declaration order, storage before linkage.
     */
    Map<String, Integer> handles() {
        Map<String, Integer> all = new LinkedHashMap<>(storage);
        linkage.forEach(all::putIfAbsent);
        return Collections.unmodifiableMap(all);
    }
}
