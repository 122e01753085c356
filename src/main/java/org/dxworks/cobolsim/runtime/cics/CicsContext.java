package org.dxworks.cobolsim.runtime.cics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-runtime CICS state: the current transaction, its commarea, the HANDLE CONDITION table
 * and the terminal screen. The screen survives between transactions; the rest is reset at
 * the start of each run.
 */
public final class CicsContext {
    private final ScreenBuffer screen = new ScreenBuffer();
    private final Map<String, String> handlers = new LinkedHashMap<>();
    private String transId;
    private String commarea = "";

    public ScreenBuffer getScreen() {
        return screen;
    }

    public String getTransId() {
        return transId;
    }

    public String getCommarea() {
        return commarea;
    }

    public Map<String, String> getHandlers() {
        return Collections.unmodifiableMap(handlers);
    }

    public Optional<String> handlerFor(String condition) {
        return Optional.ofNullable(handlers.get(condition));
    }

    public void handle(String condition, String label) {
        if (label == null) {
            handlers.remove(condition);
        } else {
            handlers.put(condition, label);
        }
    }

    public void begin(String transId, String commarea) {
        this.transId = transId;
        this.commarea = commarea == null ? "" : commarea;
        handlers.clear();
    }
}
