package org.dxworks.cobolsim.model.debug;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Source-mapping view of a program: node kind and the lines it covers.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class DebugNode {
    public final String kind;
    public final int startLine;
    public final int endLine;
    public final List<DebugNode> children = new ArrayList<>();

    public DebugNode(String kind, int startLine, int endLine) {
        this.kind = kind;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public boolean covers(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * Innermost node whose line range covers {@code line}.
     */
    public Optional<DebugNode> deepestAt(int line) {
        if (!covers(line)) {
            return Optional.empty();
        }
        for (DebugNode child : children) {
            Optional<DebugNode> hit = child.deepestAt(line);
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.of(this);
    }
}
