package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.model.statement.PerformStatement;
import org.dxworks.cobolsim.model.statement.Statement;

import java.util.List;

/**
 * Position of execution inside one frame. A frame keeps a stack of cursors; the step loop
 * always advances the top one, which is what lets a run stop between any two statements and
 * pick up again later.
 */
abstract sealed class Cursor permits Cursor.Block, Cursor.Loop {

    static final class Block extends Cursor {
        final List<Statement> statements;
        private int next;

        Block(List<Statement> statements) {
            this.statements = statements;
        }

        boolean hasNext() {
            return next < statements.size();
        }

        Statement peek() {
            return statements.get(next);
        }

        void advance() {
            next++;
        }
    }

    /**
     * An inline PERFORM. {@code count} is the resolved TIMES value, or -1 for UNTIL / once.
     */
    static final class Loop extends Cursor {
        final PerformStatement perform;
        final long count;
        long iterations;

        Loop(PerformStatement perform, long count) {
            this.perform = perform;
            this.count = count;
        }
    }
}
