package org.dxworks.cobolsim.debug;

import org.dxworks.cobolsim.model.statement.Statement;
import org.dxworks.cobolsim.runtime.CallStackView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Line debugger driven by the runtime's per-statement callback.
 *
 * <p>Commands only change the debugger's state; the host then resumes the suspended run with
 * its token. Typical loop:
 * <pre>
 *   ExecutionResult r = runtime.run(program);
 *   while (r.isSuspended() &amp;&amp; r.suspension.kind == SuspensionKind.DEBUG) {
 *       debugger.step();
 *       r = runtime.resume(r.suspension.token, null);
 *   }
 * </pre>
 */
public class Debugger implements DebugAdapter {

    private static final Logger log = LoggerFactory.getLogger(Debugger.class);

    private final SortedSet<Integer> breakpoints = new TreeSet<>();
    private final DebuggerListener listener;

    private DebugStatus status = DebugStatus.STOPPED;
    private DebugMode mode = DebugMode.RUN;
    private boolean pauseRequested;
    private int targetDepth = -1;
    private int lastDepth;
    private int currentLine;

    public Debugger() {
        this(new DebuggerListener() {
        });
    }

    public Debugger(DebuggerListener listener) {
        this.listener = listener;
    }

    /**
     * @return true when a breakpoint is now set on {@code line}
     */
    public boolean toggleBreakpoint(int line) {
        if (breakpoints.remove(line)) {
            return false;
        }
        breakpoints.add(line);
        return true;
    }

    public SortedSet<Integer> getBreakpoints() {
        return Collections.unmodifiableSortedSet(breakpoints);
    }

    /**
     * Stops before the next statement, whatever the mode.
     */
    public void pause() {
        pauseRequested = true;
    }

    public void step() {
        mode = DebugMode.STEP;
        setStatus(DebugStatus.RUNNING);
    }

    /**
     * Steps over calls: stops again only at the depth of the statement the run is paused on, or above.
     */
    public void next() {
        mode = DebugMode.NEXT;
        targetDepth = lastDepth;
        setStatus(DebugStatus.RUNNING);
    }

    public void resume() {
        mode = DebugMode.RUN;
        setStatus(DebugStatus.RUNNING);
    }

    public DebugStatus getStatus() {
        return status;
    }

    public DebugMode getMode() {
        return mode;
    }

    public int getCurrentLine() {
        return currentLine;
    }

    @Override
    public DebugDecision beforeStatement(Statement statement, CallStackView callStack) {
        if (status != DebugStatus.RUNNING) {
            setStatus(DebugStatus.RUNNING);
        }
        int depth = callStack.depth();
        lastDepth = depth;
        currentLine = statement.line();
        listener.onStatement(currentLine);

        boolean stop = pauseRequested
                || breakpoints.contains(currentLine)
                || mode == DebugMode.STEP
                || (mode == DebugMode.NEXT && depth <= targetDepth);
        if (!stop) {
            return DebugDecision.PROCEED;
        }
        pauseRequested = false;
        log.debug("Paused at line {} (depth {}, mode {})", currentLine, depth, mode);
        listener.onVariables(callStack.visibleVariables());
        setStatus(DebugStatus.PAUSED);
        return DebugDecision.SUSPEND;
    }

    @Override
    public void onTerminated() {
        setStatus(DebugStatus.TERMINATED);
    }

    private void setStatus(DebugStatus next) {
        if (status != next) {
            status = next;
            listener.onStatusChange(next);
        }
    }
}
