package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.debug.DebugAdapter;
import org.dxworks.cobolsim.debug.DebugDecision;
import org.dxworks.cobolsim.model.Program;
import org.dxworks.cobolsim.model.VariableDeclaration;
import org.dxworks.cobolsim.model.statement.Statement;
import org.dxworks.cobolsim.runtime.cics.CicsContext;
import org.dxworks.cobolsim.runtime.cics.ScreenChar;
import org.dxworks.cobolsim.runtime.file.DatasetCatalog;
import org.dxworks.cobolsim.runtime.file.FileHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Executes compiled programs.
 *
 * <p>A run is a step loop over the cursor stack of the current frame. Every step executes at
 * most one statement, so the loop can stop between any two statements: when ACCEPT has no
 * value, when RECEIVE MAP has no operator input, or when the debug adapter asks to stop. The
 * run then returns a {@link ExecutionStatus#SUSPENDED} result whose token continues it via
 * {@link #resume(ResumeToken, String)}.
 *
 * <p>One instance owns its programs, datasets, screen and cells; it is not thread-safe.
 */
public class CobolRuntime {

    private static final Logger log = LoggerFactory.getLogger(CobolRuntime.class);

    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 100_000;
    public static final int DEFAULT_MAX_CALL_DEPTH = 100;
    public static final String ABEND_PREFIX = "IGZ9999S RUNTIME TERMINATED ABNORMALLY: ";
    public static final String UNKNOWN_TRANSACTION = "DFHAC2001";

    static final String COMMAREA = "DFHCOMMAREA";

    private final InputHandler inputHandler;
    private final ScreenUpdateHandler screenUpdateHandler;
    private final ScreenInputHandler screenInputHandler;
    private final int maxLoopIterations;
    private final int maxCallDepth;

    private final Map<String, Program> programs = new LinkedHashMap<>();
    private final Map<String, String> transactions = new LinkedHashMap<>();
    private final DatasetCatalog datasets = new DatasetCatalog();
    private final CicsContext cics = new CicsContext();
    private final CellArena arena = new CellArena();
    private final List<StackFrame> callStack = new ArrayList<>();
    private final Map<String, FileHandle> openFiles = new LinkedHashMap<>();
    private final CallStackView callStackView = new CallStackView(this);
    private final StatementExecutor executor;

    private DebugAdapter debugAdapter;
    private List<String> output = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
    private boolean running;
    private boolean abended;
    private NextTransaction nextTransaction;
    private Pending pending;
    private boolean skipDebugOnce;
    private int tokenSequence;

    public CobolRuntime() {
        this(InputHandler.SUSPENDING, ScreenUpdateHandler.IGNORE, ScreenInputHandler.SUSPENDING);
    }

    public CobolRuntime(InputHandler inputHandler, ScreenUpdateHandler screenUpdateHandler,
                        ScreenInputHandler screenInputHandler) {
        this(inputHandler, screenUpdateHandler, screenInputHandler, DEFAULT_MAX_LOOP_ITERATIONS, DEFAULT_MAX_CALL_DEPTH);
    }

    public CobolRuntime(InputHandler inputHandler, ScreenUpdateHandler screenUpdateHandler,
                        ScreenInputHandler screenInputHandler, int maxLoopIterations, int maxCallDepth) {
        this.inputHandler = inputHandler;
        this.screenUpdateHandler = screenUpdateHandler;
        this.screenInputHandler = screenInputHandler;
        this.maxLoopIterations = maxLoopIterations > 0 ? maxLoopIterations : DEFAULT_MAX_LOOP_ITERATIONS;
        this.maxCallDepth = maxCallDepth > 0 ? maxCallDepth : DEFAULT_MAX_CALL_DEPTH;
        this.executor = new StatementExecutor(this, new Evaluator(this));
    }

    public void setDebugAdapter(DebugAdapter debugAdapter) {
        this.debugAdapter = debugAdapter;
    }

    public void registerProgram(Program program) {
        programs.put(program.registryKey(), program);
    }

    public void registerTransaction(String transId, String programId) {
        transactions.put(transId.trim().toUpperCase(Locale.ROOT), programId.trim().toUpperCase(Locale.ROOT));
    }

    public Optional<Program> findProgram(String name) {
        return Optional.ofNullable(programs.get(name.trim().toUpperCase(Locale.ROOT)));
    }

    public DatasetCatalog getDatasets() {
        return datasets;
    }

    /**
     * Registers {@code program} and runs it from the start, discarding any previous run.
     */
    public ExecutionResult run(Program program) {
        registerProgram(program);
        return start(program, null, "");
    }

    /**
     * Starts the program registered for {@code transId}, or the program of that name, with
     * {@code commarea} available to it as DFHCOMMAREA.
     */
    public ExecutionResult runTransaction(String transId, String commarea) {
        String key = transId.trim().toUpperCase(Locale.ROOT);
        Optional<Program> program = findProgram(transactions.getOrDefault(key, key));
        if (program.isEmpty()) {
            reset();
            recordAbend(new RuntimeAbend(UNKNOWN_TRANSACTION, "TRANSACTION '" + key + "' IS NOT RECOGNIZED."));
            return finish();
        }
        return start(program.get(), key, commarea);
    }

    /**
     * Continues a suspended run. {@code value} is the ACCEPT input; it is ignored for the other
     * suspension kinds.
     *
     * @throws IllegalArgumentException when {@code token} is not the one of the pending suspension
     */
    public ExecutionResult resume(ResumeToken token, String value) {
        if (pending == null || !pending.suspension.token.equals(token)) {
            throw new IllegalArgumentException("No suspension is waiting for token " + token);
        }
        Pending resumed = pending;
        pending = null;
        log.debug("Resuming {} suspension {}", resumed.suspension.kind, token);
        try {
            resumed.action.accept(value);
        } catch (RuntimeAbend abend) {
            recordAbend(abend);
            return finish();
        }
        return drive();
    }

    public boolean isSuspended() {
        return pending != null;
    }

    /**
     * Variables visible in the current frame, by name. Empty before the first run.
     */
    public Map<String, VariableCell> getMemory() {
        if (callStack.isEmpty()) {
            return Map.of();
        }
        return variablesOf(currentFrame());
    }

    public Map<String, FileHandle> getOpenFiles() {
        return Collections.unmodifiableMap(openFiles);
    }

    public List<ScreenChar> getScreenBuffer() {
        return cics.getScreen().snapshot();
    }

    public CicsContext getCicsContext() {
        return cics;
    }

    public int getCallDepth() {
        return callStack.size();
    }

    private ExecutionResult start(Program program, String transId, String commarea) {
        reset();
        cics.begin(transId, commarea);
        log.debug("Starting program {}{}", program.id, transId == null ? "" : " for transaction " + transId);
        try {
            pushFrame(program, Map.of());
        } catch (RuntimeAbend abend) {
            recordAbend(abend);
            return finish();
        }
        return drive();
    }

    private void reset() {
        callStack.clear();
        arena.clear();
        openFiles.clear();
        output = new ArrayList<>();
        errors = new ArrayList<>();
        running = true;
        abended = false;
        nextTransaction = null;
        pending = null;
        skipDebugOnce = false;
    }

    private ExecutionResult drive() {
        try {
            while (running) {
                StackFrame frame = currentFrame();
                Cursor cursor = frame.cursors.peek();
                if (cursor == null) {
                    if (callStack.size() > 1) {
                        popFrame();
                    } else {
                        running = false;
                    }
                } else if (cursor instanceof Cursor.Block block) {
                    if (!block.hasNext()) {
                        frame.cursors.pop();
                        continue;
                    }
                    Statement statement = block.peek();
                    if (shouldStopForDebugger(statement)) {
                        suspend(Suspension.debug(nextToken(), statement.line()), value -> skipDebugOnce = true);
                        return suspended();
                    }
                    block.advance();
                    statement.accept(executor);
                    if (pending != null) {
                        return suspended();
                    }
                } else if (cursor instanceof Cursor.Loop loop) {
                    stepLoop(frame, loop);
                }
            }
        } catch (RuntimeAbend abend) {
            recordAbend(abend);
        }
        return finish();
    }

    private boolean shouldStopForDebugger(Statement statement) {
        if (debugAdapter == null) {
            return false;
        }
        if (skipDebugOnce) {
            skipDebugOnce = false;
            return false;
        }
        return debugAdapter.beforeStatement(statement, callStackView) == DebugDecision.SUSPEND;
    }

    private void stepLoop(StackFrame frame, Cursor.Loop loop) {
        boolean again = loop.perform.until != null
                ? !executor.evaluator().test(loop.perform.until)
                : loop.iterations < loop.count;
        if (!again) {
            frame.cursors.pop();
            return;
        }
        if (loop.iterations >= maxLoopIterations) {
            throw new RuntimeAbend(RuntimeAbend.LIMIT_EXCEEDED, "INFINITE LOOP. PERFORM AT LINE "
                    + loop.perform.line() + " EXCEEDED " + maxLoopIterations + " ITERATIONS.");
        }
        loop.iterations++;
        if (!loop.perform.body.isEmpty()) {
            frame.cursors.push(new Cursor.Block(loop.perform.body));
        }
    }

    private ExecutionResult suspended() {
        return new ExecutionResult(ExecutionStatus.SUSPENDED, output, errors, false, nextTransaction, pending.suspension);
    }

    private ExecutionResult finish() {
        running = false;
        pending = null;
        if (debugAdapter != null) {
            debugAdapter.onTerminated();
        }
        log.debug("Run finished with {} output line(s) and {} error(s)", output.size(), errors.size());
        return new ExecutionResult(ExecutionStatus.COMPLETED, output, errors, abended, nextTransaction, null);
    }

    private void recordAbend(RuntimeAbend abend) {
        log.warn("Run abended: {}", abend.getMessage());
        errors.add(ABEND_PREFIX + abend.getMessage());
        abended = true;
        running = false;
    }

    // ---- services for statement execution ----

    StackFrame currentFrame() {
        if (callStack.isEmpty()) {
            throw new IllegalStateException("No active program");
        }
        return callStack.get(callStack.size() - 1);
    }

    List<StackFrame> frames() {
        return Collections.unmodifiableList(callStack);
    }

    Program currentProgram() {
        return currentFrame().program;
    }

    VariableCell cell(String name) {
        return findCell(name).orElseThrow(() -> RuntimeAbend.undefinedVariable(name));
    }

    Optional<VariableCell> findCell(String name) {
        Integer handle = currentFrame().handleOf(name);
        return handle == null ? Optional.empty() : Optional.of(arena.get(handle));
    }

    int handleOf(String name) {
        Integer handle = currentFrame().handleOf(name);
        if (handle == null) {
            throw RuntimeAbend.undefinedVariable(name);
        }
        return handle;
    }

    Map<String, VariableCell> variablesOf(StackFrame frame) {
        Map<String, VariableCell> variables = new LinkedHashMap<>();
        frame.handles().forEach((name, handle) -> variables.put(name, arena.get(handle)));
        return Collections.unmodifiableMap(variables);
    }

    /**
     * Activates {@code program}. Linkage items named in {@code linkageAliases} share the
     * caller's cells; the others get fresh cells, DFHCOMMAREA filled from the current commarea.
     */
    void pushFrame(Program program, Map<String, Integer> linkageAliases) {
        if (callStack.size() >= maxCallDepth) {
            throw new RuntimeAbend(RuntimeAbend.LIMIT_EXCEEDED, "STACK OVERFLOW.");
        }
        StackFrame frame = new StackFrame(program, arena.mark());
        for (VariableDeclaration declaration : program.dataDivision.ownedStorage()) {
            frame.bindStorage(declaration.name, arena.allocate(VariableCell.declare(declaration)));
        }
        for (VariableDeclaration declaration : program.dataDivision.linkageSection) {
            Integer alias = linkageAliases.get(declaration.name);
            if (alias != null) {
                frame.bindLinkage(declaration.name, alias);
                continue;
            }
            VariableCell cell = VariableCell.declare(declaration);
            if (COMMAREA.equalsIgnoreCase(declaration.name)) {
                cell.storeText(cics.getCommarea());
            }
            frame.bindLinkage(declaration.name, arena.allocate(cell));
        }
        linkageAliases.forEach((name, handle) -> {
            if (frame.handleOf(name) == null) {
                frame.bindLinkage(name, handle);
            }
        });
        frame.cursors.push(new Cursor.Block(program.procedureDivision.statements));
        callStack.add(frame);
        log.debug("Entered {} at depth {}", program.id, callStack.size());
    }

    void popFrame() {
        StackFrame frame = callStack.remove(callStack.size() - 1);
        arena.release(frame.arenaMark);
        log.debug("Left {}", frame.programId);
    }

    void pushBlock(List<Statement> statements) {
        if (!statements.isEmpty()) {
            currentFrame().cursors.push(new Cursor.Block(statements));
        }
    }

    void pushLoop(Cursor.Loop loop) {
        currentFrame().cursors.push(loop);
    }

    void stop() {
        running = false;
    }

    void display(String line) {
        output.add(line);
    }

    void recordError(String message) {
        errors.add(message);
    }

    void setNextTransaction(NextTransaction next) {
        this.nextTransaction = next;
    }

    ResumeToken nextToken() {
        return new ResumeToken("R" + (++tokenSequence));
    }

    void suspend(Suspension suspension, Consumer<String> action) {
        pending = new Pending(suspension, action);
        log.debug("Suspended for {} at line {}", suspension.kind, suspension.line);
    }

    InputHandler inputHandler() {
        return inputHandler;
    }

    ScreenUpdateHandler screenUpdateHandler() {
        return screenUpdateHandler;
    }

    ScreenInputHandler screenInputHandler() {
        return screenInputHandler;
    }

    Map<String, FileHandle> openFiles() {
        return openFiles;
    }

    CicsContext cics() {
        return cics;
    }

    private static final class Pending {
        final Suspension suspension;
        final Consumer<String> action;

        Pending(Suspension suspension, Consumer<String> action) {
            this.suspension = suspension;
            this.action = action;
        }
    }
}
