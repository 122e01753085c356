package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.model.FileOrganization;
import org.dxworks.cobolsim.model.MapDefinition;
import org.dxworks.cobolsim.model.MapField;
import org.dxworks.cobolsim.model.Program;
import org.dxworks.cobolsim.model.expression.Operand;
import org.dxworks.cobolsim.model.expression.VariableRef;
import org.dxworks.cobolsim.model.statement.ExecCicsStatement;
import org.dxworks.cobolsim.runtime.cics.CicsContext;
import org.dxworks.cobolsim.runtime.cics.ScreenBuffer;
import org.dxworks.cobolsim.runtime.file.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * EXEC CICS commands. Exceptional outcomes raise a CICS condition, which either goes to the
 * label registered by HANDLE CONDITION or abends the run.
 */
final class CicsOperations {

    private static final Logger log = LoggerFactory.getLogger(CicsOperations.class);

    static final String NOTFND = "NOTFND";
    static final String DUPREC = "DUPREC";
    static final String MAPFAIL = "MAPFAIL";
    static final String PGMIDERR = "PGMIDERR";
    static final String DSIDERR = "DSIDERR";

    private final CobolRuntime runtime;
    private final StatementExecutor executor;

    CicsOperations(CobolRuntime runtime, StatementExecutor executor) {
        this.runtime = runtime;
        this.executor = executor;
    }

    void execute(ExecCicsStatement statement) {
        log.debug("EXEC CICS {} {}", statement.command, statement.params.keySet());
        switch (statement.command) {
            case SEND_MAP -> sendMap(statement);
            case RECEIVE_MAP -> receiveMap(statement);
            case READ -> read(statement);
            case WRITE -> write(statement);
            case REWRITE -> rewrite(statement);
            case DELETE -> delete(statement);
            case RETURN -> doReturn(statement);
            case LINK -> link(statement);
            case HANDLE_CONDITION -> handleCondition(statement);
        }
    }

    private void sendMap(ExecCicsStatement statement) {
        Optional<MapDefinition> map = findMap(statement);
        if (map.isEmpty()) {
            raise(MAPFAIL);
            return;
        }
        requireOnScreen(map.get());
        ScreenBuffer screen = runtime.cics().getScreen();
        boolean dataOnly = statement.hasParam("DATAONLY");
        boolean mapOnly = statement.hasParam("MAPONLY");
        if (!dataOnly) {
            screen.clear();
        }
        for (MapField field : map.get().fields) {
            Optional<VariableCell> cell = mapOnly ? Optional.empty() : runtime.findCell(field.name);
            if (dataOnly && cell.isEmpty()) {
                continue;
            }
            String text = cell.map(VariableCell::getDisplayValue).orElse(field.initial == null ? "" : field.initial);
            screen.write(field.row, field.column, PicFormatter.fitAlphanumeric(text, field.length));
        }
        runtime.screenUpdateHandler().onScreenUpdate(screen.snapshot());
    }

    private void receiveMap(ExecCicsStatement statement) {
        Optional<MapDefinition> map = findMap(statement);
        if (map.isEmpty()) {
            raise(MAPFAIL);
            return;
        }
        requireOnScreen(map.get());
        if (runtime.screenInputHandler().awaitInput()) {
            scrape(map.get());
        } else {
            MapDefinition definition = map.get();
            runtime.suspend(Suspension.receiveMap(runtime.nextToken(), statement.line(),
                    definition.mapName, definition.mapsetName), ignored -> scrape(definition));
        }
    }

    private void scrape(MapDefinition map) {
        ScreenBuffer screen = runtime.cics().getScreen();
        for (MapField field : map.fields) {
            runtime.findCell(field.name).ifPresent(cell -> cell.storeText(screen.read(field.row, field.column, field.length)));
        }
    }

    private static void requireOnScreen(MapDefinition map) {
        for (MapField field : map.fields) {
            if (!ScreenBuffer.contains(field.row, field.column)) {
                throw new RuntimeAbend(RuntimeAbend.CICS_ABEND, "FIELD '" + field.name + "' OF MAP '" + map.mapName
                        + "' STARTS OFF THE SCREEN AT LINE " + field.row + ", COLUMN " + field.column + ".");
            }
        }
    }

    private void read(ExecCicsStatement statement) {
        Optional<Dataset> dataset = keyedDataset(statement);
        if (dataset.isEmpty()) {
            raise(DSIDERR);
            return;
        }
        String key = key(statement);
        Optional<String> record = dataset.get().get(key);
        if (record.isEmpty()) {
            raise(NOTFND);
            return;
        }
        executor.store(dataRef(statement, "INTO"), record.get());
    }

    private void write(ExecCicsStatement statement) {
        String name = datasetName(statement);
        Dataset dataset = runtime.getDatasets().find(name)
                .orElseGet(() -> runtime.getDatasets().create(name, FileOrganization.INDEXED));
        if (!dataset.isKeyed()) {
            raise(DSIDERR);
            return;
        }
        String key = key(statement);
        if (dataset.containsKey(key)) {
            raise(DUPREC);
            return;
        }
        dataset.put(key, executor.evaluator().text(required(statement, "FROM")));
    }

    private void rewrite(ExecCicsStatement statement) {
        Optional<Dataset> dataset = keyedDataset(statement);
        if (dataset.isEmpty()) {
            raise(DSIDERR);
            return;
        }
        String key = key(statement);
        if (!dataset.get().containsKey(key)) {
            raise(NOTFND);
            return;
        }
        dataset.get().put(key, executor.evaluator().text(required(statement, "FROM")));
    }

    private void delete(ExecCicsStatement statement) {
        Optional<Dataset> dataset = keyedDataset(statement);
        if (dataset.isEmpty()) {
            raise(DSIDERR);
            return;
        }
        if (!dataset.get().remove(key(statement))) {
            raise(NOTFND);
        }
    }

    private void doReturn(ExecCicsStatement statement) {
        // a LINKed program returns to its linker
        if (runtime.getCallDepth() > 1 && !statement.hasParam("TRANSID")) {
            runtime.popFrame();
            return;
        }
        if (statement.hasParam("TRANSID")) {
            String transId = name(statement, "TRANSID");
            Operand commarea = statement.param("COMMAREA");
            String data = commarea == null ? "" : executor.evaluator().text(commarea);
            runtime.setNextTransaction(new NextTransaction(transId, data));
            log.debug("RETURN TRANSID({}) with {} byte(s) of commarea", transId, data.length());
        }
        runtime.stop();
    }

    private void link(ExecCicsStatement statement) {
        String name = name(statement, "PROGRAM");
        Optional<Program> target = runtime.findProgram(name);
        if (target.isEmpty()) {
            raise(PGMIDERR);
            return;
        }
        Operand commarea = statement.param("COMMAREA");
        Map<String, Integer> aliases = commarea instanceof VariableRef ref
                ? Map.of(CobolRuntime.COMMAREA, runtime.handleOf(ref.name))
                : Map.of();
        runtime.pushFrame(target.get(), aliases);
    }

    private void handleCondition(ExecCicsStatement statement) {
        CicsContext context = runtime.cics();
        statement.params.forEach((condition, label) -> {
            String target = label instanceof VariableRef ref ? ref.name : label == null ? null : executor.evaluator().name(label);
            context.handle(condition, target);
        });
    }

    /**
     * Routes {@code condition} to its HANDLE CONDITION label, or abends when none is registered.
     */
    void raise(String condition) {
        Optional<String> label = runtime.cics().handlerFor(condition);
        if (label.isEmpty()) {
            throw new RuntimeAbend(RuntimeAbend.CICS_ABEND, "CICS CONDITION '" + condition + "' NOT HANDLED.");
        }
        String message = "CICS HANDLE CONDITION TRIGGERED: " + condition + " -> " + label.get();
        log.info(message);
        runtime.recordError(message);
    }

    private Optional<MapDefinition> findMap(ExecCicsStatement statement) {
        String map = name(statement, "MAP");
        String mapset = statement.param("MAPSET") == null ? null : name(statement, "MAPSET");
        return runtime.currentProgram().dataDivision.findMap(map, mapset);
    }

    private Optional<Dataset> keyedDataset(ExecCicsStatement statement) {
        return runtime.getDatasets().find(datasetName(statement)).filter(Dataset::isKeyed);
    }

    private String datasetName(ExecCicsStatement statement) {
        return statement.param("FILE") != null ? name(statement, "FILE") : name(statement, "DATASET");
    }

    private String key(ExecCicsStatement statement) {
        return executor.evaluator().text(required(statement, "RIDFLD")).trim();
    }

    /**
     * Resource name given by an option: a literal, the content of a data item, or the word
     * itself when no such item exists.
     */
    private String name(ExecCicsStatement statement, String option) {
        Operand operand = required(statement, option);
        if (operand instanceof VariableRef ref && runtime.findCell(ref.name).isEmpty()) {
            return ref.name;
        }
        return executor.evaluator().name(operand);
    }

    private VariableRef dataRef(ExecCicsStatement statement, String option) {
        Operand operand = required(statement, option);
        if (!(operand instanceof VariableRef ref)) {
            throw new RuntimeAbend(RuntimeAbend.CICS_ABEND,
                    "CICS OPTION " + option + " OF " + describe(statement) + " MUST NAME A DATA ITEM.");
        }
        return ref;
    }

    private static Operand required(ExecCicsStatement statement, String option) {
        Operand operand = statement.param(option);
        if (operand == null) {
            throw new RuntimeAbend(RuntimeAbend.CICS_ABEND,
                    "CICS COMMAND " + describe(statement) + " REQUIRES OPTION " + option + ".");
        }
        return operand;
    }

    private static String describe(ExecCicsStatement statement) {
        return statement.command.name().replace('_', ' ');
    }
}
