package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.model.Program;
import org.dxworks.cobolsim.model.expression.Figurative;
import org.dxworks.cobolsim.model.expression.NumericLiteral;
import org.dxworks.cobolsim.model.expression.Operand;
import org.dxworks.cobolsim.model.expression.VariableRef;
import org.dxworks.cobolsim.model.statement.AcceptStatement;
import org.dxworks.cobolsim.model.statement.ArithmeticStatement;
import org.dxworks.cobolsim.model.statement.CallStatement;
import org.dxworks.cobolsim.model.statement.CloseStatement;
import org.dxworks.cobolsim.model.statement.ComputeStatement;
import org.dxworks.cobolsim.model.statement.DisplayStatement;
import org.dxworks.cobolsim.model.statement.ExecCicsStatement;
import org.dxworks.cobolsim.model.statement.ExitProgramStatement;
import org.dxworks.cobolsim.model.statement.GobackStatement;
import org.dxworks.cobolsim.model.statement.IfStatement;
import org.dxworks.cobolsim.model.statement.MoveStatement;
import org.dxworks.cobolsim.model.statement.OpenStatement;
import org.dxworks.cobolsim.model.statement.PerformStatement;
import org.dxworks.cobolsim.model.statement.ReadStatement;
import org.dxworks.cobolsim.model.statement.StatementVisitor;
import org.dxworks.cobolsim.model.statement.StopRunStatement;
import org.dxworks.cobolsim.model.statement.WriteStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one statement against the current frame. Statements with bodies only push a
 * cursor; the step loop of {@link CobolRuntime} runs the body.
 */
final class StatementExecutor implements StatementVisitor<Void> {

    private static final Logger log = LoggerFactory.getLogger(StatementExecutor.class);

    private final CobolRuntime runtime;
    private final Evaluator evaluator;
    private final FileOperations files;
    private final CicsOperations cics;

    StatementExecutor(CobolRuntime runtime, Evaluator evaluator) {
        this.runtime = runtime;
        this.evaluator = evaluator;
        this.files = new FileOperations(runtime, this);
        this.cics = new CicsOperations(runtime, this);
    }

    Evaluator evaluator() {
        return evaluator;
    }

    @Override
    public Void visitMove(MoveStatement statement) {
        move(statement.source, statement.target);
        return null;
    }

    void move(Operand source, VariableRef target) {
        VariableCell cell = evaluator.cell(target);
        if (target.hasRefMod()) {
            evaluator.checkRange(cell, target.refMod);
            cell.overwrite(target.refMod.start - 1, target.refMod.length, evaluator.text(source));
            return;
        }
        move(source, cell);
    }

    void move(Operand source, VariableCell cell) {
        if (source instanceof Figurative figurative) {
            cell.fill(figurative.constant);
        } else if (source instanceof NumericLiteral literal) {
            cell.storeNumber(literal.value);
        } else if (source instanceof VariableRef ref && !ref.hasRefMod() && evaluator.cell(ref).isNumeric()) {
            cell.storeNumber(evaluator.cell(ref).getNumericValue());
        } else {
            cell.storeText(evaluator.text(source));
        }
    }

    /**
     * Stores raw text (a record, an input line) into a data item, honouring reference modification.
     */
    void store(VariableRef target, String text) {
        VariableCell cell = evaluator.cell(target);
        if (target.hasRefMod()) {
            evaluator.checkRange(cell, target.refMod);
            cell.overwrite(target.refMod.start - 1, target.refMod.length, text);
        } else {
            cell.storeText(text);
        }
    }

    @Override
    public Void visitArithmetic(ArithmeticStatement statement) {
        BigDecimal value = evaluator.number(statement.value);
        BigDecimal target = evaluator.number(statement.target);
        BigDecimal result = switch (statement.verb) {
            case ADD -> target.add(value);
            case SUBTRACT -> target.subtract(value);
            case MULTIPLY -> target.multiply(value);
            case DIVIDE_INTO -> evaluator.divide(target, value);
            case DIVIDE_BY -> evaluator.divide(value, target);
        };
        evaluator.cell(statement.receiver()).storeNumber(result);
        return null;
    }

    @Override
    public Void visitCompute(ComputeStatement statement) {
        BigDecimal result = statement.expression.accept(evaluator);
        evaluator.cell(statement.target).storeNumber(result);
        return null;
    }

    @Override
    public Void visitIf(IfStatement statement) {
        runtime.pushBlock(evaluator.test(statement.condition) ? statement.thenBody : statement.elseBody);
        return null;
    }

    @Override
    public Void visitPerform(PerformStatement statement) {
        long count;
        if (statement.times != null) {
            BigDecimal times = evaluator.number(statement.times).setScale(0, RoundingMode.DOWN);
            count = times.signum() <= 0 ? 0 : times.min(BigDecimal.valueOf(Long.MAX_VALUE)).longValue();
        } else {
            count = statement.until != null ? -1 : 1;
        }
        runtime.pushLoop(new Cursor.Loop(statement, count));
        return null;
    }

    @Override
    public Void visitDisplay(DisplayStatement statement) {
        StringBuilder line = new StringBuilder();
        for (Operand value : statement.values) {
            line.append(evaluator.text(value));
        }
        runtime.display(line.toString());
        return null;
    }

    @Override
    public Void visitAccept(AcceptStatement statement) {
        VariableCell cell = evaluator.cell(statement.target);
        Optional<String> value = runtime.inputHandler().requestInput(cell.name, cell.type, cell.length);
        if (value.isPresent()) {
            accept(statement.target, value.get());
        } else {
            runtime.suspend(Suspension.accept(runtime.nextToken(), statement.line(), cell),
                    input -> accept(statement.target, input));
        }
        return null;
    }

    private void accept(VariableRef target, String value) {
        String input = value == null ? "" : value;
        runtime.display("> " + input);
        store(target, input);
    }

    @Override
    public Void visitCall(CallStatement statement) {
        String name = evaluator.name(statement.program);
        Program target = runtime.findProgram(name).orElseThrow(() -> new RuntimeAbend(RuntimeAbend.UNDEFINED_PROGRAM,
                "CALL TO UNDEFINED PROGRAM '" + name + "'."));
        List<String> parameters = target.procedureDivision.usingParameters;
        if (parameters.size() != statement.using.size()) {
            throw new RuntimeAbend(RuntimeAbend.PARAMETER_MISMATCH, "PARAMETER MISMATCH. PROGRAM '" + target.id
                    + "' EXPECTS " + parameters.size() + " PARAMETER(S), " + statement.using.size() + " PASSED.");
        }
        Map<String, Integer> aliases = new LinkedHashMap<>();
        for (int i = 0; i < parameters.size(); i++) {
            aliases.put(parameters.get(i), runtime.handleOf(statement.using.get(i).name));
        }
        log.debug("CALL {} with {} argument(s)", target.id, aliases.size());
        runtime.pushFrame(target, aliases);
        return null;
    }

    @Override
    public Void visitExitProgram(ExitProgramStatement statement) {
        if (runtime.getCallDepth() > 1) {
            runtime.popFrame();
        }
        return null;
    }

    @Override
    public Void visitGoback(GobackStatement statement) {
        if (runtime.getCallDepth() > 1) {
            runtime.popFrame();
        } else {
            runtime.stop();
        }
        return null;
    }

    @Override
    public Void visitStopRun(StopRunStatement statement) {
        runtime.stop();
        return null;
    }

    @Override
    public Void visitOpen(OpenStatement statement) {
        files.open(statement);
        return null;
    }

    @Override
    public Void visitClose(CloseStatement statement) {
        files.close(statement);
        return null;
    }

    @Override
    public Void visitRead(ReadStatement statement) {
        files.read(statement);
        return null;
    }

    @Override
    public Void visitWrite(WriteStatement statement) {
        files.write(statement);
        return null;
    }

    @Override
    public Void visitExecCics(ExecCicsStatement statement) {
        cics.execute(statement);
        return null;
    }
}
