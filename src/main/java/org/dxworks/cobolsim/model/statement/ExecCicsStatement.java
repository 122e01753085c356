package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.Operand;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * EXEC CICS command with its {@code KEYWORD(value)} options in source order.
 * Options written without a value map to null.
 */
public final class ExecCicsStatement extends Statement {
    public final CicsCommand command;
    public final Map<String, Operand> params;

    public ExecCicsStatement(CicsCommand command, Map<String, Operand> params, SourceSpan span) {
        super(span);
        this.command = command;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public Operand param(String name) {
        return params.get(name);
    }

    public boolean hasParam(String name) {
        return params.containsKey(name);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.EXEC_CICS;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExecCics(this);
    }
}
