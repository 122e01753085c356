package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.Operand;
import org.dxworks.cobolsim.model.expression.VariableRef;

import java.util.List;

public final class CallStatement extends Statement {
    /** Literal program name, or a data item holding it. */
    public final Operand program;
    public final List<VariableRef> using;

    public CallStatement(Operand program, List<VariableRef> using, SourceSpan span) {
        super(span);
        this.program = program;
        this.using = List.copyOf(using);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.CALL;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
