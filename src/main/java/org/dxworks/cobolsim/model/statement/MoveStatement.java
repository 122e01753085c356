package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.Operand;
import org.dxworks.cobolsim.model.expression.VariableRef;

public final class MoveStatement extends Statement {
    public final Operand source;
    public final VariableRef target;

    public MoveStatement(Operand source, VariableRef target, SourceSpan span) {
        super(span);
        this.source = source;
        this.target = target;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.MOVE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitMove(this);
    }
}
