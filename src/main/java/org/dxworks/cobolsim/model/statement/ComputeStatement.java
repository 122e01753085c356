package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.Expression;
import org.dxworks.cobolsim.model.expression.VariableRef;

public final class ComputeStatement extends Statement {
    public final VariableRef target;
    public final Expression expression;

    public ComputeStatement(VariableRef target, Expression expression, SourceSpan span) {
        super(span);
        this.target = target;
        this.expression = expression;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.COMPUTE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitCompute(this);
    }
}
