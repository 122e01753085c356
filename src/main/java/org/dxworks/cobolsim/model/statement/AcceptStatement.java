package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.VariableRef;

public final class AcceptStatement extends Statement {
    public final VariableRef target;

    public AcceptStatement(VariableRef target, SourceSpan span) {
        super(span);
        this.target = target;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.ACCEPT;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitAccept(this);
    }
}
