package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;

public final class GobackStatement extends Statement {

    public GobackStatement(SourceSpan span) {
        super(span);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.GOBACK;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitGoback(this);
    }
}
