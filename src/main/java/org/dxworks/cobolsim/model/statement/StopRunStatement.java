package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;

public final class StopRunStatement extends Statement {

    public StopRunStatement(SourceSpan span) {
        super(span);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.STOP_RUN;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitStopRun(this);
    }
}
