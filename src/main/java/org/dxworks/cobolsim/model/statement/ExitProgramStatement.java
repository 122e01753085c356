package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;

public final class ExitProgramStatement extends Statement {

    public ExitProgramStatement(SourceSpan span) {
        super(span);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.EXIT_PROGRAM;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExitProgram(this);
    }
}
