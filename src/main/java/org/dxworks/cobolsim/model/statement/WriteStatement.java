package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.Operand;

public final class WriteStatement extends Statement {
    public final String recordName;
    /** Null when the record area is written as is. */
    public final Operand from;

    public WriteStatement(String recordName, Operand from, SourceSpan span) {
        super(span);
        this.recordName = recordName;
        this.from = from;
    }

    @Override
    public StatementKind kind() {
        return StatementKind.WRITE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWrite(this);
    }
}
