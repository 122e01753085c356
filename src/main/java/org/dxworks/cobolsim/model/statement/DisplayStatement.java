package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.Operand;

import java.util.List;

public final class DisplayStatement extends Statement {
    public final List<Operand> values;

    public DisplayStatement(List<Operand> values, SourceSpan span) {
        super(span);
        this.values = List.copyOf(values);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.DISPLAY;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitDisplay(this);
    }
}
