package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.Condition;
import org.dxworks.cobolsim.model.expression.Operand;

import java.util.List;

/**
 * Inline PERFORM. At most one of {@code until} and {@code times} is set; with neither the
 * body runs once.
 */
public final class PerformStatement extends Statement {
    public final Condition until;
    public final Operand times;
    public final List<Statement> body;

    public PerformStatement(Condition until, Operand times, List<Statement> body, SourceSpan span) {
        super(span);
        this.until = until;
        this.times = times;
        this.body = List.copyOf(body);
    }

    @Override
    public List<List<Statement>> bodies() {
        return List.of(body);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.PERFORM;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitPerform(this);
    }
}
