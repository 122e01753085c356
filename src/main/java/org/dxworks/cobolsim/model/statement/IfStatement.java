package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.Condition;

import java.util.List;

public final class IfStatement extends Statement {
    public final Condition condition;
    public final List<Statement> thenBody;
    /** Empty when there is no ELSE branch. */
    public final List<Statement> elseBody;

    public IfStatement(Condition condition, List<Statement> thenBody, List<Statement> elseBody, SourceSpan span) {
        super(span);
        this.condition = condition;
        this.thenBody = List.copyOf(thenBody);
        this.elseBody = List.copyOf(elseBody);
    }

    @Override
    public List<List<Statement>> bodies() {
        return List.of(thenBody, elseBody);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.IF;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }
}
