package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.VariableRef;

import java.util.List;

/**
 * READ file [INTO item] [AT END ...]. Without an AT END phrase, reading past the last record
 * is a runtime error.
 */
public final class ReadStatement extends Statement {
    public final String fileName;
    public final VariableRef into;
    public final boolean hasAtEnd;
    public final List<Statement> atEnd;

    public ReadStatement(String fileName, VariableRef into, boolean hasAtEnd, List<Statement> atEnd, SourceSpan span) {
        super(span);
        this.fileName = fileName;
        this.into = into;
        this.hasAtEnd = hasAtEnd;
        this.atEnd = List.copyOf(atEnd);
    }

    @Override
    public List<List<Statement>> bodies() {
        return List.of(atEnd);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.READ;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitRead(this);
    }
}
