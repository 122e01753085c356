package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;

import java.util.List;

/**
 * Closed set of procedure statements. New kinds must be added to {@link StatementVisitor},
 * so every interpreter pass is forced to handle them.
 */
public abstract sealed class Statement
        permits MoveStatement, ArithmeticStatement, ComputeStatement, IfStatement, PerformStatement,
        DisplayStatement, AcceptStatement, CallStatement, ExitProgramStatement, GobackStatement,
        StopRunStatement, OpenStatement, CloseStatement, ReadStatement, WriteStatement, ExecCicsStatement {

    public final SourceSpan span;

    protected Statement(SourceSpan span) {
        this.span = span;
    }

    public abstract StatementKind kind();

    public abstract <R> R accept(StatementVisitor<R> visitor);

    /**
     * Nested statement lists, in source order. Empty for simple statements.
     */
    public List<List<Statement>> bodies() {
        return List.of();
    }

    public int line() {
        return span.startLine;
    }
}
