package org.dxworks.cobolsim.model;

import org.dxworks.cobolsim.model.statement.Statement;

import java.util.List;

public final class ProcedureDivision {
    public final List<String> usingParameters;
    public final List<Statement> statements;
    public final SourceSpan span;

    public ProcedureDivision(List<String> usingParameters, List<Statement> statements, SourceSpan span) {
        this.usingParameters = List.copyOf(usingParameters);
        this.statements = List.copyOf(statements);
        this.span = span;
    }
}
