package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;

import java.util.List;

public final class CloseStatement extends Statement {
    public final List<String> fileNames;

    public CloseStatement(List<String> fileNames, SourceSpan span) {
        super(span);
        this.fileNames = List.copyOf(fileNames);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.CLOSE;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitClose(this);
    }
}
