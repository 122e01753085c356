package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;

import java.util.List;

public final class OpenStatement extends Statement {
    public final List<Target> targets;

    public OpenStatement(List<Target> targets, SourceSpan span) {
        super(span);
        this.targets = List.copyOf(targets);
    }

    public static final class Target {
        public final OpenMode mode;
        public final String fileName;

        public Target(OpenMode mode, String fileName) {
            this.mode = mode;
            this.fileName = fileName;
        }
    }

    @Override
    public StatementKind kind() {
        return StatementKind.OPEN;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitOpen(this);
    }
}
