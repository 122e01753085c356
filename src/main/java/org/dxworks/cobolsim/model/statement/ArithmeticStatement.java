package org.dxworks.cobolsim.model.statement;

import org.dxworks.cobolsim.model.SourceSpan;
import org.dxworks.cobolsim.model.expression.Operand;
import org.dxworks.cobolsim.model.expression.VariableRef;

/**
 * ADD / SUBTRACT / MULTIPLY / DIVIDE. The result goes to {@code giving} when present,
 * otherwise to {@code target}, which is then always a data item reference.
 */
public final class ArithmeticStatement extends Statement {
    public final ArithmeticVerb verb;
    public final Operand value;
    public final Operand target;
    public final VariableRef giving;

    public ArithmeticStatement(ArithmeticVerb verb, Operand value, Operand target, VariableRef giving, SourceSpan span) {
        super(span);
        this.verb = verb;
        this.value = value;
        this.target = target;
        this.giving = giving;
    }

    public VariableRef receiver() {
        return giving != null ? giving : (VariableRef) target;
    }

    @Override
    public StatementKind kind() {
        return verb.getKind();
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }
}
