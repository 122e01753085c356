package org.dxworks.cobolsim.model.expression;

/**
 * A statement operand: a literal, a figurative constant or a data item reference.
 * Variable references are resolved only when the statement executes.
 */
public sealed interface Operand permits NumericLiteral, StringLiteral, Figurative, VariableRef {

    /**
     * Source-like rendering, used in diagnostics.
     */
    String describe();

    default boolean isLiteral() {
        return !(this instanceof VariableRef);
    }
}
