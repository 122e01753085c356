package org.dxworks.cobolsim.model.expression;

/**
 * COMPUTE expression tree.
 */
public sealed interface Expression permits Expression.Literal, Expression.Variable, Expression.Unary, Expression.Binary {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitLiteral(Literal literal);

        R visitVariable(Variable variable);

        R visitUnary(Unary unary);

        R visitBinary(Binary binary);
    }

    final class Literal implements Expression {
        public final NumericLiteral value;

        public Literal(NumericLiteral value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    final class Variable implements Expression {
        public final VariableRef ref;

        public Variable(VariableRef ref) {
            this.ref = ref;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    /**
     * Unary minus.
     */
    final class Unary implements Expression {
        public final Expression operand;

        public Unary(Expression operand) {
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    final class Binary implements Expression {
        public final ArithmeticOperator operator;
        public final Expression left;
        public final Expression right;

        public Binary(ArithmeticOperator operator, Expression left, Expression right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }
}
