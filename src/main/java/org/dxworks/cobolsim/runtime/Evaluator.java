package org.dxworks.cobolsim.runtime;

import org.dxworks.cobolsim.model.expression.Condition;
import org.dxworks.cobolsim.model.expression.Expression;
import org.dxworks.cobolsim.model.expression.Figurative;
import org.dxworks.cobolsim.model.expression.FigurativeConstant;
import org.dxworks.cobolsim.model.expression.NumericLiteral;
import org.dxworks.cobolsim.model.expression.Operand;
import org.dxworks.cobolsim.model.expression.ReferenceModification;
import org.dxworks.cobolsim.model.expression.StringLiteral;
import org.dxworks.cobolsim.model.expression.VariableRef;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Resolves operands against the current frame and evaluates conditions and COMPUTE
 * expressions.
 */
final class Evaluator implements Expression.Visitor<BigDecimal> {

    private static final int MAX_INTEGER_EXPONENT = 999;

    private final CobolRuntime runtime;

    Evaluator(CobolRuntime runtime) {
        this.runtime = runtime;
    }

    VariableCell cell(VariableRef ref) {
        return runtime.cell(ref.name);
    }

    /**
     * Character value of an operand, as DISPLAY shows it.
     */
    String text(Operand operand) {
        if (operand instanceof NumericLiteral literal) {
            return literal.value.toPlainString();
        }
        if (operand instanceof StringLiteral literal) {
            return literal.value;
        }
        if (operand instanceof Figurative figurative) {
            return String.valueOf(figurative.constant.getFill());
        }
        VariableRef ref = (VariableRef) operand;
        VariableCell cell = cell(ref);
        return ref.hasRefMod() ? slice(cell, ref.refMod) : cell.getDisplayValue();
    }

    BigDecimal number(Operand operand) {
        if (operand instanceof NumericLiteral literal) {
            return literal.value;
        }
        if (operand instanceof StringLiteral literal) {
            if (!literal.isNumericLooking()) {
                throw new RuntimeAbend(RuntimeAbend.INVALID_NUMERIC_DATA, "NON-NUMERIC OPERAND.");
            }
            return new BigDecimal(literal.value.trim().replaceFirst("^\\+", ""));
        }
        if (operand instanceof Figurative figurative) {
            if (figurative.constant != FigurativeConstant.ZERO) {
                throw new RuntimeAbend(RuntimeAbend.INVALID_NUMERIC_DATA, "NON-NUMERIC OPERAND.");
            }
            return BigDecimal.ZERO;
        }
        VariableRef ref = (VariableRef) operand;
        VariableCell cell = cell(ref);
        if (!ref.hasRefMod()) {
            return cell.getNumericValue();
        }
        String slice = slice(cell, ref.refMod);
        return PicFormatter.parseNumber(slice).orElseThrow(() -> RuntimeAbend.invalidNumeric(slice));
    }

    /**
     * Name carried by a program-name or CICS option operand: a literal's text, or the trimmed
     * content of the data item.
     */
    String name(Operand operand) {
        return text(operand).trim();
    }

    String slice(VariableCell cell, ReferenceModification refMod) {
        checkRange(cell, refMod);
        String image = cell.getStorageImage();
        int start = refMod.start - 1;
        return image.substring(start, Math.min(image.length(), start + refMod.length));
    }

    void checkRange(VariableCell cell, ReferenceModification refMod) {
        if (refMod.start < 1 || refMod.length < 1 || refMod.start > cell.length) {
            throw new RuntimeAbend(RuntimeAbend.REFERENCE_MODIFICATION,
                    "REFERENCE MODIFICATION " + refMod + " OUT OF RANGE FOR '" + cell.name + "'.");
        }
    }

    boolean test(Condition condition) {
        boolean result = condition.operator.test(compare(condition.left, condition.right));
        return condition.negated != result;
    }

    /**
     * Numeric comparison when both sides read as non-blank numbers; otherwise the shorter
     * side is padded with spaces and the texts are compared.
     */
    int compare(Operand left, Operand right) {
        String l = text(left);
        String r = text(right);
        Optional<BigDecimal> ln = PicFormatter.parseComparable(l);
        Optional<BigDecimal> rn = PicFormatter.parseComparable(r);
        if (ln.isPresent() && rn.isPresent()) {
            return Integer.signum(ln.get().compareTo(rn.get()));
        }
        int width = Math.max(l.length(), r.length());
        return Integer.signum(PicFormatter.fitAlphanumeric(l, width).compareTo(PicFormatter.fitAlphanumeric(r, width)));
    }

    BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.signum() == 0) {
            throw new RuntimeAbend(RuntimeAbend.DIVIDE_BY_ZERO, "DIVIDE BY ZERO.");
        }
        return dividend.divide(divisor, MathContext.DECIMAL128);
    }

    @Override
    public BigDecimal visitLiteral(Expression.Literal literal) {
        return literal.value.value;
    }

    @Override
    public BigDecimal visitVariable(Expression.Variable variable) {
        return number(variable.ref);
    }

    @Override
    public BigDecimal visitUnary(Expression.Unary unary) {
        return unary.operand.accept(this).negate();
    }

    @Override
    public BigDecimal visitBinary(Expression.Binary binary) {
        BigDecimal left = binary.left.accept(this);
        BigDecimal right = binary.right.accept(this);
        return switch (binary.operator) {
            case ADD -> left.add(right);
            case SUBTRACT -> left.subtract(right);
            case MULTIPLY -> left.multiply(right);
            case DIVIDE -> divide(left, right);
            case POWER -> power(left, right);
        };
    }

    private BigDecimal power(BigDecimal base, BigDecimal exponent) {
        BigDecimal stripped = exponent.stripTrailingZeros();
        if (stripped.scale() <= 0 && stripped.abs().compareTo(BigDecimal.valueOf(MAX_INTEGER_EXPONENT)) <= 0) {
            int n = stripped.intValueExact();
            return n >= 0 ? base.pow(n) : divide(BigDecimal.ONE, base.pow(-n));
        }
        double result = Math.pow(base.doubleValue(), exponent.doubleValue());
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new RuntimeAbend(RuntimeAbend.INVALID_NUMERIC_DATA, "NON-NUMERIC OPERAND.");
        }
        return BigDecimal.valueOf(result);
    }
}
