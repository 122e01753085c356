package org.dxworks.cobolsim.runtime;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.dxworks.cobolsim.model.PicType;
import org.dxworks.cobolsim.model.VariableDeclaration;
import org.dxworks.cobolsim.model.expression.Figurative;
import org.dxworks.cobolsim.model.expression.FigurativeConstant;
import org.dxworks.cobolsim.model.expression.NumericLiteral;
import org.dxworks.cobolsim.model.expression.Operand;
import org.dxworks.cobolsim.model.expression.StringLiteral;
import org.dxworks.cobolsim.model.expression.VariableRef;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Storage of one data item. Alphanumeric cells always hold exactly {@code length}
 * characters; numeric cells hold an integer of at most {@code length} digits.
 */
public final class VariableCell {
    public final String name;
    public final PicType type;
    public final int length;

    private String text;
    private BigInteger number;

    VariableCell(String name, PicType type, int length) {
        this.name = name;
        this.type = type;
        this.length = length;
        if (type == PicType.NUMERIC) {
            this.number = BigInteger.ZERO;
        } else {
            this.text = " ".repeat(length);
        }
    }

    static VariableCell declare(VariableDeclaration declaration) {
        VariableCell cell = new VariableCell(declaration.name, declaration.picType, declaration.length);
        Operand initial = declaration.initialValue;
        if (initial instanceof Figurative figurative) {
            cell.fill(figurative.constant);
        } else if (initial instanceof NumericLiteral literal) {
            cell.storeNumber(literal.value);
        } else if (initial instanceof StringLiteral literal) {
            cell.storeText(literal.value);
        } else if (initial instanceof VariableRef) {
            throw new IllegalStateException("VALUE clause of " + declaration.name + " references a data item");
        }
        return cell;
    }

    @JsonIgnore
    public boolean isNumeric() {
        return type == PicType.NUMERIC;
    }

    /**
     * DISPLAY form: the full padded text, or the integer value without leading zeros.
     */
    @JsonProperty("value")
    public String getDisplayValue() {
        return isNumeric() ? number.toString() : text;
    }

    /**
     * Character image used by reference modification: text as stored, or the digits
     * zero-padded to the declared length.
     */
    @JsonIgnore
    public String getStorageImage() {
        if (!isNumeric()) {
            return text;
        }
        String digits = number.abs().toString();
        return digits.length() >= length ? digits : "0".repeat(length - digits.length()) + digits;
    }

    /**
     * Numeric value of the cell; alphanumeric content must read as a number.
     */
    @JsonIgnore
    public BigDecimal getNumericValue() {
        if (isNumeric()) {
            return new BigDecimal(number);
        }
        return PicFormatter.parseNumber(text).orElseThrow(() -> RuntimeAbend.invalidNumeric(text));
    }

    void storeNumber(BigDecimal value) {
        if (isNumeric()) {
            number = PicFormatter.fitNumeric(value, length);
        } else {
            text = PicFormatter.fitAlphanumeric(value.stripTrailingZeros().toPlainString(), length);
        }
    }

    void storeText(String value) {
        if (isNumeric()) {
            BigDecimal parsed = PicFormatter.parseNumber(value).orElseThrow(() -> RuntimeAbend.invalidNumeric(value));
            number = PicFormatter.fitNumeric(parsed, length);
        } else {
            text = PicFormatter.fitAlphanumeric(value, length);
        }
    }

    void fill(FigurativeConstant constant) {
        if (isNumeric()) {
            number = BigInteger.ZERO;
        } else {
            text = String.valueOf(constant.getFill()).repeat(length);
        }
    }

    /**
     * Overwrites {@code count} characters starting at the 0-based {@code offset}; the rest of
     * the item is kept.
     */
    void overwrite(int offset, int count, String value) {
        String image = getStorageImage();
        int end = Math.min(image.length(), offset + count);
        String replaced = image.substring(0, offset)
                + PicFormatter.fitAlphanumeric(value, end - offset)
                + image.substring(end);
        storeText(replaced);
    }

    @Override
    public String toString() {
        return name + "=" + getDisplayValue();
    }
}
