package org.dxworks.cobolsim.model.expression;

import java.util.regex.Pattern;

public final class StringLiteral implements Operand {
    private static final Pattern NUMERIC_LOOKING = Pattern.compile("^\\s*[+-]?[0-9]+(\\.[0-9]+)?\\s*$");

    public final String value;

    public StringLiteral(String value) {
        this.value = value;
    }

    public boolean isNumericLooking() {
        return NUMERIC_LOOKING.matcher(value).matches();
    }

    @Override
    public String describe() {
        return "\"" + value + "\"";
    }
}
