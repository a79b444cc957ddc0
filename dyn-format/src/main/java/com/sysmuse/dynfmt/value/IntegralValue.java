package com.sysmuse.dynfmt.value;

import com.sysmuse.dynfmt.TemplateValue;

/**
 * Whole numbers. Precision has no meaning for these and is ignored, same as
 * java.util.Formatter refusing a precision for %d.
 */
public final class IntegralValue implements TemplateValue {

    private final Number number;

    public IntegralValue(Number number) {
        this.number = number;
    }

    @Override
    public String toText(int precision) {
        return String.valueOf(number);
    }

    @Override
    public boolean isNumeric() {
        return true;
    }

    @Override
    public String toString() {
        return String.valueOf(number);
    }
}
