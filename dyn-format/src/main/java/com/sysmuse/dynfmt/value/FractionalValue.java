package com.sysmuse.dynfmt.value;

import com.sysmuse.dynfmt.TemplateValue;

import java.util.Locale;

/**
 * Float, Double and BigDecimal values. A precision selects a fixed number of
 * fractional digits through {@code %.Nf}; without one the value's own toString is used.
 */
public final class FractionalValue implements TemplateValue {

    private final Number number;

    public FractionalValue(Number number) {
        this.number = number;
    }

    @Override
    public String toText(int precision) {
        if (precision < 0) {
            return String.valueOf(number);
        }
        return String.format(Locale.ROOT, "%." + precision + "f", number);
    }

    /**
     * NaN and Infinity are padded like text.
     */
    @Override
    public boolean isNumeric() {
        if (number instanceof Double d) {
            return !d.isNaN() && !d.isInfinite();
        }
        if (number instanceof Float f) {
            return !f.isNaN() && !f.isInfinite();
        }
        return true;
    }

    @Override
    public String toString() {
        return String.valueOf(number);
    }
}
