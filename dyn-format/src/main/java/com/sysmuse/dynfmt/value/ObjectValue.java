package com.sysmuse.dynfmt.value;

import com.sysmuse.dynfmt.TemplateValue;

import java.util.Formattable;
import java.util.Formatter;
import java.util.Locale;

/**
 * Fallback for any other object, null included.
 * Formattable objects render themselves and receive the precision; everything else uses
 * String.valueOf and ignores it.
 */
public final class ObjectValue implements TemplateValue {

    private final Object value;

    public ObjectValue(Object value) {
        this.value = value;
    }

    @Override
    public String toText(int precision) {
        if (value instanceof Formattable formattable) {
            StringBuilder out = new StringBuilder();
            try (Formatter formatter = new Formatter(out, Locale.ROOT)) {
                formattable.formatTo(formatter, 0, -1, precision);
            }
            return out.toString();
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
