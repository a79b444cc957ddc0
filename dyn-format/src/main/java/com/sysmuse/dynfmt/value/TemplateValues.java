package com.sysmuse.dynfmt.value;

import com.sysmuse.dynfmt.TemplateValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Adapts plain Java objects to {@link TemplateValue}.
 */
public final class TemplateValues {

    private TemplateValues() {
    }

    public static TemplateValue of(Object value) {
        if (value instanceof TemplateValue templateValue) {
            return templateValue;
        }
        if (isIntegral(value)) {
            return new IntegralValue((Number) value);
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return new FractionalValue((Number) value);
        }
        if (value instanceof CharSequence || value instanceof Character || value instanceof Boolean) {
            return new TextValue(value.toString());
        }
        return new ObjectValue(value);
    }

    public static List<TemplateValue> list(Object... values) {
        List<TemplateValue> result = new ArrayList<>(values.length);
        for (Object value : values) {
            result.add(of(value));
        }
        return result;
    }

    public static List<TemplateValue> list(Collection<?> values) {
        List<TemplateValue> result = new ArrayList<>(values.size());
        for (Object value : values) {
            result.add(of(value));
        }
        return result;
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger
                || value instanceof AtomicInteger
                || value instanceof AtomicLong;
    }
}
