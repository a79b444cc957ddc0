package com.sysmuse.dynfmt.value;

import com.sysmuse.dynfmt.TemplateValue;

/**
 * Strings, characters and booleans. Precision truncates to that many code points, as %.Ns does.
 */
public final class TextValue implements TemplateValue {

    private final String text;

    public TextValue(String text) {
        this.text = text;
    }

    @Override
    public String toText(int precision) {
        return truncate(text, precision);
    }

    /**
     * Cuts {@code text} down to {@code maxCodePoints} code points; a negative limit leaves it alone.
     */
    public static String truncate(String text, int maxCodePoints) {
        if (maxCodePoints < 0 || maxCodePoints >= text.length()) {
            return text;
        }
        if (maxCodePoints >= text.codePointCount(0, text.length())) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }

    @Override
    public String toString() {
        return text;
    }
}
