package com.sysmuse.dynfmt;

import com.sysmuse.dynfmt.util.LoggingUtil;

/**
 * Turns the captured sub-fields of a closed placeholder into a {@link ResolvedDirective}.
 *
 * Position is whitespace-trimmed; width and precision are taken as written. Anything that does not
 * parse as a non-negative decimal int degrades instead of failing: a bad position leaves the
 * placeholder unresolved, a bad width or precision is treated as absent.
 */
final class SpecResolver {

    private static final int INVALID = -2;

    private SpecResolver() {
    }

    static ResolvedDirective resolve(CharSequence template, PlaceholderSpec spec, ArgumentCursor cursor) {
        TemplateValue value = resolveValue(template, spec, cursor);
        if (value == null) {
            return ResolvedDirective.UNRESOLVED;
        }

        int width = ResolvedDirective.NONE;
        char padChar = ' ';
        int widthStart = spec.getWidthStart();
        int widthEnd = spec.getWidthEnd();
        if (widthStart < widthEnd) {
            int parsed = parseNonNegative(template, widthStart, widthEnd);
            if (parsed == INVALID) {
                logIgnored("width", template, widthStart, widthEnd);
            } else {
                width = parsed;
                if (template.charAt(widthStart) == '0') {
                    padChar = '0';
                }
            }
        }

        int precision = ResolvedDirective.NONE;
        int precisionStart = spec.getPrecisionStart();
        int precisionEnd = spec.getPrecisionEnd();
        if (precisionStart < precisionEnd) {
            int parsed = parseNonNegative(template, precisionStart, precisionEnd);
            if (parsed == INVALID) {
                logIgnored("precision", template, precisionStart, precisionEnd);
            } else {
                precision = parsed;
            }
        }

        return new ResolvedDirective(value, padChar, width, precision);
    }

    private static TemplateValue resolveValue(CharSequence template, PlaceholderSpec spec, ArgumentCursor cursor) {
        int start = spec.getPositionStart();
        int end = spec.getPositionEnd();
        while (start < end && isWhiteSpace(template.charAt(start))) {
            start++;
        }
        while (end > start && isWhiteSpace(template.charAt(end - 1))) {
            end--;
        }

        if (start == end) {
            TemplateValue value = cursor.next();
            if (value == null && LoggingUtil.isDebugEnabled()) {
                LoggingUtil.debug("No argument left for sequential placeholder at offset " + (spec.getOpenOffset() - 1));
            }
            return value;
        }

        int index = parseNonNegative(template, start, end);
        if (index == INVALID) {
            if (LoggingUtil.isDebugEnabled()) {
                LoggingUtil.debug("Unparsable placeholder position '" + template.subSequence(start, end) +
                        "' at offset " + (spec.getOpenOffset() - 1));
            }
            return null;
        }

        TemplateValue value = cursor.at(index);
        if (value == null && LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Placeholder index " + index + " out of range at offset " + (spec.getOpenOffset() - 1));
        }
        return value;
    }

    /**
     * Parses chars [start, end) as an unsigned decimal int: ASCII digits with an optional leading '+'.
     * Returns INVALID for anything else, overflow included.
     */
    static int parseNonNegative(CharSequence text, int start, int end) {
        int digitsStart = start < end && text.charAt(start) == '+' ? start + 1 : start;
        if (digitsStart == end) {
            return INVALID;
        }
        for (int i = digitsStart; i < end; i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return INVALID;
            }
        }
        try {
            int value = Integer.parseInt(text, start, end, 10);
            return value < 0 ? INVALID : value;
        } catch (NumberFormatException e) {
            return INVALID;
        }
    }

    /**
     * Unicode White_Space: space separators plus the C0 controls TAB..CR and NEL.
     */
    static boolean isWhiteSpace(char c) {
        return Character.isSpaceChar(c) || (c >= '\t' && c <= '\r') || c == '\u0085';
    }

    private static void logIgnored(String field, CharSequence template, int start, int end) {
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Ignoring unparsable " + field + " '" + template.subSequence(start, end) + "'");
        }
    }
}
