package com.sysmuse.dynfmt;

/**
 * What to write for one placeholder: the value (null when unresolved) and its padding and precision.
 */
final class ResolvedDirective {

    static final int NONE = -1;

    static final ResolvedDirective UNRESOLVED = new ResolvedDirective(null, ' ', NONE, NONE);

    private final TemplateValue value;
    private final char padChar;
    private final int width;
    private final int precision;

    ResolvedDirective(TemplateValue value, char padChar, int width, int precision) {
        this.value = value;
        this.padChar = padChar;
        this.width = width;
        this.precision = precision;
    }

    boolean isResolved() {
        return value != null;
    }

    TemplateValue getValue() {
        return value;
    }

    char getPadChar() {
        return padChar;
    }

    int getWidth() {
        return width;
    }

    boolean hasWidth() {
        return width != NONE;
    }

    int getPrecision() {
        return precision;
    }

    boolean hasPrecision() {
        return precision != NONE;
    }
}
