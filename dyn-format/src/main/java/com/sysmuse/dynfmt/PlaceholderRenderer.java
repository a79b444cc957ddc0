package com.sysmuse.dynfmt;

import java.io.IOException;

/**
 * Writes a resolved placeholder: the value's own text, left-padded to the directive's width.
 */
final class PlaceholderRenderer {

    private PlaceholderRenderer() {
    }

    static void render(ResolvedDirective directive, Appendable sink) throws IOException {
        if (!directive.isResolved()) {
            return;
        }

        TemplateValue value = directive.getValue();
        String text = value.toText(directive.getPrecision());
        int padding = directive.hasWidth()
                ? directive.getWidth() - text.codePointCount(0, text.length())
                : 0;
        if (padding <= 0) {
            sink.append(text);
            return;
        }

        char padChar = directive.getPadChar();
        int start = 0;
        // zeros go between the sign and the digits
        if (padChar == '0' && value.isNumeric() && !text.isEmpty()
                && (text.charAt(0) == '-' || text.charAt(0) == '+')) {
            sink.append(text.charAt(0));
            start = 1;
        }
        for (int i = 0; i < padding; i++) {
            sink.append(padChar);
        }
        sink.append(text, start, text.length());
    }
}
