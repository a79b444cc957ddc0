package com.sysmuse.dynfmt;

import java.util.List;

/**
 * Read access to the argument list for one render.
 * Sequential reads move forward only; indexed reads leave the sequential position alone.
 */
final class ArgumentCursor {

    private final List<? extends TemplateValue> arguments;
    private int next = 0;

    ArgumentCursor(List<? extends TemplateValue> arguments) {
        this.arguments = arguments;
    }

    /**
     * Returns the next argument not yet taken sequentially, or null once the list is used up.
     */
    TemplateValue next() {
        if (next >= arguments.size()) {
            return null;
        }
        return arguments.get(next++);
    }

    /**
     * Returns the argument at {@code index}, or null when out of range.
     */
    TemplateValue at(int index) {
        if (index < 0 || index >= arguments.size()) {
            return null;
        }
        return arguments.get(index);
    }
}
