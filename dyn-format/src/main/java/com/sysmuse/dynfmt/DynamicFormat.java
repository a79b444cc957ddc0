package com.sysmuse.dynfmt;

import com.sysmuse.dynfmt.value.TemplateValues;

import java.io.IOException;
import java.util.Collection;

/**
 * Static shortcuts over a shared {@link DynamicFormatter} with default settings.
 *
 * <pre>
 * DynamicFormat.format("{}a{}b{}c", 1, 2, 3);   // "1a2b3c"
 * DynamicFormat.format("{2:04}|{0:.2}", 1.5, "x", 7);   // "0007|1.50"
 * </pre>
 */
public final class DynamicFormat {

    private static final DynamicFormatter DEFAULT = new DynamicFormatter();

    private DynamicFormat() {
    }

    static DynamicFormatter defaultFormatter() {
        return DEFAULT;
    }

    public static String format(CharSequence template, Object... args) {
        return DEFAULT.format(template, TemplateValues.list(args));
    }

    /**
     * Each element of {@code args} is one argument; wrap a collection in an array to pass it whole.
     */
    public static String format(CharSequence template, Collection<?> args) {
        return DEFAULT.format(template, TemplateValues.list(args));
    }

    public static void write(Appendable sink, CharSequence template, Object... args) throws IOException {
        DEFAULT.render(template, TemplateValues.list(args), sink);
    }

    public static FormatArguments arguments(CharSequence template, Object... args) {
        return FormatArguments.of(template, args);
    }
}
