package com.sysmuse.dynfmt;

import com.sysmuse.dynfmt.value.TemplateValues;
import com.sysmuse.dynfmt.value.TextValue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Formattable;
import java.util.FormattableFlags;
import java.util.Formatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A template bound to its arguments, rendered only when written out.
 *
 * Can itself be used as an argument of another template, or as a {@code %s} argument to
 * String.format, in which case width, precision and the '-' and upper-case flags are honored.
 */
public final class FormatArguments implements TemplateValue, Formattable {

    private final String template;
    private final List<TemplateValue> arguments;
    private final DynamicFormatter formatter;

    public FormatArguments(CharSequence template, List<? extends TemplateValue> arguments) {
        this(template, arguments, DynamicFormat.defaultFormatter());
    }

    public FormatArguments(CharSequence template, List<? extends TemplateValue> arguments, DynamicFormatter formatter) {
        this.template = Objects.requireNonNull(template, "template").toString();
        this.arguments = List.copyOf(arguments);
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public static FormatArguments of(CharSequence template, Object... args) {
        return new FormatArguments(template, TemplateValues.list(args));
    }

    public String getTemplate() {
        return template;
    }

    public List<TemplateValue> getArguments() {
        return arguments;
    }

    public void writeTo(Appendable sink) throws IOException {
        formatter.render(template, arguments, sink);
    }

    @Override
    public String toText(int precision) {
        return TextValue.truncate(toString(), precision);
    }

    @Override
    public void formatTo(Formatter target, int flags, int width, int precision) {
        String text = toText(precision);
        if ((flags & FormattableFlags.UPPERCASE) == FormattableFlags.UPPERCASE) {
            text = text.toUpperCase(Locale.ROOT);
        }
        boolean leftJustify = (flags & FormattableFlags.LEFT_JUSTIFY) == FormattableFlags.LEFT_JUSTIFY;
        String pattern = "%" + (leftJustify && width > 0 ? "-" : "") + (width > 0 ? width : "") + "s";
        target.format(pattern, text);
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        try {
            writeTo(out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
