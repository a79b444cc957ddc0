package com.sysmuse.dynfmt;

import com.sysmuse.dynfmt.util.FormatConfig;
import com.sysmuse.dynfmt.util.LoggingUtil;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Renders runtime templates such as {@code "{}a{1:04}b{:6.2}"} against an ordered argument list.
 *
 * <p>Placeholder syntax is {@code {position:width.precision}}, every part optional:
 * <ul>
 *   <li>position: argument index, surrounding whitespace allowed; empty takes the next
 *       argument in order. Indexed references never move that sequential cursor.</li>
 *   <li>width: minimum length, left padded; a leading {@code 0} pads with zeros.</li>
 *   <li>precision: handed to the value, e.g. fractional digits for doubles.</li>
 * </ul>
 * <code>{{</code> and <code>}}</code> write a single brace. Missing arguments, bad indexes and
 * unparsable sub-fields render as nothing; extra arguments are ignored. The only error
 * is an {@link IOException} from the sink, which stops the render with whatever was
 * already written left in place.
 *
 * <p>The template is scanned once, left to right, and written to the sink as it goes.
 * Instances hold no per-render state and can be shared between threads.
 */
public class DynamicFormatter {

    static final char OPEN = '{';
    static final char CLOSE = '}';
    static final char WIDTH_SEPARATOR = ':';
    static final char PRECISION_SEPARATOR = '.';

    private final UnterminatedPlaceholderMode unterminatedMode;

    public DynamicFormatter() {
        this(UnterminatedPlaceholderMode.LITERAL);
    }

    public DynamicFormatter(UnterminatedPlaceholderMode unterminatedMode) {
        this.unterminatedMode = Objects.requireNonNull(unterminatedMode, "unterminatedMode");
    }

    public DynamicFormatter(FormatConfig config) {
        this(config.getUnterminatedPlaceholderMode());
    }

    public UnterminatedPlaceholderMode getUnterminatedMode() {
        return unterminatedMode;
    }

    /**
     * Render {@code template} with {@code arguments} into {@code sink}.
     *
     * @throws IOException when the sink fails; nothing already written is undone
     */
    public void render(CharSequence template, List<? extends TemplateValue> arguments, Appendable sink) throws IOException {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(arguments, "arguments");
        Objects.requireNonNull(sink, "sink");

        ArgumentCursor cursor = new ArgumentCursor(arguments);
        PlaceholderSpec spec = new PlaceholderSpec();
        ParserState state = ParserState.LITERAL;
        int length = template.length();
        int pieceStart = 0;
        int pos = 0;

        try {
            while (true) {
                if (!state.isSpec()) {
                    if (pos >= length) {
                        appendSpan(sink, template, pieceStart, length);
                        return;
                    }
                    char c = template.charAt(pos);
                    if (c != OPEN && c != CLOSE) {
                        pos++;
                        continue;
                    }

                    appendSpan(sink, template, pieceStart, pos);
                    pos++;
                    if (pos >= length) {
                        if (LoggingUtil.isTraceEnabled()) {
                            LoggingUtil.trace("Dropping trailing '" + c + "'");
                        }
                        return;
                    }
                    if (c == OPEN) {
                        spec.reset(pos);
                        state = ParserState.SPEC_POSITION;
                    } else {
                        // the char after '}' starts the next span unscanned, so "}}" writes one '}'
                        pieceStart = pos;
                        pos++;
                    }
                    continue;
                }

                if (pos >= length) {
                    finishUnterminated(template, spec, sink);
                    return;
                }

                char c = template.charAt(pos);
                switch (c) {
                    case CLOSE:
                        PlaceholderRenderer.render(SpecResolver.resolve(template, spec, cursor), sink);
                        pos++;
                        pieceStart = pos;
                        state = ParserState.LITERAL;
                        break;
                    case OPEN:
                        // abandon the placeholder; this '{' starts the next span, so "{{" writes one '{'
                        pieceStart = pos;
                        pos++;
                        state = ParserState.LITERAL;
                        break;
                    case WIDTH_SEPARATOR:
                        pos++;
                        if (state == ParserState.SPEC_POSITION) {
                            spec.beginWidth(pos);
                            state = ParserState.SPEC_WIDTH;
                        } else {
                            spec.extend(state);
                        }
                        break;
                    case PRECISION_SEPARATOR:
                        pos++;
                        if (state == ParserState.SPEC_WIDTH) {
                            spec.beginPrecision(pos);
                            state = ParserState.SPEC_PRECISION;
                        } else {
                            spec.extend(state);
                        }
                        break;
                    default:
                        pos++;
                        spec.extend(state);
                        break;
                }
            }
        } catch (IOException e) {
            LoggingUtil.debug("Sink failed while rendering template at offset " + pos, e);
            throw e;
        }
    }

    /**
     * Render into a new String.
     */
    public String format(CharSequence template, List<? extends TemplateValue> arguments) {
        StringBuilder out = new StringBuilder(template.length() + 16);
        try {
            render(template, arguments, out);
        } catch (IOException e) {
            // StringBuilder.append does not throw
            throw new IllegalStateException("Unexpected I/O failure writing to a StringBuilder", e);
        }
        return out.toString();
    }

    private void finishUnterminated(CharSequence template, PlaceholderSpec spec, Appendable sink) throws IOException {
        int start = spec.getOpenOffset();
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Unterminated placeholder at offset " + (start - 1) + " handled as " + unterminatedMode);
        }
        if (unterminatedMode == UnterminatedPlaceholderMode.LITERAL) {
            appendSpan(sink, template, start, template.length());
        }
    }

    private static void appendSpan(Appendable sink, CharSequence template, int start, int end) throws IOException {
        if (start < end) {
            sink.append(template, start, end);
        }
    }
}
