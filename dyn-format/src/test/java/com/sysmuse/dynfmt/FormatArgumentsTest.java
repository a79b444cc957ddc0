package com.sysmuse.dynfmt;

import com.sysmuse.dynfmt.value.TemplateValues;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FormatArgumentsTest {

    @Test
    public void testToStringRenders() {
        FormatArguments args = FormatArguments.of("{}-{}", 1, 2);
        assertEquals("1-2", args.toString());
        assertEquals("{}-{}", args.getTemplate());
        assertEquals(2, args.getArguments().size());
    }

    @Test
    public void testWriteToSink() throws Exception {
        BoundedSink sink = new BoundedSink(16);
        FormatArguments.of("{}{}{}", 1, 2, 3).writeTo(sink);
        assertEquals("123", sink.toString());
    }

    @Test
    public void testUsableWithStringFormat() {
        FormatArguments args = FormatArguments.of("{}-{}", 1, 2);
        assertEquals("[   1-2]", String.format("[%6s]", args));
        assertEquals("[1-2   ]", String.format("[%-6s]", args));
        assertEquals("[1-]", String.format("[%.2s]", args));
        assertEquals("[1-2]", String.format("[%s]", args));
    }

    @Test
    public void testUpperCaseFlag() {
        FormatArguments args = FormatArguments.of("ab{}", "c");
        assertEquals("ABC", String.format("%S", args));
        assertEquals("[  AB]", String.format("[%4.2S]", args));
        assertEquals("abc", String.format("%s", args));
    }

    @Test
    public void testNestedAsArgument() {
        FormatArguments inner = FormatArguments.of("{}{}", "a", "b");
        assertEquals("<   ab>", DynamicFormat.format("<{:5}>", inner));
        assertEquals("<a>", DynamicFormat.format("<{:.1}>", inner));
    }

    @Test
    public void testArgumentsAreCopied() {
        List<TemplateValue> values = new ArrayList<>(TemplateValues.list(1));
        FormatArguments args = new FormatArguments("{}{}", values);
        values.add(TemplateValues.of(2));
        assertEquals("1", args.toString());
        assertThrows(UnsupportedOperationException.class, () -> args.getArguments().add(TemplateValues.of(3)));
    }

    @Test
    public void testCustomFormatter() {
        FormatArguments args = new FormatArguments("{}{0:3", TemplateValues.list(9),
                new DynamicFormatter(UnterminatedPlaceholderMode.DROP));
        assertEquals("9", args.toString());
    }
}
