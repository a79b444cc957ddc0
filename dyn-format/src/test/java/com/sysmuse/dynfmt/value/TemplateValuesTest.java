package com.sysmuse.dynfmt.value;

import com.sysmuse.dynfmt.TemplateValue;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Formattable;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class TemplateValuesTest {

    @Test
    public void testAdapterSelection() {
        assertInstanceOf(IntegralValue.class, TemplateValues.of(42));
        assertInstanceOf(IntegralValue.class, TemplateValues.of(42L));
        assertInstanceOf(IntegralValue.class, TemplateValues.of((byte) 4));
        assertInstanceOf(IntegralValue.class, TemplateValues.of(BigInteger.TEN));
        assertInstanceOf(IntegralValue.class, TemplateValues.of(new AtomicLong(3)));
        assertInstanceOf(FractionalValue.class, TemplateValues.of(2.5));
        assertInstanceOf(FractionalValue.class, TemplateValues.of(2.5f));
        assertInstanceOf(FractionalValue.class, TemplateValues.of(BigDecimal.ONE));
        assertInstanceOf(TextValue.class, TemplateValues.of("x"));
        assertInstanceOf(TextValue.class, TemplateValues.of(new StringBuilder("x")));
        assertInstanceOf(TextValue.class, TemplateValues.of('x'));
        assertInstanceOf(TextValue.class, TemplateValues.of(false));
        assertInstanceOf(ObjectValue.class, TemplateValues.of(null));
        assertInstanceOf(ObjectValue.class, TemplateValues.of(List.of()));
    }

    @Test
    public void testTemplateValuePassesThrough() {
        TemplateValue value = precision -> "v";
        assertSame(value, TemplateValues.of(value));
    }

    @Test
    public void testIntegralIgnoresPrecision() {
        TemplateValue value = TemplateValues.of(-12);
        assertEquals("-12", value.toText(3));
        assertTrue(value.isNumeric());
        assertEquals("12345678901234567890", TemplateValues.of(new BigInteger("12345678901234567890")).toText(2));
    }

    @Test
    public void testFractionalPrecision() {
        assertEquals("0.1", TemplateValues.of(0.1).toText(TemplateValue.NO_PRECISION));
        assertEquals("0.100", TemplateValues.of(0.1).toText(3));
        assertEquals("1000000.00", TemplateValues.of(1_000_000.0).toText(2));
        assertEquals("-2.7", TemplateValues.of(-2.66).toText(1));
        assertTrue(TemplateValues.of(1.0).isNumeric());
        assertFalse(TemplateValues.of(Double.NaN).isNumeric());
        assertFalse(TemplateValues.of(Float.NEGATIVE_INFINITY).isNumeric());
    }

    @Test
    public void testTextTruncation() {
        assertEquals("abc", TemplateValues.of("abc").toText(-1));
        assertEquals("", TemplateValues.of("abc").toText(0));
        assertEquals("😀", TextValue.truncate("😀ab", 1));
        assertEquals("😀a", TextValue.truncate("😀ab", 2));
        assertEquals("😀ab", TextValue.truncate("😀ab", 3));
        assertFalse(TemplateValues.of("-1").isNumeric());
    }

    @Test
    public void testFormattableReceivesPrecision() {
        Formattable formattable = (formatter, flags, width, precision) -> formatter.format("F%d", precision);
        assertEquals("F3", TemplateValues.of(formattable).toText(3));
        assertEquals("F-1", TemplateValues.of(formattable).toText(-1));
    }

    @Test
    public void testPlainObjectsUseToString() {
        assertEquals("null", TemplateValues.of(null).toText(2));
        assertEquals("[1, 2]", TemplateValues.of(List.of(1, 2)).toText(1));
    }

    @Test
    public void testListFromCollection() {
        List<TemplateValue> values = TemplateValues.list(List.of(1, "a", 2.0));
        assertEquals(3, values.size());
        assertEquals("a", values.get(1).toText(-1));
        assertEquals("2.0", values.get(2).toText(-1));
    }
}
