package com.sysmuse.dynfmt;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BoundedSinkTest {

    @Test
    public void testAppendWithinCapacity() throws Exception {
        BoundedSink sink = new BoundedSink(8);
        sink.append("abc").append('d').append("xxefgxx", 2, 5);
        assertEquals("abcdefg", sink.toString());
        assertEquals(7, sink.length());
        assertEquals(1, sink.remaining());
        assertEquals(8, sink.capacity());
        assertEquals('d', sink.charAt(3));
        assertEquals("cde", sink.subSequence(2, 5).toString());
    }

    @Test
    public void testOverflowWritesNothingOfTheFailedAppend() throws Exception {
        BoundedSink sink = new BoundedSink(4);
        sink.append("ab");
        SinkCapacityExceededException e = assertThrows(SinkCapacityExceededException.class, () -> sink.append("cde"));
        assertEquals(4, e.getCapacity());
        assertEquals(5, e.getRequiredLength());
        assertEquals("ab", sink.toString());

        sink.append("cd");
        assertThrows(SinkCapacityExceededException.class, () -> sink.append('e'));
        assertEquals("abcd", sink.toString());
    }

    @Test
    public void testZeroCapacity() throws Exception {
        BoundedSink sink = new BoundedSink(0);
        sink.append("");
        assertThrows(SinkCapacityExceededException.class, () -> sink.append("a"));
        assertEquals("", sink.toString());
    }

    @Test
    public void testNullIsAppendedAsText() throws Exception {
        BoundedSink sink = new BoundedSink(10);
        sink.append(null);
        assertEquals("null", sink.toString());
    }

    @Test
    public void testClear() throws Exception {
        BoundedSink sink = new BoundedSink(3);
        sink.append("abc");
        sink.clear();
        assertEquals(0, sink.length());
        sink.append("xyz");
        assertEquals("xyz", sink.toString());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedSink(-1));
        BoundedSink sink = new BoundedSink(3);
        assertThrows(IndexOutOfBoundsException.class, () -> sink.charAt(0));
        assertThrows(IndexOutOfBoundsException.class, () -> sink.append("abc", 2, 1));
    }
}
