package com.sysmuse.dynfmt;

import java.util.Arrays;

/**
 * Fixed-size output buffer. Its storage is allocated once; an append that would not fit
 * fails with {@link SinkCapacityExceededException} and writes none of its chars.
 */
public class BoundedSink implements Appendable, CharSequence {

    private final char[] buffer;
    private int length = 0;

    public BoundedSink(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + capacity);
        }
        this.buffer = new char[capacity];
    }

    @Override
    public BoundedSink append(CharSequence csq) throws SinkCapacityExceededException {
        CharSequence text = csq == null ? "null" : csq;
        return append(text, 0, text.length());
    }

    @Override
    public BoundedSink append(CharSequence csq, int start, int end) throws SinkCapacityExceededException {
        CharSequence text = csq == null ? "null" : csq;
        if (start < 0 || start > end || end > text.length()) {
            throw new IndexOutOfBoundsException("start " + start + ", end " + end + ", length " + text.length());
        }
        int count = end - start;
        ensureRoom(count);
        for (int i = start; i < end; i++) {
            buffer[length++] = text.charAt(i);
        }
        return this;
    }

    @Override
    public BoundedSink append(char c) throws SinkCapacityExceededException {
        ensureRoom(1);
        buffer[length++] = c;
        return this;
    }

    private void ensureRoom(int count) throws SinkCapacityExceededException {
        if (count > buffer.length - length) {
            throw new SinkCapacityExceededException(buffer.length, length + count);
        }
    }

    public int capacity() {
        return buffer.length;
    }

    public int remaining() {
        return buffer.length - length;
    }

    public void clear() {
        Arrays.fill(buffer, 0, length, '\0');
        length = 0;
    }

    @Override
    public int length() {
        return length;
    }

    @Override
    public char charAt(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("index " + index + ", length " + length);
        }
        return buffer[index];
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        if (start < 0 || start > end || end > length) {
            throw new IndexOutOfBoundsException("start " + start + ", end " + end + ", length " + length);
        }
        return new String(buffer, start, end - start);
    }

    @Override
    public String toString() {
        return new String(buffer, 0, length);
    }
}
