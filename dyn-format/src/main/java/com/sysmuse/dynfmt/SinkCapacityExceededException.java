package com.sysmuse.dynfmt;

import java.io.IOException;

/**
 * Thrown by {@link BoundedSink} when an append does not fit.
 */
public class SinkCapacityExceededException extends IOException {

    private final int capacity;
    private final int requiredLength;

    public SinkCapacityExceededException(int capacity, int requiredLength) {
        super("Sink capacity " + capacity + " exceeded, " + requiredLength + " chars required");
        this.capacity = capacity;
        this.requiredLength = requiredLength;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getRequiredLength() {
        return requiredLength;
    }
}
