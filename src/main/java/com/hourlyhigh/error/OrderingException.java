package com.hourlyhigh.error;

/**
 * Logical time moved backwards (or failed to move forward) where it must strictly advance.
 * The operation that throws it leaves all prior state untouched.
 */
public class OrderingException extends IllegalStateException {

    private final long requested;
    private final long current;

    public OrderingException(String message, long requested, long current) {
        super(message + ": requested=" + requested + ", current=" + current);
        this.requested = requested;
        this.current = current;
    }

    public long getRequested() {
        return requested;
    }

    public long getCurrent() {
        return current;
    }
}
