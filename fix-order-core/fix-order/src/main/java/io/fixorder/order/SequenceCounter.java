package io.fixorder.order;

public final class SequenceCounter {
    public static final int DEFAULT_INITIAL_VALUE = 1;

    private final int initialValue;
    private int nextValue;

    public SequenceCounter() {
        this(DEFAULT_INITIAL_VALUE);
    }

    public SequenceCounter(int initialValue) {
        if (initialValue <= 0) {
            throw new IllegalArgumentException("initialValue must be > 0");
        }
        this.initialValue = initialValue;
        this.nextValue = initialValue;
    }

    public synchronized int next() {
        if (nextValue == Integer.MAX_VALUE) {
            throw new IllegalStateException("Sequence number space exhausted; reset the session");
        }
        return nextValue++;
    }

    public synchronized int peek() {
        return nextValue;
    }

    public synchronized void reset() {
        nextValue = initialValue;
    }

    public int initialValue() {
        return initialValue;
    }
}
