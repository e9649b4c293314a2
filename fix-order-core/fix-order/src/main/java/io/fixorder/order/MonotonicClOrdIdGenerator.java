package io.fixorder.order;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@code ORD-<epochMillis>} identifiers. When the clock has not advanced since the previous
 * identifier the millisecond component is bumped, so values never repeat within one process.
 */
public final class MonotonicClOrdIdGenerator implements ClOrdIdGenerator {
    private static final String PREFIX = "ORD-";

    private final Clock clock;
    private final AtomicLong last = new AtomicLong(Long.MIN_VALUE);

    public MonotonicClOrdIdGenerator() {
        this(Clock.systemUTC());
    }

    public MonotonicClOrdIdGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String nextClOrdId() {
        long now = clock.millis();
        long value = last.updateAndGet(previous -> Math.max(now, previous + 1));
        return PREFIX + value;
    }
}
