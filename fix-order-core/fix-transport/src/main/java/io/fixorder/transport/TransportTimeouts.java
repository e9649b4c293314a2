package io.fixorder.transport;

import java.time.Duration;
import java.util.Objects;

public record TransportTimeouts(Duration connectTimeout, Duration readTimeout, int receiveBufferSize) {
    public static final int DEFAULT_RECEIVE_BUFFER_SIZE = 4096;

    public TransportTimeouts {
        connectTimeout = requirePositive("connectTimeout", connectTimeout);
        readTimeout = requirePositive("readTimeout", readTimeout);
        if (receiveBufferSize <= 0) {
            throw new IllegalArgumentException("receiveBufferSize must be > 0");
        }
    }

    public static TransportTimeouts defaults() {
        return new TransportTimeouts(Duration.ofSeconds(8), Duration.ofSeconds(8), DEFAULT_RECEIVE_BUFFER_SIZE);
    }

    public static TransportTimeouts ofMillis(long connectTimeoutMs, long readTimeoutMs) {
        return new TransportTimeouts(
            Duration.ofMillis(connectTimeoutMs),
            Duration.ofMillis(readTimeoutMs),
            DEFAULT_RECEIVE_BUFFER_SIZE
        );
    }

    int connectTimeoutMillis() {
        return toSocketMillis(connectTimeout);
    }

    int readTimeoutMillis() {
        return toSocketMillis(readTimeout);
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
        return value;
    }

    // socket timeouts are int millis where 0 means infinite
    private static int toSocketMillis(Duration value) {
        long millis = Math.max(1L, value.toMillis());
        return (int) Math.min(Integer.MAX_VALUE, millis);
    }
}
