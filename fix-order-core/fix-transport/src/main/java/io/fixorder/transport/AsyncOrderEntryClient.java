package io.fixorder.transport;

import io.fixorder.order.OrderRequest;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public final class AsyncOrderEntryClient implements AutoCloseable {
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final OrderEntryClient client;
    private final ExecutorService executor;

    public AsyncOrderEntryClient(OrderEntryClient client) {
        this(client, 1);
    }

    public AsyncOrderEntryClient(OrderEntryClient client, int workers) {
        this.client = Objects.requireNonNull(client, "client");
        if (workers <= 0) {
            throw new IllegalArgumentException("workers must be > 0");
        }
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, r -> {
            Thread thread = new Thread(r, "fix-order-worker-" + pool + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public CompletableFuture<SubmissionResult> submit(OrderRequest order) {
        Objects.requireNonNull(order, "order");
        return CompletableFuture.supplyAsync(() -> client.submit(order), executor);
    }

    public CompletableFuture<Void> resetSequence() {
        return CompletableFuture.runAsync(client::resetSequence, executor);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
