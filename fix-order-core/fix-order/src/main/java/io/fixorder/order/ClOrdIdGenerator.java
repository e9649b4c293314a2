package io.fixorder.order;

@FunctionalInterface
public interface ClOrdIdGenerator {
    String nextClOrdId();
}
