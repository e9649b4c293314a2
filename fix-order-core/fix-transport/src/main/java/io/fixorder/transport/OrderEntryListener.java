package io.fixorder.transport;

import io.fixorder.order.FixSession;
import io.fixorder.order.NewOrderSingle;
import io.fixorder.order.OrderRequest;
import io.fixorder.order.OrderValidationException;

/**
 * Callbacks for whoever renders the exchange. Invoked on the thread that performs the
 * submission, which is a worker thread when orders go through {@link AsyncOrderEntryClient}.
 */
public interface OrderEntryListener {
    OrderEntryListener NO_OP = new OrderEntryListener() {
    };

    default void onSent(NewOrderSingle message) {
    }

    default void onOutcome(NewOrderSingle message, TransportOutcome outcome) {
    }

    default void onRejected(OrderRequest order, OrderValidationException failure) {
    }

    default void onSequenceReset(FixSession session) {
    }
}
