package io.fixorder.transport;

import io.fixorder.order.FixSession;
import io.fixorder.order.NewOrderSingle;
import io.fixorder.order.NewOrderSingleBuilder;
import io.fixorder.order.OrderRequest;
import io.fixorder.order.OrderValidationException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OrderEntryClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(OrderEntryClient.class);

    private final FixSession session;
    private final NewOrderSingleBuilder builder;
    private final OrderTransport transport;
    private final TransportEndpoint endpoint;
    private final TransportTimeouts timeouts;
    private final OrderEntryListener listener;

    public OrderEntryClient(FixSession session, TransportEndpoint endpoint) {
        this(
            session,
            new NewOrderSingleBuilder(),
            new TcpOrderTransport(),
            endpoint,
            TransportTimeouts.defaults(),
            OrderEntryListener.NO_OP
        );
    }

    public OrderEntryClient(
        FixSession session,
        NewOrderSingleBuilder builder,
        OrderTransport transport,
        TransportEndpoint endpoint,
        TransportTimeouts timeouts,
        OrderEntryListener listener
    ) {
        this.session = Objects.requireNonNull(session, "session");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.listener = Objects.requireNonNullElse(listener, OrderEntryListener.NO_OP);
    }

    public SubmissionResult submit(OrderRequest order) {
        NewOrderSingle message;
        try {
            message = builder.build(session, order);
        } catch (OrderValidationException rejected) {
            LOGGER.info("Order rejected before sending [session={}]: {}", session.id(), rejected.getMessage());
            listener.onRejected(order, rejected);
            throw rejected;
        }

        listener.onSent(message);
        TransportOutcome outcome = transport.send(endpoint, message.payload(), timeouts);
        LOGGER.info(
            "Order exchange complete [session={}, msgSeqNum={}, clOrdId={}, outcome={}]",
            session.id(),
            message.msgSeqNum(),
            message.clOrdId(),
            outcome.getClass().getSimpleName()
        );
        listener.onOutcome(message, outcome);
        return new SubmissionResult(message, outcome);
    }

    public void resetSequence() {
        session.resetSequence();
        LOGGER.info("Sequence number reset [session={}, next={}]", session.id(), session.peekSeqNum());
        listener.onSequenceReset(session);
    }

    public FixSession session() {
        return session;
    }

    public TransportEndpoint endpoint() {
        return endpoint;
    }

    public TransportTimeouts timeouts() {
        return timeouts;
    }
}
