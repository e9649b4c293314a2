package io.fixorder.transport;

public interface OrderTransport {
    TransportOutcome send(TransportEndpoint endpoint, byte[] message, TransportTimeouts timeouts);
}
