package io.fixorder.transport;

import io.fixorder.model.FixCanonicalizer;
import java.util.Arrays;
import java.util.Objects;

// Refused and TransportError: the order never left the client, or may not have
public sealed interface TransportOutcome
    permits TransportOutcome.Received,
        TransportOutcome.TimedOut,
        TransportOutcome.ClosedByPeer,
        TransportOutcome.Refused,
        TransportOutcome.TransportError {

    default boolean delivered() {
        return !failed();
    }

    default boolean failed() {
        return this instanceof Refused || this instanceof TransportError;
    }

    String describe();

    record Received(byte[] response) implements TransportOutcome {
        public Received {
            response = Objects.requireNonNull(response, "response").clone();
            if (response.length == 0) {
                throw new IllegalArgumentException("response must not be empty");
            }
        }

        @Override
        public byte[] response() {
            return response.clone();
        }

        public int length() {
            return response.length;
        }

        @Override
        public String describe() {
            return FixCanonicalizer.toConsoleString(response);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Received that && Arrays.equals(response, that.response);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(response);
        }

        @Override
        public String toString() {
            return "Received[" + response.length + " bytes]";
        }
    }

    record TimedOut(long waitedMillis) implements TransportOutcome {
        @Override
        public String describe() {
            return "No response after " + waitedMillis + " ms (timeout) - message delivered.";
        }
    }

    record ClosedByPeer() implements TransportOutcome {
        @Override
        public String describe() {
            return "Connection closed by server.";
        }
    }

    record Refused(TransportEndpoint endpoint) implements TransportOutcome {
        public Refused {
            endpoint = Objects.requireNonNull(endpoint, "endpoint");
        }

        @Override
        public String describe() {
            return "Connection refused at " + endpoint;
        }
    }

    record TransportError(TransportEndpoint endpoint, String detail) implements TransportOutcome {
        public TransportError {
            endpoint = Objects.requireNonNull(endpoint, "endpoint");
            detail = Objects.requireNonNullElse(detail, "unknown transport failure");
        }

        @Override
        public String describe() {
            return detail;
        }
    }
}
