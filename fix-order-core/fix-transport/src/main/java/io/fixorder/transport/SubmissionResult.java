package io.fixorder.transport;

import io.fixorder.order.NewOrderSingle;
import java.util.Objects;

public record SubmissionResult(NewOrderSingle message, TransportOutcome outcome) {
    public SubmissionResult {
        message = Objects.requireNonNull(message, "message");
        outcome = Objects.requireNonNull(outcome, "outcome");
    }

    public boolean delivered() {
        return outcome.delivered();
    }
}
