package io.fixorder.cli;

import io.fixorder.order.FixSession;
import io.fixorder.order.NewOrderSingle;
import io.fixorder.order.OrderRequest;
import io.fixorder.order.OrderValidationException;
import io.fixorder.transport.OrderEntryListener;
import io.fixorder.transport.TransportOutcome;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

final class ConsoleOrderEntryListener implements OrderEntryListener {
    static final String SENT = "SENT >";
    static final String RECEIVED = "< RECV";
    static final String INFO = "INFO";
    static final String ERROR = "ERROR";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private final PrintWriter out;
    private final PrintWriter err;
    private final Clock clock;

    ConsoleOrderEntryListener(PrintWriter out, PrintWriter err) {
        this(out, err, Clock.systemDefaultZone());
    }

    ConsoleOrderEntryListener(PrintWriter out, PrintWriter err, Clock clock) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onSent(NewOrderSingle message) {
        line(out, SENT, message.toConsoleString());
    }

    @Override
    public void onOutcome(NewOrderSingle message, TransportOutcome outcome) {
        if (outcome instanceof TransportOutcome.Received received) {
            line(out, RECEIVED, received.describe());
        } else if (outcome.failed()) {
            line(err, ERROR, outcome.describe());
        } else {
            line(out, INFO, outcome.describe());
        }
    }

    @Override
    public void onRejected(OrderRequest order, OrderValidationException failure) {
        line(err, ERROR, "Invalid input: " + failure.getMessage());
    }

    @Override
    public void onSequenceReset(FixSession session) {
        line(out, INFO, "Sequence number reset to " + session.peekSeqNum() + ".");
    }

    private synchronized void line(PrintWriter target, String label, String detail) {
        target.println();
        target.println("[" + TIMESTAMP.format(clock.instant().atZone(clock.getZone())) + "] " + label);
        target.println(detail);
        target.flush();
    }
}
