package io.fixorder.order;

import java.util.Objects;

public final class FixSession {
    private final String senderCompId;
    private final String targetCompId;
    private final SequenceCounter sequence;

    public FixSession(String senderCompId, String targetCompId) {
        this(senderCompId, targetCompId, new SequenceCounter());
    }

    public FixSession(String senderCompId, String targetCompId, SequenceCounter sequence) {
        this.senderCompId = requireCompId("senderCompId", senderCompId);
        this.targetCompId = requireCompId("targetCompId", targetCompId);
        this.sequence = Objects.requireNonNull(sequence, "sequence");
    }

    public String senderCompId() {
        return senderCompId;
    }

    public String targetCompId() {
        return targetCompId;
    }

    public int nextSeqNum() {
        return sequence.next();
    }

    public int peekSeqNum() {
        return sequence.peek();
    }

    public void resetSequence() {
        sequence.reset();
    }

    public String id() {
        return senderCompId + "_" + targetCompId;
    }

    @Override
    public String toString() {
        return "FixSession[" + id() + ", nextSeqNum=" + sequence.peek() + "]";
    }

    private static String requireCompId(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new OrderValidationException(name + " must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.indexOf('\u0001') >= 0) {
            throw new OrderValidationException(name + " must not contain the SOH delimiter");
        }
        return trimmed;
    }
}
