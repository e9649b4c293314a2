package io.fixorder.order;

import io.fixorder.model.FixCanonicalizer;
import io.fixorder.model.FixMessage;
import io.fixorder.model.FixParser;
import java.util.Arrays;
import java.util.Objects;

public record NewOrderSingle(
    byte[] payload,
    int msgSeqNum,
    String clOrdId,
    String sendingTime,
    OrderRequest order
) {
    public NewOrderSingle {
        payload = Objects.requireNonNull(payload, "payload").clone();
        clOrdId = Objects.requireNonNull(clOrdId, "clOrdId");
        sendingTime = Objects.requireNonNull(sendingTime, "sendingTime");
        order = Objects.requireNonNull(order, "order");
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int length() {
        return payload.length;
    }

    public FixMessage toFixMessage() {
        return FixParser.parse(payload);
    }

    public String toDisplayString() {
        return FixCanonicalizer.toDisplayString(payload);
    }

    public String toConsoleString() {
        return FixCanonicalizer.toConsoleString(payload);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof NewOrderSingle that)) {
            return false;
        }
        return msgSeqNum == that.msgSeqNum
            && Arrays.equals(payload, that.payload)
            && clOrdId.equals(that.clOrdId)
            && sendingTime.equals(that.sendingTime)
            && order.equals(that.order);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(payload), msgSeqNum, clOrdId, sendingTime, order);
    }

    @Override
    public String toString() {
        return "NewOrderSingle[msgSeqNum=" + msgSeqNum + ", clOrdId=" + clOrdId + ", " + toDisplayString() + "]";
    }
}
