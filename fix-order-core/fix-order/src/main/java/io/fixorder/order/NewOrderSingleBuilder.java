package io.fixorder.order;

import io.fixorder.model.FixChecksum;
import io.fixorder.model.FixField;
import io.fixorder.model.FixFieldEncoder;
import io.fixorder.model.FixTags;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes FIX 4.2 NewOrderSingle (35=D) limit orders.
 *
 * <p>Body fields are written in a fixed order: 35, 49, 56, 34, 52, 11, 21, 55, 54, 60, 38, 40,
 * 44. BodyLength(9) counts the body bytes only; CheckSum(10) covers every byte before it.
 */
public final class NewOrderSingleBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(NewOrderSingleBuilder.class);
    private static final DateTimeFormatter SENDING_TIME_FORMATTER =
        DateTimeFormatter.ofPattern("yyyyMMdd-HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final ClOrdIdGenerator clOrdIds;

    public NewOrderSingleBuilder() {
        this(Clock.systemUTC());
    }

    public NewOrderSingleBuilder(Clock clock) {
        this(clock, new MonotonicClOrdIdGenerator(clock));
    }

    public NewOrderSingleBuilder(Clock clock, ClOrdIdGenerator clOrdIds) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.clOrdIds = Objects.requireNonNull(clOrdIds, "clOrdIds");
    }

    public NewOrderSingle build(FixSession session, OrderRequest order) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(order, "order").validate();

        String now = SENDING_TIME_FORMATTER.format(clock.instant());
        int seqNum = session.nextSeqNum();
        String clOrdId = clOrdIds.nextClOrdId();

        List<FixField> body = List.of(
            FixFieldEncoder.field(FixTags.MSG_TYPE, FixTags.MSG_TYPE_NEW_ORDER_SINGLE),
            FixFieldEncoder.field(FixTags.SENDER_COMP_ID, session.senderCompId()),
            FixFieldEncoder.field(FixTags.TARGET_COMP_ID, session.targetCompId()),
            FixFieldEncoder.field(FixTags.MSG_SEQ_NUM, seqNum),
            FixFieldEncoder.field(FixTags.SENDING_TIME, now),
            FixFieldEncoder.field(FixTags.CL_ORD_ID, clOrdId),
            FixFieldEncoder.field(FixTags.HANDL_INST, FixTags.HANDL_INST_AUTOMATED),
            FixFieldEncoder.field(FixTags.SYMBOL, order.symbol()),
            FixFieldEncoder.field(FixTags.SIDE, order.side().fixValue()),
            FixFieldEncoder.field(FixTags.TRANSACT_TIME, now),
            FixFieldEncoder.field(FixTags.ORDER_QTY, order.wholeQuantity()),
            FixFieldEncoder.field(FixTags.ORD_TYPE, FixTags.ORD_TYPE_LIMIT),
            FixFieldEncoder.price(FixTags.PRICE, order.price())
        );

        StringBuilder bodyText = new StringBuilder(160);
        for (FixField field : body) {
            field.appendTo(bodyText);
        }
        int bodyLength = bodyText.toString().getBytes(StandardCharsets.US_ASCII).length;

        StringBuilder payload = new StringBuilder(bodyLength + 32);
        FixFieldEncoder.field(FixTags.BEGIN_STRING, FixTags.FIX_4_2).appendTo(payload);
        FixFieldEncoder.field(FixTags.BODY_LENGTH, bodyLength).appendTo(payload);
        payload.append(bodyText);

        int checksum = FixChecksum.compute(payload.toString().getBytes(StandardCharsets.US_ASCII));
        FixFieldEncoder.field(FixTags.CHECK_SUM, FixChecksum.format(checksum)).appendTo(payload);

        byte[] bytes = payload.toString().getBytes(StandardCharsets.US_ASCII);
        LOGGER.debug(
            "Built NewOrderSingle [session={}, msgSeqNum={}, clOrdId={}, bytes={}]",
            session.id(),
            seqNum,
            clOrdId,
            bytes.length
        );
        return new NewOrderSingle(bytes, seqNum, clOrdId, now, order);
    }
}
