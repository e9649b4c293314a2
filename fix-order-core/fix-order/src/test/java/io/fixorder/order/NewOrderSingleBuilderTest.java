package io.fixorder.order;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.fixorder.model.FixChecksum;
import io.fixorder.model.FixIntegrityCheck;
import io.fixorder.model.FixMessage;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class NewOrderSingleBuilderTest {
    private static final Clock FIXED = Clock.fixed(Instant.parse("2026-01-10T10:15:30.250Z"), ZoneOffset.UTC);

    @Test
    void buildsExactWireBytesForBuyLimitOrder() {
        NewOrderSingleBuilder builder = new NewOrderSingleBuilder(FIXED, () -> "ORD-1");
        FixSession session = new FixSession("CLIENT1", "SERVER1");

        NewOrderSingle message = builder.build(session, OrderRequest.limit("aapl", Side.BUY, 100, "150.00"));

        String expected = "8=FIX.4.2|9=125|35=D|49=CLIENT1|56=SERVER1|34=1|52=20260110-10:15:30|11=ORD-1|21=1"
            + "|55=AAPL|54=1|60=20260110-10:15:30|38=100|40=2|44=150.0000|10=188|";
        assertEquals(expected, message.toDisplayString());
        assertEquals(1, message.msgSeqNum());
        assertEquals("ORD-1", message.clOrdId());
        assertEquals("20260110-10:15:30", message.sendingTime());
    }

    @Test
    void scenarioBuyAaplCarriesBusinessFieldsAndValidChecksum() {
        NewOrderSingle message = new NewOrderSingleBuilder(FIXED)
            .build(new FixSession("CLIENT1", "SERVER1"), OrderRequest.parse("AAPL", "BUY", "100", "150.00"));

        String display = message.toDisplayString();
        assertTrue(display.contains("|55=AAPL|"));
        assertTrue(display.contains("|54=1|"));
        assertTrue(display.contains("|38=100|"));
        assertTrue(display.contains("|40=2|"));

        byte[] payload = message.payload();
        int checksumStart = display.lastIndexOf("10=");
        String expectedChecksum = FixChecksum.format(FixChecksum.compute(payload, 0, checksumStart));
        assertEquals(expectedChecksum, message.toFixMessage().get(10));
    }

    @Test
    void writesBodyFieldsInFixedOrder() {
        NewOrderSingle message = new NewOrderSingleBuilder(FIXED)
            .build(new FixSession("CLIENT1", "SERVER1"), OrderRequest.limit("IBM", Side.SELL, 5, "1"));

        assertEquals(
            List.of(8, 9, 35, 49, 56, 34, 52, 11, 21, 55, 54, 60, 38, 40, 44, 10),
            message.toFixMessage().tagOrder()
        );
    }

    @Test
    void checksumAndBodyLengthHoldForRandomOrders() {
        Random random = new Random(42L);
        NewOrderSingleBuilder builder = new NewOrderSingleBuilder();
        FixSession session = new FixSession("SENDER", "TARGET");
        String[] symbols = {"AAPL", "MSFT", "x", "brk.b", "GOOGL", "SPY"};

        for (int i = 0; i < 500; i++) {
            OrderRequest order = OrderRequest.limit(
                symbols[random.nextInt(symbols.length)],
                random.nextBoolean() ? Side.BUY : Side.SELL,
                BigDecimal.valueOf(1 + random.nextInt(1_000_000)),
                BigDecimal.valueOf(1 + random.nextInt(10_000_000), 4)
            );
            byte[] payload = builder.build(session, order).payload();
            String text = new String(payload, StandardCharsets.US_ASCII);

            int bodyStart = text.indexOf("\u000135=") + 1;
            int checksumStart = text.lastIndexOf("\u000110=") + 1;
            FixMessage parsed = FixMessage.fromRaw(payload);
            assertEquals(checksumStart - bodyStart, parsed.getInt(9), text);
            assertEquals(FixChecksum.format(FixChecksum.compute(payload, 0, checksumStart)), parsed.get(10), text);
            assertEquals(3, parsed.get(10).length());
            assertTrue(text.endsWith("\u0001"));
            assertTrue(FixIntegrityCheck.of(payload).valid(), text);
        }
    }

    @Test
    void parsedMessageRecoversOrderParameters() {
        NewOrderSingleBuilder builder = new NewOrderSingleBuilder(FIXED);
        OrderRequest order = OrderRequest.parse(" msft ", "sell", "250.9", "410.125");

        FixMessage parsed = builder.build(new FixSession("CLIENT1", "SERVER1"), order).toFixMessage();

        assertEquals("MSFT", parsed.get(55));
        assertEquals(Side.SELL, Side.parse(parsed.get(54)));
        assertEquals(250, parsed.getInt(38));
        assertEquals(0, new BigDecimal(parsed.get(44)).compareTo(new BigDecimal("410.125")));
        assertEquals("410.1250", parsed.get(44));
        assertEquals("CLIENT1", parsed.senderCompId());
        assertEquals("SERVER1", parsed.targetCompId());
        assertEquals("D", parsed.msgType());
    }

    @Test
    void consumesOneSequenceNumberPerMessage() {
        NewOrderSingleBuilder builder = new NewOrderSingleBuilder(FIXED);
        FixSession session = new FixSession("CLIENT1", "SERVER1");
        OrderRequest order = OrderRequest.limit("AAPL", Side.BUY, 1, "1");

        assertEquals(1, builder.build(session, order).msgSeqNum());
        assertEquals(2, builder.build(session, order).msgSeqNum());
        session.resetSequence();
        assertEquals(1, builder.build(session, order).msgSeqNum());
    }

    @Test
    void rejectsEmptySymbolWithoutConsumingSequence() {
        NewOrderSingleBuilder builder = new NewOrderSingleBuilder(FIXED);
        FixSession session = new FixSession("CLIENT1", "SERVER1");

        OrderValidationException failure = assertThrows(
            OrderValidationException.class,
            () -> builder.build(session, OrderRequest.limit("", Side.BUY, 100, "150.00"))
        );

        assertTrue(failure.getMessage().contains("Symbol"));
        assertEquals(1, session.peekSeqNum());
    }

    @Test
    void rejectsNonPositiveQuantityAndPrice() {
        NewOrderSingleBuilder builder = new NewOrderSingleBuilder(FIXED);
        FixSession session = new FixSession("CLIENT1", "SERVER1");

        assertThrows(OrderValidationException.class, () -> builder.build(session, OrderRequest.limit("AAPL", Side.BUY, 0, "150")));
        assertThrows(OrderValidationException.class, () -> builder.build(session, OrderRequest.limit("AAPL", Side.BUY, 10, "0")));
        assertThrows(OrderValidationException.class, () -> builder.build(session, OrderRequest.limit("AAPL", Side.BUY, 10, "-1.5")));
        assertThrows(
            OrderValidationException.class,
            () -> builder.build(session, OrderRequest.limit("AAPL", Side.BUY, new BigDecimal("0.5"), BigDecimal.ONE))
        );
        assertEquals(1, session.peekSeqNum());
    }

    @Test
    void rejectsValuesThatWouldChangeOnTheWire() {
        NewOrderSingleBuilder builder = new NewOrderSingleBuilder(FIXED);
        FixSession session = new FixSession("CLIENT1", "SERVER1");

        OrderValidationException tooLarge = assertThrows(
            OrderValidationException.class,
            () -> builder.build(session, OrderRequest.limit("AAPL", Side.BUY, new BigDecimal("18446744073709551716"), BigDecimal.ONE))
        );
        assertTrue(tooLarge.getMessage().contains("too large"));

        OrderValidationException roundsToZero = assertThrows(
            OrderValidationException.class,
            () -> builder.build(session, OrderRequest.parse("AAPL", "BUY", "10", "0.00004"))
        );
        assertTrue(roundsToZero.getMessage().startsWith("Price must be > 0"));
        assertEquals(1, session.peekSeqNum());

        NewOrderSingle smallest = builder.build(session, OrderRequest.parse("AAPL", "BUY", String.valueOf(Long.MAX_VALUE), "0.00006"));
        FixMessage parsed = smallest.toFixMessage();
        assertEquals(String.valueOf(Long.MAX_VALUE), parsed.get(38));
        assertEquals("0.0001", parsed.get(44));
    }
}
