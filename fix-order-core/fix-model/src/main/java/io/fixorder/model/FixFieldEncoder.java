package io.fixorder.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

public final class FixFieldEncoder {
    public static final int PRICE_SCALE = 4;

    private FixFieldEncoder() {
    }

    public static byte[] encode(int tag, long value) {
        return field(tag, value).encode();
    }

    public static byte[] encode(int tag, BigDecimal price) {
        return price(tag, price).encode();
    }

    public static byte[] encode(int tag, String value) {
        return field(tag, value).encode();
    }

    public static FixField field(int tag, long value) {
        return new FixField(tag, Long.toString(value));
    }

    public static FixField field(int tag, String value) {
        return new FixField(tag, Objects.requireNonNull(value, "value").trim());
    }

    public static FixField price(int tag, BigDecimal price) {
        return new FixField(tag, formatPrice(price));
    }

    public static String formatPrice(BigDecimal price) {
        Objects.requireNonNull(price, "price");
        return price.setScale(PRICE_SCALE, RoundingMode.HALF_EVEN).toPlainString();
    }
}
