package io.fixorder.order;

import io.fixorder.model.FixFieldEncoder;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;

public record OrderRequest(String symbol, Side side, BigDecimal quantity, BigDecimal price) {
    public OrderRequest {
        symbol = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        side = Objects.requireNonNull(side, "side");
        quantity = Objects.requireNonNull(quantity, "quantity");
        price = Objects.requireNonNull(price, "price");
    }

    public static OrderRequest limit(String symbol, Side side, BigDecimal quantity, BigDecimal price) {
        return new OrderRequest(symbol, side, quantity, price);
    }

    public static OrderRequest limit(String symbol, Side side, long quantity, String price) {
        return new OrderRequest(symbol, side, BigDecimal.valueOf(quantity), parseDecimal("price", price));
    }

    // text as typed on a command line
    public static OrderRequest parse(String symbol, String side, String quantity, String price) {
        return new OrderRequest(symbol, Side.parse(side), parseDecimal("quantity", quantity), parseDecimal("price", price));
    }

    public OrderRequest validate() {
        if (symbol.isEmpty()) {
            throw new OrderValidationException("Symbol must not be empty");
        }
        if (symbol.indexOf('\u0001') >= 0) {
            throw new OrderValidationException("Symbol must not contain the SOH delimiter");
        }
        if (quantity.signum() <= 0) {
            throw new OrderValidationException("Quantity must be > 0: " + quantity.toPlainString());
        }
        long whole;
        try {
            whole = wholeQuantity();
        } catch (ArithmeticException overflow) {
            throw new OrderValidationException("Quantity is too large: " + quantity.toPlainString(), overflow);
        }
        if (whole <= 0) {
            throw new OrderValidationException("Quantity must be at least one whole unit: " + quantity.toPlainString());
        }
        if (price.setScale(FixFieldEncoder.PRICE_SCALE, RoundingMode.HALF_EVEN).signum() <= 0) {
            throw new OrderValidationException("Price must be > 0 at " + FixFieldEncoder.PRICE_SCALE + " decimals: " + price.toPlainString());
        }
        return this;
    }

    // whole units as sent in OrderQty(38); throws ArithmeticException past Long.MAX_VALUE
    public long wholeQuantity() {
        return quantity.setScale(0, RoundingMode.DOWN).longValueExact();
    }

    private static BigDecimal parseDecimal(String name, String text) {
        if (text == null || text.isBlank()) {
            throw new OrderValidationException("Invalid " + name + ": value is required");
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException malformed) {
            throw new OrderValidationException("Invalid " + name + ": " + text, malformed);
        }
    }
}
