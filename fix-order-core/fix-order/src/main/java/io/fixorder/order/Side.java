package io.fixorder.order;

import java.util.Locale;

public enum Side {
    BUY("1"),
    SELL("2");

    private final String fixValue;

    Side(String fixValue) {
        this.fixValue = fixValue;
    }

    public String fixValue() {
        return fixValue;
    }

    public static Side parse(String text) {
        if (text == null || text.isBlank()) {
            throw new OrderValidationException("Side is required");
        }
        return switch (text.trim().toUpperCase(Locale.ROOT)) {
            case "BUY", "B", "1" -> BUY;
            case "SELL", "S", "2" -> SELL;
            default -> throw new OrderValidationException("Unknown side: " + text);
        };
    }
}
