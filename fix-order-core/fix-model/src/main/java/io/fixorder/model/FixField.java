package io.fixorder.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

public record FixField(int tag, String value) {
    public FixField {
        if (tag <= 0) {
            throw new IllegalArgumentException("FIX tag must be positive: " + tag);
        }
        value = Objects.requireNonNull(value, "value");
    }

    public static FixField parse(String token) {
        int index = token.indexOf('=');
        if (index < 1) {
            throw new IllegalArgumentException("Invalid FIX token: " + token);
        }
        return new FixField(Integer.parseInt(token.substring(0, index)), token.substring(index + 1));
    }

    public byte[] encode() {
        return appendTo(new StringBuilder(value.length() + 8)).toString().getBytes(StandardCharsets.US_ASCII);
    }

    public StringBuilder appendTo(StringBuilder out) {
        return out.append(tag).append('=').append(value).append(FixCanonicalizer.SOH);
    }

    public int encodedLength() {
        return Integer.toString(tag).length() + 1 + value.length() + 1;
    }
}
