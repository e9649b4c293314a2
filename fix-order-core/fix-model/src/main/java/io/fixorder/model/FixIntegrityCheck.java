package io.fixorder.model;

import java.nio.charset.StandardCharsets;

/**
 * BodyLength and CheckSum consistency of a raw, SOH-delimited message.
 *
 * <p>A value of {@code -1} means the field was absent or not numeric.
 */
public record FixIntegrityCheck(
    int declaredBodyLength,
    int actualBodyLength,
    int declaredChecksum,
    int actualChecksum
) {
    private static final byte[] CHECKSUM_PREFIX = "\u000110=".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] BODY_LENGTH_PREFIX = "9=".getBytes(StandardCharsets.US_ASCII);

    public static FixIntegrityCheck of(byte[] raw) {
        int checksumStart = checksumFieldStart(raw);
        int bodyLengthStart = bodyLengthFieldStart(raw);

        int declaredBodyLength = -1;
        int actualBodyLength = -1;
        if (bodyLengthStart >= 0) {
            int valueStart = bodyLengthStart + BODY_LENGTH_PREFIX.length;
            int valueEnd = indexOfSoh(raw, valueStart);
            if (valueEnd > valueStart) {
                declaredBodyLength = parseDigits(raw, valueStart, valueEnd);
                if (checksumStart >= 0) {
                    actualBodyLength = checksumStart - (valueEnd + 1);
                }
            }
        }

        int declaredChecksum = -1;
        int actualChecksum = -1;
        if (checksumStart >= 0) {
            int valueStart = checksumStart + 3;
            int valueEnd = indexOfSoh(raw, valueStart);
            if (valueEnd < 0) {
                valueEnd = raw.length;
            }
            declaredChecksum = valueEnd - valueStart == 3 ? parseDigits(raw, valueStart, valueEnd) : -1;
            actualChecksum = FixChecksum.compute(raw, 0, checksumStart);
        }

        return new FixIntegrityCheck(declaredBodyLength, actualBodyLength, declaredChecksum, actualChecksum);
    }

    public boolean bodyLengthValid() {
        return declaredBodyLength >= 0 && declaredBodyLength == actualBodyLength;
    }

    public boolean checksumValid() {
        return declaredChecksum >= 0 && declaredChecksum == actualChecksum;
    }

    public boolean valid() {
        return bodyLengthValid() && checksumValid();
    }

    // offset of the "10=" field, just past the SOH that ends the preceding field
    private static int checksumFieldStart(byte[] raw) {
        for (int i = raw.length - CHECKSUM_PREFIX.length; i >= 0; i--) {
            if (regionMatches(raw, i, CHECKSUM_PREFIX)) {
                return i + 1;
            }
        }
        return -1;
    }

    private static int bodyLengthFieldStart(byte[] raw) {
        int firstSoh = indexOfSoh(raw, 0);
        if (firstSoh < 0) {
            return -1;
        }
        int candidate = firstSoh + 1;
        return regionMatches(raw, candidate, BODY_LENGTH_PREFIX) ? candidate : -1;
    }

    private static boolean regionMatches(byte[] raw, int offset, byte[] expected) {
        if (offset < 0 || offset + expected.length > raw.length) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (raw[offset + i] != expected[i]) {
                return false;
            }
        }
        return true;
    }

    private static int indexOfSoh(byte[] raw, int from) {
        for (int i = from; i < raw.length; i++) {
            if (raw[i] == 0x01) {
                return i;
            }
        }
        return -1;
    }

    private static int parseDigits(byte[] raw, int from, int to) {
        if (from >= to || to - from > 9) {
            return -1;
        }
        int value = 0;
        for (int i = from; i < to; i++) {
            byte b = raw[i];
            if (b < '0' || b > '9') {
                return -1;
            }
            value = (value * 10) + (b - '0');
        }
        return value;
    }
}
