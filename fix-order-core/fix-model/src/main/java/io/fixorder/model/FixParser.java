package io.fixorder.model;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public final class FixParser {
    private static final byte SOH = 0x01;

    private FixParser() {
    }

    public static FixMessage parse(String canonicalRaw) {
        return parse(canonicalRaw.getBytes(StandardCharsets.ISO_8859_1));
    }

    public static FixMessage parse(byte[] canonicalRaw) {
        return parse(canonicalRaw, 0, canonicalRaw.length);
    }

    public static FixMessage parse(byte[] canonicalRaw, int offset, int length) {
        int end = offset + length;
        if (offset < 0 || length < 0 || end > canonicalRaw.length) {
            throw new IndexOutOfBoundsException("Invalid range offset=" + offset + " length=" + length);
        }
        List<FixField> fields = new ArrayList<>(Math.max(4, length / 8));

        int index = offset;
        while (index < end) {
            while (index < end && isIgnoredLeadingByte(canonicalRaw[index])) {
                index++;
            }
            if (index >= end) {
                break;
            }

            int tag = 0;
            int tagStart = index;
            while (index < end && isDigit(canonicalRaw[index])) {
                tag = (tag * 10) + (canonicalRaw[index] - '0');
                index++;
            }

            if (index == tagStart || index >= end || canonicalRaw[index] != '=') {
                index = skipToDelimiter(canonicalRaw, index, end);
                continue;
            }
            index++;

            int valueStart = index;
            while (index < end && canonicalRaw[index] != SOH) {
                index++;
            }

            if (tag > 0) {
                fields.add(new FixField(tag, new String(canonicalRaw, valueStart, index - valueStart, StandardCharsets.ISO_8859_1)));
            }

            if (index < end && canonicalRaw[index] == SOH) {
                index++;
            }
        }

        return new FixMessage(fields);
    }

    private static boolean isDigit(byte value) {
        return value >= '0' && value <= '9';
    }

    private static boolean isIgnoredLeadingByte(byte value) {
        return value == SOH || value == '\n' || value == '\r';
    }

    private static int skipToDelimiter(byte[] canonicalRaw, int index, int end) {
        int cursor = index;
        while (cursor < end && canonicalRaw[cursor] != SOH) {
            cursor++;
        }
        if (cursor < end && canonicalRaw[cursor] == SOH) {
            cursor++;
        }
        return cursor;
    }
}
