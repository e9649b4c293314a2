package io.fixorder.model;

import java.nio.charset.StandardCharsets;

public final class FixCanonicalizer {
    public static final char SOH = '\u0001';
    public static final String PIPE = "|";
    public static final String CONSOLE_SEPARATOR = " | ";

    private FixCanonicalizer() {
    }

    // | and ^A become SOH
    public static byte[] normalize(byte[] raw) {
        byte[] out = new byte[raw.length];
        int write = 0;
        for (int read = 0; read < raw.length; read++) {
            byte value = raw[read];
            if (value == 0x01 || value == '|') {
                out[write++] = 0x01;
                continue;
            }
            if (value == '^' && read + 1 < raw.length && raw[read + 1] == 'A') {
                out[write++] = 0x01;
                read++;
                continue;
            }
            out[write++] = value;
        }
        if (write == out.length) {
            return out;
        }
        byte[] compact = new byte[write];
        System.arraycopy(out, 0, compact, 0, write);
        return compact;
    }

    public static byte[] normalize(String raw) {
        return normalize(raw.getBytes(StandardCharsets.ISO_8859_1));
    }

    public static String toDisplayString(byte[] wire) {
        return toDisplayString(wire, PIPE);
    }

    public static String toDisplayString(byte[] wire, String separator) {
        StringBuilder out = new StringBuilder(wire.length + 16);
        for (byte value : wire) {
            if (value == 0x01) {
                out.append(separator);
            } else {
                out.append((char) (value & 0xFF));
            }
        }
        return out.toString();
    }

    public static String toConsoleString(byte[] wire) {
        String display = toDisplayString(wire, CONSOLE_SEPARATOR);
        if (display.endsWith(CONSOLE_SEPARATOR)) {
            return display.substring(0, display.length() - CONSOLE_SEPARATOR.length());
        }
        return display;
    }
}
