package io.fixorder.model;

public final class FixChecksum {
    private FixChecksum() {
    }

    public static int compute(byte[] bytes) {
        return compute(bytes, 0, bytes.length);
    }

    public static int compute(byte[] bytes, int from, int to) {
        if (from < 0 || to > bytes.length || from > to) {
            throw new IndexOutOfBoundsException("Invalid range [" + from + ", " + to + ") for length " + bytes.length);
        }
        int sum = 0;
        for (int i = from; i < to; i++) {
            sum += bytes[i] & 0xFF;
        }
        return sum % 256;
    }

    public static int compute(CharSequence payload) {
        int sum = 0;
        for (int i = 0; i < payload.length(); i++) {
            sum += payload.charAt(i) & 0xFF;
        }
        return sum % 256;
    }

    public static String format(int checksum) {
        if (checksum < 0 || checksum > 255) {
            throw new IllegalArgumentException("Checksum out of range: " + checksum);
        }
        StringBuilder out = new StringBuilder(3);
        if (checksum < 100) {
            out.append('0');
        }
        if (checksum < 10) {
            out.append('0');
        }
        return out.append(checksum).toString();
    }
}
