package io.fixorder.model;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

// wire order, repeated tags kept; lookups return the last occurrence
public final class FixMessage {
    private final List<FixField> fields;

    FixMessage(List<FixField> fields) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    }

    public static FixMessage fromRaw(String raw) {
        return FixParser.parse(FixCanonicalizer.normalize(raw));
    }

    public static FixMessage fromRaw(byte[] raw) {
        return FixParser.parse(raw);
    }

    public List<FixField> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public String get(int tag) {
        for (int i = fields.size() - 1; i >= 0; i--) {
            FixField field = fields.get(i);
            if (field.tag() == tag) {
                return field.value();
            }
        }
        return null;
    }

    public Optional<String> find(int tag) {
        return Optional.ofNullable(get(tag));
    }

    public boolean has(int tag) {
        return get(tag) != null;
    }

    public int getInt(int tag) {
        String value = get(tag);
        if (value == null) {
            throw new NoSuchElementException("Tag " + tag + " is not present");
        }
        return Integer.parseInt(value);
    }

    public List<String> values(int tag) {
        List<String> out = new ArrayList<>(2);
        for (FixField field : fields) {
            if (field.tag() == tag) {
                out.add(field.value());
            }
        }
        return List.copyOf(out);
    }

    public List<Integer> tagOrder() {
        List<Integer> out = new ArrayList<>(fields.size());
        for (FixField field : fields) {
            out.add(field.tag());
        }
        return List.copyOf(out);
    }

    public String msgType() {
        return get(FixTags.MSG_TYPE);
    }

    public String senderCompId() {
        return get(FixTags.SENDER_COMP_ID);
    }

    public String targetCompId() {
        return get(FixTags.TARGET_COMP_ID);
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder(fields.size() * 12);
        for (FixField field : fields) {
            out.append(field.tag()).append('=').append(field.value()).append('|');
        }
        return out.toString();
    }
}
