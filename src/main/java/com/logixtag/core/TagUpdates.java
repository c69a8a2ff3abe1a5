package com.logixtag.core;

import com.logixtag.types.TagValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered set of field updates for one encode call.
 * <p>
 * Values are either typed {@link TagValue}s, converted into the field's kind when they fit,
 * or text as a test case supplies it, parsed against the field's kind at encode time.
 * <pre>
 *   var updates = TagUpdates.builder()
 *       .set("EnableIn", true)
 *       .set("Setpoint", 42)
 *       .setText("Gain", "1.5")
 *       .set("Setpoint", 50)      // replaces the earlier Setpoint
 *       .build();
 * </pre>
 */
public final class TagUpdates {
    private final Map<String, Object> values;

    private TagUpdates(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Updates from a map of path to {@link TagValue} or {@link String}.
     */
    public static TagUpdates of(Map<String, ?> updates) {
        var builder = builder();
        for (var entry : updates.entrySet()) {
            builder.setRaw(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Set<Map.Entry<String, Object>> entries() {
        return values.entrySet();
    }

    public Object get(String path) {
        return values.get(path);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "TagUpdates" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder set(String path, boolean value) {
            return setRaw(path, TagValue.fromBool(value));
        }

        public Builder set(String path, byte value) {
            return setRaw(path, TagValue.fromSint(value));
        }

        public Builder set(String path, short value) {
            return setRaw(path, TagValue.fromInt(value));
        }

        public Builder set(String path, int value) {
            return setRaw(path, TagValue.fromDint(value));
        }

        public Builder set(String path, long value) {
            return setRaw(path, TagValue.fromLint(value));
        }

        public Builder set(String path, float value) {
            return setRaw(path, TagValue.fromReal(value));
        }

        public Builder set(String path, TagValue value) {
            return setRaw(path, value);
        }

        public Builder setText(String path, String text) {
            return setRaw(path, text);
        }

        public Builder setIf(boolean condition, String path, TagValue value) {
            return condition ? setRaw(path, value) : this;
        }

        // Bulk operations
        public Builder setAllText(Map<String, String> texts) {
            for (var entry : texts.entrySet()) {
                setRaw(entry.getKey(), entry.getValue());
            }
            return this;
        }

        private Builder setRaw(String path, Object value) {
            Objects.requireNonNull(path, "Field path cannot be null");
            Objects.requireNonNull(value, "Value of '" + path + "' cannot be null");
            if (!(value instanceof TagValue) && !(value instanceof String)) {
                throw new IllegalArgumentException("Value of '" + path + "' must be a TagValue or String, got "
                        + value.getClass().getName());
            }
            values.put(path, value);
            return this;
        }

        public TagUpdates build() {
            return new TagUpdates(new LinkedHashMap<>(values));
        }
    }
}
