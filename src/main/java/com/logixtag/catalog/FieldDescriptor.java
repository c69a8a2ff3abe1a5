package com.logixtag.catalog;

import com.logixtag.error.TagCodecException;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * One named, typed member of a composite type or one Add-On Instruction parameter.
 * Immutable once resolved.
 */
@Value
public class FieldDescriptor {
    String name;
    String typeName;
    /** Number of elements, 0 for a scalar. */
    int arrayLength;
    boolean hidden;
    boolean required;
    boolean visible;
    Usage usage;

    @Builder(toBuilder = true)
    public FieldDescriptor(String name, String typeName, int arrayLength, boolean hidden,
                           boolean required, boolean visible, Usage usage) {
        this.name = Objects.requireNonNull(name, "Field name cannot be null");
        this.typeName = Objects.requireNonNull(typeName, "Type name of '" + name + "' cannot be null");
        if (arrayLength < 0) {
            throw new IllegalArgumentException("Array length of '" + name + "' cannot be negative: " + arrayLength);
        }
        this.arrayLength = arrayLength;
        this.hidden = hidden;
        this.required = required;
        this.visible = visible;
        this.usage = usage == null ? Usage.MEMBER : usage;
    }

    public static class FieldDescriptorBuilder {
        private boolean visible = true;
        private Usage usage = Usage.MEMBER;
    }

    public static FieldDescriptor of(String name, String typeName) {
        return builder().name(name).typeName(typeName).build();
    }

    public static FieldDescriptor array(String name, String typeName, int arrayLength) {
        return builder().name(name).typeName(typeName).arrayLength(arrayLength).build();
    }

    public boolean isArray() {
        return arrayLength > 0;
    }

    /**
     * Descriptor of a single element of this array member, named {@code name[index]}.
     */
    public FieldDescriptor element(int index) {
        return toBuilder().name(name + "[" + index + "]").arrayLength(0).build();
    }

    /**
     * Parses a declared dimension. Absent or blank text means a scalar.
     *
     * @throws TagCodecException {@code MALFORMED_DIMENSION} when the text is not a non-negative integer
     */
    public static int parseDimension(String fieldName, String dimension) throws TagCodecException {
        if (dimension == null || dimension.isBlank()) return 0;
        try {
            int parsed = Integer.parseInt(dimension.trim());
            if (parsed < 0) throw TagCodecException.malformedDimension(fieldName, dimension);
            return parsed;
        } catch (NumberFormatException e) {
            throw TagCodecException.malformedDimension(fieldName, dimension);
        }
    }
}
