package com.logixtag.layout;

import com.logixtag.catalog.FieldDescriptor;
import com.logixtag.types.AtomicKind;
import lombok.Value;

import java.util.Objects;

/**
 * One atomic leaf of a {@link Layout}: where its bytes live inside the tag image.
 * <p>
 * BOOL fields share a 4-byte host word; for them {@code byteOffset} is the word's offset,
 * {@code byteSize} is 4 and {@code bitOffset} is the bit inside the word counted from its
 * least-significant bit. Every other kind has {@code bitOffset == -1}.
 */
@Value
public class PlacedField {
    /** Dotted, indexed path of the leaf, e.g. {@code Loops[1].Kp}. */
    String path;
    FieldDescriptor descriptor;
    AtomicKind kind;
    int byteOffset;
    int bitOffset;
    int byteSize;

    public PlacedField(String path, FieldDescriptor descriptor, AtomicKind kind, int byteOffset, int bitOffset, int byteSize) {
        this.path = Objects.requireNonNull(path, "Path cannot be null");
        this.descriptor = Objects.requireNonNull(descriptor, "FieldDescriptor cannot be null");
        this.kind = Objects.requireNonNull(kind, "AtomicKind cannot be null");
        this.byteOffset = byteOffset;
        this.bitOffset = bitOffset;
        this.byteSize = byteSize;
    }

    public boolean isBitField() {
        return bitOffset >= 0;
    }

    /**
     * Offset of the first byte past this field's span.
     */
    public int endOffset() {
        return byteOffset + byteSize;
    }

    PlacedField relocate(String prefix, int delta) {
        return new PlacedField(prefix + path, descriptor, kind, byteOffset + delta, bitOffset, byteSize);
    }
}
