package com.logixtag.types;

import java.nio.ByteBuffer;

/**
 * Reads and writes one atomic value at an absolute position of a little-endian tag image.
 * Handlers never move the buffer's position and never touch bytes outside the value's span;
 * the BOOL handler touches only the addressed bit.
 * <p>
 * Callers coerce values to the handler's kind and check bounds before calling.
 */
public interface AtomicHandler {
    TagValue read(ByteBuffer image, int byteOffset, int bitOffset);
    void write(ByteBuffer image, int byteOffset, int bitOffset, TagValue value);

    AtomicHandler BOOL = new AtomicHandler() {
        @Override
        public TagValue read(ByteBuffer image, int byteOffset, int bitOffset) {
            int b = image.get(byteOffset + (bitOffset >>> 3));
            return TagValue.fromBool(((b >>> (bitOffset & 7)) & 1) != 0);
        }

        @Override
        public void write(ByteBuffer image, int byteOffset, int bitOffset, TagValue value) {
            int index = byteOffset + (bitOffset >>> 3);
            int mask = 1 << (bitOffset & 7);
            int current = image.get(index);
            int updated = ((TagValue.BoolValue) value).getValue() ? (current | mask) : (current & ~mask);
            image.put(index, (byte) updated);
        }
    };

    AtomicHandler SINT8 = new AtomicHandler() {
        @Override
        public TagValue read(ByteBuffer image, int byteOffset, int bitOffset) {
            // signed get sign-extends: 0xFF reads as -1
            return TagValue.fromSint(image.get(byteOffset));
        }

        @Override
        public void write(ByteBuffer image, int byteOffset, int bitOffset, TagValue value) {
            image.put(byteOffset, ((TagValue.SintValue) value).getValue());
        }
    };

    AtomicHandler INT16 = new AtomicHandler() {
        @Override
        public TagValue read(ByteBuffer image, int byteOffset, int bitOffset) {
            return TagValue.fromInt(image.getShort(byteOffset));
        }

        @Override
        public void write(ByteBuffer image, int byteOffset, int bitOffset, TagValue value) {
            image.putShort(byteOffset, ((TagValue.IntValue) value).getValue());
        }
    };

    AtomicHandler DINT32 = new AtomicHandler() {
        @Override
        public TagValue read(ByteBuffer image, int byteOffset, int bitOffset) {
            return TagValue.fromDint(image.getInt(byteOffset));
        }

        @Override
        public void write(ByteBuffer image, int byteOffset, int bitOffset, TagValue value) {
            image.putInt(byteOffset, ((TagValue.DintValue) value).getValue());
        }
    };

    AtomicHandler LINT64 = new AtomicHandler() {
        @Override
        public TagValue read(ByteBuffer image, int byteOffset, int bitOffset) {
            return TagValue.fromLint(image.getLong(byteOffset));
        }

        @Override
        public void write(ByteBuffer image, int byteOffset, int bitOffset, TagValue value) {
            image.putLong(byteOffset, ((TagValue.LintValue) value).getValue());
        }
    };

    AtomicHandler REAL32 = new AtomicHandler() {
        @Override
        public TagValue read(ByteBuffer image, int byteOffset, int bitOffset) {
            // raw bits so NaN payloads survive a decode/encode cycle
            return TagValue.fromReal(Float.intBitsToFloat(image.getInt(byteOffset)));
        }

        @Override
        public void write(ByteBuffer image, int byteOffset, int bitOffset, TagValue value) {
            image.putInt(byteOffset, Float.floatToRawIntBits(((TagValue.RealValue) value).getValue()));
        }
    };

    static AtomicHandler forKind(AtomicKind kind) {
        switch (kind) {
            case BOOL: return BOOL;
            case SINT8: return SINT8;
            case INT16: return INT16;
            case DINT32: return DINT32;
            case LINT64: return LINT64;
            case REAL32: return REAL32;
            default: throw new IllegalArgumentException("No binary handler for " + kind);
        }
    }
}
