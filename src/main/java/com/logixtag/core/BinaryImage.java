package com.logixtag.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * The raw memory image of a tag as the controller stores it (little-endian).
 * <p>
 * An image is owned by its caller; the codec never keeps a reference across calls.
 * Only one encode may run against a given image at a time.
 */
public final class BinaryImage {
    private final byte[] bytes;

    private BinaryImage(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps the array without copying. In-place encodes write through to it.
     */
    public static BinaryImage wrap(byte[] bytes) {
        return new BinaryImage(Objects.requireNonNull(bytes, "Image bytes cannot be null"));
    }

    public static BinaryImage copyOf(byte[] bytes) {
        return new BinaryImage(Objects.requireNonNull(bytes, "Image bytes cannot be null").clone());
    }

    /**
     * A zero-filled image of the given length.
     */
    public static BinaryImage allocate(int length) {
        return new BinaryImage(new byte[length]);
    }

    public int length() {
        return bytes.length;
    }

    public byte byteAt(int offset) {
        return bytes[offset];
    }

    public BinaryImage copy() {
        return new BinaryImage(bytes.clone());
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    public boolean contentEquals(BinaryImage other) {
        return other != null && Arrays.equals(bytes, other.bytes);
    }

    /**
     * Little-endian view over the backing array. Only absolute accessors are used on it.
     */
    ByteBuffer buffer() {
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("BinaryImage[").append(bytes.length).append(" bytes:");
        int shown = Math.min(bytes.length, 32);
        for (int i = 0; i < shown; i++) {
            sb.append(' ').append(String.format("%02X", bytes[i] & 0xFF));
        }
        if (shown < bytes.length) sb.append(" ...");
        return sb.append(']').toString();
    }
}
