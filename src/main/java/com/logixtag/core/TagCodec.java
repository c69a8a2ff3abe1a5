package com.logixtag.core;

import com.logixtag.error.ErrorType;
import com.logixtag.error.TagCodecException;
import com.logixtag.layout.Layout;
import com.logixtag.layout.PlacedField;
import com.logixtag.types.AtomicHandler;
import com.logixtag.types.TagValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between a tag's raw image and its named field values.
 * <p>
 * Integers are little-endian two's complement, REAL is IEEE-754 single precision and each
 * BOOL is one bit of its host word. Encoding writes only the bytes (for BOOL, only the bit)
 * of the updated fields; every other byte of the image is preserved. For any field {@code f}
 * and valid value {@code v}: {@code decode(encode(image, {f: v}))[f] == v}.
 * <p>
 * The codec is stateless and thread-safe; concurrent calls must use distinct images.
 */
public final class TagCodec {
    private static final Logger log = LoggerFactory.getLogger(TagCodec.class);

    /**
     * Decodes every field of the layout, in layout order.
     *
     * @throws TagCodecException {@code BUFFER_UNDERFLOW} when the image is shorter than the layout
     */
    public Map<String, TagValue> decode(Layout layout, BinaryImage image) throws TagCodecException {
        checkLength(layout, image);
        var buffer = image.buffer();
        var values = new LinkedHashMap<String, TagValue>(layout.size() * 2);
        for (var field : layout.getFields()) {
            values.put(field.getPath(), read(buffer, field));
        }
        return values;
    }

    /**
     * Decodes only the named fields, in the order given.
     *
     * @throws TagCodecException {@code FIELD_NOT_FOUND} for a path the layout does not contain
     */
    public Map<String, TagValue> decode(Layout layout, BinaryImage image, Collection<String> paths) throws TagCodecException {
        var buffer = image.buffer();
        var values = new LinkedHashMap<String, TagValue>(paths.size() * 2);
        for (var path : paths) {
            var field = layout.field(path);
            checkBounds(field, image);
            values.put(path, read(buffer, field));
        }
        return values;
    }

    public TagValue decodeField(Layout layout, BinaryImage image, String path) throws TagCodecException {
        var field = layout.field(path);
        checkBounds(field, image);
        return read(image.buffer(), field);
    }

    /**
     * Encodes the updates into a copy of {@code image}. All updates are validated before any
     * byte is written, so a failing update leaves no partial result.
     *
     * @throws TagCodecException {@code FIELD_NOT_FOUND}, {@code VALUE_RANGE} or
     *                           {@code TYPE_MISMATCH} for the first invalid update
     */
    public BinaryImage encode(Layout layout, BinaryImage image, TagUpdates updates) throws TagCodecException {
        var target = image.copy();
        encodeInPlace(layout, target, updates);
        return target;
    }

    public BinaryImage encode(Layout layout, BinaryImage image, Map<String, TagValue> updates) throws TagCodecException {
        return encode(layout, image, TagUpdates.of(updates));
    }

    /**
     * Like {@link #encode(Layout, BinaryImage, TagUpdates)} but writes into {@code image} itself.
     */
    public void encodeInPlace(Layout layout, BinaryImage image, TagUpdates updates) throws TagCodecException {
        var prepared = new ArrayList<PreparedWrite>(updates.size());
        for (var entry : updates.entries()) {
            prepared.add(prepare(layout, image, entry.getKey(), entry.getValue()));
        }
        var buffer = image.buffer();
        for (var write : prepared) {
            write.apply(buffer);
        }
    }

    /**
     * Encodes each update independently into a copy of {@code image}. Invalid updates are
     * collected per field instead of aborting the call; valid ones are still applied.
     */
    public EncodeResult encodeEach(Layout layout, BinaryImage image, TagUpdates updates) {
        var target = image.copy();
        var buffer = target.buffer();
        var applied = new ArrayList<String>(updates.size());
        var failures = new LinkedHashMap<String, TagCodecException>();
        for (var entry : updates.entries()) {
            try {
                prepare(layout, target, entry.getKey(), entry.getValue()).apply(buffer);
                applied.add(entry.getKey());
            } catch (TagCodecException e) {
                log.warn("Rejected update of '{}' to '{}': {}", entry.getKey(), entry.getValue(), e.getMessage());
                failures.put(entry.getKey(), e);
            }
        }
        return new EncodeResult(target, Collections.unmodifiableList(applied), Collections.unmodifiableMap(failures));
    }

    private PreparedWrite prepare(Layout layout, BinaryImage image, String path, Object raw) throws TagCodecException {
        var field = layout.field(path);
        checkBounds(field, image);
        TagValue value;
        try {
            value = raw instanceof String
                    ? TagValue.parse(field.getKind(), (String) raw)
                    : ((TagValue) raw).coerceTo(field.getKind());
        } catch (TagCodecException e) {
            if (e.getErrorType() == ErrorType.VALUE_RANGE) {
                throw TagCodecException.valueRange(path, field.getByteOffset(), raw, field.getKind().getTypeName());
            }
            throw new TagCodecException(e.getErrorType(), path, field.getByteOffset(), raw,
                    e.getMessage() + " (field '" + path + "' at byte " + field.getByteOffset() + ")");
        }
        return new PreparedWrite(field, value);
    }

    private static TagValue read(ByteBuffer buffer, PlacedField field) {
        var value = AtomicHandler.forKind(field.getKind()).read(buffer, field.getByteOffset(), field.getBitOffset());
        if (log.isTraceEnabled()) {
            log.trace("Decoded '{}' at byte {} = {}", field.getPath(), field.getByteOffset(), value);
        }
        return value;
    }

    private static void checkLength(Layout layout, BinaryImage image) throws TagCodecException {
        if (image.length() < layout.getTotalByteSize()) {
            throw new TagCodecException(ErrorType.BUFFER_UNDERFLOW, null, image.length(), null,
                    "Image has " + image.length() + " bytes, layout needs " + layout.getTotalByteSize());
        }
    }

    private static void checkBounds(PlacedField field, BinaryImage image) throws TagCodecException {
        if (field.endOffset() > image.length()) {
            throw new TagCodecException(ErrorType.BUFFER_UNDERFLOW, field.getPath(), field.getByteOffset(), null,
                    "Field '" + field.getPath() + "' spans bytes " + field.getByteOffset() + ".." + (field.endOffset() - 1)
                            + " but the image has " + image.length() + " bytes");
        }
    }

    private static final class PreparedWrite {
        final PlacedField field;
        final TagValue value;

        PreparedWrite(PlacedField field, TagValue value) {
            this.field = field;
            this.value = value;
        }

        void apply(ByteBuffer buffer) {
            AtomicHandler.forKind(field.getKind()).write(buffer, field.getByteOffset(), field.getBitOffset(), value);
            log.debug("Encoded '{}' at byte {} = {}", field.getPath(), field.getByteOffset(), value);
        }
    }
}
