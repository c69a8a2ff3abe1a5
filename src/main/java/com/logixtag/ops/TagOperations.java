package com.logixtag.ops;

import com.logixtag.core.BinaryImage;
import com.logixtag.core.TagCodec;
import com.logixtag.core.TagUpdates;
import com.logixtag.error.ErrorType;
import com.logixtag.error.TagCodecException;
import com.logixtag.layout.Layout;
import com.logixtag.types.TagValue;
import lombok.Value;
import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Caller-side helpers built on {@link TagCodec}: the encode-then-read-back check applied
 * after every write, and comparison of two images field by field.
 */
@UtilityClass
public class TagOperations {
    private static final Logger log = LoggerFactory.getLogger(TagOperations.class);

    /**
     * Encodes the updates, decodes the updated fields from the result and checks that each
     * one reads back as written.
     *
     * @throws TagCodecException {@code VERIFICATION_FAILED} naming the first field that does not
     *                           read back, or any error of {@link TagCodec#encode}
     */
    public static BinaryImage encodeAndVerify(TagCodec codec, Layout layout, BinaryImage image, TagUpdates updates)
            throws TagCodecException {
        var encoded = codec.encode(layout, image, updates);
        var readBack = codec.decode(layout, encoded, updates.names());
        for (var entry : updates.entries()) {
            var path = entry.getKey();
            var field = layout.field(path);
            var expected = entry.getValue() instanceof String
                    ? TagValue.parse(field.getKind(), (String) entry.getValue())
                    : ((TagValue) entry.getValue()).coerceTo(field.getKind());
            var actual = readBack.get(path);
            if (!expected.equals(actual)) {
                throw new TagCodecException(ErrorType.VERIFICATION_FAILED, path, field.getByteOffset(), expected,
                        "Field '" + path + "' reads back " + actual + " after writing " + expected);
            }
        }
        log.debug("Verified {} updated fields", updates.size());
        return encoded;
    }

    /**
     * Fields whose decoded values differ between two images of the same layout, in layout order.
     */
    public static List<FieldChange> diff(TagCodec codec, Layout layout, BinaryImage before, BinaryImage after)
            throws TagCodecException {
        var oldValues = codec.decode(layout, before);
        var newValues = codec.decode(layout, after);
        var changes = new ArrayList<FieldChange>();
        for (var entry : oldValues.entrySet()) {
            var newValue = newValues.get(entry.getKey());
            if (!Objects.equals(entry.getValue(), newValue)) {
                changes.add(new FieldChange(entry.getKey(), entry.getValue(), newValue));
            }
        }
        return changes;
    }

    @Value
    public static class FieldChange {
        String path;
        TagValue oldValue;
        TagValue newValue;

        @Override
        public String toString() {
            return path + ": " + oldValue + " -> " + newValue;
        }
    }
}
