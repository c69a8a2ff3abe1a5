package com.logixtag.ops;

import com.logixtag.catalog.TypeCatalog;
import com.logixtag.core.BinaryImage;
import com.logixtag.core.TagCodec;
import com.logixtag.core.TagUpdates;
import com.logixtag.error.ErrorType;
import com.logixtag.error.TagCodecException;
import com.logixtag.layout.Layout;
import com.logixtag.layout.LayoutAssigner;
import com.logixtag.types.TagValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.logixtag.catalog.FieldDescriptor.of;
import static org.assertj.core.api.Assertions.*;

class TagOperationsTest {

    private final TagCodec codec = new TagCodec();
    private Layout layout;

    @BeforeEach
    void setUp() throws TagCodecException {
        layout = new LayoutAssigner(TypeCatalog.builder().build()).assign(List.of(
                of("EnableIn", "BOOL"), of("Setpoint", "DINT"), of("Gain", "REAL"), of("Mode", "SINT")));
    }

    @Test
    void shouldReturnVerifiedImage() throws TagCodecException {
        var updates = TagUpdates.builder()
                .set("EnableIn", true)
                .setText("Setpoint", "250")
                .set("Mode", 3)
                .build();

        var image = TagOperations.encodeAndVerify(codec, layout, BinaryImage.allocate(layout.getTotalByteSize()), updates);

        assertThat(codec.decodeField(layout, image, "Setpoint")).isEqualTo(TagValue.fromDint(250));
        assertThat(codec.decodeField(layout, image, "Mode")).isEqualTo(TagValue.fromSint((byte) 3));
    }

    @Test
    void shouldPropagateEncodeFailures() {
        var updates = TagUpdates.builder().setText("Gain", "fast").build();

        assertThatThrownBy(() -> TagOperations.encodeAndVerify(codec, layout, BinaryImage.allocate(13), updates))
                .isInstanceOf(TagCodecException.class)
                .extracting("errorType").isEqualTo(ErrorType.TYPE_MISMATCH);
    }

    @Test
    void shouldListChangedFieldsInLayoutOrder() throws TagCodecException {
        var before = BinaryImage.allocate(layout.getTotalByteSize());
        var after = codec.encode(layout, before, TagUpdates.builder()
                .set("Mode", (byte) -1)
                .set("EnableIn", true)
                .build());

        var changes = TagOperations.diff(codec, layout, before, after);

        assertThat(changes).extracting(TagOperations.FieldChange::getPath).containsExactly("EnableIn", "Mode");
        assertThat(changes.get(1).getOldValue()).isEqualTo(TagValue.fromSint((byte) 0));
        assertThat(changes.get(1).getNewValue()).isEqualTo(TagValue.fromSint((byte) -1));
        assertThat(changes.get(0)).hasToString("EnableIn: 0 -> 1");
    }

    @Test
    void shouldReportNoChangesForEqualImages() throws TagCodecException {
        var image = BinaryImage.allocate(layout.getTotalByteSize());

        assertThat(TagOperations.diff(codec, layout, image, image.copy())).isEmpty();
    }
}
