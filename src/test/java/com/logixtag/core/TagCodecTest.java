package com.logixtag.core;

import com.logixtag.catalog.TypeCatalog;
import com.logixtag.error.ErrorType;
import com.logixtag.error.TagCodecException;
import com.logixtag.layout.Layout;
import com.logixtag.layout.LayoutAssigner;
import com.logixtag.types.TagValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.logixtag.catalog.FieldDescriptor.array;
import static com.logixtag.catalog.FieldDescriptor.of;
import static org.assertj.core.api.Assertions.*;

class TagCodecTest {

    private final TagCodec codec = new TagCodec();
    private Layout layout;

    /*
     * Offsets of the test layout:
     *   0  Enable (bit 0), Done (bit 1)    4  Count (SINT)    6  Level (INT)
     *   8  Setpoint (DINT)                12  Gain (REAL)    16  Total (LINT)
     *  24  Axes[0].Kp  28 Axes[0].Ki  32 Axes[1].Kp  36 Axes[1].Ki       total 40
     */
    @BeforeEach
    void setUp() throws TagCodecException {
        var catalog = TypeCatalog.builder()
                .composite("Pair", of("Kp", "REAL"), of("Ki", "REAL"))
                .build();
        layout = new LayoutAssigner(catalog).assign(List.of(
                of("Enable", "BOOL"),
                of("Count", "SINT"),
                of("Level", "INT"),
                of("Setpoint", "DINT"),
                of("Gain", "REAL"),
                of("Total", "LINT"),
                of("Done", "BOOL"),
                array("Axes", "Pair", 2)));
    }

    private static BinaryImage filled(int length, int fill) {
        var bytes = new byte[length];
        for (int i = 0; i < length; i++) bytes[i] = (byte) fill;
        return BinaryImage.wrap(bytes);
    }

    @Test
    void shouldMatchDocumentedOffsets() {
        assertThat(layout.getTotalByteSize()).isEqualTo(40);
        assertThat(layout.findField("Done").getBitOffset()).isEqualTo(1);
        assertThat(layout.findField("Axes[1].Ki").getByteOffset()).isEqualTo(36);
    }

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        void shouldDecodeEveryKind() throws TagCodecException {
            var bytes = new byte[40];
            bytes[0] = 0b10;                        // Done set, Enable clear
            bytes[4] = (byte) 0xFF;                 // Count = -1
            bytes[6] = (byte) 0x18; bytes[7] = (byte) 0xFC;   // Level = -1000
            bytes[8] = 0x2A;                        // Setpoint = 42
            int gain = Float.floatToIntBits(2.5f);
            bytes[12] = (byte) gain; bytes[13] = (byte) (gain >> 8);
            bytes[14] = (byte) (gain >> 16); bytes[15] = (byte) (gain >> 24);
            bytes[23] = (byte) 0x80;                // Total = Long.MIN_VALUE

            var values = codec.decode(layout, BinaryImage.wrap(bytes));

            assertThat(values).containsEntry("Enable", TagValue.fromBool(false))
                    .containsEntry("Done", TagValue.fromBool(true))
                    .containsEntry("Count", TagValue.fromSint((byte) -1))
                    .containsEntry("Level", TagValue.fromInt((short) -1000))
                    .containsEntry("Setpoint", TagValue.fromDint(42))
                    .containsEntry("Gain", TagValue.fromReal(2.5f))
                    .containsEntry("Total", TagValue.fromLint(Long.MIN_VALUE))
                    .containsEntry("Axes[1].Ki", TagValue.fromReal(0.0f));
            assertThat(values.keySet()).containsExactlyElementsOf(layout.paths());
        }

        @Test
        void shouldDecodeSelectedFieldsInRequestedOrder() throws TagCodecException {
            var image = codec.encode(layout, BinaryImage.allocate(40),
                    TagUpdates.builder().set("Setpoint", 7).set("Axes[0].Kp", 0.5f).build());

            var values = codec.decode(layout, image, List.of("Axes[0].Kp", "Setpoint"));

            assertThat(values.keySet()).containsExactly("Axes[0].Kp", "Setpoint");
            assertThat(codec.decodeField(layout, image, "Setpoint")).isEqualTo(TagValue.fromDint(7));
        }

        @Test
        void shouldRejectShortImage() {
            assertThatThrownBy(() -> codec.decode(layout, BinaryImage.allocate(39)))
                    .isInstanceOf(TagCodecException.class)
                    .extracting("errorType").isEqualTo(ErrorType.BUFFER_UNDERFLOW);
        }

        @Test
        void shouldDecodeFieldsThatFitInShortImage() throws TagCodecException {
            var image = BinaryImage.allocate(12);

            assertThat(codec.decodeField(layout, image, "Setpoint")).isEqualTo(TagValue.fromDint(0));
            assertThatThrownBy(() -> codec.decodeField(layout, image, "Gain"))
                    .isInstanceOf(TagCodecException.class)
                    .extracting("errorType").isEqualTo(ErrorType.BUFFER_UNDERFLOW);
        }

        @Test
        void shouldReportUnknownField() {
            assertThatThrownBy(() -> codec.decodeField(layout, BinaryImage.allocate(40), "Missing"))
                    .isInstanceOf(TagCodecException.class)
                    .extracting("errorType").isEqualTo(ErrorType.FIELD_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("encode")
    class Encode {

        @Test
        void shouldRoundTripEveryKind() throws TagCodecException {
            var updates = TagUpdates.builder()
                    .set("Enable", true)
                    .set("Count", (byte) -128)
                    .set("Level", (short) 32767)
                    .set("Setpoint", Integer.MIN_VALUE)
                    .set("Gain", -0.125f)
                    .set("Total", Long.MAX_VALUE)
                    .set("Done", true)
                    .set("Axes[1].Kp", 3.0f)
                    .build();

            var decoded = codec.decode(layout, codec.encode(layout, BinaryImage.allocate(40), updates));

            for (var path : updates.names()) {
                assertThat(decoded.get(path)).as(path).isEqualTo(updates.get(path));
            }
        }

        @Test
        void shouldNotTouchBytesOutsideUpdatedField() throws TagCodecException {
            var image = filled(40, 0xA5);

            var encoded = codec.encode(layout, image, TagUpdates.builder().set("Level", (short) 0).build());

            for (int i = 0; i < 40; i++) {
                if (i == 6 || i == 7) {
                    assertThat(encoded.byteAt(i)).isZero();
                } else {
                    assertThat(encoded.byteAt(i)).as("byte %d", i).isEqualTo(image.byteAt(i));
                }
            }
        }

        @Test
        void shouldChangeOnlyTheAddressedBit() throws TagCodecException {
            var image = filled(40, 0xFF);

            var encoded = codec.encode(layout, image, TagUpdates.builder().set("Done", false).build());

            assertThat(encoded.byteAt(0)).isEqualTo((byte) 0xFD);
            assertThat(encoded.toByteArray()).startsWith((byte) 0xFD, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF);
            assertThat(codec.decodeField(layout, encoded, "Enable")).isEqualTo(TagValue.fromBool(true));
        }

        @Test
        void shouldLeaveInputImageUnchanged() throws TagCodecException {
            var image = BinaryImage.allocate(40);

            var encoded = codec.encode(layout, image, TagUpdates.builder().set("Setpoint", 99).build());

            assertThat(image.contentEquals(BinaryImage.allocate(40))).isTrue();
            assertThat(encoded.contentEquals(image)).isFalse();
        }

        @Test
        void shouldPreserveTrailingBytesBeyondLayout() throws TagCodecException {
            var image = filled(44, 0x11);

            var encoded = codec.encode(layout, image, TagUpdates.builder().set("Total", 0L).build());

            assertThat(encoded.length()).isEqualTo(44);
            assertThat(encoded.byteAt(43)).isEqualTo((byte) 0x11);
        }

        @Test
        void shouldParseTextUpdates() throws TagCodecException {
            var updates = TagUpdates.builder()
                    .setText("Enable", "1")
                    .setText("Setpoint", "-17")
                    .setText("Gain", "1.5e+000")
                    .build();

            var decoded = codec.decode(layout, codec.encode(layout, BinaryImage.allocate(40), updates));

            assertThat(decoded.get("Enable")).isEqualTo(TagValue.fromBool(true));
            assertThat(decoded.get("Setpoint")).isEqualTo(TagValue.fromDint(-17));
            assertThat(decoded.get("Gain")).isEqualTo(TagValue.fromReal(1.5f));
        }

        @Test
        void shouldCoerceTypedValuesIntoFieldKind() throws TagCodecException {
            var encoded = codec.encode(layout, BinaryImage.allocate(40), Map.of(
                    "Count", TagValue.fromDint(12),
                    "Total", TagValue.fromSint((byte) -3),
                    "Gain", TagValue.fromDint(4)));

            assertThat(codec.decodeField(layout, encoded, "Count")).isEqualTo(TagValue.fromSint((byte) 12));
            assertThat(codec.decodeField(layout, encoded, "Total")).isEqualTo(TagValue.fromLint(-3));
            assertThat(codec.decodeField(layout, encoded, "Gain")).isEqualTo(TagValue.fromReal(4.0f));
        }

        @Test
        void shouldReportValueOutOfRangeWithContext() {
            assertThatThrownBy(() -> codec.encode(layout, BinaryImage.allocate(40),
                    TagUpdates.builder().setText("Count", "200").build()))
                    .isInstanceOf(TagCodecException.class)
                    .extracting("errorType", "subject", "byteOffset", "value")
                    .containsExactly(ErrorType.VALUE_RANGE, "Count", 4, "200");
        }

        @Test
        void shouldNameFieldKindInRangeMessage() {
            assertThatThrownBy(() -> codec.encode(layout, BinaryImage.allocate(40),
                    TagUpdates.builder().setText("Level", "70000").build()))
                    .isInstanceOf(TagCodecException.class)
                    .hasMessage("Value 70000 is out of range for INT field 'Level' at byte 6");
        }

        @Test
        void shouldReportUnknownField() {
            assertThatThrownBy(() -> codec.encode(layout, BinaryImage.allocate(40),
                    TagUpdates.builder().set("Speed", 1).build()))
                    .isInstanceOf(TagCodecException.class)
                    .extracting("errorType").isEqualTo(ErrorType.FIELD_NOT_FOUND);
        }

        @Test
        void shouldApplyNothingWhenAnyUpdateFails() {
            var image = BinaryImage.allocate(40);
            var updates = TagUpdates.builder()
                    .set("Setpoint", 5)
                    .set("Count", 1000)
                    .build();

            assertThatThrownBy(() -> codec.encodeInPlace(layout, image, updates))
                    .isInstanceOf(TagCodecException.class);
            assertThat(image.contentEquals(BinaryImage.allocate(40))).isTrue();
        }

        @Test
        void shouldWriteThroughWrappedArrayInPlace() throws TagCodecException {
            var bytes = new byte[40];

            codec.encodeInPlace(layout, BinaryImage.wrap(bytes), TagUpdates.builder().set("Setpoint", 0x01020304).build());

            assertThat(bytes[8]).isEqualTo((byte) 0x04);
            assertThat(bytes[11]).isEqualTo((byte) 0x01);
        }
    }

    @Nested
    @DisplayName("encodeEach")
    class EncodeEach {

        @Test
        void shouldApplyValidUpdatesAndCollectFailures() throws TagCodecException {
            var updates = TagUpdates.builder()
                    .set("Setpoint", 5)
                    .setText("Count", "999")
                    .set("Unknown", true)
                    .setText("Gain", "0.25")
                    .build();

            var result = codec.encodeEach(layout, BinaryImage.allocate(40), updates);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getApplied()).containsExactly("Setpoint", "Gain");
            assertThat(result.getFailures()).containsOnlyKeys("Count", "Unknown");
            assertThat(result.getFailures().get("Count").getErrorType()).isEqualTo(ErrorType.VALUE_RANGE);
            assertThat(result.getFailures().get("Unknown").getErrorType()).isEqualTo(ErrorType.FIELD_NOT_FOUND);
            assertThat(codec.decodeField(layout, result.getImage(), "Gain")).isEqualTo(TagValue.fromReal(0.25f));
            assertThat(result.getImage().byteAt(4)).isZero();
        }

        @Test
        void shouldSucceedWhenEveryUpdateIsValid() {
            var result = codec.encodeEach(layout, BinaryImage.allocate(40),
                    TagUpdates.builder().set("Enable", true).build());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getImage().byteAt(0)).isEqualTo((byte) 1);
        }
    }
}
