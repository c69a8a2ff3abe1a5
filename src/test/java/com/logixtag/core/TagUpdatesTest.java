package com.logixtag.core;

import com.logixtag.types.TagValue;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TagUpdatesTest {

    @Test
    void shouldKeepInsertionOrderAndReplaceRepeatedNames() {
        var updates = TagUpdates.builder()
                .set("EnableIn", true)
                .set("Setpoint", 42)
                .setText("Gain", "1.5")
                .set("Setpoint", 50)
                .build();

        assertThat(updates.names()).containsExactly("EnableIn", "Setpoint", "Gain");
        assertThat(updates.get("Setpoint")).isEqualTo(TagValue.fromDint(50));
        assertThat(updates.get("Gain")).isEqualTo("1.5");
        assertThat(updates.size()).isEqualTo(3);
    }

    @Test
    void shouldPickValueKindFromSetterOverload() {
        var updates = TagUpdates.builder()
                .set("A", (byte) 1)
                .set("B", (short) 1)
                .set("C", 1L)
                .set("D", 1.0f)
                .build();

        assertThat(updates.get("A")).isEqualTo(TagValue.fromSint((byte) 1));
        assertThat(updates.get("B")).isEqualTo(TagValue.fromInt((short) 1));
        assertThat(updates.get("C")).isEqualTo(TagValue.fromLint(1L));
        assertThat(updates.get("D")).isEqualTo(TagValue.fromReal(1.0f));
    }

    @Test
    void shouldApplyConditionalAndBulkSetters() {
        var texts = new LinkedHashMap<String, String>();
        texts.put("Mode", "2");
        texts.put("Output", "-7");

        var updates = TagUpdates.builder()
                .setIf(false, "Skipped", TagValue.fromBool(true))
                .setIf(true, "Kept", TagValue.fromBool(true))
                .setAllText(texts)
                .build();

        assertThat(updates.names()).containsExactly("Kept", "Mode", "Output");
    }

    @Test
    void shouldAcceptMapOfValuesAndText() {
        var updates = TagUpdates.of(Map.of("Gain", TagValue.fromReal(2.0f)));

        assertThat(updates.get("Gain")).isEqualTo(TagValue.fromReal(2.0f));
        assertThat(TagUpdates.builder().build().isEmpty()).isTrue();
    }

    @Test
    void shouldRejectOtherValueTypes() {
        assertThatThrownBy(() -> TagUpdates.of(Map.of("Gain", 2.0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Gain");
    }

    @Test
    void shouldRejectNullValues() {
        assertThatThrownBy(() -> TagUpdates.builder().setText("Gain", null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldBeUnmodifiable() {
        var updates = TagUpdates.builder().set("Setpoint", 1).build();

        assertThatThrownBy(() -> updates.entries().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
