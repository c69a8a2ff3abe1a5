package com.logixtag.config;

import com.logixtag.Constants;
import com.logixtag.literal.RealLiteralStyle;
import lombok.Builder;
import lombok.Value;

/**
 * Settings shared by the layout assigner, the codec and the default-value synthesizer.
 * Defaults can be overridden with system properties:
 * <ul>
 *   <li>{@code logixtag.layout.roundToWord} - round total layout size up to a 4-byte multiple</li>
 *   <li>{@code logixtag.literal.maxDepth} - deepest composite nesting accepted</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class CodecOptions {

    @Builder.Default
    boolean roundTotalToWord = Boolean.parseBoolean(
            System.getProperty("logixtag.layout.roundToWord", "false"));

    @Builder.Default
    int maxNestingDepth = Integer.getInteger(
            "logixtag.literal.maxDepth", Constants.DEFAULT_MAX_NESTING_DEPTH);

    @Builder.Default
    RealLiteralStyle realLiteralStyle = RealLiteralStyle.CONTROLLER;

    public static CodecOptions defaults() {
        return builder().build();
    }
}
