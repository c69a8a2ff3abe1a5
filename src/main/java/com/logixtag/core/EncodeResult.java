package com.logixtag.core;

import com.logixtag.error.TagCodecException;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a per-field encode: the new image holds every applied update, and each rejected
 * update is reported by path. Rejected updates leave the image untouched.
 */
@Value
public class EncodeResult {
    BinaryImage image;
    List<String> applied;
    Map<String, TagCodecException> failures;

    public boolean isSuccess() {
        return failures.isEmpty();
    }
}
