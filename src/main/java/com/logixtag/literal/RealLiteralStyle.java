package com.logixtag.literal;

import lombok.Getter;

/**
 * Text used for a REAL zero in default-value literals.
 */
public enum RealLiteralStyle {
    /** Fixed-width exponent form written by the controller's own export. */
    CONTROLLER("0.00000000e+000"),
    COMPACT("0.0");

    @Getter
    private final String zero;

    RealLiteralStyle(String zero) {
        this.zero = zero;
    }
}
