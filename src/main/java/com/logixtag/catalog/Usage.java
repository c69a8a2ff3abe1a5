package com.logixtag.catalog;

import java.util.Locale;

/**
 * How a member is used by its owning type. Structure members are {@link #MEMBER};
 * Add-On Instruction parameters carry their declared usage.
 */
public enum Usage {
    INPUT,
    OUTPUT,
    IN_OUT,
    LOCAL,
    MEMBER;

    /**
     * Whether the member occupies backing memory of its owner. InOut parameters are
     * references to other tags and local tags are kept off the parameter layout.
     */
    public boolean isLaidOut() {
        return this != IN_OUT && this != LOCAL;
    }

    public static Usage fromAttribute(String usage) {
        if (usage == null || usage.isBlank()) return MEMBER;
        switch (usage.trim().toLowerCase(Locale.ROOT)) {
            case "input": return INPUT;
            case "output": return OUTPUT;
            case "inout": return IN_OUT;
            default: throw new IllegalArgumentException("Unknown usage: " + usage);
        }
    }
}
