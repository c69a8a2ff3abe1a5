package com.logixtag.types;

import lombok.Getter;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Atomic (primitive) tag types.
 * <p>
 * Bool members are packed 32 to a 4-byte host word, so their width is the width of that
 * word. {@link #STR} is variable length and is never placed inside a packed layout.
 */
public enum AtomicKind {
    BOOL(4, 4, "BOOL", "BIT"),
    SINT8(1, 1, "SINT"),
    INT16(2, 2, "INT"),
    DINT32(4, 4, "DINT"),
    LINT64(8, 8, "LINT"),
    REAL32(4, 4, "REAL"),
    STR(0, 0, "STRING");

    @Getter
    private final int byteWidth;
    @Getter
    private final int alignment;
    private final String[] typeNames;

    private static final Map<String, AtomicKind> LOOKUP = new HashMap<>();

    static {
        for (var kind : values()) {
            for (var name : kind.typeNames) {
                LOOKUP.put(name, kind);
            }
        }
    }

    AtomicKind(int byteWidth, int alignment, String... typeNames) {
        this.byteWidth = byteWidth;
        this.alignment = alignment;
        this.typeNames = typeNames;
    }

    /**
     * The controller's own name for this kind, e.g. {@code DINT}.
     */
    public String getTypeName() {
        return typeNames[0];
    }

    /**
     * Whether the kind can be placed inside a packed binary layout.
     */
    public boolean isPackable() {
        return this != STR;
    }

    public long minValue() {
        switch (this) {
            case SINT8: return Byte.MIN_VALUE;
            case INT16: return Short.MIN_VALUE;
            case DINT32: return Integer.MIN_VALUE;
            case LINT64: return Long.MIN_VALUE;
            case BOOL: return 0;
            default: throw new IllegalStateException(this + " has no integer range");
        }
    }

    public long maxValue() {
        switch (this) {
            case SINT8: return Byte.MAX_VALUE;
            case INT16: return Short.MAX_VALUE;
            case DINT32: return Integer.MAX_VALUE;
            case LINT64: return Long.MAX_VALUE;
            case BOOL: return 1;
            default: throw new IllegalStateException(this + " has no integer range");
        }
    }

    /**
     * Looks up an atomic kind by type name, ignoring case.
     *
     * @return the kind, or null when the name is not atomic
     */
    public static AtomicKind fromTypeName(String typeName) {
        if (typeName == null) return null;
        return LOOKUP.get(typeName.trim().toUpperCase(Locale.ROOT));
    }
}
