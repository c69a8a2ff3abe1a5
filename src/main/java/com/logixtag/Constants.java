package com.logixtag;

public final class Constants {
    public static final int BOOL_HOST_BYTES = 4;
    public static final int BOOLS_PER_HOST = 32;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 8;
    public static final int STRING_DATA_LENGTH = 82;

    private Constants() {}
}
