package com.logixtag.error;

import lombok.Getter;

/**
 * Exception thrown by tag layout and codec operations.
 * <p>
 * Every failure is local to one field or one type resolution. The subject names that
 * field (or type), and where they are known the byte offset and the requested value are
 * attached so a caller can log the failure and carry on with the remaining fields.
 */
@Getter
public class TagCodecException extends Exception {
    private final ErrorType errorType;
    private final String subject;
    private final int byteOffset;
    private final Object value;

    public TagCodecException(ErrorType errorType, String message) {
        this(errorType, null, -1, null, message);
    }

    public TagCodecException(ErrorType errorType, String subject, String message) {
        this(errorType, subject, -1, null, message);
    }

    public TagCodecException(ErrorType errorType, String subject, int byteOffset, Object value, String message) {
        super(message);
        this.errorType = errorType;
        this.subject = subject;
        this.byteOffset = byteOffset;
        this.value = value;
    }

    public TagCodecException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.subject = null;
        this.byteOffset = -1;
        this.value = null;
    }

    public static TagCodecException typeNotFound(String typeName) {
        return new TagCodecException(ErrorType.TYPE_NOT_FOUND, typeName, "Type not found: " + typeName);
    }

    public static TagCodecException unsupportedType(String typeName, String reason) {
        return new TagCodecException(ErrorType.UNSUPPORTED_TYPE, typeName,
                "Unsupported type '" + typeName + "': " + reason);
    }

    public static TagCodecException malformedDimension(String fieldName, String dimension) {
        return new TagCodecException(ErrorType.MALFORMED_DIMENSION, fieldName, -1, dimension,
                "Dimension of '" + fieldName + "' is not a non-negative integer: '" + dimension + "'");
    }

    public static TagCodecException fieldNotFound(String fieldName) {
        return new TagCodecException(ErrorType.FIELD_NOT_FOUND, fieldName, "Field not found: " + fieldName);
    }

    public static TagCodecException duplicateField(String path) {
        return new TagCodecException(ErrorType.DUPLICATE_FIELD, path, "Field path declared more than once: " + path);
    }

    public static TagCodecException valueRange(String fieldName, int byteOffset, Object value, String kind) {
        return new TagCodecException(ErrorType.VALUE_RANGE, fieldName, byteOffset, value,
                "Value " + value + " is out of range for " + kind + " field '" + fieldName + "' at byte " + byteOffset);
    }

    public static TagCodecException nestingDepthExceeded(String typeName, int depth) {
        return new TagCodecException(ErrorType.MAX_NESTING_DEPTH_EXCEEDED, typeName, -1, depth,
                "Type '" + typeName + "' is nested " + depth + " levels deep, beyond the supported limit");
    }

    @Override
    public String toString() {
        return String.format("TagCodecException{type=%s, subject=%s, message='%s'}", errorType, subject, getMessage());
    }
}
