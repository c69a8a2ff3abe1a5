package com.logixtag.error;

/**
 * Types of errors that can occur while resolving, laying out or coding tags.
 */
public enum ErrorType {
    TYPE_NOT_FOUND,
    UNSUPPORTED_TYPE,
    MALFORMED_DIMENSION,
    FIELD_NOT_FOUND,
    DUPLICATE_FIELD,
    VALUE_RANGE,
    TYPE_MISMATCH,
    MAX_NESTING_DEPTH_EXCEEDED,
    BUFFER_UNDERFLOW,
    VERIFICATION_FAILED,
    MALFORMED_DOCUMENT
}
