package com.hookshape.model;

/**
 * Machine-readable cause of a rejected delivery.
 */
public enum RejectionReason {
    MISSING_CORRELATION_KEY,
    UNRECOGNIZED_SHAPE,
    UNRECOGNIZED_ENUM_VALUE,
    MISSING_REQUIRED_FIELD,
    INVALID_FIELD_VALUE
}
