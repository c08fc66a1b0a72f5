package com.hookshape.model;

/**
 * CLASSIFIED → tagged, fingerprinted and reshaped
 * REJECTED   → failed validation; the reason says why, do not retry blindly
 * DEGRADED   → unexpected internal failure; original payload kept, tag "unknown"
 */
public enum OutcomeStatus {
    CLASSIFIED,
    REJECTED,
    DEGRADED
}
