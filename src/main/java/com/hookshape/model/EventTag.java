package com.hookshape.model;

/**
 * A classification tag drawn from a closed, per-category enumeration.
 */
public interface EventTag {

    String wireValue();
}
