package com.hookshape.dto;

import com.hookshape.model.EventTag;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Result of classification: the closed-enum tag plus the part of the delivery
 * that the tag was decided on.
 */
@Getter
@AllArgsConstructor(staticName = "of")
public class ClassifiedEvent {

    private final EventTag tag;
    private final Map<String, Object> payload;
}
