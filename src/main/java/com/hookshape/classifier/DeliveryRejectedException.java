package com.hookshape.classifier;

import com.hookshape.model.RejectionReason;
import lombok.Getter;

/**
 * Thrown when a delivery fails validation. Processing of that delivery stops
 * before any aggregate is built.
 */
@Getter
public class DeliveryRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public DeliveryRejectedException(RejectionReason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
