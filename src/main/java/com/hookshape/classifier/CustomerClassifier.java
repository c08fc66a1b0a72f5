package com.hookshape.classifier;

import com.hookshape.core.PayloadPaths;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.model.CustomerTag;
import com.hookshape.model.RejectionReason;
import org.springframework.stereotype.Component;

import java.util.Map;

/** A "customer" delivery is always a profile update. */
@Component
public class CustomerClassifier {

    public static final String CUSTOMER = "customer";

    public ClassifiedEvent classify(Map<String, Object> body) {
        Map<String, Object> customer = PayloadPaths.object(body, CUSTOMER);
        if (customer == null) {
            throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE,
                    "missing required customer object");
        }
        return ClassifiedEvent.of(CustomerTag.PROFILE_UPDATE, customer);
    }
}
