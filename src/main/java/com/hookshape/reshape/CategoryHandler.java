package com.hookshape.reshape;

import com.hookshape.dto.Aggregate;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.dto.DeliveryContext;
import com.hookshape.model.EventCategory;

import java.util.List;
import java.util.Map;

/**
 * Strategy for one event category.
 *
 * classify() validates the shape and assigns the tag, throwing
 * DeliveryRejectedException when the delivery cannot be accepted.
 * reshape() turns the classified delivery into sparse aggregates; it never rejects.
 */
public interface CategoryHandler {

    EventCategory category();

    ClassifiedEvent classify(Map<String, Object> body);

    List<Aggregate> reshape(ClassifiedEvent event, DeliveryContext context);
}
