package com.hookshape.reshape;

import com.hookshape.model.EventCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the handler for a category. Every CategoryHandler bean registers itself;
 * two handlers for one category is a wiring error.
 */
@Component
@Slf4j
public class CategoryHandlerRegistry {

    private final Map<EventCategory, CategoryHandler> handlers = new EnumMap<>(EventCategory.class);

    public CategoryHandlerRegistry(List<CategoryHandler> handlers) {
        for (CategoryHandler handler : handlers) {
            CategoryHandler previous = this.handlers.put(handler.category(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for category " + handler.category()
                        + ": " + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
            }
        }
        log.info("Registered category handlers: {}", this.handlers.keySet());
    }

    public Optional<CategoryHandler> find(EventCategory category) {
        return Optional.ofNullable(handlers.get(category));
    }
}
