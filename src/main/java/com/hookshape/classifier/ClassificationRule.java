package com.hookshape.classifier;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.function.Predicate;

/**
 * One step of a classification cascade: a named structural predicate and the tag
 * it produces when it holds.
 */
@Getter
@RequiredArgsConstructor(staticName = "of")
public final class ClassificationRule<I, T> {

    private final String name;
    private final Predicate<I> condition;
    private final T tag;

    public boolean matches(I input) {
        return condition.test(input);
    }

    @Override
    public String toString() {
        return name + " → " + tag;
    }
}
