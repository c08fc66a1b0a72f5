package com.hookshape.classifier;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Ordered, immutable list of classification rules.
 *
 * HOW IT WORKS:
 *   rules are tried top to bottom → the first whose predicate holds wins
 *   no rule holds → empty, and the caller decides (reject, or a fallback tag)
 *
 * The order is the priority. It is data, exposed through getRules(), so tests and
 * logs can show exactly why an input got its tag.
 */
@Getter
public final class ClassificationCascade<I, T> {

    private final List<ClassificationRule<I, T>> rules;

    public ClassificationCascade(List<ClassificationRule<I, T>> rules) {
        this.rules = List.copyOf(rules);
    }

    public Optional<ClassificationRule<I, T>> firstMatch(I input) {
        for (ClassificationRule<I, T> rule : rules) {
            if (rule.matches(input)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public Optional<T> classify(I input) {
        return firstMatch(input).map(ClassificationRule::getTag);
    }
}
