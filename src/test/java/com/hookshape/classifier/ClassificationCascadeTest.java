package com.hookshape.classifier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationCascadeTest {

    private final ClassificationCascade<Integer, String> cascade = new ClassificationCascade<>(List.of(
            rule("even", n -> n % 2 == 0, "even"),
            rule("multiple of three", n -> n % 3 == 0, "three"),
            rule("positive", n -> n > 0, "positive")
    ));

    private static ClassificationRule<Integer, String> rule(String name, Predicate<Integer> condition, String tag) {
        return ClassificationRule.of(name, condition, tag);
    }

    @Test
    @DisplayName("The first matching rule wins even when later rules also match")
    void firstMatchWins() {
        assertEquals(Optional.of("even"), cascade.classify(6));
        assertEquals(Optional.of("three"), cascade.classify(9));
        assertEquals(Optional.of("positive"), cascade.classify(7));
    }

    @Test
    @DisplayName("No match gives empty")
    void noMatch() {
        assertTrue(cascade.classify(-7).isEmpty());
        assertTrue(cascade.firstMatch(-7).isEmpty());
    }

    @Test
    @DisplayName("firstMatch exposes the rule that decided")
    void firstMatchRule() {
        assertEquals("multiple of three", cascade.firstMatch(3).map(ClassificationRule::getName).orElseThrow());
    }

    @Test
    @DisplayName("The rule list is an immutable snapshot in priority order")
    void rulesAreData() {
        List<ClassificationRule<Integer, String>> source = new ArrayList<>();
        source.add(rule("any", n -> true, "any"));
        ClassificationCascade<Integer, String> copy = new ClassificationCascade<>(source);
        source.clear();

        assertEquals(1, copy.getRules().size());
        assertThrows(UnsupportedOperationException.class, () -> copy.getRules().clear());
        assertEquals(List.of("even", "multiple of three", "positive"),
                cascade.getRules().stream().map(ClassificationRule::getName).toList());
    }
}
