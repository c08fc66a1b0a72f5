package com.hookshape.classifier;

import com.hookshape.core.Timestamps;

import java.time.ZoneOffset;

/**
 * Heuristic used by the appointment cascade: scheduled appointments are booked on
 * quarter-hour slots, so a UTC minute of 00, 15, 30 or 45 suggests a newly set one.
 * False for anything that does not parse.
 */
final class QuarterHour {

    private QuarterHour() {}

    static boolean isOnBoundary(Object dateTime) {
        return Timestamps.parse(dateTime)
                .map(instant -> instant.atOffset(ZoneOffset.UTC).getMinute() % 15 == 0)
                .orElse(false);
    }
}
