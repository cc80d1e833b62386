package com.project.lingodeck.backend.algorithm;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public final class SchedulingAlgoUtils {

    /** Ease factors are kept to this many decimal places. */
    private static final double EASE_SCALE = 10_000d;

    private SchedulingAlgoUtils() {
    }

    /**
     * Rounds an interval to whole days, half-up, the way SM-2 does.
     *
     * @param days raw interval, may be fractional.
     * @return the rounded interval, never negative.
     */
    public static int roundDays(double days) {
        return (int) Math.max(0, Math.round(days));
    }

    /**
     * Rounds an ease factor to four decimal places.
     *
     * Keeps repeated +0.15 / -0.20 steps from drifting in binary floating point.
     */
    public static double roundEase(double ease) {
        return Math.round(ease * EASE_SCALE) / EASE_SCALE;
    }

    /**
     * Returns {@code now} moved forward by a whole number of days.
     */
    public static Instant plusDays(Instant now, int days) {
        return now.plus(Duration.ofDays(days));
    }

    /** Returns a fresh opaque card id (a random UUID). */
    public static String newId() {
        return UUID.randomUUID().toString();
    }
}
