package com.project.lingodeck.backend.algorithm;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning constants of the SM-2 family scheduler.
 *
 * Bound from {@code lingodeck.scheduler.*}; the defaults are the classic
 * SM-2 values with Anki's HARD and EASY adjustments.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "lingodeck.scheduler")
public class SchedulerSettings {

    /** Ease given to a brand-new card. */
    private double initialEase = 2.5;

    /** Lower bound for the ease factor. */
    private double minimumEase = 1.3;

    /** Ease lost on {@link Grade#AGAIN}. */
    private double againPenalty = 0.20;

    /** Ease lost on {@link Grade#HARD}. */
    private double hardPenalty = 0.15;

    /** Ease gained on {@link Grade#EASY}. */
    private double easyBonus = 0.15;

    /** Interval multiplier applied on {@link Grade#HARD}. */
    private double hardIntervalMultiplier = 1.2;

    /** Extra interval multiplier applied on top of the ease on {@link Grade#EASY}. */
    private double easyIntervalMultiplier = 1.3;

    /**
     * How long a lapsed card waits before it is due again.
     * Zero means it is due immediately (same session / same day).
     */
    private Duration relearnInterval = Duration.ZERO;

    /** Upper bound for any interval, in days. */
    private int maximumIntervalDays = 36500;
}
