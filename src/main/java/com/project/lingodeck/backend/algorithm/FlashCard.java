package com.project.lingodeck.backend.algorithm;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A learner's flashcard together with its spaced-repetition state.
 *
 * Instances are immutable: the {@link Scheduler} returns an updated copy
 * (built with {@link #toBuilder()}) instead of changing the card it was given.
 */
@Value
@Builder(toBuilder = true)
public class FlashCard {

    /** Opaque unique id. */
    String id;

    /** The learner this card belongs to. All scheduling is scoped per owner. */
    String ownerId;

    CardType cardType;

    /** Type-specific payload, never inspected by scheduling code. */
    CardContent content;

    // ── scheduling state ──────────────────────────────────────────────────

    /**
     * Per-card multiplier for interval growth (e.g. 2.5 = ×2.5).
     * Never drops below the configured minimum ease.
     */
    double easeFactor;

    /** Days until the next review. 0 = never successfully reviewed, or just lapsed. */
    int intervalDays;

    /** Consecutive successful reviews since the last lapse. */
    int repetitions;

    /** Lifetime count of reviews graded {@link Grade#AGAIN}. */
    int lapses;

    /** The card is eligible for review once {@code now >= dueAt}. */
    Instant dueAt;

    /** Null until the first review. */
    Instant lastReviewedAt;

    Instant createdAt;

    // -----------------------------------------------------------------------
    // Factory
    // -----------------------------------------------------------------------

    /**
     * Creates a brand-new card that is due immediately.
     *
     * All scheduling fields start in the "new" state:
     *   interval/repetitions/lapses = 0, ease = initialEase, dueAt = createdAt = now.
     */
    public static FlashCard newCard(String id, String ownerId, CardContent content, double initialEase, Instant now) {
        return FlashCard.builder()
                .id(id)
                .ownerId(ownerId)
                .cardType(content.getCardType())
                .content(content)
                .easeFactor(initialEase)
                .intervalDays(0)
                .repetitions(0)
                .lapses(0)
                .dueAt(now)
                .lastReviewedAt(null)
                .createdAt(now)
                .build();
    }

    public boolean isDue(Instant now) {
        return !dueAt.isAfter(now);
    }

    public boolean isNew() {
        return lastReviewedAt == null;
    }
}
