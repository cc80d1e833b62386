package com.project.lingodeck.backend.session;

import com.project.lingodeck.backend.algorithm.FlashCard;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * What the caller should show after a review transition:
 * the next card, the end-of-session summary, or nothing at all.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReviewStep {
    FlashCard card;
    SessionSummary summary;

    /** Cards left in the queue after {@link #card}. */
    int remaining;

    public static ReviewStep nothingDue() {
        return new ReviewStep(null, null, 0);
    }

    public static ReviewStep next(FlashCard card, int remaining) {
        return new ReviewStep(card, null, remaining);
    }

    public static ReviewStep finished(SessionSummary summary) {
        return new ReviewStep(null, summary, 0);
    }

    public boolean hasCard() {
        return card != null;
    }

    public boolean isFinished() {
        return summary != null;
    }

    public boolean isNothingDue() {
        return card == null && summary == null;
    }
}
