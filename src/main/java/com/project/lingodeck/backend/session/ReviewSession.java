package com.project.lingodeck.backend.session;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * The live review / edit interaction of one learner.
 *
 * There is at most one session per owner. Instances are immutable; every
 * transition of {@link ReviewSessionStateMachine} builds a new one and hands
 * it to the {@link SessionStore}.
 *
 * {@code activeCardId} is set exactly when the mode is REVIEWING, or EDITING
 * with {@code resumeMode} REVIEWING.
 */
@Value
@Builder(toBuilder = true)
public class ReviewSession {

    String ownerId;

    SessionMode mode;

    /** The card currently presented to the learner. */
    String activeCardId;

    /** The card being edited while the mode is EDITING. */
    String editingCardId;

    /** Mode to go back to when the edit finishes. Only set while EDITING. */
    SessionMode resumeMode;

    /**
     * Ids still to be reviewed after the active card, in order.
     * Snapshot taken when the review starts; it is never re-queried.
     */
    List<String> queue;

    Instant startedAt;

    /** Time of the last graded answer or of the review start. */
    Instant updatedAt;

    SessionStats stats;

    // ── duplicate-delivery guard ──────────────────────────────────────────

    /** Card id of the last applied outcome. */
    String lastSubmissionCardId;

    /** Client token of the last applied outcome, may be null. */
    String lastSubmissionToken;

    /**
     * The state of a learner who has no stored session.
     */
    public static ReviewSession idle(String ownerId) {
        return ReviewSession.builder()
                .ownerId(ownerId)
                .mode(SessionMode.IDLE)
                .queue(List.of())
                .stats(SessionStats.empty())
                .build();
    }

    public boolean hasActiveCard() {
        return activeCardId != null;
    }

    /** Cards left after the active one. */
    public int remaining() {
        return queue == null ? 0 : queue.size();
    }

    /**
     * True if this exact submission was the last one applied,
     * so a redelivered message can be answered without grading twice.
     */
    public boolean isLastSubmission(String cardId, String token) {
        return token != null
                && token.equals(lastSubmissionToken)
                && cardId != null
                && cardId.equals(lastSubmissionCardId);
    }
}
