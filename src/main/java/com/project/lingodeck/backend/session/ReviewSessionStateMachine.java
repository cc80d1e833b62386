package com.project.lingodeck.backend.session;

import com.project.lingodeck.backend.algorithm.FlashCard;
import com.project.lingodeck.backend.algorithm.Grade;
import com.project.lingodeck.backend.algorithm.Scheduler;
import com.project.lingodeck.backend.exception.ExceptionMessage;
import com.project.lingodeck.backend.exception.InvalidArgumentException;
import com.project.lingodeck.backend.exception.InvalidStateException;
import com.project.lingodeck.backend.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives a learner's session through IDLE → REVIEWING ⇄ EDITING → IDLE.
 *
 * <pre>
 *  startReview   IDLE → REVIEWING (or stays IDLE when nothing is due)
 *  reportOutcome REVIEWING → REVIEWING (next card) or IDLE (queue exhausted)
 *  startEdit     IDLE | REVIEWING → EDITING
 *  finishEdit    EDITING → the mode it was entered from
 *  cancel        any → IDLE
 * </pre>
 *
 * The machine is not synchronized: the caller must serialize calls for the same
 * owner. It keeps nothing between calls; every transition loads the session from
 * the {@link SessionStore}, computes the next one and writes it back. A rejected
 * transition throws before anything is written.
 */
@Slf4j
public class ReviewSessionStateMachine {

    private final SessionStore store;
    private final Scheduler scheduler;
    private final SessionSettings settings;

    public ReviewSessionStateMachine(SessionStore store, Scheduler scheduler, SessionSettings settings) {
        this.store = store;
        this.scheduler = scheduler;
        this.settings = settings;
    }

    // -----------------------------------------------------------------------
    // Review
    // -----------------------------------------------------------------------

    /**
     * Starts a review of everything due for {@code ownerId}.
     *
     * If a review is already running the active card is returned again and
     * no second queue is built.
     *
     * @return the first card, or {@link ReviewStep#nothingDue()} when no card is due.
     * @throws InvalidStateException if a card is being edited.
     */
    public ReviewStep startReview(String ownerId, Instant now) {
        ReviewSession session = loadOrIdle(ownerId);

        if (session.getMode() == SessionMode.REVIEWING) {
            log.info("Review already running for {}, resuming card {}", ownerId, session.getActiveCardId());
            ReviewStep resumed = resumeActiveCard(session, now);
            if (resumed.hasCard()) {
                return resumed;
            }
            // every remaining card was deleted, start over from what is due now
            session = loadOrIdle(ownerId);
        }
        if (session.getMode() == SessionMode.EDITING) {
            throw new InvalidStateException(ExceptionMessage.SESSION_EDITING);
        }

        Map<String, FlashCard> dueCards = store.queryDue(ownerId, now).stream()
                .filter(card -> ownerId.equals(card.getOwnerId()))
                .collect(Collectors.toMap(FlashCard::getId, Function.identity(), (first, second) -> first));

        List<String> order = scheduler.nextDue(dueCards.values(), now);
        int limit = settings.getMaxCardsPerSession();
        if (limit > 0 && order.size() > limit) {
            order = order.subList(0, limit);
        }

        if (order.isEmpty()) {
            log.info("Nothing due for {}", ownerId);
            return ReviewStep.nothingDue();
        }

        FlashCard first = dueCards.get(order.get(0));
        List<String> queue = List.copyOf(order.subList(1, order.size()));

        ReviewSession started = ReviewSession.builder()
                .ownerId(ownerId)
                .mode(SessionMode.REVIEWING)
                .activeCardId(first.getId())
                .queue(queue)
                .startedAt(now)
                .updatedAt(now)
                .stats(SessionStats.empty())
                .build();
        store.saveSession(started);

        log.info("Started review for {} with {} cards", ownerId, order.size());
        return ReviewStep.next(first, queue.size());
    }

    /**
     * Grades the active card and moves on to the next one.
     *
     * The graded card and the advanced session are committed together. When the
     * same {@code (cardId, submissionToken)} pair arrives twice, the second call
     * returns the current step and applies nothing. If the active card was deleted
     * meanwhile, nothing is graded and the review moves on to the next card.
     *
     * @return the next card, or the session summary if the queue is exhausted.
     * @throws InvalidStateException    if no review is running or {@code cardId} is not the active card.
     * @throws InvalidArgumentException if {@code grade} is null.
     */
    public ReviewStep reportOutcome(String ownerId, String cardId, Grade grade, String submissionToken, Instant now) {
        if (grade == null) {
            throw new InvalidArgumentException(ExceptionMessage.GRADE_REQUIRED);
        }

        ReviewSession session = loadOrIdle(ownerId);

        if (session.isLastSubmission(cardId, submissionToken)) {
            log.info("Duplicate submission {} for card {} of {}, replaying", submissionToken, cardId, ownerId);
            return currentStep(session, now);
        }
        if (session.getMode() == SessionMode.EDITING) {
            throw new InvalidStateException(ExceptionMessage.SESSION_EDITING);
        }
        if (session.getMode() != SessionMode.REVIEWING) {
            throw new InvalidStateException(ExceptionMessage.SESSION_NOT_REVIEWING);
        }
        if (!session.getActiveCardId().equals(cardId)) {
            log.warn("Rejected outcome for {}: card {} is not the active card {}", ownerId, cardId, session.getActiveCardId());
            throw new InvalidStateException(ExceptionMessage.CARD_NOT_ACTIVE + ": " + cardId);
        }

        Optional<FlashCard> active = store.loadCard(cardId);
        if (active.isEmpty()) {
            return resumeActiveCard(session, now);
        }
        FlashCard graded = scheduler.applyOutcome(active.get(), grade, now);

        Deque<String> queue = new ArrayDeque<>(session.getQueue());
        FlashCard nextCard = pollNextCard(ownerId, queue);

        ReviewSession.ReviewSessionBuilder advanced = session.toBuilder()
                .stats(session.getStats().record(grade))
                .updatedAt(now)
                .lastSubmissionCardId(cardId)
                .lastSubmissionToken(submissionToken)
                .queue(List.copyOf(queue));
        if (nextCard != null) {
            advanced.activeCardId(nextCard.getId());
        } else {
            advanced.mode(SessionMode.IDLE).activeCardId(null);
        }
        ReviewSession next = advanced.build();

        store.commitReview(graded, next);
        log.info("{} graded card {} as {}, next due {}", ownerId, cardId, grade, graded.getDueAt());

        if (nextCard == null) {
            SessionSummary summary = SessionSummary.of(next);
            log.info("Review finished for {}: {} cards, {}% recalled", ownerId, summary.getReviewed(), summary.getRecallRate());
            return ReviewStep.finished(summary);
        }
        return ReviewStep.next(nextCard, next.remaining());
    }

    // -----------------------------------------------------------------------
    // Editing
    // -----------------------------------------------------------------------

    /**
     * Suspends scheduling while {@code cardId} is edited. The review queue and
     * active card, if any, are kept for {@link #finishEdit}.
     *
     * @throws InvalidStateException if an edit is already in progress.
     * @throws NotFoundException     if the card does not exist or belongs to someone else.
     */
    public void startEdit(String ownerId, String cardId) {
        ReviewSession session = loadOrIdle(ownerId);
        if (session.getMode() == SessionMode.EDITING) {
            throw new InvalidStateException(ExceptionMessage.SESSION_EDITING);
        }

        FlashCard card = requireCard(cardId);
        if (!ownerId.equals(card.getOwnerId())) {
            throw new NotFoundException(ExceptionMessage.CARD_NOT_FOUND, cardId);
        }

        store.saveSession(session.toBuilder()
                .mode(SessionMode.EDITING)
                .resumeMode(session.getMode())
                .editingCardId(cardId)
                .build());
        log.info("{} started editing card {}", ownerId, cardId);
    }

    /**
     * Returns to the mode {@link #startEdit} was called from.
     *
     * @throws InvalidStateException if no edit is in progress.
     */
    public void finishEdit(String ownerId) {
        ReviewSession session = loadOrIdle(ownerId);
        if (session.getMode() != SessionMode.EDITING) {
            throw new InvalidStateException(ExceptionMessage.SESSION_NOT_EDITING);
        }

        SessionMode restored = session.getResumeMode() == null ? SessionMode.IDLE : session.getResumeMode();
        store.saveSession(session.toBuilder()
                .mode(restored)
                .resumeMode(null)
                .editingCardId(null)
                .build());
        log.info("{} finished editing card {}, back to {}", ownerId, session.getEditingCardId(), restored);
    }

    // -----------------------------------------------------------------------
    // Cancel / introspection
    // -----------------------------------------------------------------------

    /**
     * Drops the queue and active card and returns to IDLE. Outcomes that were
     * already reported stay applied.
     */
    public void cancel(String ownerId) {
        Optional<ReviewSession> stored = store.loadSession(ownerId);
        if (stored.isEmpty() || stored.get().getMode() == SessionMode.IDLE) {
            return;
        }

        ReviewSession session = stored.get();
        store.saveSession(session.toBuilder()
                .mode(SessionMode.IDLE)
                .activeCardId(null)
                .editingCardId(null)
                .resumeMode(null)
                .queue(List.of())
                .build());
        log.info("{} cancelled the session ({} cards left unreviewed)",
                ownerId, session.remaining() + (session.hasActiveCard() ? 1 : 0));
    }

    /**
     * Read-only view of the learner's session, an IDLE one if none is stored.
     */
    public ReviewSession getSessionState(String ownerId) {
        return loadOrIdle(ownerId);
    }

    // -----------------------------------------------------------------------
    // helpers
    // -----------------------------------------------------------------------

    private ReviewSession loadOrIdle(String ownerId) {
        return store.loadSession(ownerId).orElseGet(() -> ReviewSession.idle(ownerId));
    }

    private FlashCard requireCard(String cardId) {
        return store.loadCard(cardId)
                .orElseThrow(() -> new NotFoundException(ExceptionMessage.CARD_NOT_FOUND, cardId));
    }

    /**
     * Takes ids off the head of {@code queue} until one resolves to an existing card
     * of the owner. Cards deleted since the review started are skipped.
     */
    private FlashCard pollNextCard(String ownerId, Deque<String> queue) {
        while (!queue.isEmpty()) {
            String id = queue.poll();
            Optional<FlashCard> card = store.loadCard(id).filter(c -> ownerId.equals(c.getOwnerId()));
            if (card.isPresent()) {
                return card.get();
            }
            log.warn("Skipping card {} of {}: no longer exists", id, ownerId);
        }
        return null;
    }

    private ReviewStep currentStep(ReviewSession session, Instant now) {
        if (session.getMode() == SessionMode.REVIEWING) {
            return resumeActiveCard(session, now);
        }
        if (session.hasActiveCard()) {
            return ReviewStep.next(requireCard(session.getActiveCardId()), session.remaining());
        }
        return ReviewStep.finished(SessionSummary.of(session));
    }

    /**
     * Returns the active card of a running review. When that card no longer exists
     * it is skipped like a deleted queue entry: the next queued card becomes active,
     * or the review ends if none is left. Nothing is graded for the skipped card.
     */
    private ReviewStep resumeActiveCard(ReviewSession session, Instant now) {
        String ownerId = session.getOwnerId();
        Optional<FlashCard> active = store.loadCard(session.getActiveCardId())
                .filter(card -> ownerId.equals(card.getOwnerId()));
        if (active.isPresent()) {
            return ReviewStep.next(active.get(), session.remaining());
        }

        log.warn("Active card {} of {} no longer exists, skipping it", session.getActiveCardId(), ownerId);
        Deque<String> queue = new ArrayDeque<>(session.getQueue());
        FlashCard nextCard = pollNextCard(ownerId, queue);

        ReviewSession.ReviewSessionBuilder advanced = session.toBuilder()
                .updatedAt(now)
                .queue(List.copyOf(queue));
        if (nextCard != null) {
            advanced.activeCardId(nextCard.getId());
        } else {
            advanced.mode(SessionMode.IDLE).activeCardId(null);
        }
        ReviewSession next = advanced.build();
        store.saveSession(next);

        if (nextCard == null) {
            return ReviewStep.finished(SessionSummary.of(next));
        }
        return ReviewStep.next(nextCard, next.remaining());
    }
}
