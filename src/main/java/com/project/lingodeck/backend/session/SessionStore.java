package com.project.lingodeck.backend.session;

import com.project.lingodeck.backend.algorithm.FlashCard;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keyed persistence of sessions (by owner id) and cards (by card id).
 *
 * The review engine keeps no state of its own between calls; everything
 * durable lives behind this interface. Any method may throw
 * {@link com.project.lingodeck.backend.exception.StoreUnavailableException},
 * which the engine passes on to its caller without retrying.
 */
public interface SessionStore {

    Optional<ReviewSession> loadSession(String ownerId);

    /** Full overwrite, last writer wins. */
    void saveSession(ReviewSession session);

    Optional<FlashCard> loadCard(String cardId);

    void saveCard(FlashCard card);

    /**
     * Cards of {@code ownerId} due at {@code now}. May return a superset;
     * the scheduler filters precisely.
     */
    List<FlashCard> queryDue(String ownerId, Instant now);

    /**
     * Saves a graded card and the advanced session as one atomic unit:
     * either both are written or neither is.
     */
    void commitReview(FlashCard card, ReviewSession session);
}
