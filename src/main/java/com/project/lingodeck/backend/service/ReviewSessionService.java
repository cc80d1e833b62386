package com.project.lingodeck.backend.service;

import com.project.lingodeck.backend.algorithm.FlashCard;
import com.project.lingodeck.backend.algorithm.Grade;
import com.project.lingodeck.backend.algorithm.Scheduler;
import com.project.lingodeck.backend.exception.ExceptionMessage;
import com.project.lingodeck.backend.exception.StoreUnavailableException;
import com.project.lingodeck.backend.session.ReviewSession;
import com.project.lingodeck.backend.session.ReviewSessionStateMachine;
import com.project.lingodeck.backend.session.ReviewStep;
import com.project.lingodeck.backend.session.SessionSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Entry point for the transport layer.
 *
 * The state machine assumes one transition per learner at a time, so every
 * mutating call here holds that learner's lock. Learners never share a lock.
 * A request that cannot get the lock within {@code lingodeck.session.lock-timeout}
 * fails with {@link StoreUnavailableException} and can be retried.
 */
@Slf4j
@Service
public class ReviewSessionService {

    private final ReviewSessionStateMachine stateMachine;
    private final Scheduler scheduler;
    private final SessionSettings sessionSettings;
    private final Clock clock;

    // an entry lives only while some request holds or waits for it
    private final ConcurrentMap<String, OwnerLock> ownerLocks = new ConcurrentHashMap<>();

    public ReviewSessionService(ReviewSessionStateMachine stateMachine,
                                Scheduler scheduler,
                                SessionSettings sessionSettings,
                                Clock clock) {
        this.stateMachine = stateMachine;
        this.scheduler = scheduler;
        this.sessionSettings = sessionSettings;
        this.clock = clock;
    }

    public ReviewStep startReview(String ownerId) {
        return withOwnerLock(ownerId, () -> stateMachine.startReview(ownerId, clock.instant()));
    }

    public ReviewStep reportOutcome(String ownerId, String cardId, Grade grade, String submissionToken) {
        return withOwnerLock(ownerId,
                () -> stateMachine.reportOutcome(ownerId, cardId, grade, submissionToken, clock.instant()));
    }

    public void startEdit(String ownerId, String cardId) {
        withOwnerLock(ownerId, () -> {
            stateMachine.startEdit(ownerId, cardId);
            return null;
        });
    }

    public void finishEdit(String ownerId) {
        withOwnerLock(ownerId, () -> {
            stateMachine.finishEdit(ownerId);
            return null;
        });
    }

    public void cancel(String ownerId) {
        withOwnerLock(ownerId, () -> {
            stateMachine.cancel(ownerId);
            return null;
        });
    }

    public ReviewSession getSessionState(String ownerId) {
        return stateMachine.getSessionState(ownerId);
    }

    /** Due date per answer button for the card being shown. */
    public Map<Grade, Instant> previewDueDates(FlashCard card) {
        return scheduler.previewDueDates(card, clock.instant());
    }

    private <T> T withOwnerLock(String ownerId, Supplier<T> transition) {
        OwnerLock ownerLock = acquire(ownerId);
        try {
            if (!ownerLock.lock.tryLock(sessionSettings.getLockTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Timed out waiting for the session lock of {}", ownerId);
                throw new StoreUnavailableException(ExceptionMessage.SESSION_BUSY);
            }
        } catch (InterruptedException e) {
            release(ownerId);
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(ExceptionMessage.SESSION_BUSY, e);
        } catch (StoreUnavailableException e) {
            release(ownerId);
            throw e;
        }

        try {
            return transition.get();
        } finally {
            ownerLock.lock.unlock();
            release(ownerId);
        }
    }

    private OwnerLock acquire(String ownerId) {
        return ownerLocks.compute(ownerId, (id, existing) -> {
            OwnerLock ownerLock = existing == null ? new OwnerLock() : existing;
            ownerLock.users++;
            return ownerLock;
        });
    }

    private void release(String ownerId) {
        ownerLocks.computeIfPresent(ownerId, (id, ownerLock) -> --ownerLock.users == 0 ? null : ownerLock);
    }

    /** Number of learners with a lock entry; entries are dropped once no request uses them. */
    int lockCount() {
        return ownerLocks.size();
    }

    // users is only touched inside compute/computeIfPresent, which ConcurrentHashMap runs atomically per key
    private static final class OwnerLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
