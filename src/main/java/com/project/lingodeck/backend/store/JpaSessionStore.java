package com.project.lingodeck.backend.store;

import com.project.lingodeck.backend.algorithm.FlashCard;
import com.project.lingodeck.backend.exception.ExceptionMessage;
import com.project.lingodeck.backend.exception.StoreUnavailableException;
import com.project.lingodeck.backend.repository.FlashCardRepository;
import com.project.lingodeck.backend.repository.ReviewSessionRepository;
import com.project.lingodeck.backend.session.ReviewSession;
import com.project.lingodeck.backend.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link SessionStore} on top of Spring Data JPA.
 *
 * Every call runs in its own transaction; {@link #commitReview} writes the card
 * and the session in the same one. Persistence failures, including those raised
 * at commit time, come out as {@link StoreUnavailableException}.
 */
@Slf4j
@Component
public class JpaSessionStore implements SessionStore {

    private final FlashCardRepository flashCardRepository;
    private final ReviewSessionRepository reviewSessionRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaSessionStore(FlashCardRepository flashCardRepository,
                           ReviewSessionRepository reviewSessionRepository,
                           PlatformTransactionManager transactionManager) {
        this.flashCardRepository = flashCardRepository;
        this.reviewSessionRepository = reviewSessionRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<ReviewSession> loadSession(String ownerId) {
        return inTransaction(() -> reviewSessionRepository.findById(ownerId).map(StoreMapper::toSession));
    }

    @Override
    public void saveSession(ReviewSession session) {
        inTransaction(() -> reviewSessionRepository.save(StoreMapper.toEntity(session)));
    }

    @Override
    public Optional<FlashCard> loadCard(String cardId) {
        return inTransaction(() -> flashCardRepository.findById(cardId).map(StoreMapper::toCard));
    }

    @Override
    public void saveCard(FlashCard card) {
        inTransaction(() -> flashCardRepository.save(StoreMapper.toEntity(card)));
    }

    @Override
    public List<FlashCard> queryDue(String ownerId, Instant now) {
        return inTransaction(() -> flashCardRepository.findByOwnerIdAndDueAtLessThanEqual(ownerId, now).stream()
                .map(StoreMapper::toCard)
                .toList());
    }

    @Override
    public void commitReview(FlashCard card, ReviewSession session) {
        inTransaction(() -> {
            flashCardRepository.save(StoreMapper.toEntity(card));
            reviewSessionRepository.save(StoreMapper.toEntity(session));
            return null;
        });
    }

    private <T> T inTransaction(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("{}: {}", ExceptionMessage.STORE_UNAVAILABLE, e.getMessage());
            throw new StoreUnavailableException(ExceptionMessage.STORE_UNAVAILABLE, e);
        }
    }
}
