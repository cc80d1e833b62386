package com.project.lingodeck.backend.service;

import com.project.lingodeck.backend.algorithm.CardContent;
import com.project.lingodeck.backend.algorithm.DeckStatistics;
import com.project.lingodeck.backend.algorithm.FlashCard;
import com.project.lingodeck.backend.algorithm.Scheduler;
import com.project.lingodeck.backend.algorithm.SchedulerSettings;
import com.project.lingodeck.backend.algorithm.SchedulingAlgoUtils;
import com.project.lingodeck.backend.entity.FlashCardEntity;
import com.project.lingodeck.backend.exception.ExceptionMessage;
import com.project.lingodeck.backend.exception.InvalidArgumentException;
import com.project.lingodeck.backend.exception.NotFoundException;
import com.project.lingodeck.backend.repository.FlashCardRepository;
import com.project.lingodeck.backend.store.StoreMapper;
import com.project.lingodeck.backend.utils.EntityValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * The learner's card catalog: cards come in from the generator, are read back
 * for display, edited and summarized for the dashboard.
 */
@Slf4j
@Service
public class FlashCardService {

    private final FlashCardRepository flashCardRepository;
    private final Scheduler scheduler;
    private final SchedulerSettings schedulerSettings;
    private final EntityValidator entityValidator;
    private final Clock clock;

    FlashCardService(FlashCardRepository flashCardRepository,
                     Scheduler scheduler,
                     SchedulerSettings schedulerSettings,
                     EntityValidator entityValidator,
                     Clock clock) {
        this.flashCardRepository = flashCardRepository;
        this.scheduler = scheduler;
        this.schedulerSettings = schedulerSettings;
        this.entityValidator = entityValidator;
        this.clock = clock;
    }

    /**
     * Stores a new card for {@code ownerId}. It is due immediately.
     */
    @Transactional
    public FlashCard createCard(String ownerId, CardContent content) {
        entityValidator.validate(content);

        FlashCard card = FlashCard.newCard(SchedulingAlgoUtils.newId(), ownerId, content,
                schedulerSettings.getInitialEase(), clock.instant());
        flashCardRepository.save(StoreMapper.toEntity(card));

        log.info("Created {} card {} for {}", card.getCardType(), card.getId(), ownerId);
        return card;
    }

    /**
     * Replaces the content of an existing card. Scheduling state is left as it is,
     * so an edited card keeps its place in the review rotation.
     *
     * @throws NotFoundException        if the card does not exist or belongs to someone else.
     * @throws InvalidArgumentException if the new content is of a different card type.
     */
    @Transactional
    public FlashCard updateCard(String ownerId, String cardId, CardContent content) {
        entityValidator.validate(content);

        FlashCardEntity entity = findOwned(ownerId, cardId);
        if (entity.getCardType() != content.getCardType()) {
            throw new InvalidArgumentException(ExceptionMessage.CARD_TYPE_CHANGED + ": "
                    + entity.getCardType() + " -> " + content.getCardType());
        }
        entity.setContent(content);
        flashCardRepository.save(entity);

        log.info("Updated content of card {} of {}", cardId, ownerId);
        return StoreMapper.toCard(entity);
    }

    @Transactional(readOnly = true)
    public FlashCard getCard(String ownerId, String cardId) {
        return StoreMapper.toCard(findOwned(ownerId, cardId));
    }

    @Transactional
    public void deleteCard(String ownerId, String cardId) {
        flashCardRepository.delete(findOwned(ownerId, cardId));
        log.info("Deleted card {} of {}", cardId, ownerId);
    }

    @Transactional(readOnly = true)
    public DeckStatistics getStatistics(String ownerId) {
        List<FlashCard> cards = flashCardRepository.findByOwnerId(ownerId).stream()
                .map(StoreMapper::toCard)
                .toList();
        return scheduler.summarize(cards, clock.instant());
    }

    private FlashCardEntity findOwned(String ownerId, String cardId) {
        return flashCardRepository.findByIdAndOwnerId(cardId, ownerId)
                .orElseThrow(() -> new NotFoundException(ExceptionMessage.CARD_NOT_FOUND, cardId));
    }
}
