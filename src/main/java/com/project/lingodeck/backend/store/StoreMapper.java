package com.project.lingodeck.backend.store;

import com.project.lingodeck.backend.algorithm.FlashCard;
import com.project.lingodeck.backend.entity.FlashCardEntity;
import com.project.lingodeck.backend.entity.ReviewSessionEntity;
import com.project.lingodeck.backend.session.ReviewSession;
import com.project.lingodeck.backend.session.SessionStats;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the immutable engine values and their JPA entities.
 */
public final class StoreMapper {

    private StoreMapper() {
    }

    public static FlashCard toCard(FlashCardEntity entity) {
        return FlashCard.builder()
                .id(entity.getId())
                .ownerId(entity.getOwnerId())
                .cardType(entity.getCardType())
                .content(entity.getContent())
                .easeFactor(entity.getEaseFactor())
                .intervalDays(entity.getIntervalDays())
                .repetitions(entity.getRepetitions())
                .lapses(entity.getLapses())
                .dueAt(entity.getDueAt())
                .lastReviewedAt(entity.getLastReviewedAt())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    public static FlashCardEntity toEntity(FlashCard card) {
        return FlashCardEntity.builder()
                .id(card.getId())
                .ownerId(card.getOwnerId())
                .cardType(card.getCardType())
                .content(card.getContent())
                .easeFactor(card.getEaseFactor())
                .intervalDays(card.getIntervalDays())
                .repetitions(card.getRepetitions())
                .lapses(card.getLapses())
                .dueAt(card.getDueAt())
                .lastReviewedAt(card.getLastReviewedAt())
                .createdAt(card.getCreatedAt())
                .build();
    }

    public static ReviewSession toSession(ReviewSessionEntity entity) {
        return ReviewSession.builder()
                .ownerId(entity.getOwnerId())
                .mode(entity.getMode())
                .activeCardId(entity.getActiveCardId())
                .editingCardId(entity.getEditingCardId())
                .resumeMode(entity.getResumeMode())
                .queue(entity.getQueue() == null ? List.of() : List.copyOf(entity.getQueue()))
                .startedAt(entity.getStartedAt())
                .updatedAt(entity.getUpdatedAt())
                .stats(new SessionStats(entity.getAgainCount(), entity.getHardCount(),
                        entity.getGoodCount(), entity.getEasyCount()))
                .lastSubmissionCardId(entity.getLastSubmissionCardId())
                .lastSubmissionToken(entity.getLastSubmissionToken())
                .build();
    }

    public static ReviewSessionEntity toEntity(ReviewSession session) {
        SessionStats stats = session.getStats() == null ? SessionStats.empty() : session.getStats();
        return ReviewSessionEntity.builder()
                .ownerId(session.getOwnerId())
                .mode(session.getMode())
                .activeCardId(session.getActiveCardId())
                .editingCardId(session.getEditingCardId())
                .resumeMode(session.getResumeMode())
                .queue(session.getQueue() == null ? new ArrayList<>() : new ArrayList<>(session.getQueue()))
                .startedAt(session.getStartedAt())
                .updatedAt(session.getUpdatedAt())
                .againCount(stats.getAgain())
                .hardCount(stats.getHard())
                .goodCount(stats.getGood())
                .easyCount(stats.getEasy())
                .lastSubmissionCardId(session.getLastSubmissionCardId())
                .lastSubmissionToken(session.getLastSubmissionToken())
                .build();
    }
}
