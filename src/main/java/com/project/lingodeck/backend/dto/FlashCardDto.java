package com.project.lingodeck.backend.dto;

import com.project.lingodeck.backend.algorithm.CardContent;
import com.project.lingodeck.backend.algorithm.CardType;
import com.project.lingodeck.backend.algorithm.FlashCard;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class FlashCardDto {
    private String id;
    private CardType cardType;
    private CardContent content;
    private double easeFactor;
    private int intervalDays;
    private int repetitions;
    private int lapses;
    private Instant dueAt;
    private Instant lastReviewedAt;

    public static FlashCardDto from(FlashCard card) {
        return new FlashCardDto(card.getId(), card.getCardType(), card.getContent(), card.getEaseFactor(),
                card.getIntervalDays(), card.getRepetitions(), card.getLapses(), card.getDueAt(), card.getLastReviewedAt());
    }
}
