package com.project.lingodeck.backend.entity;

import com.project.lingodeck.backend.algorithm.CardContent;
import com.project.lingodeck.backend.algorithm.CardType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "flashcards", indexes = {
        @Index(name = "idx_flashcards_owner_due", columnList = "owner_id, due_at")
})
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class FlashCardEntity {

    @Id
    @Column(name = "id", length = 64)
    String id;

    @Column(name = "owner_id", nullable = false, length = 64)
    String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "card_type", nullable = false, length = 32)
    CardType cardType;

    @Convert(converter = CardContentConverter.class)
    @Column(name = "content", length = 4000)
    CardContent content;

    @Column(name = "ease_factor", nullable = false)
    double easeFactor;

    @Column(name = "interval_days", nullable = false)
    int intervalDays;

    @Column(name = "repetitions", nullable = false)
    int repetitions;

    @Column(name = "lapses", nullable = false)
    int lapses;

    @Column(name = "due_at", nullable = false)
    Instant dueAt;

    @Column(name = "last_reviewed_at")
    Instant lastReviewedAt;

    @Column(name = "created_at")
    Instant createdAt;
}
