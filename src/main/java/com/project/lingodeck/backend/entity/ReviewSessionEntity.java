package com.project.lingodeck.backend.entity;

import com.project.lingodeck.backend.session.SessionMode;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One row per learner; the queue lives in {@code review_session_queue}
 * with its order kept by {@code queue_position}.
 */
@Getter
@Setter
@Entity
@Table(name = "review_sessions")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class ReviewSessionEntity {

    @Id
    @Column(name = "owner_id", length = 64)
    String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, length = 16)
    SessionMode mode;

    @Column(name = "active_card_id", length = 64)
    String activeCardId;

    @Column(name = "editing_card_id", length = 64)
    String editingCardId;

    @Enumerated(EnumType.STRING)
    @Column(name = "resume_mode", length = 16)
    SessionMode resumeMode;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "review_session_queue", joinColumns = @JoinColumn(name = "owner_id"))
    @OrderColumn(name = "queue_position")
    @Column(name = "card_id", length = 64)
    List<String> queue = new ArrayList<>();

    @Column(name = "started_at")
    Instant startedAt;

    @Column(name = "updated_at")
    Instant updatedAt;

    @Column(name = "again_count")
    int againCount;

    @Column(name = "hard_count")
    int hardCount;

    @Column(name = "good_count")
    int goodCount;

    @Column(name = "easy_count")
    int easyCount;

    @Column(name = "last_submission_card_id", length = 64)
    String lastSubmissionCardId;

    @Column(name = "last_submission_token", length = 128)
    String lastSubmissionToken;
}
