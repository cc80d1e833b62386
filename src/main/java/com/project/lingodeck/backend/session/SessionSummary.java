package com.project.lingodeck.backend.session;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Returned when a review session runs out of cards. */
@Value
@Builder
public class SessionSummary {
    String ownerId;
    Instant startedAt;
    Instant finishedAt;
    SessionStats stats;
    int reviewed;
    double recallRate;

    public static SessionSummary of(ReviewSession session) {
        SessionStats stats = session.getStats() == null ? SessionStats.empty() : session.getStats();
        return SessionSummary.builder()
                .ownerId(session.getOwnerId())
                .startedAt(session.getStartedAt())
                .finishedAt(session.getUpdatedAt())
                .stats(stats)
                .reviewed(stats.total())
                .recallRate(stats.recallRate())
                .build();
    }
}
