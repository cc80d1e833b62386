package com.project.lingodeck.backend.algorithm;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/** Snapshot counts over one learner's cards, see {@link Scheduler#summarize}. */
@Value
@Builder
public class DeckStatistics {
    long total;
    long dueNow;
    long overdue;
    long newCards;
    long difficult;
    double averageEase;
    Map<CardType, Long> byType;
}
