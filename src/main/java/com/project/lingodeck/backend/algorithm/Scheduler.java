package com.project.lingodeck.backend.algorithm;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The SM-2 family core of the review engine.
 *
 * A scheduler supports two main operations:
 *   1. {@link #nextDue}:       which cards are due now, and in which order.
 *   2. {@link #applyOutcome}:  how a grade moves a card's due date and ease
 *                               (0=Again, 1=Hard, 2=Good, 3=Easy).
 *
 * Both are pure functions of their arguments and the {@link SchedulerSettings}
 * the scheduler was built with: no I/O, no clock, no state between calls.
 * Calling {@code applyOutcome(card, grade, now)} twice with the same
 * arguments gives equal results, which is what makes a retried request safe.
 */
@Getter
public class Scheduler {

    /** Cards with an ease below this count as "difficult" in {@link #summarize}. */
    private static final double DIFFICULT_EASE = 2.0;

    /** Orders due cards oldest-overdue first, ties broken by id for determinism. */
    private static final Comparator<FlashCard> DUE_ORDER =
            Comparator.comparing(FlashCard::getDueAt).thenComparing(FlashCard::getId);

    private final SchedulerSettings settings;

    public Scheduler(SchedulerSettings settings) {
        this.settings = settings;
    }

    // =====================================================================
    //  DUE CARDS
    // =====================================================================

    /**
     * Returns the ids of the cards that are due at {@code now}.
     *
     * Logic:
     *   1. Keep cards whose {@code dueAt <= now}.
     *   2. Sort by {@code dueAt} ascending, so the most overdue card comes first.
     *   3. Break ties by ascending id so the order never depends on input order.
     *
     * @return the ordered ids; empty (never null) when nothing is due.
     */
    public List<String> nextDue(Collection<FlashCard> cards, Instant now) {
        return cards.stream()
                .filter(card -> card.isDue(now))
                .sorted(DUE_ORDER)
                .map(FlashCard::getId)
                .collect(Collectors.toList());
    }

    // =====================================================================
    //  ANSWERING
    // =====================================================================

    /**
     * Returns a copy of {@code card} rescheduled for the given grade.
     *
     * <pre>
     *  AGAIN: repetitions = 0, lapses + 1, ease - againPenalty,
     *          interval = 0, due after the relearn interval.
     *  HARD:  repetitions + 1, ease - hardPenalty,
     *          interval = max(1, round(interval × 1.2)).
     *  GOOD:  repetitions + 1, ease unchanged,
     *          interval = 1 on the first success, else round(interval × ease).
     *  EASY:  repetitions + 1, ease + easyBonus,
     *          interval = round(max(1, interval) × ease × 1.3).
     * </pre>
     *
     * The ease never drops below the configured minimum and intervals are capped
     * at the configured maximum. {@code lastReviewedAt} is always set to {@code now}.
     */
    public FlashCard applyOutcome(FlashCard card, Grade grade, Instant now) {
        FlashCard.FlashCardBuilder next = card.toBuilder().lastReviewedAt(now);

        return switch (grade) {
            case AGAIN -> next
                    .repetitions(0)
                    .lapses(card.getLapses() + 1)
                    .easeFactor(lowerEase(card.getEaseFactor(), settings.getAgainPenalty()))
                    .intervalDays(0)
                    .dueAt(now.plus(relearnInterval()))
                    .build();
            case HARD -> {
                int interval = cap(Math.max(1,
                        SchedulingAlgoUtils.roundDays(card.getIntervalDays() * settings.getHardIntervalMultiplier())));
                yield next
                        .repetitions(card.getRepetitions() + 1)
                        .easeFactor(lowerEase(card.getEaseFactor(), settings.getHardPenalty()))
                        .intervalDays(interval)
                        .dueAt(SchedulingAlgoUtils.plusDays(now, interval))
                        .build();
            }
            case GOOD -> {
                int repetitions = card.getRepetitions() + 1;
                int interval = repetitions == 1
                        ? 1
                        : cap(Math.max(1, SchedulingAlgoUtils.roundDays(card.getIntervalDays() * card.getEaseFactor())));
                yield next
                        .repetitions(repetitions)
                        .intervalDays(interval)
                        .dueAt(SchedulingAlgoUtils.plusDays(now, interval))
                        .build();
            }
            case EASY -> {
                double ease = SchedulingAlgoUtils.roundEase(card.getEaseFactor() + settings.getEasyBonus());
                int interval = cap(SchedulingAlgoUtils.roundDays(
                        Math.max(1, card.getIntervalDays()) * ease * settings.getEasyIntervalMultiplier()));
                yield next
                        .repetitions(card.getRepetitions() + 1)
                        .easeFactor(ease)
                        .intervalDays(interval)
                        .dueAt(SchedulingAlgoUtils.plusDays(now, interval))
                        .build();
            }
        };
    }

    /**
     * Returns the due date each grade would give {@code card} if answered at {@code now}.
     * Lets the caller label the four answer buttons ("Good · 15d").
     */
    public Map<Grade, Instant> previewDueDates(FlashCard card, Instant now) {
        Map<Grade, Instant> preview = new EnumMap<>(Grade.class);
        for (Grade grade : Grade.values()) {
            preview.put(grade, applyOutcome(card, grade, now).getDueAt());
        }
        return preview;
    }

    // =====================================================================
    //  STATISTICS
    // =====================================================================

    /**
     * Summarizes a learner's card population at {@code now}.
     *
     * A card is "overdue" when it has been due for more than a day, and
     * "difficult" when its ease is below 2.0 or it has lapsed more often
     * than its current success streak.
     *
     * "New" means never reviewed ({@code lastReviewedAt == null}), not
     * {@code repetitions == 0}: repetitions is a streak that AGAIN resets, so a
     * lapsed card is not new. Only the lifetime lapse count is stored, so the
     * streak stands in for the number of correct answers in "difficult"; this is
     * stricter than comparing lifetime totals.
     */
    public DeckStatistics summarize(Collection<FlashCard> cards, Instant now) {
        Instant overdueBefore = now.minus(Duration.ofDays(1));

        Map<CardType, Long> byType = new EnumMap<>(CardType.class);
        for (CardType type : CardType.values()) {
            byType.put(type, 0L);
        }
        cards.forEach(card -> byType.merge(card.getCardType(), 1L, Long::sum));

        return DeckStatistics.builder()
                .total(cards.size())
                .dueNow(cards.stream().filter(card -> card.isDue(now)).count())
                .overdue(cards.stream().filter(card -> card.getDueAt().isBefore(overdueBefore)).count())
                .newCards(cards.stream().filter(FlashCard::isNew).count())
                .difficult(cards.stream()
                        .filter(card -> card.getEaseFactor() < DIFFICULT_EASE || card.getLapses() > card.getRepetitions())
                        .count())
                .averageEase(SchedulingAlgoUtils.roundEase(cards.stream()
                        .mapToDouble(FlashCard::getEaseFactor)
                        .average()
                        .orElse(0.0)))
                .byType(byType)
                .build();
    }

    // -----------------------------------------------------------------------
    // helpers
    // -----------------------------------------------------------------------

    private double lowerEase(double ease, double penalty) {
        return Math.max(settings.getMinimumEase(), SchedulingAlgoUtils.roundEase(ease - penalty));
    }

    private int cap(int intervalDays) {
        return Math.min(intervalDays, settings.getMaximumIntervalDays());
    }

    private Duration relearnInterval() {
        Duration interval = settings.getRelearnInterval();
        return interval == null ? Duration.ZERO : interval;
    }
}
