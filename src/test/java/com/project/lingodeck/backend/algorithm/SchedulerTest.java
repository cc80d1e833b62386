package com.project.lingodeck.backend.algorithm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SchedulerTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");
    private static final String OWNER = "learner-1";

    private SchedulerSettings settings;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        settings = new SchedulerSettings();
        scheduler = new Scheduler(settings);
    }

    private static FlashCard newCard(String id) {
        return FlashCard.newCard(id, OWNER, new VocabularyContent("дом", "house", null), 2.5, T0.minus(Duration.ofDays(3)));
    }

    private static FlashCard reviewedCard(int repetitions, int intervalDays, double ease) {
        return newCard("card-1").toBuilder()
                .repetitions(repetitions)
                .intervalDays(intervalDays)
                .easeFactor(ease)
                .lastReviewedAt(T0.minus(Duration.ofDays(intervalDays)))
                .dueAt(T0)
                .build();
    }

    private static FlashCard dueAt(String id, Instant dueAt) {
        return newCard(id).toBuilder().dueAt(dueAt).build();
    }

    @Nested
    @DisplayName("applyOutcome")
    class ApplyOutcome {

        @Test
        @DisplayName("GOOD on a new card schedules it for tomorrow")
        void goodOnNewCard() {
            FlashCard card = FlashCard.newCard("c", OWNER, new VocabularyContent("кот", "cat", null), 2.5, T0);

            FlashCard next = scheduler.applyOutcome(card, Grade.GOOD, T0);

            assertThat(next.getRepetitions()).isEqualTo(1);
            assertThat(next.getIntervalDays()).isEqualTo(1);
            assertThat(next.getDueAt()).isEqualTo(T0.plus(Duration.ofDays(1)));
            assertThat(next.getEaseFactor()).isEqualTo(2.5);
            assertThat(next.getLastReviewedAt()).isEqualTo(T0);
        }

        @Test
        @DisplayName("GOOD on a reviewed card multiplies the interval by the ease")
        void goodOnReviewedCard() {
            FlashCard next = scheduler.applyOutcome(reviewedCard(3, 6, 2.5), Grade.GOOD, T0);

            assertThat(next.getIntervalDays()).isEqualTo(15);
            assertThat(next.getDueAt()).isEqualTo(T0.plus(Duration.ofDays(15)));
            assertThat(next.getRepetitions()).isEqualTo(4);
            assertThat(next.getEaseFactor()).isEqualTo(2.5);
        }

        @Test
        @DisplayName("AGAIN resets the streak, counts a lapse and makes the card due immediately")
        void againLapsesTheCard() {
            FlashCard card = reviewedCard(3, 6, 2.5);

            FlashCard next = scheduler.applyOutcome(card, Grade.AGAIN, T0);

            assertThat(next.getRepetitions()).isZero();
            assertThat(next.getLapses()).isEqualTo(card.getLapses() + 1);
            assertThat(next.getEaseFactor()).isCloseTo(2.3, within(1e-9));
            assertThat(next.getIntervalDays()).isZero();
            assertThat(next.getDueAt()).isEqualTo(T0);
            assertThat(next.isDue(T0)).isTrue();
        }

        @Test
        @DisplayName("AGAIN waits for the configured relearn interval")
        void againUsesRelearnInterval() {
            settings.setRelearnInterval(Duration.ofMinutes(10));

            FlashCard next = scheduler.applyOutcome(reviewedCard(3, 6, 2.5), Grade.AGAIN, T0);

            assertThat(next.getDueAt()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
        }

        @Test
        @DisplayName("HARD lowers the ease and grows the interval by 1.2")
        void hard() {
            FlashCard next = scheduler.applyOutcome(reviewedCard(3, 6, 2.5), Grade.HARD, T0);

            assertThat(next.getEaseFactor()).isCloseTo(2.35, within(1e-9));
            assertThat(next.getIntervalDays()).isEqualTo(7);
            assertThat(next.getRepetitions()).isEqualTo(4);
            assertThat(next.getDueAt()).isEqualTo(T0.plus(Duration.ofDays(7)));
        }

        @Test
        @DisplayName("HARD on a new card still waits at least one day")
        void hardOnNewCard() {
            FlashCard next = scheduler.applyOutcome(newCard("c"), Grade.HARD, T0);

            assertThat(next.getIntervalDays()).isEqualTo(1);
            assertThat(next.getDueAt()).isEqualTo(T0.plus(Duration.ofDays(1)));
        }

        @Test
        @DisplayName("EASY raises the ease first and applies the easy multiplier")
        void easy() {
            FlashCard next = scheduler.applyOutcome(reviewedCard(3, 6, 2.5), Grade.EASY, T0);

            // round(6 * 2.65 * 1.3) = round(20.67)
            assertThat(next.getEaseFactor()).isCloseTo(2.65, within(1e-9));
            assertThat(next.getIntervalDays()).isEqualTo(21);
            assertThat(next.getRepetitions()).isEqualTo(4);
        }

        @Test
        @DisplayName("EASY on a new card treats the interval as one day")
        void easyOnNewCard() {
            FlashCard next = scheduler.applyOutcome(newCard("c"), Grade.EASY, T0);

            // round(1 * 2.65 * 1.3) = round(3.445)
            assertThat(next.getIntervalDays()).isEqualTo(3);
        }

        @Test
        @DisplayName("intervals never exceed the configured maximum")
        void intervalIsCapped() {
            settings.setMaximumIntervalDays(30);

            FlashCard next = scheduler.applyOutcome(reviewedCard(5, 20, 2.5), Grade.GOOD, T0);

            assertThat(next.getIntervalDays()).isEqualTo(30);
        }

        @Test
        @DisplayName("the same inputs give the same result and leave the input card untouched")
        void isReferentiallyTransparent() {
            FlashCard card = reviewedCard(3, 6, 2.5);
            FlashCard before = card.toBuilder().build();

            for (Grade grade : Grade.values()) {
                FlashCard first = scheduler.applyOutcome(card, grade, T0);
                FlashCard second = scheduler.applyOutcome(card, grade, T0);
                assertThat(second).isEqualTo(first);
            }
            assertThat(card).isEqualTo(before);
        }

        @Test
        @DisplayName("the ease never drops below the minimum, whatever the answers")
        void easeFloorHolds() {
            Random random = new Random(42);
            FlashCard card = newCard("c");
            Instant now = T0;

            for (int i = 0; i < 2_000; i++) {
                Grade grade = Grade.values()[random.nextInt(4)];
                card = scheduler.applyOutcome(card, grade, now);
                now = now.plus(Duration.ofHours(random.nextInt(48)));

                assertThat(card.getEaseFactor()).isGreaterThanOrEqualTo(settings.getMinimumEase());
                assertThat(card.getIntervalDays()).isGreaterThanOrEqualTo(0);
                assertThat(card.getDueAt()).isNotNull();
            }
        }

        @Test
        @DisplayName("a card at the ease floor stays there after AGAIN")
        void againAtTheFloor() {
            FlashCard next = scheduler.applyOutcome(reviewedCard(2, 3, 1.35), Grade.AGAIN, T0);

            assertThat(next.getEaseFactor()).isEqualTo(1.3);
        }
    }

    @Nested
    @DisplayName("nextDue")
    class NextDue {

        @Test
        @DisplayName("returns only due cards, most overdue first")
        void filtersAndOrders() {
            List<FlashCard> cards = List.of(
                    dueAt("b", T0.minus(Duration.ofHours(1))),
                    dueAt("future", T0.plus(Duration.ofMinutes(1))),
                    dueAt("a", T0.minus(Duration.ofDays(2))),
                    dueAt("exactly-now", T0));

            assertThat(scheduler.nextDue(cards, T0)).containsExactly("a", "b", "exactly-now");
        }

        @Test
        @DisplayName("breaks ties by id so input order does not matter")
        void tiesByIdAndStable() {
            Instant due = T0.minus(Duration.ofHours(3));
            List<FlashCard> cards = new ArrayList<>(List.of(
                    dueAt("c3", due), dueAt("c1", due), dueAt("c2", due), dueAt("c0", T0.minus(Duration.ofDays(1)))));

            List<String> expected = List.of("c0", "c1", "c2", "c3");
            for (int seed = 0; seed < 5; seed++) {
                Collections.shuffle(cards, new Random(seed));
                assertThat(scheduler.nextDue(cards, T0)).isEqualTo(expected);
            }
        }

        @Test
        @DisplayName("empty input or nothing due gives an empty list")
        void emptyResults() {
            assertThat(scheduler.nextDue(List.of(), T0)).isEmpty();
            assertThat(scheduler.nextDue(List.of(dueAt("x", T0.plusSeconds(1))), T0)).isEmpty();
        }
    }

    @Test
    @DisplayName("previewDueDates lists the due date for every grade")
    void previewDueDates() {
        Map<Grade, Instant> preview = scheduler.previewDueDates(reviewedCard(3, 6, 2.5), T0);

        assertThat(preview).containsOnlyKeys(Grade.values());
        assertThat(preview.get(Grade.AGAIN)).isEqualTo(T0);
        assertThat(preview.get(Grade.HARD)).isEqualTo(T0.plus(Duration.ofDays(7)));
        assertThat(preview.get(Grade.GOOD)).isEqualTo(T0.plus(Duration.ofDays(15)));
        assertThat(preview.get(Grade.EASY)).isEqualTo(T0.plus(Duration.ofDays(21)));
    }

    @Test
    @DisplayName("summarize counts due, overdue, new and difficult cards")
    void summarize() {
        FlashCard fresh = newCard("new");
        FlashCard overdue = reviewedCard(1, 1, 2.5).toBuilder().id("overdue").dueAt(T0.minus(Duration.ofDays(3))).build();
        FlashCard difficult = reviewedCard(0, 0, 1.8).toBuilder().id("difficult").lapses(2).dueAt(T0.plus(Duration.ofDays(1))).build();
        FlashCard grammar = FlashCard.newCard("grammar", OWNER,
                new GrammarFormContent("книга", "genitive plural", "книг", "genitive"), 2.5, T0.plus(Duration.ofDays(1)));

        DeckStatistics stats = scheduler.summarize(List.of(fresh, overdue, difficult, grammar), T0);

        assertThat(stats.getTotal()).isEqualTo(4);
        assertThat(stats.getDueNow()).isEqualTo(2);
        assertThat(stats.getOverdue()).isEqualTo(2);
        assertThat(stats.getNewCards()).isEqualTo(2);
        assertThat(stats.getDifficult()).isEqualTo(1);
        assertThat(stats.getAverageEase()).isCloseTo(2.325, within(1e-9));
        assertThat(stats.getByType())
                .containsEntry(CardType.VOCABULARY, 3L)
                .containsEntry(CardType.GRAMMAR_FORM, 1L)
                .containsEntry(CardType.SENTENCE_PRODUCTION, 0L);
    }

    @Test
    @DisplayName("summarize does not count a lapsed card as new, and flags lapses outrunning the streak")
    void summarizeLapsedCard() {
        FlashCard lapsed = scheduler.applyOutcome(reviewedCard(3, 10, 2.5), Grade.AGAIN, T0);
        FlashCard recovering = reviewedCard(1, 1, 2.5).toBuilder().id("recovering").lapses(2).build();
        FlashCard steady = reviewedCard(3, 10, 2.5).toBuilder().id("steady").lapses(2).build();

        DeckStatistics stats = scheduler.summarize(List.of(lapsed, recovering, steady), T0);

        assertThat(lapsed.getRepetitions()).isZero();
        assertThat(stats.getNewCards()).isZero();
        // lapsed: 1 lapse > 0 streak, recovering: 2 > 1, steady: 2 < 3
        assertThat(stats.getDifficult()).isEqualTo(2);
    }
}
