package com.project.lingodeck.backend.session;

import com.project.lingodeck.backend.algorithm.Grade;
import lombok.Value;

/** Number of answers per grade in one review session. */
@Value
public class SessionStats {
    int again;
    int hard;
    int good;
    int easy;

    public static SessionStats empty() {
        return new SessionStats(0, 0, 0, 0);
    }

    /** Returns a copy with one more answer of the given grade. */
    public SessionStats record(Grade grade) {
        return switch (grade) {
            case AGAIN -> new SessionStats(again + 1, hard, good, easy);
            case HARD -> new SessionStats(again, hard + 1, good, easy);
            case GOOD -> new SessionStats(again, hard, good + 1, easy);
            case EASY -> new SessionStats(again, hard, good, easy + 1);
        };
    }

    public int total() {
        return again + hard + good + easy;
    }

    /** Share of answers that were not {@link Grade#AGAIN}, in percent, one decimal. */
    public double recallRate() {
        int total = total();
        if (total == 0) {
            return 0.0;
        }
        return Math.round((total - again) * 1000.0 / total) / 10.0;
    }
}
