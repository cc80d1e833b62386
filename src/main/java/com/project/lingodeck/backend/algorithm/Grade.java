package com.project.lingodeck.backend.algorithm;

import java.util.Arrays;

/**
 * The learner's self-assessment for one review, on Anki's four-point scale.
 *
 * The int value is what the transport layer sends over the wire.
 *
 * <pre>
 *  0 = AGAIN: forgotten; the card lapses and is relearnt.
 *  1 = HARD:  recalled with serious difficulty.
 *  2 = GOOD:  recalled after some hesitation.
 *  3 = EASY:  recalled instantly.
 * </pre>
 */
public enum Grade {

    AGAIN(0),
    HARD(1),
    GOOD(2),
    EASY(3);

    private final int value;

    Grade(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Looks up a grade by its wire value.
     *
     * @throws IllegalArgumentException if the value is outside 0..3.
     */
    public static Grade fromValue(int value) {
        return Arrays.stream(values())
                .filter(grade -> grade.value == value)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown grade value: " + value));
    }
}
