package com.project.lingodeck.backend.algorithm;

/**
 * The closed set of flashcard variants the tutor produces.
 *
 * The scheduler never branches on the type; it is carried so that the
 * presentation layer knows how to render the {@link CardContent} payload.
 *
 * <pre>
 *  VOCABULARY:          a word with its translation (front / back).
 *  GRAMMAR_FORM:        an inflected form of a dictionary word (case, tense, ...).
 *  SENTENCE_PRODUCTION: the learner produces a full sentence from a prompt.
 * </pre>
 */
public enum CardType {

    VOCABULARY,
    GRAMMAR_FORM,
    SENTENCE_PRODUCTION
}
