package com.project.lingodeck.backend.session;

/**
 * What a learner's session is doing right now.
 *
 * <pre>
 *  IDLE:      initial and resting state; no card is in flight.
 *  REVIEWING: a queue of due cards is being worked through; one card is active.
 *  EDITING:   a card is being edited; scheduling is suspended until the edit
 *              finishes and the previous mode is restored.
 * </pre>
 */
public enum SessionMode {

    IDLE,
    REVIEWING,
    EDITING
}
