package com.project.lingodeck.backend.exception;

public enum ExceptionMessage {

    CARD_NOT_FOUND("Flashcard does not exist"),
    CARD_TYPE_CHANGED("The card type of an existing flashcard cannot be changed"),
    INVALID_GRADE("Grade should be between 0 and 3"),
    SESSION_NOT_REVIEWING("No review is in progress"),
    SESSION_EDITING("A card is being edited, finish the edit first"),
    SESSION_NOT_EDITING("No card is being edited"),
    CARD_NOT_ACTIVE("Card is not the active card of this session"),
    GRADE_REQUIRED("A grade is required"),
    STORE_UNAVAILABLE("Session store is unavailable"),
    SESSION_BUSY("Another request for this learner is still in progress"),
    VALIDATION_FAILED("Validation has failed"),
    ;

    final private String message;
    ExceptionMessage(String message) {
        this.message = message;
    }

    public String toString() {
        return message;
    }
}
