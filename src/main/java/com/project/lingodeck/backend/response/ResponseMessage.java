package com.project.lingodeck.backend.response;

public enum ResponseMessage {
    REVIEW_STARTED("Review started"),
    NOTHING_DUE("Nothing due for review"),
    NEXT_CARD("Outcome recorded"),
    SESSION_FINISHED("Review session finished"),
    EDIT_STARTED("Editing started"),
    EDIT_FINISHED("Editing finished"),
    SESSION_CANCELLED("Session cancelled"),
    CARD_CREATED("Flashcard created"),
    CARD_UPDATED("Flashcard updated"),
    CARD_DELETED("Flashcard deleted"),
    INVALID_STATE("Request does not fit the current session"),
    NOT_FOUND("Not found"),
    INVALID_REQUEST("Invalid request"),
    SERVICE_UNAVAILABLE("Service temporarily unavailable"),
    SUCCESS("Success"),
    ;
    private final String message;
    ResponseMessage(String message) {
        this.message = message;
    }

    public String toString() {
        return message;
    }
}
