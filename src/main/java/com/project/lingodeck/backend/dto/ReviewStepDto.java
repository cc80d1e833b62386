package com.project.lingodeck.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.project.lingodeck.backend.algorithm.Grade;
import com.project.lingodeck.backend.session.ReviewStep;
import com.project.lingodeck.backend.session.SessionSummary;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReviewStepDto {
    private FlashCardDto card;

    /** When the card would be due again for each answer button. */
    private Map<Grade, Instant> dueIfAnswered;

    private int remaining;
    private SessionSummary summary;
    private boolean nothingDue;

    public static ReviewStepDto from(ReviewStep step, Map<Grade, Instant> dueIfAnswered) {
        return new ReviewStepDto(
                step.hasCard() ? FlashCardDto.from(step.getCard()) : null,
                step.hasCard() ? dueIfAnswered : null,
                step.getRemaining(),
                step.getSummary(),
                step.isNothingDue());
    }
}
