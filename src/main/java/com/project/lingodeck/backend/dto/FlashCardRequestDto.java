package com.project.lingodeck.backend.dto;

import com.project.lingodeck.backend.algorithm.CardContent;
import com.project.lingodeck.backend.algorithm.CardType;
import com.project.lingodeck.backend.algorithm.GrammarFormContent;
import com.project.lingodeck.backend.algorithm.SentenceContent;
import com.project.lingodeck.backend.algorithm.VocabularyContent;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Flat request body for a new or edited card; which fields matter depends on {@code cardType}.
 * Required fields of each variant are checked on the built {@link CardContent}.
 */
@Getter
@AllArgsConstructor
@NoArgsConstructor
public class FlashCardRequestDto {
    @NotNull(message="cardType is required")
    CardType cardType;

    String front;
    String back;
    String notes;

    String dictionaryForm;
    String grammaticalCase;

    String prompt;
    String answer;
    String hint;

    public CardContent toContent() {
        return switch (cardType) {
            case VOCABULARY -> new VocabularyContent(front, back, notes);
            case GRAMMAR_FORM -> new GrammarFormContent(dictionaryForm, prompt, answer, grammaticalCase);
            case SENTENCE_PRODUCTION -> new SentenceContent(prompt, answer, hint);
        };
    }
}
