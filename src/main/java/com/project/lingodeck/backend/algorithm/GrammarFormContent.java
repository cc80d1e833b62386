package com.project.lingodeck.backend.algorithm;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Asks for one inflected form of a dictionary word,
 * e.g. the genitive plural of "книга".
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class GrammarFormContent implements CardContent {
    @NotBlank(message = "dictionaryForm is required")
    private String dictionaryForm;
    @NotBlank(message = "prompt is required")
    private String prompt;
    @NotBlank(message = "answer is required")
    private String answer;
    private String grammaticalCase;

    @Override
    public CardType getCardType() {
        return CardType.GRAMMAR_FORM;
    }
}
