package com.project.lingodeck.backend.algorithm;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SentenceContent implements CardContent {
    @NotBlank(message = "prompt is required")
    private String prompt;
    @NotBlank(message = "answer is required")
    private String answer;
    private String hint;

    @Override
    public CardType getCardType() {
        return CardType.SENTENCE_PRODUCTION;
    }
}
