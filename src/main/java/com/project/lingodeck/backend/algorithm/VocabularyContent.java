package com.project.lingodeck.backend.algorithm;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class VocabularyContent implements CardContent {
    @NotBlank(message = "front is required")
    private String front;
    @NotBlank(message = "back is required")
    private String back;
    private String notes;

    @Override
    public CardType getCardType() {
        return CardType.VOCABULARY;
    }
}
