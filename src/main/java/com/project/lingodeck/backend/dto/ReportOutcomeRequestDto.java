package com.project.lingodeck.backend.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@AllArgsConstructor
@NoArgsConstructor
public class ReportOutcomeRequestDto {
    @NotEmpty(message="cardId is required")
    String cardId;

    // 0 = Again, 1 = Hard, 2 = Good, 3 = Easy
    @NotNull(message="grade is required")
    @Min(value = 0, message="grade should be between 0 and 3")
    @Max(value = 3, message="grade should be between 0 and 3")
    Integer grade;

    // optional, lets a redelivered message be recognised
    String submissionToken;
}
