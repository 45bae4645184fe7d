package com.teamcode.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record CreateQuestionRequest(
        @NotBlank(message = "Title must not be blank")
        String title,
        String description,
        @PositiveOrZero
        int score
) {}
