package com.teamcode.backend.dto;

import jakarta.validation.constraints.NotBlank;

public record CreateTestCaseRequest(
        String title,
        String input,
        @NotBlank(message = "Expected output must not be blank")
        String output
) {}
