package com.teamcode.backend.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * A solution together with the output it produced for each test case of the question.
 */
public record SubmitAnswerRequest(
        String content,
        @NotNull @Valid List<TestCaseOutput> outputs
) {
    public record TestCaseOutput(@NotNull Long testCaseId, String output) {}
}
