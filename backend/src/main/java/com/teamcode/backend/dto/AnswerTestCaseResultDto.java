package com.teamcode.backend.dto;

import com.teamcode.backend.entity.AnswerTestCaseResult;

public record AnswerTestCaseResultDto(Long id, Long answerId, Long testCaseId, String output, String expectedOutput, boolean passed) {

    public static AnswerTestCaseResultDto from(AnswerTestCaseResult result) {
        return new AnswerTestCaseResultDto(
                result.getId(),
                result.getAnswer().getId(),
                result.getTestCase().getId(),
                result.getOutput(),
                result.getTestCase().getOutput(),
                result.isPassed()
        );
    }
}
