package com.teamcode.backend.dto;

import com.teamcode.backend.entity.TestCase;

public record TestCaseDto(Long id, Long questionId, String title, String input, String output) {

    public static TestCaseDto from(TestCase testCase) {
        return new TestCaseDto(
                testCase.getId(),
                testCase.getQuestion().getId(),
                testCase.getTitle(),
                testCase.getInput(),
                testCase.getOutput()
        );
    }

    public static TestCaseDto withoutOutput(TestCase testCase) {
        return new TestCaseDto(testCase.getId(), testCase.getQuestion().getId(), testCase.getTitle(), testCase.getInput(), null);
    }
}
