package com.teamcode.backend.dto;

import com.teamcode.backend.entity.Question;

public record QuestionDto(Long id, Long exerciseId, String title, String description, int score, int testCaseCount) {

    public static QuestionDto from(Question question) {
        return new QuestionDto(
                question.getId(),
                question.getExercise().getId(),
                question.getTitle(),
                question.getDescription(),
                question.getScore(),
                question.getTestCases().size()
        );
    }
}
