package com.teamcode.backend.dto;

import com.teamcode.backend.entity.DependencyOperator;
import com.teamcode.backend.entity.QuestionDependency;

public record DependencyDto(Long id, Long questionId, Long prerequisiteId, DependencyOperator operator) {

    public static DependencyDto from(QuestionDependency dependency) {
        return new DependencyDto(
                dependency.getId(),
                dependency.getQuestion1().getId(),
                dependency.getQuestion2().getId(),
                dependency.getOperator()
        );
    }
}
