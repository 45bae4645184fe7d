package com.teamcode.backend.dto;

public record EligibilityDto(
        Long teamId,
        Long questionId,
        boolean orDependenciesCompleted,
        boolean andDependenciesCompleted,
        boolean ableToAnswer
) {}
