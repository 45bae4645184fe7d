package com.teamcode.backend.dto;

import com.teamcode.backend.entity.Exercise;

import java.time.LocalDateTime;

public record ExerciseDto(Long id, String title, String description, Long authorId, LocalDateTime createdAt) {

    public static ExerciseDto from(Exercise exercise) {
        return new ExerciseDto(
                exercise.getId(),
                exercise.getTitle(),
                exercise.getDescription(),
                exercise.getUser().getId(),
                exercise.getCreatedAt()
        );
    }
}
