package com.teamcode.backend.repository;

import com.teamcode.backend.entity.Exercise;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExerciseRepository extends JpaRepository<Exercise, Long> {
    List<Exercise> findByUser_IdOrderByCreatedAtDesc(Long userId);
}
