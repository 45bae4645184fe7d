package com.teamcode.backend.repository;

import com.teamcode.backend.entity.Question;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface QuestionRepository extends JpaRepository<Question, Long> {
    List<Question> findByExercise_IdOrderByIdAsc(Long exerciseId);
}
