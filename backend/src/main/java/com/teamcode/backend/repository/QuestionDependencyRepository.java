package com.teamcode.backend.repository;

import com.teamcode.backend.entity.DependencyOperator;
import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.QuestionDependency;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface QuestionDependencyRepository extends JpaRepository<QuestionDependency, Long> {

    @EntityGraph(attributePaths = {"question2"})
    List<QuestionDependency> findByQuestion1AndOperator(Question question1, DependencyOperator operator);

    @EntityGraph(attributePaths = {"question2"})
    List<QuestionDependency> findByQuestion1_IdOrderByIdAsc(Long questionId);

    List<QuestionDependency> findByQuestion1_Exercise_Id(Long exerciseId);

    boolean existsByQuestion1AndQuestion2(Question question1, Question question2);
}
