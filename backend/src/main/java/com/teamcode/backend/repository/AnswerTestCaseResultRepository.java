package com.teamcode.backend.repository;

import com.teamcode.backend.entity.Answer;
import com.teamcode.backend.entity.AnswerTestCaseResult;
import com.teamcode.backend.entity.TestCase;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AnswerTestCaseResultRepository extends JpaRepository<AnswerTestCaseResult, Long> {

    @EntityGraph(attributePaths = {"answer", "testCase"})
    List<AnswerTestCaseResult> findByAnswerAndTestCase(Answer answer, TestCase testCase);

    @EntityGraph(attributePaths = {"testCase"})
    List<AnswerTestCaseResult> findByAnswer_IdOrderByIdAsc(Long answerId);
}
