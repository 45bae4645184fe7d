package com.teamcode.backend.repository;

import com.teamcode.backend.entity.TestCase;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TestCaseRepository extends JpaRepository<TestCase, Long> {
    List<TestCase> findByQuestion_IdOrderByIdAsc(Long questionId);
}
