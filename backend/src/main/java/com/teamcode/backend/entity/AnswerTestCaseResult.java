package com.teamcode.backend.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Output an answer produced for one test case.
 */
@Entity
@Table(name = "answer_test_case_results")
@Getter
@Setter
@NoArgsConstructor
public class AnswerTestCaseResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "answer_id", nullable = false)
    private Answer answer;

    @NotNull
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "test_case_id", nullable = false)
    private TestCase testCase;

    @NotBlank
    @Column(columnDefinition = "TEXT", nullable = false)
    private String output;

    public AnswerTestCaseResult(Answer answer, TestCase testCase, String output) {
        this.answer = answer;
        this.testCase = testCase;
        this.output = output;
    }

    /**
     * Compares the produced output with the expected output of the test case, ignoring trailing whitespace.
     */
    public boolean isPassed() {
        if (output == null || testCase == null || testCase.getOutput() == null) {
            return false;
        }
        return output.stripTrailing().equals(testCase.getOutput().stripTrailing());
    }
}
