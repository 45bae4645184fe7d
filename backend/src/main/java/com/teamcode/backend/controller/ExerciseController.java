package com.teamcode.backend.controller;

import com.teamcode.backend.auth.AuthPrincipal;
import com.teamcode.backend.dto.CreateDependencyRequest;
import com.teamcode.backend.dto.CreateExerciseRequest;
import com.teamcode.backend.dto.CreateQuestionRequest;
import com.teamcode.backend.dto.CreateTestCaseRequest;
import com.teamcode.backend.dto.DependencyDto;
import com.teamcode.backend.dto.ExerciseDto;
import com.teamcode.backend.dto.QuestionDto;
import com.teamcode.backend.dto.TestCaseDto;
import com.teamcode.backend.service.ExerciseService;
import com.teamcode.backend.service.QuestionDependencyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ExerciseController {

    private final ExerciseService exerciseService;
    private final QuestionDependencyService questionDependencyService;

    @PostMapping("/exercises")
    public ResponseEntity<ExerciseDto> createExercise(
            @AuthenticationPrincipal AuthPrincipal principal,
            @Valid @RequestBody CreateExerciseRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(exerciseService.createExercise(principal.id(), request));
    }

    @GetMapping("/exercises")
    public ResponseEntity<List<ExerciseDto>> listOwnExercises(@AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(exerciseService.listOwnExercises(principal.id()));
    }

    @GetMapping("/exercises/{exerciseId}/questions")
    public ResponseEntity<List<QuestionDto>> listQuestions(@PathVariable Long exerciseId) {
        return ResponseEntity.ok(exerciseService.listQuestions(exerciseId));
    }

    @PostMapping("/exercises/{exerciseId}/questions")
    public ResponseEntity<QuestionDto> addQuestion(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long exerciseId,
            @Valid @RequestBody CreateQuestionRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(exerciseService.addQuestion(principal.id(), exerciseId, request));
    }

    @GetMapping("/questions/{questionId}/test-cases")
    public ResponseEntity<List<TestCaseDto>> listTestCases(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long questionId
    ) {
        return ResponseEntity.ok(exerciseService.listTestCases(principal.id(), questionId));
    }

    @PostMapping("/questions/{questionId}/test-cases")
    public ResponseEntity<TestCaseDto> addTestCase(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long questionId,
            @Valid @RequestBody CreateTestCaseRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(exerciseService.addTestCase(principal.id(), questionId, request));
    }

    @GetMapping("/questions/{questionId}/dependencies")
    public ResponseEntity<List<DependencyDto>> listDependencies(@PathVariable Long questionId) {
        return ResponseEntity.ok(questionDependencyService.listDependencies(questionId));
    }

    @PostMapping("/questions/{questionId}/dependencies")
    public ResponseEntity<DependencyDto> addDependency(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long questionId,
            @Valid @RequestBody CreateDependencyRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(questionDependencyService.addDependency(principal.id(), questionId, request));
    }
}
