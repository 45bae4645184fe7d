package com.teamcode.backend.controller;

import com.teamcode.backend.auth.AuthPrincipal;
import com.teamcode.backend.dto.AnswerDto;
import com.teamcode.backend.dto.AnswerTestCaseResultDto;
import com.teamcode.backend.dto.EligibilityDto;
import com.teamcode.backend.dto.SubmitAnswerRequest;
import com.teamcode.backend.service.AnswerEligibilityService;
import com.teamcode.backend.service.AnswerService;
import com.teamcode.backend.service.AnswerTestCaseResultService;
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
public class AnswerController {

    private final AnswerService answerService;
    private final AnswerEligibilityService answerEligibilityService;
    private final AnswerTestCaseResultService answerTestCaseResultService;

    @GetMapping("/teams/{teamId}/questions/{questionId}/eligibility")
    public ResponseEntity<EligibilityDto> eligibility(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long teamId,
            @PathVariable Long questionId
    ) {
        return ResponseEntity.ok(answerEligibilityService.eligibility(principal.id(), teamId, questionId));
    }

    @PostMapping("/teams/{teamId}/questions/{questionId}/answers")
    public ResponseEntity<AnswerDto> submit(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long teamId,
            @PathVariable Long questionId,
            @Valid @RequestBody SubmitAnswerRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(answerService.submit(principal.id(), teamId, questionId, request));
    }

    @GetMapping("/teams/{teamId}/questions/{questionId}/answers")
    public ResponseEntity<List<AnswerDto>> listAnswers(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long teamId,
            @PathVariable Long questionId
    ) {
        return ResponseEntity.ok(answerService.listAnswers(principal.id(), teamId, questionId));
    }

    @GetMapping("/answers/{answerId}/results")
    public ResponseEntity<List<AnswerTestCaseResultDto>> resultsOf(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long answerId
    ) {
        return ResponseEntity.ok(answerTestCaseResultService.resultsOf(principal.id(), answerId));
    }

    @GetMapping("/answers/{answerId}/test-cases/{testCaseId}/results")
    public ResponseEntity<List<AnswerTestCaseResultDto>> results(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long answerId,
            @PathVariable Long testCaseId
    ) {
        return ResponseEntity.ok(answerTestCaseResultService.results(principal.id(), answerId, testCaseId));
    }
}
