package com.teamcode.backend.service;

import com.teamcode.backend.dto.AnswerTestCaseResultDto;
import com.teamcode.backend.dto.SaveResult;
import com.teamcode.backend.entity.Answer;
import com.teamcode.backend.entity.AnswerTestCaseResult;
import com.teamcode.backend.entity.TestCase;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.repository.AnswerRepository;
import com.teamcode.backend.repository.AnswerTestCaseResultRepository;
import com.teamcode.backend.repository.TestCaseRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class AnswerTestCaseResultService {

    private final AnswerTestCaseResultRepository answerTestCaseResultRepository;
    private final AnswerRepository answerRepository;
    private final TestCaseRepository testCaseRepository;
    private final EntityValidator entityValidator;
    private final TeamService teamService;
    private final UserService userService;

    /**
     * Stored results linking the answer and the test case, normally zero or one.
     */
    @Transactional(readOnly = true)
    public List<AnswerTestCaseResult> result(Answer answer, TestCase testCase) {
        return answerTestCaseResultRepository.findByAnswerAndTestCase(answer, testCase);
    }

    @Transactional(readOnly = true)
    public List<AnswerTestCaseResultDto> results(Long viewerId, Long answerId, Long testCaseId) {
        Answer answer = getVisibleAnswer(viewerId, answerId);
        TestCase testCase = testCaseRepository.findById(testCaseId)
                .orElseThrow(() -> new BizException("TEST_CASE_NOT_FOUND", "Test case not found: " + testCaseId));
        return result(answer, testCase).stream()
                .map(AnswerTestCaseResultDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<AnswerTestCaseResultDto> resultsOf(Long viewerId, Long answerId) {
        getVisibleAnswer(viewerId, answerId);
        return answerTestCaseResultRepository.findByAnswer_IdOrderByIdAsc(answerId).stream()
                .map(AnswerTestCaseResultDto::from)
                .toList();
    }

    private Answer getVisibleAnswer(Long viewerId, Long answerId) {
        Answer answer = answerRepository.findById(answerId)
                .orElseThrow(() -> new BizException("ANSWER_NOT_FOUND", "Answer not found: " + answerId));
        teamService.requireParticipant(userService.getUser(viewerId), answer.getTeam());
        return answer;
    }

    /**
     * Persists the output an answer produced for a test case. A blank output is rejected.
     */
    @Transactional
    public SaveResult<AnswerTestCaseResult> record(Answer answer, TestCase testCase, String output) {
        AnswerTestCaseResult result = new AnswerTestCaseResult(answer, testCase, output);
        Map<String, List<String>> errors = entityValidator.validate(result);
        if (!errors.isEmpty()) {
            return SaveResult.rejected(result, errors);
        }
        answer.getResults().add(result);
        return SaveResult.saved(answerTestCaseResultRepository.save(result));
    }
}
