package com.teamcode.backend.service;

import com.teamcode.backend.dto.AnswerDto;
import com.teamcode.backend.dto.SaveResult;
import com.teamcode.backend.dto.SubmitAnswerRequest;
import com.teamcode.backend.entity.Answer;
import com.teamcode.backend.entity.AnswerTestCaseResult;
import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.Team;
import com.teamcode.backend.entity.TestCase;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.repository.AnswerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerService {

    private final AnswerRepository answerRepository;
    private final AnswerTestCaseResultService answerTestCaseResultService;
    private final AnswerEligibilityService answerEligibilityService;
    private final TeamService teamService;
    private final ExerciseService exerciseService;
    private final UserService userService;

    /**
     * Records a team member's answer and grades it against every test case of the question.
     * The answer is correct when each test case received an output equal to the expected one.
     */
    @Transactional
    public AnswerDto submit(Long userId, Long teamId, Long questionId, SubmitAnswerRequest req) {
        User user = userService.getUser(userId);
        Team team = teamService.getTeam(teamId);
        Question question = exerciseService.getQuestion(questionId);

        if (!team.hasParticipant(user)) {
            throw new BizException("NOT_TEAM_MEMBER", "User does not belong to team " + teamId);
        }
        if (!team.hasExercise(question.getExercise())) {
            throw new BizException("EXERCISE_NOT_ASSIGNED", "Exercise is not assigned to team " + teamId);
        }
        if (!answerEligibilityService.ableToAnswer(question, team)) {
            throw new BizException("QUESTION_LOCKED", "Prerequisites of question " + questionId + " are not completed");
        }

        Map<Long, String> outputs = new HashMap<>();
        for (SubmitAnswerRequest.TestCaseOutput entry : req.outputs()) {
            outputs.put(entry.testCaseId(), entry.output());
        }
        Set<Long> known = question.getTestCases().stream().map(TestCase::getId).collect(Collectors.toSet());
        outputs.keySet().stream()
                .filter(id -> !known.contains(id))
                .forEach(id -> log.warn("Ignoring output for test case {} which is not part of question {}", id, questionId));

        Answer answer = answerRepository.save(new Answer(req.content(), question, user, team));

        boolean allPassed = true;
        for (TestCase testCase : question.getTestCases()) {
            SaveResult<AnswerTestCaseResult> recorded =
                    answerTestCaseResultService.record(answer, testCase, outputs.get(testCase.getId()));
            if (!recorded.isSaved() || !recorded.entity().isPassed()) {
                allPassed = false;
            }
        }
        answer.setCorrect(allPassed);

        log.info("Answer {} by user {} in team {} for question {}: correct={}",
                answer.getId(), userId, teamId, questionId, allPassed);
        return AnswerDto.of(answer);
    }

    @Transactional(readOnly = true)
    public List<AnswerDto> listAnswers(Long userId, Long teamId, Long questionId) {
        Team team = teamService.getTeam(teamId);
        teamService.requireParticipant(userService.getUser(userId), team);
        return answerRepository.findByTeam_IdAndQuestion_IdOrderByCreatedAtDesc(teamId, questionId).stream()
                .map(AnswerDto::of)
                .toList();
    }
}
