package com.teamcode.backend.service;

import com.teamcode.backend.dto.EligibilityDto;
import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.Team;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.repository.QuestionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class AnswerEligibilityService {

    private final DependencyCheck dependencyCheck;
    private final TeamService teamService;
    private final UserService userService;
    private final QuestionRepository questionRepository;

    /**
     * True when both the OR and the AND prerequisites of the question are satisfied for the team.
     */
    public boolean ableToAnswer(Question question, Team team) {
        return evaluate(question, team).ableToAnswer();
    }

    @Transactional(readOnly = true)
    public EligibilityDto eligibility(Long viewerId, Long teamId, Long questionId) {
        Team team = teamService.getTeam(teamId);
        teamService.requireParticipant(userService.getUser(viewerId), team);
        Question question = questionRepository.findById(questionId)
                .orElseThrow(() -> new BizException("QUESTION_NOT_FOUND", "Question not found: " + questionId));
        return evaluate(question, team);
    }

    private EligibilityDto evaluate(Question question, Team team) {
        boolean orCompleted = dependencyCheck.orDependenciesCompleted(question, team);
        boolean andCompleted = dependencyCheck.andDependenciesCompleted(question, team);
        return new EligibilityDto(team.getId(), question.getId(), orCompleted, andCompleted, orCompleted && andCompleted);
    }
}
