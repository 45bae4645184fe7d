package com.teamcode.backend.service;

import com.teamcode.backend.entity.DependencyOperator;
import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.QuestionDependency;
import com.teamcode.backend.entity.Team;
import com.teamcode.backend.repository.AnswerRepository;
import com.teamcode.backend.repository.QuestionDependencyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evaluates the direct prerequisites of a question against the correct answers of a team.
 * Only one level of edges is read, so evaluation terminates on any graph.
 */
@Component
@RequiredArgsConstructor
public class QuestionDependencyEvaluator implements DependencyCheck {

    private final QuestionDependencyRepository questionDependencyRepository;
    private final AnswerRepository answerRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean orDependenciesCompleted(Question question, Team team) {
        Collection<Question> prerequisites = prerequisites(question, DependencyOperator.OR);
        if (prerequisites.isEmpty()) {
            return true;
        }
        return answerRepository.existsByTeamAndCorrectTrueAndQuestionIn(team, prerequisites);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean andDependenciesCompleted(Question question, Team team) {
        Collection<Question> prerequisites = prerequisites(question, DependencyOperator.AND);
        if (prerequisites.isEmpty()) {
            return true;
        }
        return answerRepository.countCorrectlyAnsweredQuestions(team, prerequisites) == prerequisites.size();
    }

    private Collection<Question> prerequisites(Question question, DependencyOperator operator) {
        Map<Long, Question> byId = new LinkedHashMap<>();
        for (QuestionDependency dependency : questionDependencyRepository.findByQuestion1AndOperator(question, operator)) {
            byId.putIfAbsent(dependency.getQuestion2().getId(), dependency.getQuestion2());
        }
        return byId.values();
    }
}
