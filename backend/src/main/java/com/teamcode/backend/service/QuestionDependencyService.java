package com.teamcode.backend.service;

import com.teamcode.backend.dto.CreateDependencyRequest;
import com.teamcode.backend.dto.DependencyDto;
import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.QuestionDependency;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.repository.QuestionDependencyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class QuestionDependencyService {

    private final QuestionDependencyRepository questionDependencyRepository;
    private final ExerciseService exerciseService;
    private final UserService userService;

    /**
     * Makes {@code questionId} depend on the prerequisite. The stored graph stays acyclic: self edges,
     * duplicates, edges between exercises and edges closing a cycle are refused.
     */
    @Transactional
    public DependencyDto addDependency(Long actorId, Long questionId, CreateDependencyRequest req) {
        User actor = userService.getUser(actorId);
        Question question = exerciseService.getQuestion(questionId);
        Question prerequisite = exerciseService.getQuestion(req.prerequisiteId());
        exerciseService.requireAuthor(actor, question.getExercise());

        Long exerciseId = question.getExercise().getId();
        if (!exerciseId.equals(prerequisite.getExercise().getId())) {
            throw new BizException("DEPENDENCY_CROSS_EXERCISE", "Both questions must belong to the same exercise");
        }
        if (questionDependencyRepository.existsByQuestion1AndQuestion2(question, prerequisite)) {
            throw new BizException("DEPENDENCY_EXISTS", "Dependency already exists");
        }

        DependencyGraph graph = new DependencyGraph();
        for (QuestionDependency edge : questionDependencyRepository.findByQuestion1_Exercise_Id(exerciseId)) {
            graph.addEdge(edge.getQuestion1().getId(), edge.getQuestion2().getId());
        }
        if (graph.wouldCreateCycle(question.getId(), prerequisite.getId())) {
            throw new BizException("DEPENDENCY_CYCLE",
                    "Question " + prerequisite.getId() + " already depends on question " + question.getId());
        }

        QuestionDependency saved = questionDependencyRepository.save(
                new QuestionDependency(question, prerequisite, req.operator()));
        log.info("Question {} now depends on question {} ({})", question.getId(), prerequisite.getId(), req.operator());
        return DependencyDto.from(saved);
    }

    @Transactional(readOnly = true)
    public List<DependencyDto> listDependencies(Long questionId) {
        return questionDependencyRepository.findByQuestion1_IdOrderByIdAsc(questionId).stream()
                .map(DependencyDto::from)
                .toList();
    }
}
