package com.teamcode.backend.service;

import com.teamcode.backend.dto.CreateExerciseRequest;
import com.teamcode.backend.dto.CreateQuestionRequest;
import com.teamcode.backend.dto.CreateTestCaseRequest;
import com.teamcode.backend.dto.ExerciseDto;
import com.teamcode.backend.dto.QuestionDto;
import com.teamcode.backend.dto.TestCaseDto;
import com.teamcode.backend.entity.Exercise;
import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.TestCase;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.repository.ExerciseRepository;
import com.teamcode.backend.repository.QuestionRepository;
import com.teamcode.backend.repository.TestCaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ExerciseService {

    private final ExerciseRepository exerciseRepository;
    private final QuestionRepository questionRepository;
    private final TestCaseRepository testCaseRepository;
    private final UserService userService;

    @Transactional
    public ExerciseDto createExercise(Long actorId, CreateExerciseRequest req) {
        User actor = userService.getUser(actorId);
        if (!actor.isTeacherOrAdmin()) {
            throw new BizException("FORBIDDEN", "Only teachers can create exercises");
        }
        Exercise exercise = exerciseRepository.save(new Exercise(req.title().trim(), req.description(), actor));
        log.info("User {} created exercise {}", actorId, exercise.getId());
        return ExerciseDto.from(exercise);
    }

    @Transactional(readOnly = true)
    public List<ExerciseDto> listOwnExercises(Long actorId) {
        return exerciseRepository.findByUser_IdOrderByCreatedAtDesc(actorId).stream()
                .map(ExerciseDto::from)
                .toList();
    }

    @Transactional
    public QuestionDto addQuestion(Long actorId, Long exerciseId, CreateQuestionRequest req) {
        Exercise exercise = getExercise(exerciseId);
        requireAuthor(userService.getUser(actorId), exercise);

        Question question = new Question(req.title().trim(), req.description(), req.score());
        exercise.addQuestion(question);
        return QuestionDto.from(questionRepository.save(question));
    }

    @Transactional(readOnly = true)
    public List<QuestionDto> listQuestions(Long exerciseId) {
        getExercise(exerciseId);
        return questionRepository.findByExercise_IdOrderByIdAsc(exerciseId).stream()
                .map(QuestionDto::from)
                .toList();
    }

    @Transactional
    public TestCaseDto addTestCase(Long actorId, Long questionId, CreateTestCaseRequest req) {
        Question question = getQuestion(questionId);
        requireAuthor(userService.getUser(actorId), question.getExercise());

        TestCase testCase = new TestCase(req.title(), req.input(), req.output());
        question.addTestCase(testCase);
        return TestCaseDto.from(testCaseRepository.save(testCase));
    }

    /**
     * Expected outputs are only shown to the author of the exercise and to admins.
     */
    @Transactional(readOnly = true)
    public List<TestCaseDto> listTestCases(Long viewerId, Long questionId) {
        Question question = getQuestion(questionId);
        boolean showOutput = isAuthorOrAdmin(userService.getUser(viewerId), question.getExercise());
        return testCaseRepository.findByQuestion_IdOrderByIdAsc(questionId).stream()
                .map(testCase -> showOutput ? TestCaseDto.from(testCase) : TestCaseDto.withoutOutput(testCase))
                .toList();
    }

    public Exercise getExercise(Long exerciseId) {
        return exerciseRepository.findById(exerciseId)
                .orElseThrow(() -> new BizException("EXERCISE_NOT_FOUND", "Exercise not found: " + exerciseId));
    }

    public Question getQuestion(Long questionId) {
        return questionRepository.findById(questionId)
                .orElseThrow(() -> new BizException("QUESTION_NOT_FOUND", "Question not found: " + questionId));
    }

    void requireAuthor(User actor, Exercise exercise) {
        if (!isAuthorOrAdmin(actor, exercise)) {
            throw new BizException("FORBIDDEN", "Only the author of the exercise can change it");
        }
    }

    private boolean isAuthorOrAdmin(User actor, Exercise exercise) {
        return exercise.getUser().getId().equals(actor.getId()) || Boolean.TRUE.equals(actor.getAdmin());
    }
}
