package com.teamcode.backend.support;

import com.teamcode.backend.entity.Answer;
import com.teamcode.backend.entity.DependencyOperator;
import com.teamcode.backend.entity.Exercise;
import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.QuestionDependency;
import com.teamcode.backend.entity.Team;
import com.teamcode.backend.entity.TestCase;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.repository.AnswerRepository;
import com.teamcode.backend.repository.ExerciseRepository;
import com.teamcode.backend.repository.QuestionDependencyRepository;
import com.teamcode.backend.repository.QuestionRepository;
import com.teamcode.backend.repository.TeamRepository;
import com.teamcode.backend.repository.TestCaseRepository;
import com.teamcode.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Persists entity graphs for service tests. Callers run inside a test transaction.
 */
@Component
@RequiredArgsConstructor
public class Fixtures {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final UserRepository userRepository;
    private final TeamRepository teamRepository;
    private final ExerciseRepository exerciseRepository;
    private final QuestionRepository questionRepository;
    private final QuestionDependencyRepository questionDependencyRepository;
    private final TestCaseRepository testCaseRepository;
    private final AnswerRepository answerRepository;

    public static User buildUser() {
        int n = SEQUENCE.incrementAndGet();
        return User.builder()
                .name("User " + n)
                .email("user" + n + "@example.com")
                .password("$2a$10$7EqJtq98hPqEX7fNZaFWoOhi5BWX4Z9f7m8v1Fh3Jr1dXh9e7Jx1a")
                .teacher(false)
                .admin(false)
                .build();
    }

    public User user() {
        return userRepository.save(buildUser());
    }

    public User teacher() {
        User user = buildUser();
        user.setTeacher(true);
        return userRepository.save(user);
    }

    public Team team(User owner, User... members) {
        Team team = new Team("Team " + SEQUENCE.incrementAndGet(), owner);
        for (User member : members) {
            team.addUser(member);
        }
        owner.getTeamsCreated().add(team);
        return teamRepository.save(team);
    }

    public Exercise exercise(User author) {
        return exerciseRepository.save(new Exercise("Exercise " + SEQUENCE.incrementAndGet(), "Practice", author));
    }

    public Exercise exerciseFor(Team team) {
        Exercise exercise = exercise(team.getOwner());
        team.addExercise(exercise);
        return exercise;
    }

    public Question question(Exercise exercise) {
        Question question = new Question("Question " + SEQUENCE.incrementAndGet(), "Print something", 10);
        exercise.addQuestion(question);
        return questionRepository.save(question);
    }

    public TestCase testCase(Question question, String expectedOutput) {
        TestCase testCase = new TestCase("case", "input", expectedOutput);
        question.addTestCase(testCase);
        return testCaseRepository.save(testCase);
    }

    public QuestionDependency dependency(Question question, Question prerequisite, DependencyOperator operator) {
        QuestionDependency dependency = new QuestionDependency(question, prerequisite, operator);
        question.getDependencies().add(dependency);
        return questionDependencyRepository.save(dependency);
    }

    public Answer answer(Question question, User user, Team team, boolean correct) {
        Answer answer = new Answer("print(1)", question, user, team);
        answer.setCorrect(correct);
        return answerRepository.save(answer);
    }
}
