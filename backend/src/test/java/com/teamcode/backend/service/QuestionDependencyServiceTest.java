package com.teamcode.backend.service;

import com.teamcode.backend.dto.CreateDependencyRequest;
import com.teamcode.backend.dto.DependencyDto;
import com.teamcode.backend.entity.Exercise;
import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import static com.teamcode.backend.entity.DependencyOperator.AND;
import static com.teamcode.backend.entity.DependencyOperator.OR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class QuestionDependencyServiceTest {

    @Autowired
    private QuestionDependencyService questionDependencyService;

    @Autowired
    private Fixtures fixtures;

    private User author;
    private Exercise exercise;
    private Question first;
    private Question second;
    private Question third;

    @BeforeEach
    void setUp() {
        author = fixtures.teacher();
        exercise = fixtures.exercise(author);
        first = fixtures.question(exercise);
        second = fixtures.question(exercise);
        third = fixtures.question(exercise);
    }

    @Test
    @DisplayName("the author can add a dependency edge")
    void addDependency() {
        DependencyDto dto = questionDependencyService.addDependency(author.getId(), first.getId(),
                new CreateDependencyRequest(second.getId(), AND));

        assertThat(dto.questionId()).isEqualTo(first.getId());
        assertThat(dto.prerequisiteId()).isEqualTo(second.getId());
        assertThat(questionDependencyService.listDependencies(first.getId())).hasSize(1);
    }

    @Test
    @DisplayName("a question cannot depend on itself")
    void rejectsSelfEdge() {
        assertThatThrownBy(() -> questionDependencyService.addDependency(author.getId(), first.getId(),
                new CreateDependencyRequest(first.getId(), OR)))
                .isInstanceOf(BizException.class)
                .extracting("code").isEqualTo("DEPENDENCY_CYCLE");
    }

    @Test
    @DisplayName("an edge closing a cycle is refused")
    void rejectsCycle() {
        questionDependencyService.addDependency(author.getId(), first.getId(), new CreateDependencyRequest(second.getId(), OR));
        questionDependencyService.addDependency(author.getId(), second.getId(), new CreateDependencyRequest(third.getId(), AND));

        assertThatThrownBy(() -> questionDependencyService.addDependency(author.getId(), third.getId(),
                new CreateDependencyRequest(first.getId(), OR)))
                .isInstanceOf(BizException.class)
                .extracting("code").isEqualTo("DEPENDENCY_CYCLE");
    }

    @Test
    void rejectsDuplicate() {
        questionDependencyService.addDependency(author.getId(), first.getId(), new CreateDependencyRequest(second.getId(), OR));

        assertThatThrownBy(() -> questionDependencyService.addDependency(author.getId(), first.getId(),
                new CreateDependencyRequest(second.getId(), AND)))
                .isInstanceOf(BizException.class)
                .extracting("code").isEqualTo("DEPENDENCY_EXISTS");
    }

    @Test
    void rejectsEdgeAcrossExercises() {
        Question elsewhere = fixtures.question(fixtures.exercise(author));

        assertThatThrownBy(() -> questionDependencyService.addDependency(author.getId(), first.getId(),
                new CreateDependencyRequest(elsewhere.getId(), OR)))
                .isInstanceOf(BizException.class)
                .extracting("code").isEqualTo("DEPENDENCY_CROSS_EXERCISE");
    }

    @Test
    void onlyTheAuthorCanAddEdges() {
        User stranger = fixtures.teacher();

        assertThatThrownBy(() -> questionDependencyService.addDependency(stranger.getId(), first.getId(),
                new CreateDependencyRequest(second.getId(), OR)))
                .isInstanceOf(BizException.class)
                .extracting("code").isEqualTo("FORBIDDEN");
    }
}
