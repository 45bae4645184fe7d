package com.teamcode.backend.repository;

import com.teamcode.backend.entity.Answer;
import com.teamcode.backend.entity.Question;
import com.teamcode.backend.entity.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface AnswerRepository extends JpaRepository<Answer, Long> {

    boolean existsByTeamAndCorrectTrueAndQuestionIn(Team team, Collection<Question> questions);

    @Query("select count(distinct a.question.id) from Answer a where a.team = :team and a.correct = true and a.question in :questions")
    long countCorrectlyAnsweredQuestions(@Param("team") Team team, @Param("questions") Collection<Question> questions);

    List<Answer> findByTeam_IdAndQuestion_IdOrderByCreatedAtDesc(Long teamId, Long questionId);
}
