package com.teamcode.backend.dto;

import com.teamcode.backend.entity.Answer;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class AnswerDto {
    private Long id;
    private Long questionId;
    private Long teamId;
    private Long userId;
    private boolean correct;
    private LocalDateTime createdAt;
    @Builder.Default
    private List<AnswerTestCaseResultDto> results = new ArrayList<>();

    public static AnswerDto of(Answer answer) {
        return AnswerDto.builder()
                .id(answer.getId())
                .questionId(answer.getQuestion().getId())
                .teamId(answer.getTeam().getId())
                .userId(answer.getUser().getId())
                .correct(answer.isCorrect())
                .createdAt(answer.getCreatedAt())
                .results(answer.getResults().stream().map(AnswerTestCaseResultDto::from).toList())
                .build();
    }
}
