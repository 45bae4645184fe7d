package com.teamcode.backend.dto;

import com.teamcode.backend.entity.Team;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class TeamDto {
    private Long id;
    private String name;
    private Long ownerId;
    private String ownerName;
    private boolean owned;
    private int memberCount;
    private LocalDateTime createdAt;
    @Builder.Default
    private List<Long> exerciseIds = new ArrayList<>();

    public static TeamDto of(Team team, Long viewerId) {
        return TeamDto.builder()
                .id(team.getId())
                .name(team.getName())
                .ownerId(team.getOwner().getId())
                .ownerName(team.getOwner().getName())
                .owned(team.getOwner().getId().equals(viewerId))
                .memberCount(team.getUsers().size())
                .createdAt(team.getCreatedAt())
                .exerciseIds(team.getExercises().stream().map(e -> e.getId()).sorted().toList())
                .build();
    }
}
