package com.teamcode.backend.service;

import com.teamcode.backend.dto.TeamDto;
import com.teamcode.backend.entity.Exercise;
import com.teamcode.backend.entity.Team;
import com.teamcode.backend.entity.User;
import com.teamcode.backend.exception.BizException;
import com.teamcode.backend.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TeamService {

    private final TeamRepository teamRepository;
    private final UserService userService;
    private final ExerciseService exerciseService;

    @Transactional
    public TeamDto createTeam(Long ownerId, String name) {
        User owner = userService.getUser(ownerId);
        Team team = teamRepository.save(new Team(name.trim(), owner));
        owner.getTeamsCreated().add(team);
        log.info("User {} created team {}", ownerId, team.getId());
        return TeamDto.of(team, ownerId);
    }

    @Transactional
    public TeamDto addMember(Long actorId, Long teamId, String email) {
        Team team = getTeam(teamId);
        requireManager(userService.getUser(actorId), team);

        User member = userService.getUserByEmail(email);
        if (!team.hasParticipant(member)) {
            team.addUser(member);
            log.info("User {} joined team {}", member.getId(), teamId);
        }
        return TeamDto.of(team, actorId);
    }

    @Transactional
    public TeamDto attachExercise(Long actorId, Long teamId, Long exerciseId) {
        Team team = getTeam(teamId);
        requireManager(userService.getUser(actorId), team);

        Exercise exercise = exerciseService.getExercise(exerciseId);
        if (!team.hasExercise(exercise)) {
            team.addExercise(exercise);
        }
        return TeamDto.of(team, actorId);
    }

    @Transactional(readOnly = true)
    public TeamDto getTeamFor(Long viewerId, Long teamId) {
        Team team = getTeam(teamId);
        requireParticipant(userService.getUser(viewerId), team);
        return TeamDto.of(team, viewerId);
    }

    @Transactional(readOnly = true)
    public List<TeamDto> listTeams(Long userId) {
        User user = userService.getUser(userId);
        return userService.teamsFromWhereBelongs(user).stream()
                .map(team -> TeamDto.of(team, userId))
                .toList();
    }

    public Team getTeam(Long teamId) {
        return teamRepository.findById(teamId)
                .orElseThrow(() -> new BizException("TEAM_NOT_FOUND", "Team not found: " + teamId));
    }

    /**
     * Reads of team data are limited to its owner, its members and admins.
     */
    public void requireParticipant(User viewer, Team team) {
        if (!team.hasParticipant(viewer) && !Boolean.TRUE.equals(viewer.getAdmin())) {
            throw new BizException("NOT_TEAM_MEMBER", "User does not belong to team " + team.getId());
        }
    }

    private void requireManager(User actor, Team team) {
        if (!actor.isOwner(team) && !Boolean.TRUE.equals(actor.getAdmin())) {
            throw new BizException("FORBIDDEN", "Only the owner of the team can change it");
        }
    }
}
