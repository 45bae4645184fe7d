package com.teamcode.backend.controller;

import com.teamcode.backend.auth.AuthPrincipal;
import com.teamcode.backend.dto.AddMemberRequest;
import com.teamcode.backend.dto.CreateTeamRequest;
import com.teamcode.backend.dto.TeamDto;
import com.teamcode.backend.service.TeamService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/teams")
@RequiredArgsConstructor
public class TeamController {

    private final TeamService teamService;

    @PostMapping
    public ResponseEntity<TeamDto> createTeam(
            @AuthenticationPrincipal AuthPrincipal principal,
            @Valid @RequestBody CreateTeamRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(teamService.createTeam(principal.id(), request.name()));
    }

    @GetMapping("/{teamId}")
    public ResponseEntity<TeamDto> getTeam(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long teamId
    ) {
        return ResponseEntity.ok(teamService.getTeamFor(principal.id(), teamId));
    }

    @PostMapping("/{teamId}/members")
    public ResponseEntity<TeamDto> addMember(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long teamId,
            @Valid @RequestBody AddMemberRequest request
    ) {
        return ResponseEntity.ok(teamService.addMember(principal.id(), teamId, request.email()));
    }

    @PutMapping("/{teamId}/exercises/{exerciseId}")
    public ResponseEntity<TeamDto> attachExercise(
            @AuthenticationPrincipal AuthPrincipal principal,
            @PathVariable Long teamId,
            @PathVariable Long exerciseId
    ) {
        return ResponseEntity.ok(teamService.attachExercise(principal.id(), teamId, exerciseId));
    }
}
