package com.teamcode.backend.controller;

import com.teamcode.backend.auth.AuthPrincipal;
import com.teamcode.backend.dto.TeamDto;
import com.teamcode.backend.dto.UserProfileDto;
import com.teamcode.backend.service.TeamService;
import com.teamcode.backend.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/me")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final TeamService teamService;

    @GetMapping
    public ResponseEntity<UserProfileDto> getMyInfo(@AuthenticationPrincipal AuthPrincipal principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(UserProfileDto.from(userService.getUser(principal.id())));
    }

    @GetMapping("/teams")
    public ResponseEntity<List<TeamDto>> getMyTeams(@AuthenticationPrincipal AuthPrincipal principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }
        return ResponseEntity.ok(teamService.listTeams(principal.id()));
    }
}
