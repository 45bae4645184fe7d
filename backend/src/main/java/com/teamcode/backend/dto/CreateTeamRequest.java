package com.teamcode.backend.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTeamRequest(
        @NotBlank(message = "Team name must not be blank")
        @Size(max = 100, message = "Team name must be at most 100 characters")
        String name
) {}
