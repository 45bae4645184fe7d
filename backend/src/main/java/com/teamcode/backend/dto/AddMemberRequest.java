package com.teamcode.backend.dto;

import jakarta.validation.constraints.NotBlank;

public record AddMemberRequest(@NotBlank String email) {}
