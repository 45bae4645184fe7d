package com.teamcode.backend.dto;

import com.teamcode.backend.entity.DependencyOperator;
import jakarta.validation.constraints.NotNull;

public record CreateDependencyRequest(
        @NotNull Long prerequisiteId,
        @NotNull DependencyOperator operator
) {}
