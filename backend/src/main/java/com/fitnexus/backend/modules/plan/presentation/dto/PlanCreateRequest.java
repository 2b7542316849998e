package com.fitnexus.backend.modules.plan.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record PlanCreateRequest(
        @NotNull UUID userId,
        @NotBlank @Size(max = 150) String title,
        @Size(max = 4000) String description,
        LocalDate expiryDate
) {
}
