package com.fitnexus.backend.modules.schedule.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Create and update payload. The branch is never taken from the client.
 */
public record SessionRequest(
        @NotBlank @Size(max = 100) String sessionName,
        @NotNull LocalDate sessionDate,
        @NotNull LocalTime startTime,
        @NotNull LocalTime endTime,
        @Positive Integer maxCapacity,
        @Size(max = 1000) String description
) {
}
