package com.fitnexus.backend.modules.schedule.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerResponse;

public record SessionResponse(
        UUID id,
        UUID trainerId,
        String sessionName,
        LocalDate sessionDate,
        LocalTime startTime,
        LocalTime endTime,
        String branchName,
        Integer maxCapacity,
        String description,
        TrainerResponse trainer
) {
}
