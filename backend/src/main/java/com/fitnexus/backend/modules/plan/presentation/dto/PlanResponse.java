package com.fitnexus.backend.modules.plan.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fitnexus.backend.modules.account.presentation.dto.UserResponse;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerResponse;

public record PlanResponse(
        UUID id,
        UUID userId,
        UUID assignedByTrainerId,
        String title,
        String description,
        LocalDate assignedDate,
        LocalDate expiryDate,
        String branchName,
        UserResponse user,
        TrainerResponse trainer
) {
}
