package com.fitnexus.backend.modules.plan.presentation.dto;

import com.fitnexus.backend.modules.account.presentation.dto.UserResponse;
import com.fitnexus.backend.modules.plan.domain.AbstractAssignedPlan;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerDtoMapper;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerResponse;

public final class PlanDtoMapper {

    private PlanDtoMapper() {
    }

    public static PlanResponse toResponse(AbstractAssignedPlan plan) {
        UserResponse user = UserResponse.from(plan.getUser());
        TrainerResponse trainer = TrainerDtoMapper.toOwnerResponse(plan.getAssignedByTrainer(), plan.getId());
        return new PlanResponse(
                plan.getId(),
                user.id(),
                trainer.id(),
                plan.getTitle(),
                plan.getDescription(),
                plan.getAssignedDate(),
                plan.getExpiryDate(),
                plan.getBranchName(),
                user,
                trainer
        );
    }
}
