package com.fitnexus.backend.modules.plan.application;

import java.time.Clock;

import com.fitnexus.backend.modules.account.infrastructure.persistence.GymUserRepository;
import com.fitnexus.backend.modules.plan.domain.DietPlan;
import com.fitnexus.backend.modules.plan.domain.PlanKind;
import com.fitnexus.backend.modules.plan.infrastructure.persistence.DietPlanRepository;
import com.fitnexus.backend.modules.trainer.application.TrainerProfileSupport;

import org.springframework.stereotype.Service;

@Service
public class DietPlanService extends AssignedPlanService<DietPlan> {

    public DietPlanService(
            DietPlanRepository dietPlanRepository,
            GymUserRepository gymUserRepository,
            TrainerProfileSupport trainerProfileSupport,
            Clock clock
    ) {
        super(dietPlanRepository, gymUserRepository, trainerProfileSupport, clock);
    }

    @Override
    protected PlanKind kind() {
        return PlanKind.DIET;
    }

    @Override
    protected DietPlan newPlan() {
        return new DietPlan();
    }
}
