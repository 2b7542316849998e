package com.fitnexus.backend.modules.plan.application;

import java.time.Clock;

import com.fitnexus.backend.modules.account.infrastructure.persistence.GymUserRepository;
import com.fitnexus.backend.modules.plan.domain.ExercisePlan;
import com.fitnexus.backend.modules.plan.domain.PlanKind;
import com.fitnexus.backend.modules.plan.infrastructure.persistence.ExercisePlanRepository;
import com.fitnexus.backend.modules.trainer.application.TrainerProfileSupport;

import org.springframework.stereotype.Service;

@Service
public class ExercisePlanService extends AssignedPlanService<ExercisePlan> {

    public ExercisePlanService(
            ExercisePlanRepository exercisePlanRepository,
            GymUserRepository gymUserRepository,
            TrainerProfileSupport trainerProfileSupport,
            Clock clock
    ) {
        super(exercisePlanRepository, gymUserRepository, trainerProfileSupport, clock);
    }

    @Override
    protected PlanKind kind() {
        return PlanKind.EXERCISE;
    }

    @Override
    protected ExercisePlan newPlan() {
        return new ExercisePlan();
    }
}
