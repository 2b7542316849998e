package com.fitnexus.backend.modules.plan.infrastructure.persistence;

import com.fitnexus.backend.modules.plan.domain.ExercisePlan;

public interface ExercisePlanRepository extends AssignedPlanRepository<ExercisePlan> {
}
