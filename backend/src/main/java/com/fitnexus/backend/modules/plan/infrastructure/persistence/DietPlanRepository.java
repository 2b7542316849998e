package com.fitnexus.backend.modules.plan.infrastructure.persistence;

import com.fitnexus.backend.modules.plan.domain.DietPlan;

public interface DietPlanRepository extends AssignedPlanRepository<DietPlan> {
}
