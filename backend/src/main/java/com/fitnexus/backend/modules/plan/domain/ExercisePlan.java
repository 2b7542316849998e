package com.fitnexus.backend.modules.plan.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "exercise_plan")
public class ExercisePlan extends AbstractAssignedPlan {

    public ExercisePlan() {
    }
}
