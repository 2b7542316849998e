package com.fitnexus.backend.modules.plan.domain;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "diet_plan")
public class DietPlan extends AbstractAssignedPlan {

    public DietPlan() {
    }
}
