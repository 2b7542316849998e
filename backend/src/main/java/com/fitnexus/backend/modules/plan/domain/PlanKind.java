package com.fitnexus.backend.modules.plan.domain;

public enum PlanKind {
    DIET("Diet plan"),
    EXERCISE("Exercise plan");

    private final String label;

    PlanKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
