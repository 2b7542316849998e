package com.fitnexus.backend.modules.plan.domain;

import java.time.LocalDate;
import java.util.UUID;

import com.fitnexus.backend.global.jpa.AbstractTimestampedEntity;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.trainer.domain.Trainer;

import jakarta.persistence.Column;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MappedSuperclass;

import org.hibernate.annotations.UuidGenerator;

/**
 * A plan a trainer assigns to one member of their branch. The member, the trainer and the branch
 * snapshot are fixed at creation.
 */
@MappedSuperclass
public abstract class AbstractAssignedPlan extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private GymUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "assigned_by_trainer_id", nullable = false, updatable = false)
    private Trainer assignedByTrainer;

    @Column(name = "title", nullable = false, length = 150)
    private String title;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "assigned_date", nullable = false, updatable = false)
    private LocalDate assignedDate;

    @Column(name = "expiry_date")
    private LocalDate expiryDate;

    @Column(name = "branch_name", nullable = false, updatable = false, length = 100)
    private String branchName;

    protected AbstractAssignedPlan() {
    }

    public void assign(GymUser user, Trainer trainer, String branchName, LocalDate assignedDate) {
        if (this.user != null) {
            throw new IllegalStateException("plan is already assigned");
        }
        this.user = user;
        this.assignedByTrainer = trainer;
        this.branchName = branchName;
        this.assignedDate = assignedDate;
    }

    public UUID getId() {
        return id;
    }

    public GymUser getUser() {
        return user;
    }

    public Trainer getAssignedByTrainer() {
        return assignedByTrainer;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public LocalDate getAssignedDate() {
        return assignedDate;
    }

    public LocalDate getExpiryDate() {
        return expiryDate;
    }

    public void setExpiryDate(LocalDate expiryDate) {
        this.expiryDate = expiryDate;
    }

    public String getBranchName() {
        return branchName;
    }
}
