package com.fitnexus.backend.modules.schedule.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import com.fitnexus.backend.global.jpa.AbstractTimestampedEntity;
import com.fitnexus.backend.modules.trainer.domain.Trainer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "session_schedule")
public class SessionSchedule extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "trainer_id", nullable = false, updatable = false)
    private Trainer trainer;

    @Column(name = "session_name", nullable = false, length = 100)
    private String sessionName;

    @Column(name = "session_date", nullable = false)
    private LocalDate sessionDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    /** Snapshot of the trainer's branch when the session was created. */
    @Column(name = "branch_name", nullable = false, updatable = false, length = 100)
    private String branchName;

    @Column(name = "max_capacity")
    private Integer maxCapacity;

    @Column(name = "description", length = 1000)
    private String description;

    protected SessionSchedule() {
    }

    public SessionSchedule(Trainer trainer, String branchName) {
        this.trainer = trainer;
        this.branchName = branchName;
    }

    public UUID getId() {
        return id;
    }

    public Trainer getTrainer() {
        return trainer;
    }

    public boolean isOwnedBy(UUID trainerId) {
        return trainer != null && trainer.getId() != null && trainer.getId().equals(trainerId);
    }

    public String getSessionName() {
        return sessionName;
    }

    public void setSessionName(String sessionName) {
        this.sessionName = sessionName;
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }

    public void setSessionDate(LocalDate sessionDate) {
        this.sessionDate = sessionDate;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public void setStartTime(LocalTime startTime) {
        this.startTime = startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }

    public void setEndTime(LocalTime endTime) {
        this.endTime = endTime;
    }

    public String getBranchName() {
        return branchName;
    }

    public Integer getMaxCapacity() {
        return maxCapacity;
    }

    public void setMaxCapacity(Integer maxCapacity) {
        this.maxCapacity = maxCapacity;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }
}
