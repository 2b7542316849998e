package com.fitnexus.backend.modules.trainer.domain;

import java.util.UUID;

import com.fitnexus.backend.global.jpa.AbstractTimestampedEntity;
import com.fitnexus.backend.modules.account.domain.GymUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapsId;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Table;

/**
 * Trainer profile. Keyed by the id of its {@link GymUser} account, which also holds the
 * trainer's name, contact details, credential hash and branch.
 */
@Entity
@Table(name = "trainer")
public class Trainer extends AbstractTimestampedEntity {

    @Id
    private UUID id;

    @MapsId
    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "id")
    private GymUser account;

    /** Comma-delimited, see {@link Specializations}. */
    @Column(name = "specialization", nullable = false, length = 500)
    private String specialization = "";

    @Column(name = "rating", nullable = false)
    private double rating;

    @Column(name = "experience", nullable = false)
    private int experience;

    @Column(name = "availability", length = 255)
    private String availability;

    protected Trainer() {
    }

    public Trainer(GymUser account) {
        this.account = account;
    }

    public UUID getId() {
        return id;
    }

    public GymUser getAccount() {
        return account;
    }

    public String getName() {
        return account.getFullName();
    }

    public String getBranchName() {
        return account.getBranch();
    }

    public String getSpecialization() {
        return specialization;
    }

    public void setSpecialization(String specialization) {
        this.specialization = specialization == null ? "" : specialization;
    }

    public double getRating() {
        return rating;
    }

    public void setRating(double rating) {
        this.rating = rating;
    }

    public int getExperience() {
        return experience;
    }

    public void setExperience(int experience) {
        this.experience = experience;
    }

    public String getAvailability() {
        return availability;
    }

    public void setAvailability(String availability) {
        this.availability = availability;
    }
}
