package com.fitnexus.backend.modules.trainer.presentation.dto;

import java.util.UUID;

import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.trainer.domain.Specializations;
import com.fitnexus.backend.modules.trainer.domain.Trainer;

import jakarta.persistence.EntityNotFoundException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class TrainerDtoMapper {

    private static final Logger log = LoggerFactory.getLogger(TrainerDtoMapper.class);

    private TrainerDtoMapper() {
    }

    /**
     * Storage to transport form. The stored specialization text is split into a list; the
     * entity itself is left untouched.
     */
    public static TrainerResponse toResponse(Trainer trainer) {
        GymUser account = trainer.getAccount();
        return new TrainerResponse(
                trainer.getId(),
                account.getFullName(),
                Specializations.split(trainer.getSpecialization()),
                trainer.getRating(),
                trainer.getExperience(),
                account.getPhone(),
                account.getEmail(),
                trainer.getAvailability(),
                account.getBranch()
        );
    }

    /**
     * Owner block embedded in session and plan responses.
     *
     * @throws ProblemException 400 {@code OWNER_TRAINER_MISSING} when the owning trainer row
     *                          cannot be loaded, which only happens if referential integrity broke
     */
    public static TrainerResponse toOwnerResponse(Trainer owner, Object resourceId) {
        if (owner == null) {
            throw missingOwner(null, resourceId, null);
        }
        UUID ownerId = owner.getId();
        try {
            return toResponse(owner);
        } catch (EntityNotFoundException ex) {
            throw missingOwner(ownerId, resourceId, ex);
        }
    }

    private static ProblemException missingOwner(UUID ownerId, Object resourceId, Exception cause) {
        log.error("Owning trainer {} of resource {} could not be loaded", ownerId, resourceId, cause);
        return ProblemException.invalidState("OWNER_TRAINER_MISSING", "Owning trainer record is missing");
    }
}
