package com.fitnexus.backend.modules.trainer.application;

import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.modules.trainer.domain.Trainer;
import com.fitnexus.backend.modules.trainer.infrastructure.persistence.TrainerRepository;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the trainer profile behind the calling account for services that create
 * trainer-owned resources.
 * <p>
 * The branch a trainer works in is read from the stored account, never from the token, so a
 * branch change made by an admin takes effect before the caller's token expires.
 */
@Component
public class TrainerProfileSupport {

    private final TrainerRepository trainerRepository;

    public TrainerProfileSupport(TrainerRepository trainerRepository) {
        this.trainerRepository = trainerRepository;
    }

    /**
     * @throws ProblemException 403 when the caller is not a trainer, 400 when the trainer has no
     *                          branch, 404 when the profile row is missing
     */
    public Trainer loadCallerProfile(CallerContext caller) {
        caller.requireTrainer();
        Trainer trainer = trainerRepository.findByIdWithAccount(caller.userId())
                .orElseThrow(() -> ProblemException.notFound("TRAINER_NOT_FOUND", "Trainer profile not found"));
        if (!StringUtils.hasText(trainer.getBranchName())) {
            throw ProblemException.invalidState("TRAINER_BRANCH_REQUIRED", "Trainer's branch is not specified");
        }
        return trainer;
    }
}
