package com.fitnexus.backend.modules.trainer.application;

import java.util.List;
import java.util.UUID;

import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.account.infrastructure.persistence.GymUserRepository;
import com.fitnexus.backend.modules.trainer.domain.Specializations;
import com.fitnexus.backend.modules.trainer.domain.Trainer;
import com.fitnexus.backend.modules.trainer.infrastructure.persistence.TrainerRepository;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerCreateRequest;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerDtoMapper;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerResponse;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerUpdateRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class TrainerService {

    private static final Logger log = LoggerFactory.getLogger(TrainerService.class);

    private final TrainerRepository trainerRepository;
    private final GymUserRepository gymUserRepository;
    private final PasswordEncoder passwordEncoder;

    public TrainerService(
            TrainerRepository trainerRepository,
            GymUserRepository gymUserRepository,
            PasswordEncoder passwordEncoder
    ) {
        this.trainerRepository = trainerRepository;
        this.gymUserRepository = gymUserRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Provisions a trainer account together with its profile. Admins place the trainer in their
     * own branch; superadmins must name one.
     */
    public TrainerResponse addTrainer(CallerContext caller, TrainerCreateRequest request) {
        caller.requireAdminOrSuperadmin();
        String branch = resolveTargetBranch(caller, request.branchName());

        String email = request.email().trim();
        if (gymUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "An account with this email already exists");
        }

        GymUser account = new GymUser();
        account.setEmail(email);
        account.setPasswordHash(passwordEncoder.encode(request.password()));
        account.setFullName(request.name().trim());
        account.setPhone(request.phone());
        account.setRole(GymRole.TRAINER);
        account.setBranch(branch);
        GymUser savedAccount = saveAccount(account);

        Trainer trainer = new Trainer(savedAccount);
        trainer.setSpecialization(joinSpecializations(request.specialization()));
        trainer.setRating(request.rating());
        trainer.setExperience(request.experience());
        trainer.setAvailability(request.availability());
        Trainer saved = trainerRepository.save(trainer);

        log.info("Trainer {} added to branch {} by {}", saved.getId(), branch, caller.userId());
        return TrainerDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<TrainerResponse> listTrainers(CallerContext caller) {
        List<Trainer> trainers;
        if (caller.role() == GymRole.ADMIN) {
            trainers = trainerRepository.findAllByBranch(requireAdminBranch(caller));
        } else if (caller.isSuperadmin() || !caller.hasBranch()) {
            trainers = trainerRepository.findAllWithAccount();
        } else {
            trainers = trainerRepository.findAllByBranch(caller.branch());
        }
        return trainers.stream().map(TrainerDtoMapper::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public TrainerResponse getTrainer(CallerContext caller, UUID trainerId) {
        return TrainerDtoMapper.toResponse(loadTrainer(trainerId));
    }

    public TrainerResponse updateTrainer(CallerContext caller, UUID trainerId, TrainerUpdateRequest request) {
        Trainer trainer = loadManagedTrainer(caller, trainerId);
        GymUser account = trainer.getAccount();

        String email = request.email().trim();
        if (!email.equalsIgnoreCase(account.getEmail()) && gymUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "An account with this email already exists");
        }

        if (StringUtils.hasText(request.branchName()) && !request.branchName().trim().equals(account.getBranch())) {
            if (!caller.isSuperadmin()) {
                throw ProblemException.forbidden("BRANCH_SCOPE_VIOLATION", "Admins cannot move trainers to another branch");
            }
            account.setBranch(request.branchName().trim());
        }

        account.setEmail(email);
        account.setFullName(request.name().trim());
        account.setPhone(request.phone());
        if (StringUtils.hasText(request.password())) {
            account.setPasswordHash(passwordEncoder.encode(request.password()));
        }
        trainer.setSpecialization(joinSpecializations(request.specialization()));
        trainer.setRating(request.rating());
        trainer.setExperience(request.experience());
        trainer.setAvailability(request.availability());
        saveAccount(account);

        log.info("Trainer {} updated by {}", trainerId, caller.userId());
        return TrainerDtoMapper.toResponse(trainer);
    }

    /**
     * Removes the profile and its account. Sessions, attendance and plans owned by the trainer
     * go with it through the foreign-key cascades.
     */
    public void deleteTrainer(CallerContext caller, UUID trainerId) {
        Trainer trainer = loadManagedTrainer(caller, trainerId);
        GymUser account = trainer.getAccount();
        trainerRepository.delete(trainer);
        trainerRepository.flush();
        gymUserRepository.delete(account);
        log.info("Trainer {} deleted by {}", trainerId, caller.userId());
    }

    private Trainer loadTrainer(UUID trainerId) {
        return trainerRepository.findByIdWithAccount(trainerId)
                .orElseThrow(() -> ProblemException.notFound("TRAINER_NOT_FOUND", "Trainer not found"));
    }

    private Trainer loadManagedTrainer(CallerContext caller, UUID trainerId) {
        caller.requireAdminOrSuperadmin();
        Trainer trainer = loadTrainer(trainerId);
        if (!caller.isSuperadmin() && !caller.inBranch(trainer.getBranchName())) {
            throw ProblemException.notFound("TRAINER_NOT_FOUND", "Trainer not found");
        }
        return trainer;
    }

    private String resolveTargetBranch(CallerContext caller, String requestedBranch) {
        if (caller.isSuperadmin()) {
            if (!StringUtils.hasText(requestedBranch)) {
                throw ProblemException.invalidState("BRANCH_REQUIRED", "branchName is required");
            }
            return requestedBranch.trim();
        }
        return requireAdminBranch(caller);
    }

    private static String requireAdminBranch(CallerContext caller) {
        if (!caller.hasBranch()) {
            throw ProblemException.invalidState("ADMIN_BRANCH_REQUIRED", "Admin's branch is not specified");
        }
        return caller.branch();
    }

    /**
     * Flushes immediately so that a concurrent registration of the same email surfaces here as 409.
     */
    private GymUser saveAccount(GymUser account) {
        try {
            return gymUserRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            if (isEmailUniqueViolation(ex)) {
                throw ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "An account with this email already exists");
            }
            throw ex;
        }
    }

    private static boolean isEmailUniqueViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains("uq_gym_user_email");
    }

    private static String joinSpecializations(List<String> specializations) {
        try {
            return Specializations.join(specializations);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.invalidState("INVALID_SPECIALIZATION", ex.getMessage());
        }
    }
}
