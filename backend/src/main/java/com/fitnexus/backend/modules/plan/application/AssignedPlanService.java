package com.fitnexus.backend.modules.plan.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.fitnexus.backend.global.common.ImmutableFieldGuard;
import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.account.infrastructure.persistence.GymUserRepository;
import com.fitnexus.backend.modules.plan.domain.AbstractAssignedPlan;
import com.fitnexus.backend.modules.plan.domain.PlanKind;
import com.fitnexus.backend.modules.plan.infrastructure.persistence.AssignedPlanRepository;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanCreateRequest;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanDtoMapper;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanResponse;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanUpdateRequest;
import com.fitnexus.backend.modules.trainer.application.TrainerProfileSupport;
import com.fitnexus.backend.modules.trainer.domain.Trainer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

/**
 * Trainer-side lifecycle of an assigned plan. Subclasses bind a concrete plan table.
 */
@Transactional
public abstract class AssignedPlanService<P extends AbstractAssignedPlan> {

    private static final Logger log = LoggerFactory.getLogger(AssignedPlanService.class);

    private final AssignedPlanRepository<P> planRepository;
    private final GymUserRepository gymUserRepository;
    private final TrainerProfileSupport trainerProfileSupport;
    private final Clock clock;

    protected AssignedPlanService(
            AssignedPlanRepository<P> planRepository,
            GymUserRepository gymUserRepository,
            TrainerProfileSupport trainerProfileSupport,
            Clock clock
    ) {
        this.planRepository = planRepository;
        this.gymUserRepository = gymUserRepository;
        this.trainerProfileSupport = trainerProfileSupport;
        this.clock = clock;
    }

    protected abstract PlanKind kind();

    protected abstract P newPlan();

    public PlanResponse createPlan(CallerContext caller, PlanCreateRequest request) {
        Trainer trainer = trainerProfileSupport.loadCallerProfile(caller);
        String branch = trainer.getBranchName();
        GymUser member = gymUserRepository.findByIdAndBranch(request.userId(), branch)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND_IN_BRANCH", "User not found in trainer's branch"));

        LocalDate today = LocalDate.now(clock);
        validateExpiry(today, request.expiryDate());

        P plan = newPlan();
        plan.assign(member, trainer, branch, today);
        plan.setTitle(request.title().trim());
        plan.setDescription(request.description());
        plan.setExpiryDate(request.expiryDate());
        P saved = planRepository.save(plan);

        log.info("{} {} assigned to user {} by trainer {}", kind().label(), saved.getId(), member.getId(), trainer.getId());
        return PlanDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<PlanResponse> listPlans(CallerContext caller, UUID userIdFilter) {
        String branch = trainerProfileSupport.loadCallerProfile(caller).getBranchName();
        List<P> plans = userIdFilter == null
                ? planRepository.findAllByAssignedByTrainerIdAndBranchNameOrderByAssignedDateDesc(caller.userId(), branch)
                : planRepository.findAllByAssignedByTrainerIdAndBranchNameAndUserIdOrderByAssignedDateDesc(
                        caller.userId(), branch, userIdFilter);
        return plans.stream().map(PlanDtoMapper::toResponse).toList();
    }

    public PlanResponse updatePlan(CallerContext caller, UUID planId, PlanUpdateRequest request) {
        P plan = loadOwnedPlan(caller, planId);
        if (request.userId() != null) {
            ImmutableFieldGuard.requireUnchanged("userId", plan.getUser().getId(), request.userId());
        }
        validateExpiry(plan.getAssignedDate(), request.expiryDate());

        plan.setTitle(request.title().trim());
        plan.setDescription(request.description());
        plan.setExpiryDate(request.expiryDate());

        log.info("{} {} updated by trainer {}", kind().label(), planId, caller.userId());
        return PlanDtoMapper.toResponse(plan);
    }

    public void deletePlan(CallerContext caller, UUID planId) {
        P plan = loadOwnedPlan(caller, planId);
        planRepository.delete(plan);
        log.info("{} {} deleted by trainer {}", kind().label(), planId, caller.userId());
    }

    private P loadOwnedPlan(CallerContext caller, UUID planId) {
        String branch = trainerProfileSupport.loadCallerProfile(caller).getBranchName();
        return planRepository.findByIdAndAssignedByTrainerIdAndBranchName(planId, caller.userId(), branch)
                .orElseThrow(() -> ProblemException.notFound("PLAN_NOT_FOUND", kind().label() + " not found"));
    }

    private static void validateExpiry(LocalDate assignedDate, LocalDate expiryDate) {
        if (expiryDate != null && expiryDate.isBefore(assignedDate)) {
            throw ProblemException.invalidState("INVALID_EXPIRY_DATE", "expiryDate must not precede " + assignedDate);
        }
    }
}
