package com.fitnexus.backend.modules.plan.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fitnexus.backend.modules.plan.domain.AbstractAssignedPlan;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

/**
 * Queries shared by every plan table. All lookups are scoped to the assigning trainer and
 * the branch, so another trainer's plan reads as absent.
 */
@NoRepositoryBean
public interface AssignedPlanRepository<P extends AbstractAssignedPlan> extends JpaRepository<P, UUID> {

    Optional<P> findByIdAndAssignedByTrainerIdAndBranchName(UUID id, UUID trainerId, String branchName);

    List<P> findAllByAssignedByTrainerIdAndBranchNameOrderByAssignedDateDesc(UUID trainerId, String branchName);

    List<P> findAllByAssignedByTrainerIdAndBranchNameAndUserIdOrderByAssignedDateDesc(
            UUID trainerId,
            String branchName,
            UUID userId
    );
}
