package com.fitnexus.backend.global.security;

import java.util.Objects;
import java.util.UUID;

import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.modules.account.domain.GymRole;

/**
 * Identity of the caller of a single request: who, with which role, in which branch.
 * <p>
 * Built once by the controller from the authenticated principal and passed explicitly to every
 * service operation. Derivation has no side effects; the guards only throw.
 */
public record CallerContext(UUID userId, GymRole role, String branch) {

    public CallerContext {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(role, "role");
        branch = (branch == null || branch.isBlank()) ? null : branch;
    }

    /**
     * @throws ProblemException 401 when the request carries no authenticated principal
     */
    public static CallerContext of(JwtAuthenticationPrincipal principal) {
        if (principal == null || principal.userId() == null || principal.role() == null) {
            throw ProblemException.unauthenticated("UNAUTHORIZED");
        }
        return new CallerContext(principal.userId(), principal.role(), principal.branch());
    }

    public boolean isTrainer() {
        return role == GymRole.TRAINER;
    }

    public boolean isAdminOrSuperadmin() {
        return role == GymRole.ADMIN || role == GymRole.SUPERADMIN;
    }

    public boolean isSuperadmin() {
        return role == GymRole.SUPERADMIN;
    }

    public boolean hasBranch() {
        return branch != null;
    }

    public boolean isSelf(UUID otherUserId) {
        return userId.equals(otherUserId);
    }

    public boolean inBranch(String otherBranch) {
        return branch != null && branch.equals(otherBranch);
    }

    public CallerContext requireTrainer() {
        if (!isTrainer()) {
            throw ProblemException.forbidden("TRAINER_ROLE_REQUIRED", "Only trainers can access this resource");
        }
        return this;
    }

    public CallerContext requireAdminOrSuperadmin() {
        if (!isAdminOrSuperadmin()) {
            throw ProblemException.forbidden("ADMIN_ROLE_REQUIRED", "Only admins or superadmins can access this resource");
        }
        return this;
    }
}
