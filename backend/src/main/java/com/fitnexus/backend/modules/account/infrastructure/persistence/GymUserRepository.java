package com.fitnexus.backend.modules.account.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface GymUserRepository extends JpaRepository<GymUser, UUID> {

    @Query("select u from GymUser u where lower(u.email) = lower(:email)")
    Optional<GymUser> findByEmailIgnoreCase(@Param("email") String email);

    @Query("select case when count(u) > 0 then true else false end from GymUser u where lower(u.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    /**
     * Point lookup restricted to one branch; a user of another branch reads as absent.
     */
    Optional<GymUser> findByIdAndBranch(UUID id, String branch);

    boolean existsByRole(GymRole role);
}
