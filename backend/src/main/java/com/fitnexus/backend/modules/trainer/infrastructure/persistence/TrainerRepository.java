package com.fitnexus.backend.modules.trainer.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fitnexus.backend.modules.trainer.domain.Trainer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TrainerRepository extends JpaRepository<Trainer, UUID> {

    @Query("""
            select t
              from Trainer t
              join fetch t.account a
             order by lower(a.fullName)
            """)
    List<Trainer> findAllWithAccount();

    @Query("""
            select t
              from Trainer t
              join fetch t.account a
             where a.branch = :branch
             order by lower(a.fullName)
            """)
    List<Trainer> findAllByBranch(@Param("branch") String branch);

    @Query("""
            select t
              from Trainer t
              join fetch t.account a
             where t.id = :id
            """)
    Optional<Trainer> findByIdWithAccount(@Param("id") UUID id);
}
