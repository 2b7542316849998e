package com.fitnexus.backend.modules.schedule.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fitnexus.backend.modules.schedule.domain.SessionSchedule;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SessionScheduleRepository extends JpaRepository<SessionSchedule, UUID> {

    /**
     * Owner-scoped point lookup; another trainer's session reads as absent.
     */
    Optional<SessionSchedule> findByIdAndTrainerId(UUID id, UUID trainerId);

    /**
     * Row lock taken by bookings so that the seat count and the insert see the same state.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from SessionSchedule s where s.id = :id")
    Optional<SessionSchedule> findByIdForUpdate(@Param("id") UUID id);

    List<SessionSchedule> findAllByTrainerIdOrderBySessionDateAscStartTimeAsc(UUID trainerId);

    List<SessionSchedule> findAllByOrderBySessionDateAscStartTimeAsc();

    List<SessionSchedule> findAllByBranchNameOrderBySessionDateAscStartTimeAsc(String branchName);

    List<SessionSchedule> findAllBySessionDateOrderByStartTimeAsc(LocalDate sessionDate);

    List<SessionSchedule> findAllByBranchNameAndSessionDateOrderByStartTimeAsc(String branchName, LocalDate sessionDate);
}
