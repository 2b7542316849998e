package com.fitnexus.backend.modules.attendance.infrastructure.persistence;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fitnexus.backend.modules.attendance.domain.AttendanceStatus;
import com.fitnexus.backend.modules.attendance.domain.SessionAttendance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SessionAttendanceRepository extends JpaRepository<SessionAttendance, UUID> {

    Optional<SessionAttendance> findBySessionIdAndUserIdAndAttendanceDate(UUID sessionId, UUID userId, LocalDate attendanceDate);

    List<SessionAttendance> findAllBySessionIdOrderByAttendanceDateAsc(UUID sessionId);

    List<SessionAttendance> findAllBySessionIdAndUserIdOrderByAttendanceDateAsc(UUID sessionId, UUID userId);

    List<SessionAttendance> findAllBySessionIdAndAttendanceDate(UUID sessionId, LocalDate attendanceDate);

    List<SessionAttendance> findAllBySessionIdAndUserIdAndAttendanceDate(UUID sessionId, UUID userId, LocalDate attendanceDate);

    long countBySessionIdAndAttendanceDateAndStatusNot(UUID sessionId, LocalDate attendanceDate, AttendanceStatus status);

    /**
     * Inserts the booking, or overwrites the status of the row already holding
     * (session, user, date). The existing row keeps its id.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            insert into session_attendance (id, session_id, user_id, status, attendance_date, created_at, updated_at)
            values (:id, :sessionId, :userId, :status, :attendanceDate, :now, :now)
            on conflict (session_id, user_id, attendance_date)
            do update set status = excluded.status, updated_at = excluded.updated_at
            """, nativeQuery = true)
    int upsert(@Param("id") UUID id,
               @Param("sessionId") UUID sessionId,
               @Param("userId") UUID userId,
               @Param("status") String status,
               @Param("attendanceDate") LocalDate attendanceDate,
               @Param("now") OffsetDateTime now);
}
