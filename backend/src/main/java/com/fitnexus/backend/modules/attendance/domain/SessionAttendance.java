package com.fitnexus.backend.modules.attendance.domain;

import java.time.LocalDate;
import java.util.UUID;

import com.fitnexus.backend.global.jpa.AbstractTimestampedEntity;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.schedule.domain.SessionSchedule;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * One member's booking of a session on a given day. At most one row exists per
 * (session, user, attendance date).
 */
@Entity
@Table(
        name = "session_attendance",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_session_attendance_session_user_date",
                columnNames = {"session_id", "user_id", "attendance_date"}
        )
)
public class SessionAttendance extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "session_id", nullable = false, updatable = false)
    private SessionSchedule session;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private GymUser user;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AttendanceStatus status = AttendanceStatus.BOOKED;

    @Column(name = "attendance_date", nullable = false)
    private LocalDate attendanceDate;

    protected SessionAttendance() {
    }

    public SessionAttendance(SessionSchedule session, GymUser user, LocalDate attendanceDate, AttendanceStatus status) {
        this.session = session;
        this.user = user;
        this.attendanceDate = attendanceDate;
        this.status = status;
    }

    public UUID getId() {
        return id;
    }

    public SessionSchedule getSession() {
        return session;
    }

    public GymUser getUser() {
        return user;
    }

    public void setUser(GymUser user) {
        this.user = user;
    }

    public boolean belongsToUser(UUID userId) {
        return user != null && user.getId() != null && user.getId().equals(userId);
    }

    public AttendanceStatus getStatus() {
        return status;
    }

    public void setStatus(AttendanceStatus status) {
        this.status = status;
    }

    public LocalDate getAttendanceDate() {
        return attendanceDate;
    }

    public void setAttendanceDate(LocalDate attendanceDate) {
        this.attendanceDate = attendanceDate;
    }
}
