package com.fitnexus.backend.modules.attendance.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fitnexus.backend.global.common.ImmutableFieldGuard;
import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.account.infrastructure.persistence.GymUserRepository;
import com.fitnexus.backend.modules.attendance.domain.AttendanceStatus;
import com.fitnexus.backend.modules.attendance.domain.SessionAttendance;
import com.fitnexus.backend.modules.attendance.infrastructure.persistence.SessionAttendanceRepository;
import com.fitnexus.backend.modules.attendance.presentation.dto.AttendanceCreateRequest;
import com.fitnexus.backend.modules.attendance.presentation.dto.AttendanceDtoMapper;
import com.fitnexus.backend.modules.attendance.presentation.dto.AttendanceResponse;
import com.fitnexus.backend.modules.attendance.presentation.dto.AttendanceUpdateRequest;
import com.fitnexus.backend.modules.schedule.domain.SessionSchedule;
import com.fitnexus.backend.modules.schedule.infrastructure.persistence.SessionScheduleRepository;
import com.fitnexus.backend.modules.trainer.application.TrainerProfileSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Bookings and attendance marks. Trainers manage the records of their own sessions; every other
 * role acts on its own records only.
 */
@Service
@Transactional
public class SessionAttendanceService {

    private static final Logger log = LoggerFactory.getLogger(SessionAttendanceService.class);
    private static final String UNIQUE_BOOKING_CONSTRAINT = "uq_session_attendance_session_user_date";

    private final SessionAttendanceRepository sessionAttendanceRepository;
    private final SessionScheduleRepository sessionScheduleRepository;
    private final GymUserRepository gymUserRepository;
    private final TrainerProfileSupport trainerProfileSupport;
    private final Clock clock;

    public SessionAttendanceService(
            SessionAttendanceRepository sessionAttendanceRepository,
            SessionScheduleRepository sessionScheduleRepository,
            GymUserRepository gymUserRepository,
            TrainerProfileSupport trainerProfileSupport,
            Clock clock
    ) {
        this.sessionAttendanceRepository = sessionAttendanceRepository;
        this.sessionScheduleRepository = sessionScheduleRepository;
        this.gymUserRepository = gymUserRepository;
        this.trainerProfileSupport = trainerProfileSupport;
        this.clock = clock;
    }

    /**
     * Books, or re-marks, the subject user on the session for the given day. A second call for the
     * same (session, user, date) updates the status of the existing record.
     * <p>
     * The session row stays locked until commit, so concurrent bookings of one session are counted
     * against its capacity one at a time.
     */
    public BookingResult recordAttendance(CallerContext caller, UUID sessionId, AttendanceCreateRequest request) {
        SessionSchedule session = sessionScheduleRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND", "Session not found"));
        GymUser subject = resolveSubjectForCreate(caller, session, request.userId());

        LocalDate attendanceDate = request.attendanceDate() != null ? request.attendanceDate() : LocalDate.now(clock);
        AttendanceStatus status = request.status() != null ? request.status() : AttendanceStatus.BOOKED;

        Optional<SessionAttendance> existing = sessionAttendanceRepository
                .findBySessionIdAndUserIdAndAttendanceDate(sessionId, subject.getId(), attendanceDate);
        if (existing.isPresent()) {
            return new BookingResult(updateStatus(existing.get(), status), false);
        }

        ensureCapacity(session, attendanceDate, status);
        UUID candidateId = UUID.randomUUID();
        sessionAttendanceRepository.upsert(candidateId, sessionId, subject.getId(), status.name(), attendanceDate,
                OffsetDateTime.now(clock));
        SessionAttendance saved = sessionAttendanceRepository
                .findBySessionIdAndUserIdAndAttendanceDate(sessionId, subject.getId(), attendanceDate)
                .orElseThrow(() -> ProblemException.conflict("ATTENDANCE_CONFLICT", "Attendance could not be recorded"));

        boolean created = candidateId.equals(saved.getId());
        if (created) {
            log.info("Attendance {} recorded for user {} on session {} ({})",
                    saved.getId(), subject.getId(), sessionId, attendanceDate);
        } else {
            log.debug("Concurrent booking for user {} on session {} ({}) merged into attendance {}",
                    subject.getId(), sessionId, attendanceDate, saved.getId());
        }
        return new BookingResult(AttendanceDtoMapper.toResponse(saved), created);
    }

    @Transactional(readOnly = true)
    public List<AttendanceResponse> listAttendance(
            CallerContext caller,
            UUID sessionId,
            UUID userIdFilter,
            LocalDate dateFilter
    ) {
        SessionSchedule session = loadSession(sessionId);
        UUID userId;
        if (caller.isTrainer()) {
            requireSessionManagedBy(caller, session);
            userId = userIdFilter;
        } else {
            userId = caller.userId();
        }
        return findFiltered(sessionId, userId, dateFilter).stream()
                .map(AttendanceDtoMapper::toResponse)
                .toList();
    }

    public AttendanceResponse updateAttendance(CallerContext caller, UUID attendanceId, AttendanceUpdateRequest request) {
        SessionAttendance attendance = loadAttendance(attendanceId);

        if (caller.isTrainer()) {
            String branch = requireSessionManagedBy(caller, attendance.getSession());
            if (request.userId() != null && !attendance.belongsToUser(request.userId())) {
                attendance.setUser(loadUserInBranch(request.userId(), branch));
            }
        } else {
            requireOwnRecord(caller, attendance);
            if (request.userId() != null) {
                ImmutableFieldGuard.requireUnchanged("userId", attendance.getUser().getId(), request.userId(),
                        HttpStatus.FORBIDDEN, "ATTENDANCE_SELF_ONLY");
            }
        }

        attendance.setStatus(request.status());
        if (request.attendanceDate() != null) {
            attendance.setAttendanceDate(request.attendanceDate());
        }
        try {
            sessionAttendanceRepository.saveAndFlush(attendance);
        } catch (DataIntegrityViolationException ex) {
            if (isUniqueBookingViolation(ex)) {
                throw ProblemException.conflict("ATTENDANCE_CONFLICT",
                        "An attendance record already exists for this user, session and date");
            }
            throw ex;
        }
        log.info("Attendance {} updated by {}", attendanceId, caller.userId());
        return AttendanceDtoMapper.toResponse(attendance);
    }

    public void deleteAttendance(CallerContext caller, UUID attendanceId) {
        SessionAttendance attendance = loadAttendance(attendanceId);
        if (caller.isTrainer()) {
            requireSessionManagedBy(caller, attendance.getSession());
        } else {
            requireOwnRecord(caller, attendance);
        }
        sessionAttendanceRepository.delete(attendance);
        log.info("Attendance {} deleted by {}", attendanceId, caller.userId());
    }

    private GymUser resolveSubjectForCreate(CallerContext caller, SessionSchedule session, UUID subjectId) {
        if (caller.isTrainer()) {
            String branch = requireSessionManagedBy(caller, session);
            return loadUserInBranch(subjectId, branch);
        }
        if (!caller.isSelf(subjectId)) {
            log.debug("User {} tried to book session {} for {}", caller.userId(), session.getId(), subjectId);
            throw ProblemException.forbidden("ATTENDANCE_SELF_ONLY", "Members can only book attendance for themselves");
        }
        if (!caller.inBranch(session.getBranchName())) {
            throw ProblemException.forbidden("SESSION_BRANCH_MISMATCH", "Session belongs to another branch");
        }
        return gymUserRepository.findById(subjectId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User not found"));
    }

    /**
     * @return the trainer's branch as stored on the account
     */
    private String requireSessionManagedBy(CallerContext caller, SessionSchedule session) {
        String branch = trainerProfileSupport.loadCallerProfile(caller).getBranchName();
        if (!session.isOwnedBy(caller.userId()) || !branch.equals(session.getBranchName())) {
            log.debug("Trainer {} denied attendance access to session {}", caller.userId(), session.getId());
            throw ProblemException.forbidden("NOT_SESSION_OWNER", "Session is not managed by this trainer");
        }
        return branch;
    }

    private static void requireOwnRecord(CallerContext caller, SessionAttendance attendance) {
        if (!attendance.belongsToUser(caller.userId())) {
            throw ProblemException.forbidden("ATTENDANCE_SELF_ONLY", "Members can only manage their own attendance");
        }
    }

    private void ensureCapacity(SessionSchedule session, LocalDate attendanceDate, AttendanceStatus status) {
        Integer capacity = session.getMaxCapacity();
        if (capacity == null || !status.occupiesSeat()) {
            return;
        }
        long taken = sessionAttendanceRepository.countBySessionIdAndAttendanceDateAndStatusNot(
                session.getId(), attendanceDate, AttendanceStatus.CANCELLED);
        if (taken >= capacity) {
            throw ProblemException.conflict("SESSION_FULL", "Session is fully booked for " + attendanceDate);
        }
    }

    private static boolean isUniqueBookingViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains(UNIQUE_BOOKING_CONSTRAINT);
    }

    private AttendanceResponse updateStatus(SessionAttendance attendance, AttendanceStatus status) {
        attendance.setStatus(status);
        log.info("Attendance {} status set to {}", attendance.getId(), status.code());
        return AttendanceDtoMapper.toResponse(attendance);
    }

    private List<SessionAttendance> findFiltered(UUID sessionId, UUID userId, LocalDate date) {
        if (userId != null && date != null) {
            return sessionAttendanceRepository.findAllBySessionIdAndUserIdAndAttendanceDate(sessionId, userId, date);
        }
        if (userId != null) {
            return sessionAttendanceRepository.findAllBySessionIdAndUserIdOrderByAttendanceDateAsc(sessionId, userId);
        }
        if (date != null) {
            return sessionAttendanceRepository.findAllBySessionIdAndAttendanceDate(sessionId, date);
        }
        return sessionAttendanceRepository.findAllBySessionIdOrderByAttendanceDateAsc(sessionId);
    }

    private SessionSchedule loadSession(UUID sessionId) {
        return sessionScheduleRepository.findById(sessionId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND", "Session not found"));
    }

    private SessionAttendance loadAttendance(UUID attendanceId) {
        return sessionAttendanceRepository.findById(attendanceId)
                .orElseThrow(() -> ProblemException.notFound("ATTENDANCE_NOT_FOUND", "Attendance record not found"));
    }

    private GymUser loadUserInBranch(UUID userId, String branch) {
        return gymUserRepository.findByIdAndBranch(userId, branch)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND_IN_BRANCH", "User not found in trainer's branch"));
    }
}
