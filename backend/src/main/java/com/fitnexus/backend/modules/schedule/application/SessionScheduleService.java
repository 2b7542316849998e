package com.fitnexus.backend.modules.schedule.application;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.modules.schedule.domain.SessionSchedule;
import com.fitnexus.backend.modules.schedule.infrastructure.persistence.SessionScheduleRepository;
import com.fitnexus.backend.modules.schedule.presentation.dto.SessionDtoMapper;
import com.fitnexus.backend.modules.schedule.presentation.dto.SessionRequest;
import com.fitnexus.backend.modules.schedule.presentation.dto.SessionResponse;
import com.fitnexus.backend.modules.trainer.application.TrainerProfileSupport;
import com.fitnexus.backend.modules.trainer.domain.Trainer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class SessionScheduleService {

    private static final Logger log = LoggerFactory.getLogger(SessionScheduleService.class);

    private final SessionScheduleRepository sessionScheduleRepository;
    private final TrainerProfileSupport trainerProfileSupport;

    public SessionScheduleService(
            SessionScheduleRepository sessionScheduleRepository,
            TrainerProfileSupport trainerProfileSupport
    ) {
        this.sessionScheduleRepository = sessionScheduleRepository;
        this.trainerProfileSupport = trainerProfileSupport;
    }

    public SessionResponse createSession(CallerContext caller, SessionRequest request) {
        Trainer trainer = trainerProfileSupport.loadCallerProfile(caller);
        validateTimeRange(request);

        SessionSchedule session = new SessionSchedule(trainer, trainer.getBranchName());
        applyRequest(session, request);
        SessionSchedule saved = sessionScheduleRepository.save(session);

        log.info("Session {} created by trainer {} in branch {}", saved.getId(), trainer.getId(), saved.getBranchName());
        return SessionDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<SessionResponse> listOwnSessions(CallerContext caller) {
        caller.requireTrainer();
        return sessionScheduleRepository.findAllByTrainerIdOrderBySessionDateAscStartTimeAsc(caller.userId())
                .stream()
                .map(SessionDtoMapper::toResponse)
                .toList();
    }

    /**
     * Read-only timetable visible to every authenticated caller.
     */
    @Transactional(readOnly = true)
    public List<SessionResponse> listPublicSessions(CallerContext caller, String branch, LocalDate date) {
        boolean byBranch = StringUtils.hasText(branch);
        List<SessionSchedule> sessions;
        if (byBranch && date != null) {
            sessions = sessionScheduleRepository.findAllByBranchNameAndSessionDateOrderByStartTimeAsc(branch.trim(), date);
        } else if (byBranch) {
            sessions = sessionScheduleRepository.findAllByBranchNameOrderBySessionDateAscStartTimeAsc(branch.trim());
        } else if (date != null) {
            sessions = sessionScheduleRepository.findAllBySessionDateOrderByStartTimeAsc(date);
        } else {
            sessions = sessionScheduleRepository.findAllByOrderBySessionDateAscStartTimeAsc();
        }
        return sessions.stream().map(SessionDtoMapper::toResponse).toList();
    }

    public SessionResponse updateSession(CallerContext caller, UUID sessionId, SessionRequest request) {
        SessionSchedule session = loadOwnedSession(caller, sessionId);
        validateTimeRange(request);
        applyRequest(session, request);
        log.info("Session {} updated by trainer {}", sessionId, caller.userId());
        return SessionDtoMapper.toResponse(session);
    }

    /**
     * Attendance records of the session are removed by the foreign-key cascade.
     */
    public void deleteSession(CallerContext caller, UUID sessionId) {
        SessionSchedule session = loadOwnedSession(caller, sessionId);
        sessionScheduleRepository.delete(session);
        log.info("Session {} deleted by trainer {}", sessionId, caller.userId());
    }

    private SessionSchedule loadOwnedSession(CallerContext caller, UUID sessionId) {
        caller.requireTrainer();
        return sessionScheduleRepository.findByIdAndTrainerId(sessionId, caller.userId())
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND", "Session not found"));
    }

    private static void validateTimeRange(SessionRequest request) {
        if (!request.endTime().isAfter(request.startTime())) {
            throw ProblemException.invalidState("INVALID_TIME_RANGE", "endTime must be after startTime");
        }
    }

    private static void applyRequest(SessionSchedule session, SessionRequest request) {
        session.setSessionName(request.sessionName().trim());
        session.setSessionDate(request.sessionDate());
        session.setStartTime(request.startTime());
        session.setEndTime(request.endTime());
        session.setMaxCapacity(request.maxCapacity());
        session.setDescription(request.description());
    }
}
