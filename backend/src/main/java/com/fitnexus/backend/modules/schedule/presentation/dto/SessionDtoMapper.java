package com.fitnexus.backend.modules.schedule.presentation.dto;

import com.fitnexus.backend.modules.schedule.domain.SessionSchedule;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerDtoMapper;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerResponse;

public final class SessionDtoMapper {

    private SessionDtoMapper() {
    }

    public static SessionResponse toResponse(SessionSchedule session) {
        TrainerResponse trainer = TrainerDtoMapper.toOwnerResponse(session.getTrainer(), session.getId());
        return new SessionResponse(
                session.getId(),
                trainer.id(),
                session.getSessionName(),
                session.getSessionDate(),
                session.getStartTime(),
                session.getEndTime(),
                session.getBranchName(),
                session.getMaxCapacity(),
                session.getDescription(),
                trainer
        );
    }
}
