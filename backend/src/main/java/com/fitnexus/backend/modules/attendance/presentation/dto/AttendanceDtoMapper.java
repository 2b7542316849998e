package com.fitnexus.backend.modules.attendance.presentation.dto;

import com.fitnexus.backend.modules.account.presentation.dto.UserResponse;
import com.fitnexus.backend.modules.attendance.domain.SessionAttendance;

public final class AttendanceDtoMapper {

    private AttendanceDtoMapper() {
    }

    public static AttendanceResponse toResponse(SessionAttendance attendance) {
        UserResponse user = UserResponse.from(attendance.getUser());
        return new AttendanceResponse(
                attendance.getId(),
                attendance.getSession().getId(),
                user.id(),
                attendance.getStatus(),
                attendance.getAttendanceDate(),
                user
        );
    }
}
