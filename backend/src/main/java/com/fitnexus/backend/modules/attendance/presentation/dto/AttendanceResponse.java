package com.fitnexus.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fitnexus.backend.modules.account.presentation.dto.UserResponse;
import com.fitnexus.backend.modules.attendance.domain.AttendanceStatus;

public record AttendanceResponse(
        UUID id,
        UUID sessionId,
        UUID userId,
        AttendanceStatus status,
        LocalDate attendanceDate,
        UserResponse user
) {
}
