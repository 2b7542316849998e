package com.fitnexus.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fitnexus.backend.modules.attendance.domain.AttendanceStatus;

import jakarta.validation.constraints.NotNull;

/**
 * A null {@code userId} or {@code attendanceDate} keeps the current value.
 */
public record AttendanceUpdateRequest(
        UUID userId,
        @NotNull AttendanceStatus status,
        LocalDate attendanceDate
) {
}
