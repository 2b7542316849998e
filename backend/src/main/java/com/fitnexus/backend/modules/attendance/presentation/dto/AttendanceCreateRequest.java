package com.fitnexus.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.util.UUID;

import com.fitnexus.backend.modules.attendance.domain.AttendanceStatus;

import jakarta.validation.constraints.NotNull;

/**
 * {@code status} defaults to booked and {@code attendanceDate} to today (UTC).
 */
public record AttendanceCreateRequest(
        @NotNull UUID userId,
        AttendanceStatus status,
        LocalDate attendanceDate
) {
}
