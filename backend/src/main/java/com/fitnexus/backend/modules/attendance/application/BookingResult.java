package com.fitnexus.backend.modules.attendance.application;

import com.fitnexus.backend.modules.attendance.presentation.dto.AttendanceResponse;

/**
 * Outcome of an attendance upsert; {@code created} is false when an existing record was updated.
 */
public record BookingResult(AttendanceResponse attendance, boolean created) {
}
