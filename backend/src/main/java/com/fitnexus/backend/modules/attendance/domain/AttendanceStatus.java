package com.fitnexus.backend.modules.attendance.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AttendanceStatus {
    BOOKED,
    ATTENDED,
    CANCELLED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean occupiesSeat() {
        return this != CANCELLED;
    }

    @JsonCreator
    public static AttendanceStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("status must not be blank");
        }
        return AttendanceStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
