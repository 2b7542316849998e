package com.fitnexus.backend.modules.account.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GymRole {
    MEMBER,
    TRAINER,
    ADMIN,
    SUPERADMIN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String authority() {
        return "ROLE_" + name();
    }

    @JsonCreator
    public static GymRole fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        return GymRole.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
