package com.fitnexus.backend.global.common;

import java.util.Objects;

import com.fitnexus.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Rejects update payloads that try to change a field fixed at creation time.
 */
public final class ImmutableFieldGuard {

    public static final String IMMUTABLE_FIELD = "IMMUTABLE_FIELD";

    private ImmutableFieldGuard() {
    }

    /**
     * Fails with 400 {@code IMMUTABLE_FIELD} when {@code requested} differs from {@code current}.
     */
    public static void requireUnchanged(String field, Object current, Object requested) {
        requireUnchanged(field, current, requested, HttpStatus.BAD_REQUEST, IMMUTABLE_FIELD);
    }

    public static void requireUnchanged(String field, Object current, Object requested, HttpStatus status, String code) {
        if (!Objects.equals(current, requested)) {
            throw new ProblemException(status, code, field + " cannot be changed after creation");
        }
    }
}
