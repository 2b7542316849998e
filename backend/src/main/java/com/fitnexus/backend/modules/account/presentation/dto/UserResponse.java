package com.fitnexus.backend.modules.account.presentation.dto;

import java.util.UUID;

import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;

/**
 * Public view of an account, embedded in attendance and plan responses.
 */
public record UserResponse(
        UUID id,
        String name,
        String email,
        String phone,
        GymRole role,
        String branch
) {

    public static UserResponse from(GymUser user) {
        return new UserResponse(
                user.getId(),
                user.getFullName(),
                user.getEmail(),
                user.getPhone(),
                user.getRole(),
                user.getBranch()
        );
    }
}
