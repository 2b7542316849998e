package com.fitnexus.backend.modules.trainer.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Full replacement of a trainer profile. A blank {@code password} keeps the current one.
 */
public record TrainerUpdateRequest(
        @NotBlank @Size(max = 100) String name,
        List<@NotBlank @Size(max = 50) String> specialization,
        @DecimalMin("0.0") @DecimalMax("5.0") double rating,
        @PositiveOrZero int experience,
        @Size(max = 32) String phone,
        @NotBlank @Email @Size(max = 320) String email,
        @Size(min = 8, max = 128) String password,
        @Size(max = 255) String availability,
        @Size(max = 100) String branchName
) {
}
