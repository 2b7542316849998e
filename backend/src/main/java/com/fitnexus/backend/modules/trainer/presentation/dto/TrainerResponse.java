package com.fitnexus.backend.modules.trainer.presentation.dto;

import java.util.List;
import java.util.UUID;

public record TrainerResponse(
        UUID id,
        String name,
        List<String> specialization,
        double rating,
        int experience,
        String phone,
        String email,
        String availability,
        String branchName
) {
}
