package com.fitnexus.backend.global.security;

import java.util.UUID;

import com.fitnexus.backend.modules.account.domain.GymRole;

public record JwtAuthenticationPrincipal(UUID userId, String loginId, GymRole role, String branch) {
}
