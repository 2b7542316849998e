package com.fitnexus.backend.modules.account.presentation.dto;

public record LoginResponse(TokenResponse tokens, UserResponse user) {
}
