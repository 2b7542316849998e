package com.fitnexus.backend.modules.account.presentation;

import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.global.security.JwtAuthenticationPrincipal;
import com.fitnexus.backend.modules.account.application.AuthService;
import com.fitnexus.backend.modules.account.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Current account")
    @GetMapping("/profile/me")
    public ResponseEntity<UserResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        CallerContext caller = CallerContext.of(principal);
        return ResponseEntity.ok(authService.loadProfile(caller.userId()));
    }
}
