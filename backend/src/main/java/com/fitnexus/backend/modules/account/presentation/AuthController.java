package com.fitnexus.backend.modules.account.presentation;

import com.fitnexus.backend.modules.account.application.AuthService;
import com.fitnexus.backend.modules.account.presentation.dto.LoginRequest;
import com.fitnexus.backend.modules.account.presentation.dto.LoginResponse;
import com.fitnexus.backend.modules.account.presentation.dto.RegisterRequest;
import com.fitnexus.backend.modules.account.presentation.dto.UserResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register a member", description = "Creates a member account in the requested branch. The role is always `member`.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "409", description = "Email taken, code `EMAIL_ALREADY_REGISTERED`")
    })
    @PostMapping("/auth/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @Operation(summary = "Log in")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Access token issued"),
            @ApiResponse(responseCode = "401", description = "Unknown email or wrong password, code `INVALID_CREDENTIALS`")
    })
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
}
