package com.fitnexus.backend.modules.schedule.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.global.security.JwtAuthenticationPrincipal;
import com.fitnexus.backend.modules.schedule.application.SessionScheduleService;
import com.fitnexus.backend.modules.schedule.presentation.dto.SessionRequest;
import com.fitnexus.backend.modules.schedule.presentation.dto.SessionResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/trainers")
public class SessionScheduleController {

    private final SessionScheduleService sessionScheduleService;

    public SessionScheduleController(SessionScheduleService sessionScheduleService) {
        this.sessionScheduleService = sessionScheduleService;
    }

    @Operation(summary = "Create a session", description = "The session is placed in the branch stored on the trainer's account.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Session created"),
            @ApiResponse(responseCode = "400", description = "`INVALID_TIME_RANGE` or `TRAINER_BRANCH_REQUIRED`"),
            @ApiResponse(responseCode = "403", description = "Caller is not a trainer")
    })
    @PostMapping("/sessions")
    public ResponseEntity<SessionResponse> createSession(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody SessionRequest request
    ) {
        SessionResponse response = sessionScheduleService.createSession(CallerContext.of(principal), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<SessionResponse>> listOwnSessions(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(sessionScheduleService.listOwnSessions(CallerContext.of(principal)));
    }

    @Operation(summary = "Public timetable", description = "Optional `branch` and `date` filters; open to every authenticated caller.")
    @GetMapping("/public-sessions")
    public ResponseEntity<List<SessionResponse>> listPublicSessions(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "branch", required = false) String branch,
            @RequestParam(name = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(sessionScheduleService.listPublicSessions(CallerContext.of(principal), branch, date));
    }

    @Operation(summary = "Update own session")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session updated"),
            @ApiResponse(responseCode = "404", description = "Not one of the caller's sessions, code `SESSION_NOT_FOUND`")
    })
    @PutMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionResponse> updateSession(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID sessionId,
            @Valid @RequestBody SessionRequest request
    ) {
        return ResponseEntity.ok(sessionScheduleService.updateSession(CallerContext.of(principal), sessionId, request));
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> deleteSession(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID sessionId
    ) {
        sessionScheduleService.deleteSession(CallerContext.of(principal), sessionId);
        return ResponseEntity.noContent().build();
    }
}
