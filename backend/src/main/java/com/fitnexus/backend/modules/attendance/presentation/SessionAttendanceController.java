package com.fitnexus.backend.modules.attendance.presentation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.global.security.JwtAuthenticationPrincipal;
import com.fitnexus.backend.modules.attendance.application.BookingResult;
import com.fitnexus.backend.modules.attendance.application.SessionAttendanceService;
import com.fitnexus.backend.modules.attendance.presentation.dto.AttendanceCreateRequest;
import com.fitnexus.backend.modules.attendance.presentation.dto.AttendanceResponse;
import com.fitnexus.backend.modules.attendance.presentation.dto.AttendanceUpdateRequest;

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
@RequestMapping("/trainers/sessions")
public class SessionAttendanceController {

    private final SessionAttendanceService sessionAttendanceService;

    public SessionAttendanceController(SessionAttendanceService sessionAttendanceService) {
        this.sessionAttendanceService = sessionAttendanceService;
    }

    @Operation(
            summary = "Book or mark attendance",
            description = """
                    Trainers record attendance for users of their branch on their own sessions; \
                    members book themselves. A repeat call for the same user and date updates the status.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "New record created"),
            @ApiResponse(responseCode = "200", description = "Existing record updated"),
            @ApiResponse(responseCode = "403", description = "`NOT_SESSION_OWNER`, `ATTENDANCE_SELF_ONLY` or `SESSION_BRANCH_MISMATCH`"),
            @ApiResponse(responseCode = "409", description = "Session already full for that date, code `SESSION_FULL`")
    })
    @PostMapping("/{sessionId}/attendance")
    public ResponseEntity<AttendanceResponse> recordAttendance(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID sessionId,
            @Valid @RequestBody AttendanceCreateRequest request
    ) {
        BookingResult result = sessionAttendanceService.recordAttendance(CallerContext.of(principal), sessionId, request);
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result.attendance());
    }

    @Operation(summary = "List attendance", description = "Members only ever see their own records.")
    @GetMapping("/{sessionId}/attendance")
    public ResponseEntity<List<AttendanceResponse>> listAttendance(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID sessionId,
            @RequestParam(name = "userId", required = false) UUID userId,
            @RequestParam(name = "attendanceDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate attendanceDate
    ) {
        return ResponseEntity.ok(sessionAttendanceService.listAttendance(
                CallerContext.of(principal), sessionId, userId, attendanceDate));
    }

    @Operation(summary = "Update attendance")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Record updated"),
            @ApiResponse(responseCode = "403", description = "`NOT_SESSION_OWNER` or `ATTENDANCE_SELF_ONLY`"),
            @ApiResponse(responseCode = "409", description = "Another record exists for that user and date, code `ATTENDANCE_CONFLICT`")
    })
    @PutMapping("/attendance/{attendanceId}")
    public ResponseEntity<AttendanceResponse> updateAttendance(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID attendanceId,
            @Valid @RequestBody AttendanceUpdateRequest request
    ) {
        return ResponseEntity.ok(sessionAttendanceService.updateAttendance(CallerContext.of(principal), attendanceId, request));
    }

    @DeleteMapping("/attendance/{attendanceId}")
    public ResponseEntity<Void> deleteAttendance(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID attendanceId
    ) {
        sessionAttendanceService.deleteAttendance(CallerContext.of(principal), attendanceId);
        return ResponseEntity.noContent().build();
    }
}
