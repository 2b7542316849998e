package com.fitnexus.backend.modules.trainer.presentation;

import java.util.List;
import java.util.UUID;

import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.global.security.JwtAuthenticationPrincipal;
import com.fitnexus.backend.modules.trainer.application.TrainerService;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerCreateRequest;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerResponse;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerUpdateRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/trainers")
public class TrainerController {

    private final TrainerService trainerService;

    public TrainerController(TrainerService trainerService) {
        this.trainerService = trainerService;
    }

    @Operation(
            summary = "Add a trainer",
            description = """
                    Creates the trainer account and profile. \
                    Admins always place the trainer in their own branch; superadmins must send `branchName`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Trainer created"),
            @ApiResponse(responseCode = "400", description = "`BRANCH_REQUIRED`, `ADMIN_BRANCH_REQUIRED` or `INVALID_SPECIALIZATION`"),
            @ApiResponse(responseCode = "403", description = "Caller is not an admin or superadmin"),
            @ApiResponse(responseCode = "409", description = "Email taken, code `EMAIL_ALREADY_REGISTERED`")
    })
    @PostMapping("/add-trainer")
    public ResponseEntity<TrainerResponse> addTrainer(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody TrainerCreateRequest request
    ) {
        TrainerResponse response = trainerService.addTrainer(CallerContext.of(principal), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Operation(summary = "List trainers", description = "Admins see their own branch; superadmins see every branch.")
    @GetMapping
    public ResponseEntity<List<TrainerResponse>> listTrainers(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal
    ) {
        return ResponseEntity.ok(trainerService.listTrainers(CallerContext.of(principal)));
    }

    @GetMapping("/{trainerId}")
    public ResponseEntity<TrainerResponse> getTrainer(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID trainerId
    ) {
        return ResponseEntity.ok(trainerService.getTrainer(CallerContext.of(principal), trainerId));
    }

    @Operation(summary = "Update a trainer")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Trainer updated"),
            @ApiResponse(responseCode = "403", description = "Admin tried to change the branch, code `BRANCH_SCOPE_VIOLATION`"),
            @ApiResponse(responseCode = "404", description = "Trainer not found or outside the admin's branch"),
            @ApiResponse(responseCode = "409", description = "Email taken, code `EMAIL_ALREADY_REGISTERED`")
    })
    @PutMapping("/{trainerId}")
    public ResponseEntity<TrainerResponse> updateTrainer(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID trainerId,
            @Valid @RequestBody TrainerUpdateRequest request
    ) {
        return ResponseEntity.ok(trainerService.updateTrainer(CallerContext.of(principal), trainerId, request));
    }

    @Operation(summary = "Delete a trainer", description = "Removes the profile and the account together with the trainer's sessions and plans.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Trainer deleted"),
            @ApiResponse(responseCode = "404", description = "Trainer not found or outside the admin's branch")
    })
    @DeleteMapping("/{trainerId}")
    public ResponseEntity<Void> deleteTrainer(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID trainerId
    ) {
        trainerService.deleteTrainer(CallerContext.of(principal), trainerId);
        return ResponseEntity.noContent().build();
    }
}
