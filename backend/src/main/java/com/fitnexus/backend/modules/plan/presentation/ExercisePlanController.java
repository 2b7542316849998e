package com.fitnexus.backend.modules.plan.presentation;

import java.util.List;
import java.util.UUID;

import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.global.security.JwtAuthenticationPrincipal;
import com.fitnexus.backend.modules.plan.application.ExercisePlanService;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanCreateRequest;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanResponse;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanUpdateRequest;

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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/trainers/exercise-plans")
public class ExercisePlanController {

    private final ExercisePlanService exercisePlanService;

    public ExercisePlanController(ExercisePlanService exercisePlanService) {
        this.exercisePlanService = exercisePlanService;
    }

    @Operation(summary = "Assign an exercise plan")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Plan assigned"),
            @ApiResponse(responseCode = "400", description = "`INVALID_EXPIRY_DATE`"),
            @ApiResponse(responseCode = "404", description = "Member not in the trainer's branch, code `USER_NOT_FOUND_IN_BRANCH`")
    })
    @PostMapping
    public ResponseEntity<PlanResponse> createPlan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody PlanCreateRequest request
    ) {
        PlanResponse response = exercisePlanService.createPlan(CallerContext.of(principal), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<PlanResponse>> listPlans(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "userId", required = false) UUID userId
    ) {
        return ResponseEntity.ok(exercisePlanService.listPlans(CallerContext.of(principal), userId));
    }

    @Operation(summary = "Update an exercise plan", description = "`userId` cannot change.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Plan updated"),
            @ApiResponse(responseCode = "400", description = "`IMMUTABLE_FIELD` or `INVALID_EXPIRY_DATE`"),
            @ApiResponse(responseCode = "404", description = "`PLAN_NOT_FOUND`")
    })
    @PutMapping("/{planId}")
    public ResponseEntity<PlanResponse> updatePlan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID planId,
            @Valid @RequestBody PlanUpdateRequest request
    ) {
        return ResponseEntity.ok(exercisePlanService.updatePlan(CallerContext.of(principal), planId, request));
    }

    @DeleteMapping("/{planId}")
    public ResponseEntity<Void> deletePlan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID planId
    ) {
        exercisePlanService.deletePlan(CallerContext.of(principal), planId);
        return ResponseEntity.noContent().build();
    }
}
