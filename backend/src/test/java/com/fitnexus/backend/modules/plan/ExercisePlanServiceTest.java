package com.fitnexus.backend.modules.plan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.account.infrastructure.persistence.GymUserRepository;
import com.fitnexus.backend.modules.plan.application.ExercisePlanService;
import com.fitnexus.backend.modules.plan.domain.AbstractAssignedPlan;
import com.fitnexus.backend.modules.plan.domain.ExercisePlan;
import com.fitnexus.backend.modules.plan.infrastructure.persistence.ExercisePlanRepository;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanCreateRequest;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanResponse;
import com.fitnexus.backend.modules.plan.presentation.dto.PlanUpdateRequest;
import com.fitnexus.backend.modules.trainer.application.TrainerProfileSupport;
import com.fitnexus.backend.modules.trainer.domain.Trainer;
import com.fitnexus.backend.modules.trainer.infrastructure.persistence.TrainerRepository;
import com.fitnexus.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ExercisePlanServiceTest {

    private static final String PUNE = "Pune Branch";
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    @Mock
    private ExercisePlanRepository exercisePlanRepository;

    @Mock
    private GymUserRepository gymUserRepository;

    @Mock
    private TrainerRepository trainerRepository;

    private ExercisePlanService exercisePlanService;

    private Trainer trainer;
    private GymUser member;
    private CallerContext trainerCaller;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T09:00:00Z"), ZoneOffset.UTC);
        exercisePlanService = new ExercisePlanService(exercisePlanRepository, gymUserRepository,
                new TrainerProfileSupport(trainerRepository), clock);
        trainer = TestEntities.trainer(TestEntities.user(UUID.randomUUID(), GymRole.TRAINER, PUNE));
        member = TestEntities.user(UUID.randomUUID(), GymRole.MEMBER, PUNE);
        trainerCaller = TestEntities.caller(trainer.getAccount());
        when(trainerRepository.findByIdWithAccount(trainer.getId())).thenReturn(Optional.of(trainer));
    }

    @Test
    void createPlan_storesExercisePlanForMember() {
        when(gymUserRepository.findByIdAndBranch(member.getId(), PUNE)).thenReturn(Optional.of(member));
        when(exercisePlanRepository.save(any(ExercisePlan.class))).thenAnswer(invocation -> {
            ExercisePlan plan = invocation.getArgument(0);
            TestEntities.setId(plan, AbstractAssignedPlan.class, UUID.randomUUID());
            return plan;
        });

        PlanResponse response = exercisePlanService.createPlan(trainerCaller,
                new PlanCreateRequest(member.getId(), " Push Pull Legs ", "6 days a week", null));

        assertThat(response.title()).isEqualTo("Push Pull Legs");
        assertThat(response.expiryDate()).isNull();
        assertThat(response.assignedDate()).isEqualTo(TODAY);
        assertThat(response.branchName()).isEqualTo(PUNE);
        assertThat(response.user().id()).isEqualTo(member.getId());
    }

    @Test
    void updatePlan_expiryBeforeAssignedDateIsInvalid() {
        ExercisePlan plan = existingPlan();
        when(exercisePlanRepository.findByIdAndAssignedByTrainerIdAndBranchName(plan.getId(), trainer.getId(), PUNE))
                .thenReturn(Optional.of(plan));

        assertThatThrownBy(() -> exercisePlanService.updatePlan(trainerCaller, plan.getId(),
                new PlanUpdateRequest(null, "Strength", null, TODAY.minusDays(1))))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("INVALID_EXPIRY_DATE");
                });
        assertThat(plan.getTitle()).isEqualTo("Full body");
    }

    @Test
    void deletePlan_removesOwnedPlan() {
        ExercisePlan plan = existingPlan();
        when(exercisePlanRepository.findByIdAndAssignedByTrainerIdAndBranchName(plan.getId(), trainer.getId(), PUNE))
                .thenReturn(Optional.of(plan));

        exercisePlanService.deletePlan(trainerCaller, plan.getId());

        verify(exercisePlanRepository).delete(plan);
    }

    @Test
    void deletePlan_missingPlanIsNotFound() {
        UUID planId = UUID.randomUUID();
        when(exercisePlanRepository.findByIdAndAssignedByTrainerIdAndBranchName(planId, trainer.getId(), PUNE))
                .thenReturn(Optional.empty());

        assertThatThrownBy(() -> exercisePlanService.deletePlan(trainerCaller, planId))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("PLAN_NOT_FOUND");
                    assertThat(ex.getDetailMessage()).startsWith("Exercise plan");
                });
        verify(exercisePlanRepository, never()).delete(any());
    }

    @Test
    void listPlans_withoutFilterReturnsAllOwnPlans() {
        ExercisePlan plan = existingPlan();
        when(exercisePlanRepository.findAllByAssignedByTrainerIdAndBranchNameOrderByAssignedDateDesc(trainer.getId(), PUNE))
                .thenReturn(List.of(plan));

        assertThat(exercisePlanService.listPlans(trainerCaller, null))
                .extracting(PlanResponse::id)
                .containsExactly(plan.getId());
    }

    private ExercisePlan existingPlan() {
        ExercisePlan plan = new ExercisePlan();
        plan.assign(member, trainer, PUNE, TODAY);
        plan.setTitle("Full body");
        TestEntities.setId(plan, AbstractAssignedPlan.class, UUID.randomUUID());
        return plan;
    }
}
