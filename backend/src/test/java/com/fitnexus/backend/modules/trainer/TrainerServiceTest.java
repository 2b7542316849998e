package com.fitnexus.backend.modules.trainer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.global.security.CallerContext;
import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.account.infrastructure.persistence.GymUserRepository;
import com.fitnexus.backend.modules.trainer.application.TrainerService;
import com.fitnexus.backend.modules.trainer.domain.Trainer;
import com.fitnexus.backend.modules.trainer.infrastructure.persistence.TrainerRepository;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerCreateRequest;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerResponse;
import com.fitnexus.backend.modules.trainer.presentation.dto.TrainerUpdateRequest;
import com.fitnexus.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class TrainerServiceTest {

    private static final String PUNE = "Pune Branch";
    private static final String MUMBAI = "Mumbai Branch";

    @Mock
    private TrainerRepository trainerRepository;

    @Mock
    private GymUserRepository gymUserRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    private TrainerService trainerService;

    private CallerContext puneAdmin;
    private CallerContext superadmin;

    @BeforeEach
    void setUp() {
        trainerService = new TrainerService(trainerRepository, gymUserRepository, passwordEncoder);
        puneAdmin = new CallerContext(UUID.randomUUID(), GymRole.ADMIN, PUNE);
        superadmin = new CallerContext(UUID.randomUUID(), GymRole.SUPERADMIN, null);
    }

    @Test
    @DisplayName("admin creates trainers in their own branch regardless of the requested branch")
    void addTrainer_adminUsesOwnBranch() {
        when(gymUserRepository.existsByEmailIgnoreCase("coach@fitnexus.test")).thenReturn(false);
        when(passwordEncoder.encode("secret-pass")).thenReturn("encoded");
        when(gymUserRepository.saveAndFlush(any(GymUser.class))).thenAnswer(invocation -> {
            GymUser account = invocation.getArgument(0);
            TestEntities.setId(account, GymUser.class, UUID.randomUUID());
            return account;
        });
        when(trainerRepository.save(any(Trainer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        TrainerResponse response = trainerService.addTrainer(puneAdmin, createRequest(MUMBAI));

        ArgumentCaptor<GymUser> accountCaptor = ArgumentCaptor.forClass(GymUser.class);
        verify(gymUserRepository).saveAndFlush(accountCaptor.capture());
        GymUser account = accountCaptor.getValue();
        assertThat(account.getRole()).isEqualTo(GymRole.TRAINER);
        assertThat(account.getBranch()).isEqualTo(PUNE);
        assertThat(account.getPasswordHash()).isEqualTo("encoded");
        assertThat(response.branchName()).isEqualTo(PUNE);
        assertThat(response.specialization()).containsExactly("Yoga", "Strength");
    }

    @Test
    void addTrainer_superadminMustNameBranch() {
        assertThatThrownBy(() -> trainerService.addTrainer(superadmin, createRequest(null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("BRANCH_REQUIRED"));
        verifyNoInteractions(gymUserRepository);
    }

    @Test
    void addTrainer_duplicateEmailIsConflict() {
        when(gymUserRepository.existsByEmailIgnoreCase("coach@fitnexus.test")).thenReturn(true);

        assertThatThrownBy(() -> trainerService.addTrainer(superadmin, createRequest(MUMBAI)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("EMAIL_ALREADY_REGISTERED");
                });
        verify(trainerRepository, never()).save(any());
    }

    @Test
    @DisplayName("an email registered concurrently after the pre-check still maps to 409")
    void addTrainer_concurrentDuplicateEmailIsConflict() {
        when(gymUserRepository.existsByEmailIgnoreCase("coach@fitnexus.test")).thenReturn(false);
        when(passwordEncoder.encode("secret-pass")).thenReturn("encoded");
        when(gymUserRepository.saveAndFlush(any(GymUser.class))).thenThrow(new DataIntegrityViolationException(
                "duplicate key value violates unique constraint \"uq_gym_user_email_lower\""));

        assertThatThrownBy(() -> trainerService.addTrainer(superadmin, createRequest(MUMBAI)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("EMAIL_ALREADY_REGISTERED");
                });
        verify(trainerRepository, never()).save(any());
    }

    @Test
    void addTrainer_unrelatedIntegrityFailurePropagates() {
        DataIntegrityViolationException failure = new DataIntegrityViolationException("ck_gym_user_role");
        when(gymUserRepository.existsByEmailIgnoreCase("coach@fitnexus.test")).thenReturn(false);
        when(passwordEncoder.encode("secret-pass")).thenReturn("encoded");
        when(gymUserRepository.saveAndFlush(any(GymUser.class))).thenThrow(failure);

        assertThatThrownBy(() -> trainerService.addTrainer(superadmin, createRequest(MUMBAI))).isSameAs(failure);
    }

    @Test
    void addTrainer_memberIsForbidden() {
        CallerContext member = new CallerContext(UUID.randomUUID(), GymRole.MEMBER, PUNE);

        assertThatThrownBy(() -> trainerService.addTrainer(member, createRequest(PUNE)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
    }

    @Test
    @DisplayName("admin lists only their branch, superadmin lists every trainer")
    void listTrainers_scopedByRole() {
        Trainer puneTrainer = trainerIn(PUNE);
        Trainer mumbaiTrainer = trainerIn(MUMBAI);
        when(trainerRepository.findAllByBranch(PUNE)).thenReturn(List.of(puneTrainer));
        when(trainerRepository.findAllWithAccount()).thenReturn(List.of(puneTrainer, mumbaiTrainer));

        assertThat(trainerService.listTrainers(puneAdmin))
                .extracting(TrainerResponse::branchName)
                .containsExactly(PUNE);
        assertThat(trainerService.listTrainers(superadmin))
                .extracting(TrainerResponse::branchName)
                .containsExactly(PUNE, MUMBAI);
    }

    @Test
    void listTrainers_adminWithoutBranchIsInvalidState() {
        CallerContext branchlessAdmin = new CallerContext(UUID.randomUUID(), GymRole.ADMIN, null);

        assertThatThrownBy(() -> trainerService.listTrainers(branchlessAdmin))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("ADMIN_BRANCH_REQUIRED");
                });
    }

    @Test
    void listTrainers_memberSeesOwnBranch() {
        CallerContext member = new CallerContext(UUID.randomUUID(), GymRole.MEMBER, MUMBAI);
        when(trainerRepository.findAllByBranch(MUMBAI)).thenReturn(List.of(trainerIn(MUMBAI)));

        assertThat(trainerService.listTrainers(member)).hasSize(1);
    }

    @Test
    void updateTrainer_adminOfOtherBranchSeesNotFound() {
        Trainer mumbaiTrainer = trainerIn(MUMBAI);
        when(trainerRepository.findByIdWithAccount(mumbaiTrainer.getId())).thenReturn(Optional.of(mumbaiTrainer));

        assertThatThrownBy(() -> trainerService.updateTrainer(puneAdmin, mumbaiTrainer.getId(), updateRequest(null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("TRAINER_NOT_FOUND");
                });
    }

    @Test
    void updateTrainer_adminCannotMoveBranch() {
        Trainer puneTrainer = trainerIn(PUNE);
        when(trainerRepository.findByIdWithAccount(puneTrainer.getId())).thenReturn(Optional.of(puneTrainer));

        assertThatThrownBy(() -> trainerService.updateTrainer(puneAdmin, puneTrainer.getId(), updateRequest(MUMBAI)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("BRANCH_SCOPE_VIOLATION"));
        assertThat(puneTrainer.getBranchName()).isEqualTo(PUNE);
    }

    @Test
    void updateTrainer_superadminMovesBranchAndKeepsPassword() {
        Trainer puneTrainer = trainerIn(PUNE);
        String originalEmail = puneTrainer.getAccount().getEmail();
        when(trainerRepository.findByIdWithAccount(puneTrainer.getId())).thenReturn(Optional.of(puneTrainer));

        TrainerUpdateRequest request = new TrainerUpdateRequest(
                "Renamed Coach", List.of("Boxing"), 3.5, 9, "555-0199", originalEmail, null, "Weekends", MUMBAI);
        TrainerResponse response = trainerService.updateTrainer(superadmin, puneTrainer.getId(), request);

        assertThat(response.branchName()).isEqualTo(MUMBAI);
        assertThat(response.name()).isEqualTo("Renamed Coach");
        assertThat(response.specialization()).containsExactly("Boxing");
        assertThat(puneTrainer.getAccount().getPasswordHash()).isEqualTo("hash");
        verify(passwordEncoder, never()).encode(any());
    }

    @Test
    void deleteTrainer_removesProfileAndAccount() {
        Trainer puneTrainer = trainerIn(PUNE);
        when(trainerRepository.findByIdWithAccount(puneTrainer.getId())).thenReturn(Optional.of(puneTrainer));

        trainerService.deleteTrainer(puneAdmin, puneTrainer.getId());

        verify(trainerRepository).delete(puneTrainer);
        verify(gymUserRepository).delete(puneTrainer.getAccount());
    }

    @Test
    void deleteTrainer_trainerRoleIsForbidden() {
        CallerContext trainer = new CallerContext(UUID.randomUUID(), GymRole.TRAINER, PUNE);

        assertThatThrownBy(() -> trainerService.deleteTrainer(trainer, UUID.randomUUID()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ADMIN_ROLE_REQUIRED"));
        verifyNoInteractions(trainerRepository);
    }

    private static Trainer trainerIn(String branch) {
        return TestEntities.trainer(TestEntities.user(UUID.randomUUID(), GymRole.TRAINER, branch));
    }

    private static TrainerCreateRequest createRequest(String branch) {
        return new TrainerCreateRequest(
                "Coach Carter", List.of("Yoga", "Strength"), 4.0, 5, "555-0101",
                "coach@fitnexus.test", "secret-pass", "Mornings", branch);
    }

    private static TrainerUpdateRequest updateRequest(String branch) {
        return new TrainerUpdateRequest(
                "Coach Carter", List.of("Yoga"), 4.0, 5, "555-0101",
                "coach@fitnexus.test", null, "Mornings", branch);
    }
}
