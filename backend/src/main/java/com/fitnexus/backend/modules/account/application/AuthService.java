package com.fitnexus.backend.modules.account.application;

import java.util.UUID;

import com.fitnexus.backend.global.error.ProblemException;
import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.account.infrastructure.persistence.GymUserRepository;
import com.fitnexus.backend.modules.account.presentation.dto.LoginRequest;
import com.fitnexus.backend.modules.account.presentation.dto.LoginResponse;
import com.fitnexus.backend.modules.account.presentation.dto.RegisterRequest;
import com.fitnexus.backend.modules.account.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final GymUserRepository gymUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            GymUserRepository gymUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.gymUserRepository = gymUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    /**
     * Self-registration always creates a member; trainers and admins are provisioned by admins.
     */
    public UserResponse register(RegisterRequest request) {
        String email = request.email().trim();
        if (gymUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "An account with this email already exists");
        }

        GymUser user = new GymUser();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFullName(request.name().trim());
        user.setPhone(request.phone());
        user.setRole(GymRole.MEMBER);
        user.setBranch(request.branch().trim());

        GymUser saved;
        try {
            saved = gymUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            if (isEmailUniqueViolation(ex)) {
                throw ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "An account with this email already exists");
            }
            throw ex;
        }
        log.info("Registered member {} in branch {}", saved.getId(), saved.getBranch());
        return UserResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        GymUser user = gymUserRepository.findByEmailIgnoreCase(request.email().trim())
                .orElseThrow(() -> ProblemException.unauthenticated("INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw ProblemException.unauthenticated("INVALID_CREDENTIALS");
        }

        return new LoginResponse(jwtTokenService.issueAccessToken(user), UserResponse.from(user));
    }

    @Transactional(readOnly = true)
    public UserResponse loadProfile(UUID userId) {
        return gymUserRepository.findById(userId)
                .map(UserResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
    }

    private static boolean isEmailUniqueViolation(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        return message != null && message.contains("uq_gym_user_email");
    }
}
