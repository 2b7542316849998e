package com.fitnexus.backend.modules.account.application;

import com.fitnexus.backend.modules.account.domain.GymRole;
import com.fitnexus.backend.modules.account.domain.GymUser;
import com.fitnexus.backend.modules.account.infrastructure.persistence.GymUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Creates the first superadmin from configuration so a fresh database can provision admins
 * and trainers. Does nothing once any superadmin exists.
 */
@Component
public class SuperadminBootstrap {

    private static final Logger log = LoggerFactory.getLogger(SuperadminBootstrap.class);

    private final GymUserRepository gymUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final String email;
    private final String password;

    public SuperadminBootstrap(
            GymUserRepository gymUserRepository,
            PasswordEncoder passwordEncoder,
            @Value("${app.bootstrap.superadmin.email:}") String email,
            @Value("${app.bootstrap.superadmin.password:}") String password
    ) {
        this.gymUserRepository = gymUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.email = email;
        this.password = password;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void ensureSuperadmin() {
        if (!StringUtils.hasText(email) || !StringUtils.hasText(password)) {
            log.debug("Superadmin bootstrap disabled");
            return;
        }
        if (gymUserRepository.existsByRole(GymRole.SUPERADMIN)) {
            return;
        }
        if (gymUserRepository.existsByEmailIgnoreCase(email)) {
            log.warn("Superadmin bootstrap skipped: {} is already registered with another role", email);
            return;
        }

        GymUser superadmin = new GymUser();
        superadmin.setEmail(email.trim());
        superadmin.setPasswordHash(passwordEncoder.encode(password));
        superadmin.setFullName("Superadmin");
        superadmin.setRole(GymRole.SUPERADMIN);
        gymUserRepository.save(superadmin);
        log.info("Bootstrapped superadmin account {}", superadmin.getEmail());
    }
}
