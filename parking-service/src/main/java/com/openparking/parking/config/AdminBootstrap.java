package com.openparking.parking.config;

import com.openparking.parking.domain.model.Role;
import com.openparking.parking.domain.model.User;
import com.openparking.parking.domain.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Creates the configured administrator accounts that do not exist yet.
 * Existing accounts are never modified, so a password changed after the first start survives restarts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private final AdminBootstrapProperties properties;
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        for (AdminBootstrapProperties.Admin admin : properties.getAdmins()) {
            if (isBlank(admin.getEmail()) || isBlank(admin.getPassword())) {
                log.warn("Skipping bootstrap admin without email or password");
                continue;
            }
            String email = admin.getEmail().trim().toLowerCase(Locale.ROOT);
            userRepository.findByEmail(email).ifPresentOrElse(
                    existing -> {
                        if (existing.getRole() != Role.ADMIN) {
                            log.warn("Bootstrap admin {} already exists with role {}, leaving it unchanged",
                                    email, existing.getRole());
                        }
                    },
                    () -> {
                        User created = userRepository.save(User.builder()
                                .name(isBlank(admin.getName()) ? "Administrator" : admin.getName().trim())
                                .email(email)
                                .password(passwordEncoder.encode(admin.getPassword()))
                                .role(Role.ADMIN)
                                .build());
                        log.info("Created bootstrap admin {} (id={})", email, created.getId());
                    });
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
