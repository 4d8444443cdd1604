package com.openparking.parking.domain.service;

import com.openparking.common.exception.ConflictException;
import com.openparking.common.exception.ResourceNotFoundException;
import com.openparking.parking.api.dto.AuthResponse;
import com.openparking.parking.api.dto.LoginRequest;
import com.openparking.parking.api.dto.RegisterRequest;
import com.openparking.parking.api.dto.UpdateProfileRequest;
import com.openparking.parking.api.dto.UserResponse;
import com.openparking.parking.domain.model.AuditAction;
import com.openparking.parking.domain.model.Role;
import com.openparking.parking.domain.model.User;
import com.openparking.parking.domain.repository.UserRepository;
import com.openparking.parking.security.AuthenticatedUser;
import com.openparking.parking.security.JwtUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registration, login and the caller's own profile.
 * Self-registration always creates a {@link Role#USER}; administrators come from configuration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtils jwtUtils;
    private final ActionLogService actionLogService;

    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new ConflictException("User already exists");
        }

        User user = userRepository.save(User.builder()
                .name(request.name().trim())
                .email(email)
                .password(passwordEncoder.encode(request.password()))
                .role(Role.USER)
                .build());
        log.info("User {} registered", user.getId());

        actionLogService.record(AuditAction.USER_REGISTERED, user.getId(), Map.of("email", email));
        return AuthResponse.from(user, jwtUtils.generateToken(user));
    }

    /**
     * Unknown email and wrong password fail the same way; both are audited without an actor.
     */
    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        String email = normalizeEmail(request.email());
        Optional<User> user = userRepository.findByEmail(email)
                .filter(u -> passwordEncoder.matches(request.password(), u.getPassword()));
        if (user.isEmpty()) {
            log.info("Failed login attempt for {}", email);
            actionLogService.record(AuditAction.USER_LOGIN_FAILED, null, Map.of("email", email));
            throw new BadCredentialsException("Invalid email or password");
        }

        User authenticated = user.get();
        actionLogService.record(AuditAction.USER_LOGIN_SUCCESS, authenticated.getId(), Map.of("email", email));
        return AuthResponse.from(authenticated, jwtUtils.generateToken(authenticated));
    }

    @Transactional(readOnly = true)
    public UserResponse me(AuthenticatedUser principal) {
        return UserResponse.from(findUser(principal.id()));
    }

    /**
     * Updates whichever of name, email and password are given. A new email must not belong
     * to another account.
     */
    @Transactional
    public UserResponse updateProfile(AuthenticatedUser principal, UpdateProfileRequest request) {
        User user = findUser(principal.id());

        if (hasText(request.name())) {
            user.setName(request.name().trim());
        }
        if (hasText(request.email())) {
            String email = normalizeEmail(request.email());
            if (userRepository.existsByEmailAndIdNot(email, user.getId())) {
                throw new ConflictException("Email already taken by another user");
            }
            user.setEmail(email);
        }
        if (hasText(request.password())) {
            user.setPassword(passwordEncoder.encode(request.password()));
        }
        user = userRepository.save(user);
        log.info("User {} updated their profile", user.getId());

        actionLogService.record(AuditAction.USER_PROFILE_UPDATED, user.getId());
        return UserResponse.from(user);
    }

    private User findUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
