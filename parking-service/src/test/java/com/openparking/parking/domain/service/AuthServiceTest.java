package com.openparking.parking.domain.service;

import com.openparking.common.exception.ConflictException;
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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private JwtUtils jwtUtils;
    @Mock
    private ActionLogService actionLogService;

    @InjectMocks
    private AuthService service;

    private static User alice() {
        return User.builder().id(1L).name("Alice").email("alice@example.com").password("hashed").role(Role.USER).build();
    }

    @Test
    @DisplayName("register creates a USER with a hashed password and a lower-cased email")
    void register_createsUser() {
        when(userRepository.existsByEmail("alice@example.com")).thenReturn(false);
        when(passwordEncoder.encode("secret1")).thenReturn("hashed");
        when(userRepository.save(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            u.setId(1L);
            return u;
        });
        when(jwtUtils.generateToken(any(User.class))).thenReturn("token");

        AuthResponse response = service.register(new RegisterRequest("Alice", " Alice@Example.com ", "secret1"));

        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(saved.capture());
        assertThat(saved.getValue().getRole()).isEqualTo(Role.USER);
        assertThat(saved.getValue().getPassword()).isEqualTo("hashed");
        assertThat(response.email()).isEqualTo("alice@example.com");
        assertThat(response.token()).isEqualTo("token");
        verify(actionLogService).record(eq(AuditAction.USER_REGISTERED), eq(1L), anyMap());
    }

    @Test
    @DisplayName("register refuses an email already in use")
    void register_duplicate() {
        when(userRepository.existsByEmail("alice@example.com")).thenReturn(true);

        assertThatThrownBy(() -> service.register(new RegisterRequest("Alice", "alice@example.com", "secret1")))
                .isInstanceOf(ConflictException.class)
                .hasMessage("User already exists");
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("login returns a token for valid credentials")
    void login_success() {
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(alice()));
        when(passwordEncoder.matches("secret1", "hashed")).thenReturn(true);
        when(jwtUtils.generateToken(any(User.class))).thenReturn("token");

        AuthResponse response = service.login(new LoginRequest("alice@example.com", "secret1"));

        assertThat(response.token()).isEqualTo("token");
        verify(actionLogService).record(eq(AuditAction.USER_LOGIN_SUCCESS), eq(1L), anyMap());
    }

    @Test
    @DisplayName("wrong password and unknown email fail identically and are audited without an actor")
    void login_failures() {
        when(userRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(alice()));
        when(passwordEncoder.matches("wrong", "hashed")).thenReturn(false);
        when(userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.login(new LoginRequest("alice@example.com", "wrong")))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Invalid email or password");
        assertThatThrownBy(() -> service.login(new LoginRequest("nobody@example.com", "secret1")))
                .isInstanceOf(BadCredentialsException.class)
                .hasMessage("Invalid email or password");

        verify(actionLogService).record(AuditAction.USER_LOGIN_FAILED, null, Map.of("email", "alice@example.com"));
        verify(actionLogService).record(AuditAction.USER_LOGIN_FAILED, null, Map.of("email", "nobody@example.com"));
        verifyNoInteractions(jwtUtils);
    }

    @Test
    @DisplayName("updateProfile refuses an email owned by another account")
    void updateProfile_emailTaken() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(alice()));
        when(userRepository.existsByEmailAndIdNot("bob@example.com", 1L)).thenReturn(true);

        assertThatThrownBy(() -> service.updateProfile(
                new AuthenticatedUser(1L, "alice@example.com", Role.USER),
                new UpdateProfileRequest(null, "Bob@example.com", null)))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Email already taken by another user");
    }

    @Test
    @DisplayName("updateProfile changes only the given fields")
    void updateProfile_partial() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(alice()));
        when(passwordEncoder.encode("newsecret")).thenReturn("rehashed");
        when(userRepository.save(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

        UserResponse response = service.updateProfile(
                new AuthenticatedUser(1L, "alice@example.com", Role.USER),
                new UpdateProfileRequest("Alice Smith", null, "newsecret"));

        assertThat(response.name()).isEqualTo("Alice Smith");
        assertThat(response.email()).isEqualTo("alice@example.com");
        verify(userRepository, never()).existsByEmailAndIdNot(any(), any());
        verify(actionLogService).record(AuditAction.USER_PROFILE_UPDATED, 1L);
    }
}
