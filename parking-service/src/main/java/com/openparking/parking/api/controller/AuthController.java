package com.openparking.parking.api.controller;

import com.openparking.common.dto.BaseResponse;
import com.openparking.common.util.Constants;
import com.openparking.parking.api.dto.AuthResponse;
import com.openparking.parking.api.dto.LoginRequest;
import com.openparking.parking.api.dto.RegisterRequest;
import com.openparking.parking.api.dto.UpdateProfileRequest;
import com.openparking.parking.api.dto.UserResponse;
import com.openparking.parking.domain.service.AuthService;
import com.openparking.parking.security.AuthenticatedUser;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(Constants.API_PREFIX + "/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<BaseResponse<AuthResponse>> register(@Valid @RequestBody RegisterRequest request) {
        AuthResponse response = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("User registered successfully", response));
    }

    @PostMapping("/login")
    public ResponseEntity<BaseResponse<AuthResponse>> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Login successful", authService.login(request)));
    }

    @GetMapping("/me")
    public ResponseEntity<BaseResponse<UserResponse>> me(@AuthenticationPrincipal AuthenticatedUser principal) {
        return ResponseEntity.ok(BaseResponse.success(authService.me(principal)));
    }

    @PutMapping("/profile")
    public ResponseEntity<BaseResponse<UserResponse>> updateProfile(
            @AuthenticationPrincipal AuthenticatedUser principal,
            @Valid @RequestBody UpdateProfileRequest request) {
        UserResponse response = authService.updateProfile(principal, request);
        return ResponseEntity.ok(BaseResponse.success("Profile updated successfully", response));
    }
}
