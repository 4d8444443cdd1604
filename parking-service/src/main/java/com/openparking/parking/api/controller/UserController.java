package com.openparking.parking.api.controller;

import com.openparking.common.dto.BaseResponse;
import com.openparking.common.dto.PageResponse;
import com.openparking.common.util.Constants;
import com.openparking.parking.api.dto.UserDetailResponse;
import com.openparking.parking.api.dto.UserResponse;
import com.openparking.parking.domain.service.UserService;
import com.openparking.parking.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Administrator-only user management (see the URL rules in SecurityConfig).
 */
@RestController
@RequestMapping(Constants.API_PREFIX + "/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping
    public ResponseEntity<BaseResponse<PageResponse<UserResponse>>> listUsers(
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(BaseResponse.success("Users fetched successfully",
                userService.listUsers(search, page, limit)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<UserDetailResponse>> getUser(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success("User details fetched successfully", userService.getUser(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<BaseResponse<Void>> deleteUser(@PathVariable Long id,
                                                         @AuthenticationPrincipal AuthenticatedUser admin) {
        userService.deleteUser(id, admin);
        return ResponseEntity.ok(BaseResponse.success("User deleted successfully", null));
    }
}
