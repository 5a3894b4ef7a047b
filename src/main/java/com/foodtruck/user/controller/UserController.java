package com.foodtruck.user.controller;

import com.foodtruck.common.dto.ApiResponse;
import com.foodtruck.common.dto.DeletionResponse;
import com.foodtruck.common.dto.PageQuery;
import com.foodtruck.common.dto.PageResponse;
import com.foodtruck.common.security.AuthenticatedUser;
import com.foodtruck.common.security.AuthenticationFilter;
import com.foodtruck.user.dto.CreateUserRequest;
import com.foodtruck.user.dto.UpdateUserRequest;
import com.foodtruck.user.dto.UserResponse;
import com.foodtruck.user.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

/**
 * User directory endpoints. {@code /me} works for any authenticated caller.
 */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @GetMapping
    public ApiResponse<PageResponse<UserResponse>> listUsers(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + PageQuery.DEFAULT_LIMIT) int limit) {
        return ApiResponse.ok(userService.listUsers(actor, PageQuery.of(offset, limit)));
    }

    @GetMapping("/me")
    public ApiResponse<UserResponse> getCurrentUser(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor) {
        return ApiResponse.ok(userService.getCurrentUser(actor));
    }

    @GetMapping("/{id}")
    public ApiResponse<UserResponse> getUser(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id) {
        return ApiResponse.ok(userService.getUser(actor, id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<UserResponse> createUser(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @Valid @RequestBody CreateUserRequest request) {
        return ApiResponse.ok(userService.createUser(actor, request));
    }

    @PatchMapping("/{id}")
    public ApiResponse<UserResponse> updateUser(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id,
            @Valid @RequestBody UpdateUserRequest request) {
        return ApiResponse.ok(userService.updateUser(actor, id, request));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<DeletionResponse> deleteUser(
            @RequestAttribute(AuthenticationFilter.PRINCIPAL_ATTRIBUTE) AuthenticatedUser actor,
            @PathVariable Long id) {
        return ApiResponse.ok(userService.deleteUser(actor, id));
    }
}
