package com.foodtruck.auth.controller;

import com.foodtruck.auth.dto.TokenRequest;
import com.foodtruck.auth.dto.TokenResponse;
import com.foodtruck.auth.service.AuthService;
import com.foodtruck.common.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/token")
    public ApiResponse<TokenResponse> createToken(@Valid @RequestBody TokenRequest request) {
        return ApiResponse.ok(authService.issueToken(request));
    }
}
