package com.foodtruck.setup;

import com.foodtruck.common.dto.ApiResponse;
import com.foodtruck.user.dto.SetupRequest;
import com.foodtruck.user.dto.UserResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/setup")
@RequiredArgsConstructor
public class SetupController {

    private final SetupService setupService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<UserResponse> createFirstAdmin(@Valid @RequestBody SetupRequest request) {
        return ApiResponse.ok(setupService.createFirstAdmin(request));
    }
}
